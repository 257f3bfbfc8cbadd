package com.gene.evidence.config;

import com.gene.evidence.snapshot.ArtifactLayout;
import org.eclipse.microprofile.config.Config;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Immutable runtime settings, read from MicroProfile Config under the {@code gene-evidence.} prefix.
 * Defaults live in {@code META-INF/microprofile-config.properties}; environment variables override them.
 */
public final class GeneEvidenceConfig {

    public static final String PREFIX = "gene-evidence.";
    public static final String CURATED_PATH = PREFIX + "curated.path";
    public static final String WORKSPACE_PATH = PREFIX + "workspace.path";
    public static final String EXCLUDE_ZINC_FINGERS = PREFIX + "universe.exclude-zinc-fingers";
    public static final String DEFAULT_CANDIDATE_LIMIT = PREFIX + "serving.default-candidate-limit";
    public static final String MAX_CANDIDATE_LIMIT = PREFIX + "serving.max-candidate-limit";
    public static final String ENRICHMENT_TOP = PREFIX + "enrichment.top";
    public static final String ENRICHMENT_RATE_LIMIT = PREFIX + "enrichment.rate-limit-millis";
    public static final String ENRICHMENT_MAX_ATTEMPTS = PREFIX + "enrichment.max-attempts";
    public static final String ENRICHMENT_BACKOFF = PREFIX + "enrichment.backoff-millis";
    public static final String ENRICHMENT_TIMEOUT = PREFIX + "enrichment.timeout-seconds";
    public static final String ENRICHMENT_CACHE_SIZE = PREFIX + "enrichment.cache-max-size";
    public static final String NCBI_BASE_URL = PREFIX + "enrichment.ncbi-base-url";
    public static final String UNIPROT_BASE_URL = PREFIX + "enrichment.uniprot-base-url";

    private final Path curatedPath;
    private final Path workspacePath;
    private final boolean excludeZincFingers;
    private final int defaultCandidateLimit;
    private final int maxCandidateLimit;
    private final int enrichmentTop;
    private final Duration rateLimit;
    private final int maxAttempts;
    private final Duration backoff;
    private final Duration timeout;
    private final long cacheMaxSize;
    private final String ncbiBaseUrl;
    private final String uniprotBaseUrl;

    private GeneEvidenceConfig(Builder builder) {
        this.curatedPath = builder.curatedPath;
        this.workspacePath = builder.workspacePath;
        this.excludeZincFingers = builder.excludeZincFingers;
        this.defaultCandidateLimit = builder.defaultCandidateLimit;
        this.maxCandidateLimit = builder.maxCandidateLimit;
        this.enrichmentTop = builder.enrichmentTop;
        this.rateLimit = builder.rateLimit;
        this.maxAttempts = builder.maxAttempts;
        this.backoff = builder.backoff;
        this.timeout = builder.timeout;
        this.cacheMaxSize = builder.cacheMaxSize;
        this.ncbiBaseUrl = builder.ncbiBaseUrl;
        this.uniprotBaseUrl = builder.uniprotBaseUrl;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static GeneEvidenceConfig defaults() {
        return builder().build();
    }

    /**
     * Reads every key, falling back to the builder default for keys the config does not define.
     */
    public static GeneEvidenceConfig from(Config config) {
        GeneEvidenceConfig d = defaults();
        return builder()
                .curatedPath(Path.of(config.getOptionalValue(CURATED_PATH, String.class)
                        .orElse(d.curatedPath.toString())))
                .workspacePath(Path.of(config.getOptionalValue(WORKSPACE_PATH, String.class)
                        .orElse(d.workspacePath.toString())))
                .excludeZincFingers(config.getOptionalValue(EXCLUDE_ZINC_FINGERS, Boolean.class)
                        .orElse(d.excludeZincFingers))
                .defaultCandidateLimit(config.getOptionalValue(DEFAULT_CANDIDATE_LIMIT, Integer.class)
                        .orElse(d.defaultCandidateLimit))
                .maxCandidateLimit(config.getOptionalValue(MAX_CANDIDATE_LIMIT, Integer.class)
                        .orElse(d.maxCandidateLimit))
                .enrichmentTop(config.getOptionalValue(ENRICHMENT_TOP, Integer.class)
                        .orElse(d.enrichmentTop))
                .rateLimit(Duration.ofMillis(config.getOptionalValue(ENRICHMENT_RATE_LIMIT, Long.class)
                        .orElse(d.rateLimit.toMillis())))
                .maxAttempts(config.getOptionalValue(ENRICHMENT_MAX_ATTEMPTS, Integer.class)
                        .orElse(d.maxAttempts))
                .backoff(Duration.ofMillis(config.getOptionalValue(ENRICHMENT_BACKOFF, Long.class)
                        .orElse(d.backoff.toMillis())))
                .timeout(Duration.ofSeconds(config.getOptionalValue(ENRICHMENT_TIMEOUT, Long.class)
                        .orElse(d.timeout.getSeconds())))
                .cacheMaxSize(config.getOptionalValue(ENRICHMENT_CACHE_SIZE, Long.class)
                        .orElse(d.cacheMaxSize))
                .ncbiBaseUrl(config.getOptionalValue(NCBI_BASE_URL, String.class)
                        .orElse(d.ncbiBaseUrl))
                .uniprotBaseUrl(config.getOptionalValue(UNIPROT_BASE_URL, String.class)
                        .orElse(d.uniprotBaseUrl))
                .build();
    }

    public ArtifactLayout layout() {
        return new ArtifactLayout(curatedPath, workspacePath);
    }

    public Path getCuratedPath() { return curatedPath; }
    public Path getWorkspacePath() { return workspacePath; }
    public boolean isExcludeZincFingers() { return excludeZincFingers; }
    public int getDefaultCandidateLimit() { return defaultCandidateLimit; }
    public int getMaxCandidateLimit() { return maxCandidateLimit; }
    public int getEnrichmentTop() { return enrichmentTop; }
    public Duration getRateLimit() { return rateLimit; }
    public int getMaxAttempts() { return maxAttempts; }
    public Duration getBackoff() { return backoff; }
    public Duration getTimeout() { return timeout; }
    public long getCacheMaxSize() { return cacheMaxSize; }
    public String getNcbiBaseUrl() { return ncbiBaseUrl; }
    public String getUniprotBaseUrl() { return uniprotBaseUrl; }

    @Override
    public String toString() {
        return "GeneEvidenceConfig{curatedPath=" + curatedPath
                + ", workspacePath=" + workspacePath
                + ", excludeZincFingers=" + excludeZincFingers
                + ", candidateLimit=" + defaultCandidateLimit + "/" + maxCandidateLimit
                + ", enrichmentTop=" + enrichmentTop + "}";
    }

    public static class Builder {
        private Path curatedPath = Path.of("../lacuene");
        private Path workspacePath = Path.of(".");
        private boolean excludeZincFingers = true;
        private int defaultCandidateLimit = 50;
        private int maxCandidateLimit = 500;
        private int enrichmentTop = 20;
        private Duration rateLimit = Duration.ofMillis(400);
        private int maxAttempts = 3;
        private Duration backoff = Duration.ofMillis(1000);
        private Duration timeout = Duration.ofSeconds(15);
        private long cacheMaxSize = 1000;
        private String ncbiBaseUrl = "https://eutils.ncbi.nlm.nih.gov/entrez/eutils";
        private String uniprotBaseUrl = "https://rest.uniprot.org/uniprotkb";

        public Builder curatedPath(Path curatedPath) {
            this.curatedPath = curatedPath;
            return this;
        }

        public Builder workspacePath(Path workspacePath) {
            this.workspacePath = workspacePath;
            return this;
        }

        public Builder excludeZincFingers(boolean excludeZincFingers) {
            this.excludeZincFingers = excludeZincFingers;
            return this;
        }

        public Builder defaultCandidateLimit(int defaultCandidateLimit) {
            this.defaultCandidateLimit = defaultCandidateLimit;
            return this;
        }

        public Builder maxCandidateLimit(int maxCandidateLimit) {
            this.maxCandidateLimit = maxCandidateLimit;
            return this;
        }

        public Builder enrichmentTop(int enrichmentTop) {
            this.enrichmentTop = enrichmentTop;
            return this;
        }

        public Builder rateLimit(Duration rateLimit) {
            this.rateLimit = rateLimit;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder backoff(Duration backoff) {
            this.backoff = backoff;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder cacheMaxSize(long cacheMaxSize) {
            this.cacheMaxSize = cacheMaxSize;
            return this;
        }

        public Builder ncbiBaseUrl(String ncbiBaseUrl) {
            this.ncbiBaseUrl = ncbiBaseUrl;
            return this;
        }

        public Builder uniprotBaseUrl(String uniprotBaseUrl) {
            this.uniprotBaseUrl = uniprotBaseUrl;
            return this;
        }

        public GeneEvidenceConfig build() {
            if (defaultCandidateLimit <= 0 || maxCandidateLimit < defaultCandidateLimit) {
                throw new IllegalArgumentException("Candidate limits must satisfy 0 < default <= max, got "
                        + defaultCandidateLimit + "/" + maxCandidateLimit);
            }
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
            }
            if (enrichmentTop < 0) {
                throw new IllegalArgumentException("enrichmentTop must be non-negative, got " + enrichmentTop);
            }
            return new GeneEvidenceConfig(this);
        }
    }
}
