package com.gene.evidence.cdi;

import com.gene.evidence.api.GeneQueryService;
import com.gene.evidence.config.GeneEvidenceConfig;
import com.gene.evidence.health.HealthCheckRegistry;
import com.gene.evidence.health.MemoryHealthCheck;
import com.gene.evidence.health.SnapshotHealthCheck;
import com.gene.evidence.metrics.MicrometerPipelineMetrics;
import com.gene.evidence.metrics.NoOpPipelineMetrics;
import com.gene.evidence.metrics.PipelineMetrics;
import com.gene.evidence.snapshot.ServedSnapshotHolder;
import com.gene.evidence.snapshot.SnapshotLoader;
import com.gene.evidence.source.GeneUniverseLoader;
import com.gene.evidence.source.ZincFingerExclusionRule;
import com.gene.evidence.tier.TierResolver;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * CDI producer that wires the read-only serving layer from MicroProfile Config properties.
 *
 * <p>The served snapshot is loaded once when the holder is first produced. Artifacts that
 * are missing or malformed at that point leave their tier empty; the service still starts.</p>
 *
 * <h2>Configuration</h2>
 * <pre>
 * gene-evidence.curated.path=../lacuene
 * gene-evidence.workspace.path=.
 * gene-evidence.serving.default-candidate-limit=50
 * </pre>
 */
@ApplicationScoped
public class GeneEvidenceProducer {

    private static final Logger log = LoggerFactory.getLogger(GeneEvidenceProducer.class);

    // ── Paths ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = GeneEvidenceConfig.CURATED_PATH, defaultValue = "../lacuene")
    String curatedPath;

    @Inject
    @ConfigProperty(name = GeneEvidenceConfig.WORKSPACE_PATH, defaultValue = ".")
    String workspacePath;

    @Inject
    @ConfigProperty(name = GeneEvidenceConfig.EXCLUDE_ZINC_FINGERS, defaultValue = "true")
    boolean excludeZincFingers;

    // ── Serving ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = GeneEvidenceConfig.DEFAULT_CANDIDATE_LIMIT, defaultValue = "50")
    int defaultCandidateLimit;

    @Inject
    @ConfigProperty(name = GeneEvidenceConfig.MAX_CANDIDATE_LIMIT, defaultValue = "500")
    int maxCandidateLimit;

    // ── Enrichment ────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = GeneEvidenceConfig.ENRICHMENT_TOP, defaultValue = "20")
    int enrichmentTop;

    @Inject
    @ConfigProperty(name = GeneEvidenceConfig.ENRICHMENT_RATE_LIMIT, defaultValue = "400")
    long rateLimitMillis;

    @Inject
    @ConfigProperty(name = GeneEvidenceConfig.ENRICHMENT_MAX_ATTEMPTS, defaultValue = "3")
    int maxAttempts;

    @Inject
    @ConfigProperty(name = GeneEvidenceConfig.ENRICHMENT_BACKOFF, defaultValue = "1000")
    long backoffMillis;

    @Inject
    @ConfigProperty(name = GeneEvidenceConfig.ENRICHMENT_TIMEOUT, defaultValue = "15")
    long timeoutSeconds;

    @Inject
    @ConfigProperty(name = GeneEvidenceConfig.ENRICHMENT_CACHE_SIZE, defaultValue = "1000")
    long cacheMaxSize;

    @Inject
    @ConfigProperty(name = GeneEvidenceConfig.NCBI_BASE_URL,
            defaultValue = "https://eutils.ncbi.nlm.nih.gov/entrez/eutils")
    String ncbiBaseUrl;

    @Inject
    @ConfigProperty(name = GeneEvidenceConfig.UNIPROT_BASE_URL, defaultValue = "https://rest.uniprot.org/uniprotkb")
    String uniprotBaseUrl;

    // ── Metrics ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "gene-evidence.metrics.enabled", defaultValue = "true")
    boolean metricsEnabled;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public GeneEvidenceConfig geneEvidenceConfig() {
        GeneEvidenceConfig config = GeneEvidenceConfig.builder()
                .curatedPath(Path.of(curatedPath))
                .workspacePath(Path.of(workspacePath))
                .excludeZincFingers(excludeZincFingers)
                .defaultCandidateLimit(defaultCandidateLimit)
                .maxCandidateLimit(maxCandidateLimit)
                .enrichmentTop(enrichmentTop)
                .rateLimit(Duration.ofMillis(rateLimitMillis))
                .maxAttempts(maxAttempts)
                .backoff(Duration.ofMillis(backoffMillis))
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .cacheMaxSize(cacheMaxSize)
                .ncbiBaseUrl(ncbiBaseUrl)
                .uniprotBaseUrl(uniprotBaseUrl)
                .build();
        log.info("Producing GeneEvidenceConfig: {}", config);
        return config;
    }

    @Produces
    @ApplicationScoped
    public PipelineMetrics pipelineMetrics() {
        if (!metricsEnabled) {
            log.info("Metrics disabled");
            return new NoOpPipelineMetrics();
        }
        return new MicrometerPipelineMetrics(new SimpleMeterRegistry());
    }

    @Produces
    @ApplicationScoped
    public ServedSnapshotHolder servedSnapshotHolder(GeneEvidenceConfig config) {
        GeneUniverseLoader universeLoader = new GeneUniverseLoader(config.isExcludeZincFingers()
                ? List.of(new ZincFingerExclusionRule())
                : List.of());
        SnapshotLoader loader = new SnapshotLoader(config.layout(), universeLoader);
        return new ServedSnapshotHolder(loader.load());
    }

    @Produces
    @ApplicationScoped
    public HealthCheckRegistry healthCheckRegistry(ServedSnapshotHolder holder) {
        return new HealthCheckRegistry()
                .register(new SnapshotHealthCheck(holder))
                .register(new MemoryHealthCheck(holder));
    }

    @Produces
    @ApplicationScoped
    public GeneQueryService geneQueryService(ServedSnapshotHolder holder, HealthCheckRegistry health,
                                             PipelineMetrics metrics, GeneEvidenceConfig config) {
        return new GeneQueryService(holder, new TierResolver(), health, metrics,
                config.getDefaultCandidateLimit(), config.getMaxCandidateLimit(), Clock.systemUTC());
    }
}
