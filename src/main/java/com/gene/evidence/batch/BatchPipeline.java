package com.gene.evidence.batch;

import com.gene.evidence.candidate.CandidateSelector;
import com.gene.evidence.config.GeneEvidenceConfig;
import com.gene.evidence.enrich.CandidateEnricher;
import com.gene.evidence.enrich.HttpGeneAnnotationClient;
import com.gene.evidence.enrich.RetryPolicy;
import com.gene.evidence.genome.GenomeWideCsvExporter;
import com.gene.evidence.genome.GenomeWideSummarizer;
import com.gene.evidence.logging.LogContext;
import com.gene.evidence.metrics.MicrometerPipelineMetrics;
import com.gene.evidence.metrics.PipelineMetrics;
import com.gene.evidence.scoring.LogarithmicEvidenceScorer;
import com.gene.evidence.snapshot.ArtifactLayout;
import com.gene.evidence.snapshot.ArtifactReader;
import com.gene.evidence.snapshot.AtomicArtifactWriter;
import com.gene.evidence.snapshot.SnapshotWriteException;
import com.gene.evidence.source.ExclusionRule;
import com.gene.evidence.source.ZincFingerExclusionRule;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.eclipse.microprofile.config.ConfigProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Offline pipeline: genome-wide cross-reference, gap derivation, then enrichment.
 *
 * <p>Phases are isolated. A failing phase is recorded and logged and the next phase still
 * runs against whatever artifacts are on disk. The run ends by writing
 * {@code derived/pipeline_status.json}.</p>
 */
public class BatchPipeline {
    private static final Logger log = LoggerFactory.getLogger(BatchPipeline.class);

    private static final List<String> REPORTED_FILES = List.of(
            ArtifactLayout.GENOME_WIDE_CSV,
            ArtifactLayout.GENOME_WIDE_SUMMARY,
            ArtifactLayout.GAP_CANDIDATES,
            ArtifactLayout.CANDIDATE_ENRICHMENT);

    private final ArtifactLayout layout;
    private final List<BatchJob> jobs;
    private final AtomicArtifactWriter writer;
    private final PipelineMetrics metrics;
    private final Clock clock;

    public BatchPipeline(ArtifactLayout layout, List<BatchJob> jobs, AtomicArtifactWriter writer,
                         PipelineMetrics metrics, Clock clock) {
        this.layout = layout;
        this.jobs = List.copyOf(jobs);
        this.writer = writer;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Wires the three standard phases from configuration.
     */
    public static BatchPipeline fromConfig(GeneEvidenceConfig config, PipelineMetrics metrics) {
        ArtifactLayout layout = config.layout();
        List<ExclusionRule> rules = config.isExcludeZincFingers()
                ? List.of(new ZincFingerExclusionRule())
                : List.of();
        EvidenceAssembler assembler = EvidenceAssembler.forLayout(layout, rules);
        AtomicArtifactWriter writer = new AtomicArtifactWriter();

        HttpGeneAnnotationClient client = HttpGeneAnnotationClient.builder()
                .ncbiBaseUrl(config.getNcbiBaseUrl())
                .uniprotBaseUrl(config.getUniprotBaseUrl())
                .timeout(config.getTimeout())
                .retryPolicy(new RetryPolicy(config.getMaxAttempts(), config.getBackoff()))
                .cacheMaxSize(config.getCacheMaxSize())
                .metrics(metrics)
                .build();

        List<BatchJob> jobs = List.of(
                new GenomeWideJob(layout, assembler, new GenomeWideSummarizer(),
                        new GenomeWideCsvExporter(), writer, metrics),
                new GapDerivationJob(layout, assembler,
                        new CandidateSelector(new LogarithmicEvidenceScorer()), writer, metrics),
                new EnrichmentJob(layout, new ArtifactReader(),
                        new CandidateEnricher(client, metrics, config.getRateLimit()),
                        config.getEnrichmentTop(), writer, metrics));
        return new BatchPipeline(layout, jobs, writer, metrics, Clock.systemUTC());
    }

    public PipelineStatus run() {
        String runId = UUID.randomUUID().toString();
        Instant started = clock.instant();
        Map<String, PhaseResult> phases = new LinkedHashMap<>();
        log.info("pipeline.started runId={} phases={}", runId, jobs.size());

        for (BatchJob job : jobs) {
            phases.put(job.getName(), runPhase(runId, job));
        }

        long seconds = Duration.between(started, clock.instant()).toSeconds();
        PipelineStatus status = new PipelineStatus(runId, started, seconds, phases, fileSizes());
        try {
            writer.writeJson(layout.pipelineStatus(), status);
            metrics.recordArtifactWritten(ArtifactLayout.PIPELINE_STATUS);
        } catch (SnapshotWriteException e) {
            log.error("pipeline.statusWriteFailed path={} error={}", layout.pipelineStatus(), e.getMessage());
        }
        log.info("pipeline.completed runId={} allSucceeded={} durationSeconds={}",
                runId, status.allSucceeded(), seconds);
        return status;
    }

    private PhaseResult runPhase(String runId, BatchJob job) {
        try (LogContext ctx = LogContext.forBatch(runId, job.getName())) {
            Instant start = clock.instant();
            log.info("phase.started phase={}", job.getName());
            try {
                String summary = job.run(runId);
                Duration elapsed = Duration.between(start, clock.instant());
                metrics.recordPhaseDuration(job.getName(), true, elapsed);
                log.info("phase.completed phase={} durationMs={} summary={}",
                        job.getName(), elapsed.toMillis(), summary);
                return PhaseResult.ok(elapsed.toMillis(), summary);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                Duration elapsed = Duration.between(start, clock.instant());
                metrics.recordPhaseDuration(job.getName(), false, elapsed);
                log.warn("phase.interrupted phase={}", job.getName());
                return PhaseResult.failed(elapsed.toMillis(), "Interrupted");
            } catch (Exception e) {
                Duration elapsed = Duration.between(start, clock.instant());
                metrics.recordPhaseDuration(job.getName(), false, elapsed);
                log.error("phase.failed phase={} error={}", job.getName(), e.getMessage(), e);
                return PhaseResult.failed(elapsed.toMillis(), e.getMessage());
            }
        }
    }

    private Map<String, Long> fileSizes() {
        Map<String, Long> sizes = new LinkedHashMap<>();
        for (String name : REPORTED_FILES) {
            Path path = layout.derivedDirectory().resolve(name);
            if (!Files.isRegularFile(path)) {
                continue;
            }
            try {
                sizes.put(name, Files.size(path));
            } catch (IOException e) {
                log.warn("pipeline.sizeUnavailable path={} error={}", path, e.getMessage());
            }
        }
        return sizes;
    }

    /**
     * Batch entry point. Reads {@code gene-evidence.*} keys through MicroProfile Config.
     */
    public static void main(String[] args) {
        GeneEvidenceConfig config = GeneEvidenceConfig.from(ConfigProvider.getConfig());
        log.info("pipeline.config {}", config);
        PipelineStatus status = fromConfig(config, new MicrometerPipelineMetrics(new SimpleMeterRegistry())).run();
        if (!status.allSucceeded()) {
            System.exit(1);
        }
    }
}
