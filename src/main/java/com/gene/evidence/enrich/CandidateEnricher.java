package com.gene.evidence.enrich;

import com.gene.evidence.candidate.CandidateRecord;
import com.gene.evidence.candidate.CandidateSnapshot;
import com.gene.evidence.core.model.Provenance;
import com.gene.evidence.logging.LogContext;
import com.gene.evidence.metrics.PipelineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Supplier;

/**
 * Annotates the top gap candidates with NCBI Gene, PubMed and UniProt data.
 *
 * <p>Candidates are processed one at a time with a fixed pause between them. A lookup that
 * fails after retries leaves its field empty and is listed in {@code failed_lookups}; the
 * run always continues with the next lookup.</p>
 */
public class CandidateEnricher {
    private static final Logger log = LoggerFactory.getLogger(CandidateEnricher.class);

    public static final String WORKER = "gene-evidence/candidate-enrichment";
    static final int MAX_TEXT_LENGTH = 500;

    static final Comparator<CandidateRecord> PRIORITY = Comparator
            .comparingDouble(CandidateRecord::confidenceScore).reversed()
            .thenComparing(Comparator.comparingInt(CandidateRecord::phenotypeCount).reversed());

    private final GeneAnnotationClient client;
    private final PipelineMetrics metrics;
    private final Duration rateLimit;
    private final RetryPolicy.Sleeper sleeper;
    private final Clock clock;

    public CandidateEnricher(GeneAnnotationClient client, PipelineMetrics metrics, Duration rateLimit) {
        this(client, metrics, rateLimit, RetryPolicy.THREAD_SLEEPER, Clock.systemUTC());
    }

    public CandidateEnricher(GeneAnnotationClient client, PipelineMetrics metrics, Duration rateLimit,
                             RetryPolicy.Sleeper sleeper, Clock clock) {
        this.client = client;
        this.metrics = metrics;
        this.rateLimit = rateLimit;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    public EnrichmentSnapshot enrich(CandidateSnapshot candidates, int top, String runId) throws InterruptedException {
        List<CandidateRecord> selected = candidates.candidates().stream()
                .sorted(PRIORITY)
                .limit(Math.max(top, 0))
                .toList();
        log.info("enrichment.started candidates={} of={}", selected.size(), candidates.candidates().size());

        List<EnrichedCandidate> enriched = new ArrayList<>(selected.size());
        int failed = 0;
        for (int i = 0; i < selected.size(); i++) {
            CandidateRecord candidate = selected.get(i);
            try (LogContext ctx = LogContext.forEnrichment(runId, candidate.symbol())) {
                EnrichedCandidate result = enrichOne(candidate);
                failed += result.failedLookups().size();
                enriched.add(result);
                log.info("enrichment.candidate index={}/{} pubs={} failures={}",
                        i + 1, selected.size(), result.pubmedCraniofacialCount(), result.failedLookups());
            }
            if (i < selected.size() - 1 && !rateLimit.isZero()) {
                sleeper.sleep(rateLimit);
            }
        }

        EnrichmentSnapshot snapshot = new EnrichmentSnapshot(provenance(), enriched.size(), failed, enriched);
        log.info("enrichment.completed enriched={} withPublications={} failedLookups={}",
                enriched.size(), snapshot.withPublications(), failed);
        return snapshot;
    }

    private EnrichedCandidate enrichOne(CandidateRecord candidate) {
        List<String> failures = new ArrayList<>();
        String ncbiId = candidate.crossReferences().ncbiId();
        String uniprotId = candidate.crossReferences().uniprotId();

        String summary = lookup(GeneAnnotationClient.SERVICE_NCBI_GENE, failures,
                () -> client.geneSummary(ncbiId), "");
        Integer publications = lookup(GeneAnnotationClient.SERVICE_PUBMED, failures,
                () -> client.craniofacialPublicationCount(candidate.symbol()), 0);
        String function = lookup(GeneAnnotationClient.SERVICE_UNIPROT, failures,
                () -> client.proteinFunction(uniprotId), "");

        return new EnrichedCandidate(
                candidate.symbol(),
                candidate.confidenceScore(),
                ncbiId,
                uniprotId,
                truncate(summary),
                publications,
                truncate(function),
                candidate.phenotypeCount(),
                candidate.evidence() != null ? candidate.evidence().orphanetDisorderCount() : 0,
                candidate.hgncSource(),
                failures);
    }

    private <T> T lookup(String service, List<String> failures, Supplier<T> call, T emptyValue) {
        try {
            T value = call.get();
            return value != null ? value : emptyValue;
        } catch (UpstreamFetchException e) {
            log.warn("enrichment.lookupFailed service={} error={}", service, e.getMessage());
            metrics.incrementUpstreamFailure(service);
            failures.add(service);
            return emptyValue;
        }
    }

    static String truncate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > MAX_TEXT_LENGTH ? text.substring(0, MAX_TEXT_LENGTH) : text;
    }

    private Provenance provenance() {
        return Provenance.builder()
                .worker(WORKER)
                .generated(Instant.now(clock))
                .canonSource("NCBI Gene")
                .canonSource("PubMed")
                .canonSource("UniProt")
                .nonCanonElement("Gene summary truncation")
                .nonCanonElement("Craniofacial search term filter")
                .description("Quick external annotations for the top gap candidates")
                .build();
    }
}
