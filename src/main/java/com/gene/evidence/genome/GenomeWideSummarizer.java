package com.gene.evidence.genome;

import com.gene.evidence.core.model.AggregatedGeneRecord;
import com.gene.evidence.core.model.Provenance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Builds the genome-wide cross-reference table and its summary.
 */
public class GenomeWideSummarizer {
    private static final Logger log = LoggerFactory.getLogger(GenomeWideSummarizer.class);

    public static final String WORKER = "gene-evidence/genome-wide";

    /**
     * A gene with more phenotype terms than this and no curation counts as a phenotype-rich gap.
     */
    static final int PHENOTYPE_THRESHOLD = 5;

    private final Clock clock;

    public GenomeWideSummarizer() {
        this(Clock.systemUTC());
    }

    public GenomeWideSummarizer(Clock clock) {
        this.clock = clock;
    }

    /**
     * Rows sorted by symbol.
     */
    public List<GenomeWideRow> rows(List<AggregatedGeneRecord> records) {
        return records.stream()
                .map(GenomeWideRow::of)
                .sorted(Comparator.comparing(GenomeWideRow::symbol))
                .toList();
    }

    public GenomeWideSummary summarize(List<GenomeWideRow> rows) {
        int inHpo = 0;
        int inOrphanet = 0;
        int inOmim = 0;
        int inCurated = 0;
        int phenotypeGaps = 0;
        int diseaseGaps = 0;
        for (GenomeWideRow row : rows) {
            if (row.inHpo()) {
                inHpo++;
            }
            if (row.inOrphanet()) {
                inOrphanet++;
            }
            if (row.inOmim()) {
                inOmim++;
            }
            if (row.inCurated()) {
                inCurated++;
            }
            if (row.hpoPhenotypeCount() > PHENOTYPE_THRESHOLD && !row.inCurated()) {
                phenotypeGaps++;
            }
            if (row.inOmim() && !row.inCurated()) {
                diseaseGaps++;
            }
        }

        Provenance provenance = Provenance.builder()
                .worker(WORKER)
                .generated(Instant.now(clock))
                .canonSource("HGNC")
                .canonSource("HPO")
                .canonSource("Orphanet")
                .canonSource("OMIM")
                .nonCanonElement("Cross-reference join logic")
                .nonCanonElement("Phenotype count thresholds")
                .description("Per-source coverage across the gene universe")
                .build();

        GenomeWideSummary summary = new GenomeWideSummary(rows.size(), inHpo, inOrphanet, inOmim, inCurated,
                phenotypeGaps, diseaseGaps, provenance);
        log.info("genomeWide.summarized total={} inHpo={} inOrphanet={} inOmim={} inCurated={} diseaseNotCurated={}",
                rows.size(), inHpo, inOrphanet, inOmim, inCurated, diseaseGaps);
        return summary;
    }
}
