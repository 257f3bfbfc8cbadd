package com.gene.evidence.genome;

import com.gene.evidence.core.model.AggregatedGeneRecord;
import com.gene.evidence.core.model.EvidenceSource;
import com.gene.evidence.core.model.GeneRecord;
import com.gene.evidence.core.model.SourceEvidence;

/**
 * One gene of the genome-wide cross-reference table.
 */
public record GenomeWideRow(
        String symbol,
        String name,
        String ncbiId,
        String uniprotId,
        String ensemblId,
        String omimId,
        String location,
        int hpoPhenotypeCount,
        int orphanetDisorderCount,
        boolean inOmim,
        String omimTitle,
        int omimSyndromeCount,
        boolean inCurated,
        int curatedSourceCount,
        String hgncSource
) {
    public static GenomeWideRow of(AggregatedGeneRecord record) {
        GeneRecord gene = record.gene();
        SourceEvidence omim = record.evidence(EvidenceSource.OMIM);
        return new GenomeWideRow(
                record.symbol(),
                gene.name(),
                gene.ncbiId(),
                gene.uniprotId(),
                gene.ensemblId(),
                gene.omimId(),
                gene.location(),
                record.evidence(EvidenceSource.HPO).count(),
                record.evidence(EvidenceSource.ORPHANET).count(),
                omim.present(),
                omim.label(),
                omim.present() ? omim.count() : 0,
                record.curated(),
                record.evidence(EvidenceSource.CURATED_PIPELINE).count(),
                gene.source());
    }

    public boolean inHpo() {
        return hpoPhenotypeCount > 0;
    }

    public boolean inOrphanet() {
        return orphanetDisorderCount > 0;
    }
}
