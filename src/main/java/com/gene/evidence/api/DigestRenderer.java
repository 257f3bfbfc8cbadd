package com.gene.evidence.api;

import com.gene.evidence.candidate.CandidateRecord;
import com.gene.evidence.candidate.CandidateSnapshot;
import com.gene.evidence.core.model.Tier;
import com.gene.evidence.snapshot.ServedSnapshot;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Renders the periodic digest posted to the project tracker.
 */
class DigestRenderer {

    static final int TOP_CANDIDATES = 10;

    String render(LocalDate date, ServedSnapshot snapshot, CoverageSummary coverage) {
        StringBuilder md = new StringBuilder();
        md.append("# Gene evidence digest (").append(date).append(")\n\n");

        md.append("## Tiers\n\n");
        md.append("| Tier | Available | Entries | Artifact |\n");
        md.append("|---|---|---|---|\n");
        for (Tier tier : Tier.values()) {
            md.append("| ").append(tier.getParamName())
                    .append(" | ").append(snapshot.isAvailable(tier) ? "yes" : "no")
                    .append(" | ").append(snapshot.size(tier))
                    .append(" | ").append(snapshot.getStatus(tier).name().toLowerCase(Locale.ROOT))
                    .append(" |\n");
        }
        md.append('\n');

        md.append("## Source coverage\n\n");
        if (coverage == null) {
            md.append("_Curated data not loaded._\n\n");
        } else {
            md.append("Curated genes: ").append(coverage.totalGenes()).append("\n\n");
            md.append("| Source | Genes | Percent |\n");
            md.append("|---|---|---|\n");
            for (Map.Entry<String, SourceCoverage> entry : coverage.sources().entrySet()) {
                md.append("| ").append(entry.getKey())
                        .append(" | ").append(entry.getValue().count())
                        .append(" | ").append(entry.getValue().percent()).append("% |\n");
            }
            md.append('\n');
        }

        md.append("## Top gap candidates\n\n");
        Optional<CandidateSnapshot> candidates = snapshot.getCandidates();
        if (candidates.isEmpty() || candidates.get().candidates().isEmpty()) {
            md.append("_No gap candidates available._\n");
            return md.toString();
        }
        CandidateSnapshot artifact = candidates.get();
        md.append("Candidates: ").append(artifact.candidateCount());
        artifact.scoreDistribution().forEach((band, count) ->
                md.append(", ").append(band).append(": ").append(count));
        md.append("\n\n");
        md.append("| # | Symbol | Score | HPO | Orphanet | OMIM |\n");
        md.append("|---|---|---|---|---|---|\n");
        List<CandidateRecord> top = artifact.candidates().subList(0,
                Math.min(TOP_CANDIDATES, artifact.candidates().size()));
        int rank = 1;
        for (CandidateRecord candidate : top) {
            md.append("| ").append(rank++)
                    .append(" | ").append(candidate.symbol())
                    .append(" | ").append(candidate.confidenceScore())
                    .append(" | ").append(candidate.phenotypeCount())
                    .append(" | ").append(candidate.evidence() != null ? candidate.evidence().orphanetDisorderCount() : 0)
                    .append(" | ").append(candidate.evidence() != null && candidate.evidence().hasOmim() ? "yes" : "")
                    .append(" |\n");
        }
        return md.toString();
    }
}
