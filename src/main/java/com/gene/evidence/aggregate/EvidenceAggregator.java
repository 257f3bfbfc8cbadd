package com.gene.evidence.aggregate;

import com.gene.evidence.core.model.AggregatedGeneRecord;
import com.gene.evidence.core.model.EvidenceSource;
import com.gene.evidence.core.model.GeneRecord;
import com.gene.evidence.core.model.GeneSymbol;
import com.gene.evidence.core.model.SourceEvidence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Joins per-source evidence onto the gene universe.
 *
 * <p>Produces exactly one record per symbol. Universe order is preserved and the first
 * occurrence of a duplicate symbol wins. Curated symbols missing from the universe are
 * appended as symbol-only records so curated membership is never lost. Keys of the
 * evidence maps are normalized again here so a caller passing raw keys still joins.</p>
 */
public class EvidenceAggregator {
    private static final Logger log = LoggerFactory.getLogger(EvidenceAggregator.class);

    public List<AggregatedGeneRecord> aggregate(List<GeneRecord> universe,
                                                Set<String> curatedSymbols,
                                                Map<EvidenceSource, Map<String, SourceEvidence>> evidenceBySource) {
        Set<String> curated = normalizeAll(curatedSymbols);
        Map<EvidenceSource, Map<String, SourceEvidence>> evidence = normalizeKeys(evidenceBySource);

        Map<String, GeneRecord> genes = new LinkedHashMap<>();
        int duplicates = 0;
        for (GeneRecord gene : universe) {
            if (gene == null || gene.symbol() == null || gene.symbol().isEmpty()) {
                continue;
            }
            if (genes.putIfAbsent(gene.symbol(), gene) != null) {
                duplicates++;
            }
        }
        int added = 0;
        for (String symbol : curated) {
            if (!genes.containsKey(symbol)) {
                genes.put(symbol, GeneRecord.symbolOnly(symbol, GeneRecord.CURATED_SOURCE));
                added++;
            }
        }

        List<AggregatedGeneRecord> records = new ArrayList<>(genes.size());
        for (Map.Entry<String, GeneRecord> entry : genes.entrySet()) {
            String symbol = entry.getKey();
            Map<EvidenceSource, SourceEvidence> attached = new EnumMap<>(EvidenceSource.class);
            evidence.forEach((source, bySymbol) -> {
                SourceEvidence value = bySymbol.get(symbol);
                if (value != null) {
                    attached.put(source, value);
                }
            });
            records.add(new AggregatedGeneRecord(symbol, entry.getValue(), attached, curated.contains(symbol)));
        }

        log.info("aggregation.completed genes={} curated={} duplicatesSkipped={} curatedAdded={}",
                records.size(), curated.size(), duplicates, added);
        return records;
    }

    private static Set<String> normalizeAll(Set<String> symbols) {
        Set<String> normalized = new TreeSet<>();
        if (symbols != null) {
            for (String symbol : symbols) {
                String value = GeneSymbol.normalize(symbol);
                if (value != null && !value.isEmpty()) {
                    normalized.add(value);
                }
            }
        }
        return normalized;
    }

    private static Map<EvidenceSource, Map<String, SourceEvidence>> normalizeKeys(
            Map<EvidenceSource, Map<String, SourceEvidence>> evidenceBySource) {
        Map<EvidenceSource, Map<String, SourceEvidence>> normalized = new EnumMap<>(EvidenceSource.class);
        if (evidenceBySource == null) {
            return normalized;
        }
        evidenceBySource.forEach((source, bySymbol) -> {
            Map<String, SourceEvidence> keyed = new HashMap<>();
            if (bySymbol != null) {
                bySymbol.forEach((symbol, value) -> {
                    String key = GeneSymbol.normalize(symbol);
                    if (key != null && !key.isEmpty() && value != null) {
                        keyed.putIfAbsent(key, value);
                    }
                });
            }
            normalized.put(source, keyed);
        });
        return normalized;
    }
}
