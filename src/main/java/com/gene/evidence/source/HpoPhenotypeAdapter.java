package com.gene.evidence.source;

import com.gene.evidence.core.model.EvidenceSource;
import com.gene.evidence.core.model.GeneSymbol;
import com.gene.evidence.core.model.SourceEvidence;
import com.gene.evidence.snapshot.ArtifactLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Phenotype associations from the HPO {@code genes_to_phenotype.txt} bulk file.
 *
 * <p>Tab-separated: gene id, gene symbol, HPO id, HPO term name, ... Lines starting with
 * {@code #} and lines with fewer than four columns are skipped. Evidence per gene is the
 * sorted set of distinct term names.</p>
 */
public class HpoPhenotypeAdapter implements SourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(HpoPhenotypeAdapter.class);
    private static final int MIN_COLUMNS = 4;

    private final Path path;

    public HpoPhenotypeAdapter(Path path) {
        this.path = path;
    }

    @Override
    public EvidenceSource getSource() {
        return EvidenceSource.HPO;
    }

    @Override
    public Map<String, SourceEvidence> load() {
        if (path == null || !Files.isRegularFile(path)) {
            log.warn("source.missing source={} path={} (continuing without it)", getSource(), path);
            return Map.of();
        }

        Map<String, Set<String>> termsBySymbol = new HashMap<>();
        long skipped = 0;
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.startsWith("#") || line.isBlank()) {
                    continue;
                }
                String[] parts = line.strip().split("\t");
                if (parts.length < MIN_COLUMNS) {
                    skipped++;
                    continue;
                }
                String symbol = GeneSymbol.normalize(parts[1]);
                if (symbol.isEmpty()) {
                    skipped++;
                    continue;
                }
                termsBySymbol.computeIfAbsent(symbol, k -> new TreeSet<>()).add(parts[3].trim());
            }
        } catch (IOException e) {
            throw new ArtifactLoadException(path, "Failed to read HPO file " + path, e);
        }

        Map<String, SourceEvidence> result = new LinkedHashMap<>();
        termsBySymbol.forEach((symbol, terms) ->
                result.put(symbol, SourceEvidence.counted(EvidenceSource.HPO, new ArrayList<>(terms))));
        log.info("source.loaded source={} genes={} skippedLines={}", getSource(), result.size(), skipped);
        return result;
    }
}
