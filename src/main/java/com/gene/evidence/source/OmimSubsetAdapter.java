package com.gene.evidence.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.gene.evidence.core.model.EvidenceSource;
import com.gene.evidence.core.model.SourceEvidence;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Disease entries from the bundled OMIM subset: {@code {"genes": {SYMBOL: {title, syndromes}}}}.
 * An empty entry object means no disease entry.
 */
public class OmimSubsetAdapter extends JsonSourceAdapter {

    public OmimSubsetAdapter(Path path) {
        super(path);
    }

    @Override
    public EvidenceSource getSource() {
        return EvidenceSource.OMIM;
    }

    @Override
    protected JsonNode selectGenes(JsonNode root) {
        return root.get("genes");
    }

    @Override
    protected Optional<SourceEvidence> toEvidence(JsonNode value) {
        if (!value.isObject() || value.isEmpty()) {
            return Optional.empty();
        }
        String title = value.hasNonNull("title") ? value.get("title").asText() : "";
        return Optional.of(SourceEvidence.entry(EvidenceSource.OMIM, title, textList(value.get("syndromes"))));
    }
}
