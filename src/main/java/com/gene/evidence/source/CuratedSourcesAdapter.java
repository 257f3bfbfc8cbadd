package com.gene.evidence.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.gene.evidence.core.model.EvidenceSource;
import com.gene.evidence.core.model.SourceEvidence;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-source coverage flags from the curated pipeline ({@code sources.json}).
 *
 * <p>Every key is a member of the curated reference set, so the key set of
 * {@link #load()} doubles as that set. The evidence count is the number of truthy flags.</p>
 */
public class CuratedSourcesAdapter extends JsonSourceAdapter {

    public CuratedSourcesAdapter(Path path) {
        super(path);
    }

    @Override
    public EvidenceSource getSource() {
        return EvidenceSource.CURATED_PIPELINE;
    }

    @Override
    protected Optional<SourceEvidence> toEvidence(JsonNode value) {
        List<String> flags = new ArrayList<>();
        if (value.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (isTruthy(field.getValue())) {
                    flags.add(field.getKey());
                }
            }
        }
        return Optional.of(SourceEvidence.counted(EvidenceSource.CURATED_PIPELINE, flags));
    }

    static boolean isTruthy(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return false;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            return node.doubleValue() != 0.0;
        }
        if (node.isTextual()) {
            return !node.textValue().isEmpty();
        }
        return node.size() > 0;
    }
}
