package com.gene.evidence.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.gene.evidence.core.model.EvidenceSource;
import com.gene.evidence.core.model.SourceEvidence;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Rare-disease associations from the pre-parsed Orphanet cache.
 *
 * <p>The cache stores either a list of disorders per gene or an object with a
 * {@code disorders} list; disorders are objects with a {@code name} or plain strings.
 * Both shapes collapse to a count plus the disorder names.</p>
 */
public class OrphanetAdapter extends JsonSourceAdapter {

    public OrphanetAdapter(Path path) {
        super(path);
    }

    @Override
    public EvidenceSource getSource() {
        return EvidenceSource.ORPHANET;
    }

    @Override
    protected Optional<SourceEvidence> toEvidence(JsonNode value) {
        JsonNode disorders;
        if (value.isArray()) {
            disorders = value;
        } else if (value.isObject()) {
            disorders = value.get("disorders");
        } else {
            return Optional.empty();
        }
        List<String> names = textList(disorders);
        return Optional.of(SourceEvidence.counted(EvidenceSource.ORPHANET, names));
    }
}
