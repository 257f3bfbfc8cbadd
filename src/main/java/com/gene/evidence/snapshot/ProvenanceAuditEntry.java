package com.gene.evidence.snapshot;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A provenance block found in a derived artifact, kept as written so that blocks from
 * older generators with different fields are still listed.
 */
public record ProvenanceAuditEntry(
        @JsonProperty("artifact") String artifact,
        @JsonProperty("provenance") Map<String, Object> provenance
) {
    public ProvenanceAuditEntry {
        provenance = provenance != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(provenance))
                : Map.of();
    }
}
