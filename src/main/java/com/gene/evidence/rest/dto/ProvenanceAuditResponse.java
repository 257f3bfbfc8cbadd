package com.gene.evidence.rest.dto;

import com.gene.evidence.snapshot.ProvenanceAuditEntry;

import java.util.List;

public record ProvenanceAuditResponse(int count, List<ProvenanceAuditEntry> artifacts) {

    public static ProvenanceAuditResponse from(List<ProvenanceAuditEntry> entries) {
        return new ProvenanceAuditResponse(entries.size(), entries);
    }
}
