package com.gene.evidence.source;

import com.gene.evidence.core.model.EvidenceSource;
import com.gene.evidence.core.model.SourceEvidence;

import java.util.Map;

/**
 * Produces normalized per-gene evidence for one source.
 *
 * <p>Keys of the returned map are normalized gene symbols. When the backing file is
 * absent the adapter returns an empty map; it never fails for a missing file.</p>
 */
public interface SourceAdapter {

    /**
     * The source this adapter reads.
     */
    EvidenceSource getSource();

    /**
     * Loads evidence keyed by normalized gene symbol.
     *
     * @throws com.gene.evidence.snapshot.ArtifactLoadException if the file exists but is unreadable
     */
    Map<String, SourceEvidence> load();
}
