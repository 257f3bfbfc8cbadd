package com.gene.evidence.api;

import com.gene.evidence.snapshot.ArtifactStatus;

public record TierAvailability(boolean available, int entries, ArtifactStatus artifact) {
}
