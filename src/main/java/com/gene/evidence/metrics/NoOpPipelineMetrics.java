package com.gene.evidence.metrics;

import com.gene.evidence.core.model.Tier;

import java.time.Duration;

/**
 * No-op implementation of {@link PipelineMetrics}.
 */
public class NoOpPipelineMetrics implements PipelineMetrics {

    @Override
    public void recordPhaseDuration(String phase, boolean succeeded, Duration duration) {
    }

    @Override
    public void recordCandidateCount(int count) {
    }

    @Override
    public void recordArtifactWritten(String artifact) {
    }

    @Override
    public void incrementUpstreamFailure(String service) {
    }

    @Override
    public void recordUpstreamCacheHit() {
    }

    @Override
    public void recordUpstreamCacheMiss() {
    }

    @Override
    public void incrementTierQuery(Tier requested, Tier served) {
    }

    @Override
    public void incrementTierUnavailable(Tier requested) {
    }
}
