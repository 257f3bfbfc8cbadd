package com.gene.evidence.metrics;

import com.gene.evidence.core.model.Tier;

import java.time.Duration;

/**
 * Records batch and serving metrics.
 * The default {@link NoOpPipelineMetrics} does nothing, so jobs and tests need no registry.
 */
public interface PipelineMetrics {

    void recordPhaseDuration(String phase, boolean succeeded, Duration duration);

    void recordCandidateCount(int count);

    void recordArtifactWritten(String artifact);

    void incrementUpstreamFailure(String service);

    void recordUpstreamCacheHit();

    void recordUpstreamCacheMiss();

    void incrementTierQuery(Tier requested, Tier served);

    void incrementTierUnavailable(Tier requested);
}
