package com.gene.evidence.metrics;

import com.gene.evidence.core.model.Tier;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link PipelineMetrics}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code gene.pipeline.phase.duration} Timer (tags: phase, outcome)</li>
 *   <li>{@code gene.candidates.count} DistributionSummary</li>
 *   <li>{@code gene.artifact.written} Counter (tag: artifact)</li>
 *   <li>{@code gene.upstream.failure} Counter (tag: service)</li>
 *   <li>{@code gene.upstream.cache.hit} / {@code gene.upstream.cache.miss} Counters</li>
 *   <li>{@code gene.query.tier} Counter (tags: requested, served, fallback)</li>
 *   <li>{@code gene.query.unavailable} Counter (tag: requested)</li>
 * </ul>
 */
public class MicrometerPipelineMetrics implements PipelineMetrics {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary candidateCountSummary;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerPipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.candidateCountSummary = DistributionSummary.builder("gene.candidates.count")
                .description("Number of gap candidates per derivation run")
                .register(registry);
        this.cacheHitCounter = Counter.builder("gene.upstream.cache.hit")
                .description("Upstream lookups answered from the response cache")
                .register(registry);
        this.cacheMissCounter = Counter.builder("gene.upstream.cache.miss")
                .description("Upstream lookups that went to the network")
                .register(registry);
    }

    @Override
    public void recordPhaseDuration(String phase, boolean succeeded, Duration duration) {
        String outcome = succeeded ? "success" : "failure";
        Timer timer = timerCache.computeIfAbsent(phase + ":" + outcome, k ->
                Timer.builder("gene.pipeline.phase.duration")
                        .description("Duration of batch pipeline phases")
                        .tag("phase", phase)
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordCandidateCount(int count) {
        candidateCountSummary.record(count);
    }

    @Override
    public void recordArtifactWritten(String artifact) {
        counter("written:" + artifact, "gene.artifact.written", "Artifacts published", "artifact", artifact)
                .increment();
    }

    @Override
    public void incrementUpstreamFailure(String service) {
        counter("upstream:" + service, "gene.upstream.failure", "Upstream calls failed after retries",
                "service", service).increment();
    }

    @Override
    public void recordUpstreamCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordUpstreamCacheMiss() {
        cacheMissCounter.increment();
    }

    @Override
    public void incrementTierQuery(Tier requested, Tier served) {
        String key = "query:" + requested.name() + ":" + served.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("gene.query.tier")
                        .description("Tier queries by requested and served tier")
                        .tag("requested", requested.getParamName())
                        .tag("served", served.getParamName())
                        .tag("fallback", Boolean.toString(requested != served))
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementTierUnavailable(Tier requested) {
        counter("unavailable:" + requested.name(), "gene.query.unavailable", "Tier queries answered with 503",
                "requested", requested.getParamName()).increment();
    }

    private Counter counter(String key, String name, String description, String tagKey, String tagValue) {
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
