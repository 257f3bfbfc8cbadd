package com.gene.evidence.enrich;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Bounded retry with a fixed pause between attempts.
 */
public class RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    /**
     * Pauses the calling thread. Replaced in tests to avoid real waits.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    public static final Sleeper THREAD_SLEEPER = duration -> Thread.sleep(duration.toMillis());

    private final int maxAttempts;
    private final Duration backoff;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, Duration backoff) {
        this(maxAttempts, backoff, THREAD_SLEEPER);
    }

    public RetryPolicy(int maxAttempts, Duration backoff, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
        this.sleeper = sleeper;
    }

    /**
     * Runs {@code call} until it succeeds or the attempts are used up.
     *
     * @param service name reported in logs and in the exception
     * @throws UpstreamFetchException with the last failure as cause when every attempt failed
     */
    public <T> T execute(String service, Callable<T> call) {
        Exception last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return call.call();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new UpstreamFetchException(service, "Interrupted while calling " + service, e);
            } catch (Exception e) {
                last = e;
                log.debug("upstream.attemptFailed service={} attempt={}/{} error={}",
                        service, attempt, maxAttempts, e.getMessage());
                if (attempt < maxAttempts) {
                    pause(service);
                }
            }
        }
        throw new UpstreamFetchException(service,
                service + " failed after " + maxAttempts + " attempts: " + last.getMessage(), last);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getBackoff() {
        return backoff;
    }

    private void pause(String service) {
        try {
            sleeper.sleep(backoff);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamFetchException(service, "Interrupted while backing off from " + service, e);
        }
    }
}
