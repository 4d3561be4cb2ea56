package io.irontrade.infrastructure.broker.common;

import java.time.Duration;

/**
 * Retry policy with exponential backoff for broker API requests.
 *
 * One instance tracks the attempts of a single logical request: create a
 * fresh policy per request.
 *
 * Usage:
 * <pre>
 * RetryPolicy policy = RetryPolicy.forApiRequests();
 *
 * while (true) {
 *     try {
 *         return send(request);
 *     } catch (TransientFailure e) {
 *         if (!policy.shouldRetry()) throw e;
 *         Duration delay = policy.recordFailure();
 *         Thread.sleep(delay.toMillis());
 *     }
 * }
 * </pre>
 */
public class RetryPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxRetries;

    private int retryCount = 0;
    private Duration currentDelay;

    private RetryPolicy(Duration initialDelay, Duration maxDelay, double multiplier, int maxRetries) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.maxRetries = maxRetries;
        this.currentDelay = initialDelay;
    }

    /**
     * Whether another attempt is allowed.
     */
    public synchronized boolean shouldRetry() {
        return retryCount < maxRetries;
    }

    /**
     * Record a failed attempt.
     *
     * @return the delay to wait before retrying
     */
    public synchronized Duration recordFailure() {
        Duration delay = currentDelay;
        retryCount++;

        long nextDelayMillis = (long) (currentDelay.toMillis() * multiplier);
        currentDelay = Duration.ofMillis(Math.min(nextDelayMillis, maxDelay.toMillis()));
        return delay;
    }

    /**
     * Record a successful attempt. Resets the backoff.
     */
    public synchronized void recordSuccess() {
        retryCount = 0;
        currentDelay = initialDelay;
    }

    public synchronized int getRetryCount() {
        return retryCount;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Default policy for REST calls to a broker: 3 retries, 250ms doubling to 2s.
     */
    public static RetryPolicy forApiRequests() {
        return builder()
            .initialDelay(Duration.ofMillis(250))
            .maxDelay(Duration.ofSeconds(2))
            .multiplier(2.0)
            .maxRetries(3)
            .build();
    }

    /**
     * Builder for RetryPolicy.
     */
    public static class Builder {
        private Duration initialDelay = Duration.ofMillis(250);
        private Duration maxDelay = Duration.ofSeconds(2);
        private double multiplier = 2.0;
        private int maxRetries = 3;

        public Builder initialDelay(Duration initialDelay) {
            if (initialDelay.isNegative() || initialDelay.isZero()) {
                throw new IllegalArgumentException("Initial delay must be positive");
            }
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative() || maxDelay.isZero()) {
                throw new IllegalArgumentException("Max delay must be positive");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("Multiplier must be at least 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("Max retries cannot be negative");
            }
            this.maxRetries = maxRetries;
            return this;
        }

        public RetryPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new RetryPolicy(initialDelay, maxDelay, multiplier, maxRetries);
        }
    }
}
