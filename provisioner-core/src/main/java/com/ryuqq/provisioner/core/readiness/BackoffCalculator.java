package com.ryuqq.provisioner.core.readiness;

import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with jitter for readiness polls.
 *
 * <p><strong>Algorithm:</strong></p>
 * <pre>
 * delay = min(baseDelay * 2^(attempt-1) + jitter, maxDelay)
 * jitter = random(0, exponential * jitterFactor)
 * </pre>
 *
 * <p><strong>Example (baseDelay=500ms, maxDelay=5000ms, jitterFactor=0.1):</strong></p>
 * <ul>
 *   <li>attempt=1: 500-550ms</li>
 *   <li>attempt=2: 1000-1100ms</li>
 *   <li>attempt=3: 2000-2200ms</li>
 *   <li>attempt=5: 5000ms (capped)</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final DoubleSupplier random;

    /**
     * @param baseDelayMs base delay (positive)
     * @param maxDelayMs maximum delay (at least baseDelayMs)
     * @param jitterFactor jitter ratio (0.0 ~ 1.0)
     * @throws IllegalArgumentException if a parameter is out of range
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        this(baseDelayMs, maxDelayMs, jitterFactor, Math::random);
    }

    BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor, DoubleSupplier random) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be positive (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
        this.random = random;
    }

    public static BackoffCalculator from(ReadinessConfig config) {
        return new BackoffCalculator(config.baseDelayMs(), config.maxDelayMs(), config.jitterFactor());
    }

    /**
     * Delay before the given attempt.
     *
     * @param attemptCount attempt number, starting at 1
     * @return delay in milliseconds
     * @throws IllegalArgumentException if attemptCount is not positive
     */
    public long calculate(int attemptCount) {
        if (attemptCount <= 0) {
            throw new IllegalArgumentException(
                "attemptCount must be positive (current: " + attemptCount + ")"
            );
        }

        // shift capped at 30 so the multiplication cannot overflow
        int shift = Math.min(attemptCount - 1, 30);
        long exponential = Math.min(baseDelayMs * (1L << shift), maxDelayMs);
        long jitter = (long) (exponential * jitterFactor * random.getAsDouble());

        return Math.min(exponential + jitter, maxDelayMs);
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }
}
