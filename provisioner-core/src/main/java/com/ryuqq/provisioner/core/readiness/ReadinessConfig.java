package com.ryuqq.provisioner.core.readiness;

/**
 * Readiness poll settings (immutable record).
 *
 * <p><strong>Settings:</strong></p>
 * <ul>
 *   <li>maxWaitMs: total time a single wait may take (default 60000ms)</li>
 *   <li>baseDelayMs: first backoff delay (default 500ms)</li>
 *   <li>maxDelayMs: backoff cap (default 5000ms)</li>
 *   <li>jitterFactor: jitter ratio (default 0.1)</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 * @param maxWaitMs total wait bound (positive)
 * @param baseDelayMs first delay (positive)
 * @param maxDelayMs delay cap (at least baseDelayMs)
 * @param jitterFactor jitter ratio (0.0 ~ 1.0)
 */
public record ReadinessConfig(
    long maxWaitMs,
    long baseDelayMs,
    long maxDelayMs,
    double jitterFactor
) {

    /**
     * Default settings: maxWait=60s, baseDelay=500ms, maxDelay=5s, jitter=0.1.
     */
    public ReadinessConfig() {
        this(60000, 500, 5000, 0.1);
    }

    public ReadinessConfig {
        if (maxWaitMs <= 0) {
            throw new IllegalArgumentException(
                "maxWaitMs must be positive (current: " + maxWaitMs + ")"
            );
        }
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
    }

    public ReadinessConfig withMaxWaitMs(long maxWaitMs) {
        return new ReadinessConfig(maxWaitMs, baseDelayMs, maxDelayMs, jitterFactor);
    }

    public ReadinessConfig withBaseDelayMs(long baseDelayMs) {
        return new ReadinessConfig(maxWaitMs, baseDelayMs, maxDelayMs, jitterFactor);
    }

    public ReadinessConfig withMaxDelayMs(long maxDelayMs) {
        return new ReadinessConfig(maxWaitMs, baseDelayMs, maxDelayMs, jitterFactor);
    }

    public ReadinessConfig withJitterFactor(double jitterFactor) {
        return new ReadinessConfig(maxWaitMs, baseDelayMs, maxDelayMs, jitterFactor);
    }
}
