package com.ryuqq.provisioner.core.readiness;

import com.ryuqq.provisioner.core.exception.PropagationTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * Bounded poll-until-ready loop for eventually consistent cloud state.
 *
 * <p><strong>Algorithm:</strong></p>
 * <ol>
 *   <li>evaluate the condition; return when it holds</li>
 *   <li>otherwise sleep for the next backoff delay, never past the remaining budget</li>
 *   <li>give up with {@link PropagationTimeoutException} once the slept time reaches maxWait</li>
 * </ol>
 *
 * <p>The budget counts slept time only, so a condition that is itself slow can stretch a
 * wait beyond maxWait by the duration of its calls.</p>
 *
 * <p>An interrupt during a sleep restores the thread's interrupt flag and aborts the wait.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class ReadinessWaiter {

    private static final Logger log = LoggerFactory.getLogger(ReadinessWaiter.class);

    private final ReadinessConfig config;
    private final BackoffCalculator backoff;
    private final Sleeper sleeper;

    public ReadinessWaiter(ReadinessConfig config) {
        this(config, BackoffCalculator.from(requireConfig(config)), Thread::sleep);
    }

    ReadinessWaiter(ReadinessConfig config, BackoffCalculator backoff, Sleeper sleeper) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (backoff == null) {
            throw new IllegalArgumentException("backoff cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.config = config;
        this.backoff = backoff;
        this.sleeper = sleeper;
    }

    /**
     * Blocks until the condition holds.
     *
     * @param description what is being waited for, used in logs and the exception message
     * @param condition readiness check (typically a describe call)
     * @throws PropagationTimeoutException if the condition does not hold within maxWait
     * @throws IllegalStateException if the thread is interrupted while waiting
     */
    public void await(String description, BooleanSupplier condition) {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("description cannot be null or blank");
        }
        if (condition == null) {
            throw new IllegalArgumentException("condition cannot be null");
        }

        long waitedMs = 0;
        int attempt = 0;
        while (true) {
            attempt++;
            if (condition.getAsBoolean()) {
                if (attempt > 1) {
                    log.debug("{} ready after {} attempts ({} ms)", description, attempt, waitedMs);
                }
                return;
            }
            long remaining = config.maxWaitMs() - waitedMs;
            if (remaining <= 0) {
                throw new PropagationTimeoutException(description, Duration.ofMillis(waitedMs), attempt);
            }
            long delay = Math.min(backoff.calculate(attempt), remaining);
            log.debug("Waiting {} ms for {} (attempt {})", delay, description, attempt);
            sleep(delay);
            waitedMs += delay;
        }
    }

    public ReadinessConfig getConfig() {
        return config;
    }

    private void sleep(long millis) {
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Readiness poll interrupted", e);
        }
    }

    private static ReadinessConfig requireConfig(ReadinessConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return config;
    }

    /**
     * Sleep hook, replaced in tests.
     */
    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
