package com.eyelevel.uploadengine.retry;

import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.SleepingBackOffPolicy;
import org.springframework.retry.backoff.ThreadWaitSleeper;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with additive jitter and a hard cap.
 * <p>
 * The delay before retry {@code k} (0-based) is {@code min(maxDelay, base * 2^k + jitter)}, where the jitter is
 * drawn uniformly from {@code [0, jitterRatio * base * 2^k)}.
 */
public class JitteredExponentialBackOffPolicy implements SleepingBackOffPolicy<JitteredExponentialBackOffPolicy> {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterRatio;
    private final Sleeper sleeper;

    public JitteredExponentialBackOffPolicy(final long baseDelayMs, final long maxDelayMs, final double jitterRatio) {
        this(baseDelayMs, maxDelayMs, jitterRatio, new ThreadWaitSleeper());
    }

    private JitteredExponentialBackOffPolicy(final long baseDelayMs, final long maxDelayMs, final double jitterRatio,
                                             final Sleeper sleeper) {
        if (baseDelayMs < 0 || maxDelayMs < 0 || jitterRatio < 0) {
            throw new IllegalArgumentException("Backoff delays and jitter ratio must not be negative");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterRatio = jitterRatio;
        this.sleeper = sleeper;
    }

    @Override
    public JitteredExponentialBackOffPolicy withSleeper(final Sleeper sleeper) {
        return new JitteredExponentialBackOffPolicy(baseDelayMs, maxDelayMs, jitterRatio, sleeper);
    }

    @Override
    public BackOffContext start(final RetryContext context) {
        return new AttemptCounter();
    }

    @Override
    public void backOff(final BackOffContext backOffContext) throws BackOffInterruptedException {
        final AttemptCounter counter = (AttemptCounter) backOffContext;
        final long delay = computeDelay(counter.next());
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackOffInterruptedException("Thread interrupted while sleeping " + delay + "ms before retry", e);
        }
    }

    /**
     * Computes a jittered delay for the given 0-based retry index.
     */
    public long computeDelay(final int attempt) {
        final double unjittered = baseDelayMs * Math.pow(2, attempt);
        final double jitter = unjittered * jitterRatio * ThreadLocalRandom.current().nextDouble();
        return (long) Math.min(maxDelayMs, unjittered + jitter);
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    private static final class AttemptCounter implements BackOffContext {

        private static final long serialVersionUID = 1L;
        private int attempt;

        int next() {
            return attempt++;
        }
    }
}
