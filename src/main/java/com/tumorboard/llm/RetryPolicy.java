package com.tumorboard.llm;

import com.tumorboard.AppLogger;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Bounded retry with exponential backoff.
 *
 * The wait after failed attempt {@code n} is {@code multiplier * 2^(n-1)} seconds, clamped to
 * [{@code minWait}, {@code maxWait}]. With the defaults that is 2s then 2s before attempts 2 and 3.
 */
public final class RetryPolicy {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_MIN_WAIT = Duration.ofSeconds(2);
    public static final Duration DEFAULT_MAX_WAIT = Duration.ofSeconds(10);

    @FunctionalInterface
    public interface Attempt<T> {
        T call() throws Exception;
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    public static final Sleeper THREAD_SLEEPER = duration -> Thread.sleep(duration.toMillis());

    private final int maxAttempts;
    private final double multiplier;
    private final Duration minWait;
    private final Duration maxWait;
    private final Predicate<Exception> retryable;
    private final Sleeper sleeper;
    private final AppLogger logger = AppLogger.get();

    public RetryPolicy(int maxAttempts, double multiplier, Duration minWait, Duration maxWait,
                       Predicate<Exception> retryable, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.multiplier = multiplier;
        this.minWait = Objects.requireNonNull(minWait, "minWait");
        this.maxWait = Objects.requireNonNull(maxWait, "maxWait");
        this.retryable = Objects.requireNonNull(retryable, "retryable");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * Three attempts, 2s..10s exponential backoff, every exception retryable.
     */
    public static RetryPolicy defaultPolicy() {
        return defaultPolicy(THREAD_SLEEPER);
    }

    public static RetryPolicy defaultPolicy(Sleeper sleeper) {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, 1.0, DEFAULT_MIN_WAIT, DEFAULT_MAX_WAIT, e -> true, sleeper);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Wait before the attempt following failed attempt {@code attemptNumber} (1-based).
     */
    public Duration waitAfter(int attemptNumber) {
        double seconds = multiplier * Math.pow(2, attemptNumber - 1);
        long millis = Math.round(seconds * 1000);
        millis = Math.max(minWait.toMillis(), Math.min(maxWait.toMillis(), millis));
        return Duration.ofMillis(millis);
    }

    /**
     * Runs the operation until it succeeds, fails with a non-retryable error, or attempts run out.
     *
     * @throws RetryFailedException carrying the last failure and the number of attempts made
     * @throws InterruptedException if interrupted during the call or a backoff wait; never retried
     */
    public <T> T execute(String operation, Attempt<T> attempt) throws RetryFailedException, InterruptedException {
        Exception last = null;
        for (int n = 1; n <= maxAttempts; n++) {
            try {
                return attempt.call();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw e;
            } catch (Exception e) {
                last = e;
                if (!retryable.test(e)) {
                    throw new RetryFailedException(operation, n, false, e);
                }
                if (n < maxAttempts) {
                    Duration wait = waitAfter(n);
                    logger.warn(operation + " attempt " + n + "/" + maxAttempts + " failed: " + e.getMessage()
                        + "; retrying in " + wait.toMillis() + "ms");
                    sleeper.sleep(wait);
                }
            }
        }
        throw new RetryFailedException(operation, maxAttempts, true, last);
    }

    /**
     * Terminal outcome of {@link #execute}: either retries were exhausted or the error was not retryable.
     */
    public static class RetryFailedException extends Exception {
        private final int attempts;
        private final boolean exhausted;

        public RetryFailedException(String operation, int attempts, boolean exhausted, Exception cause) {
            super(operation + (exhausted ? " failed after " + attempts + " attempts: " : " failed: ")
                + (cause != null ? cause.getMessage() : "unknown error"), cause);
            this.attempts = attempts;
            this.exhausted = exhausted;
        }

        public int getAttempts() {
            return attempts;
        }

        public boolean isExhausted() {
            return exhausted;
        }
    }
}
