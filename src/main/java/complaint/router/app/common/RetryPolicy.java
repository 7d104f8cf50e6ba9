package complaint.router.app.common;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Bounded retry with a fixed, linear or exponential delay between attempts.
 * The cancellation signal is checked before every attempt and every wait.
 */
@Slf4j
public final class RetryPolicy {

    public enum Backoff {
        FIXED,
        LINEAR,
        EXPONENTIAL;

        public static Backoff parse(String value) {
            if (value == null || value.isBlank()) {
                return FIXED;
            }
            return Backoff.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final int maxAttempts;
    private final Duration delay;
    private final Backoff backoff;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, Duration delay, Backoff backoff) {
        this(maxAttempts, delay, backoff, Thread::sleep);
    }

    public RetryPolicy(int maxAttempts, Duration delay, Backoff backoff, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.delay = delay == null ? Duration.ZERO : delay;
        this.backoff = backoff == null ? Backoff.FIXED : backoff;
        this.sleeper = sleeper;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Delay before the attempt that follows the given one (1-based).
     */
    public long delayMs(int attempt) {
        long base = delay.toMillis();
        switch (backoff) {
            case LINEAR:
                return base * attempt;
            case EXPONENTIAL:
                return base * (1L << Math.min(attempt - 1, 20));
            default:
                return base;
        }
    }

    /**
     * Runs {@code action} until it succeeds, throws a non-retryable exception, or the attempts run out.
     * The last failure is rethrown as-is.
     *
     * @throws CancellationException if {@code cancelled} reports true or the thread is interrupted
     */
    public <T> T execute(String operation, Supplier<T> action,
                         Predicate<RuntimeException> retryable, BooleanSupplier cancelled) {
        RuntimeException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (cancelled.getAsBoolean()) {
                throw new CancellationException(operation + " cancelled before attempt " + attempt);
            }
            try {
                return action.get();
            } catch (RuntimeException e) {
                last = e;
                if (!retryable.test(e)) {
                    throw e;
                }
                if (attempt == maxAttempts) {
                    log.error("{} failed after {} attempts: {}", operation, maxAttempts, e.getMessage());
                    break;
                }
                long waitMs = delayMs(attempt);
                log.warn("{} failed (attempt {}/{}): {}. Retrying in {} ms",
                        operation, attempt, maxAttempts, e.getMessage(), waitMs);
                pause(operation, waitMs, cancelled);
            }
        }
        throw last;
    }

    private void pause(String operation, long waitMs, BooleanSupplier cancelled) {
        if (cancelled.getAsBoolean()) {
            throw new CancellationException(operation + " cancelled while waiting to retry");
        }
        if (waitMs <= 0) {
            return;
        }
        try {
            sleeper.sleep(waitMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException(operation + " interrupted while waiting to retry");
        }
    }
}
