package com.hting007.logiq.io;

import com.hting007.logiq.config.DetectorConfig;
import lombok.extern.log4j.Log4j2;

/**
 * Bounded retry with a fixed backoff for calls across the I/O boundary. Only
 * {@link TransientIoException} is retried; anything else propagates at once.
 */
@Log4j2
public class RetryPolicy {

    @FunctionalInterface
    public interface IoCall<T> {
        T call() throws TransientIoException;
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final int maxAttempts;
    private final long backoffMillis;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, long backoffMillis) {
        this(maxAttempts, backoffMillis, Thread::sleep);
    }

    public RetryPolicy(int maxAttempts, long backoffMillis, Sleeper sleeper) {
        if (maxAttempts <= 0) throw new IllegalArgumentException("maxAttempts must be > 0");
        if (backoffMillis < 0) throw new IllegalArgumentException("backoffMillis must be >= 0");
        this.maxAttempts = maxAttempts;
        this.backoffMillis = backoffMillis;
        this.sleeper = sleeper;
    }

    public static RetryPolicy from(DetectorConfig config) {
        return new RetryPolicy(config.getRetryMaxAttempts(), config.getRetryBackoffMillis());
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * @param operation short name used in log lines
     * @throws TransientIoException the last failure once every attempt failed, or when
     *                              interrupted while backing off
     */
    public <T> T execute(String operation, IoCall<T> call) throws TransientIoException {
        TransientIoException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return call.call();
            } catch (TransientIoException e) {
                last = e;
                log.warn("{} failed (attempt {}/{}): {}", operation, attempt, maxAttempts, e.getMessage());
            }
            if (attempt < maxAttempts) {
                try {
                    sleeper.sleep(backoffMillis);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new TransientIoException(operation + " interrupted during backoff", ie);
                }
            }
        }
        throw last;
    }
}
