package com.eventfullyengineered.jstreamwake.delivery;

import com.google.common.base.Preconditions;

import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Backoff between webhook delivery attempts. Retries 1 to 10 wait {@code min(2^n * 100ms, 30s)} plus up to 1s of
 * jitter, later retries wait 60s plus up to 5s of jitter.
 */
public class RetryPolicy {

    public static final int BACKOFF_RETRIES = 10;
    public static final long MAX_BACKOFF_MILLIS = 30_000L;
    public static final long STEADY_DELAY_MILLIS = 60_000L;
    public static final long BACKOFF_JITTER_MILLIS = 1_000L;
    public static final long STEADY_JITTER_MILLIS = 5_000L;

    private final Supplier<Random> random;

    public RetryPolicy() {
        this(ThreadLocalRandom::current);
    }

    public RetryPolicy(Supplier<Random> random) {
        this.random = Preconditions.checkNotNull(random, "random");
    }

    /**
     * @param retry 1 for the first retry
     * @return the delay in millis before that retry
     */
    public long delayMillis(int retry) {
        Preconditions.checkArgument(retry > 0, "retry must be positive");
        if (retry > BACKOFF_RETRIES) {
            return STEADY_DELAY_MILLIS + jitter(STEADY_JITTER_MILLIS);
        }
        long base = Math.min((1L << retry) * 100L, MAX_BACKOFF_MILLIS);
        return base + jitter(BACKOFF_JITTER_MILLIS);
    }

    private long jitter(long bound) {
        return (long) (random.get().nextDouble() * bound);
    }
}
