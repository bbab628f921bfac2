package io.hookcron.utils;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Exponential backoff with jitter: {@code 2^attempt * base + uniform[0, base)}.
 */
public final class RetryBackoff {

    // 2^20 * base is already days for a 1s base; higher exponents would overflow.
    static final int MAX_EXPONENT = 20;

    private final Duration base;
    private final Supplier<Random> random;

    public RetryBackoff(Duration base) {
        this(base, ThreadLocalRandom::current);
    }

    public RetryBackoff(Duration base, Supplier<Random> random) {
        this.base = Objects.requireNonNull(base, "base must not be null");
        this.random = Objects.requireNonNull(random, "random must not be null");
        if (base.isNegative() || base.isZero()) {
            throw new IllegalArgumentException("base must be a positive duration");
        }
    }

    /**
     * Delay before the retry that follows attempt number {@code attempt}.
     */
    public Duration delayFor(int attempt) {
        int exp = Math.max(0, Math.min(attempt, MAX_EXPONENT));
        long baseMs = Math.max(1, base.toMillis());
        long backoff = baseMs * (1L << exp);
        long jitter = (long) Math.floor(random.get().nextDouble() * baseMs);
        return Duration.ofMillis(backoff + jitter);
    }

    public Duration base() {
        return base;
    }
}
