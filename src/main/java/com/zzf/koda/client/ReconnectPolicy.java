package com.zzf.koda.client;

/**
 * Bounded exponential backoff: attempt {@code n} (1-based) waits {@code base * 2^(n-1)} ms,
 * capped at {@code maxDelayMs}; no attempt beyond {@code maxAttempts}.
 */
public final class ReconnectPolicy {

    private final int maxAttempts;
    private final long baseDelayMs;
    private final long maxDelayMs;

    public ReconnectPolicy(int maxAttempts, long baseDelayMs, long maxDelayMs) {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must not be negative");
        }
        if (baseDelayMs <= 0 || maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("delays must satisfy 0 < baseDelayMs <= maxDelayMs");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
    }

    public static ReconnectPolicy defaults() {
        return new ReconnectPolicy(5, 500L, 10_000L);
    }

    public boolean allows(int attempt) {
        return attempt >= 1 && attempt <= maxAttempts;
    }

    public long delayForAttempt(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt is 1-based");
        }
        int shift = Math.min(attempt - 1, 30);
        long delay = baseDelayMs << shift;
        if (delay <= 0 || delay > maxDelayMs) {
            return maxDelayMs;
        }
        return delay;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }
}
