package com.chanmux.protocol;

import com.chanmux.shared.config.LifecycleConfig;

/**
 * Decides what to do after a connection closed: reconnect with exponential backoff,
 * stop because the account logged out, or give up once the attempt budget is spent.
 */
public class ReconnectPolicy {

    private static final int MAX_ATTEMPTS = 5;
    private static final long BASE_DELAY_MS = 3_000;
    private static final long MAX_DELAY_MS = 60_000;

    private final int maxAttempts;
    private final long baseDelayMs;
    private final long maxDelayMs;

    public ReconnectPolicy() {
        this(MAX_ATTEMPTS, BASE_DELAY_MS, MAX_DELAY_MS);
    }

    public ReconnectPolicy(int maxAttempts, long baseDelayMs, long maxDelayMs) {
        if (maxAttempts < 0) throw new IllegalArgumentException("maxAttempts must be >= 0");
        this.maxAttempts = maxAttempts;
        this.baseDelayMs = Math.max(baseDelayMs, 0);
        this.maxDelayMs = Math.max(maxDelayMs, this.baseDelayMs);
    }

    public static ReconnectPolicy from(LifecycleConfig config) {
        return new ReconnectPolicy(
            config.maxReconnectAttempts(),
            config.reconnectBaseDelay().toMillis(),
            config.reconnectMaxDelay().toMillis());
    }

    /**
     * @param cause           why the connection closed
     * @param currentAttempts reconnects already made since the last successful open
     */
    public ReconnectDecision decide(DisconnectReason cause, int currentAttempts) {
        if (cause != null && cause.isLoggedOut()) {
            return ReconnectDecision.loggedOut();
        }
        int attempt = currentAttempts + 1;
        if (attempt > maxAttempts) {
            return ReconnectDecision.giveUp();
        }
        return ReconnectDecision.reconnect(attempt, delayFor(attempt));
    }

    /** {@code min(base * 2^(attempt-1), max)}; attempt counts from 1. */
    public long delayFor(int attempt) {
        if (attempt < 1) throw new IllegalArgumentException("attempt must be >= 1");
        long delay = baseDelayMs;
        for (int i = 1; i < attempt && delay < maxDelayMs; i++) {
            delay *= 2;
        }
        return Math.min(delay, maxDelayMs);
    }

    public int maxAttempts() {
        return maxAttempts;
    }
}
