package com.chanmux.shared.config;

import java.time.Duration;

public record LifecycleConfig(
    Duration pairingTimeout,
    Duration settleDelay,
    int maxReconnectAttempts,
    Duration reconnectBaseDelay,
    Duration reconnectMaxDelay
) {
    public static LifecycleConfig defaults() {
        return new LifecycleConfig(
            Duration.ofSeconds(15),
            Duration.ofSeconds(1),
            5,
            Duration.ofSeconds(3),
            Duration.ofSeconds(60)
        );
    }
}
