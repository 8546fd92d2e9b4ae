package com.chanmux.shared.config;

import java.time.Duration;

public record MessagingConfig(
    Duration minDelay,
    String defaultCountryCode
) {
    public static MessagingConfig defaults() {
        return new MessagingConfig(Duration.ofMillis(1000), "55");
    }
}
