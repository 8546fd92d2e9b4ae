package com.chanmux.shared.config;

import java.time.Duration;

/** Connection settings for the external protocol bridge. */
public record BridgeConfig(
    String url,
    Duration connectTimeout,
    Duration requestTimeout,
    Duration keepAliveInterval,
    Duration qrTimeout,
    String browserName,
    boolean markOnlineOnConnect,
    boolean syncFullHistory
) {
    public static BridgeConfig defaults() {
        return new BridgeConfig(
            "ws://localhost:8085/bridge",
            Duration.ofSeconds(60),
            Duration.ofSeconds(60),
            Duration.ofSeconds(25),
            Duration.ofSeconds(40),
            "ChanMux",
            false,
            false
        );
    }
}
