package com.chanmux.protocol;

import com.chanmux.shared.config.BridgeConfig;

import java.time.Duration;

public record ClientOptions(
    String browserName,
    boolean markOnlineOnConnect,
    boolean syncFullHistory,
    Duration connectTimeout,
    Duration keepAliveInterval,
    Duration qrTimeout
) {
    public static ClientOptions from(BridgeConfig config) {
        return new ClientOptions(
            config.browserName(),
            config.markOnlineOnConnect(),
            config.syncFullHistory(),
            config.connectTimeout(),
            config.keepAliveInterval(),
            config.qrTimeout()
        );
    }
}
