package com.chanmux.shared.config;

import java.nio.file.Path;

public record ChanMuxConfig(
    int serverPort,
    Path dataDir,
    BridgeConfig bridge,
    LifecycleConfig lifecycle,
    MessagingConfig messaging
) {}
