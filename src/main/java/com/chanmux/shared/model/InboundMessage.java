package com.chanmux.shared.model;

import java.time.Instant;

public record InboundMessage(
    String channelId,
    String from,
    String text,
    boolean fromMe,
    Instant timestamp
) {}
