package com.chanmux.shared.model;

public record OutboundMessage(
    String to,
    String text
) {}
