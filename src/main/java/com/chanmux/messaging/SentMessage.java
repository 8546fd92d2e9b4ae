package com.chanmux.messaging;

public record SentMessage(String messageId, String to, String message) {}
