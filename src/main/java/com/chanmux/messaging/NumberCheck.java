package com.chanmux.messaging;

public record NumberCheck(boolean exists, String jid) {}
