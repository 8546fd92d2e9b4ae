package com.chanmux.protocol;

public record RecipientCheck(boolean exists, String jid) {}
