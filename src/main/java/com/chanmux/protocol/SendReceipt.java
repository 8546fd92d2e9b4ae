package com.chanmux.protocol;

public record SendReceipt(String messageId, String remoteJid) {}
