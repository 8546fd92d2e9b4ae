package com.chanmux.shared.model;

public enum ChannelStatus {
    CREATED,
    CONNECTING,
    QRCODE,
    CONNECTED,
    RECONNECTING,
    LOGGED_OUT,
    FAILED,
    RESTORING;

    /** Terminal states are only left through an explicit create or regenerate. */
    public boolean isTerminal() {
        return this == LOGGED_OUT || this == FAILED;
    }
}
