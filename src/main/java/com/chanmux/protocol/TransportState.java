package com.chanmux.protocol;

public enum TransportState {
    CONNECTING,
    OPEN,
    CLOSING,
    CLOSED
}
