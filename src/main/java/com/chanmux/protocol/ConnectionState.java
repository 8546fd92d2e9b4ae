package com.chanmux.protocol;

public enum ConnectionState {
    CONNECTING,
    OPEN,
    CLOSE
}
