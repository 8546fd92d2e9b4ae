package com.chanmux.protocol;

@FunctionalInterface
public interface ConnectionListener {
    void onEvent(ConnectionEvent event);
}
