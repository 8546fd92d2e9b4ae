package com.chanmux.auth;

import com.chanmux.shared.error.AlreadyWaitingException;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One-shot "wait for the first QR code" handshakes, at most one per channel.
 * A wait is torn down by closing it; closing only ever removes that same wait.
 */
public class PairingCoordinator {

    private final Map<String, PairingWait> waits = new ConcurrentHashMap<>();

    public PairingWait beginWait(String channelId) {
        var wait = new PairingWait(channelId, this);
        if (waits.putIfAbsent(channelId, wait) != null) {
            throw new AlreadyWaitingException(channelId);
        }
        return wait;
    }

    /** Completes the pending wait, if any. Returns true if a waiter was released. */
    public boolean resolve(String channelId) {
        var wait = waits.get(channelId);
        return wait != null && wait.complete();
    }

    public boolean reject(String channelId, Throwable cause) {
        var wait = waits.get(channelId);
        return wait != null && wait.fail(cause);
    }

    public boolean isWaiting(String channelId) {
        return waits.containsKey(channelId);
    }

    void release(PairingWait wait) {
        waits.remove(wait.channelId(), wait);
    }
}
