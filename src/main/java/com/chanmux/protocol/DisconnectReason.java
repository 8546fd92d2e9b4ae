package com.chanmux.protocol;

/** Why the transport closed, by the status codes the protocol reports. */
public enum DisconnectReason {
    CONNECTION_CLOSED(428),
    CONNECTION_LOST(408),
    CONNECTION_REPLACED(440),
    LOGGED_OUT(401),
    BAD_SESSION(500),
    RESTART_REQUIRED(515),
    MULTIDEVICE_MISMATCH(411),
    FORBIDDEN(403),
    UNAVAILABLE_SERVICE(503),
    UNKNOWN(-1);

    private final int code;

    DisconnectReason(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public boolean isLoggedOut() {
        return this == LOGGED_OUT;
    }

    public static DisconnectReason fromCode(int code) {
        for (var reason : values()) {
            if (reason.code == code) return reason;
        }
        return UNKNOWN;
    }
}
