package com.chanmux.shared.model;

import java.time.Instant;

/**
 * Partial update of a {@link Channel}. A null field means "keep the current value";
 * {@code clearQrCode} is the only way to drop a stored QR image.
 */
public record ChannelUpdate(
    ChannelStatus status,
    String qrCode,
    boolean clearQrCode,
    Instant lastSeen,
    Integer reconnectAttempts
) {

    public static ChannelUpdate status(ChannelStatus status, Instant now) {
        return new ChannelUpdate(status, null, false, now, null);
    }

    public ChannelUpdate withQrCode(String qrCode) {
        return new ChannelUpdate(status, qrCode, false, lastSeen, reconnectAttempts);
    }

    public ChannelUpdate withoutQrCode() {
        return new ChannelUpdate(status, null, true, lastSeen, reconnectAttempts);
    }

    public ChannelUpdate withReconnectAttempts(int attempts) {
        return new ChannelUpdate(status, qrCode, clearQrCode, lastSeen, attempts);
    }
}
