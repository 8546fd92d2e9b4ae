package com.chanmux.shared.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

public record Channel(
    String channelId,
    ChannelStatus status,
    String qrCode,
    Instant lastSeen,
    int reconnectAttempts
) {

    public static Channel created(String channelId, Instant now) {
        return new Channel(channelId, ChannelStatus.CREATED, null, now, 0);
    }

    public static Channel restoring(String channelId, Instant now) {
        return new Channel(channelId, ChannelStatus.RESTORING, null, now, 0);
    }

    /** Fields left null in the update keep their current value. */
    public Channel merge(ChannelUpdate update) {
        return new Channel(
            channelId,
            update.status() != null ? update.status() : status,
            update.clearQrCode() ? null : (update.qrCode() != null ? update.qrCode() : qrCode),
            update.lastSeen() != null ? update.lastSeen() : lastSeen,
            update.reconnectAttempts() != null ? update.reconnectAttempts() : reconnectAttempts
        );
    }

    @JsonIgnore
    public boolean isConnected() {
        return status == ChannelStatus.CONNECTED;
    }
}
