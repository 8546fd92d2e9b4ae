package com.chanmux.shared.model;

public record PairingResult(
    String channelId,
    ChannelStatus status,
    String qrCode
) {

    public static PairingResult of(Channel channel) {
        return new PairingResult(channel.channelId(), channel.status(), channel.qrCode());
    }
}
