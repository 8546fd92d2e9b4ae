package com.chanmux.shared.error;

public class ChannelNotConnectedException extends ChanMuxException {

    public ChannelNotConnectedException(String channelId) {
        super("CHANNEL_NOT_CONNECTED", "Channel is not connected: " + channelId);
    }

    public ChannelNotConnectedException(String channelId, Throwable cause) {
        super("CHANNEL_NOT_CONNECTED", "Channel is not connected: " + channelId, cause);
    }
}
