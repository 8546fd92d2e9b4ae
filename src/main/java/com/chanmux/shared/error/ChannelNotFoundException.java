package com.chanmux.shared.error;

public class ChannelNotFoundException extends ChanMuxException {

    public ChannelNotFoundException(String channelId) {
        super("CHANNEL_NOT_FOUND", "Channel not found: " + channelId);
    }
}
