package com.chanmux.shared.error;

public class ChannelAlreadyExistsException extends ChanMuxException {

    public ChannelAlreadyExistsException(String channelId) {
        super("CHANNEL_ALREADY_EXISTS", "Channel already exists: " + channelId);
    }
}
