package com.chanmux.shared.error;

public class AlreadyWaitingException extends ChanMuxException {

    public AlreadyWaitingException(String channelId) {
        super("PAIRING_ALREADY_WAITING", "A pairing wait is already open for channel " + channelId);
    }
}
