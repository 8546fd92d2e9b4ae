package com.chanmux.shared.error;

public class PairingEncodeException extends ChanMuxException {

    public PairingEncodeException(String channelId, Throwable cause) {
        super("PAIRING_ENCODE_FAILED", "Failed to encode pairing code for channel " + channelId, cause);
    }
}
