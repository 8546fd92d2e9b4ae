package com.chanmux.auth;

public interface QrEncoder {

    /** Encodes a raw pairing payload into an image the user can scan. */
    String encode(String payload) throws QrEncodingException;
}
