package com.chanmux.auth;

public class QrEncodingException extends Exception {

    public QrEncodingException(String message) {
        super(message);
    }

    public QrEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
