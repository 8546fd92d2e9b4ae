package com.chanmux.shared.error;

/**
 * Base of all domain failures. {@link #code()} is the stable identifier reported to API clients.
 */
public class ChanMuxException extends RuntimeException {

    private final String code;

    public ChanMuxException(String code, String message) {
        super(message);
        this.code = code;
    }

    public ChanMuxException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
