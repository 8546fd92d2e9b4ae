package com.chanmux.gateway.http;

import com.chanmux.shared.error.ChanMuxException;
import org.springframework.http.HttpStatus;

/** A request rejected by the HTTP layer itself, before reaching the lifecycle core. */
public class ApiException extends ChanMuxException {

    private final HttpStatus status;

    public ApiException(HttpStatus status, String code, String message) {
        super(code, message);
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
