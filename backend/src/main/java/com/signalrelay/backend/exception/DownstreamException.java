package com.signalrelay.backend.exception;

import lombok.Getter;

/**
 * A call to an upstream or downstream HTTP service failed. {@code statusCode} is the HTTP status when
 * one was received, otherwise 500.
 */
@Getter
public class DownstreamException extends GatewayException {

    private final String target;
    private final int statusCode;

    public DownstreamException(String target, int statusCode, String message) {
        super(message);
        this.target = target;
        this.statusCode = statusCode;
    }

    public DownstreamException(String target, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.target = target;
        this.statusCode = statusCode;
    }
}
