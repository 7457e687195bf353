package com.signalrelay.backend.exception;

public class MalformedSignalException extends GatewayException {
    public MalformedSignalException(String message) {
        super(message);
    }
}
