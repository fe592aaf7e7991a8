package com.aiinpocket.grinexrate.exception;

public class UpstreamTransportException extends GrinexApiException {

    public UpstreamTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
