package com.aiinpocket.grinexrate.exception;

public class UpstreamDecodeException extends GrinexApiException {

    public UpstreamDecodeException(String message) {
        super(message);
    }

    public UpstreamDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
