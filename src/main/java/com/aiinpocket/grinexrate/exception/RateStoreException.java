package com.aiinpocket.grinexrate.exception;

public class RateStoreException extends RateServiceException {

    public RateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
