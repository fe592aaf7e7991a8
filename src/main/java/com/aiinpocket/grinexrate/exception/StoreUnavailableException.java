package com.aiinpocket.grinexrate.exception;

/** 資料庫連線探測失敗。 */
public class StoreUnavailableException extends RateServiceException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
