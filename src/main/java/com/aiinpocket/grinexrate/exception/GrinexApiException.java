package com.aiinpocket.grinexrate.exception;

/** Grinex 上游呼叫失敗（網路、狀態碼、回應格式）。 */
public abstract class GrinexApiException extends RateServiceException {

    protected GrinexApiException(String message) {
        super(message);
    }

    protected GrinexApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
