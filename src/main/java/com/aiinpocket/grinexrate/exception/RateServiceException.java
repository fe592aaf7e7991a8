package com.aiinpocket.grinexrate.exception;

/**
 * 匯率服務所有業務錯誤的共同父類別（unchecked）。
 * 由 {@code GlobalExceptionHandler} 統一轉換為 HTTP 錯誤回應。
 */
public abstract class RateServiceException extends RuntimeException {

    protected RateServiceException(String message) {
        super(message);
    }

    protected RateServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
