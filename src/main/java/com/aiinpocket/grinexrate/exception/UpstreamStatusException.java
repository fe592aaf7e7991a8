package com.aiinpocket.grinexrate.exception;

/**
 * Grinex 回應非 200。保留狀態碼與原始 body 供診斷。
 */
public class UpstreamStatusException extends GrinexApiException {

    private final int statusCode;
    private final String body;

    public UpstreamStatusException(int statusCode, String body) {
        super("Grinex API request failed with status " + statusCode + ": " + body);
        this.statusCode = statusCode;
        this.body = body;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getBody() {
        return body;
    }
}
