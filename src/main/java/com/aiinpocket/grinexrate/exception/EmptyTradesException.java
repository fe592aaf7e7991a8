package com.aiinpocket.grinexrate.exception;

/** 成交清單為空，無法計算報價。 */
public class EmptyTradesException extends RateServiceException {

    public EmptyTradesException() {
        super("No trades data available");
    }
}
