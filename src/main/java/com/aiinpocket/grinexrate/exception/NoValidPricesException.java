package com.aiinpocket.grinexrate.exception;

/** 所有成交的價格欄位都無法解析。 */
public class NoValidPricesException extends RateServiceException {

    public NoValidPricesException(int tradeCount) {
        super("No valid prices found in " + tradeCount + " trades");
    }
}
