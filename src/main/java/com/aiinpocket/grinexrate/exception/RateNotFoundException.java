package com.aiinpocket.grinexrate.exception;

public class RateNotFoundException extends RateServiceException {

    private final String tradingPair;

    public RateNotFoundException(String tradingPair) {
        super("No rate found for trading pair: " + tradingPair);
        this.tradingPair = tradingPair;
    }

    public String getTradingPair() {
        return tradingPair;
    }
}
