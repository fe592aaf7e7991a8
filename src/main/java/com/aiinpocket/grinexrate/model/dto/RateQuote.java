package com.aiinpocket.grinexrate.model.dto;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 對外回傳的報價。
 *
 * @param tradingPair 交易對（如 USDT/RUB）
 * @param askPrice    成交窗口內最高價
 * @param bidPrice    成交窗口內最低價
 * @param timestamp   最新成交時間
 */
public record RateQuote(
        String tradingPair,
        BigDecimal askPrice,
        BigDecimal bidPrice,
        Instant timestamp
) {}
