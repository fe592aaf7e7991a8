package com.aiinpocket.grinexrate.model.dto;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 一批成交計算出的價格區間：ask 為最高價、bid 為最低價，
 * observedAt 為最新一筆成交的時間。
 */
public record PriceWindow(
        BigDecimal ask,
        BigDecimal bid,
        Instant observedAt
) {}
