package com.aiinpocket.grinexrate.service;

import com.aiinpocket.grinexrate.exception.EmptyTradesException;
import com.aiinpocket.grinexrate.exception.NoValidPricesException;
import com.aiinpocket.grinexrate.model.dto.GrinexTrade;
import com.aiinpocket.grinexrate.model.dto.PriceWindow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 從一批最近成交計算 ask / bid。
 *
 * <p>ask 為可解析價格中的最高價、bid 為最低價，與成交順序無關，因此 ask &ge; bid 恆成立；
 * 只有一筆有效價格時 ask == bid。無法解析的價格略過並記錄 warn。
 *
 * <p>報價時間取 created_at 最新的一筆（不假設上游已由新到舊排列）；
 * 全部時間都無法解析時以目前時間代替。
 */
@Component
@Slf4j
public class TradePriceExtractor {

    public PriceWindow extract(List<GrinexTrade> trades) {
        if (trades == null || trades.isEmpty()) {
            throw new EmptyTradesException();
        }

        List<BigDecimal> prices = new ArrayList<>();
        for (GrinexTrade trade : trades) {
            BigDecimal price = parsePrice(trade.price());
            if (price != null) {
                prices.add(price);
            }
        }

        if (prices.isEmpty()) {
            throw new NoValidPricesException(trades.size());
        }

        BigDecimal ask = Collections.max(prices);
        BigDecimal bid = Collections.min(prices);
        return new PriceWindow(ask, bid, latestTradeTime(trades));
    }

    private BigDecimal parsePrice(String raw) {
        if (raw == null || raw.isBlank()) {
            log.warn("[Grinex] 成交價格為空，略過");
            return null;
        }
        try {
            return new BigDecimal(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("[Grinex] 無法解析成交價格: {}", raw);
            return null;
        }
    }

    private Instant latestTradeTime(List<GrinexTrade> trades) {
        Instant latest = null;
        for (GrinexTrade trade : trades) {
            Instant createdAt = parseTime(trade.createdAt());
            if (createdAt != null && (latest == null || createdAt.isAfter(latest))) {
                latest = createdAt;
            }
        }
        if (latest == null) {
            log.warn("[Grinex] 所有成交時間皆無法解析，改用目前時間");
            return Instant.now();
        }
        return latest;
    }

    private Instant parseTime(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return OffsetDateTime.parse(raw.trim()).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("[Grinex] 無法解析成交時間: {}", raw);
            return null;
        }
    }
}
