package com.aiinpocket.grinexrate.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Grinex /api/v2/trades 回應中的單筆成交。
 * 價格、數量皆為字串，由 {@code TradePriceExtractor} 自行解析。
 *
 * @param id        上游成交編號，未使用，缺值時為 null
 * @param createdAt RFC3339 格式的成交時間（如 2025-07-28T21:22:14+03:00）
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GrinexTrade(
        Long id,
        String hid,
        String price,
        String volume,
        String funds,
        String market,
        @JsonProperty("created_at") String createdAt
) {}
