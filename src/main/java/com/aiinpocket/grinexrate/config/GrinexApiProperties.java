package com.aiinpocket.grinexrate.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Grinex 交易所 API 設定。
 *
 * @param baseUrl     API 根網址（如 https://grinex.io）
 * @param tradesPath  最近成交查詢路徑
 * @param marketsPath 市場列表路徑（僅用於健康檢查）
 * @param tradingPair 交易對（如 USDT/RUB），去掉斜線轉小寫即為 Grinex 市場代號
 * @param tradeLimit  每次抓取的成交筆數
 * @param timeout     連線與讀取逾時
 * @param userAgent   送出請求時的 User-Agent
 */
@ConfigurationProperties(prefix = "grinex.api")
public record GrinexApiProperties(
        String baseUrl,
        String tradesPath,
        String marketsPath,
        String tradingPair,
        int tradeLimit,
        Duration timeout,
        String userAgent
) {}
