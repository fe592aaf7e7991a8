package com.aiinpocket.grinexrate.service;

import com.aiinpocket.grinexrate.config.GrinexApiProperties;
import com.aiinpocket.grinexrate.exception.UpstreamDecodeException;
import com.aiinpocket.grinexrate.exception.UpstreamStatusException;
import com.aiinpocket.grinexrate.exception.UpstreamTransportException;
import com.aiinpocket.grinexrate.model.dto.GrinexTrade;
import com.aiinpocket.grinexrate.model.dto.PriceWindow;
import com.aiinpocket.grinexrate.model.dto.RateQuote;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Service;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

/**
 * Grinex REST API 客戶端。
 *
 * <p>{@link #fetchQuote(String)} 抓取最近 N 筆成交並交給 {@link TradePriceExtractor} 計算報價；
 * {@link #probeReachable()} 只確認市場列表端點回應 200，供健康檢查使用。
 * 兩者都不重試，錯誤原樣往上拋。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GrinexApiService {

    private final RestClient grinexRestClient;
    private final GrinexApiProperties props;
    private final TradePriceExtractor priceExtractor;
    private final ObjectMapper objectMapper;

    public RateQuote fetchQuote(String tradingPair) {
        String json = fetchTrades(toMarketId(tradingPair));

        List<GrinexTrade> trades = parseTrades(json);
        PriceWindow window = priceExtractor.extract(trades);

        RateQuote quote = new RateQuote(tradingPair, window.ask(), window.bid(), window.observedAt());
        log.info("[Grinex] 取得 {} 報價 ask={} bid={} timestamp={} (trades={})",
                tradingPair, quote.askPrice(), quote.bidPrice(), quote.timestamp(), trades.size());
        return quote;
    }

    public void probeReachable() {
        try {
            grinexRestClient.get()
                    .uri(props.marketsPath())
                    .retrieve()
                    .onStatus(status -> status.value() != HttpStatus.OK.value(), GrinexApiService::rejectStatus)
                    .toBodilessEntity();
        } catch (ResourceAccessException e) {
            throw new UpstreamTransportException("Grinex health check request failed: " + e.getMessage(), e);
        }
    }

    /** USDT/RUB → usdtrub */
    static String toMarketId(String tradingPair) {
        return tradingPair.replace("/", "").toLowerCase(Locale.ROOT);
    }

    private String fetchTrades(String market) {
        log.debug("[Grinex] 查詢最近成交 market={} limit={}", market, props.tradeLimit());
        try {
            return grinexRestClient.get()
                    .uri(uriBuilder -> uriBuilder
                            .path(props.tradesPath())
                            .queryParam("market", market)
                            .queryParam("limit", props.tradeLimit())
                            .build())
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .onStatus(status -> status.value() != HttpStatus.OK.value(), GrinexApiService::rejectStatus)
                    .body(String.class);
        } catch (ResourceAccessException e) {
            throw new UpstreamTransportException("Failed to make request to Grinex: " + e.getMessage(), e);
        }
    }

    /** 只有 200 視為成功，其餘狀態碼連同 body 一起拋出 */
    private static void rejectStatus(HttpRequest request, ClientHttpResponse response) throws IOException {
        throw new UpstreamStatusException(response.getStatusCode().value(),
                StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8));
    }

    private List<GrinexTrade> parseTrades(String json) {
        if (json == null || json.isBlank()) {
            throw new UpstreamDecodeException("Grinex returned an empty response body");
        }
        try {
            List<GrinexTrade> trades = objectMapper.readValue(json, new TypeReference<List<GrinexTrade>>() {});
            if (trades == null) {
                throw new UpstreamDecodeException("Grinex returned null instead of a trade array");
            }
            if (trades.contains(null)) {
                throw new UpstreamDecodeException("Grinex trade array contains a null element");
            }
            return trades;
        } catch (JacksonException e) {
            throw new UpstreamDecodeException("Failed to unmarshal Grinex trades: " + e.getMessage(), e);
        }
    }
}
