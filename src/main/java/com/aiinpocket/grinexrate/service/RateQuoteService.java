package com.aiinpocket.grinexrate.service;

import com.aiinpocket.grinexrate.config.GrinexApiProperties;
import com.aiinpocket.grinexrate.exception.GrinexApiException;
import com.aiinpocket.grinexrate.exception.ServiceUnhealthyException;
import com.aiinpocket.grinexrate.exception.StoreUnavailableException;
import com.aiinpocket.grinexrate.metrics.RateMetrics;
import com.aiinpocket.grinexrate.model.dto.HealthReport;
import com.aiinpocket.grinexrate.model.dto.RateQuote;
import com.aiinpocket.grinexrate.model.entity.RateRecord;
import com.aiinpocket.grinexrate.model.enums.HealthStatus;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * 報價與健康檢查的編排服務。
 *
 * <p>取得報價：Grinex 抓取 → 計算 → 落庫 → 回傳。任何一步失敗整個請求失敗，
 * 未成功落庫的報價不會回傳給呼叫端。
 *
 * <p>健康檢查每次即時計算，不快取：
 * <ul>
 *   <li>資料庫探測失敗 → unhealthy，並拋出 {@link ServiceUnhealthyException}（Grinex 不再檢查）</li>
 *   <li>資料庫正常、Grinex 探測失敗 → degraded，正常回傳</li>
 *   <li>兩者皆正常 → healthy</li>
 * </ul>
 *
 * <p>兩個操作的耗時與結果皆記錄於 {@link RateMetrics}。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RateQuoteService {

    private final GrinexApiService grinexApiService;
    private final RateStoreService rateStoreService;
    private final GrinexApiProperties props;
    private final RateMetrics rateMetrics;

    public RateQuote getQuote() {
        Timer.Sample sample = rateMetrics.start();
        try {
            RateQuote quote = grinexApiService.fetchQuote(props.tradingPair());
            RateRecord saved = rateStoreService.save(quote, Instant.now());
            rateMetrics.recordQuote(sample, "success");
            return saved.toQuote();
        } catch (RuntimeException e) {
            rateMetrics.recordQuote(sample, e.getClass().getSimpleName());
            throw e;
        }
    }

    public RateRecord latestRate() {
        return rateStoreService.latest(props.tradingPair());
    }

    public List<RateRecord> rateHistory(Instant start, Instant end) {
        return rateStoreService.range(props.tradingPair(), start, end);
    }

    public HealthReport checkHealth() {
        Timer.Sample sample = rateMetrics.start();
        try {
            rateStoreService.probeAlive();
        } catch (StoreUnavailableException e) {
            log.error("[健康檢查] 資料庫探測失敗: {}", e.getMessage());
            rateMetrics.recordHealth(sample, HealthStatus.UNHEALTHY);
            throw new ServiceUnhealthyException(HealthReport.unhealthy(e.getMessage()), e);
        }

        HealthReport report;
        try {
            grinexApiService.probeReachable();
            report = HealthReport.healthy();
        } catch (GrinexApiException e) {
            log.warn("[健康檢查] Grinex API 探測失敗: {}", e.getMessage());
            report = HealthReport.degraded("Grinex API health check failed: " + e.getMessage());
        }
        rateMetrics.recordHealth(sample, report.status());
        return report;
    }
}
