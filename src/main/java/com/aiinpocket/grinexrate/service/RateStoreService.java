package com.aiinpocket.grinexrate.service;

import com.aiinpocket.grinexrate.exception.RateNotFoundException;
import com.aiinpocket.grinexrate.exception.RateStoreException;
import com.aiinpocket.grinexrate.exception.StoreUnavailableException;
import com.aiinpocket.grinexrate.model.dto.RateQuote;
import com.aiinpocket.grinexrate.model.entity.RateRecord;
import com.aiinpocket.grinexrate.repository.RateRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * 報價儲存服務。
 * 寫入與查詢走 JPA Repository；連線探測直接透過 JdbcTemplate 取得連線驗證，不依賴任何資料表。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RateStoreService {

    /** 連線探測逾時（秒） */
    static final int PROBE_TIMEOUT_SECONDS = 5;

    private final RateRecordRepository rateRecordRepository;
    private final JdbcTemplate jdbcTemplate;

    @Transactional
    public RateRecord save(RateQuote quote, Instant persistedAt) {
        RateRecord record = RateRecord.builder()
                .tradingPair(quote.tradingPair())
                .askPrice(quote.askPrice())
                .bidPrice(quote.bidPrice())
                .timestamp(quote.timestamp())
                .createdAt(persistedAt)
                .build();
        try {
            RateRecord saved = rateRecordRepository.save(record);
            log.info("[儲存] 報價已寫入 id={} pair={} ask={} bid={}",
                    saved.getId(), saved.getTradingPair(), saved.getAskPrice(), saved.getBidPrice());
            return saved;
        } catch (DataAccessException e) {
            throw new RateStoreException("Failed to save rate for " + quote.tradingPair(), e);
        }
    }

    @Transactional(readOnly = true)
    public RateRecord latest(String tradingPair) {
        try {
            return rateRecordRepository.findTopByTradingPairOrderByCreatedAtDesc(tradingPair)
                    .orElseThrow(() -> new RateNotFoundException(tradingPair));
        } catch (DataAccessException e) {
            throw new RateStoreException("Failed to get latest rate for " + tradingPair, e);
        }
    }

    /**
     * 查詢時間區間內的報價（依落庫時間由新到舊）。
     *
     * @param start 起點（含）
     * @param end   終點（含）
     * @return 無資料時回傳空清單
     */
    @Transactional(readOnly = true)
    public List<RateRecord> range(String tradingPair, Instant start, Instant end) {
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("start must not be after end");
        }
        try {
            return rateRecordRepository.findByTradingPairAndCreatedAtBetweenOrderByCreatedAtDesc(
                    tradingPair, start, end);
        } catch (DataAccessException e) {
            throw new RateStoreException("Failed to query rates for " + tradingPair, e);
        }
    }

    public void probeAlive() {
        Boolean valid;
        try {
            valid = jdbcTemplate.execute(
                    (ConnectionCallback<Boolean>) connection -> connection.isValid(PROBE_TIMEOUT_SECONDS));
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Database health check failed: " + e.getMessage(), e);
        }
        if (!Boolean.TRUE.equals(valid)) {
            throw new StoreUnavailableException(
                    "Database health check failed: connection not valid within " + PROBE_TIMEOUT_SECONDS + "s");
        }
    }
}
