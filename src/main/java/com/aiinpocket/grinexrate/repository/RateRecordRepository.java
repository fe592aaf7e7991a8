package com.aiinpocket.grinexrate.repository;

import com.aiinpocket.grinexrate.model.entity.RateRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface RateRecordRepository extends JpaRepository<RateRecord, Long> {

    Optional<RateRecord> findTopByTradingPairOrderByCreatedAtDesc(String tradingPair);

    /** BETWEEN 兩端皆包含 */
    List<RateRecord> findByTradingPairAndCreatedAtBetweenOrderByCreatedAtDesc(
            String tradingPair, Instant start, Instant end);
}
