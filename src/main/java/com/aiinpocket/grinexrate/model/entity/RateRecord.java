package com.aiinpocket.grinexrate.model.entity;

import com.aiinpocket.grinexrate.model.dto.RateQuote;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 已落庫的報價。寫入後不再修改，保留與清理由外部處理。
 */
@Entity
@Table(name = "rates", indexes = {
        @Index(name = "idx_rates_trading_pair_created_at", columnList = "trading_pair, created_at DESC"),
        @Index(name = "idx_rates_created_at", columnList = "created_at DESC")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class RateRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "trading_pair", nullable = false, length = 20)
    private String tradingPair;

    @Column(name = "ask_price", nullable = false, precision = 20, scale = 8)
    private BigDecimal askPrice;

    @Column(name = "bid_price", nullable = false, precision = 20, scale = 8)
    private BigDecimal bidPrice;

    /** 報價對應的最新成交時間 */
    @Column(name = "timestamp", nullable = false)
    private Instant timestamp;

    /** 落庫時間 */
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public RateQuote toQuote() {
        return new RateQuote(tradingPair, askPrice, bidPrice, timestamp);
    }
}
