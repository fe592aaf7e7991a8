package com.aiinpocket.grinexrate.service;

import com.aiinpocket.grinexrate.config.GrinexApiProperties;
import com.aiinpocket.grinexrate.exception.RateStoreException;
import com.aiinpocket.grinexrate.exception.ServiceUnhealthyException;
import com.aiinpocket.grinexrate.exception.StoreUnavailableException;
import com.aiinpocket.grinexrate.exception.UpstreamStatusException;
import com.aiinpocket.grinexrate.exception.UpstreamTransportException;
import com.aiinpocket.grinexrate.metrics.RateMetrics;
import com.aiinpocket.grinexrate.model.dto.HealthReport;
import com.aiinpocket.grinexrate.model.dto.RateQuote;
import com.aiinpocket.grinexrate.model.entity.RateRecord;
import com.aiinpocket.grinexrate.model.enums.HealthStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RateQuoteServiceTest {

    private static final String PAIR = "USDT/RUB";

    @Mock
    private GrinexApiService grinexApiService;

    @Mock
    private RateStoreService rateStoreService;

    private SimpleMeterRegistry meterRegistry;
    private RateQuoteService service;

    private final RateQuote quote = new RateQuote(PAIR, new BigDecimal("81.30"), new BigDecimal("81.20"),
            Instant.parse("2025-07-28T18:22:14Z"));

    @BeforeEach
    void setUp() {
        GrinexApiProperties props = new GrinexApiProperties(
                "https://grinex.test", "/api/v2/trades", "/api/v2/markets",
                PAIR, 100, Duration.ofSeconds(5), "GrinexRateService/test");
        meterRegistry = new SimpleMeterRegistry();
        service = new RateQuoteService(grinexApiService, rateStoreService, props, new RateMetrics(meterRegistry));
    }

    @Nested
    @DisplayName("getQuote()")
    class GetQuote {

        @Test
        @DisplayName("抓取成功並落庫 → 回傳報價")
        void fetchAndPersist() {
            Instant before = Instant.now();
            when(grinexApiService.fetchQuote(PAIR)).thenReturn(quote);
            when(rateStoreService.save(eq(quote), any(Instant.class))).thenAnswer(invocation -> {
                RateQuote q = invocation.getArgument(0);
                Instant persistedAt = invocation.getArgument(1);
                assertThat(persistedAt).isAfterOrEqualTo(before);
                return RateRecord.builder().id(1L).tradingPair(q.tradingPair())
                        .askPrice(q.askPrice()).bidPrice(q.bidPrice())
                        .timestamp(q.timestamp()).createdAt(persistedAt).build();
            });

            assertThat(service.getQuote()).isEqualTo(quote);
            assertThat(meterRegistry.get("grinex.rate.quote").tag("outcome", "success").timer().count())
                    .isEqualTo(1);
        }

        @Test
        @DisplayName("落庫失敗 → 不回傳報價")
        void persistenceFailureAborts() {
            when(grinexApiService.fetchQuote(PAIR)).thenReturn(quote);
            when(rateStoreService.save(eq(quote), any(Instant.class)))
                    .thenThrow(new RateStoreException("Failed to save rate for " + PAIR, new RuntimeException("disk full")));

            assertThatThrownBy(() -> service.getQuote()).isInstanceOf(RateStoreException.class);
            assertThat(meterRegistry.get("grinex.rate.quote").tag("outcome", "RateStoreException").timer().count())
                    .isEqualTo(1);
        }

        @Test
        @DisplayName("Grinex 失敗 → 不落庫")
        void upstreamFailureSkipsStore() {
            when(grinexApiService.fetchQuote(PAIR)).thenThrow(new UpstreamStatusException(500, "boom"));

            assertThatThrownBy(() -> service.getQuote()).isInstanceOf(UpstreamStatusException.class);
            verify(rateStoreService, never()).save(any(), any());
        }
    }

    @Nested
    @DisplayName("checkHealth()")
    class CheckHealth {

        @Test
        @DisplayName("資料庫失敗 → unhealthy 並拋出例外，不檢查 Grinex")
        void storeDown() {
            doThrow(new StoreUnavailableException("Database health check failed: refused"))
                    .when(rateStoreService).probeAlive();

            assertThatThrownBy(() -> service.checkHealth())
                    .isInstanceOfSatisfying(ServiceUnhealthyException.class, e -> {
                        assertThat(e.getReport().status()).isEqualTo(HealthStatus.UNHEALTHY);
                        assertThat(e.getReport().message()).contains("refused");
                    });
            verify(grinexApiService, never()).probeReachable();
            assertThat(meterRegistry.get("grinex.rate.healthcheck").tag("status", "unhealthy").timer().count())
                    .isEqualTo(1);
        }

        @Test
        @DisplayName("資料庫正常、Grinex 失敗 → degraded")
        void upstreamDown() {
            doNothing().when(rateStoreService).probeAlive();
            doThrow(new UpstreamTransportException("Grinex health check request failed: timeout",
                    new IOException("timeout")))
                    .when(grinexApiService).probeReachable();

            HealthReport report = service.checkHealth();

            assertThat(report.status()).isEqualTo(HealthStatus.DEGRADED);
            assertThat(report.message()).contains("timeout");
            assertThat(meterRegistry.get("grinex.rate.healthcheck").tag("status", "degraded").timer().count())
                    .isEqualTo(1);
        }

        @Test
        @DisplayName("兩者皆正常 → healthy")
        void allHealthy() {
            doNothing().when(rateStoreService).probeAlive();
            doNothing().when(grinexApiService).probeReachable();

            assertThat(service.checkHealth()).isEqualTo(HealthReport.healthy());
        }
    }
}
