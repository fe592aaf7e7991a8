package com.aiinpocket.grinexrate.metrics;

import com.aiinpocket.grinexrate.model.enums.HealthStatus;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

/**
 * 報價與健康檢查的 Micrometer 指標，由 /actuator/prometheus 匯出。
 *
 * <ul>
 *   <li>{@code grinex.rate.quote} — 取得報價耗時，tag: outcome（success / 例外類別名稱）</li>
 *   <li>{@code grinex.rate.healthcheck} — 健康檢查耗時，tag: status（healthy / degraded / unhealthy）</li>
 * </ul>
 */
@Component
public class RateMetrics {

    static final String QUOTE_TIMER = "grinex.rate.quote";
    static final String HEALTH_TIMER = "grinex.rate.healthcheck";

    private final MeterRegistry registry;

    public RateMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public Timer.Sample start() {
        return Timer.start(registry);
    }

    public void recordQuote(Timer.Sample sample, String outcome) {
        sample.stop(Timer.builder(QUOTE_TIMER)
                .description("Time to fetch, derive and persist a quote")
                .tag("outcome", outcome)
                .register(registry));
    }

    public void recordHealth(Timer.Sample sample, HealthStatus status) {
        sample.stop(Timer.builder(HEALTH_TIMER)
                .description("Time to probe the database and Grinex")
                .tag("status", status.getLabel())
                .register(registry));
    }
}
