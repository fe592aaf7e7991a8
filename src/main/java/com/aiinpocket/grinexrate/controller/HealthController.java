package com.aiinpocket.grinexrate.controller;

import com.aiinpocket.grinexrate.model.dto.HealthReport;
import com.aiinpocket.grinexrate.service.RateQuoteService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 健康檢查 API。
 * healthy / degraded 回 200；資料庫無法連線時由 {@link GlobalExceptionHandler} 回 503 與 unhealthy 內容。
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final RateQuoteService rateQuoteService;

    @GetMapping("/api/healthcheck")
    public HealthReport healthcheck() {
        return rateQuoteService.checkHealth();
    }
}
