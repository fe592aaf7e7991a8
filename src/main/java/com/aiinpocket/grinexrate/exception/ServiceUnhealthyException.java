package com.aiinpocket.grinexrate.exception;

import com.aiinpocket.grinexrate.model.dto.HealthReport;

/**
 * 健康檢查判定為 unhealthy（資料庫無法連線）。
 * 同時攜帶 unhealthy 的 {@link HealthReport}，讓呼叫端同時拿到狀態與失敗訊號。
 */
public class ServiceUnhealthyException extends RateServiceException {

    private final HealthReport report;

    public ServiceUnhealthyException(HealthReport report, Throwable cause) {
        super(report.message(), cause);
        this.report = report;
    }

    public HealthReport getReport() {
        return report;
    }
}
