package com.aiinpocket.grinexrate.model.dto;

import com.aiinpocket.grinexrate.model.enums.HealthStatus;

public record HealthReport(
        HealthStatus status,
        String message
) {

    public static HealthReport healthy() {
        return new HealthReport(HealthStatus.HEALTHY, "Service is healthy");
    }

    public static HealthReport degraded(String message) {
        return new HealthReport(HealthStatus.DEGRADED, message);
    }

    public static HealthReport unhealthy(String message) {
        return new HealthReport(HealthStatus.UNHEALTHY, message);
    }
}
