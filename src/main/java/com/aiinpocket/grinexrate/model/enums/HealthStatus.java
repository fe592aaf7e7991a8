package com.aiinpocket.grinexrate.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 服務健康狀態。
 * <ul>
 *   <li>HEALTHY — 資料庫與 Grinex 皆正常</li>
 *   <li>DEGRADED — 資料庫正常，但 Grinex 無法連線（報價功能受影響）</li>
 *   <li>UNHEALTHY — 資料庫無法連線</li>
 * </ul>
 */
public enum HealthStatus {
    HEALTHY("healthy"),
    DEGRADED("degraded"),
    UNHEALTHY("unhealthy");

    private final String label;

    HealthStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
