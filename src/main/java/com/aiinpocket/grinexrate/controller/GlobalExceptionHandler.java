package com.aiinpocket.grinexrate.controller;

import com.aiinpocket.grinexrate.exception.EmptyTradesException;
import com.aiinpocket.grinexrate.exception.GrinexApiException;
import com.aiinpocket.grinexrate.exception.NoValidPricesException;
import com.aiinpocket.grinexrate.exception.RateNotFoundException;
import com.aiinpocket.grinexrate.exception.RateStoreException;
import com.aiinpocket.grinexrate.exception.ServiceUnhealthyException;
import com.aiinpocket.grinexrate.model.dto.HealthReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

/**
 * 全域 REST API 異常處理器。
 * 業務錯誤一律回傳 {@code {"error": "..."}}；健康檢查的 unhealthy 例外則回傳 503 與健康狀態本體。
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(GrinexApiException.class)
    public ResponseEntity<Map<String, String>> handleGrinexApi(GrinexApiException e) {
        log.error("[報價] 無法從 Grinex 取得報價: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(Map.of("error", "Failed to get rate from Grinex: " + e.getMessage()));
    }

    @ExceptionHandler({EmptyTradesException.class, NoValidPricesException.class})
    public ResponseEntity<Map<String, String>> handleNoTradeData(RuntimeException e) {
        log.error("[報價] 成交資料無法計算報價: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(Map.of("error", "Failed to calculate prices from trades: " + e.getMessage()));
    }

    @ExceptionHandler(RateStoreException.class)
    public ResponseEntity<Map<String, String>> handleStore(RateStoreException e) {
        log.error("[儲存] 資料庫操作失敗: {}", e.getMessage(), e);
        return ResponseEntity.internalServerError()
                .body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(RateNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(RateNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(ServiceUnhealthyException.class)
    public ResponseEntity<HealthReport> handleUnhealthy(ServiceUnhealthyException e) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(e.getReport());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleIllegalArgument(IllegalArgumentException e) {
        String msg = e.getMessage() != null ? e.getMessage() : "請求格式不正確";
        return ResponseEntity.badRequest().body(Map.of("error", msg));
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, String>> handleBadParameter(Exception e) {
        return ResponseEntity.badRequest().body(Map.of("error", "請求參數不正確，時間請使用 ISO-8601 格式"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGeneral(Exception e) {
        log.error("[GlobalExceptionHandler] 未預期的錯誤", e);
        return ResponseEntity.internalServerError()
                .body(Map.of("error", "系統發生錯誤，請稍後重試"));
    }
}
