package com.aiinpocket.gmtracker.controller;

import com.aiinpocket.gmtracker.service.GamificationStoreException;
import com.aiinpocket.gmtracker.service.MissionUpdateContentionException;
import com.aiinpocket.gmtracker.store.KeyValueStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * 全域 REST API 異常處理器。
 * 攔截未被個別 Controller 處理的異常，回傳統一的 {"error": ...} 格式。
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleIllegalArgument(IllegalArgumentException e) {
        String msg = sanitizeMessage(e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", msg));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest().body(Map.of("error", "請求格式不正確，請檢查欄位型別"));
    }

    /** 寫入衝突：呼叫端應重試整個操作 */
    @ExceptionHandler(MissionUpdateContentionException.class)
    public ResponseEntity<Map<String, String>> handleContention(MissionUpdateContentionException e) {
        log.warn("[GlobalExceptionHandler] {}", e.getMessage());
        return ResponseEntity.status(409).body(Map.of("error", "任務進度更新忙碌中，請稍後重試"));
    }

    @ExceptionHandler({GamificationStoreException.class, KeyValueStoreException.class})
    public ResponseEntity<Map<String, String>> handleStoreUnavailable(RuntimeException e) {
        log.error("[GlobalExceptionHandler] 儲存層不可用: {}", e.getMessage(), e);
        return ResponseEntity.status(503).body(Map.of("error", "進度儲存暫時無法使用，請稍後重試"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGeneral(Exception e) {
        log.error("[GlobalExceptionHandler] 未預期的錯誤", e);
        return ResponseEntity.internalServerError()
                .body(Map.of("error", "系統發生錯誤，請稍後重試"));
    }

    /** 過濾可能含有基礎設施資訊的錯誤訊息 */
    private static String sanitizeMessage(String msg) {
        if (msg == null || msg.length() > 200) return "操作失敗，請稍後重試";
        String lower = msg.toLowerCase();
        if (lower.contains("redis") || lower.contains("exception") || lower.contains("connection")
                || lower.contains("timeout") || lower.contains("password") || lower.contains("token")) {
            return "操作失敗，請稍後重試";
        }
        return msg;
    }
}
