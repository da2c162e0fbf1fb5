package com.netwarden.backend.common.web;

import com.netwarden.backend.report.notify.NotificationDispatchException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.DateTimeException;
import java.util.HashMap;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * 統一把常見例外轉成「可預期」的 HTTP 狀態碼與錯誤格式 {code, message}：
 * - 400：參數格式錯 / 日期 parse / IllegalArgument / Bean Validation
 * - 404：找不到資源（NoSuchElementException）
 * - 502：報表送出失敗
 * - 500：其他未預期錯誤
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    // ===== 400 Bad Request =====

    @ExceptionHandler({
            IllegalArgumentException.class,
            DateTimeException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            ConstraintViolationException.class,
            HandlerMethodValidationException.class
    })
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(err("BAD_REQUEST", ex.getMessage()));
    }

    /**
     * Bean Validation（@Valid）失敗：例如 @NotBlank / @Min 等
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String msg = ex.getBindingResult().getFieldErrors().isEmpty()
                ? "VALIDATION_FAILED"
                : ex.getBindingResult().getFieldErrors().get(0).getField()
                + " " + ex.getBindingResult().getFieldErrors().get(0).getDefaultMessage();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(err("VALIDATION_FAILED", msg));
    }

    // ===== 404 Not Found =====

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<Map<String, Object>> handleNoSuch(NoSuchElementException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(err("NOT_FOUND", ex.getMessage()));
    }

    // ===== 502 Bad Gateway =====

    /** 報表送出失敗（Telegram 拒收 / 連不上） */
    @ExceptionHandler(NotificationDispatchException.class)
    public ResponseEntity<Map<String, Object>> handleDispatch(NotificationDispatchException ex) {
        log.warn("notification dispatch failed: code={} status={}", ex.getMessage(), ex.getHttpStatus());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(err(ex.getMessage(), null));
    }

    // ===== 500 Fallback =====

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnknown(Exception ex) {
        log.error("unhandled api error: {}", ex.toString(), ex);
        // 不回內部訊息，避免洩漏；rid 已在 response header
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(err("INTERNAL_ERROR", null));
    }

    private static Map<String, Object> err(String code, String message) {
        Map<String, Object> m = new HashMap<>();
        m.put("code", code);
        if (message != null && !message.isBlank()) m.put("message", message);
        return m;
    }
}
