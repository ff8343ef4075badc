package com.kitchensync.backend.sync.web;

import com.kitchensync.backend.common.web.RequestIdFilter;
import com.kitchensync.backend.sync.controller.SyncBackupController;
import com.kitchensync.backend.sync.controller.SyncController;
import com.kitchensync.backend.sync.dto.SyncErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@Slf4j
@RestControllerAdvice(assignableTypes = {SyncController.class, SyncBackupController.class})
@Order(Ordered.HIGHEST_PRECEDENCE)
public class SyncExceptionAdvice {

    @ExceptionHandler(CookwareLimitExceededException.class)
    public ResponseEntity<SyncErrorResponse> handleCookwareLimit(CookwareLimitExceededException e, HttpServletRequest req) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("limit", e.limit());
        details.put("count", e.count());
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(new SyncErrorResponse("COOKWARE_LIMIT_REACHED", "Cookware limit reached for current plan", rid(req), details));
    }

    @ExceptionHandler(PantryLimitExceededException.class)
    public ResponseEntity<SyncErrorResponse> handlePantryLimit(PantryLimitExceededException e, HttpServletRequest req) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("limit", e.limit());
        details.put("remaining", 0);
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(new SyncErrorResponse("PANTRY_LIMIT_REACHED", "Pantry item limit reached for current plan", rid(req), details));
    }

    @ExceptionHandler(FeatureNotAvailableException.class)
    public ResponseEntity<SyncErrorResponse> handleFeature(FeatureNotAvailableException e, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(new SyncErrorResponse("FEATURE_NOT_AVAILABLE", "Feature not available on current plan", rid(req),
                        Map.of("feature", e.feature())));
    }

    @ExceptionHandler(SyncValidationException.class)
    public ResponseEntity<SyncErrorResponse> handleValidation(SyncValidationException e, HttpServletRequest req) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("section", e.section());
        details.put("errors", e.errors());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new SyncErrorResponse("SYNC_VALIDATION_FAILED", "Invalid items in " + e.section(), rid(req), details));
    }

    @ExceptionHandler(ImportValidationException.class)
    public ResponseEntity<SyncErrorResponse> handleImportValidation(ImportValidationException e, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new SyncErrorResponse("IMPORT_VALIDATION_FAILED", "Backup contains invalid data", rid(req),
                        Map.of("errors", e.errors())));
    }

    @ExceptionHandler(ImportArrayTooLargeException.class)
    public ResponseEntity<SyncErrorResponse> handleImportTooLarge(ImportArrayTooLargeException e, HttpServletRequest req) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("limit", e.limit());
        details.put("violations", e.violations());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new SyncErrorResponse("IMPORT_ARRAY_TOO_LARGE", "Backup array exceeds " + e.limit() + " items", rid(req), details));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<SyncErrorResponse> handleInvalidBody(MethodArgumentNotValidException e, HttpServletRequest req) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (FieldError fe : e.getBindingResult().getFieldErrors()) {
            // 同一欄位只留第一個訊息
            fields.putIfAbsent(fe.getField(), fe.getDefaultMessage());
        }
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new SyncErrorResponse("INVALID_REQUEST", "Validation failed", rid(req), Map.of("fields", fields)));
    }

    /** ?limit=abc 這類型別錯誤 → INVALID_LIMIT */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<SyncErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e, HttpServletRequest req) {
        String code = "INVALID_" + e.getName().toUpperCase(Locale.ROOT);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(new SyncErrorResponse(code, code, rid(req)));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<SyncErrorResponse> handleIllegalArg(IllegalArgumentException e, HttpServletRequest req) {
        String code = norm(e.getMessage(), "BAD_REQUEST");
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(new SyncErrorResponse(code, code, rid(req)));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<SyncErrorResponse> handleUnreadable(HttpMessageNotReadableException e, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new SyncErrorResponse("MALFORMED_JSON", "Request body is not valid JSON", rid(req)));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<SyncErrorResponse> handleStatus(ResponseStatusException e, HttpServletRequest req) {
        String code = norm(e.getReason(), e.getStatusCode().toString());
        return ResponseEntity.status(e.getStatusCode()).body(new SyncErrorResponse(code, code, rid(req)));
    }

    /** 儲存層錯誤等：不外洩細節，只記 log */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<SyncErrorResponse> handleUnknown(Exception e, HttpServletRequest req) {
        String rid = rid(req);
        log.error("sync_internal_error rid={} path={}", rid, req.getRequestURI(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new SyncErrorResponse("INTERNAL_ERROR", "Internal server error", rid));
    }

    private static String rid(HttpServletRequest req) {
        return RequestIdFilter.getOrCreate(req);
    }

    private static String norm(String msg, String fallback) {
        if (msg == null) return fallback;
        String c = msg.trim();
        return c.isEmpty() ? fallback : c;
    }
}
