package com.trendradar.radar.api;

import com.trendradar.radar.isolation.ConfigRestoreException;
import com.trendradar.radar.isolation.ConfigWriteException;
import com.trendradar.radar.service.RunValidationException;
import com.trendradar.radar.service.TaskNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

@RestControllerAdvice
public class RadarExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(RadarExceptionHandler.class);

    @ExceptionHandler(RunValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(RunValidationException ex) {
        return failure(HttpStatus.BAD_REQUEST, "invalid_request", ex.getMessage());
    }

    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        MissingServletRequestParameterException.class,
        MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<Map<String, Object>> handleMalformedRequest(Exception ex) {
        return failure(HttpStatus.BAD_REQUEST, "invalid_request", "Malformed request: " + ex.getMessage());
    }

    @ExceptionHandler(TaskNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleTaskNotFound(TaskNotFoundException ex) {
        return failure(HttpStatus.NOT_FOUND, "task_not_found", ex.getMessage());
    }

    @ExceptionHandler(ConfigWriteException.class)
    public ResponseEntity<Map<String, Object>> handleConfigWrite(ConfigWriteException ex) {
        log.error("Configuration write failed at stage {}", ex.getStage(), ex);
        return failure(HttpStatus.INTERNAL_SERVER_ERROR, "config_write_failed", ex.getMessage());
    }

    @ExceptionHandler(ConfigRestoreException.class)
    public ResponseEntity<Map<String, Object>> handleConfigRestore(ConfigRestoreException ex) {
        return failure(HttpStatus.INTERNAL_SERVER_ERROR, "config_restore_failed", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleOther(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            HttpStatusCode status = errorResponse.getStatusCode();
            return failure(status, "request_failed", ex.getMessage());
        }
        log.error("Search failed", ex);
        return failure(HttpStatus.INTERNAL_SERVER_ERROR, "search_failed", ex.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> failure(HttpStatusCode status, String code, String message) {
        return ResponseEntity.status(status)
            .body(Map.of("success", false, "error", code, "message", message == null ? code : message));
    }
}
