package com.company.searchindexer.config;

import com.company.searchindexer.exception.InvalidJobParametersException;
import com.company.searchindexer.exception.JobNotFoundException;
import com.company.searchindexer.exception.PublicationNotFoundException;
import com.company.searchindexer.exception.SourceUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;

@ControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler({JobNotFoundException.class, PublicationNotFoundException.class})
    public ResponseEntity<Map<String, Object>> handleNotFound(RuntimeException ex) {
        return body(HttpStatus.NOT_FOUND, "not_found", ex.getMessage());
    }

    @ExceptionHandler(InvalidJobParametersException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidParams(InvalidJobParametersException ex) {
        log.warn("Petición rechazada: {}", ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, "invalid_request", ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        return body(HttpStatus.BAD_REQUEST, "invalid_request", "Malformed request body");
    }

    /**
     * MySQL o Elasticsearch no responden
     */
    @ExceptionHandler(SourceUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleUnavailable(SourceUnavailableException ex) {
        log.error("❌ Servicio externo no disponible: {}", ex.getMessage());
        return body(HttpStatus.SERVICE_UNAVAILABLE, "service_unavailable", ex.getMessage());
    }

    @ExceptionHandler(RejectedExecutionException.class)
    public ResponseEntity<Map<String, Object>> handleSaturated(RejectedExecutionException ex) {
        log.warn("⚠️ Pool de workers saturado");
        return body(HttpStatus.SERVICE_UNAVAILABLE, "pool_saturated", "Too many indexing processes queued, try again later");
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
