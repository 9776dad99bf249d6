package com.pibridge.web;

import com.pibridge.historian.UpstreamException;
import com.pibridge.query.ConfigurationException;
import com.pibridge.query.QueryParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps query failures to HTTP responses with an {@code errorCode} and {@code message} body.
 */
@RestControllerAdvice
public class RestExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RestExceptionHandler.class);

    @ExceptionHandler(QueryParseException.class)
    public ResponseEntity<Map<String, Object>> handleParseError(QueryParseException ex) {
        return error(HttpStatus.BAD_REQUEST, "PARSE_ERROR", ex.getMessage());
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<Map<String, Object>> handleConfigError(ConfigurationException ex) {
        ResponseEntity<Map<String, Object>> response =
            error(HttpStatus.UNPROCESSABLE_ENTITY, "CONFIG_ERROR", ex.getMessage());
        if (ex.getField() != null) {
            response.getBody().put("field", ex.getField());
        }
        return response;
    }

    @ExceptionHandler(UpstreamException.class)
    public ResponseEntity<Map<String, Object>> handleUpstreamError(UpstreamException ex) {
        log.error("Historian error: {}", ex.getMessage(), ex);
        ResponseEntity<Map<String, Object>> response =
            error(HttpStatus.BAD_GATEWAY, "UPSTREAM_ERROR", ex.getMessage());
        if (ex.getLeg() != null) {
            response.getBody().put("leg", ex.getLeg().getValue());
        }
        return response;
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String errorCode, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("errorCode", errorCode);
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
