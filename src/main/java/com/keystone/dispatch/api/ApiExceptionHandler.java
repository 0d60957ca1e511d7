package com.keystone.dispatch.api;

import com.keystone.core.error.GovernanceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps governance errors to HTTP responses. The body always carries
 * {@code error}; governance errors add {@code kind} and {@code policy_refs}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(GovernanceException.class)
    public ResponseEntity<Map<String, Object>> governance(GovernanceException e) {
        HttpStatus status = switch (e.kind()) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case STATE_CONFLICT -> HttpStatus.CONFLICT;
            case APPROVAL_REQUIRED -> HttpStatus.FORBIDDEN;
            case INSUFFICIENT_PROVENANCE, MALFORMED_PROVENANCE, POLICY_CONFLICT, UNSUPPORTED_CLAIM,
                 BUDGET_EXCEEDED, AUTHORITY_VIOLATION -> HttpStatus.UNPROCESSABLE_ENTITY;
        };
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getMessage());
        body.put("kind", e.kind().name());
        body.put("policy_refs", e.policyRefs());
        log.info("{} {}: {}", status.value(), e.kind(), e.getMessage());
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler({IllegalArgumentException.class, DateTimeParseException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> badRequest(Exception e) {
        return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
    }
}
