package com.herzen.audit.api;

import com.herzen.audit.evaluation.EvaluationException;
import com.herzen.audit.service.UnknownBlockException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(UnknownBlockException.class)
    public ResponseEntity<Map<String, Object>> unknownBlock(UnknownBlockException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Map.of("error", "unknown_block", "blockId", ex.blockId()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(Map.of("error", "invalid_request", "details", String.valueOf(ex.getMessage())));
    }

    @ExceptionHandler(EvaluationException.class)
    public ResponseEntity<Map<String, Object>> evaluationFailed(EvaluationException ex) {
        log.error("Audit evaluation failed ({}): {}", ex.code(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "evaluation_failed", "code", ex.code(), "details", ex.getMessage()));
    }
}
