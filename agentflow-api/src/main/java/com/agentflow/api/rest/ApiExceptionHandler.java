package com.agentflow.api.rest;

import com.agentflow.core.exception.CorruptStateException;
import com.agentflow.core.exception.InvalidTaskException;
import com.agentflow.core.exception.NotFoundException;
import com.agentflow.core.exception.OrchestratorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps orchestrator errors to HTTP responses carrying the error code.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidTaskException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidTask(InvalidTaskException ex) {
        return error(HttpStatus.BAD_REQUEST, ex);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(NotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, ex);
    }

    @ExceptionHandler(CorruptStateException.class)
    public ResponseEntity<Map<String, Object>> handleCorruptState(CorruptStateException ex) {
        log.error("Request touched corrupt pipeline {}: {}", ex.getTaskId(), ex.getMessage());
        return error(HttpStatus.CONFLICT, ex);
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, OrchestratorException ex) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", ex.getErrorCode());
        body.put("message", ex.getMessage());
        if (ex.getTaskId() != null) {
            body.put("taskId", ex.getTaskId());
        }
        return new ResponseEntity<>(body, status);
    }
}
