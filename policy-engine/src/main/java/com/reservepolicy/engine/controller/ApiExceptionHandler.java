package com.reservepolicy.engine.controller;

import com.reservepolicy.common.exception.ErrorCategory;
import com.reservepolicy.common.exception.PolicyEngineException;
import com.reservepolicy.engine.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps engine rejections to HTTP responses by error category.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(PolicyEngineException.class)
    public ResponseEntity<ErrorResponse> handlePolicyError(PolicyEngineException ex) {
        HttpStatus status = statusOf(ex.getCategory());
        log.info("Request rejected. code={} category={} status={}", ex.getError(), ex.getCategory(), status.value());
        return ResponseEntity.status(status)
            .body(new ErrorResponse(ex.getError().name(), ex.getCategory().name(), ex.getMessage()));
    }

    static HttpStatus statusOf(ErrorCategory category) {
        return switch (category) {
            case AUTHENTICATION -> HttpStatus.UNAUTHORIZED;
            case AUTHORIZATION  -> HttpStatus.FORBIDDEN;
            case VALIDATION     -> HttpStatus.BAD_REQUEST;
            case TEMPORAL, STATE -> HttpStatus.CONFLICT;
            case ARITHMETIC     -> HttpStatus.UNPROCESSABLE_ENTITY;
        };
    }
}
