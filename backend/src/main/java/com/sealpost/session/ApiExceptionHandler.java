package com.sealpost.session;

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

    @ExceptionHandler(NoActiveSessionException.class)
    public ResponseEntity<ApiError> noSession(NoActiveSessionException e) {
        return error(HttpStatus.CONFLICT, e.getMessage(), Map.of());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> badRequest(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage(), Map.of());
    }

    @ExceptionHandler(PublishException.class)
    public ResponseEntity<ApiError> publishFailed(PublishException e) {
        log.warn("Publish failed: {} {}", e.getMessage(), e.failures().keySet());
        return error(HttpStatus.BAD_GATEWAY, e.getMessage(), e.failures());
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String message, Map<String, String> failures) {
        return ResponseEntity.status(status)
                .body(new ApiError(status.value(), status.getReasonPhrase(), message, failures));
    }
}
