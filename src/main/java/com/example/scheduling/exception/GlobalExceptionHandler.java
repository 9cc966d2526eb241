package com.example.scheduling.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotAcceptableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String RETRY_AFTER_SECONDS = "1";

    @ExceptionHandler(SchedulingUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleUnavailable(SchedulingUnavailableException e) {
        log.warn("Transient scheduling failure: {}", e.getMessage());

        Map<String, Object> body = new HashMap<>();
        body.put("error", "Scheduling temporarily unavailable");
        body.put("message", e.getMessage());
        body.put("retryable", true);

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS)
                .body(body);
    }

    @ExceptionHandler(NotAccessibleException.class)
    public ResponseEntity<Map<String, Object>> handleNotAccessible(NotAccessibleException e) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", "UNAUTHORIZED");
        body.put("message", e.getMessage());
        return new ResponseEntity<>(body, HttpStatus.FORBIDDEN);
    }

    @ExceptionHandler(InvariantViolationException.class)
    public ResponseEntity<Map<String, Object>> handleInvariantViolation(InvariantViolationException e) {
        // already logged with full context at the commit site
        Map<String, Object> body = new HashMap<>();
        body.put("error", "Internal consistency error");
        body.put("message", "The change was not applied");
        return new ResponseEntity<>(body, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleMalformedRequest(Exception e) {
        log.debug("Malformed request: {}", e.getMessage());

        Map<String, Object> body = new HashMap<>();
        body.put("error", "Malformed request");
        body.put("message", "Request body or parameters could not be read");
        return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
    }

    /** Missing query parameters, headers or cookies. */
    @ExceptionHandler(ServletRequestBindingException.class)
    public ResponseEntity<Map<String, Object>> handleMissingInput(ServletRequestBindingException e) {
        log.debug("Incomplete request: {}", e.getMessage());

        Map<String, Object> body = new HashMap<>();
        body.put("error", "Malformed request");
        body.put("message", e.getMessage());
        return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<Map<String, Object>> handleMethodNotSupported(HttpRequestMethodNotSupportedException e) {
        log.debug("Unsupported method: {}", e.getMessage());

        Map<String, Object> body = new HashMap<>();
        body.put("error", "Method not allowed");
        body.put("message", e.getMessage());
        HttpHeaders headers = new HttpHeaders();
        if (e.getSupportedHttpMethods() != null) {
            headers.setAllow(e.getSupportedHttpMethods());
        }
        return new ResponseEntity<>(body, headers, HttpStatus.METHOD_NOT_ALLOWED);
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<Map<String, Object>> handleMediaTypeNotSupported(HttpMediaTypeNotSupportedException e) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", "Unsupported media type");
        body.put("message", e.getMessage());
        return new ResponseEntity<>(body, HttpStatus.UNSUPPORTED_MEDIA_TYPE);
    }

    @ExceptionHandler(HttpMediaTypeNotAcceptableException.class)
    public ResponseEntity<Map<String, Object>> handleMediaTypeNotAcceptable(HttpMediaTypeNotAcceptableException e) {
        // no body: the client accepts none of the types it could be rendered in
        return ResponseEntity.status(HttpStatus.NOT_ACCEPTABLE).build();
    }

    @ExceptionHandler({NoHandlerFoundException.class, NoResourceFoundException.class})
    public ResponseEntity<Map<String, Object>> handleNoRoute(Exception e) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", "Not found");
        body.put("message", e.getMessage());
        return new ResponseEntity<>(body, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException e) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", "Invalid request");
        body.put("message", e.getMessage());
        return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception e) {
        log.error("Unexpected error: {}", e.getMessage(), e);

        Map<String, Object> body = new HashMap<>();
        body.put("error", "Internal server error");
        body.put("message", "An unexpected error occurred");
        return new ResponseEntity<>(body, HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
