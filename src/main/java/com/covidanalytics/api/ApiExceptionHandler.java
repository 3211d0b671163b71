package com.covidanalytics.api;

import com.covidanalytics.domain.error.AnalyticsException;
import com.covidanalytics.domain.error.ErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps failures to {@link ErrorResponse} bodies.
 *
 * Status mapping:
 * - INVALID_FILTER: 400
 * - NOT_FOUND: 404
 * - INSUFFICIENT_DATA, FORECAST_FAILED, CLUSTERING_FAILED: 422
 * - UPSTREAM_UNAVAILABLE: 503
 * - INTERNAL (statement rejected by the warehouse): 500
 * - anything unexpected: 500 with kind INTERNAL
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(AnalyticsException.class)
    public ResponseEntity<ErrorResponse> handleAnalytics(AnalyticsException ex) {
        HttpStatus status = statusOf(ex.getKind());
        if (status.is5xxServerError()) {
            log.warn("Request failed with {}: {}", ex.getKind(), ex.getMessage());
        } else {
            log.debug("Request rejected with {}: {}", ex.getKind(), ex.getMessage());
        }
        return ResponseEntity.status(status).body(ErrorResponse.of(ex.getKind(), ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String detail = "Invalid value '" + ex.getValue() + "' for parameter '" + ex.getName() + "'";
        return ResponseEntity.badRequest().body(ErrorResponse.of(ErrorKind.INVALID_FILTER, detail));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException ex) {
        String detail = "Missing required parameter '" + ex.getParameterName() + "'";
        return ResponseEntity.badRequest().body(ErrorResponse.of(ErrorKind.INVALID_FILTER, detail));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        log.error("Unexpected error while handling request", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of(ErrorKind.INTERNAL, "An unexpected error occurred"));
    }

    static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case INVALID_FILTER -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case UPSTREAM_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case INSUFFICIENT_DATA, FORECAST_FAILED, CLUSTERING_FAILED -> HttpStatus.UNPROCESSABLE_ENTITY;
            case INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
