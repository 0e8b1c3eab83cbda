package com.sitecheck.api.exception;

import com.sitecheck.api.dto.response.ErrorResponse;
import com.sitecheck.api.security.RequestIdFilter;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex,
            WebRequest request
    ) {
        return respond(HttpStatus.BAD_REQUEST, "Invalid value for '" + ex.getName() + "'",
            String.valueOf(ex.getValue()), request);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccessException(
            DataAccessException ex,
            WebRequest request
    ) {
        log.error("Database error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Database error",
            ex.getMostSpecificCause().getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex,
            WebRequest request
    ) {
        log.error("Unexpected error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", ex.getMessage(), request);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String message, String error, WebRequest request) {
        ErrorResponse errorResponse = ErrorResponse.builder()
            .message(message)
            .error(error)
            .status(status.value())
            .timestamp(Instant.now())
            .path(request.getDescription(false).replace("uri=", ""))
            .requestId(MDC.get(RequestIdFilter.MDC_KEY))
            .build();
        return ResponseEntity.status(status).body(errorResponse);
    }
}
