package com.fueltrack.archival.exception;

import com.fueltrack.archival.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.LocalDateTime;
import java.util.stream.Collectors;

@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ArchivalInProgressException.class)
    public ResponseEntity<ErrorResponse> handleInProgress(ArchivalInProgressException e, HttpServletRequest request) {
        log.warn("Archival Conflict: {}", e.getMessage());
        return buildResponse(HttpStatus.CONFLICT, "Archival In Progress", e.getMessage(), request);
    }

    @ExceptionHandler(RestoreConflictException.class)
    public ResponseEntity<ErrorResponse> handleRestoreConflict(RestoreConflictException e, HttpServletRequest request) {
        log.warn("Restore Conflict: {}", e.getMessage());
        return buildResponse(HttpStatus.CONFLICT, "Restore Conflict", e.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e,
            HttpServletRequest request) {
        String details = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getField)
                .distinct()
                .map(field -> field + ": " + e.getBindingResult().getFieldError(field).getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("Validation Error: {}", details);
        return buildResponse(HttpStatus.BAD_REQUEST, "Validation Failed", details, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e,
            HttpServletRequest request) {
        log.warn("Unreadable Request: {}", e.getMessage());
        return buildResponse(HttpStatus.BAD_REQUEST, "Invalid JSON format", "Request body could not be read",
                request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadInput(IllegalArgumentException e, HttpServletRequest request) {
        log.warn("Invalid Input: {}", e.getMessage());
        return buildResponse(HttpStatus.BAD_REQUEST, "Invalid Input", e.getMessage(), request);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccess(DataAccessException e, HttpServletRequest request) {
        log.error("Data Store Error: ", e);
        return buildResponse(HttpStatus.SERVICE_UNAVAILABLE, "Data Store Unavailable",
                "The record store could not complete the request", request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneralError(Exception e, HttpServletRequest request) {
        log.error("Internal Server Error: ", e);
        return buildResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred",
                request);
    }

    private ResponseEntity<ErrorResponse> buildResponse(HttpStatus status, String error, String message,
            HttpServletRequest request) {
        ErrorResponse response = new ErrorResponse(
                LocalDateTime.now(),
                status.value(),
                error,
                message,
                request.getRequestURI());
        return new ResponseEntity<>(response, status);
    }
}
