package com.starwatch.controller;

import com.starwatch.exception.EntityNotFoundException;
import com.starwatch.exception.StarSourceException;
import com.starwatch.exception.SyncInProgressException;
import com.starwatch.exception.WrongQueryException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(SyncInProgressException.class)
    public ResponseEntity<ErrorResponse> handleSyncInProgress(SyncInProgressException ex) {
        return error(ex.getMessage(), HttpStatus.CONFLICT);
    }

    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(EntityNotFoundException ex) {
        return error(ex.getMessage(), HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParams(MissingServletRequestParameterException ex) {
        return error(String.format("Parameter '%s' is missing", ex.getParameterName()), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return error(String.format("Parameter '%s' has an invalid value", ex.getName()), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(WrongQueryException.class)
    public ResponseEntity<ErrorResponse> handleWrongQuery(WrongQueryException ex) {
        return error(ex.getMessage(), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(StarSourceException.class)
    public ResponseEntity<ErrorResponse> handleStarSource(StarSourceException ex) {
        log.error("Star list fetch failed: {}", ex.getMessage());
        return error(ex.getMessage(), HttpStatus.BAD_GATEWAY);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unhandled error", ex);
        return error("An unexpected error occurred", HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private static ResponseEntity<ErrorResponse> error(String message, HttpStatus status) {
        return new ResponseEntity<>(new ErrorResponse(message, status.value(), Instant.now().toEpochMilli()), status);
    }
}
