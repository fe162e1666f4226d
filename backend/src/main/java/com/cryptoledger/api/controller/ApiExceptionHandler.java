package com.cryptoledger.api.controller;

import com.cryptoledger.api.dto.ErrorBody;
import com.cryptoledger.transaction.TransactionService;
import com.cryptoledger.transaction.TransactionServiceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.Optional;

/**
 * Maps validation failures and store errors to ErrorBody (error, message, timestamp):
 * 404 for TRANSACTION_NOT_FOUND, 400 for everything else the client sent wrong.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    static final String INVALID_REQUEST = "INVALID_REQUEST";

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && !msg.isBlank())
                .orElse(VALIDATION_ERROR);
        String message = ex.getFieldErrors().stream()
                .findFirst()
                .map(e -> e.getField() + ": " + e.getCode())
                .orElse("Validation failed");
        return ResponseEntity.badRequest().body(ErrorBody.of(error, message));
    }

    @ExceptionHandler(TransactionServiceException.class)
    public ResponseEntity<ErrorBody> handleTransactionService(TransactionServiceException ex) {
        HttpStatus status = TransactionService.TRANSACTION_NOT_FOUND.equals(ex.getErrorCode())
                ? HttpStatus.NOT_FOUND
                : HttpStatus.BAD_REQUEST;
        log.debug("Transaction request rejected: {} {}", ex.getErrorCode(), ex.getMessage());
        return ResponseEntity.status(status).body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleInput(ServerWebInputException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of(INVALID_REQUEST, ex.getReason()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorBody> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of(INVALID_REQUEST, ex.getMessage()));
    }
}
