package com.cryptoledger.transaction;

import lombok.Getter;

/**
 * Thrown by the transaction store when input is invalid or the target does not exist.
 * The API layer maps INVALID_TRANSACTION and INVALID_CSV to 400, TRANSACTION_NOT_FOUND to 404.
 */
@Getter
public class TransactionServiceException extends RuntimeException {

    private final String errorCode;

    public TransactionServiceException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public TransactionServiceException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
