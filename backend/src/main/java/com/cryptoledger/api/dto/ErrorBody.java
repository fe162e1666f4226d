package com.cryptoledger.api.dto;

import java.time.Instant;

/**
 * Error response body: error (code), message, timestamp (ISO 8601). Used for every 4xx the API returns.
 */
public record ErrorBody(String error, String message, Instant timestamp) {

    public static ErrorBody of(String error, String message) {
        return new ErrorBody(error, message, Instant.now());
    }
}
