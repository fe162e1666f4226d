package com.cryptoledger.transaction.csv;

/**
 * A CSV data row that was not imported. Row numbers count data rows from 1, the header excluded.
 */
public record SkippedRow(int rowNumber, String reason) {
}
