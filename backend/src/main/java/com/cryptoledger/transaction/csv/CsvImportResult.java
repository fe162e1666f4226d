package com.cryptoledger.transaction.csv;

import java.util.List;

public record CsvImportResult(int importedCount, List<SkippedRow> skippedRows) {

    public CsvImportResult {
        skippedRows = skippedRows == null ? List.of() : List.copyOf(skippedRows);
    }
}
