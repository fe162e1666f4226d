package com.cryptoledger.transaction.csv;

import com.cryptoledger.domain.TransactionType;
import com.cryptoledger.transaction.TransactionDraft;
import com.cryptoledger.transaction.TransactionService;
import com.cryptoledger.transaction.TransactionServiceException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.cryptoledger.transaction.csv.TransactionCsvColumns.CRYPTO_SYMBOL;
import static com.cryptoledger.transaction.csv.TransactionCsvColumns.FEE;
import static com.cryptoledger.transaction.csv.TransactionCsvColumns.FIAT_CURRENCY;
import static com.cryptoledger.transaction.csv.TransactionCsvColumns.NOTES;
import static com.cryptoledger.transaction.csv.TransactionCsvColumns.PRICE_PER_UNIT;
import static com.cryptoledger.transaction.csv.TransactionCsvColumns.QUANTITY;
import static com.cryptoledger.transaction.csv.TransactionCsvColumns.REQUIRED;
import static com.cryptoledger.transaction.csv.TransactionCsvColumns.TRANSACTION_DATE;
import static com.cryptoledger.transaction.csv.TransactionCsvColumns.TRANSACTION_TYPE;

/**
 * Imports transactions from CSV with a header row. A missing required column rejects the whole file; a bad
 * row is skipped and reported, the remaining rows are still imported.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TransactionCsvImporter {

    private static final CsvMapper CSV_MAPPER = new CsvMapper();

    private final TransactionService transactionService;

    /**
     * Reads the whole file before saving anything, so a file rejected as INVALID_CSV leaves the store untouched.
     *
     * @throws TransactionServiceException INVALID_CSV when the file cannot be read or lacks required columns
     */
    public CsvImportResult importCsv(Reader reader, String walletId) {
        List<SkippedRow> skipped = new ArrayList<>();
        Map<Integer, TransactionDraft> drafts = readDrafts(reader, walletId, skipped);

        int imported = 0;
        for (Map.Entry<Integer, TransactionDraft> entry : drafts.entrySet()) {
            try {
                transactionService.addTransaction(entry.getValue());
                imported++;
            } catch (TransactionServiceException e) {
                log.debug("Skipping CSV row {}: {}", entry.getKey(), e.getMessage());
                skipped.add(new SkippedRow(entry.getKey(), e.getMessage()));
            }
        }
        skipped.sort(Comparator.comparingInt(SkippedRow::rowNumber));
        log.info("CSV import into wallet {}: {} imported, {} skipped", walletId, imported, skipped.size());
        return new CsvImportResult(imported, skipped);
    }

    private static Map<Integer, TransactionDraft> readDrafts(Reader reader, String walletId, List<SkippedRow> skipped) {
        CsvSchema headerSchema = CsvSchema.emptySchema().withHeader();
        Map<Integer, TransactionDraft> drafts = new LinkedHashMap<>();
        try (MappingIterator<Map<String, String>> rows = CSV_MAPPER.readerFor(Map.class)
                .with(headerSchema)
                .readValues(reader)) {
            boolean hasRows = rows.hasNext();
            requireColumns(rows);
            int rowNumber = 0;
            while (hasRows && rows.hasNext()) {
                rowNumber++;
                Map<String, String> row = rows.next();
                try {
                    drafts.put(rowNumber, toDraft(row, walletId));
                } catch (IllegalArgumentException | DateTimeException e) {
                    log.debug("Skipping CSV row {}: {}", rowNumber, e.getMessage());
                    skipped.add(new SkippedRow(rowNumber, e.getMessage()));
                }
            }
        } catch (TransactionServiceException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new TransactionServiceException(TransactionService.INVALID_CSV, "Error importing CSV: " + e.getMessage(), e);
        }
        return drafts;
    }

    private static void requireColumns(MappingIterator<Map<String, String>> rows) {
        CsvSchema schema = (CsvSchema) rows.getParser().getSchema();
        Set<String> present = new HashSet<>();
        if (schema != null) {
            schema.forEach(column -> present.add(column.getName().strip()));
        }
        List<String> missing = REQUIRED.stream().filter(c -> !present.contains(c)).toList();
        if (!missing.isEmpty()) {
            throw new TransactionServiceException(TransactionService.INVALID_CSV,
                    "Missing required columns: " + String.join(", ", missing));
        }
    }

    static TransactionDraft toDraft(Map<String, String> row, String walletId) {
        return new TransactionDraft(
                walletId,
                TransactionType.fromWireValue(required(row, TRANSACTION_TYPE)),
                required(row, CRYPTO_SYMBOL),
                decimal(row, QUANTITY, true),
                decimal(row, PRICE_PER_UNIT, true),
                optional(row, FIAT_CURRENCY),
                decimal(row, FEE, false),
                parseDate(required(row, TRANSACTION_DATE)),
                optional(row, NOTES));
    }

    /**
     * Accepts yyyy-MM-dd, an ISO local date-time (T or space separated) or an ISO instant. Local values are UTC.
     */
    static Instant parseDate(String value) {
        String v = value.strip();
        if (v.length() == 10) {
            return LocalDate.parse(v).atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        if (v.endsWith("Z") || v.matches(".*[+-]\\d{2}:\\d{2}$")) {
            return OffsetDateTime.parse(v.replace(' ', 'T')).toInstant();
        }
        return LocalDateTime.parse(v.replace(' ', 'T')).toInstant(ZoneOffset.UTC);
    }

    private static String required(Map<String, String> row, String column) {
        String value = row.get(column);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing value for " + column);
        }
        return value.strip();
    }

    private static String optional(Map<String, String> row, String column) {
        String value = row.get(column);
        return value == null || value.isBlank() ? null : value.strip();
    }

    private static BigDecimal decimal(Map<String, String> row, String column, boolean isRequired) {
        String value = isRequired ? required(row, column) : optional(row, column);
        if (value == null) {
            return null;
        }
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + column + ": " + value, e);
        }
    }
}
