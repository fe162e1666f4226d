package com.cryptoledger.transaction.csv;

import com.cryptoledger.domain.Transaction;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes transactions as CSV using the import column names, so an export can be imported again.
 */
@Component
public class TransactionCsvExporter {

    private static final CsvMapper CSV_MAPPER = new CsvMapper();
    private static final CsvSchema SCHEMA = CsvSchema.builder()
            .addColumns(TransactionCsvColumns.EXPORTED, CsvSchema.ColumnType.STRING)
            .build()
            .withHeader();

    public void export(List<Transaction> transactions, Writer out) throws IOException {
        if (transactions.isEmpty()) {
            out.write(String.join(",", TransactionCsvColumns.EXPORTED) + "\n");
            out.flush();
            return;
        }
        try (SequenceWriter writer = CSV_MAPPER.writer(SCHEMA).writeValues(out)) {
            for (Transaction tx : transactions) {
                writer.write(toRow(tx));
            }
        }
    }

    static Map<String, String> toRow(Transaction tx) {
        Map<String, String> row = new LinkedHashMap<>();
        row.put(TransactionCsvColumns.ID, text(tx.getId()));
        row.put(TransactionCsvColumns.WALLET_ID, text(tx.getWalletId()));
        row.put(TransactionCsvColumns.TRANSACTION_TYPE, tx.getType() != null ? tx.getType().wireValue() : "");
        row.put(TransactionCsvColumns.CRYPTO_SYMBOL, text(tx.getSymbol()));
        row.put(TransactionCsvColumns.QUANTITY, decimal(tx.getQuantity()));
        row.put(TransactionCsvColumns.PRICE_PER_UNIT, decimal(tx.getPricePerUnit()));
        row.put(TransactionCsvColumns.FIAT_CURRENCY, text(tx.getFiatCurrency()));
        row.put(TransactionCsvColumns.FEE, decimal(tx.getFee()));
        row.put(TransactionCsvColumns.TRANSACTION_DATE, instant(tx.getTransactionDate()));
        row.put(TransactionCsvColumns.NOTES, text(tx.getNotes()));
        row.put(TransactionCsvColumns.CREATED_AT, instant(tx.getCreatedAt()));
        return row;
    }

    private static String text(String value) {
        return value != null ? value : "";
    }

    private static String decimal(BigDecimal value) {
        return value != null ? value.toPlainString() : "";
    }

    private static String instant(Instant value) {
        return value != null ? value.toString() : "";
    }
}
