package com.cryptoledger.api.controller;

import com.cryptoledger.api.dto.CreateTransactionRequest;
import com.cryptoledger.api.dto.TransactionResponse;
import com.cryptoledger.api.dto.UpdateTransactionRequest;
import com.cryptoledger.domain.Transaction;
import com.cryptoledger.domain.TransactionType;
import com.cryptoledger.transaction.TransactionFilter;
import com.cryptoledger.transaction.TransactionService;
import com.cryptoledger.transaction.csv.CsvImportResult;
import com.cryptoledger.transaction.csv.TransactionCsvExporter;
import com.cryptoledger.transaction.csv.TransactionCsvImporter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.List;

/**
 * Transaction store API: CRUD, symbol list, CSV import and export.
 */
@RestController
@RequestMapping("/api/v1/transactions")
@RequiredArgsConstructor
public class TransactionController {

    static final String TEXT_CSV = "text/csv";

    private final TransactionService transactionService;
    private final TransactionCsvImporter transactionCsvImporter;
    private final TransactionCsvExporter transactionCsvExporter;

    @PostMapping
    public ResponseEntity<TransactionResponse> create(@Valid @RequestBody CreateTransactionRequest request) {
        Transaction saved = transactionService.addTransaction(request.toDraft());
        return ResponseEntity.status(HttpStatus.CREATED).body(TransactionResponse.from(saved));
    }

    @GetMapping
    public List<TransactionResponse> list(
            @RequestParam(required = false) String walletId,
            @RequestParam(required = false) String symbol,
            @RequestParam(required = false) String type,
            @RequestParam(required = false) Instant from,
            @RequestParam(required = false) Instant to
    ) {
        TransactionType txType = type == null || type.isBlank() ? null : TransactionType.fromWireValue(type);
        return transactionService.findTransactions(new TransactionFilter(walletId, symbol, txType, from, to)).stream()
                .map(TransactionResponse::from)
                .toList();
    }

    @PutMapping("/{id}")
    public TransactionResponse update(@PathVariable String id, @Valid @RequestBody UpdateTransactionRequest request) {
        return TransactionResponse.from(transactionService.updateTransaction(id, request.toDraft()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        return transactionService.deleteTransaction(id)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @GetMapping("/symbols")
    public List<String> symbols() {
        return transactionService.findSymbols();
    }

    @PostMapping(path = "/import", consumes = TEXT_CSV)
    public CsvImportResult importCsv(@RequestParam(required = false) String walletId, @RequestBody String csv) {
        return transactionCsvImporter.importCsv(new StringReader(csv), walletId);
    }

    @GetMapping(path = "/export", produces = TEXT_CSV)
    public ResponseEntity<String> exportCsv(@RequestParam(required = false) String walletId) {
        StringWriter out = new StringWriter();
        try {
            transactionCsvExporter.export(transactionService.findTransactions(TransactionFilter.forWallet(walletId)), out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"transactions.csv\"")
                .body(out.toString());
    }
}
