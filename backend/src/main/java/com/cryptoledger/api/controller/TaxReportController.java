package com.cryptoledger.api.controller;

import com.cryptoledger.api.dto.TaxReportResponse;
import com.cryptoledger.costbasis.query.GainsQueryService;
import com.cryptoledger.costbasis.report.TaxReport;
import com.cryptoledger.costbasis.report.TaxReportExporter;
import com.cryptoledger.costbasis.report.TransactionSummary;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;

/**
 * Tax report for one year: JSON view, descriptive summary and CSV downloads.
 */
@RestController
@RequestMapping("/api/v1/tax-reports/{year}")
@RequiredArgsConstructor
public class TaxReportController {

    private final GainsQueryService gainsQueryService;
    private final TaxReportExporter taxReportExporter;

    @GetMapping
    public TaxReportResponse report(
            @PathVariable int year,
            @RequestParam(required = false, defaultValue = "USD") String currency,
            @RequestParam(required = false) String walletId
    ) {
        return TaxReportResponse.from(gainsQueryService.taxReport(walletId, year, currency));
    }

    @GetMapping("/summary")
    public TransactionSummary summary(
            @PathVariable int year,
            @RequestParam(required = false, defaultValue = "USD") String currency,
            @RequestParam(required = false) String walletId
    ) {
        return gainsQueryService.taxReportSummary(walletId, year, currency);
    }

    @GetMapping(path = "/export", produces = TransactionController.TEXT_CSV)
    public ResponseEntity<String> exportDetail(
            @PathVariable int year,
            @RequestParam(required = false, defaultValue = "USD") String currency,
            @RequestParam(required = false) String walletId
    ) {
        TaxReport report = gainsQueryService.taxReport(walletId, year, currency);
        StringWriter out = new StringWriter();
        try {
            taxReportExporter.writeDetail(report, out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return attachment(taxReportExporter.detailFileName(report), out.toString());
    }

    @GetMapping(path = "/summary/export", produces = TransactionController.TEXT_CSV)
    public ResponseEntity<String> exportSummary(
            @PathVariable int year,
            @RequestParam(required = false, defaultValue = "USD") String currency,
            @RequestParam(required = false) String walletId
    ) {
        TaxReport report = gainsQueryService.taxReport(walletId, year, currency);
        StringWriter out = new StringWriter();
        try {
            taxReportExporter.writeSummary(report, out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return attachment(taxReportExporter.summaryFileName(report), out.toString());
    }

    private static ResponseEntity<String> attachment(String fileName, String body) {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + fileName + "\"")
                .body(body);
    }
}
