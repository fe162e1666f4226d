package com.cryptoledger.costbasis.report;

import com.cryptoledger.costbasis.engine.RealizedGain;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.Instant;

/**
 * CSV exporter for tax reports (Jackson CSV). Dates are written as yyyy-MM-dd in UTC; the header row is
 * always present, also for reports without transactions.
 */
@Component
public class CsvTaxReportExporter implements TaxReportExporter {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ISO_LOCAL_DATE;
    private static final DateTimeFormatter GENERATED_ON = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final CsvMapper CSV_MAPPER = new CsvMapper();
    private static final CsvSchema DETAIL_SCHEMA = CSV_MAPPER.schemaFor(DetailRow.class).withHeader();
    private static final CsvSchema SUMMARY_SCHEMA = CSV_MAPPER.schemaFor(SummaryRow.class).withHeader();

    private final Clock clock;

    public CsvTaxReportExporter() {
        this(Clock.systemUTC());
    }

    CsvTaxReportExporter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void writeDetail(TaxReport report, Writer out) throws IOException {
        if (report.getTransactions().isEmpty()) {
            // Jackson only emits the header together with the first row.
            out.write(String.join(",", DetailRow.COLUMNS) + "\n");
            out.flush();
            return;
        }
        try (SequenceWriter writer = CSV_MAPPER.writer(DETAIL_SCHEMA).writeValues(out)) {
            for (RealizedGain gain : report.getTransactions()) {
                writer.write(DetailRow.of(gain));
            }
        }
    }

    @Override
    public void writeSummary(TaxReport report, Writer out) throws IOException {
        SummaryRow row = new SummaryRow(
                report.getYear(),
                report.getShortTermGains().toPlainString(),
                report.getLongTermGains().toPlainString(),
                report.getTotalGains().toPlainString(),
                report.getFiatCurrency(),
                LocalDateTime.now(clock).format(GENERATED_ON));
        try (SequenceWriter writer = CSV_MAPPER.writer(SUMMARY_SCHEMA).writeValues(out)) {
            writer.write(row);
        }
    }

    @Override
    public String detailFileName(TaxReport report) {
        return "crypto_tax_report_" + report.getYear() + "_" + report.getFiatCurrency() + ".csv";
    }

    @Override
    public String summaryFileName(TaxReport report) {
        return "crypto_tax_summary_" + report.getYear() + "_" + report.getFiatCurrency() + ".csv";
    }

    private static String date(Instant instant) {
        return instant == null ? "" : instant.atZone(ZoneOffset.UTC).toLocalDate().format(DATE);
    }

    @JsonPropertyOrder({"buy_date", "sell_date", "buy_price", "sell_price", "quantity", "cost_basis", "proceeds",
            "gain", "term", "holding_period_days", "buy_transaction_id", "sell_transaction_id"})
    record DetailRow(
            @JsonProperty("buy_date") String buyDate,
            @JsonProperty("sell_date") String sellDate,
            @JsonProperty("buy_price") String buyPrice,
            @JsonProperty("sell_price") String sellPrice,
            @JsonProperty("quantity") String quantity,
            @JsonProperty("cost_basis") String costBasis,
            @JsonProperty("proceeds") String proceeds,
            @JsonProperty("gain") String gain,
            @JsonProperty("term") String term,
            @JsonProperty("holding_period_days") long holdingPeriodDays,
            @JsonProperty("buy_transaction_id") String buyTransactionId,
            @JsonProperty("sell_transaction_id") String sellTransactionId
    ) {
        static final String[] COLUMNS = {"buy_date", "sell_date", "buy_price", "sell_price", "quantity", "cost_basis",
                "proceeds", "gain", "term", "holding_period_days", "buy_transaction_id", "sell_transaction_id"};

        static DetailRow of(RealizedGain gain) {
            return new DetailRow(
                    date(gain.buyDate()),
                    date(gain.sellDate()),
                    gain.buyPrice().toPlainString(),
                    gain.sellPrice().toPlainString(),
                    gain.quantity().toPlainString(),
                    gain.costBasis().toPlainString(),
                    gain.proceeds().toPlainString(),
                    gain.gain().toPlainString(),
                    gain.term().label(),
                    gain.holdingPeriodDays(),
                    gain.buyTransactionId(),
                    gain.sellTransactionId());
        }
    }

    @JsonPropertyOrder({"Year", "Short Term Gains", "Long Term Gains", "Total Gains", "Currency", "Generated On"})
    record SummaryRow(
            @JsonProperty("Year") int year,
            @JsonProperty("Short Term Gains") String shortTermGains,
            @JsonProperty("Long Term Gains") String longTermGains,
            @JsonProperty("Total Gains") String totalGains,
            @JsonProperty("Currency") String currency,
            @JsonProperty("Generated On") String generatedOn
    ) {
    }
}
