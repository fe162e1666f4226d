package com.cryptoledger.costbasis.report;

import com.cryptoledger.costbasis.engine.GainTerm;
import com.cryptoledger.costbasis.engine.RealizedGain;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CsvTaxReportExporterTest {

    private static final String DETAIL_HEADER = "buy_date,sell_date,buy_price,sell_price,quantity,cost_basis,proceeds,"
            + "gain,term,holding_period_days,buy_transaction_id,sell_transaction_id";

    private final CsvTaxReportExporter exporter = new CsvTaxReportExporter(
            Clock.fixed(Instant.parse("2024-02-03T04:05:06Z"), ZoneOffset.UTC));

    private static TaxReport report() {
        RealizedGain gain = new RealizedGain("BTC",
                Instant.parse("2022-01-01T00:00:00Z"), Instant.parse("2023-01-02T00:00:00Z"),
                new BigDecimal("10000"), new BigDecimal("30000"), new BigDecimal("0.5"),
                new BigDecimal("5000.0"), new BigDecimal("15000.0"), new BigDecimal("10000.0"),
                GainTerm.LONG, 366, "b1", "s1");
        return new TaxReport(2023, "usd", BigDecimal.ZERO, new BigDecimal("10000.0"), List.of(gain));
    }

    @Test
    @DisplayName("detail CSV has one row per gain with UTC dates and lowercase term")
    void writesDetail() throws IOException {
        StringWriter out = new StringWriter();

        exporter.writeDetail(report(), out);

        List<String> lines = out.toString().lines().toList();
        assertThat(lines).hasSize(2);
        assertThat(lines.get(0)).isEqualTo(DETAIL_HEADER);
        assertThat(lines.get(1)).isEqualTo("2022-01-01,2023-01-02,10000,30000,0.5,5000.0,15000.0,10000.0,long,366,b1,s1");
    }

    @Test
    @DisplayName("detail CSV of an empty report still has the header")
    void emptyDetailHasHeader() throws IOException {
        StringWriter out = new StringWriter();

        exporter.writeDetail(new TaxReport(2023, "USD", null, null, List.of()), out);

        assertThat(out.toString().lines().toList()).containsExactly(DETAIL_HEADER);
    }

    @Test
    @DisplayName("summary CSV has totals, currency and generation time")
    void writesSummary() throws IOException {
        StringWriter out = new StringWriter();

        exporter.writeSummary(report(), out);

        List<Map<String, String>> rows = readCsv(out.toString());
        assertThat(rows).singleElement().satisfies(row -> {
            assertThat(row).containsEntry("Year", "2023");
            assertThat(row).containsEntry("Short Term Gains", "0");
            assertThat(row).containsEntry("Long Term Gains", "10000.0");
            assertThat(row).containsEntry("Total Gains", "10000.0");
            assertThat(row).containsEntry("Currency", "USD");
            assertThat(row).containsEntry("Generated On", "2024-02-03 04:05:06");
        });
    }

    private static List<Map<String, String>> readCsv(String csv) throws IOException {
        try (MappingIterator<Map<String, String>> it = new CsvMapper().readerFor(Map.class)
                .with(CsvSchema.emptySchema().withHeader())
                .readValues(csv)) {
            return it.readAll();
        }
    }

    @Test
    @DisplayName("file names carry year and currency")
    void fileNames() {
        assertThat(exporter.detailFileName(report())).isEqualTo("crypto_tax_report_2023_USD.csv");
        assertThat(exporter.summaryFileName(report())).isEqualTo("crypto_tax_summary_2023_USD.csv");
    }
}
