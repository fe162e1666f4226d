package com.cryptoledger.costbasis.report;

import java.io.IOException;
import java.io.Writer;

/**
 * Writes a tax report to an external format. Implementations own all I/O.
 */
public interface TaxReportExporter {

    /** One row per realized gain. */
    void writeDetail(TaxReport report, Writer out) throws IOException;

    /** Single row with the report totals. */
    void writeSummary(TaxReport report, Writer out) throws IOException;

    String detailFileName(TaxReport report);

    String summaryFileName(TaxReport report);
}
