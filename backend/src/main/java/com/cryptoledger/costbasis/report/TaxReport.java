package com.cryptoledger.costbasis.report;

import com.cryptoledger.costbasis.engine.InventoryShortfall;
import com.cryptoledger.costbasis.engine.RealizedGain;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;

/**
 * Capital gains report for one tax year and reporting currency. Built fresh per request and never
 * modified; the total is derived from the two term totals.
 */
@Getter
public class TaxReport {

    private final int year;
    private final String fiatCurrency;
    private final BigDecimal shortTermGains;
    private final BigDecimal longTermGains;
    private final List<RealizedGain> transactions;
    /** Disposals in this year that sold more than was held; their matched part is in {@link #transactions}. */
    private final List<InventoryShortfall> shortfalls;

    public TaxReport(int year, String fiatCurrency, BigDecimal shortTermGains, BigDecimal longTermGains,
                     List<RealizedGain> transactions) {
        this(year, fiatCurrency, shortTermGains, longTermGains, transactions, List.of());
    }

    public TaxReport(int year, String fiatCurrency, BigDecimal shortTermGains, BigDecimal longTermGains,
                     List<RealizedGain> transactions, List<InventoryShortfall> shortfalls) {
        this.year = year;
        this.fiatCurrency = fiatCurrency == null ? "USD" : fiatCurrency.strip().toUpperCase(Locale.ROOT);
        this.shortTermGains = shortTermGains != null ? shortTermGains : BigDecimal.ZERO;
        this.longTermGains = longTermGains != null ? longTermGains : BigDecimal.ZERO;
        this.transactions = transactions == null ? List.of() : List.copyOf(transactions);
        this.shortfalls = shortfalls == null ? List.of() : List.copyOf(shortfalls);
    }

    public BigDecimal getTotalGains() {
        return shortTermGains.add(longTermGains);
    }
}
