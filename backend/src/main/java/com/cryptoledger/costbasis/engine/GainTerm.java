package com.cryptoledger.costbasis.engine;

import java.util.Locale;

/**
 * Holding-period classification of a realized gain. A lot held exactly 365 days is still short term.
 */
public enum GainTerm {
    SHORT,
    LONG;

    public static final long LONG_TERM_THRESHOLD_DAYS = 365;

    public static GainTerm forHoldingPeriod(long holdingPeriodDays) {
        return holdingPeriodDays > LONG_TERM_THRESHOLD_DAYS ? LONG : SHORT;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
