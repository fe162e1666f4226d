package com.cryptoledger.common;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Display formatting for fiat amounts: currency symbol prefix, comma grouping, two decimals.
 * JPY and KRW are shown without decimals (truncated). Unknown codes are prefixed with "CODE ".
 */
public final class CurrencyFormatter {

    private static final Map<String, String> SYMBOLS = Map.of(
            "USD", "$",
            "EUR", "€",
            "GBP", "£",
            "JPY", "¥",
            "CNY", "¥",
            "KRW", "₩",
            "INR", "₹",
            "RUB", "₽");

    private static final Set<String> NO_DECIMALS = Set.of("JPY", "KRW");

    private CurrencyFormatter() {
    }

    public static String format(BigDecimal amount, String currency) {
        String code = currency == null || currency.isBlank() ? "USD" : currency.strip().toUpperCase(Locale.ROOT);
        BigDecimal value = amount != null ? amount : BigDecimal.ZERO;
        String prefix = SYMBOLS.getOrDefault(code, code + " ");
        if (NO_DECIMALS.contains(code)) {
            return prefix + pattern("#,##0").format(value.setScale(0, RoundingMode.DOWN));
        }
        return prefix + pattern("#,##0.00").format(value);
    }

    // DecimalFormat is not thread-safe.
    private static DecimalFormat pattern(String pattern) {
        DecimalFormat format = new DecimalFormat(pattern, DecimalFormatSymbols.getInstance(Locale.US));
        format.setRoundingMode(RoundingMode.HALF_UP);
        return format;
    }
}
