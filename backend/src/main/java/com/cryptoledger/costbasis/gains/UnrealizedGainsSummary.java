package com.cryptoledger.costbasis.gains;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unrealized gains per priced symbol; the total covers only symbols present in {@link #bySymbol()}.
 */
public record UnrealizedGainsSummary(Map<String, UnrealizedPosition> bySymbol, BigDecimal totalUnrealizedGain) {

    public UnrealizedGainsSummary {
        bySymbol = Collections.unmodifiableMap(new LinkedHashMap<>(bySymbol));
    }
}
