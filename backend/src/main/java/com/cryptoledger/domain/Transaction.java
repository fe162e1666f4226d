package com.cryptoledger.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;

/**
 * Ledger transaction as recorded by the user. Source of truth for every cost-basis computation;
 * lots, inventory and gains are always recomputed from these. Monetary/quantity fields are BigDecimal.
 */
@Document(collection = "transactions")
@CompoundIndexes({
    @CompoundIndex(name = "wallet_date", def = "{'walletId': 1, 'transactionDate': 1}"),
    @CompoundIndex(name = "symbol_date", def = "{'symbol': 1, 'transactionDate': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Transaction {

    public static final String DEFAULT_FIAT_CURRENCY = "USD";

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String walletId;
    private TransactionType type;
    /** Uppercase asset ticker. */
    private String symbol;
    private BigDecimal quantity;
    /** Unit price in {@link #fiatCurrency}. */
    private BigDecimal pricePerUnit;
    private String fiatCurrency = DEFAULT_FIAT_CURRENCY;
    private BigDecimal fee = BigDecimal.ZERO;
    private Instant transactionDate;
    private String notes = "";
    private Instant createdAt;

    public void setSymbol(String symbol) {
        this.symbol = symbol == null ? null : symbol.strip().toUpperCase(Locale.ROOT);
    }

    public void setFiatCurrency(String fiatCurrency) {
        this.fiatCurrency = fiatCurrency == null ? null : fiatCurrency.strip().toUpperCase(Locale.ROOT);
    }

    /** quantity × pricePerUnit, zero when either is missing. */
    public BigDecimal getTotalCost() {
        if (quantity == null || pricePerUnit == null) {
            return BigDecimal.ZERO;
        }
        return quantity.multiply(pricePerUnit);
    }

    public BigDecimal getTotalWithFee() {
        return getTotalCost().add(fee != null ? fee : BigDecimal.ZERO);
    }
}
