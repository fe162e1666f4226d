package com.cryptoledger.transaction.csv;

import java.util.List;

/**
 * Column names shared by CSV import and export.
 */
final class TransactionCsvColumns {

    static final String ID = "id";
    static final String WALLET_ID = "wallet_id";
    static final String TRANSACTION_TYPE = "transaction_type";
    static final String CRYPTO_SYMBOL = "crypto_symbol";
    static final String QUANTITY = "quantity";
    static final String PRICE_PER_UNIT = "price_per_unit";
    static final String FIAT_CURRENCY = "fiat_currency";
    static final String FEE = "fee";
    static final String TRANSACTION_DATE = "transaction_date";
    static final String NOTES = "notes";
    static final String CREATED_AT = "created_at";

    static final List<String> REQUIRED = List.of(TRANSACTION_TYPE, CRYPTO_SYMBOL, QUANTITY, PRICE_PER_UNIT,
            TRANSACTION_DATE);

    static final List<String> EXPORTED = List.of(ID, WALLET_ID, TRANSACTION_TYPE, CRYPTO_SYMBOL, QUANTITY,
            PRICE_PER_UNIT, FIAT_CURRENCY, FEE, TRANSACTION_DATE, NOTES, CREATED_AT);

    private TransactionCsvColumns() {
    }
}
