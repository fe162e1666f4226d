package com.cryptoledger.transaction;

import com.cryptoledger.domain.Transaction;
import com.cryptoledger.domain.TransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Store operations on ledger transactions. Every write is validated here; the cost-basis core assumes
 * positive quantities and non-negative prices.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionService {

    public static final String INVALID_TRANSACTION = "INVALID_TRANSACTION";
    public static final String TRANSACTION_NOT_FOUND = "TRANSACTION_NOT_FOUND";
    public static final String INVALID_CSV = "INVALID_CSV";

    private final TransactionRepository transactionRepository;

    /**
     * Validate and persist a new transaction. Currency defaults to USD, fee to zero, date to now.
     *
     * @throws TransactionServiceException INVALID_TRANSACTION on missing type/symbol or bad amounts
     */
    public Transaction addTransaction(TransactionDraft draft) {
        if (draft == null) {
            throw new TransactionServiceException(INVALID_TRANSACTION, "Transaction is required");
        }
        if (draft.type() == null) {
            throw new TransactionServiceException(INVALID_TRANSACTION, "Transaction type is required");
        }
        if (draft.symbol() == null || draft.symbol().isBlank()) {
            throw new TransactionServiceException(INVALID_TRANSACTION, "Symbol is required");
        }
        requirePositiveQuantity(draft.quantity());
        requireNonNegative("Price per unit", draft.pricePerUnit(), true);
        requireNonNegative("Fee", draft.fee(), false);

        Transaction tx = new Transaction();
        tx.setWalletId(draft.walletId());
        tx.setType(draft.type());
        tx.setSymbol(draft.symbol());
        tx.setQuantity(draft.quantity());
        tx.setPricePerUnit(draft.pricePerUnit());
        tx.setFiatCurrency(blankToNull(draft.fiatCurrency()) != null
                ? draft.fiatCurrency() : Transaction.DEFAULT_FIAT_CURRENCY);
        tx.setFee(draft.fee() != null ? draft.fee() : BigDecimal.ZERO);
        tx.setTransactionDate(draft.transactionDate() != null ? draft.transactionDate() : Instant.now());
        tx.setNotes(draft.notes() != null ? draft.notes() : "");
        tx.setCreatedAt(Instant.now());

        Transaction saved = transactionRepository.save(tx);
        log.info("Added {} {} {} (id={})", saved.getType(), saved.getQuantity(), saved.getSymbol(), saved.getId());
        return saved;
    }

    /**
     * Apply the non-null fields of {@code patch} to an existing transaction.
     *
     * @throws TransactionServiceException TRANSACTION_NOT_FOUND if missing; INVALID_TRANSACTION on bad values
     */
    public Transaction updateTransaction(String id, TransactionDraft patch) {
        Transaction tx = transactionRepository.findById(id)
                .orElseThrow(() -> new TransactionServiceException(TRANSACTION_NOT_FOUND, "Transaction not found: " + id));
        if (patch == null) {
            return tx;
        }
        if (patch.walletId() != null) {
            tx.setWalletId(patch.walletId());
        }
        if (patch.type() != null) {
            tx.setType(patch.type());
        }
        if (patch.symbol() != null) {
            if (patch.symbol().isBlank()) {
                throw new TransactionServiceException(INVALID_TRANSACTION, "Symbol must not be blank");
            }
            tx.setSymbol(patch.symbol());
        }
        if (patch.quantity() != null) {
            requirePositiveQuantity(patch.quantity());
            tx.setQuantity(patch.quantity());
        }
        if (patch.pricePerUnit() != null) {
            requireNonNegative("Price per unit", patch.pricePerUnit(), true);
            tx.setPricePerUnit(patch.pricePerUnit());
        }
        if (blankToNull(patch.fiatCurrency()) != null) {
            tx.setFiatCurrency(patch.fiatCurrency());
        }
        if (patch.fee() != null) {
            requireNonNegative("Fee", patch.fee(), true);
            tx.setFee(patch.fee());
        }
        if (patch.transactionDate() != null) {
            tx.setTransactionDate(patch.transactionDate());
        }
        if (patch.notes() != null) {
            tx.setNotes(patch.notes());
        }
        Transaction saved = transactionRepository.save(tx);
        log.info("Updated transaction {}", id);
        return saved;
    }

    /**
     * @return true when a transaction was removed
     */
    public boolean deleteTransaction(String id) {
        if (id == null || !transactionRepository.existsById(id)) {
            return false;
        }
        transactionRepository.deleteById(id);
        log.info("Deleted transaction {}", id);
        return true;
    }

    public List<Transaction> findTransactions(TransactionFilter filter) {
        TransactionFilter f = filter != null ? filter : TransactionFilter.all();
        return transactionRepository.findFiltered(f.walletId(), f.symbol(), f.type(), f.from(), f.to());
    }

    /**
     * Full history in date order, optionally for one wallet. This is the input of every gains computation.
     */
    public List<Transaction> history(String walletId) {
        if (walletId == null || walletId.isBlank()) {
            return transactionRepository.findAllByOrderByTransactionDateAsc();
        }
        return transactionRepository.findByWalletIdOrderByTransactionDateAsc(walletId);
    }

    public List<String> findSymbols() {
        return transactionRepository.findDistinctSymbols().stream().sorted().toList();
    }

    private static void requirePositiveQuantity(BigDecimal quantity) {
        if (quantity == null || quantity.signum() <= 0) {
            throw new TransactionServiceException(INVALID_TRANSACTION, "Quantity must be positive");
        }
    }

    private static void requireNonNegative(String field, BigDecimal value, boolean required) {
        if (value == null) {
            if (required) {
                throw new TransactionServiceException(INVALID_TRANSACTION, field + " is required");
            }
            return;
        }
        if (value.signum() < 0) {
            throw new TransactionServiceException(INVALID_TRANSACTION, field + " must not be negative");
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
