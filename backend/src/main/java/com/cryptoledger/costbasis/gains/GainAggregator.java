package com.cryptoledger.costbasis.gains;

import com.cryptoledger.costbasis.engine.FifoMatchingEngine;
import com.cryptoledger.costbasis.engine.GainTerm;
import com.cryptoledger.costbasis.engine.MatchingResult;
import com.cryptoledger.costbasis.engine.RealizedGain;
import com.cryptoledger.costbasis.lot.Inventory;
import com.cryptoledger.domain.Transaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns FIFO engine output into realized (by tax year and term) and unrealized (against current prices)
 * summaries. Every call re-runs the engine over the full history it is given. Tax years are UTC calendar years.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GainAggregator {

    private final FifoMatchingEngine fifoMatchingEngine;

    /**
     * Realized gains whose sell date falls in {@code year}; all years when {@code year} is null.
     */
    public RealizedGainsSummary calculateRealizedGains(List<Transaction> transactions, Integer year) {
        MatchingResult result = fifoMatchingEngine.processTransactions(transactions);

        BigDecimal shortTerm = BigDecimal.ZERO;
        BigDecimal longTerm = BigDecimal.ZERO;
        List<RealizedGain> matching = new ArrayList<>();
        for (RealizedGain gain : result.allRealizedGains()) {
            if (year != null && gain.sellDate().atZone(ZoneOffset.UTC).getYear() != year) {
                continue;
            }
            if (gain.term() == GainTerm.SHORT) {
                shortTerm = shortTerm.add(gain.gain());
            } else {
                longTerm = longTerm.add(gain.gain());
            }
            matching.add(gain);
        }
        return new RealizedGainsSummary(shortTerm, longTerm, shortTerm.add(longTerm), matching, result.shortfalls());
    }

    /**
     * Unrealized gain for each held symbol that has a price in {@code currentPrices}. Symbols without a price
     * are left out of the result and the total.
     */
    public UnrealizedGainsSummary calculateUnrealizedGains(List<Transaction> transactions,
                                                           Map<String, BigDecimal> currentPrices) {
        Inventory inventory = fifoMatchingEngine.processTransactions(transactions).residualInventory();
        Map<String, UnrealizedPosition> bySymbol = new LinkedHashMap<>();
        BigDecimal total = BigDecimal.ZERO;

        for (InventoryPosition position : positions(inventory)) {
            BigDecimal currentPrice = currentPrices == null ? null : currentPrices.get(position.symbol());
            if (currentPrice == null) {
                log.debug("No current price for {}; excluded from unrealized gains", position.symbol());
                continue;
            }
            BigDecimal marketValue = position.quantity().multiply(currentPrice);
            BigDecimal costBasis = position.quantity().multiply(position.averageCost());
            BigDecimal unrealized = marketValue.subtract(costBasis);
            bySymbol.put(position.symbol(), new UnrealizedPosition(position.symbol(), position.quantity(),
                    position.averageCost(), currentPrice, marketValue, costBasis, unrealized));
            total = total.add(unrealized);
        }
        return new UnrealizedGainsSummary(bySymbol, total);
    }

    /**
     * Open holdings after replaying all transactions, only symbols with a positive quantity.
     */
    public List<InventoryPosition> currentInventory(List<Transaction> transactions) {
        return positions(fifoMatchingEngine.processTransactions(transactions).residualInventory());
    }

    private static List<InventoryPosition> positions(Inventory inventory) {
        List<InventoryPosition> positions = new ArrayList<>();
        for (String symbol : inventory.symbols()) {
            BigDecimal quantity = inventory.quantity(symbol);
            if (quantity.signum() > 0) {
                positions.add(new InventoryPosition(symbol, quantity, inventory.averageCost(symbol), inventory.lots(symbol)));
            }
        }
        return positions;
    }
}
