package com.cryptoledger.api.controller;

import com.cryptoledger.costbasis.gains.InventoryPosition;
import com.cryptoledger.costbasis.gains.RealizedGainsSummary;
import com.cryptoledger.costbasis.gains.UnrealizedGainsSummary;
import com.cryptoledger.costbasis.query.GainsQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Realized and unrealized gains plus open FIFO inventory, for all wallets or one.
 */
@RestController
@RequestMapping("/api/v1/gains")
@RequiredArgsConstructor
public class GainsController {

    private final GainsQueryService gainsQueryService;

    @GetMapping("/realized")
    public RealizedGainsSummary realized(
            @RequestParam(required = false) Integer year,
            @RequestParam(required = false) String walletId
    ) {
        return gainsQueryService.realizedGains(walletId, year);
    }

    @GetMapping("/unrealized")
    public UnrealizedGainsSummary unrealized(
            @RequestParam(required = false, defaultValue = "USD") String currency,
            @RequestParam(required = false) String walletId
    ) {
        return gainsQueryService.unrealizedGains(walletId, currency);
    }

    @GetMapping("/inventory")
    public List<InventoryPosition> inventory(@RequestParam(required = false) String walletId) {
        return gainsQueryService.inventory(walletId);
    }
}
