package com.cryptoledger.api.controller;

import com.cryptoledger.api.dto.PortfolioValuationResponse;
import com.cryptoledger.portfolio.PortfolioDistribution;
import com.cryptoledger.portfolio.PortfolioService;
import com.cryptoledger.portfolio.PortfolioValuePoint;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/portfolio")
@RequiredArgsConstructor
public class PortfolioController {

    private final PortfolioService portfolioService;

    @GetMapping
    public PortfolioValuationResponse portfolio(
            @RequestParam(required = false, defaultValue = "USD") String currency,
            @RequestParam(required = false) String walletId
    ) {
        return PortfolioValuationResponse.from(portfolioService.getPortfolioValue(walletId, currency));
    }

    @GetMapping("/distribution")
    public PortfolioDistribution distribution(
            @RequestParam(required = false, defaultValue = "USD") String currency,
            @RequestParam(required = false) String walletId
    ) {
        return portfolioService.getPortfolioDistribution(walletId, currency);
    }

    @GetMapping("/history")
    public List<PortfolioValuePoint> history(
            @RequestParam(required = false, defaultValue = "30") int days,
            @RequestParam(required = false, defaultValue = "USD") String currency,
            @RequestParam(required = false) String walletId
    ) {
        return portfolioService.getHistoricalPortfolioValue(walletId, days, currency);
    }
}
