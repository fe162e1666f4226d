package com.cryptoledger.api.controller;

import com.cryptoledger.portfolio.DistributionEntry;
import com.cryptoledger.portfolio.PortfolioDistribution;
import com.cryptoledger.portfolio.PortfolioItem;
import com.cryptoledger.portfolio.PortfolioService;
import com.cryptoledger.portfolio.PortfolioValuation;
import com.cryptoledger.portfolio.PortfolioValuePoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.mockito.Mockito.when;

@WebFluxTest(PortfolioController.class)
@Import(ApiExceptionHandler.class)
class PortfolioControllerTest {

    @Autowired
    WebTestClient webTestClient;

    @MockBean
    PortfolioService portfolioService;

    @Test
    @DisplayName("portfolio value is formatted in the requested currency")
    void portfolio() {
        PortfolioItem btc = PortfolioItem.of("BTC", new BigDecimal("0.5"), new BigDecimal("60000"), "USD");
        when(portfolioService.getPortfolioValue(null, "USD"))
                .thenReturn(new PortfolioValuation(btc.currentValue(), "USD", List.of(btc)));

        webTestClient.get()
                .uri("/api/v1/portfolio")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.formattedTotalValue").isEqualTo("$30,000.00")
                .jsonPath("$.items[0].symbol").isEqualTo("BTC");
    }

    @Test
    @DisplayName("distribution lists entries largest first")
    void distribution() {
        when(portfolioService.getPortfolioDistribution("wallet-1", "EUR")).thenReturn(new PortfolioDistribution(
                new BigDecimal("100"), "EUR", List.of(
                new DistributionEntry("BTC", new BigDecimal("75"), new BigDecimal("75.0000")),
                new DistributionEntry("ETH", new BigDecimal("25"), new BigDecimal("25.0000")))));

        webTestClient.get()
                .uri("/api/v1/portfolio/distribution?currency=EUR&walletId=wallet-1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.distribution[0].symbol").isEqualTo("BTC")
                .jsonPath("$.distribution[1].symbol").isEqualTo("ETH");
    }

    @Test
    @DisplayName("history defaults to 30 days")
    void history() {
        when(portfolioService.getHistoricalPortfolioValue(null, 30, "USD")).thenReturn(List.of(
                new PortfolioValuePoint(LocalDate.of(2024, 1, 1), new BigDecimal("1000"))));

        webTestClient.get()
                .uri("/api/v1/portfolio/history")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].date").isEqualTo("2024-01-01")
                .jsonPath("$[0].value").isEqualTo(1000);
    }
}
