package com.cryptoledger.pricing;

import com.cryptoledger.common.RateLimiter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.Map;
import java.util.Optional;

/**
 * Blocking GET against the CoinGecko API. Every call passes the rate limiter; HTTP and parse failures are logged
 * and reported as an empty result.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CoinGeckoClient {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    private final WebClient coingeckoWebClient;
    private final RateLimiter coingeckoRateLimiter;

    public Optional<JsonNode> get(String path, Map<String, String> queryParams) {
        coingeckoRateLimiter.acquire();
        try {
            String response = coingeckoWebClient.get()
                    .uri(uriBuilder -> {
                        uriBuilder.path(path);
                        queryParams.forEach((name, value) -> uriBuilder.queryParam(name, value));
                        return uriBuilder.build();
                    })
                    .retrieve()
                    .bodyToMono(String.class)
                    .block();
            if (response == null || response.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(MAPPER.readTree(response));
        } catch (WebClientResponseException e) {
            log.warn("CoinGecko {} failed: {} {}", path, e.getStatusCode(), e.getMessage());
            return Optional.empty();
        } catch (Exception e) {
            log.warn("CoinGecko {} error: {}", path, e.getMessage());
            return Optional.empty();
        }
    }
}
