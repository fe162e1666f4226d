package com.cryptoledger.pricing;

import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Canned CoinGecko responses keyed by request path; unknown paths answer 404. Records every request URI.
 */
class CoinGeckoStub {

    private final Map<String, String> bodies = new HashMap<>();
    private final Map<String, HttpStatus> statuses = new HashMap<>();
    final List<String> requests = new ArrayList<>();

    CoinGeckoStub respond(String path, String json) {
        bodies.put(path, json);
        return this;
    }

    CoinGeckoStub fail(String path, HttpStatus status) {
        statuses.put(path, status);
        return this;
    }

    WebClient webClient() {
        return WebClient.builder()
                .baseUrl("http://coingecko.test/api/v3")
                .exchangeFunction(this::exchange)
                .build();
    }

    long requestsTo(String path) {
        return requests.stream().filter(uri -> uri.contains(path)).count();
    }

    private Mono<ClientResponse> exchange(ClientRequest request) {
        requests.add(request.url().toString());
        String path = request.url().getPath().replaceFirst("^/api/v3", "");
        HttpStatus status = statuses.get(path);
        if (status != null) {
            return Mono.just(ClientResponse.create(status).build());
        }
        String body = bodies.get(path);
        if (body == null) {
            return Mono.just(ClientResponse.create(HttpStatus.NOT_FOUND).build());
        }
        return Mono.just(ClientResponse.create(HttpStatus.OK)
                .header("Content-Type", "application/json")
                .body(body)
                .build());
    }
}
