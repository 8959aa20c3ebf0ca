package com.underwriting.propertydata.client;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Scripted {@link ExchangeFunction}: answers requests with queued responses in order,
 * repeating the last one, and records every request it sees.
 */
final class StubExchange implements ExchangeFunction {

    private final Deque<Supplier<Mono<ClientResponse>>> responses = new ArrayDeque<>();
    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();

    StubExchange json(String body) {
        return json(HttpStatus.OK, body);
    }

    StubExchange json(HttpStatus status, String body) {
        responses.add(() -> Mono.just(ClientResponse.create(status)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body(body)
            .build()));
        return this;
    }

    /** A 200 JSON response that arrives after {@code delay}. */
    StubExchange jsonAfter(Duration delay, String body) {
        responses.add(() -> Mono.delay(delay).map(tick -> ClientResponse.create(HttpStatus.OK)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body(body)
            .build()));
        return this;
    }

    StubExchange status(HttpStatus status) {
        responses.add(() -> Mono.just(ClientResponse.create(status).build()));
        return this;
    }

    /** A request that never answers; only a timeout or cancellation ends it. */
    StubExchange hang() {
        responses.add(Mono::never);
        return this;
    }

    @Override
    public synchronized Mono<ClientResponse> exchange(ClientRequest request) {
        requests.add(request);
        Supplier<Mono<ClientResponse>> next = responses.size() > 1 ? responses.poll() : responses.peek();
        if (next == null) {
            return Mono.error(new IllegalStateException("no response scripted for " + request.url()));
        }
        return next.get();
    }

    WebClient client() {
        return WebClient.builder()
            .baseUrl("http://stub.local")
            .exchangeFunction(this)
            .build();
    }

    List<ClientRequest> requests() {
        return requests;
    }

    ClientRequest lastRequest() {
        return requests.get(requests.size() - 1);
    }
}
