package com.aigreentick.services.subscriptions.support;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.mock.http.client.reactive.MockClientHttpRequest;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * In-process stand-in for the Daraja HTTP API, plugged into WebClient as its
 * ExchangeFunction. Responses are queued per path; the last one queued for
 * a path keeps answering once the others are used up.
 */
public class StubDaraja implements ExchangeFunction {

    public static final String BASE_URL = "https://daraja.test";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<String, Deque<Supplier<Mono<ClientResponse>>>> answers = new ConcurrentHashMap<>();
    private final List<Recorded> recorded = Collections.synchronizedList(new ArrayList<>());

    public StubDaraja on(String path, int status, String json) {
        return enqueue(path, () -> Mono.just(ClientResponse.create(HttpStatus.valueOf(status))
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(json)
                .build()));
    }

    public StubDaraja onError(String path, Throwable error) {
        return enqueue(path, () -> Mono.error(error));
    }

    public StubDaraja onNoResponse(String path) {
        return enqueue(path, Mono::never);
    }

    public WebClient webClient() {
        return WebClient.builder()
                .baseUrl(BASE_URL)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .exchangeFunction(this)
                .build();
    }

    public List<Recorded> requestsTo(String path) {
        synchronized (recorded) {
            return recorded.stream().filter(r -> r.path().equals(path)).collect(Collectors.toList());
        }
    }

    @Override
    public Mono<ClientResponse> exchange(ClientRequest request) {
        String path = request.url().getPath();
        recorded.add(new Recorded(path, request.headers(), readBody(request)));

        Deque<Supplier<Mono<ClientResponse>>> queue = answers.get(path);
        if (queue == null || queue.isEmpty()) {
            return Mono.error(new IllegalStateException("No stubbed answer for " + path));
        }
        synchronized (queue) {
            return (queue.size() > 1 ? queue.poll() : queue.peek()).get();
        }
    }

    private StubDaraja enqueue(String path, Supplier<Mono<ClientResponse>> answer) {
        answers.computeIfAbsent(path, p -> new ArrayDeque<>()).add(answer);
        return this;
    }

    private String readBody(ClientRequest request) {
        MockClientHttpRequest sink = new MockClientHttpRequest(request.method(), request.url());
        request.writeTo(sink, ExchangeStrategies.withDefaults()).block();
        return sink.getBodyAsString().defaultIfEmpty("").block();
    }

    public record Recorded(String path, HttpHeaders headers, String body) {

        public JsonNode json() {
            try {
                return MAPPER.readTree(body);
            } catch (IOException ex) {
                throw new UncheckedIOException(ex);
            }
        }
    }
}
