package com.geochat.routing.client;

import com.geochat.routing.TestFixtures;
import com.geochat.routing.config.RoutingProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class SimilarityClientTest {

    private RoutingProperties properties;

    @BeforeEach
    void setUp() {
        properties = TestFixtures.properties();
        properties.getSemantic().setEnabled(true);
        properties.getSemantic().setUrl("http://similarity.local/score");
    }

    @Test
    @DisplayName("Should be unconfigured when disabled or without a URL")
    void isConfigured_shouldRequireFlagAndUrl() {
        SimilarityClient client = client(request -> Mono.error(new AssertionError("no call expected")));
        assertTrue(client.isConfigured());

        properties.getSemantic().setUrl(" ");
        assertFalse(client.isConfigured());

        properties.getSemantic().setUrl("http://similarity.local/score");
        properties.getSemantic().setEnabled(false);
        assertFalse(client.isConfigured());
        assertThrows(IllegalStateException.class, () -> client.score("q", List.of("/a")));
    }

    @Test
    @DisplayName("Should post the query and candidate ids and read the scores")
    void score_shouldReadScores() {
        AtomicReference<String> method = new AtomicReference<>();
        SimilarityClient client = client(request -> {
            method.set(request.method().name() + " " + request.url());
            return Mono.just(json(HttpStatus.OK, "{\"scores\": {\"/a\": 0.8, \"/b\": 0.1}}"));
        });

        Map<String, Double> scores = client.score("compare brands", List.of("/a", "/b"));

        assertEquals("POST http://similarity.local/score", method.get());
        assertEquals(0.8, scores.get("/a"), 1e-9);
        assertEquals(0.1, scores.get("/b"), 1e-9);
    }

    @Test
    @DisplayName("Should fail on an error status")
    void score_shouldFailOnServerError() {
        SimilarityClient client = client(request -> Mono.just(json(HttpStatus.INTERNAL_SERVER_ERROR, "{}")));

        assertThrows(RuntimeException.class, () -> client.score("q", List.of("/a")));
    }

    @Test
    @DisplayName("Should fail when the response has no scores")
    void score_shouldFailOnEmptyBody() {
        SimilarityClient client = client(request -> Mono.just(json(HttpStatus.OK, "{}")));

        assertThrows(IllegalStateException.class, () -> client.score("q", List.of("/a")));
    }

    @Test
    @DisplayName("Should time out a slow backend")
    void score_shouldTimeOut() {
        properties.getSemantic().setTimeoutMs(50);
        SimilarityClient client = client(request -> Mono.just(json(HttpStatus.OK, "{\"scores\": {}}"))
                .delayElement(Duration.ofSeconds(2)));

        assertThrows(RuntimeException.class, () -> client.score("q", List.of("/a")));
    }

    private SimilarityClient client(ExchangeFunction exchange) {
        return new SimilarityClient(properties, WebClient.builder().exchangeFunction(exchange));
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }
}
