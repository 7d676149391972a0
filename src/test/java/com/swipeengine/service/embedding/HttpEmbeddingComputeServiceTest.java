package com.swipeengine.service.embedding;

import com.swipeengine.config.SwipeEngineProperties;
import com.swipeengine.model.EntityType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for HttpEmbeddingComputeService.
 */
class HttpEmbeddingComputeServiceTest {

    private SwipeEngineProperties.ComputeConfig config;
    private List<ClientRequest> requests;

    @BeforeEach
    void setUp() {
        config = new SwipeEngineProperties.ComputeConfig();
        config.setBaseUrl("http://compute.test");
        config.setMaxRetries(2);
        config.setRetryBackoff(Duration.ofMillis(1));
        requests = new ArrayList<>();
    }

    private HttpEmbeddingComputeService serviceRespondingWith(HttpStatus status) {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(ClientResponse.create(status).build());
                })
                .build();
        return new HttpEmbeddingComputeService(webClient, config);
    }

    @Test
    void testPostsToRefreshEndpoint() {
        HttpEmbeddingComputeService service = serviceRespondingWith(HttpStatus.OK);

        StepVerifier.create(service.refreshEmbedding(EntityType.USER, "u1")).verifyComplete();
        StepVerifier.create(service.refreshPostEmbedding("p9")).verifyComplete();

        assertEquals(2, requests.size());
        assertEquals(HttpMethod.POST, requests.get(0).method());
        assertEquals("http://compute.test/embeddings/users/u1/refresh", requests.get(0).url().toString());
        assertEquals("http://compute.test/embeddings/posts/p9/refresh", requests.get(1).url().toString());
    }

    @Test
    void testClientErrorIsNotRetried() {
        HttpEmbeddingComputeService service = serviceRespondingWith(HttpStatus.NOT_FOUND);

        StepVerifier.create(service.refreshEmbedding(EntityType.POST, "missing"))
                .expectError(WebClientResponseException.NotFound.class)
                .verify(Duration.ofSeconds(5));

        assertEquals(1, requests.size());
    }

    @Test
    void testServerErrorIsRetried() {
        HttpEmbeddingComputeService service = serviceRespondingWith(HttpStatus.SERVICE_UNAVAILABLE);

        StepVerifier.create(service.refreshEmbedding(EntityType.POST, "p1"))
                .expectError(WebClientResponseException.ServiceUnavailable.class)
                .verify(Duration.ofSeconds(5));

        assertEquals(3, requests.size());
    }

    @Test
    void testRetryableErrors() {
        HttpEmbeddingComputeService service = serviceRespondingWith(HttpStatus.OK);

        assertTrue(service.isRetryable(new IllegalStateException("Connection refused")));
        assertTrue(service.isRetryable(new IllegalStateException("Read timeout")));
        assertFalse(service.isRetryable(new IllegalArgumentException("bad id")));
        assertFalse(service.isRetryable(new IllegalStateException()));
    }

    @Test
    void testRetryableErrorsIndependentOfDefaultLocale() {
        HttpEmbeddingComputeService service = serviceRespondingWith(HttpStatus.OK);
        Locale previous = Locale.getDefault();
        try {
            Locale.setDefault(Locale.forLanguageTag("tr-TR"));

            assertTrue(service.isRetryable(new IllegalStateException("CONNECTION RESET")));
            assertTrue(service.isRetryable(new IllegalStateException("READ TIMEOUT")));
        } finally {
            Locale.setDefault(previous);
        }
    }
}
