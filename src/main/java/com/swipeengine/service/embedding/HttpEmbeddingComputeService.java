package com.swipeengine.service.embedding;

import com.swipeengine.config.SwipeEngineProperties;
import com.swipeengine.model.EntityType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Locale;

/**
 * Embedding compute client for the remote embedding service.
 *
 * Endpoint: POST {baseUrl}/embeddings/{users|posts}/{id}/refresh
 *
 * Timeouts, connection failures and 5xx responses are retried with backoff;
 * 4xx responses fail immediately.
 */
@Slf4j
public class HttpEmbeddingComputeService implements EmbeddingComputeService {

    private final WebClient webClient;
    private final SwipeEngineProperties.ComputeConfig config;

    public HttpEmbeddingComputeService(WebClient webClient, SwipeEngineProperties.ComputeConfig config) {
        this.webClient = webClient;
        this.config = config;
    }

    @Override
    public Mono<Void> refreshEmbedding(EntityType entityType, String entityId) {
        Mono<Void> request = webClient.post()
                .uri(config.getBaseUrl() + "/embeddings/{collection}/{id}/refresh",
                        entityType.getCollection(), entityId)
                .retrieve()
                .toBodilessEntity()
                .then();

        return executeWithRetry(request)
                .doOnSuccess(ignored -> log.debug("Refreshed {} embedding {}", entityType, entityId));
    }

    /**
     * Execute request with retry logic.
     */
    protected Mono<Void> executeWithRetry(Mono<Void> request) {
        return request
                .retryWhen(Retry.backoff(config.getMaxRetries(), config.getRetryBackoff())
                        .maxBackoff(Duration.ofSeconds(10))
                        .filter(this::isRetryable)
                        .onRetryExhaustedThrow((retryBackoffSpec, signal) -> signal.failure()));
    }

    /**
     * Check if an error is retryable.
     */
    protected boolean isRetryable(Throwable throwable) {
        if (throwable instanceof WebClientResponseException responseException) {
            return responseException.getStatusCode().is5xxServerError();
        }

        String message = throwable.getMessage();
        if (message == null) {
            return false;
        }

        String lower = message.toLowerCase(Locale.ROOT);
        return lower.contains("timeout") || lower.contains("connection");
    }
}
