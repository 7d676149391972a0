package com.swipeengine.service.batch;

import com.swipeengine.model.EntityType;
import com.swipeengine.model.RefreshSummary;
import com.swipeengine.repository.IdSource;
import com.swipeengine.service.embedding.EmbeddingComputeService;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * System-wide embedding refresh: walks every id of an entity type and asks
 * the compute service to refresh its embedding.
 *
 * Ids are paged until the source is exhausted or maxItemsPerRun ids have
 * been processed. Within a page, refreshes run concurrently and the page
 * waits for all of them to settle. A failed refresh is logged and counted
 * without aborting the pass; id source errors propagate.
 */
@Slf4j
public class EmbeddingRefresher {

    private final EmbeddingComputeService computeService;
    private final Map<EntityType, IdSource> idSources;
    private final int batchSize;
    private final int maxItemsPerRun;
    private final int concurrency;

    public EmbeddingRefresher(EmbeddingComputeService computeService,
                              Map<EntityType, IdSource> idSources,
                              int batchSize,
                              int maxItemsPerRun,
                              int concurrency) {
        if (computeService == null) {
            throw new IllegalArgumentException("Embedding compute service is required");
        }
        if (batchSize <= 0 || maxItemsPerRun <= 0 || concurrency <= 0) {
            throw new IllegalArgumentException(String.format(
                    "batchSize (%d), maxItemsPerRun (%d) and concurrency (%d) must be positive",
                    batchSize, maxItemsPerRun, concurrency));
        }
        this.computeService = computeService;
        this.idSources = Map.copyOf(idSources);
        this.batchSize = batchSize;
        this.maxItemsPerRun = maxItemsPerRun;
        this.concurrency = concurrency;
    }

    public boolean supports(EntityType entityType) {
        return idSources.containsKey(entityType);
    }

    public RefreshSummary refreshUsers() {
        return refresh(EntityType.USER);
    }

    public RefreshSummary refreshPosts() {
        return refresh(EntityType.POST);
    }

    /**
     * Refresh the embeddings of one entity type.
     *
     * @param entityType population to refresh
     * @return number of ids processed and how many refreshes succeeded or failed
     */
    public RefreshSummary refresh(EntityType entityType) {
        IdSource idSource = idSources.get(entityType);
        if (idSource == null) {
            throw new IllegalStateException("No id source configured for " + entityType);
        }

        log.info("Starting {} embedding refresh in batches of {}", entityType, batchSize);
        long startTime = System.currentTimeMillis();

        int offset = 0;
        int processed = 0;
        int succeeded = 0;

        while (processed < maxItemsPerRun) {
            int limit = Math.min(batchSize, maxItemsPerRun - processed);
            List<String> ids = idSource.findAllIds(limit, offset);

            if (ids == null || ids.isEmpty()) {
                break;
            }
            if (ids.size() > limit) {
                log.warn("Id source returned {} {} ids for a limit of {}, ignoring the excess",
                        ids.size(), entityType, limit);
                ids = ids.subList(0, limit);
            }

            int pageSucceeded = refreshPage(entityType, ids);

            succeeded += pageSucceeded;
            processed += ids.size();
            offset += ids.size();

            log.info("Processed batch of {} {} ids, {} embeddings refreshed", ids.size(), entityType, pageSucceeded);

            if (ids.size() < limit) {
                break;
            }
        }

        RefreshSummary summary = RefreshSummary.builder()
                .entityType(entityType)
                .processed(processed)
                .succeeded(succeeded)
                .failed(processed - succeeded)
                .durationMs(System.currentTimeMillis() - startTime)
                .build();

        if (processed >= maxItemsPerRun) {
            log.info("Stopped {} embedding refresh at the limit of {} items per run", entityType, maxItemsPerRun);
        }
        log.info("{} embedding refresh finished: {} processed, {} failed in {}ms",
                entityType, summary.getProcessed(), summary.getFailed(), summary.getDurationMs());

        return summary;
    }

    /**
     * Refresh one page concurrently and count the successes.
     */
    private int refreshPage(EntityType entityType, List<String> ids) {
        Long successes = Flux.fromIterable(ids)
                .flatMap(id -> refreshOne(entityType, id), concurrency)
                .filter(Boolean::booleanValue)
                .count()
                .block();
        return successes == null ? 0 : successes.intValue();
    }

    private Mono<Boolean> refreshOne(EntityType entityType, String id) {
        return Mono.defer(() -> computeService.refreshEmbedding(entityType, id))
                .thenReturn(Boolean.TRUE)
                .onErrorResume(error -> {
                    log.error("Failed to refresh embedding for {} {}: {}", entityType, id, error.getMessage());
                    return Mono.just(Boolean.FALSE);
                });
    }
}
