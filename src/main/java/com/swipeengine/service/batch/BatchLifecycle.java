package com.swipeengine.service.batch;

import com.swipeengine.config.SwipeEngineProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts the batch coordinator once the application is ready (when
 * auto-start is enabled) and stops it on shutdown.
 */
@Slf4j
@Component
public class BatchLifecycle {

    private final BatchCoordinator coordinator;
    private final SwipeEngineProperties properties;

    public BatchLifecycle(BatchCoordinator coordinator, SwipeEngineProperties properties) {
        this.coordinator = coordinator;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (properties.getBatch().isAutoStart()) {
            coordinator.start();
        } else {
            log.info("Batch auto-start disabled, coordinator left stopped");
        }
    }

    @PreDestroy
    public void onShutdown() {
        coordinator.stop();
    }
}
