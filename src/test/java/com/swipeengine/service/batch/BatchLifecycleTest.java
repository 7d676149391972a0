package com.swipeengine.service.batch;

import com.swipeengine.config.SwipeEngineProperties;
import org.junit.jupiter.api.Test;

import static org.mockito.Mockito.*;

/**
 * Tests for BatchLifecycle.
 */
class BatchLifecycleTest {

    @Test
    void testAutoStartOnReady() {
        BatchCoordinator coordinator = mock(BatchCoordinator.class);
        BatchLifecycle lifecycle = new BatchLifecycle(coordinator, new SwipeEngineProperties());

        lifecycle.onApplicationReady();
        lifecycle.onShutdown();

        verify(coordinator).start();
        verify(coordinator).stop();
    }

    @Test
    void testAutoStartDisabled() {
        BatchCoordinator coordinator = mock(BatchCoordinator.class);
        SwipeEngineProperties properties = new SwipeEngineProperties();
        properties.getBatch().setAutoStart(false);

        new BatchLifecycle(coordinator, properties).onApplicationReady();

        verify(coordinator, never()).start();
    }
}
