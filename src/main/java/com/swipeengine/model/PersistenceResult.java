package com.swipeengine.model;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * Outcome of a best-effort write. A failure carries the error instead of
 * throwing it.
 */
public final class PersistenceResult {

    private static final PersistenceResult SUCCESS = new PersistenceResult(null);

    private final RuntimeException error;

    private PersistenceResult(RuntimeException error) {
        this.error = error;
    }

    public static PersistenceResult success() {
        return SUCCESS;
    }

    public static PersistenceResult failure(RuntimeException error) {
        if (error == null) {
            throw new IllegalArgumentException("failure requires an error");
        }
        return new PersistenceResult(error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Optional<RuntimeException> getError() {
        return Optional.ofNullable(error);
    }

    public void ifFailure(Consumer<RuntimeException> handler) {
        if (error != null) {
            handler.accept(error);
        }
    }
}
