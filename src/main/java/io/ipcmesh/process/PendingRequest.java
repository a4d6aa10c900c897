package io.ipcmesh.process;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;

final class PendingRequest {
    enum State {
        PENDING,
        RESOLVED,
        REJECTED
    }

    private final String id;
    private final String type;
    private final CompletableFuture<JsonNode> future = new CompletableFuture<>();
    private final AtomicReference<State> state = new AtomicReference<>(State.PENDING);
    private volatile Future<?> timer;

    PendingRequest(String id, String type) {
        this.id = id;
        this.type = type;
    }

    String id() {
        return id;
    }

    String type() {
        return type;
    }

    State state() {
        return state.get();
    }

    CompletableFuture<JsonNode> future() {
        return future;
    }

    void attachTimer(Future<?> value) {
        timer = value;
        // settled before the timer existed
        if (state.get() != State.PENDING) {
            value.cancel(false);
        }
    }

    boolean resolve(JsonNode payload) {
        if (!state.compareAndSet(State.PENDING, State.RESOLVED)) {
            return false;
        }
        cancelTimer();
        future.complete(payload);
        return true;
    }

    boolean reject(Throwable error) {
        if (!state.compareAndSet(State.PENDING, State.REJECTED)) {
            return false;
        }
        cancelTimer();
        future.completeExceptionally(error);
        return true;
    }

    private void cancelTimer() {
        Future<?> current = timer;
        if (current != null) {
            current.cancel(false);
        }
    }
}
