package io.ipcmesh.process;

import java.time.Duration;
import java.util.Objects;

public record ProcessOptions(
        Duration timeout,
        boolean autoRestart,
        int maxRestarts
) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofMillis(30_000L);
    public static final int DEFAULT_MAX_RESTARTS = 3;

    public ProcessOptions {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        if (maxRestarts < 0) {
            throw new IllegalArgumentException("maxRestarts cannot be negative: " + maxRestarts);
        }
    }

    public static ProcessOptions defaults() {
        return new ProcessOptions(DEFAULT_TIMEOUT, false, DEFAULT_MAX_RESTARTS);
    }

    public ProcessOptions withTimeout(Duration value) {
        return new ProcessOptions(value, autoRestart, maxRestarts);
    }

    public ProcessOptions withTimeoutMs(long value) {
        return withTimeout(Duration.ofMillis(value));
    }

    public ProcessOptions withAutoRestart(boolean value) {
        return new ProcessOptions(timeout, value, maxRestarts);
    }

    public ProcessOptions withMaxRestarts(int value) {
        return new ProcessOptions(timeout, autoRestart, value);
    }
}
