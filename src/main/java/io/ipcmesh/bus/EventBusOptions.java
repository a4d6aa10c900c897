package io.ipcmesh.bus;

import java.util.function.Consumer;

public record EventBusOptions(
        int maxListeners,
        boolean warnOnMaxListeners,
        Consumer<ListenerLimitWarning> warningSink
) {
    public static final int DEFAULT_MAX_LISTENERS = 10;

    public EventBusOptions {
        if (maxListeners < 0) {
            throw new IllegalArgumentException("maxListeners cannot be negative: " + maxListeners);
        }
    }

    public static EventBusOptions defaults() {
        return new EventBusOptions(DEFAULT_MAX_LISTENERS, true, null);
    }

    public EventBusOptions withMaxListeners(int value) {
        return new EventBusOptions(value, warnOnMaxListeners, warningSink);
    }

    public EventBusOptions withWarnOnMaxListeners(boolean value) {
        return new EventBusOptions(maxListeners, value, warningSink);
    }

    public EventBusOptions withWarningSink(Consumer<ListenerLimitWarning> value) {
        return new EventBusOptions(maxListeners, warnOnMaxListeners, value);
    }
}
