package io.ipcmesh.bus;

import java.util.Objects;

public record EventTopic<T>(String name, Class<T> payloadType) {
    public EventTopic {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("event name cannot be empty");
        }
        Objects.requireNonNull(payloadType, "payloadType");
    }

    public static <T> EventTopic<T> of(String name, Class<T> payloadType) {
        return new EventTopic<>(name, payloadType);
    }
}
