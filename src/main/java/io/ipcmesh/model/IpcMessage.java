package io.ipcmesh.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;
import java.util.UUID;

public record IpcMessage<T>(
        String id,
        String type,
        T payload,
        long timestamp
) {
    public static final String RESPONSE_TYPE = "response";
    public static final String ERROR_TYPE = "error";

    public IpcMessage {
        Objects.requireNonNull(id, "id");
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("message type cannot be empty");
        }
    }

    public static <T> IpcMessage<T> create(String type, T payload) {
        return new IpcMessage<>(newId(), type, payload, System.currentTimeMillis());
    }

    public static <T> IpcMessage<T> response(String requestId, T payload) {
        return new IpcMessage<>(requestId, RESPONSE_TYPE, payload, System.currentTimeMillis());
    }

    public static <T> IpcMessage<T> error(String requestId, T payload) {
        return new IpcMessage<>(requestId, ERROR_TYPE, payload, System.currentTimeMillis());
    }

    public static String newId() {
        return UUID.randomUUID().toString();
    }

    @JsonIgnore
    public boolean isResponse() {
        return RESPONSE_TYPE.equals(type);
    }

    @JsonIgnore
    public boolean isError() {
        return ERROR_TYPE.equals(type);
    }
}
