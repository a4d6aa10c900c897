package io.ipcmesh.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.ipcmesh.model.IpcMessage;
import io.ipcmesh.util.Jsons;

public final class WorkerContext {
    private final IpcMessage<JsonNode> message;
    private final WorkerRuntime runtime;

    WorkerContext(IpcMessage<JsonNode> message, WorkerRuntime runtime) {
        this.message = message;
        this.runtime = runtime;
    }

    public String messageId() {
        return message.id();
    }

    public String type() {
        return message.type();
    }

    public JsonNode payload() {
        return message.payload() == null ? NullNode.getInstance() : message.payload();
    }

    public <T> T payload(Class<T> type) {
        return Jsons.convert(payload(), type);
    }

    public void emit(String type, Object payload) {
        runtime.write(IpcMessage.create(type, Jsons.toTree(payload)));
    }

    public void exit(int code) {
        runtime.exit(code);
    }
}
