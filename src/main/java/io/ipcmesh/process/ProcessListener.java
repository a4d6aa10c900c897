package io.ipcmesh.process;

import com.fasterxml.jackson.databind.JsonNode;
import io.ipcmesh.model.ExitInfo;
import io.ipcmesh.model.IpcMessage;

public interface ProcessListener {
    default void onStart(long pid) {
    }

    default void onExit(ExitInfo exit) {
    }

    default void onRestart(int restartCount) {
    }

    default void onError(Throwable error) {
    }

    default void onMessage(IpcMessage<JsonNode> message) {
    }
}
