package io.ipcmesh.process;

import com.fasterxml.jackson.databind.JsonNode;
import io.ipcmesh.model.ExitInfo;
import io.ipcmesh.model.IpcMessage;

public interface ConnectionListener {
    void onMessage(IpcMessage<JsonNode> message);

    void onExit(ExitInfo exit);

    void onError(Throwable error);
}
