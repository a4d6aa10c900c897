package io.ipcmesh.process;

import io.ipcmesh.model.IpcMessage;
import io.ipcmesh.model.StopSignal;

import java.io.IOException;

public interface WorkerConnection {
    void open(ConnectionListener listener);

    void send(IpcMessage<?> message) throws IOException;

    void kill(StopSignal signal);

    long pid();

    boolean isAlive();
}
