package io.ipcmesh.error;

import io.ipcmesh.model.ProcessState;

public final class ProcessStateException extends IpcException {
    private final ProcessState state;

    public ProcessStateException(String message, ProcessState state) {
        super(message + " (state=" + state + ")");
        this.state = state;
    }

    public ProcessState state() {
        return state;
    }
}
