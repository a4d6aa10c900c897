package io.ipcmesh.error;

public final class ProcessSpawnException extends IpcException {
    public ProcessSpawnException(String message, Throwable cause) {
        super(message, cause);
    }
}
