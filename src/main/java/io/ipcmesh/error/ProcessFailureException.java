package io.ipcmesh.error;

public final class ProcessFailureException extends IpcException {
    public ProcessFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
