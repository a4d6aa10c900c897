package io.ipcmesh.error;

public final class WorkerErrorException extends IpcException {
    private final String requestType;

    public WorkerErrorException(String requestType, String message) {
        super("Worker failed " + requestType + ": " + message);
        this.requestType = requestType;
    }

    public String requestType() {
        return requestType;
    }
}
