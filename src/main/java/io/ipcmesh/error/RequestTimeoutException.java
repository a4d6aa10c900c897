package io.ipcmesh.error;

import java.time.Duration;

public final class RequestTimeoutException extends IpcException {
    private final String requestType;
    private final Duration timeout;

    public RequestTimeoutException(String requestType, Duration timeout) {
        super("Request timeout: " + requestType + " after " + timeout.toMillis() + "ms");
        this.requestType = requestType;
        this.timeout = timeout;
    }

    public String requestType() {
        return requestType;
    }

    public Duration timeout() {
        return timeout;
    }
}
