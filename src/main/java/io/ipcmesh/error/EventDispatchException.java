package io.ipcmesh.error;

import java.util.List;

public final class EventDispatchException extends IpcException {
    private final String event;
    private final List<Throwable> failures;

    public EventDispatchException(String event, List<Throwable> failures) {
        super(failures.size() + " handler(s) failed for event \"" + event + "\"",
                failures.isEmpty() ? null : failures.get(0));
        this.event = event;
        this.failures = List.copyOf(failures);
        for (Throwable failure : this.failures) {
            addSuppressed(failure);
        }
    }

    public String event() {
        return event;
    }

    public List<Throwable> failures() {
        return failures;
    }
}
