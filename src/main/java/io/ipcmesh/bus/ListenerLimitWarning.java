package io.ipcmesh.bus;

public record ListenerLimitWarning(
        String event,
        int listenerCount,
        int maxListeners
) {
    public String message() {
        return "Possible listener leak: event \"" + event + "\" has " + listenerCount
                + " listeners (limit " + maxListeners + ")";
    }
}
