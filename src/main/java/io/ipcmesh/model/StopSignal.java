package io.ipcmesh.model;

public enum StopSignal {
    TERMINATE("SIGTERM"),
    KILL("SIGKILL");

    private final String signalName;

    StopSignal(String signalName) {
        this.signalName = signalName;
    }

    public String signalName() {
        return signalName;
    }
}
