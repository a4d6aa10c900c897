package io.ipcmesh.model;

public enum ProcessState {
    NOT_STARTED,
    RUNNING,
    STOPPED
}
