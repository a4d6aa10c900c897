package io.ipcmesh.error;

public final class ProcessExitedException extends IpcException {
    public static final int NO_EXIT_CODE = -1;

    private final int exitCode;

    public ProcessExitedException(String message, int exitCode) {
        super(exitCode == NO_EXIT_CODE ? message : message + " (exit=" + exitCode + ")");
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}
