package io.ipcmesh.model;

public record ExitInfo(
        int exitCode,
        boolean requested
) {
}
