package io.ipcmesh;

import io.ipcmesh.cli.IpcMeshCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = IpcMeshCommand.commandLine().execute(args);
        System.exit(code);
    }
}
