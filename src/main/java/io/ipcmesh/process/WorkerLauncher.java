package io.ipcmesh.process;

import java.io.IOException;

@FunctionalInterface
public interface WorkerLauncher {
    WorkerConnection launch(WorkerSpec spec) throws IOException;
}
