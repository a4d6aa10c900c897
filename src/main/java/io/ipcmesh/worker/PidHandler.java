package io.ipcmesh.worker;

import java.util.Map;

public final class PidHandler implements WorkerHandler {
    @Override
    public String type() {
        return "pid";
    }

    @Override
    public WorkerResult handle(WorkerContext context) {
        return WorkerResult.ok(Map.of("pid", ProcessHandle.current().pid()));
    }
}
