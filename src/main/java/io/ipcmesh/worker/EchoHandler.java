package io.ipcmesh.worker;

public final class EchoHandler implements WorkerHandler {
    @Override
    public String type() {
        return "echo";
    }

    @Override
    public WorkerResult handle(WorkerContext context) {
        return WorkerResult.ok(context.payload());
    }
}
