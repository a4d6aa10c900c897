package io.ipcmesh.worker;

public final class CrashHandler implements WorkerHandler {
    @Override
    public String type() {
        return "crash";
    }

    @Override
    public WorkerResult handle(WorkerContext context) {
        context.exit(context.payload().path("code").asInt(1));
        return WorkerResult.noReply();
    }
}
