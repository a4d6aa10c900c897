package io.ipcmesh.worker;

public final class SleepHandler implements WorkerHandler {
    private static final long MAX_SLEEP_MS = 60_000L;

    @Override
    public String type() {
        return "sleep";
    }

    @Override
    public WorkerResult handle(WorkerContext context) throws InterruptedException {
        long ms = Math.max(0L, Math.min(MAX_SLEEP_MS, context.payload().path("ms").asLong(0L)));
        Thread.sleep(ms);
        return WorkerResult.ok(context.payload());
    }
}
