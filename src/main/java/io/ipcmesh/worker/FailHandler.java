package io.ipcmesh.worker;

public final class FailHandler implements WorkerHandler {
    @Override
    public String type() {
        return "fail";
    }

    @Override
    public WorkerResult handle(WorkerContext context) {
        String message = context.payload().path("message").asText("");
        return WorkerResult.fail(message.isBlank() ? "intentional failure from fail handler" : message);
    }
}
