package io.ipcmesh.worker;

public record WorkerResult(
        boolean reply,
        Object output,
        String error
) {
    public static WorkerResult ok(Object output) {
        return new WorkerResult(true, output, null);
    }

    public static WorkerResult fail(String error) {
        return new WorkerResult(true, null, error == null ? "unknown error" : error);
    }

    public static WorkerResult noReply() {
        return new WorkerResult(false, null, null);
    }

    public boolean success() {
        return error == null;
    }
}
