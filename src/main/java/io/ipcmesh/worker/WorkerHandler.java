package io.ipcmesh.worker;

public interface WorkerHandler {
    String type();

    WorkerResult handle(WorkerContext context) throws Exception;
}
