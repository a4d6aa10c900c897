package io.ipcmesh.bus;

import java.util.concurrent.CompletionStage;

@FunctionalInterface
public interface AsyncEventHandler<T> {
    CompletionStage<Void> handle(T payload) throws Exception;
}
