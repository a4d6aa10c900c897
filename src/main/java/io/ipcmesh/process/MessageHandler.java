package io.ipcmesh.process;

@FunctionalInterface
public interface MessageHandler<T> {
    void handle(T payload);
}
