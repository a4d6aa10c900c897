package io.ipcmesh.bus;

@FunctionalInterface
public interface EventHandler<T> {
    void handle(T payload) throws Exception;
}
