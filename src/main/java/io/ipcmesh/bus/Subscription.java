package io.ipcmesh.bus;

@FunctionalInterface
public interface Subscription {
    void unsubscribe();
}
