package io.ipcmesh.service;

import io.ipcmesh.bus.EventBus;

import java.util.Objects;

public abstract class BaseService {
    protected final EventBus bus;

    protected BaseService(EventBus bus) {
        this.bus = Objects.requireNonNull(bus, "bus");
    }

    public void init() throws Exception {
    }

    public void destroy() throws Exception {
    }

    public EventBus bus() {
        return bus;
    }
}
