package io.ipcmesh.service;

import io.ipcmesh.error.IpcException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class ServiceContainer {
    private final Map<String, BaseService> services = new LinkedHashMap<>();

    public <T extends BaseService> T register(String name, T service) {
        if (services.containsKey(name)) {
            throw new IllegalStateException("Service " + name + " already registered");
        }
        services.put(name, service);
        return service;
    }

    public <T extends BaseService> T get(String name, Class<T> type) {
        BaseService service = services.get(name);
        if (service == null) {
            throw new IllegalArgumentException("Service " + name + " not found");
        }
        if (!type.isInstance(service)) {
            throw new IllegalArgumentException("Service " + name + " is a " + service.getClass().getSimpleName()
                    + ", not a " + type.getSimpleName());
        }
        return type.cast(service);
    }

    public boolean has(String name) {
        return services.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(services.keySet());
    }

    public void initAll() {
        for (Map.Entry<String, BaseService> entry : services.entrySet()) {
            try {
                entry.getValue().init();
            } catch (Exception e) {
                throw new IpcException("Failed to initialize service " + entry.getKey(), e);
            }
        }
    }

    public void destroyAll() {
        List<String> names = new ArrayList<>(services.keySet());
        Collections.reverse(names);
        IpcException failure = null;
        for (String name : names) {
            try {
                services.get(name).destroy();
            } catch (Exception e) {
                if (failure == null) {
                    failure = new IpcException("Failed to destroy service " + name, e);
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }
}
