package io.ipcmesh.worker;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class WorkerHandlerRegistry {
    private final Map<String, WorkerHandler> handlers = new ConcurrentHashMap<>();

    public static WorkerHandlerRegistry withBuiltins() {
        WorkerHandlerRegistry registry = new WorkerHandlerRegistry();
        registry.register(new EchoHandler());
        registry.register(new SleepHandler());
        registry.register(new CrashHandler());
        registry.register(new FailHandler());
        registry.register(new PidHandler());
        return registry;
    }

    public WorkerHandlerRegistry register(WorkerHandler handler) {
        handlers.put(handler.type(), handler);
        return this;
    }

    public Optional<WorkerHandler> findByType(String type) {
        return Optional.ofNullable(handlers.get(type));
    }

    public Collection<String> listTypes() {
        return handlers.keySet();
    }
}
