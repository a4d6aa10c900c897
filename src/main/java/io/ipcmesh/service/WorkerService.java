package io.ipcmesh.service;

import com.fasterxml.jackson.databind.JsonNode;
import io.ipcmesh.bus.EventBus;
import io.ipcmesh.bus.EventTopic;
import io.ipcmesh.bus.Subscription;
import io.ipcmesh.model.ExitInfo;
import io.ipcmesh.process.ManagedProcess;
import io.ipcmesh.process.ProcessListener;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

public class WorkerService extends BaseService {
    public static final EventTopic<Long> STARTED = EventTopic.of("worker:start", Long.class);
    public static final EventTopic<ExitInfo> EXITED = EventTopic.of("worker:exit", ExitInfo.class);
    public static final EventTopic<Integer> RESTARTED = EventTopic.of("worker:restart", Integer.class);
    public static final EventTopic<Throwable> FAILED = EventTopic.of("worker:error", Throwable.class);

    private final ManagedProcess process;
    private Subscription lifecycle;

    public WorkerService(EventBus bus, ManagedProcess process) {
        super(bus);
        this.process = Objects.requireNonNull(process, "process");
    }

    @Override
    public void init() {
        lifecycle = process.addListener(new ProcessListener() {
            @Override
            public void onStart(long pid) {
                publish(STARTED, pid);
            }

            @Override
            public void onExit(ExitInfo exit) {
                publish(EXITED, exit);
            }

            @Override
            public void onRestart(int restartCount) {
                publish(RESTARTED, restartCount);
            }

            @Override
            public void onError(Throwable error) {
                publish(FAILED, error);
            }
        });
        process.start();
    }

    @Override
    public void destroy() {
        try {
            process.close();
        } finally {
            if (lifecycle != null) {
                lifecycle.unsubscribe();
                lifecycle = null;
            }
        }
    }

    public CompletableFuture<JsonNode> call(String type, Object payload) {
        return process.request(type, payload);
    }

    public void post(String type, Object payload) {
        process.send(type, payload);
    }

    public ManagedProcess process() {
        return process;
    }

    private <T> void publish(EventTopic<T> topic, T payload) {
        bus.emitSync(topic, payload);
    }
}
