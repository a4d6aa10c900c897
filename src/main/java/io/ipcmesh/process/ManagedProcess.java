package io.ipcmesh.process;

import com.fasterxml.jackson.databind.JsonNode;
import io.ipcmesh.bus.Subscription;
import io.ipcmesh.error.ProcessExitedException;
import io.ipcmesh.error.ProcessFailureException;
import io.ipcmesh.error.ProcessSpawnException;
import io.ipcmesh.error.ProcessStateException;
import io.ipcmesh.error.RequestTimeoutException;
import io.ipcmesh.error.WorkerErrorException;
import io.ipcmesh.model.ExitInfo;
import io.ipcmesh.model.IpcMessage;
import io.ipcmesh.model.ProcessState;
import io.ipcmesh.model.StopSignal;
import io.ipcmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

public final class ManagedProcess implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ManagedProcess.class);
    private static final AtomicInteger LOOP_IDS = new AtomicInteger();
    private static final long LOOP_IDLE_SECONDS = 5L;

    private final WorkerSpec spec;
    private final ProcessOptions options;
    private final WorkerLauncher launcher;
    private volatile ScheduledThreadPoolExecutor loop;
    private final Object lock = new Object();
    private final Map<String, PendingRequest> pendingRequests = new LinkedHashMap<>();
    private final Map<String, List<TypedHandler<?>>> messageHandlers = new ConcurrentHashMap<>();
    private final List<ProcessListener> listeners = new CopyOnWriteArrayList<>();

    private ProcessState state = ProcessState.NOT_STARTED;
    private WorkerConnection connection;
    // bumped on every launch; exit callbacks from an older generation are ignored
    private int generation;
    private int stoppedGeneration = -1;
    private int restartCount;
    private boolean closed;

    public ManagedProcess(WorkerSpec spec, ProcessOptions options) {
        this(spec, options, new ForkedWorkerLauncher());
    }

    public ManagedProcess(WorkerSpec spec, ProcessOptions options, WorkerLauncher launcher) {
        this.spec = Objects.requireNonNull(spec, "spec");
        this.options = options == null ? ProcessOptions.defaults() : options;
        this.launcher = Objects.requireNonNull(launcher, "launcher");
    }

    public static ManagedProcess create(WorkerSpec spec, ProcessOptions options) {
        return new ManagedProcess(spec, options);
    }

    public void start() {
        synchronized (lock) {
            if (closed) {
                throw new ProcessStateException("Process manager closed", state);
            }
            if (state == ProcessState.RUNNING) {
                throw new ProcessStateException("Process already started", state);
            }
            launch();
        }
    }

    public void stop() {
        stop(StopSignal.TERMINATE);
    }

    public void stop(StopSignal signal) {
        StopSignal effective = signal == null ? StopSignal.TERMINATE : signal;
        WorkerConnection target;
        List<PendingRequest> flushed;
        synchronized (lock) {
            if (state != ProcessState.RUNNING) {
                return;
            }
            target = connection;
            connection = null;
            state = ProcessState.STOPPED;
            stoppedGeneration = generation;
            flushed = drainPending();
        }
        LOG.debug("Stopping worker pid={} with {}", target.pid(), effective.signalName());
        target.kill(effective);
        rejectAll(flushed, () -> new ProcessExitedException("Process stopped", ProcessExitedException.NO_EXIT_CODE));
    }

    public void send(String type, Object payload) {
        IpcMessage<JsonNode> message = IpcMessage.create(type, Jsons.toTree(payload));
        WorkerConnection target;
        synchronized (lock) {
            target = requireRunning();
        }
        try {
            target.send(message);
        } catch (IOException e) {
            throw new ProcessFailureException("Failed to send message: " + type, e);
        }
    }

    public CompletableFuture<JsonNode> request(String type, Object payload) {
        IpcMessage<JsonNode> message = IpcMessage.create(type, Jsons.toTree(payload));
        PendingRequest pending = new PendingRequest(message.id(), type);
        WorkerConnection target;
        synchronized (lock) {
            target = requireRunning();
            pendingRequests.put(message.id(), pending);
        }
        pending.attachTimer(requireLoop().schedule(
                () -> expire(pending),
                options.timeout().toMillis(),
                TimeUnit.MILLISECONDS
        ));
        try {
            target.send(message);
        } catch (IOException e) {
            synchronized (lock) {
                pendingRequests.remove(message.id(), pending);
            }
            pending.reject(new ProcessFailureException("Failed to send request: " + type, e));
        }
        return pending.future();
    }

    public <R> CompletableFuture<R> request(String type, Object payload, Class<R> responseType) {
        return request(type, payload).thenApply(node -> Jsons.convert(node, responseType));
    }

    public Subscription onMessage(String type, MessageHandler<JsonNode> handler) {
        return onMessage(type, JsonNode.class, handler);
    }

    public <T> Subscription onMessage(String type, Class<T> payloadType, MessageHandler<? super T> handler) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("message type cannot be empty");
        }
        Objects.requireNonNull(handler, "handler");
        TypedHandler<T> registration = new TypedHandler<>(payloadType, handler);
        List<TypedHandler<?>> handlers = messageHandlers.computeIfAbsent(type, k -> new CopyOnWriteArrayList<>());
        handlers.add(registration);
        return () -> handlers.remove(registration);
    }

    public Subscription addListener(ProcessListener listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public boolean isRunning() {
        synchronized (lock) {
            return state == ProcessState.RUNNING && connection != null && connection.isAlive();
        }
    }

    public OptionalLong getPid() {
        synchronized (lock) {
            return connection == null ? OptionalLong.empty() : OptionalLong.of(connection.pid());
        }
    }

    public ProcessState state() {
        synchronized (lock) {
            return state;
        }
    }

    public int restartCount() {
        synchronized (lock) {
            return restartCount;
        }
    }

    public int pendingCount() {
        synchronized (lock) {
            return pendingRequests.size();
        }
    }

    public WorkerSpec spec() {
        return spec;
    }

    public ProcessOptions options() {
        return options;
    }

    @Override
    public void close() {
        stop(StopSignal.TERMINATE);
        ScheduledExecutorService current;
        synchronized (lock) {
            closed = true;
            current = loop;
        }
        if (current != null) {
            current.shutdownNow();
        }
    }

    // null until the first start
    ScheduledExecutorService eventLoop() {
        return loop;
    }

    // caller holds lock
    private void launch() {
        if (loop == null) {
            loop = newLoop();
        }
        WorkerConnection next;
        try {
            next = launcher.launch(spec);
        } catch (IOException e) {
            throw new ProcessSpawnException("Failed to start worker: " + spec, e);
        }
        int launched = ++generation;
        connection = next;
        state = ProcessState.RUNNING;
        long pid = next.pid();
        LOG.debug("Started worker pid={} generation={}", pid, launched);
        // queued before the connection opens so the start event precedes the first message
        execute(() -> fire(listener -> listener.onStart(pid)));
        next.open(new GenerationListener(launched));
    }

    // caller holds lock
    private WorkerConnection requireRunning() {
        if (state == ProcessState.RUNNING && connection != null) {
            return connection;
        }
        if (state == ProcessState.STOPPED && options.autoRestart() && restartCount >= options.maxRestarts()) {
            throw new ProcessStateException("Process stopped after " + restartCount + " restart(s)", state);
        }
        if (state == ProcessState.STOPPED) {
            throw new ProcessStateException("Process stopped", state);
        }
        throw new ProcessStateException("Process not started", state);
    }

    // caller holds lock
    private List<PendingRequest> drainPending() {
        List<PendingRequest> drained = new ArrayList<>(pendingRequests.values());
        pendingRequests.clear();
        return drained;
    }

    private void expire(PendingRequest pending) {
        boolean removed;
        synchronized (lock) {
            removed = pendingRequests.remove(pending.id(), pending);
        }
        if (removed) {
            pending.reject(new RequestTimeoutException(pending.type(), options.timeout()));
        }
    }

    private void handleMessage(int origin, IpcMessage<JsonNode> message) {
        PendingRequest pending = null;
        synchronized (lock) {
            if (origin != generation || state != ProcessState.RUNNING) {
                LOG.debug("Ignoring {} message from a retired worker", message.type());
                return;
            }
            if (message.isResponse() || message.isError()) {
                pending = pendingRequests.remove(message.id());
            }
        }
        if (pending != null) {
            if (message.isResponse()) {
                pending.resolve(message.payload());
            } else {
                pending.reject(new WorkerErrorException(pending.type(), errorText(message.payload())));
            }
            return;
        }
        if (message.isResponse()) {
            LOG.debug("Dropping response {} with no pending request", message.id());
            return;
        }
        List<TypedHandler<?>> handlers = messageHandlers.get(message.type());
        if (handlers != null) {
            for (TypedHandler<?> handler : handlers) {
                try {
                    handler.deliver(message.payload());
                } catch (Throwable e) {
                    LOG.warn("Message handler for type \"{}\" failed", message.type(), e);
                }
            }
        }
        fire(listener -> listener.onMessage(message));
    }

    private void handleExit(int origin, ExitInfo exit) {
        List<PendingRequest> flushed;
        boolean restart;
        synchronized (lock) {
            if (origin == stoppedGeneration) {
                flushed = List.of();
                restart = false;
            } else if (origin != generation || state != ProcessState.RUNNING) {
                return;
            } else {
                connection = null;
                state = ProcessState.STOPPED;
                flushed = drainPending();
                restart = options.autoRestart() && restartCount < options.maxRestarts() && !closed;
            }
        }
        LOG.debug("Worker exited code={} requested={} pending={}", exit.exitCode(), exit.requested(), flushed.size());
        // the replacement worker knows nothing about these ids
        rejectAll(flushed, () -> new ProcessExitedException("Process exited", exit.exitCode()));
        fire(listener -> listener.onExit(exit));
        if (restart) {
            restart(origin);
        } else if (origin != stoppedGeneration && options.autoRestart()) {
            LOG.debug("Restart limit of {} reached, worker stays stopped", options.maxRestarts());
        }
    }

    private void restart(int origin) {
        int count;
        synchronized (lock) {
            if (closed || origin != generation || state != ProcessState.STOPPED) {
                return;
            }
            restartCount++;
            count = restartCount;
        }
        fire(listener -> listener.onRestart(count));
        try {
            synchronized (lock) {
                if (closed || origin != generation || state != ProcessState.STOPPED) {
                    return;
                }
                launch();
            }
        } catch (ProcessSpawnException e) {
            LOG.debug("Restart {} failed", count, e);
            fire(listener -> listener.onError(e));
        }
    }

    private void handleChannelError(int origin, Throwable error) {
        List<PendingRequest> flushed;
        synchronized (lock) {
            if (origin != generation || state != ProcessState.RUNNING) {
                LOG.debug("Ignoring channel error from a retired worker", error);
                return;
            }
            flushed = drainPending();
        }
        rejectAll(flushed, () -> new ProcessFailureException("Worker channel failed", error));
        fire(listener -> listener.onError(error));
    }

    private static void rejectAll(List<PendingRequest> flushed, Supplier<? extends Throwable> error) {
        for (PendingRequest pending : flushed) {
            pending.reject(error.get());
        }
    }

    private void fire(ListenerCall call) {
        for (ProcessListener listener : listeners) {
            try {
                call.invoke(listener);
            } catch (Throwable e) {
                LOG.warn("Process listener failed", e);
            }
        }
    }

    private ScheduledExecutorService requireLoop() {
        ScheduledExecutorService current = loop;
        if (current == null) {
            throw new IllegalStateException("event loop not started");
        }
        return current;
    }

    // the idle thread exits after a while, so an instance dropped without close() holds no thread
    private static ScheduledThreadPoolExecutor newLoop() {
        int loopId = LOOP_IDS.incrementAndGet();
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, "ipcmesh-loop-" + loopId);
            thread.setDaemon(true);
            return thread;
        });
        executor.setKeepAliveTime(LOOP_IDLE_SECONDS, TimeUnit.SECONDS);
        executor.allowCoreThreadTimeOut(true);
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    private void execute(Runnable task) {
        try {
            requireLoop().execute(task);
        } catch (RejectedExecutionException e) {
            LOG.debug("Event loop closed, dropping event", e);
        }
    }

    private static String errorText(JsonNode payload) {
        if (payload == null || payload.isNull()) {
            return "unknown error";
        }
        if (payload.isTextual()) {
            return payload.asText();
        }
        JsonNode message = payload.path("message");
        return message.isMissingNode() ? payload.toString() : message.asText();
    }

    @FunctionalInterface
    private interface ListenerCall {
        void invoke(ProcessListener listener);
    }

    private static final class TypedHandler<T> {
        private final Class<T> payloadType;
        private final MessageHandler<? super T> handler;

        private TypedHandler(Class<T> payloadType, MessageHandler<? super T> handler) {
            this.payloadType = payloadType;
            this.handler = handler;
        }

        private void deliver(JsonNode payload) {
            handler.handle(Jsons.convert(payload, payloadType));
        }
    }

    private final class GenerationListener implements ConnectionListener {
        private final int origin;

        private GenerationListener(int origin) {
            this.origin = origin;
        }

        @Override
        public void onMessage(IpcMessage<JsonNode> message) {
            execute(() -> handleMessage(origin, message));
        }

        @Override
        public void onExit(ExitInfo exit) {
            execute(() -> handleExit(origin, exit));
        }

        @Override
        public void onError(Throwable error) {
            execute(() -> handleChannelError(origin, error));
        }
    }
}
