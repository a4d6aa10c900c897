package io.ipcmesh.bus;

import io.ipcmesh.error.EventDispatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;

// Not thread-safe: confined to the thread that drives it. Each dispatch runs a snapshot taken when it starts.
public final class EventBus {
    private static final Logger LOG = LoggerFactory.getLogger(EventBus.class);
    private static final CompletableFuture<Void> DONE = CompletableFuture.completedFuture(null);

    private final Map<String, List<Listener>> listeners = new LinkedHashMap<>();
    private final Map<String, List<Listener>> onceListeners = new LinkedHashMap<>();
    private final Set<String> warnedEvents = new HashSet<>();
    private final int maxListeners;
    private final boolean warnOnMaxListeners;
    private final Consumer<ListenerLimitWarning> warningSink;

    public EventBus() {
        this(EventBusOptions.defaults());
    }

    public EventBus(EventBusOptions options) {
        Objects.requireNonNull(options, "options");
        this.maxListeners = options.maxListeners();
        this.warnOnMaxListeners = options.warnOnMaxListeners();
        this.warningSink = options.warningSink() == null
                ? warning -> LOG.warn(warning.message())
                : options.warningSink();
    }

    public static EventBus create(EventBusOptions options) {
        return new EventBus(options == null ? EventBusOptions.defaults() : options);
    }

    public <T> Subscription on(String event, EventHandler<? super T> handler) {
        return register(listeners, event, handler, syncInvoker(handler));
    }

    public <T> Subscription onAsync(String event, AsyncEventHandler<? super T> handler) {
        return register(listeners, event, handler, asyncInvoker(handler));
    }

    public <T> Subscription once(String event, EventHandler<? super T> handler) {
        return register(onceListeners, event, handler, syncInvoker(handler));
    }

    public <T> Subscription onceAsync(String event, AsyncEventHandler<? super T> handler) {
        return register(onceListeners, event, handler, asyncInvoker(handler));
    }

    public <T> Subscription on(EventTopic<T> topic, EventHandler<? super T> handler) {
        return on(topic.name(), handler);
    }

    public <T> Subscription once(EventTopic<T> topic, EventHandler<? super T> handler) {
        return once(topic.name(), handler);
    }

    public void off(String event, Object handler) {
        if (event == null || handler == null) {
            return;
        }
        removeByKey(listeners, event, handler);
        removeByKey(onceListeners, event, handler);
        resetWarningIfBelowLimit(event);
    }

    public CompletableFuture<Void> emit(String event, Object payload) {
        List<Listener> snapshot = snapshot(event);
        if (snapshot.isEmpty()) {
            return DONE;
        }
        List<Throwable> failures = new ArrayList<>();
        CompletableFuture<Void> chain = DONE;
        for (Listener listener : snapshot) {
            chain = chain.thenCompose(ignored -> invoke(listener, payload, failures));
        }
        return chain.thenCompose(ignored -> failures.isEmpty()
                ? DONE
                : CompletableFuture.<Void>failedFuture(new EventDispatchException(event, failures)));
    }

    public <T> CompletableFuture<Void> emit(EventTopic<T> topic, T payload) {
        return emit(topic.name(), payload);
    }

    public void emitSync(String event, Object payload) {
        List<Listener> snapshot = snapshot(event);
        List<Throwable> failures = new ArrayList<>();
        for (Listener listener : snapshot) {
            try {
                CompletionStage<Void> stage = listener.invoker().handle(payload);
                if (stage != null) {
                    stage.whenComplete((ignored, error) -> {
                        if (error != null) {
                            LOG.warn("Asynchronous handler for event \"{}\" failed after emitSync", event, unwrap(error));
                        }
                    });
                }
            } catch (Throwable e) {
                failures.add(e);
            }
        }
        if (!failures.isEmpty()) {
            throw new EventDispatchException(event, failures);
        }
    }

    public <T> void emitSync(EventTopic<T> topic, T payload) {
        emitSync(topic.name(), payload);
    }

    public void removeAllListeners(String event) {
        if (event == null) {
            removeAllListeners();
            return;
        }
        listeners.remove(event);
        onceListeners.remove(event);
        warnedEvents.remove(event);
    }

    public void removeAllListeners() {
        listeners.clear();
        onceListeners.clear();
        warnedEvents.clear();
    }

    public int listenerCount(String event) {
        return sizeOf(listeners.get(event)) + sizeOf(onceListeners.get(event));
    }

    public List<String> eventNames() {
        Set<String> names = new LinkedHashSet<>(listeners.keySet());
        names.addAll(onceListeners.keySet());
        return List.copyOf(names);
    }

    public int maxListeners() {
        return maxListeners;
    }

    private Subscription register(
            Map<String, List<Listener>> group,
            String event,
            Object handler,
            AsyncEventHandler<Object> invoker
    ) {
        if (event == null || event.isBlank()) {
            throw new IllegalArgumentException("event name cannot be empty");
        }
        Objects.requireNonNull(handler, "handler");
        List<Listener> handlers = group.computeIfAbsent(event, k -> new ArrayList<>());
        Listener listener = findByKey(handlers, handler);
        if (listener == null) {
            listener = new Listener(handler, invoker);
            handlers.add(listener);
            checkListenerLimit(event);
        }
        return new ListenerSubscription(group, event, listener);
    }

    private List<Listener> snapshot(String event) {
        List<Listener> snapshot = new ArrayList<>();
        List<Listener> persistent = listeners.get(event);
        if (persistent != null) {
            snapshot.addAll(persistent);
        }
        // once-handlers leave the registry before any of them runs
        List<Listener> once = onceListeners.remove(event);
        if (once != null) {
            snapshot.addAll(once);
            resetWarningIfBelowLimit(event);
        }
        return snapshot;
    }

    private CompletionStage<Void> invoke(Listener listener, Object payload, List<Throwable> failures) {
        CompletionStage<Void> stage;
        try {
            stage = listener.invoker().handle(payload);
        } catch (Throwable e) {
            failures.add(e);
            return DONE;
        }
        if (stage == null) {
            return DONE;
        }
        return stage.handle((ignored, error) -> {
            if (error != null) {
                failures.add(unwrap(error));
            }
            return null;
        });
    }

    private void checkListenerLimit(String event) {
        if (!warnOnMaxListeners || maxListeners <= 0) {
            return;
        }
        int count = listenerCount(event);
        if (count > maxListeners && warnedEvents.add(event)) {
            warningSink.accept(new ListenerLimitWarning(event, count, maxListeners));
        }
    }

    private void resetWarningIfBelowLimit(String event) {
        if (listenerCount(event) <= maxListeners) {
            warnedEvents.remove(event);
        }
    }

    private static void removeByKey(Map<String, List<Listener>> group, String event, Object key) {
        List<Listener> handlers = group.get(event);
        if (handlers == null) {
            return;
        }
        Listener listener = findByKey(handlers, key);
        if (listener != null) {
            removeListener(group, event, listener);
        }
    }

    private static void removeListener(Map<String, List<Listener>> group, String event, Listener listener) {
        List<Listener> handlers = group.get(event);
        if (handlers == null) {
            return;
        }
        for (int i = 0; i < handlers.size(); i++) {
            if (handlers.get(i) == listener) {
                handlers.remove(i);
                break;
            }
        }
        if (handlers.isEmpty()) {
            group.remove(event);
        }
    }

    private static Listener findByKey(List<Listener> handlers, Object key) {
        for (Listener listener : handlers) {
            if (listener.key() == key) {
                return listener;
            }
        }
        return null;
    }

    private static int sizeOf(List<Listener> handlers) {
        return handlers == null ? 0 : handlers.size();
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    @SuppressWarnings("unchecked")
    private static AsyncEventHandler<Object> syncInvoker(EventHandler<?> handler) {
        EventHandler<Object> typed = (EventHandler<Object>) handler;
        return payload -> {
            typed.handle(payload);
            return null;
        };
    }

    @SuppressWarnings("unchecked")
    private static AsyncEventHandler<Object> asyncInvoker(AsyncEventHandler<?> handler) {
        return (AsyncEventHandler<Object>) handler;
    }

    private record Listener(Object key, AsyncEventHandler<Object> invoker) {
    }

    private final class ListenerSubscription implements Subscription {
        private final Map<String, List<Listener>> group;
        private final String event;
        private final Listener listener;
        private boolean removed;

        private ListenerSubscription(Map<String, List<Listener>> group, String event, Listener listener) {
            this.group = group;
            this.event = event;
            this.listener = listener;
        }

        @Override
        public void unsubscribe() {
            if (removed) {
                return;
            }
            removed = true;
            removeListener(group, event, listener);
            resetWarningIfBelowLimit(event);
        }
    }
}
