package io.ipcmesh.process;

import com.fasterxml.jackson.databind.JsonNode;
import io.ipcmesh.model.ExitInfo;
import io.ipcmesh.model.IpcMessage;
import io.ipcmesh.model.StopSignal;
import io.ipcmesh.util.Jsons;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiConsumer;

/**
 * In-memory worker: every launch yields a {@link ScriptedConnection} whose replies, exits and
 * channel failures are driven by the test.
 */
public final class ScriptedWorkerLauncher implements WorkerLauncher {
    private static final AtomicLong PIDS = new AtomicLong(40_000L);

    private final List<ScriptedConnection> launched = new CopyOnWriteArrayList<>();
    private volatile BiConsumer<ScriptedConnection, IpcMessage<JsonNode>> responder = (connection, message) -> {
    };
    private volatile IOException nextLaunchFailure;

    public void respondWith(BiConsumer<ScriptedConnection, IpcMessage<JsonNode>> value) {
        this.responder = value;
    }

    public void echoRequests() {
        respondWith((connection, message) -> connection.reply(message.id(), message.payload()));
    }

    public void failNextLaunch(IOException failure) {
        this.nextLaunchFailure = failure;
    }

    public int launchCount() {
        return launched.size();
    }

    public ScriptedConnection current() {
        return launched.get(launched.size() - 1);
    }

    @Override
    public WorkerConnection launch(WorkerSpec spec) throws IOException {
        IOException failure = nextLaunchFailure;
        if (failure != null) {
            nextLaunchFailure = null;
            throw failure;
        }
        ScriptedConnection connection = new ScriptedConnection(PIDS.incrementAndGet());
        launched.add(connection);
        return connection;
    }

    public final class ScriptedConnection implements WorkerConnection {
        private final long pid;
        private final List<IpcMessage<JsonNode>> received = new CopyOnWriteArrayList<>();
        private volatile ConnectionListener listener;
        private volatile boolean alive = true;
        private volatile StopSignal killedWith;
        private volatile IOException sendFailure;

        private ScriptedConnection(long pid) {
            this.pid = pid;
        }

        @Override
        public void open(ConnectionListener value) {
            this.listener = value;
        }

        @Override
        @SuppressWarnings("unchecked")
        public void send(IpcMessage<?> message) throws IOException {
            if (sendFailure != null) {
                throw sendFailure;
            }
            IpcMessage<JsonNode> typed = (IpcMessage<JsonNode>) message;
            received.add(typed);
            responder.accept(this, typed);
        }

        @Override
        public void kill(StopSignal signal) {
            killedWith = signal;
            if (alive) {
                alive = false;
                listener.onExit(new ExitInfo(143, true));
            }
        }

        @Override
        public long pid() {
            return pid;
        }

        @Override
        public boolean isAlive() {
            return alive;
        }

        public void reply(String id, Object payload) {
            listener.onMessage(IpcMessage.response(id, Jsons.toTree(payload)));
        }

        public void replyError(String id, String message) {
            listener.onMessage(IpcMessage.error(id, Jsons.toTree(Map.of("message", message))));
        }

        public void push(String type, Object payload) {
            listener.onMessage(IpcMessage.create(type, Jsons.toTree(payload)));
        }

        public void crash(int exitCode) {
            alive = false;
            listener.onExit(new ExitInfo(exitCode, false));
        }

        public void breakChannel(Throwable error) {
            listener.onError(error);
        }

        public void failSends(IOException failure) {
            this.sendFailure = failure;
        }

        public List<IpcMessage<JsonNode>> received() {
            return received;
        }

        public StopSignal killedWith() {
            return killedWith;
        }
    }
}
