package io.ipcmesh.process;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.ipcmesh.model.EnvelopeCodec;
import io.ipcmesh.model.ExitInfo;
import io.ipcmesh.model.IpcMessage;
import io.ipcmesh.model.StopSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;

public final class ForkedWorkerLauncher implements WorkerLauncher {
    private static final Logger LOG = LoggerFactory.getLogger(ForkedWorkerLauncher.class);
    private static final int MAX_LOGGED_CHARS = 256;

    @Override
    public WorkerConnection launch(WorkerSpec spec) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(spec.command()));
        pb.environment().putAll(spec.environment());
        if (spec.workingDirectory() != null) {
            pb.directory(spec.workingDirectory().toFile());
        }
        pb.redirectError(spec.inheritStderr() ? ProcessBuilder.Redirect.INHERIT : ProcessBuilder.Redirect.DISCARD);
        Process process = pb.start();
        return new ForkedConnection(process);
    }

    private static String truncate(String raw) {
        if (raw.length() <= MAX_LOGGED_CHARS) {
            return raw;
        }
        return raw.substring(0, MAX_LOGGED_CHARS) + "...";
    }

    private static final class ForkedConnection implements WorkerConnection {
        private final Process process;
        private final Writer writer;
        private volatile boolean killRequested;

        private ForkedConnection(Process process) {
            this.process = process;
            this.writer = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
        }

        @Override
        public void open(ConnectionListener listener) {
            Thread reader = new Thread(() -> pump(listener), "ipcmesh-worker-" + process.pid());
            reader.setDaemon(true);
            reader.start();
        }

        @Override
        public void send(IpcMessage<?> message) throws IOException {
            String line = EnvelopeCodec.encode(message);
            synchronized (writer) {
                writer.write(line);
                writer.write('\n');
                writer.flush();
            }
        }

        @Override
        public void kill(StopSignal signal) {
            killRequested = true;
            if (signal == StopSignal.KILL) {
                process.destroyForcibly();
            } else {
                process.destroy();
            }
        }

        @Override
        public long pid() {
            return process.pid();
        }

        @Override
        public boolean isAlive() {
            return process.isAlive();
        }

        private void pump(ConnectionListener listener) {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (line.isBlank()) {
                        continue;
                    }
                    IpcMessage<JsonNode> message;
                    try {
                        message = EnvelopeCodec.decode(line);
                    } catch (JsonProcessingException e) {
                        LOG.warn("Skipping non-envelope line from worker pid={}: {}", process.pid(), truncate(line));
                        continue;
                    }
                    listener.onMessage(message);
                }
            } catch (IOException e) {
                if (!killRequested) {
                    listener.onError(e);
                }
            }
            int exitCode = awaitExit();
            closeWriter();
            listener.onExit(new ExitInfo(exitCode, killRequested));
        }

        private int awaitExit() {
            try {
                return process.waitFor();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
                return -1;
            }
        }

        private void closeWriter() {
            synchronized (writer) {
                try {
                    writer.close();
                } catch (IOException e) {
                    LOG.debug("Worker stdin already closed pid={}", process.pid(), e);
                }
            }
        }
    }
}
