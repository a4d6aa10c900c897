package io.ipcmesh.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.ipcmesh.model.EnvelopeCodec;
import io.ipcmesh.model.IpcMessage;
import io.ipcmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.function.IntConsumer;

public final class WorkerRuntime {
    private static final Logger LOG = LoggerFactory.getLogger(WorkerRuntime.class);

    private final InputStream in;
    private final Writer out;
    private final WorkerHandlerRegistry registry;
    private final IntConsumer exitHook;

    public WorkerRuntime(InputStream in, OutputStream out, WorkerHandlerRegistry registry, IntConsumer exitHook) {
        this.in = Objects.requireNonNull(in, "in");
        this.out = new BufferedWriter(new OutputStreamWriter(Objects.requireNonNull(out, "out"), StandardCharsets.UTF_8));
        this.registry = Objects.requireNonNull(registry, "registry");
        this.exitHook = Objects.requireNonNull(exitHook, "exitHook");
    }

    public static WorkerRuntime stdio(WorkerHandlerRegistry registry) {
        return new WorkerRuntime(System.in, System.out, registry, System::exit);
    }

    public long run() throws IOException {
        long handled = 0L;
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                IpcMessage<JsonNode> message;
                try {
                    message = EnvelopeCodec.decode(line);
                } catch (JsonProcessingException e) {
                    LOG.warn("Skipping malformed envelope: {}", e.getOriginalMessage());
                    continue;
                }
                dispatch(message);
                handled++;
            }
        }
        return handled;
    }

    void dispatch(IpcMessage<JsonNode> message) {
        WorkerHandler handler = registry.findByType(message.type()).orElse(null);
        if (handler == null) {
            write(IpcMessage.error(message.id(), Map.of("message", "No handler for message type: " + message.type())));
            return;
        }
        WorkerResult result;
        try {
            result = handler.handle(new WorkerContext(message, this));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result = WorkerResult.fail("interrupted");
        } catch (Exception e) {
            LOG.debug("Handler {} failed for message {}", message.type(), message.id(), e);
            result = WorkerResult.fail(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
        if (result == null || !result.reply()) {
            return;
        }
        if (result.success()) {
            write(IpcMessage.response(message.id(), Jsons.toTree(result.output())));
        } else {
            write(IpcMessage.error(message.id(), Map.of("message", result.error())));
        }
    }

    void write(IpcMessage<?> message) {
        try {
            String line = EnvelopeCodec.encode(message);
            synchronized (out) {
                out.write(line);
                out.write('\n');
                out.flush();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write envelope " + message.type(), e);
        }
    }

    void exit(int code) {
        try {
            synchronized (out) {
                out.flush();
            }
        } catch (IOException e) {
            LOG.debug("Flush before exit failed", e);
        }
        exitHook.accept(code);
    }
}
