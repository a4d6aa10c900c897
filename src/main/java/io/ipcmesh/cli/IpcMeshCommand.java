package io.ipcmesh.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.ipcmesh.Main;
import io.ipcmesh.bus.EventBus;
import io.ipcmesh.config.IpcMeshConfig;
import io.ipcmesh.model.ProcessState;
import io.ipcmesh.process.ManagedProcess;
import io.ipcmesh.process.ProcessOptions;
import io.ipcmesh.process.WorkerSpec;
import io.ipcmesh.service.ServiceContainer;
import io.ipcmesh.service.WorkerService;
import io.ipcmesh.util.Jsons;
import io.ipcmesh.worker.WorkerHandlerRegistry;
import io.ipcmesh.worker.WorkerRuntime;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

@Command(
        name = "ipcmesh",
        mixinStandardHelpOptions = true,
        description = "Event bus and supervised worker-process CLI",
        subcommands = {
                IpcMeshCommand.WorkerCommand.class,
                IpcMeshCommand.RequestCommand.class,
                IpcMeshCommand.SendCommand.class,
                IpcMeshCommand.SuperviseCommand.class,
                IpcMeshCommand.BusDemoCommand.class
        }
)
public final class IpcMeshCommand implements Runnable {
    private static final long SETTLE_POLL_MS = 10L;

    @Spec
    CommandSpec spec;

    @Option(names = {"--timeout-ms"}, description = "Request timeout in ms (env IPCMESH_TIMEOUT_MS)")
    Long timeoutMs;

    @Option(names = {"--auto-restart"}, arity = "0..1", description = "Restart the worker after a crash (env IPCMESH_AUTO_RESTART)")
    Boolean autoRestart;

    @Option(names = {"--max-restarts"}, description = "Restart attempts allowed (env IPCMESH_MAX_RESTARTS)")
    Integer maxRestarts;

    @Option(names = {"--command"}, split = " ",
            description = "Worker command line; defaults to this program's worker subcommand")
    List<String> workerCommand;

    public static CommandLine commandLine() {
        CommandLine cmd = new CommandLine(new IpcMeshCommand());
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            commandLine.getErr().println("Error: " + ex.getMessage());
            if (ex.getCause() != null) {
                commandLine.getErr().println("Caused by: " + ex.getCause().getMessage());
            }
            return ExitCodes.forFailure(ex);
        });
        return cmd;
    }

    @Override
    public void run() {
        spec.commandLine().getOut().println("Use subcommands: worker | request | send | supervise | bus-demo");
    }

    IpcMeshConfig config() {
        return IpcMeshConfig.fromEnvironment()
                .withTimeoutMs(timeoutMs)
                .withAutoRestart(autoRestart)
                .withMaxRestarts(maxRestarts);
    }

    WorkerSpec workerSpec() {
        if (workerCommand == null || workerCommand.isEmpty()) {
            return WorkerSpec.javaMain(Main.class, "worker");
        }
        return WorkerSpec.of(workerCommand);
    }

    static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    @Command(name = "worker", description = "Serve the envelope protocol on stdin/stdout with the built-in handlers")
    static final class WorkerCommand implements Callable<Integer> {
        @Override
        public Integer call() throws Exception {
            WorkerRuntime.stdio(WorkerHandlerRegistry.withBuiltins()).run();
            return ExitCodes.SUCCESS;
        }
    }

    @Command(name = "request", description = "Fork a worker, send one request and print the response")
    static final class RequestCommand implements Callable<Integer> {
        @ParentCommand
        IpcMeshCommand parent;

        @Parameters(index = "0", description = "Message type")
        String type;

        @Parameters(index = "1", arity = "0..1", defaultValue = "null", description = "JSON payload")
        String payload;

        @Override
        public Integer call() {
            JsonNode body = Jsons.parse(payload);
            try (ManagedProcess process = new ManagedProcess(parent.workerSpec(), parent.config().processOptions())) {
                process.start();
                JsonNode response = await(process.request(type, body));
                parent.spec.commandLine().getOut().println(Jsons.toJson(response));
                return ExitCodes.SUCCESS;
            }
        }
    }

    @Command(name = "send", description = "Fork a worker and deliver one fire-and-forget message")
    static final class SendCommand implements Callable<Integer> {
        @ParentCommand
        IpcMeshCommand parent;

        @Parameters(index = "0", description = "Message type")
        String type;

        @Parameters(index = "1", arity = "0..1", defaultValue = "null", description = "JSON payload")
        String payload;

        @Option(names = {"--barrier"}, defaultValue = "echo",
                description = "Request type issued after the send so the worker handled it before shutdown; empty to skip")
        String barrier;

        @Override
        public Integer call() {
            JsonNode body = Jsons.parse(payload);
            try (ManagedProcess process = new ManagedProcess(parent.workerSpec(), parent.config().processOptions())) {
                process.start();
                process.send(type, body);
                if (barrier != null && !barrier.isBlank()) {
                    // the worker handles messages in order, so the barrier reply follows the send
                    await(process.request(barrier, null));
                }
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("sent", type);
                out.put("payload", body);
                parent.spec.commandLine().getOut().println(Jsons.toJson(out));
                return ExitCodes.SUCCESS;
            }
        }
    }

    @Command(name = "supervise", description = "Run requests against an auto-restarting worker and report lifecycle events")
    static final class SuperviseCommand implements Callable<Integer> {
        @ParentCommand
        IpcMeshCommand parent;

        @Option(names = {"--type"}, defaultValue = "echo", description = "Request type")
        String type;

        @Option(names = {"--payload"}, defaultValue = "null", description = "JSON payload")
        String payload;

        @Option(names = {"--count"}, defaultValue = "3", description = "Number of requests")
        int count;

        @Override
        public Integer call() {
            JsonNode body = Jsons.parse(payload);
            IpcMeshConfig config = parent.config().withAutoRestart(parent.autoRestart == null ? Boolean.TRUE : parent.autoRestart);
            PrintWriter out = parent.spec.commandLine().getOut();
            ProcessOptions options = config.processOptions();

            EventBus bus = EventBus.create(config.eventBusOptions());
            ManagedProcess process = new ManagedProcess(parent.workerSpec(), options);
            ServiceContainer container = new ServiceContainer();
            WorkerService worker = container.register("worker", new WorkerService(bus, process));
            bus.on(WorkerService.STARTED, pid -> out.println("start pid=" + pid));
            bus.on(WorkerService.EXITED, exit -> out.println("exit code=" + exit.exitCode()));
            bus.on(WorkerService.RESTARTED, n -> out.println("restart #" + n));
            bus.on(WorkerService.FAILED, error -> out.println("error " + error.getMessage()));

            List<Map<String, Object>> results = new ArrayList<>();
            int succeeded = 0;
            container.initAll();
            try {
                for (int i = 0; i < count; i++) {
                    awaitSettled(process, options);
                    Map<String, Object> row = new LinkedHashMap<>();
                    row.put("attempt", i + 1);
                    try {
                        row.put("response", await(worker.call(type, body)));
                        succeeded++;
                    } catch (RuntimeException e) {
                        row.put("error", e.getClass().getSimpleName() + ": " + e.getMessage());
                    }
                    results.add(row);
                    out.flush();
                }
            } finally {
                container.destroyAll();
            }

            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("requests", count);
            summary.put("succeeded", succeeded);
            summary.put("restarts", process.restartCount());
            summary.put("results", results);
            out.println(Jsons.toJson(summary));
            return succeeded == count ? ExitCodes.SUCCESS : ExitCodes.GENERIC_ERROR;
        }

        // an exit is reported before its replacement is forked
        private void awaitSettled(ManagedProcess process, ProcessOptions options) {
            long deadline = System.currentTimeMillis() + options.timeout().toMillis();
            while (System.currentTimeMillis() < deadline) {
                ProcessState state = process.state();
                if (state == ProcessState.RUNNING) {
                    return;
                }
                if (!options.autoRestart() || process.restartCount() >= options.maxRestarts()) {
                    return;
                }
                try {
                    Thread.sleep(SETTLE_POLL_MS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
    }

    @Command(name = "bus-demo", description = "Publish task:created to persistent and once subscribers")
    static final class BusDemoCommand implements Callable<Integer> {
        @ParentCommand
        IpcMeshCommand parent;

        @Option(names = {"--task-id"}, defaultValue = "t1", description = "Task id carried by the event")
        String taskId;

        @Override
        public Integer call() {
            EventBus bus = EventBus.create(parent.config().eventBusOptions());
            List<String> calls = new ArrayList<>();
            bus.<JsonNode>on("task:created", task -> calls.add("on:" + task.path("id").asText()));
            bus.<JsonNode>once("task:created", task -> calls.add("once:" + task.path("id").asText()));

            JsonNode event = Jsons.toTree(Map.of("id", taskId));
            await(bus.emit("task:created", event));
            int afterFirst = bus.listenerCount("task:created");
            await(bus.emit("task:created", event));

            Map<String, Object> out = new LinkedHashMap<>();
            out.put("calls", calls);
            out.put("listenersAfterFirstEmit", afterFirst);
            out.put("listenersAfterSecondEmit", bus.listenerCount("task:created"));
            out.put("events", bus.eventNames());
            parent.spec.commandLine().getOut().println(Jsons.toJson(out));
            return ExitCodes.SUCCESS;
        }
    }
}
