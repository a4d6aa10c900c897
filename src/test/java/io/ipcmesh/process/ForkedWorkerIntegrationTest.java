package io.ipcmesh.process;

import com.fasterxml.jackson.databind.JsonNode;
import io.ipcmesh.Main;
import io.ipcmesh.error.ProcessExitedException;
import io.ipcmesh.error.RequestTimeoutException;
import io.ipcmesh.error.WorkerErrorException;
import io.ipcmesh.model.ExitInfo;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs the built-in worker in a forked JVM on the test classpath.
 */
final class ForkedWorkerIntegrationTest {
    private static final WorkerSpec WORKER = WorkerSpec.javaMain(Main.class, "worker").withInheritStderr(false);
    private static final long WAIT_SECONDS = 30L;

    @Test
    void echoRoundTripThroughARealWorker() throws Exception {
        try (ManagedProcess process = ManagedProcess.create(WORKER, ProcessOptions.defaults())) {
            process.start();
            Assertions.assertTrue(process.isRunning());
            long pid = process.getPid().orElseThrow();

            JsonNode echoed = process.request("echo", Map.of("v", 1)).get(WAIT_SECONDS, TimeUnit.SECONDS);
            JsonNode reported = process.request("pid", null).get(WAIT_SECONDS, TimeUnit.SECONDS);

            Assertions.assertEquals(1, echoed.path("v").asInt());
            Assertions.assertEquals(pid, reported.path("pid").asLong());

            CompletableFuture<JsonNode> failed = process.request("fail", Map.of("message", "nope"));
            ExecutionException ex = Assertions.assertThrows(ExecutionException.class,
                    () -> failed.get(WAIT_SECONDS, TimeUnit.SECONDS));
            Assertions.assertInstanceOf(WorkerErrorException.class, ex.getCause());
            Assertions.assertTrue(process.isRunning());
        }
    }

    @Test
    void slowHandlerTimesOut() throws Exception {
        ProcessOptions options = ProcessOptions.defaults().withTimeoutMs(200);
        try (ManagedProcess process = ManagedProcess.create(WORKER, options)) {
            process.start();
            // first exchange absorbs JVM warm-up
            process.request("echo", null).exceptionally(error -> null).get(WAIT_SECONDS, TimeUnit.SECONDS);

            CompletableFuture<JsonNode> slow = process.request("sleep", Map.of("ms", 2_000));

            ExecutionException ex = Assertions.assertThrows(ExecutionException.class,
                    () -> slow.get(WAIT_SECONDS, TimeUnit.SECONDS));
            Assertions.assertInstanceOf(RequestTimeoutException.class, ex.getCause());
        }
    }

    @Test
    void crashedWorkerIsReplacedAndServesAgain() throws Exception {
        ProcessOptions options = ProcessOptions.defaults().withAutoRestart(true).withMaxRestarts(1);
        List<ExitInfo> exits = new CopyOnWriteArrayList<>();
        CountDownLatch restarted = new CountDownLatch(2);
        try (ManagedProcess process = ManagedProcess.create(WORKER, options)) {
            process.addListener(new ProcessListener() {
                @Override
                public void onStart(long pid) {
                    restarted.countDown();
                }

                @Override
                public void onExit(ExitInfo exit) {
                    exits.add(exit);
                }
            });
            process.start();
            long firstPid = process.getPid().orElseThrow();

            CompletableFuture<JsonNode> crash = process.request("crash", Map.of("code", 3));
            ExecutionException ex = Assertions.assertThrows(ExecutionException.class,
                    () -> crash.get(WAIT_SECONDS, TimeUnit.SECONDS));
            ProcessExitedException exited = Assertions.assertInstanceOf(ProcessExitedException.class, ex.getCause());
            Assertions.assertEquals(3, exited.exitCode());

            Assertions.assertTrue(restarted.await(WAIT_SECONDS, TimeUnit.SECONDS));
            Assertions.assertEquals(1, process.restartCount());
            Assertions.assertNotEquals(firstPid, process.getPid().orElseThrow());
            Assertions.assertEquals(List.of(new ExitInfo(3, false)), exits);
            JsonNode echoed = process.request("echo", "back").get(WAIT_SECONDS, TimeUnit.SECONDS);
            Assertions.assertEquals("back", echoed.asText());
        }
    }
}
