package io.ipcmesh.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.ipcmesh.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;
import java.util.stream.StreamSupport;

final class IpcMeshCommandTest {

    @Test
    void busDemoReportsOnceSemantics() {
        Result result = execute("bus-demo", "--task-id", "t1");

        Assertions.assertEquals(ExitCodes.SUCCESS, result.exitCode);
        JsonNode out = Jsons.parse(result.out);
        Assertions.assertEquals(List.of("on:t1", "once:t1", "on:t1"), texts(out.path("calls")));
        Assertions.assertEquals(1, out.path("listenersAfterFirstEmit").asInt());
        Assertions.assertEquals(1, out.path("listenersAfterSecondEmit").asInt());
        Assertions.assertEquals(List.of("task:created"), texts(out.path("events")));
    }

    @Test
    void requestEchoesThroughAForkedWorker() {
        Result result = execute("--timeout-ms", "30000", "request", "echo", "{\"v\":1}");

        Assertions.assertEquals(ExitCodes.SUCCESS, result.exitCode, result.err);
        Assertions.assertEquals(1, Jsons.parse(result.out).path("v").asInt());
    }

    @Test
    void invalidPayloadMapsToDataError() {
        Result result = execute("request", "echo", "{not json");

        Assertions.assertEquals(ExitCodes.DATA_ERROR, result.exitCode);
        Assertions.assertTrue(result.err.startsWith("Error: Invalid JSON"));
    }

    @Test
    void unknownSubcommandIsAUsageError() {
        Result result = execute("teleport");

        Assertions.assertEquals(ExitCodes.MISUSE, result.exitCode);
    }

    private static Result execute(String... args) {
        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();
        CommandLine cmd = IpcMeshCommand.commandLine();
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        int exitCode = cmd.execute(args);
        return new Result(exitCode, out.toString(), err.toString());
    }

    private static List<String> texts(JsonNode array) {
        return StreamSupport.stream(array.spliterator(), false)
                .map(JsonNode::asText)
                .toList();
    }

    private record Result(int exitCode, String out, String err) {
    }
}
