package io.ipcmesh.cli;

import io.ipcmesh.error.ConfigException;
import io.ipcmesh.error.ProcessExitedException;
import io.ipcmesh.error.ProcessFailureException;
import io.ipcmesh.error.ProcessSpawnException;
import io.ipcmesh.error.ProcessStateException;
import io.ipcmesh.error.RequestTimeoutException;
import io.ipcmesh.error.WorkerErrorException;
import io.ipcmesh.model.ProcessState;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ExitCodesTest {
    @Test
    void mapsSupervisorFailuresToSysexits() {
        assertEquals(ExitCodes.TEMP_FAIL, ExitCodes.forFailure(new RequestTimeoutException("echo", Duration.ofMillis(5))));
        assertEquals(ExitCodes.SOFTWARE_ERROR, ExitCodes.forFailure(new WorkerErrorException("fail", "nope")));
        assertEquals(ExitCodes.SOFTWARE_ERROR,
                ExitCodes.forFailure(new ProcessStateException("Process not started", ProcessState.NOT_STARTED)));
        assertEquals(ExitCodes.PROTOCOL_ERROR, ExitCodes.forFailure(new ProcessExitedException("Process exited", 1)));
        assertEquals(ExitCodes.OS_ERROR, ExitCodes.forFailure(new ProcessSpawnException("spawn", new IOException("x"))));
        assertEquals(ExitCodes.IO_ERROR, ExitCodes.forFailure(new ProcessFailureException("pipe", new IOException("x"))));
        assertEquals(ExitCodes.CONFIG_ERROR, ExitCodes.forFailure(new ConfigException(List.of("TIMEOUT_MS: bad"))));
        assertEquals(ExitCodes.DATA_ERROR, ExitCodes.forFailure(new IllegalArgumentException("Invalid JSON")));
        assertEquals(ExitCodes.GENERIC_ERROR, ExitCodes.forFailure(new IllegalStateException("?")));
    }

    @Test
    void unwrapsCompletionExceptions() {
        CompletionException wrapped = new CompletionException(new RequestTimeoutException("echo", Duration.ofMillis(5)));

        assertEquals(ExitCodes.TEMP_FAIL, ExitCodes.forFailure(wrapped));
    }
}
