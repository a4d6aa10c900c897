package io.ipcmesh.cli;

import io.ipcmesh.error.ConfigException;
import io.ipcmesh.error.ProcessExitedException;
import io.ipcmesh.error.ProcessFailureException;
import io.ipcmesh.error.ProcessSpawnException;
import io.ipcmesh.error.ProcessStateException;
import io.ipcmesh.error.RequestTimeoutException;
import io.ipcmesh.error.WorkerErrorException;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;

public final class ExitCodes {
    public static final int SUCCESS = 0;
    public static final int GENERIC_ERROR = 1;
    public static final int MISUSE = 2;
    public static final int CONFIG_ERROR = 64;
    public static final int DATA_ERROR = 65;
    public static final int SOFTWARE_ERROR = 70;
    public static final int OS_ERROR = 71;
    public static final int IO_ERROR = 74;
    public static final int TEMP_FAIL = 75;
    public static final int PROTOCOL_ERROR = 76;
    public static final int CANCELLED = 130;

    private ExitCodes() {
    }

    public static int forFailure(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof RequestTimeoutException) {
            return TEMP_FAIL;
        }
        if (cause instanceof WorkerErrorException || cause instanceof ProcessStateException) {
            return SOFTWARE_ERROR;
        }
        if (cause instanceof ProcessExitedException) {
            return PROTOCOL_ERROR;
        }
        if (cause instanceof ProcessSpawnException) {
            return OS_ERROR;
        }
        if (cause instanceof ProcessFailureException) {
            return IO_ERROR;
        }
        if (cause instanceof ConfigException) {
            return CONFIG_ERROR;
        }
        if (cause instanceof IllegalArgumentException) {
            return DATA_ERROR;
        }
        if (cause instanceof CancellationException || cause instanceof InterruptedException) {
            return CANCELLED;
        }
        return GENERIC_ERROR;
    }
}
