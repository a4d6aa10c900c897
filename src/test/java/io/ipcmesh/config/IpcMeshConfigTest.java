package io.ipcmesh.config;

import io.ipcmesh.error.ConfigException;
import io.ipcmesh.process.ProcessOptions;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

final class IpcMeshConfigTest {

    @Test
    void emptyEnvironmentYieldsDefaults() {
        IpcMeshConfig config = IpcMeshConfig.fromEnvironment(Map.of());

        Assertions.assertEquals(30_000L, config.timeoutMs());
        Assertions.assertFalse(config.autoRestart());
        Assertions.assertEquals(3, config.maxRestarts());
        Assertions.assertEquals(10, config.maxListeners());
        Assertions.assertEquals(ProcessOptions.defaults(), config.processOptions());
    }

    @Test
    void readsPrefixedVariables() {
        IpcMeshConfig config = IpcMeshConfig.fromEnvironment(Map.of(
                "IPCMESH_TIMEOUT_MS", "250",
                "IPCMESH_AUTO_RESTART", "yes",
                "IPCMESH_MAX_RESTARTS", " 5 ",
                "IPCMESH_MAX_LISTENERS", "0",
                "TIMEOUT_MS", "1"
        ));

        ProcessOptions options = config.processOptions();
        Assertions.assertEquals(Duration.ofMillis(250), options.timeout());
        Assertions.assertTrue(options.autoRestart());
        Assertions.assertEquals(5, options.maxRestarts());
        Assertions.assertEquals(0, config.eventBusOptions().maxListeners());
    }

    @Test
    void reportsEveryInvalidVariableAtOnce() {
        ConfigException ex = Assertions.assertThrows(ConfigException.class, () -> IpcMeshConfig.fromEnvironment(Map.of(
                "IPCMESH_TIMEOUT_MS", "soon",
                "IPCMESH_AUTO_RESTART", "maybe",
                "IPCMESH_MAX_RESTARTS", "-1"
        )));

        Assertions.assertEquals(3, ex.problems().size());
        Assertions.assertTrue(ex.getMessage().contains("TIMEOUT_MS: expected a number"));
        Assertions.assertTrue(ex.getMessage().contains("AUTO_RESTART: expected a boolean"));
        Assertions.assertTrue(ex.getMessage().contains("MAX_RESTARTS: must be >= 0"));
    }

    @Test
    void zeroTimeoutIsRejected() {
        ConfigException ex = Assertions.assertThrows(ConfigException.class,
                () -> IpcMeshConfig.fromEnvironment(Map.of("IPCMESH_TIMEOUT_MS", "0")));

        Assertions.assertEquals(1, ex.problems().size());
    }

    @Test
    void explicitOverridesWinAndNullKeepsTheCurrentValue() {
        IpcMeshConfig config = IpcMeshConfig.defaults()
                .withTimeoutMs(50L)
                .withAutoRestart(null)
                .withMaxRestarts(1);

        Assertions.assertEquals(50L, config.timeoutMs());
        Assertions.assertFalse(config.autoRestart());
        Assertions.assertEquals(1, config.maxRestarts());
    }
}
