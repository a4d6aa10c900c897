package io.ipcmesh.config;

import io.ipcmesh.bus.EventBusOptions;
import io.ipcmesh.error.ConfigException;
import io.ipcmesh.process.ProcessOptions;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public final class IpcMeshConfig {
    public static final String ENV_PREFIX = "IPCMESH_";
    public static final String TIMEOUT_MS = "TIMEOUT_MS";
    public static final String AUTO_RESTART = "AUTO_RESTART";
    public static final String MAX_RESTARTS = "MAX_RESTARTS";
    public static final String MAX_LISTENERS = "MAX_LISTENERS";

    public static final long DEFAULT_TIMEOUT_MS = ProcessOptions.DEFAULT_TIMEOUT.toMillis();
    public static final boolean DEFAULT_AUTO_RESTART = false;
    public static final int DEFAULT_MAX_RESTARTS = ProcessOptions.DEFAULT_MAX_RESTARTS;
    public static final int DEFAULT_MAX_LISTENERS = EventBusOptions.DEFAULT_MAX_LISTENERS;

    private final long timeoutMs;
    private final boolean autoRestart;
    private final int maxRestarts;
    private final int maxListeners;

    public IpcMeshConfig(long timeoutMs, boolean autoRestart, int maxRestarts, int maxListeners) {
        this.timeoutMs = timeoutMs;
        this.autoRestart = autoRestart;
        this.maxRestarts = maxRestarts;
        this.maxListeners = maxListeners;
    }

    public static IpcMeshConfig defaults() {
        return new IpcMeshConfig(DEFAULT_TIMEOUT_MS, DEFAULT_AUTO_RESTART, DEFAULT_MAX_RESTARTS, DEFAULT_MAX_LISTENERS);
    }

    public static IpcMeshConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static IpcMeshConfig fromEnvironment(Map<String, String> env) {
        List<String> problems = new ArrayList<>();
        long timeoutMs = parseLong(env, TIMEOUT_MS, DEFAULT_TIMEOUT_MS, 1L, problems);
        boolean autoRestart = parseBoolean(env, AUTO_RESTART, DEFAULT_AUTO_RESTART, problems);
        int maxRestarts = (int) parseLong(env, MAX_RESTARTS, DEFAULT_MAX_RESTARTS, 0L, problems);
        int maxListeners = (int) parseLong(env, MAX_LISTENERS, DEFAULT_MAX_LISTENERS, 0L, problems);
        if (!problems.isEmpty()) {
            throw new ConfigException(problems);
        }
        return new IpcMeshConfig(timeoutMs, autoRestart, maxRestarts, maxListeners);
    }

    private static long parseLong(Map<String, String> env, String key, long fallback, long min, List<String> problems) {
        String raw = env.get(ENV_PREFIX + key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            long value = Long.parseLong(raw.trim());
            if (value < min) {
                problems.add(key + ": must be >= " + min + ", got " + value);
                return fallback;
            }
            if (value > Integer.MAX_VALUE && !TIMEOUT_MS.equals(key)) {
                problems.add(key + ": too large, got " + value);
                return fallback;
            }
            return value;
        } catch (NumberFormatException e) {
            problems.add(key + ": expected a number, got \"" + raw + "\"");
            return fallback;
        }
    }

    private static boolean parseBoolean(Map<String, String> env, String key, boolean fallback, List<String> problems) {
        String raw = env.get(ENV_PREFIX + key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        return switch (value) {
            case "true", "1", "yes", "on" -> true;
            case "false", "0", "no", "off" -> false;
            default -> {
                problems.add(key + ": expected a boolean, got \"" + raw + "\"");
                yield fallback;
            }
        };
    }

    public long timeoutMs() {
        return timeoutMs;
    }

    public boolean autoRestart() {
        return autoRestart;
    }

    public int maxRestarts() {
        return maxRestarts;
    }

    public int maxListeners() {
        return maxListeners;
    }

    public IpcMeshConfig withTimeoutMs(Long override) {
        return override == null ? this : new IpcMeshConfig(override, autoRestart, maxRestarts, maxListeners);
    }

    public IpcMeshConfig withAutoRestart(Boolean override) {
        return override == null ? this : new IpcMeshConfig(timeoutMs, override, maxRestarts, maxListeners);
    }

    public IpcMeshConfig withMaxRestarts(Integer override) {
        return override == null ? this : new IpcMeshConfig(timeoutMs, autoRestart, override, maxListeners);
    }

    public ProcessOptions processOptions() {
        return new ProcessOptions(Duration.ofMillis(timeoutMs), autoRestart, maxRestarts);
    }

    public EventBusOptions eventBusOptions() {
        return EventBusOptions.defaults().withMaxListeners(maxListeners);
    }
}
