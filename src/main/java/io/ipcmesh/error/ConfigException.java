package io.ipcmesh.error;

import java.util.List;

public final class ConfigException extends IpcException {
    private final List<String> problems;

    public ConfigException(List<String> problems) {
        super("Invalid environment variables:\n  - " + String.join("\n  - ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }
}
