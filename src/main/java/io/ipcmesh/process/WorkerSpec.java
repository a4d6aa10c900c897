package io.ipcmesh.process;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public record WorkerSpec(
        List<String> command,
        Map<String, String> environment,
        Path workingDirectory,
        boolean inheritStderr
) {
    public WorkerSpec {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("worker command cannot be empty");
        }
        command = List.copyOf(command);
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }

    public static WorkerSpec of(List<String> command) {
        return new WorkerSpec(command, Map.of(), null, true);
    }

    public static WorkerSpec of(String... command) {
        return of(List.of(command));
    }

    public static WorkerSpec javaMain(Class<?> mainClass, String... args) {
        List<String> command = new ArrayList<>();
        command.add(javaExecutable());
        command.add("-cp");
        command.add(System.getProperty("java.class.path"));
        command.add(mainClass.getName());
        command.addAll(List.of(args));
        return of(command);
    }

    public WorkerSpec withEnvironment(String key, String value) {
        Map<String, String> merged = new LinkedHashMap<>(environment);
        merged.put(key, value);
        return new WorkerSpec(command, merged, workingDirectory, inheritStderr);
    }

    public WorkerSpec withWorkingDirectory(Path value) {
        return new WorkerSpec(command, environment, value, inheritStderr);
    }

    public WorkerSpec withInheritStderr(boolean value) {
        return new WorkerSpec(command, environment, workingDirectory, value);
    }

    static String javaExecutable() {
        String exe = System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win") ? "java.exe" : "java";
        return Paths.get(System.getProperty("java.home"), "bin", exe).toString();
    }

    @Override
    public String toString() {
        return String.join(" ", command);
    }
}
