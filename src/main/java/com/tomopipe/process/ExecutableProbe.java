package com.tomopipe.process;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

public class ExecutableProbe {
    private final SystemInspector inspector;

    public ExecutableProbe() {
        this(new DefaultSystemInspector());
    }

    public ExecutableProbe(SystemInspector inspector) {
        this.inspector = inspector;
    }

    public ProbeReport probe(Collection<String> executables) {
        Map<String, String> checks = new LinkedHashMap<>();
        for (String executable : executables) {
            boolean found = executable.contains("/")
                    ? inspector.isExecutableFile(executable)
                    : inspector.commandExists(executable);
            checks.put(executable, status(found, "not found on PATH"));
        }
        String failure = checks.entrySet().stream()
                .filter(entry -> entry.getValue().startsWith("FAIL"))
                .map(entry -> entry.getKey() + ": " + entry.getValue().substring(6))
                .findFirst()
                .orElse("");
        boolean available = failure.isEmpty();
        return new ProbeReport(available, available ? "" : failure, checks);
    }

    public void require(String stage, Collection<String> executables) throws StageLaunchException {
        ProbeReport report = probe(executables);
        if (!report.available()) {
            throw new StageLaunchException(stage, "required executable missing (" + report.reason() + ")");
        }
    }

    private static String status(boolean pass, String reason) {
        return pass ? "PASS" : "FAIL: " + reason;
    }

    public record ProbeReport(boolean available, String reason, Map<String, String> checks) {
    }

    public interface SystemInspector {
        boolean isExecutableFile(String path);

        boolean commandExists(String command);
    }

    static class DefaultSystemInspector implements SystemInspector {
        @Override
        public boolean isExecutableFile(String path) {
            Path file = Path.of(path);
            return Files.isRegularFile(file) && Files.isExecutable(file);
        }

        @Override
        public boolean commandExists(String command) {
            try {
                Process process = new ProcessBuilder("bash", "-lc", "command -v " + command).start();
                return process.waitFor() == 0;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            } catch (IOException e) {
                return false;
            }
        }
    }
}
