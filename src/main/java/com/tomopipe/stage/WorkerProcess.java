package com.tomopipe.stage;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomopipe.process.CommandResult;
import com.tomopipe.process.CommandRunner;

/**
 * Runs one external worker command for a unit and appends its output to the unit's log under the
 * stage log directory.
 */
public class WorkerProcess {
    private static final Logger log = LoggerFactory.getLogger(WorkerProcess.class);

    private final CommandRunner runner;

    public WorkerProcess(CommandRunner runner) {
        this.runner = runner;
    }

    public CommandResult run(String stage, String unit, Path workDir, Path logDir, List<String> command)
            throws UnitProcessingException, InterruptedException {
        log.info("worker.start stage={} unit={} command={}", stage, unit, command.get(0));
        CommandResult result = runner.run(workDir, command);
        appendLog(stage, unit, logDir, command, result);
        if (result.interrupted()) {
            throw new InterruptedException("worker " + command.get(0) + " interrupted for unit " + unit);
        }
        if (!result.isSuccess()) {
            throw new UnitProcessingException(stage, unit, command.get(0) + " failed: " + result.describe());
        }
        log.info("worker.done stage={} unit={} command={}", stage, unit, command.get(0));
        return result;
    }

    public static Path logFile(Path logDir, String unit) {
        return logDir.resolve(unit + ".log");
    }

    private void appendLog(String stage, String unit, Path logDir, List<String> command, CommandResult result) {
        if (logDir == null) {
            return;
        }
        StringBuilder entry = new StringBuilder()
                .append("# ").append(Instant.now()).append(' ').append(stage).append('\n')
                .append("$ ").append(String.join(" ", command)).append('\n');
        if (!result.stdout().isEmpty()) {
            entry.append(result.stdout()).append('\n');
        }
        if (!result.stderr().isEmpty()) {
            entry.append("[stderr]\n").append(result.stderr()).append('\n');
        }
        entry.append("# ").append(result.describe()).append("\n\n");
        try {
            Files.createDirectories(logDir);
            Files.writeString(logFile(logDir, unit), entry, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.warn("worker.log-failed stage={} unit={} reason={}", stage, unit, e.getMessage());
        }
    }
}
