package com.tomopipe.process;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs external worker commands to completion. Stdout and stderr of every command are drained on
 * threads owned by this runner, one per stream, so a worker that writes a lot never waits for
 * another stage's worker to finish.
 */
public class CommandRunner {
    private static final Logger log = LoggerFactory.getLogger(CommandRunner.class);

    static final int TIMEOUT_EXIT_CODE = 124;
    static final int INTERRUPTED_EXIT_CODE = 130;
    static final int LAUNCH_FAILURE_EXIT_CODE = 127;

    private static final Duration STREAM_GRACE = Duration.ofSeconds(5);
    private static final AtomicInteger DRAIN_THREADS = new AtomicInteger();

    private final Duration timeout;
    private final ProcessStarter processStarter;
    private final ExecutorService drains = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "command-output-" + DRAIN_THREADS.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    });

    private enum Ending {
        EXITED,
        TIMED_OUT,
        INTERRUPTED
    }

    /**
     * @param timeout maximum run time per command; {@link Duration#ZERO} waits indefinitely
     */
    public CommandRunner(Duration timeout) {
        this(timeout, (workingDirectory, command) -> new ProcessBuilder(command)
                .directory(workingDirectory == null ? null : workingDirectory.toFile())
                .start());
    }

    public CommandRunner(Duration timeout, ProcessStarter processStarter) {
        this.timeout = timeout;
        this.processStarter = processStarter;
    }

    public CommandResult run(Path workingDirectory, List<String> command) {
        return run(workingDirectory, command.toArray(String[]::new));
    }

    public CommandResult run(Path workingDirectory, String... command) {
        Process process;
        try {
            process = processStarter.start(workingDirectory, command);
        } catch (IOException e) {
            return new CommandResult(LAUNCH_FAILURE_EXIT_CODE, "", e.getMessage(), false, false, true);
        }

        Future<String> stdout = drains.submit(() -> drain(process.getInputStream()));
        Future<String> stderr = drains.submit(() -> drain(process.getErrorStream()));

        Ending ending;
        try {
            ending = awaitExit(process) ? Ending.EXITED : Ending.TIMED_OUT;
        } catch (InterruptedException e) {
            ending = Ending.INTERRUPTED;
        }
        if (ending != Ending.EXITED) {
            process.destroyForcibly();
        }

        String out = collect(stdout, command[0]);
        String err = collect(stderr, command[0]);
        return switch (ending) {
            case EXITED -> new CommandResult(process.exitValue(), out, err, false, false, false);
            case TIMED_OUT -> new CommandResult(TIMEOUT_EXIT_CODE, out, err, true, false, false);
            case INTERRUPTED -> {
                Thread.currentThread().interrupt();
                yield new CommandResult(INTERRUPTED_EXIT_CODE, out, err, false, true, false);
            }
        };
    }

    private boolean awaitExit(Process process) throws InterruptedException {
        if (timeout.isZero()) {
            process.waitFor();
            return true;
        }
        return process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private static String drain(InputStream stream) throws IOException {
        try (InputStream in = stream) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
        }
    }

    /**
     * A killed worker can leave a grandchild holding the pipe open; output still unread after the
     * grace period is dropped.
     */
    private static String collect(Future<String> output, String executable) {
        try {
            return output.get(STREAM_GRACE.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            output.cancel(true);
            return "";
        } catch (TimeoutException e) {
            output.cancel(true);
            log.warn("command.output-abandoned executable={} graceMs={}", executable, STREAM_GRACE.toMillis());
            return "";
        } catch (ExecutionException e) {
            log.warn("command.output-unreadable executable={} reason={}", executable, e.getCause().getMessage());
            return "";
        }
    }

    @FunctionalInterface
    public interface ProcessStarter {
        Process start(Path workingDirectory, String... command) throws IOException;
    }
}
