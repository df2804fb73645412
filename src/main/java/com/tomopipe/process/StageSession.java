package com.tomopipe.process;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

public class StageSession {
    private static final int MAX_EVENTS = 50;

    private final String name;
    private final Path watchDir;
    private final Path outputDir;
    private final String description;
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    private final Deque<String> events = new ArrayDeque<>();

    private volatile SessionStatus status = SessionStatus.STARTING;
    private volatile Instant startedAt;
    private volatile Instant endedAt;
    private volatile String lastError;
    private volatile Future<?> future;

    public StageSession(String name, Path watchDir, Path outputDir, String description) {
        this.name = name;
        this.watchDir = watchDir;
        this.outputDir = outputDir;
        this.description = description;
    }

    public String name() {
        return name;
    }

    public Path watchDir() {
        return watchDir;
    }

    public Path outputDir() {
        return outputDir;
    }

    public String description() {
        return description;
    }

    public SessionStatus status() {
        return status;
    }

    public boolean isCancelRequested() {
        return cancelRequested.get() || Thread.currentThread().isInterrupted();
    }

    public void record(String event) {
        synchronized (events) {
            events.addLast(Instant.now() + " " + event);
            while (events.size() > MAX_EVENTS) {
                events.removeFirst();
            }
        }
    }

    public List<String> recentEvents() {
        synchronized (events) {
            return List.copyOf(events);
        }
    }

    public SessionInfo info() {
        return new SessionInfo(
                name,
                status,
                watchDir == null ? null : watchDir.toString(),
                outputDir == null ? null : outputDir.toString(),
                description,
                startedAt,
                endedAt,
                lastError,
                ProcessHandle.current().pid(),
                recentEvents());
    }

    void attach(Future<?> future) {
        this.future = future;
    }

    void markRunning() {
        startedAt = Instant.now();
        status = SessionStatus.RUNNING;
        record("started");
    }

    void markFinished(SessionStatus finalStatus, String error) {
        endedAt = Instant.now();
        lastError = error;
        status = finalStatus;
        record(error == null ? finalStatus.name().toLowerCase(Locale.ROOT) : finalStatus.name().toLowerCase(Locale.ROOT) + ": " + error);
    }

    boolean cancel() {
        boolean first = cancelRequested.compareAndSet(false, true);
        Future<?> running = future;
        if (running != null) {
            running.cancel(true);
        }
        return first;
    }
}
