package com.tomopipe.process;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs named stage sessions as background tasks. Each session can be listed, inspected and cancelled
 * on its own; cancelling one never touches the others.
 */
public class StageSupervisor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StageSupervisor.class);

    private final Map<String, StageSession> sessions = new ConcurrentHashMap<>();
    private final ExecutorService executor;
    private final SessionRegistry registry;

    public StageSupervisor(SessionRegistry registry) {
        this.registry = registry;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "stage-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public StageSession launch(String name, Path watchDir, Path outputDir, String description, StageTask task)
            throws StageLaunchException {
        StageSession session = new StageSession(name, watchDir, outputDir, description);
        StageSession existing = sessions.putIfAbsent(name, session);
        if (existing != null) {
            if (existing.status().isActive()) {
                throw new StageLaunchException(name, "a session with this name is already active");
            }
            sessions.put(name, session);
        }

        try {
            Future<?> future = executor.submit(() -> runSession(session, task));
            session.attach(future);
        } catch (RuntimeException e) {
            sessions.remove(name, session);
            throw new StageLaunchException(name, "unable to start session: " + e.getMessage(), e);
        }
        log.info("session.launched name={} watchDir={} outputDir={} description={}", name, watchDir, outputDir, description);
        publish();
        return session;
    }

    private void runSession(StageSession session, StageTask task) {
        if (session.isCancelRequested()) {
            return;
        }
        session.markRunning();
        publish();
        try {
            task.run(session);
            session.markFinished(session.isCancelRequested() ? SessionStatus.CANCELLED : SessionStatus.COMPLETED, null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            session.markFinished(SessionStatus.CANCELLED, null);
        } catch (Exception e) {
            if (session.isCancelRequested()) {
                session.markFinished(SessionStatus.CANCELLED, null);
            } else {
                log.error("session.failed name={} reason={}", session.name(), e.getMessage(), e);
                session.markFinished(SessionStatus.FAILED, e.getMessage());
            }
        }
        log.info("session.finished name={} status={}", session.name(), session.status());
        publish();
    }

    public List<StageSession> list() {
        List<StageSession> all = new ArrayList<>(sessions.values());
        all.sort(Comparator.comparing(StageSession::name));
        return all;
    }

    public Optional<StageSession> get(String name) {
        return Optional.ofNullable(sessions.get(name));
    }

    public boolean kill(String name) {
        StageSession session = sessions.get(name);
        if (session == null || !session.status().isActive()) {
            return false;
        }
        session.cancel();
        if (session.status() == SessionStatus.STARTING) {
            session.markFinished(SessionStatus.CANCELLED, null);
        }
        log.info("session.kill name={}", name);
        publish();
        return true;
    }

    public int killAll() {
        int killed = 0;
        for (StageSession session : list()) {
            if (kill(session.name())) {
                killed++;
            }
        }
        return killed;
    }

    public boolean hasActiveSessions() {
        return sessions.values().stream().anyMatch(session -> session.status().isActive());
    }

    /**
     * Drops kill requests written while no supervisor was running. Called before the first launch so
     * that a request aimed at an earlier run cannot cancel this one.
     *
     * @return the discarded session names
     */
    public List<String> discardPendingControlRequests() throws IOException {
        if (registry == null) {
            return List.of();
        }
        List<String> stale = registry.drainStopRequests();
        for (String request : stale) {
            log.warn("session.control discarded-stale name={}", request);
        }
        return stale;
    }

    /**
     * Applies kill requests left by another process through the registry's control files.
     */
    public void applyControlRequests() {
        if (registry == null) {
            return;
        }
        try {
            for (String request : registry.drainStopRequests()) {
                if (SessionRegistry.ALL.equals(request)) {
                    log.info("session.control request=kill-all");
                    killAll();
                } else if (!kill(request)) {
                    log.warn("session.control unknown-or-inactive name={}", request);
                }
            }
        } catch (IOException e) {
            log.warn("session.control unreadable reason={}", e.getMessage());
        }
    }

    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (hasActiveSessions()) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            Thread.sleep(50);
        }
        return true;
    }

    private void publish() {
        if (registry == null) {
            return;
        }
        try {
            registry.save(list().stream().map(StageSession::info).toList());
        } catch (IOException e) {
            log.warn("session.registry.write-failed reason={}", e.getMessage());
        }
    }

    @Override
    public void close() {
        killAll();
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("session.shutdown timed out with sessions still running");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        publish();
    }
}
