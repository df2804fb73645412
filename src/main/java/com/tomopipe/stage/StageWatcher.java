package com.tomopipe.stage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomopipe.process.Sleeper;
import com.tomopipe.process.StageSession;

/**
 * Watches one directory and hands each complete, unclaimed unit to its {@link StageBinding} exactly
 * once. Successful units are delivered to the output directory and their inputs relocated to the
 * processed directory; failed units stay where they were and are marked {@link UnitState#FAILED}
 * until an operator resets them.
 */
public class StageWatcher {
    private static final Logger log = LoggerFactory.getLogger(StageWatcher.class);

    private final StageBinding binding;
    private final StageLayout layout;
    private final UnitStateStore stateStore;
    private final Duration pollInterval;
    private final Sleeper sleeper;
    private final List<UnitListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<String, CompletableFuture<UnitOutcome>> completions = new ConcurrentHashMap<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger completedThisRun = new AtomicInteger();

    private volatile boolean reconciled;
    private volatile WatcherSnapshot snapshot;

    public StageWatcher(StageBinding binding, StageLayout layout, UnitStateStore stateStore, Duration pollInterval, Sleeper sleeper) {
        this.binding = binding;
        this.layout = layout;
        this.stateStore = stateStore;
        this.pollInterval = pollInterval;
        this.sleeper = sleeper;
        this.snapshot = new WatcherSnapshot(layout.stage(), 0, 0, 0, 0, 0, 0, null);
    }

    public String stage() {
        return layout.stage();
    }

    public StageLayout layout() {
        return layout;
    }

    public void addListener(UnitListener listener) {
        listeners.add(listener);
    }

    /**
     * Blocks until the session is cancelled. Scan failures are logged and retried on the next tick.
     */
    public void run(StageSession session) throws InterruptedException {
        log.info("watcher.start stage={} watchDir={} outputDir={} processedDir={}",
                stage(), layout.watchDir(), layout.outputDir(), layout.processedDir());
        while (!session.isCancelRequested()) {
            try {
                int processed = runOnce();
                if (processed > 0) {
                    session.record("processed " + processed + " unit(s); " + snapshot);
                }
            } catch (IOException e) {
                log.error("watcher.scan-failed stage={} reason={}", stage(), e.getMessage(), e);
                session.record("scan failed: " + e.getMessage());
            }
            sleeper.sleep(pollInterval);
        }
        log.info("watcher.stop stage={}", stage());
    }

    /**
     * One scan of the watch directory.
     *
     * @return number of units handed to the worker during this scan
     */
    public int runOnce() throws IOException, InterruptedException {
        prepareDirectories();
        if (!reconciled) {
            reconcile();
            reconciled = true;
        }

        List<WorkUnit> units = Files.isDirectory(layout.watchDir()) ? binding.detect(layout.watchDir()) : List.of();
        int processed = 0;
        int pending = 0;
        for (WorkUnit unit : units) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("watcher " + stage() + " interrupted");
            }
            UnitState state = stateStore.get(unit.name()).map(record -> record.state).orElse(UnitState.PENDING);
            if (state == UnitState.COMPLETED || state == UnitState.FAILED) {
                continue;
            }
            if (binding.alreadyProduced(unit, layout)) {
                log.warn("watcher.skip stage={} unit={} reason=output-already-present", stage(), unit.name());
                relocateInputs(unit);
                complete(unit, UnitState.COMPLETED, "output already present");
                continue;
            }
            if (inputsAlreadyProcessed(unit)) {
                log.warn("watcher.skip stage={} unit={} reason=input-already-in-processed-dir", stage(), unit.name());
                complete(unit, UnitState.COMPLETED, "input already relocated to " + layout.processedDir());
                continue;
            }
            if (!binding.isReady(unit, layout)) {
                pending++;
                continue;
            }
            if (binding.requiresLease()) {
                Optional<UnitLease> lease = UnitLease.tryAcquire(layout.watchDir(), unit.name(), stage());
                if (lease.isEmpty()) {
                    log.debug("watcher.leased stage={} unit={}", stage(), unit.name());
                    pending++;
                    continue;
                }
                try (UnitLease held = lease.get()) {
                    process(unit);
                }
            } else {
                process(unit);
            }
            processed++;
        }
        refreshSnapshot(units.size(), pending);
        return processed;
    }

    /**
     * Counts from the last completed scan, with in-flight and completed-this-run counts read live.
     */
    public WatcherSnapshot snapshot() {
        WatcherSnapshot last = snapshot;
        return new WatcherSnapshot(last.stage(), last.detected(), last.pending(), inFlight.get(), last.completed(),
                last.failed(), completedThisRun.get(), last.lastScanAt());
    }

    public CompletableFuture<UnitOutcome> completion(String unit) {
        return completions.computeIfAbsent(unit, name -> new CompletableFuture<>());
    }

    public boolean resetFailed(String unit) throws IOException {
        if (!stateStore.resetFailed(unit)) {
            return false;
        }
        completions.remove(unit);
        log.info("watcher.reset stage={} unit={}", stage(), unit);
        return true;
    }

    private void process(WorkUnit unit) throws IOException, InterruptedException {
        Path workDir = layout.stagingDir(unit.name());
        Relocations.deleteTree(workDir);
        Files.createDirectories(workDir);

        UnitRecord record = stateStore.update(unit.name(), UnitState.CLAIMED, null);
        record.inputs = unit.inputs().stream().map(Path::toString).toList();
        stateStore.put(record);
        log.info("watcher.claim stage={} unit={} attempt={}", stage(), unit.name(), record.attempts);

        inFlight.incrementAndGet();
        List<Path[]> staged = new ArrayList<>();
        try {
            if (binding.consumesInputsInPlace()) {
                for (Path input : unit.inputs()) {
                    Path target = workDir.resolve(input.getFileName());
                    Relocations.move(input, target);
                    staged.add(new Path[] { input, target });
                }
            }
            binding.process(unit, workDir, layout);
            deliver(unit, workDir);
            complete(unit, UnitState.COMPLETED, null);
        } catch (UnitProcessingException e) {
            rollback(staged, workDir);
            fail(unit, e.getMessage());
        } catch (IOException e) {
            rollback(staged, workDir);
            fail(unit, new UnitProcessingException(stage(), unit.name(), "relocation failed: " + e.getMessage(), e).getMessage());
        } catch (InterruptedException e) {
            rollback(staged, workDir);
            stateStore.update(unit.name(), UnitState.PENDING, "interrupted");
            throw e;
        } finally {
            inFlight.decrementAndGet();
        }
    }

    private void deliver(WorkUnit unit, Path workDir) throws IOException, UnitProcessingException {
        if (binding.consumesInputsInPlace()) {
            Relocations.move(workDir, layout.outputDir().resolve(unit.name()));
            return;
        }
        List<String> artifacts = binding.artifacts(unit);
        for (String artifact : artifacts) {
            if (!Files.exists(workDir.resolve(artifact))) {
                throw new UnitProcessingException(stage(), unit.name(), "worker finished without producing " + artifact);
            }
            if (Files.exists(layout.outputDir().resolve(artifact))) {
                throw new UnitProcessingException(stage(), unit.name(), "output already holds " + artifact);
            }
        }
        List<String> delivered = new ArrayList<>();
        try {
            for (String artifact : artifacts) {
                Relocations.move(workDir.resolve(artifact), layout.outputDir().resolve(artifact));
                delivered.add(artifact);
            }
        } catch (IOException e) {
            withdraw(unit, delivered, workDir);
            throw e;
        }
        relocateInputs(unit);
        Relocations.deleteTree(workDir);
    }

    /**
     * Takes back artifacts of a partial delivery so the output directory holds all of a unit or none.
     */
    private void withdraw(WorkUnit unit, List<String> delivered, Path workDir) {
        for (String artifact : delivered) {
            try {
                Relocations.move(layout.outputDir().resolve(artifact), workDir.resolve(artifact));
            } catch (IOException e) {
                log.error("watcher.withdraw-failed stage={} unit={} artifact={} reason={}", stage(), unit.name(), artifact, e.getMessage());
            }
        }
    }

    private void relocateInputs(WorkUnit unit) throws IOException {
        if (binding.consumesInputsInPlace() || layout.processedDir() == null) {
            return;
        }
        for (Path input : unit.inputs()) {
            Path target = layout.processedDir().resolve(input.getFileName());
            if (Files.exists(input) && !Files.exists(target)) {
                Relocations.move(input, target);
            }
        }
    }

    private boolean inputsAlreadyProcessed(WorkUnit unit) {
        if (binding.consumesInputsInPlace() || layout.processedDir() == null) {
            return false;
        }
        return unit.inputs().stream().allMatch(input -> Files.exists(layout.processedDir().resolve(input.getFileName())));
    }

    private void rollback(List<Path[]> staged, Path workDir) {
        for (Path[] move : staged) {
            try {
                if (Files.exists(move[1]) && !Files.exists(move[0])) {
                    Relocations.move(move[1], move[0]);
                }
            } catch (IOException e) {
                log.error("watcher.rollback-failed stage={} staged={} original={} reason={}", stage(), move[1], move[0], e.getMessage());
            }
        }
        try {
            Relocations.deleteTree(workDir);
        } catch (IOException e) {
            log.warn("watcher.cleanup-failed stage={} workDir={} reason={}", stage(), workDir, e.getMessage());
        }
    }

    /**
     * Settles units left {@link UnitState#CLAIMED} by a previous run: finished units are completed,
     * unfinished ones are rolled back to their watch directory and become pending again.
     */
    void reconcile() throws IOException {
        for (UnitRecord record : stateStore.all().values()) {
            if (record.state != UnitState.CLAIMED) {
                continue;
            }
            WorkUnit unit = new WorkUnit(record.name, record.inputs.stream().map(Path::of).toList());
            Path workDir = layout.stagingDir(record.name);
            if (binding.alreadyProduced(unit, layout)) {
                relocateInputs(unit);
                Relocations.deleteTree(workDir);
                complete(unit, UnitState.COMPLETED, "recovered after restart");
                continue;
            }
            List<Path[]> staged = new ArrayList<>();
            for (Path input : unit.inputs()) {
                staged.add(new Path[] { input, workDir.resolve(input.getFileName()) });
            }
            rollback(staged, workDir);
            stateStore.update(record.name, UnitState.PENDING, "rolled back after restart");
            log.warn("watcher.recover stage={} unit={} action=rollback", stage(), record.name);
        }
    }

    private void complete(WorkUnit unit, UnitState state, String detail) throws IOException {
        stateStore.update(unit.name(), state, state == UnitState.FAILED ? detail : null);
        if (state == UnitState.COMPLETED) {
            completedThisRun.incrementAndGet();
            log.info("watcher.done stage={} unit={}{}", stage(), unit.name(), detail == null ? "" : " detail=" + detail);
        }
        UnitOutcome outcome = new UnitOutcome(stage(), unit.name(), state, detail, Instant.now());
        completion(unit.name()).complete(outcome);
        for (UnitListener listener : listeners) {
            listener.onOutcome(outcome);
        }
    }

    private void fail(WorkUnit unit, String reason) throws IOException {
        log.error("watcher.unit-failed stage={} unit={} reason={}", stage(), unit.name(), reason);
        complete(unit, UnitState.FAILED, reason);
    }

    private void prepareDirectories() throws IOException {
        Files.createDirectories(layout.outputDir());
        if (layout.processedDir() != null) {
            Files.createDirectories(layout.processedDir());
        }
        if (layout.sideChannelDir() != null) {
            Files.createDirectories(layout.sideChannelDir());
        }
        if (layout.logDir() != null) {
            Files.createDirectories(layout.logDir());
        }
    }

    private void refreshSnapshot(int detected, int pending) throws IOException {
        int completed = 0;
        int failed = 0;
        for (UnitRecord record : stateStore.all().values()) {
            if (record.state == UnitState.COMPLETED) {
                completed++;
            } else if (record.state == UnitState.FAILED) {
                failed++;
            }
        }
        snapshot = new WatcherSnapshot(stage(), detected, pending, inFlight.get(), completed, failed,
                completedThisRun.get(), Instant.now());
    }

    @FunctionalInterface
    public interface UnitListener {
        void onOutcome(UnitOutcome outcome);
    }
}
