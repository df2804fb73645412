package com.tomopipe.monitor;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomopipe.process.Sleeper;
import com.tomopipe.stage.WatcherSnapshot;

/**
 * Gate driven by a watcher's own unit accounting instead of process counts. Drained once at least
 * one unit completed and the watcher has stayed idle, with no new completion, for the quiet period.
 */
public class WatcherDrainGate implements CompletionGate {
    private static final Logger log = LoggerFactory.getLogger(WatcherDrainGate.class);

    private final Supplier<WatcherSnapshot> snapshots;
    private final Duration quietPeriod;
    private final Duration pollInterval;
    private final Duration timeout;
    private final Sleeper sleeper;
    private final CompletableFuture<MonitorState> completion = new CompletableFuture<>();

    private volatile MonitorState state = MonitorState.NOT_STARTED;

    /**
     * @param timeout {@link Duration#ZERO} waits forever
     */
    public WatcherDrainGate(Supplier<WatcherSnapshot> snapshots, Duration quietPeriod, Duration pollInterval, Duration timeout,
            Sleeper sleeper) {
        this.snapshots = snapshots;
        this.quietPeriod = quietPeriod;
        this.pollInterval = pollInterval;
        this.timeout = timeout;
        this.sleeper = sleeper;
    }

    @Override
    public MonitorState await() throws CompletionTimeoutException, InterruptedException {
        Duration waited = Duration.ZERO;
        Duration quietFor = Duration.ZERO;
        int lastCompleted = -1;
        while (!completion.isDone()) {
            WatcherSnapshot snapshot = snapshots.get();
            int completed = snapshot.completedThisRun();
            if (completed > 0 && state == MonitorState.NOT_STARTED) {
                state = MonitorState.ACTIVE;
                log.info("gate.active stage={} completed={}", snapshot.stage(), completed);
            }

            if (state == MonitorState.ACTIVE && snapshot.idle() && completed == lastCompleted) {
                if (quietFor.compareTo(quietPeriod) >= 0) {
                    log.info("gate.drained stage={} completed={} failed={} quietFor={}", snapshot.stage(), completed, snapshot.failed(), quietFor);
                    return finish(MonitorState.DRAINED);
                }
            } else {
                quietFor = Duration.ZERO;
            }
            lastCompleted = completed;

            if (!timeout.isZero() && waited.compareTo(timeout) >= 0) {
                MonitorState phase = state;
                finish(MonitorState.TIMED_OUT);
                log.warn("gate.timeout stage={} phase={} waited={}", snapshot.stage(), phase, waited);
                throw new CompletionTimeoutException(describe(), phase, waited);
            }

            try {
                sleeper.sleep(pollInterval);
            } catch (InterruptedException e) {
                finish(MonitorState.CANCELLED);
                throw e;
            }
            waited = waited.plus(pollInterval);
            quietFor = quietFor.plus(pollInterval);
        }
        return completion.join();
    }

    @Override
    public CompletableFuture<MonitorState> completion() {
        return completion;
    }

    @Override
    public MonitorState state() {
        return state;
    }

    @Override
    public void cancel() {
        finish(MonitorState.CANCELLED);
    }

    @Override
    public String describe() {
        return "watcher-idle(quietPeriod=" + quietPeriod + ")";
    }

    private synchronized MonitorState finish(MonitorState terminal) {
        if (completion.isDone()) {
            return completion.join();
        }
        state = terminal;
        completion.complete(terminal);
        return terminal;
    }
}
