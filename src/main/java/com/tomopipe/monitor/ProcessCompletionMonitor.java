package com.tomopipe.monitor;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomopipe.process.Sleeper;

/**
 * Infers that an upstream stage has drained by sampling how many of its worker processes are alive.
 *
 * <p>The monitor stays {@link MonitorState#NOT_STARTED} until a sample reaches the warm-up
 * threshold, then waits for a run of consecutive samples at or below the drained threshold. A
 * single low sample is not enough by default because a stage running its workers one after another
 * shows a count of zero between two units. A burst of work that starts and ends between two
 * samples is not seen at all; the optional warm-up timeout is the only way out of that case.</p>
 *
 * <p>Timeouts are counted in poll intervals slept, not wall-clock time.</p>
 */
public class ProcessCompletionMonitor implements CompletionGate {
    private static final Logger log = LoggerFactory.getLogger(ProcessCompletionMonitor.class);

    private final String pattern;
    private final ProcessCountSource source;
    private final int warmupThreshold;
    private final int drainedThreshold;
    private final int drainConfirmations;
    private final Duration pollInterval;
    private final Duration warmupTimeout;
    private final Duration drainTimeout;
    private final Sleeper sleeper;
    private final CompletableFuture<MonitorState> completion = new CompletableFuture<>();

    private volatile MonitorState state = MonitorState.NOT_STARTED;
    private volatile int lastSample = -1;

    /**
     * @param warmupTimeout {@link Duration#ZERO} waits for warm-up forever
     * @param drainTimeout {@link Duration#ZERO} waits for the drain forever
     */
    public ProcessCompletionMonitor(String pattern, ProcessCountSource source, int warmupThreshold, int drainedThreshold,
            Duration pollInterval, Duration warmupTimeout, Duration drainTimeout, Sleeper sleeper) {
        this(pattern, source, warmupThreshold, drainedThreshold, 1, pollInterval, warmupTimeout, drainTimeout, sleeper);
    }

    /**
     * @param drainConfirmations consecutive samples at or below the drained threshold needed to drain
     */
    public ProcessCompletionMonitor(String pattern, ProcessCountSource source, int warmupThreshold, int drainedThreshold,
            int drainConfirmations, Duration pollInterval, Duration warmupTimeout, Duration drainTimeout, Sleeper sleeper) {
        if (warmupThreshold < 1 || drainedThreshold < 0 || drainedThreshold >= warmupThreshold) {
            throw new IllegalArgumentException("Thresholds must satisfy 0 <= drained < warmup, got warmup="
                    + warmupThreshold + " drained=" + drainedThreshold);
        }
        if (drainConfirmations < 1) {
            throw new IllegalArgumentException("drainConfirmations must be >= 1, got " + drainConfirmations);
        }
        this.drainConfirmations = drainConfirmations;
        this.pattern = pattern;
        this.source = source;
        this.warmupThreshold = warmupThreshold;
        this.drainedThreshold = drainedThreshold;
        this.pollInterval = pollInterval;
        this.warmupTimeout = warmupTimeout;
        this.drainTimeout = drainTimeout;
        this.sleeper = sleeper;
    }

    @Override
    public MonitorState await() throws CompletionTimeoutException, InterruptedException {
        Duration waitedInPhase = Duration.ZERO;
        int drainedRun = 0;
        log.info("monitor.start pattern={} warmup={} drained={} confirmations={} pollInterval={}", pattern, warmupThreshold,
                drainedThreshold, drainConfirmations, pollInterval);
        while (!completion.isDone()) {
            int count = source.count();
            lastSample = count;
            if (completion.isDone()) {
                break;
            }

            if (state == MonitorState.NOT_STARTED && count >= warmupThreshold) {
                state = MonitorState.ACTIVE;
                waitedInPhase = Duration.ZERO;
                log.info("monitor.active pattern={} count={}", pattern, count);
            } else if (state == MonitorState.ACTIVE) {
                drainedRun = count <= drainedThreshold ? drainedRun + 1 : 0;
                if (drainedRun >= drainConfirmations) {
                    log.info("monitor.drained pattern={} count={} samples={}", pattern, count, drainedRun);
                    return finish(MonitorState.DRAINED);
                }
            }

            Duration timeout = state == MonitorState.NOT_STARTED ? warmupTimeout : drainTimeout;
            if (!timeout.isZero() && waitedInPhase.compareTo(timeout) >= 0) {
                MonitorState phase = state;
                finish(MonitorState.TIMED_OUT);
                log.warn("monitor.timeout pattern={} phase={} waited={} lastCount={}", pattern, phase, waitedInPhase, count);
                throw new CompletionTimeoutException(describe(), phase, waitedInPhase);
            }

            try {
                sleeper.sleep(pollInterval);
            } catch (InterruptedException e) {
                finish(MonitorState.CANCELLED);
                throw e;
            }
            waitedInPhase = waitedInPhase.plus(pollInterval);
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

    public int lastSample() {
        return lastSample;
    }

    @Override
    public void cancel() {
        if (finish(MonitorState.CANCELLED) == MonitorState.CANCELLED) {
            log.info("monitor.cancelled pattern={}", pattern);
        }
    }

    @Override
    public String describe() {
        return "process-sampling(" + pattern + ", warmup=" + warmupThreshold + ", drained=" + drainedThreshold
                + " x" + drainConfirmations + ")";
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
