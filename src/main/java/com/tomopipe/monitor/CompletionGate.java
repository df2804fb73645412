package com.tomopipe.monitor;

import java.util.concurrent.CompletableFuture;

/**
 * Decides when an upstream stage has finished so a dependent stage may start.
 */
public interface CompletionGate {

    /**
     * Blocks until the gate reaches a terminal state.
     *
     * @return {@link MonitorState#DRAINED} or {@link MonitorState#CANCELLED}
     * @throws CompletionTimeoutException when a configured timeout elapses first
     */
    MonitorState await() throws CompletionTimeoutException, InterruptedException;

    /**
     * Completed exactly once with the terminal state.
     */
    CompletableFuture<MonitorState> completion();

    MonitorState state();

    void cancel();

    String describe();
}
