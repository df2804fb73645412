package com.tomopipe.monitor;

import java.time.Duration;

import com.tomopipe.PipelineException;

public class CompletionTimeoutException extends PipelineException {
    private final MonitorState stateAtTimeout;
    private final Duration waited;

    public CompletionTimeoutException(String gate, MonitorState stateAtTimeout, Duration waited) {
        super("Gate " + gate + " gave up in state " + stateAtTimeout + " after " + waited);
        this.stateAtTimeout = stateAtTimeout;
        this.waited = waited;
    }

    public MonitorState stateAtTimeout() {
        return stateAtTimeout;
    }

    public Duration waited() {
        return waited;
    }
}
