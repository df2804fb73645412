package com.tomopipe.pipeline;

import com.tomopipe.PipelineException;

public class LifecycleTransitionException extends PipelineException {
    private final DatasetLifecycle from;
    private final DatasetLifecycle to;

    public LifecycleTransitionException(String dataset, DatasetLifecycle from, DatasetLifecycle to) {
        super("Dataset " + dataset + " cannot move back from " + from + " to " + to);
        this.from = from;
        this.to = to;
    }

    public DatasetLifecycle from() {
        return from;
    }

    public DatasetLifecycle to() {
        return to;
    }
}
