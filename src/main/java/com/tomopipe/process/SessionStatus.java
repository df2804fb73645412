package com.tomopipe.process;

public enum SessionStatus {
    STARTING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isActive() {
        return this == STARTING || this == RUNNING;
    }
}
