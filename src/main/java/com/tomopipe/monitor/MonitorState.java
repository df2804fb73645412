package com.tomopipe.monitor;

public enum MonitorState {
    NOT_STARTED,
    ACTIVE,
    DRAINED,
    CANCELLED,
    TIMED_OUT;

    public boolean isTerminal() {
        return this == DRAINED || this == CANCELLED || this == TIMED_OUT;
    }
}
