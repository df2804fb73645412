package com.tomopipe.runtime;

public enum GateStrategy {
    PROCESS_SAMPLING,
    WATCHER_IDLE
}
