package com.tomopipe.stage;

import java.time.Instant;

public record WatcherSnapshot(
        String stage,
        int detected,
        int pending,
        int inFlight,
        int completed,
        int failed,
        int completedThisRun,
        Instant lastScanAt) {

    public boolean idle() {
        return pending == 0 && inFlight == 0;
    }
}
