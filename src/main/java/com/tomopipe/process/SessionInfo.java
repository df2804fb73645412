package com.tomopipe.process;

import java.time.Instant;
import java.util.List;

public record SessionInfo(
        String name,
        SessionStatus status,
        String watchDir,
        String outputDir,
        String description,
        Instant startedAt,
        Instant endedAt,
        String lastError,
        long supervisorPid,
        List<String> recentEvents) {
}
