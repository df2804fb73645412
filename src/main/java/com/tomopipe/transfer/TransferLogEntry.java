package com.tomopipe.transfer;

import java.time.Instant;

public record TransferLogEntry(
        Instant timestamp,
        String dataset,
        String unit,
        String durableId,
        TransferOutcome outcome,
        int filesCopied,
        int filesSkipped,
        long bytesCopied,
        int attempts,
        String details) {
}
