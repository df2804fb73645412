package com.tomopipe.transfer;

public enum TransferOutcome {
    ARCHIVED,
    ALREADY_ARCHIVED,
    FAILED,
    RUN_SUMMARY
}
