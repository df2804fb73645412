package com.tomopipe.stage;

public enum UnitState {
    PENDING,
    CLAIMED,
    COMPLETED,
    FAILED
}
