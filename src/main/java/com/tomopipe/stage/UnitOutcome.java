package com.tomopipe.stage;

import java.time.Instant;

public record UnitOutcome(String stage, String unit, UnitState state, String detail, Instant at) {

    public boolean succeeded() {
        return state == UnitState.COMPLETED;
    }
}
