package com.tomopipe.stage;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public class UnitRecord {
    public String name;
    public UnitState state = UnitState.PENDING;
    public int attempts;
    public String lastError;
    public Instant claimedAt;
    public Instant updatedAt;
    public List<String> inputs = new ArrayList<>();
}
