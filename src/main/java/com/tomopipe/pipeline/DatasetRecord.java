package com.tomopipe.pipeline;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import com.tomopipe.runtime.AcquisitionSoftware;

public class DatasetRecord {
    public String name;
    public String sourceDir;
    public AcquisitionSoftware software;
    public Double rawTiltAxis;
    public Double pixelSizeAngstrom;
    public Double exposurePerTilt;
    public DatasetLifecycle lifecycle = DatasetLifecycle.RAW;
    public Instant createdAt;
    public Instant updatedAt;
    public Map<DatasetLifecycle, Instant> transitions = new LinkedHashMap<>();
}
