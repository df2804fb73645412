package com.tomopipe.stage;

import com.tomopipe.PipelineException;

public class UnitProcessingException extends PipelineException {
    private final String stage;
    private final String unit;

    public UnitProcessingException(String stage, String unit, String message) {
        super("Stage " + stage + " unit " + unit + ": " + message);
        this.stage = stage;
        this.unit = unit;
    }

    public UnitProcessingException(String stage, String unit, String message, Throwable cause) {
        super("Stage " + stage + " unit " + unit + ": " + message, cause);
        this.stage = stage;
        this.unit = unit;
    }

    public String stage() {
        return stage;
    }

    public String unit() {
        return unit;
    }
}
