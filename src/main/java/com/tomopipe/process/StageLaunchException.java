package com.tomopipe.process;

import com.tomopipe.PipelineException;

public class StageLaunchException extends PipelineException {
    private final String stage;

    public StageLaunchException(String stage, String message) {
        super("Stage " + stage + ": " + message);
        this.stage = stage;
    }

    public StageLaunchException(String stage, String message, Throwable cause) {
        super("Stage " + stage + ": " + message, cause);
        this.stage = stage;
    }

    public String stage() {
        return stage;
    }
}
