package com.tomopipe.runtime;

import com.tomopipe.PipelineException;

public class ConfigurationException extends PipelineException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
