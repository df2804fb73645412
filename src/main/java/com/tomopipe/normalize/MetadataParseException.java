package com.tomopipe.normalize;

import java.nio.file.Path;

import com.tomopipe.PipelineException;

public class MetadataParseException extends PipelineException {
    private final Path source;

    public MetadataParseException(Path source, String message) {
        super(message + " [" + source + "]");
        this.source = source;
    }

    public MetadataParseException(Path source, String message, Throwable cause) {
        super(message + " [" + source + "]", cause);
        this.source = source;
    }

    public Path source() {
        return source;
    }
}
