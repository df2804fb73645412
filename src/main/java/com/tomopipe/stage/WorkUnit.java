package com.tomopipe.stage;

import java.nio.file.Path;
import java.util.List;

/**
 * One complete input unit found in a watch directory. {@code inputs} are the files or directories
 * the stage consumes; they are relocated, never deleted.
 */
public record WorkUnit(String name, List<Path> inputs) {

    public WorkUnit {
        inputs = List.copyOf(inputs);
    }

    public Path primaryInput() {
        return inputs.get(0);
    }
}
