package com.tomopipe.normalize;

import java.nio.file.Path;
import java.util.List;

public record NormalizationReport(
        Path dataset,
        List<Path> sidecars,
        List<String> removed,
        List<String> renamed,
        List<String> rewritten,
        List<String> relocatedFrames,
        List<String> inconsistencies,
        Double canonicalTiltAxis) {

    public boolean consistent() {
        return inconsistencies.isEmpty();
    }
}
