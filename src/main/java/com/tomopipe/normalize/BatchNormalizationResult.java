package com.tomopipe.normalize;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

public record BatchNormalizationResult(List<NormalizationReport> reports, Map<Path, String> failures) {

    public boolean allSucceeded() {
        return failures.isEmpty();
    }
}
