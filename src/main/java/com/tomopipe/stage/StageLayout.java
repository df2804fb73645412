package com.tomopipe.stage;

import java.nio.file.Path;

/**
 * Directories bound to one watch-stage. {@code sideChannelDir} holds thumbnails and may be null;
 * {@code logDir} receives one worker log per unit.
 */
public record StageLayout(
        String stage,
        Path watchDir,
        Path outputDir,
        Path processedDir,
        Path sideChannelDir,
        Path logDir) {

    public Path stagingDir(String unit) {
        return outputDir.resolve(".staging").resolve(unit);
    }
}
