package com.tomopipe.stage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * What a {@link StageWatcher} runs: how complete units are recognised, what the worker produces and
 * how it is invoked. The watcher owns claiming, relocation and state.
 */
public interface StageBinding {

    List<WorkUnit> detect(Path watchDir) throws IOException;

    /**
     * Names, relative to the work directory, of the files the worker produces. Ignored when
     * {@link #consumesInputsInPlace()} is true: the whole work directory is then delivered as
     * {@code <outputDir>/<unit>}.
     */
    List<String> artifacts(WorkUnit unit);

    /**
     * True when the worker needs its inputs inside the work directory. Inputs are moved there before
     * processing, travel with the delivered directory on success and are moved back on failure.
     */
    boolean consumesInputsInPlace();

    void process(WorkUnit unit, Path workDir, StageLayout layout) throws UnitProcessingException, InterruptedException;

    default boolean isReady(WorkUnit unit, StageLayout layout) {
        return true;
    }

    /**
     * True when another consumer reads the same units; the watcher then holds a {@link UnitLease}
     * in the watch directory from claim until relocation or rollback.
     */
    default boolean requiresLease() {
        return false;
    }

    default boolean alreadyProduced(WorkUnit unit, StageLayout layout) {
        if (consumesInputsInPlace()) {
            return Files.exists(layout.outputDir().resolve(unit.name()));
        }
        List<String> artifacts = artifacts(unit);
        return !artifacts.isEmpty() && artifacts.stream().allMatch(name -> Files.exists(layout.outputDir().resolve(name)));
    }
}
