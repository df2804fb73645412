package com.tomopipe.stage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import com.tomopipe.imod.ImodCommands;
import com.tomopipe.normalize.MetadataNormalizer;
import com.tomopipe.runtime.PipelineConfig.ReconstructionConfig;

/**
 * Alignment and reconstruction of one motion-corrected tilt series. {@code batchruntomo} works in
 * the directory holding the stack, so the stack and its sidecar travel into the delivered
 * {@code <series>} directory.
 */
public class ReconstructionBinding implements StageBinding {
    public static final String STAGE = "reconstruction";
    public static final String TOMOGRAM_SUFFIX = "_rec.mrc";

    private final ReconstructionConfig config;
    private final Path directiveFile;
    private final Path doneDir;
    private final WorkerProcess worker;

    /**
     * @param doneDir where archived units end up; a tomogram there also counts as produced. May be null.
     */
    public ReconstructionBinding(ReconstructionConfig config, Path directiveFile, Path doneDir, WorkerProcess worker) {
        this.config = config;
        this.directiveFile = directiveFile;
        this.doneDir = doneDir;
        this.worker = worker;
    }

    @Override
    public List<WorkUnit> detect(Path watchDir) throws IOException {
        List<Path> stacks;
        try (Stream<Path> stream = Files.list(watchDir)) {
            stacks = stream.filter(Files::isRegularFile)
                    .filter(path -> {
                        String name = path.getFileName().toString();
                        return name.endsWith(".mrc") && !name.startsWith(".");
                    })
                    .sorted()
                    .toList();
        }
        List<WorkUnit> units = new ArrayList<>();
        for (Path stack : stacks) {
            String name = stack.getFileName().toString();
            String series = name.substring(0, name.length() - ".mrc".length());
            Path sidecar = stack.resolveSibling(series + MetadataNormalizer.CANONICAL_SUFFIX);
            if (Files.isRegularFile(sidecar)) {
                units.add(new WorkUnit(series, List.of(stack, sidecar)));
            }
        }
        return units;
    }

    @Override
    public List<String> artifacts(WorkUnit unit) {
        return List.of(tomogramName(unit.name()));
    }

    @Override
    public boolean consumesInputsInPlace() {
        return true;
    }

    @Override
    public boolean alreadyProduced(WorkUnit unit, StageLayout layout) {
        String tomogram = tomogramName(unit.name());
        if (Files.exists(layout.outputDir().resolve(unit.name()).resolve(tomogram))) {
            return true;
        }
        return doneDir != null && Files.exists(doneDir.resolve(unit.name()).resolve(tomogram));
    }

    @Override
    public void process(WorkUnit unit, Path workDir, StageLayout layout) throws UnitProcessingException, InterruptedException {
        worker.run(STAGE, unit.name(), workDir, layout.logDir(),
                ImodCommands.batchruntomo(config, unit.name(), workDir, directiveFile));
        if (!Files.isRegularFile(workDir.resolve(tomogramName(unit.name())))) {
            throw new UnitProcessingException(STAGE, unit.name(), "batchruntomo finished without " + tomogramName(unit.name()));
        }
    }

    public static String tomogramName(String series) {
        return series + TOMOGRAM_SUFFIX;
    }
}
