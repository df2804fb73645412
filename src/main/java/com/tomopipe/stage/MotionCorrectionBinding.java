package com.tomopipe.stage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomopipe.imod.ImodCommands;
import com.tomopipe.normalize.FrameReference;
import com.tomopipe.normalize.MdocDocument;
import com.tomopipe.normalize.MetadataNormalizer;
import com.tomopipe.normalize.MetadataParseException;
import com.tomopipe.runtime.PipelineConfig.MotionCorrectionConfig;

/**
 * Motion correction of one tilt series: a canonical sidecar in the dataset directory whose frames
 * are all present under {@code Frames}. Produces the aligned stack and its adjusted sidecar.
 */
public class MotionCorrectionBinding implements StageBinding {
    private static final Logger log = LoggerFactory.getLogger(MotionCorrectionBinding.class);

    public static final String STAGE = "motion-correction";

    private final MotionCorrectionConfig config;
    private final Path framesDir;
    private final String gainPath;
    private final Duration settle;
    private final WorkerProcess worker;

    public MotionCorrectionBinding(MotionCorrectionConfig config, Path framesDir, String gainPath, Duration settle, WorkerProcess worker) {
        this.config = config;
        this.framesDir = framesDir;
        this.gainPath = gainPath;
        this.settle = settle;
        this.worker = worker;
    }

    @Override
    public List<WorkUnit> detect(Path watchDir) throws IOException {
        List<Path> sidecars;
        try (Stream<Path> stream = Files.list(watchDir)) {
            sidecars = stream.filter(Files::isRegularFile)
                    .filter(MetadataNormalizer::isCanonical)
                    .filter(path -> !path.getFileName().toString().startsWith("."))
                    .sorted()
                    .toList();
        }
        List<WorkUnit> units = new ArrayList<>();
        for (Path sidecar : sidecars) {
            if (framesPresent(sidecar)) {
                units.add(new WorkUnit(MetadataNormalizer.seriesName(sidecar), List.of(sidecar)));
            }
        }
        return units;
    }

    private boolean framesPresent(Path sidecar) throws IOException {
        List<FrameReference> frames;
        try {
            frames = MdocDocument.read(sidecar).framesByTiltAngle();
        } catch (MetadataParseException e) {
            log.warn("mc.sidecar-unreadable sidecar={} reason={}", sidecar.getFileName(), e.getMessage());
            return false;
        }
        if (frames.isEmpty()) {
            return false;
        }
        return frames.stream().allMatch(frame -> Files.isRegularFile(framesDir.resolve(frame.frameFileName())));
    }

    @Override
    public boolean isReady(WorkUnit unit, StageLayout layout) {
        if (settle.isZero()) {
            return true;
        }
        Instant threshold = Instant.now().minus(settle);
        try {
            if (modifiedAfter(unit.primaryInput(), threshold)) {
                return false;
            }
            for (FrameReference frame : MdocDocument.read(unit.primaryInput()).framesByTiltAngle()) {
                if (modifiedAfter(framesDir.resolve(frame.frameFileName()), threshold)) {
                    return false;
                }
            }
            return true;
        } catch (IOException | MetadataParseException e) {
            log.warn("mc.settle-check-failed unit={} reason={}", unit.name(), e.getMessage());
            return false;
        }
    }

    private static boolean modifiedAfter(Path path, Instant threshold) throws IOException {
        return Files.getLastModifiedTime(path).toInstant().isAfter(threshold);
    }

    @Override
    public List<String> artifacts(WorkUnit unit) {
        return List.of(unit.name() + ".mrc", unit.name() + MetadataNormalizer.CANONICAL_SUFFIX);
    }

    @Override
    public boolean consumesInputsInPlace() {
        return false;
    }

    @Override
    public void process(WorkUnit unit, Path workDir, StageLayout layout) throws UnitProcessingException, InterruptedException {
        Path stack = workDir.resolve(unit.name() + ".mrc");
        worker.run(STAGE, unit.name(), workDir, layout.logDir(),
                ImodCommands.alignframes(config, unit.primaryInput(), framesDir, stack, gainPath));

        if (config.isThumbnails() && layout.sideChannelDir() != null) {
            try {
                worker.run(STAGE, unit.name(), workDir, layout.logDir(),
                        ImodCommands.thumbnail(stack, layout.sideChannelDir().resolve(unit.name() + ".jpg")));
            } catch (UnitProcessingException e) {
                log.warn("mc.thumbnail-failed unit={} reason={}", unit.name(), e.getMessage());
            }
        }
    }
}
