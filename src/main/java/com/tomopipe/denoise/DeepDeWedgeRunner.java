package com.tomopipe.denoise;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomopipe.runtime.CheckpointSelection;
import com.tomopipe.runtime.PipelineConfig.DeepDeWedgeConfig;
import com.tomopipe.stage.UnitProcessingException;
import com.tomopipe.stage.WorkerProcess;

/**
 * Denoises a dataset's tomograms with DeepDeWedge once their half sets exist: a model is fitted on
 * a random sample of half-set pairs, and the chosen checkpoint then refines every pair.
 */
public class DeepDeWedgeRunner {
    private static final Logger log = LoggerFactory.getLogger(DeepDeWedgeRunner.class);

    public static final String STAGE = "deepdewedge";
    static final String FIT_CONFIG = "fit_config.yaml";
    static final String REFINE_CONFIG = "refine_config.yaml";
    static final String CHECKPOINT_SUFFIX = ".ckpt";

    private final DeepDeWedgeConfig config;
    private final Path projectDir;
    private final WorkerProcess worker;
    private final Path logDir;
    private final Random random;

    public DeepDeWedgeRunner(DeepDeWedgeConfig config, Path projectDir, WorkerProcess worker, Path logDir) {
        this(config, projectDir, worker, logDir, new Random(config.getSeed()));
    }

    DeepDeWedgeRunner(DeepDeWedgeConfig config, Path projectDir, WorkerProcess worker, Path logDir, Random random) {
        this.config = config;
        this.projectDir = projectDir;
        this.worker = worker;
        this.logDir = logDir;
        this.random = random;
    }

    public record HalfSetPair(Path evens, Path odds) {
    }

    /**
     * Fits and refines.
     *
     * @return the checkpoint the tomograms were refined with
     */
    public Path run(String dataset, List<Path> roots) throws IOException, UnitProcessingException, InterruptedException {
        List<HalfSetPair> pairs = locate(roots);
        if (pairs.isEmpty()) {
            throw new UnitProcessingException(STAGE, dataset, "no half-set pairs under " + roots);
        }
        Files.createDirectories(projectDir);
        List<HalfSetPair> training = trainingSample(pairs);
        log.info("ddw.start dataset={} pairs={} training={}", dataset, pairs.size(),
                training.stream().map(pair -> pair.evens().getFileName().toString()).toList());

        Path fitConfig = DeepDeWedgeConfigFile.write(projectDir.resolve(FIT_CONFIG), config, projectDir, training, null);
        ddw(dataset, "prepare-data", fitConfig);
        ddw(dataset, "fit-model", fitConfig);

        Path checkpoint = bestCheckpoint(projectDir, config.getCheckpoint())
                .orElseThrow(() -> new UnitProcessingException(STAGE, dataset,
                        "fit-model left no " + config.getCheckpoint() + " checkpoint under " + projectDir));
        log.info("ddw.checkpoint dataset={} selection={} checkpoint={}", dataset, config.getCheckpoint(), checkpoint.getFileName());

        Path refineConfig = DeepDeWedgeConfigFile.write(projectDir.resolve(REFINE_CONFIG), config, projectDir, pairs, checkpoint);
        ddw(dataset, "refine-tomogram", refineConfig);
        log.info("ddw.done dataset={} refined={}", dataset, pairs.size());
        return checkpoint;
    }

    private void ddw(String dataset, String command, Path configFile) throws UnitProcessingException, InterruptedException {
        worker.run(STAGE, dataset, projectDir, logDir, List.of(config.getExecutable(), command, "--config", configFile.toString()));
    }

    public static List<HalfSetPair> locate(List<Path> roots) throws IOException {
        List<HalfSetPair> pairs = new ArrayList<>();
        for (Path root : roots) {
            if (!Files.isDirectory(root)) {
                continue;
            }
            for (Path unitDir : HalfSetPreparer.unitDirectories(root)) {
                String series = unitDir.getFileName().toString();
                if (HalfSetPreparer.halvesExist(unitDir, series)) {
                    Path halfsets = unitDir.resolve(HalfSetPreparer.HALFSETS_DIR);
                    pairs.add(new HalfSetPair(halfsets.resolve(HalfSetCommandFiles.Half.EVENS.reconstruction(series)),
                            halfsets.resolve(HalfSetCommandFiles.Half.ODDS.reconstruction(series))));
                }
            }
        }
        return pairs;
    }

    List<HalfSetPair> trainingSample(List<HalfSetPair> pairs) {
        if (pairs.size() <= config.getTrainingSamples()) {
            return pairs;
        }
        List<HalfSetPair> shuffled = new ArrayList<>(pairs);
        Collections.shuffle(shuffled, random);
        return List.copyOf(shuffled.subList(0, config.getTrainingSamples()));
    }

    /**
     * Checkpoints are named {@code ...=<value>.ckpt} inside a {@code val_loss}, {@code fitting_loss}
     * or {@code epoch} directory; the last such directory found is the latest fit.
     */
    static Optional<Path> bestCheckpoint(Path projectDir, CheckpointSelection selection) throws IOException {
        String dirName = switch (selection) {
            case VAL_LOSS -> "val_loss";
            case FITTING_LOSS -> "fitting_loss";
            case LATEST_EPOCH -> "epoch";
        };
        List<Path> dirs;
        try (Stream<Path> walk = Files.walk(projectDir)) {
            dirs = walk.filter(Files::isDirectory)
                    .filter(dir -> dir.getFileName().toString().equals(dirName))
                    .sorted()
                    .toList();
        }
        if (dirs.isEmpty()) {
            return Optional.empty();
        }
        List<Path> checkpoints;
        try (Stream<Path> stream = Files.list(dirs.get(dirs.size() - 1))) {
            checkpoints = stream.filter(path -> path.getFileName().toString().endsWith(CHECKPOINT_SUFFIX))
                    .filter(path -> !Double.isNaN(checkpointValue(path)))
                    .toList();
        }
        Comparator<Path> byValue = Comparator.comparingDouble(DeepDeWedgeRunner::checkpointValue);
        return selection == CheckpointSelection.LATEST_EPOCH
                ? checkpoints.stream().max(byValue)
                : checkpoints.stream().min(byValue);
    }

    static double checkpointValue(Path checkpoint) {
        String name = checkpoint.getFileName().toString();
        String value = name.substring(name.lastIndexOf('=') + 1, name.length() - CHECKPOINT_SUFFIX.length());
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }
}
