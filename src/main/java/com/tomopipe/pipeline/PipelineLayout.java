package com.tomopipe.pipeline;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import com.tomopipe.normalize.MetadataNormalizer;
import com.tomopipe.runtime.ConfigurationException;
import com.tomopipe.runtime.PipelineConfig;
import com.tomopipe.stage.MotionCorrectionBinding;
import com.tomopipe.stage.ReconstructionBinding;
import com.tomopipe.stage.StageLayout;
import com.tomopipe.transfer.TransferAgent;

/**
 * Every directory the pipeline reads or writes, resolved once from configuration. Stage layouts are
 * chained: each downstream stage watches the directory its upstream stage delivers to.
 */
public record PipelineLayout(
        Path datasetDir,
        Path framesDir,
        Path alignedDir,
        Path thumbnailsDir,
        Path processedDir,
        Path doneDir,
        Path reconstructedDir,
        Path comsDir,
        Path stateDir,
        Path deepDeWedgeDir) {

    public static final String THUMBNAILS_DIR = "alignedJPG";
    public static final String PROCESSED_DIR = "Processed";
    public static final String DONE_DIR = "Done";

    public static PipelineLayout from(PipelineConfig config) {
        PipelineConfig.LayoutConfig layout = config.getLayout();
        Path project = Path.of(layout.getProjectDir()).toAbsolutePath().normalize();
        String datasetDir = config.getAcquisition().getDatasetDir();
        Path dataset = datasetDir == null ? project : project.resolve(datasetDir).normalize();
        Path aligned = project.resolve(layout.getAlignedDir()).normalize();
        return new PipelineLayout(
                dataset,
                dataset.resolve(MetadataNormalizer.FRAMES_DIR),
                aligned,
                aligned.resolve(THUMBNAILS_DIR),
                aligned.resolve(PROCESSED_DIR),
                aligned.resolve(DONE_DIR),
                project.resolve(layout.getReconstructedDir()).normalize(),
                project.resolve(layout.getComsDir()).normalize(),
                project.resolve(layout.getStateDir()).normalize(),
                project.resolve(config.getDenoising().getDeepDeWedge().getProjectDir()).normalize());
    }

    public String datasetName() {
        return datasetDir.getFileName().toString();
    }

    public Path logDir(String stage) {
        return stateDir.resolve("logs").resolve(stage);
    }

    public StageLayout motionCorrection() {
        return new StageLayout(MotionCorrectionBinding.STAGE, datasetDir, alignedDir, processedDir, thumbnailsDir,
                logDir(MotionCorrectionBinding.STAGE));
    }

    public StageLayout reconstruction() {
        return new StageLayout(ReconstructionBinding.STAGE, alignedDir, reconstructedDir, null, null,
                logDir(ReconstructionBinding.STAGE));
    }

    public StageLayout transfer() {
        return new StageLayout(TransferAgent.STAGE, reconstructedDir, stateDir.resolve(TransferAgent.STAGE), doneDir, null,
                logDir(TransferAgent.STAGE));
    }

    /**
     * Output directories must not collide with each other or with the dataset they are derived from.
     */
    public void validate() throws ConfigurationException {
        Map<Path, String> outputs = new LinkedHashMap<>();
        outputs.put(datasetDir, "dataset directory");
        claim(outputs, alignedDir, "motion-correction output");
        claim(outputs, reconstructedDir, "reconstruction output");
        claim(outputs, doneDir, "transfer done directory");
        claim(outputs, comsDir, "command file directory");
        claim(outputs, stateDir, "state directory");
        claim(outputs, deepDeWedgeDir, "DeepDeWedge project directory");
    }

    private static void claim(Map<Path, String> outputs, Path dir, String role) throws ConfigurationException {
        String existing = outputs.putIfAbsent(dir, role);
        if (existing != null) {
            throw new ConfigurationException("The " + role + " and the " + existing + " resolve to the same path " + dir);
        }
    }
}
