package com.tomopipe.denoise;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

import com.tomopipe.runtime.PipelineConfig.DeepDeWedgeConfig;

/**
 * The YAML file {@code ddw} reads its settings from. Fitting and refining share one layout; only
 * the listed tomograms and the checkpoint differ.
 */
public final class DeepDeWedgeConfigFile {
    static final List<Integer> EXTRACTION_STRIDES = List.of(64, 80, 80);
    static final double MIN_MASK_FRACTION = 0.3;
    static final double VAL_FRACTION = 0.2;
    static final int UNET_CHANNELS = 64;
    static final int DOWNSAMPLE_LAYERS = 3;
    static final double LEARNING_RATE = 0.0004;
    static final int FIT_BATCH_SIZE = 5;
    static final int REFINE_BATCH_SIZE = 10;
    static final int SUBTOMO_OVERLAP = 32;

    private static final ObjectMapper MAPPER = YAMLMapper.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .build();

    private DeepDeWedgeConfigFile() {
    }

    @JsonPropertyOrder({ "shared", "prepare_data", "fit_model", "refine_tomogram" })
    record Document(
            Shared shared,
            @JsonProperty("prepare_data") PrepareData prepareData,
            @JsonProperty("fit_model") FitModel fitModel,
            @JsonProperty("refine_tomogram") RefineTomogram refineTomogram) {
    }

    record Shared(
            @JsonProperty("project_dir") String projectDir,
            @JsonProperty("tomo0_files") List<String> tomo0Files,
            @JsonProperty("tomo1_files") List<String> tomo1Files,
            @JsonProperty("subtomo_size") int subtomoSize,
            @JsonProperty("mw_angle") int mwAngle,
            @JsonProperty("num_workers") int numWorkers,
            int gpu,
            long seed,
            boolean overwrite) {
    }

    record PrepareData(
            @JsonProperty("mask_files") List<String> maskFiles,
            @JsonProperty("min_nonzero_mask_fraction_in_subtomo") double minNonzeroMaskFraction,
            @JsonProperty("subtomo_extraction_strides") List<Integer> extractionStrides,
            @JsonProperty("val_fraction") double valFraction) {
    }

    record FitModel(
            @JsonProperty("unet_params_dict") UnetParams unetParams,
            @JsonProperty("adam_params_dict") AdamParams adamParams,
            @JsonProperty("num_epochs") int numEpochs,
            @JsonProperty("batch_size") int batchSize,
            @JsonProperty("update_subtomo_missing_wedges_every_n_epochs") int updateWedgesEvery,
            @JsonProperty("check_val_every_n_epochs") int checkValEvery,
            @JsonProperty("save_n_models_with_lowest_val_loss") int keepLowestVal,
            @JsonProperty("save_n_models_with_lowest_fitting_loss") int keepLowestFitting,
            @JsonProperty("save_model_every_n_epochs") int saveEvery,
            String logger) {
    }

    record UnetParams(
            int chans,
            @JsonProperty("num_downsample_layers") int numDownsampleLayers,
            @JsonProperty("drop_prob") double dropProb) {
    }

    record AdamParams(double lr) {
    }

    record RefineTomogram(
            @JsonProperty("model_checkpoint_file") String modelCheckpointFile,
            @JsonProperty("subtomo_overlap") int subtomoOverlap,
            @JsonProperty("batch_size") int batchSize) {
    }

    /**
     * Writes the settings for the given half-set pairs to {@code target}.
     *
     * @param checkpoint model to refine with; null for a fitting configuration
     */
    public static Path write(Path target, DeepDeWedgeConfig config, Path projectDir, List<DeepDeWedgeRunner.HalfSetPair> pairs,
            Path checkpoint) throws IOException {
        Document document = new Document(
                new Shared(projectDir.toString(),
                        pairs.stream().map(pair -> pair.evens().toString()).toList(),
                        pairs.stream().map(pair -> pair.odds().toString()).toList(),
                        config.getSubtomoSize(), config.getMwAngle(), config.getNumWorkers(), config.getGpu(), config.getSeed(), true),
                new PrepareData(null, MIN_MASK_FRACTION, EXTRACTION_STRIDES, VAL_FRACTION),
                new FitModel(new UnetParams(UNET_CHANNELS, DOWNSAMPLE_LAYERS, 0.0), new AdamParams(LEARNING_RATE),
                        config.getNumEpochs(), FIT_BATCH_SIZE, 10, 10, 5, 5, 50, "csv"),
                new RefineTomogram(checkpoint == null ? null : checkpoint.toString(), SUBTOMO_OVERLAP, REFINE_BATCH_SIZE));
        MAPPER.writeValue(target.toFile(), document);
        return target;
    }
}
