package com.tomopipe.imod;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.tomopipe.runtime.PipelineConfig.MotionCorrectionConfig;
import com.tomopipe.runtime.PipelineConfig.ReconstructionConfig;

/**
 * Argument lists for the IMOD programs the stages invoke. The same configuration always yields the
 * same list, in the same order.
 */
public final class ImodCommands {
    static final int PAIRWISE_FRAMES = 7;
    static final String ALIGN_AND_SUM_BINNING = "10,1";
    static final int ANTIALIAS_FILTER = 4;
    static final int SHIFT_LIMIT = 20;
    static final String FILTER_RADIUS2 = "0.050000";
    static final String FILTER_SIGMA2 = "0.007145";
    static final String VARY_FILTER = "0.050000";
    static final String SCALING_OF_SUM = "16.000000";
    static final String DOSE_DROP = "0.1,1.5";
    static final int NICE_VALUE = 15;

    private ImodCommands() {
    }

    /**
     * {@code alignframes} for one tilt series described by its sidecar, writing the aligned stack
     * and an adjusted sidecar next to {@code output}.
     */
    public static List<String> alignframes(MotionCorrectionConfig config, Path sidecar, Path framesDir, Path output, String gainPath) {
        List<String> args = new ArrayList<>();
        args.add(config.getExecutable());
        args.add("-MetadataFile");
        args.add(sidecar.toString());
        args.add("-PathToFramesInMdoc");
        args.add(framesDir.toString());
        args.add("-OutputImageFile");
        args.add(output.toString());
        args.add("-AdjustAndWriteMdoc");
        if (gainPath != null && !gainPath.isBlank()) {
            args.add("-GainReferenceFile");
            args.add(gainPath);
        }
        args.add("-UseGPU");
        args.add(Integer.toString(config.getGpu()));
        args.add("-PairwiseFrames");
        args.add(Integer.toString(PAIRWISE_FRAMES));
        args.add("-GroupSize");
        args.add("1");
        args.add("-AlignAndSumBinning");
        args.add(ALIGN_AND_SUM_BINNING);
        args.add("-AntialiasFilter");
        args.add(Integer.toString(ANTIALIAS_FILTER));
        args.add("-RefineAlignment");
        args.add("0");
        args.add("-StopIterationsAtShift");
        args.add("0.000000");
        args.add("-ShiftLimit");
        args.add(Integer.toString(SHIFT_LIMIT));
        args.add("-MinForSplineSmoothing");
        args.add("0");
        args.add("-FilterRadius2");
        args.add(FILTER_RADIUS2);
        args.add("-FilterSigma2");
        args.add(FILTER_SIGMA2);
        args.add("-VaryFilter");
        args.add(VARY_FILTER);
        args.add("-ScalingOfSum");
        args.add(SCALING_OF_SUM);
        if (config.getBinning() > 1) {
            args.add("-BinningOfOutput");
            args.add(Integer.toString(config.getBinning()));
        }
        if (config.isDoseWeighting()) {
            args.add("-DoseWeightingMdoc");
            args.add("-NormalizeDoseWeighting");
            args.add("-Voltage");
            args.add(Integer.toString(config.getVoltage()));
            args.add("-DropFramesByDose");
            args.add(DOSE_DROP);
        } else {
            args.add("-DropFramesBelowMean");
            args.add(number(config.getDropMean()));
        }
        return List.copyOf(args);
    }

    /**
     * JPEG preview of an aligned stack.
     */
    public static List<String> thumbnail(Path stack, Path jpeg) {
        return List.of("mrc2tif", "-j", stack.toString(), jpeg.toString());
    }

    /**
     * {@code batchruntomo} for one tilt series already placed in {@code location}.
     */
    public static List<String> batchruntomo(ReconstructionConfig config, String rootName, Path location, Path directiveFile) {
        return List.of(
                config.getExecutable(),
                "-DirectiveFile", directiveFile.toString(),
                "-RootName", rootName,
                "-CurrentLocation", location.toString(),
                "-NamingStyle", "1",
                "-CPUMachineList", "localhost:" + config.getCpus(),
                "-GPUMachineList", Integer.toString(config.getGpus()),
                "-NiceValue", Integer.toString(NICE_VALUE),
                "-EtomoDebug", "0",
                "-BypassEtomo");
    }

    public static List<String> submit(String submitExecutable, String commandFile) {
        return List.of(submitExecutable, commandFile);
    }

    static String number(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    static String flag(boolean value) {
        return value ? "1" : "0";
    }
}
