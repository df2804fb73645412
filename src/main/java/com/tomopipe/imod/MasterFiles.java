package com.tomopipe.imod;

import static com.tomopipe.imod.ImodCommands.flag;
import static com.tomopipe.imod.ImodCommands.number;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomopipe.normalize.TiltAxisConvention;
import com.tomopipe.runtime.PipelineConfig.ReconstructionConfig;
import com.tomopipe.runtime.ReconstructionMethod;
import com.tomopipe.runtime.TrackingMethod;

/**
 * Master command and directive files kept under {@code coms/} for operators who rerun a single
 * series by hand with the IMOD tools.
 */
public final class MasterFiles {
    private static final Logger log = LoggerFactory.getLogger(MasterFiles.class);

    public static final String FRAME_ALIGNMENT_MASTER = "FRAMEWATCHER_MASTER.pcm";
    public static final String RECONSTRUCTION_COM = "BRT_MASTER.com";
    public static final String RECONSTRUCTION_DIRECTIVES = "BRT_MASTER.adoc";

    private MasterFiles() {
    }

    public record Written(Path frameAlignment, Path reconstructionCom, Path directives) {
    }

    public static Written write(Path comsDir, Path framesDir, Path reconstructionLocation, ReconstructionConfig config,
            ImagingParameters imaging) throws IOException {
        Files.createDirectories(comsDir);
        Path pcm = comsDir.resolve(FRAME_ALIGNMENT_MASTER);
        Path com = comsDir.resolve(RECONSTRUCTION_COM);
        Path adoc = comsDir.resolve(RECONSTRUCTION_DIRECTIVES);
        writeAtomically(pcm, frameAlignment(framesDir));
        writeAtomically(adoc, directives(config, imaging));
        writeAtomically(com, reconstructionCom(config, adoc, reconstructionLocation));
        log.info("coms.written dir={} files={}", comsDir, List.of(pcm.getFileName(), com.getFileName(), adoc.getFileName()));
        return new Written(pcm, com, adoc);
    }

    public static String frameAlignment(Path framesDir) {
        return String.join("\n",
                "$alignframes -StandardInput",
                "OutputImageFile",
                "AdjustAndWriteMdoc",
                "PathToFramesInMdoc " + framesDir,
                "UseGPU 0",
                "PairwiseFrames " + ImodCommands.PAIRWISE_FRAMES,
                "GroupSize 1",
                "AlignAndSumBinning " + ImodCommands.ALIGN_AND_SUM_BINNING.replace(',', ' '),
                "AntialiasFilter " + ImodCommands.ANTIALIAS_FILTER,
                "RefineAlignment 0",
                "StopIterationsAtShift 0.000000",
                "ShiftLimit " + ImodCommands.SHIFT_LIMIT,
                "MinForSplineSmoothing 0",
                "FilterRadius2 " + ImodCommands.FILTER_RADIUS2,
                "FilterSigma2 " + ImodCommands.FILTER_SIGMA2,
                "VaryFilter " + ImodCommands.VARY_FILTER,
                "ScalingOfSum " + ImodCommands.SCALING_OF_SUM) + "\n";
    }

    public static String reconstructionCom(ReconstructionConfig config, Path directiveFile, Path location) {
        return String.join("\n",
                "$batchruntomo -StandardInput",
                "NamingStyle     1",
                "MakeSubDirectory",
                "CPUMachineList  localhost:" + config.getCpus(),
                "GPUMachineList  " + config.getGpus(),
                "NiceValue       " + ImodCommands.NICE_VALUE,
                "EtomoDebug      0",
                "DirectiveFile   " + directiveFile,
                "CurrentLocation " + location,
                "BypassEtomo") + "\n";
    }

    /**
     * Batch directives for {@code batchruntomo}. Tracking, CTF and reconstruction-method entries are
     * only present when the corresponding option selects them.
     */
    public static String directives(ReconstructionConfig config, ImagingParameters imaging) {
        boolean sirt = config.getMethod() == ReconstructionMethod.SIRT;
        boolean fiducial = config.getTrackingMethod() == TrackingMethod.FIDUCIAL;

        List<String> lines = new ArrayList<>();
        lines.add("setupset.systemTemplate = " + config.getSystemTemplate());
        lines.add("runtime.Preprocessing.any.removeXrays = " + flag(config.isRemoveXrays()));
        lines.add("comparam.prenewst.newstack.BinByFactor = " + config.getPrealignBin());
        lines.add("runtime.Fiducials.any.trackingMethod = " + config.getTrackingMethod().directiveValue());
        lines.add("setupset.copyarg.gold = " + (fiducial ? number(config.getGoldSize()) : "0"));
        lines.add("runtime.AlignedStack.any.binByFactor = " + config.getFinalBin());
        lines.add("runtime.Reconstruction.any.useSirt = " + flag(sirt));
        lines.add("runtime.Trimvol.any.scaleFromZ = ");
        lines.add("runtime.Postprocess.any.doTrimvol = " + flag(config.isTrimvol()));
        lines.add("setupset.copyarg.pixel = " + number(imaging.pixelSizeNm()));
        if (imaging.tiltAxis() != null) {
            lines.add("setupset.copyarg.rotation = " + TiltAxisConvention.format(imaging.tiltAxis()));
        }
        lines.add("setupset.copyarg.dosesym = " + flag(!config.isBidirectional()));
        lines.add("setupset.copyarg.voltage = " + config.getVoltage());
        lines.add("setupset.copyarg.Cs = " + number(config.getCs()));
        lines.add("comparam.prenewst.newstack.AntialiasFilter = 4");
        lines.add("comparam.newst.newstack.AntialiasFilter = 4");
        lines.add("runtime.Trimvol.any.reorient = " + config.getReorientation().directiveValue());
        lines.add("comparam.tilt.tilt.THICKNESS = " + config.effectiveThicknessUnbinned());

        if (fiducial) {
            lines.add("runtime.Fiducials.any.seedingMethod = 1");
            lines.add("comparam.track.beadtrack.SobelFilterCentering = " + flag(config.isUseSobel()));
            lines.add("comparam.autofidseed.autofidseed.TargetNumberOfBeads = " + config.getNumBeads());
            if (config.isUseSobel()) {
                lines.add("comparam.track.beadtrack.KernelSigmaForSobel = " + number(config.getSobelSigma()));
            }
        } else {
            lines.add("comparam.xcorr_pt.tiltxcorr.SizeOfPatchesXandY = " + config.getPatchSizeX() + "," + config.getPatchSizeY());
            lines.add("comparam.xcorr_pt.tiltxcorr.OverlapOfPatchesXandY = "
                    + number(config.getPatchOverlapX()) + "," + number(config.getPatchOverlapY()));
        }

        if (config.isCtfCorrection()) {
            lines.add("runtime.AlignedStack.any.correctCTF = 1");
            lines.add("comparam.ctfplotter.ctfplotter.ScanDefocusRange = "
                    + number(config.getDefocusLow()) + "," + number(config.getDefocusHigh()));
            lines.add("runtime.CTFplotting.any.autoFitRangeAndStep = " + config.getAutofitRange() + "," + config.getAutofitStep());
            lines.add("comparam.ctfplotter.ctfplotter.BaselineFittingOrder = 4");
            lines.add("comparam.ctfplotter.ctfplotter.SearchAstigmatism = 1");
            lines.add("comparam.ctfplotter.ctfplotter.TuneFittingSampling = " + flag(config.isTuneFittingSampling()));
        }
        if (config.isDoseWeighting()) {
            lines.add("runtime.AlignedStack.any.filterStack = 1");
        }

        switch (config.getMethod()) {
            case SIRT_LIKE -> lines.add("comparam.tilt.tilt.FakeSIRTiterations = " + config.getFakeSirtIterations());
            case SIRT -> lines.add("comparam.sirtsetup.sirtsetup.LeaveIterations = " + config.getSirtIterations());
            case BACKPROJECTION -> {
            }
        }
        return String.join("\n", lines) + "\n";
    }

    static void writeAtomically(Path target, String content) throws IOException {
        Path temp = target.resolveSibling("." + target.getFileName() + ".tmp");
        Files.writeString(temp, content, StandardCharsets.UTF_8);
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
