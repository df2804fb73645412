package com.tomopipe.imod;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.tomopipe.runtime.PipelineConfig;
import com.tomopipe.runtime.ReconstructionMethod;
import com.tomopipe.runtime.TrackingMethod;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MasterFilesTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldWritePatchTrackingDirectivesWithImagingValues() {
        PipelineConfig.ReconstructionConfig config = new PipelineConfig.ReconstructionConfig();

        List<String> lines = MasterFiles.directives(config, new ImagingParameters(2.5, -3.0, 3.1)).lines().toList();

        assertTrue(lines.contains("setupset.copyarg.pixel = 0.25"));
        assertTrue(lines.contains("setupset.copyarg.rotation = -3.00"));
        assertTrue(lines.contains("runtime.Fiducials.any.trackingMethod = 1"));
        assertTrue(lines.contains("setupset.copyarg.gold = 0"));
        assertTrue(lines.contains("comparam.xcorr_pt.tiltxcorr.SizeOfPatchesXandY = 200,200"));
        assertTrue(lines.contains("comparam.xcorr_pt.tiltxcorr.OverlapOfPatchesXandY = 0.4,0.4"));
        assertTrue(lines.contains("setupset.copyarg.dosesym = 1"));
        assertTrue(lines.contains("comparam.tilt.tilt.THICKNESS = 1200"));
        assertTrue(lines.contains("comparam.tilt.tilt.FakeSIRTiterations = 10"));
        assertTrue(lines.contains("runtime.Trimvol.any.reorient = 2"));
        assertTrue(lines.contains("runtime.AlignedStack.any.correctCTF = 1"));
        assertFalse(lines.stream().anyMatch(line -> line.startsWith("runtime.Fiducials.any.seedingMethod")));
    }

    @Test
    void shouldWriteFiducialAndSirtDirectivesOnlyWhenSelected() {
        PipelineConfig.ReconstructionConfig config = new PipelineConfig.ReconstructionConfig();
        config.setTrackingMethod(TrackingMethod.FIDUCIAL);
        config.setGoldSize(10.0);
        config.setMethod(ReconstructionMethod.SIRT);
        config.setCtfCorrection(false);
        config.setBidirectional(true);
        config.setThicknessBinned(300);

        List<String> lines = MasterFiles.directives(config, new ImagingParameters(2.68, null, null)).lines().toList();

        assertTrue(lines.contains("setupset.copyarg.gold = 10"));
        assertTrue(lines.contains("runtime.Fiducials.any.seedingMethod = 1"));
        assertTrue(lines.contains("comparam.autofidseed.autofidseed.TargetNumberOfBeads = 25"));
        assertTrue(lines.contains("runtime.Reconstruction.any.useSirt = 1"));
        assertTrue(lines.contains("comparam.sirtsetup.sirtsetup.LeaveIterations = 10"));
        assertTrue(lines.contains("setupset.copyarg.dosesym = 0"));
        assertTrue(lines.contains("comparam.tilt.tilt.THICKNESS = 1200"));
        assertFalse(lines.stream().anyMatch(line -> line.startsWith("setupset.copyarg.rotation")));
        assertFalse(lines.stream().anyMatch(line -> line.contains("ctfplotter")));
        assertFalse(lines.stream().anyMatch(line -> line.contains("tiltxcorr")));
    }

    @Test
    void shouldWriteSameFilesOnEveryRun() throws Exception {
        PipelineConfig.ReconstructionConfig config = new PipelineConfig.ReconstructionConfig();
        ImagingParameters imaging = new ImagingParameters(2.68, 85.3, 3.0);
        Path coms = tempDir.resolve("coms");

        MasterFiles.Written first = MasterFiles.write(coms, tempDir.resolve("Frames"), tempDir.resolve("Reconstructed"), config, imaging);
        String pcm = Files.readString(first.frameAlignment());
        String com = Files.readString(first.reconstructionCom());
        String adoc = Files.readString(first.directives());
        MasterFiles.write(coms, tempDir.resolve("Frames"), tempDir.resolve("Reconstructed"), config, imaging);

        assertEquals(pcm, Files.readString(first.frameAlignment()));
        assertEquals(com, Files.readString(first.reconstructionCom()));
        assertEquals(adoc, Files.readString(first.directives()));
        assertTrue(com.contains("DirectiveFile   " + first.directives()));
        assertTrue(pcm.startsWith("$alignframes -StandardInput\n"));
        try (Stream<Path> files = Files.list(coms)) {
            assertEquals(3, files.count());
        }
    }
}
