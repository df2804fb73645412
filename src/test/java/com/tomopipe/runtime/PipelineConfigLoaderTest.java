package com.tomopipe.runtime;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PipelineConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldFallBackToDefaultsWhenFileIsMissing() throws Exception {
        PipelineConfig config = new PipelineConfigLoader().load(tempDir.resolve("missing.yml"));

        assertEquals(AcquisitionSoftware.SERIALEM, config.getAcquisition().getSoftware());
        assertEquals(60000L, config.getMotionCorrection().getSettleMs());
        assertEquals(1200, config.getReconstruction().effectiveThicknessUnbinned());
        assertFalse(config.getDenoising().isEnabled());
    }

    @Test
    void shouldReadEnumsCaseInsensitivelyAndKeepUnsetDefaults() throws Exception {
        Path file = tempDir.resolve("pipeline.yml");
        Files.writeString(file, """
                acquisition:
                  software: tomography5
                  datasetDir: session
                  tiltAxis: -87.0
                reconstruction:
                  trackingMethod: fiducial
                  method: sirt
                  thicknessBinned: 250
                denoising:
                  enabled: true
                  gate: watcher_idle
                """);

        PipelineConfig config = new PipelineConfigLoader().load(file);

        assertEquals(AcquisitionSoftware.TOMOGRAPHY5, config.getAcquisition().getSoftware());
        assertEquals(-87.0, config.getAcquisition().getTiltAxis());
        assertEquals(TrackingMethod.FIDUCIAL, config.getReconstruction().getTrackingMethod());
        assertEquals(ReconstructionMethod.SIRT, config.getReconstruction().getMethod());
        assertEquals(1000, config.getReconstruction().effectiveThicknessUnbinned());
        assertEquals(GateStrategy.WATCHER_IDLE, config.getDenoising().getGate());
        assertEquals(4, config.getReconstruction().getCpus());
    }

    @Test
    void shouldRejectUnknownEnumValueWithFieldPath() throws Exception {
        Path file = tempDir.resolve("pipeline.yml");
        Files.writeString(file, """
                acquisition:
                  software: EPU
                """);

        ConfigurationException error = assertThrows(ConfigurationException.class, () -> new PipelineConfigLoader().load(file));

        assertTrue(error.getMessage().contains("acquisition.software"));
        assertTrue(error.getMessage().contains("TOMOGRAPHY5"));
    }

    @Test
    void shouldLoadBundledDefaults() throws Exception {
        Path file = Path.of("src/main/resources/application.yml");

        PipelineConfig config = new PipelineConfigLoader().load(file);

        assertEquals("session", config.getAcquisition().getDatasetDir());
        assertEquals(TrackingMethod.PATCH, config.getReconstruction().getTrackingMethod());
        assertEquals(4, config.getSupervision().getStalePatterns().size());
        assertEquals(1, config.getDenoising().getWarmupThreshold());
        assertEquals(0, config.getDenoising().getDrainedThreshold());
        assertEquals(2, config.getDenoising().getDrainConfirmations());
        assertFalse(config.getDenoising().getDeepDeWedge().isEnabled());
        assertEquals(CheckpointSelection.VAL_LOSS, config.getDenoising().getDeepDeWedge().getCheckpoint());
    }
}
