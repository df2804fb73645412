package com.tomopipe.pipeline;

import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.tomopipe.runtime.ConfigurationException;
import com.tomopipe.runtime.PipelineConfig;
import com.tomopipe.stage.StageLayout;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PipelineLayoutTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldResolveDirectoriesUnderProjectDirectory() {
        PipelineLayout layout = PipelineLayout.from(config("session"));

        assertEquals(tempDir.resolve("session"), layout.datasetDir());
        assertEquals(tempDir.resolve("session").resolve("Frames"), layout.framesDir());
        assertEquals(tempDir.resolve("Aligned").resolve("alignedJPG"), layout.thumbnailsDir());
        assertEquals(tempDir.resolve("Aligned").resolve("Processed"), layout.processedDir());
        assertEquals(tempDir.resolve("Aligned").resolve("Done"), layout.doneDir());
        assertEquals(tempDir.resolve("Reconstructed"), layout.reconstructedDir());
        assertEquals(tempDir.resolve("coms"), layout.comsDir());
        assertEquals(tempDir.resolve("DDW"), layout.deepDeWedgeDir());
        assertEquals(tempDir.resolve(".tomopipe").resolve("logs").resolve("transfer"), layout.logDir("transfer"));
        assertEquals("session", layout.datasetName());
    }

    @Test
    void shouldChainStageLayouts() {
        PipelineLayout layout = PipelineLayout.from(config("session"));

        StageLayout motionCorrection = layout.motionCorrection();
        StageLayout reconstruction = layout.reconstruction();
        StageLayout transfer = layout.transfer();

        assertEquals(layout.datasetDir(), motionCorrection.watchDir());
        assertEquals(motionCorrection.outputDir(), reconstruction.watchDir());
        assertEquals(reconstruction.outputDir(), transfer.watchDir());
        assertEquals(layout.doneDir(), transfer.processedDir());
        assertEquals(layout.stateDir().resolve("transfer"), transfer.outputDir());
        assertNull(reconstruction.processedDir());
    }

    @Test
    void shouldUseProjectDirectoryWhenDatasetIsUnset() {
        PipelineLayout layout = PipelineLayout.from(config(null));

        assertEquals(tempDir, layout.datasetDir());
        assertEquals(tempDir.getFileName().toString(), layout.datasetName());
    }

    @Test
    void shouldAcceptDistinctDirectories() {
        assertDoesNotThrow(() -> PipelineLayout.from(config("session")).validate());
    }

    @Test
    void shouldRejectCollidingOutputDirectories() {
        PipelineConfig config = config("session");
        config.getLayout().setReconstructedDir("session");

        ConfigurationException error = assertThrows(ConfigurationException.class, () -> PipelineLayout.from(config).validate());

        assertTrue(error.getMessage().contains("reconstruction output"));
        assertTrue(error.getMessage().contains("dataset directory"));
    }

    private PipelineConfig config(String datasetDir) {
        PipelineConfig config = new PipelineConfig();
        config.getLayout().setProjectDir(tempDir.toString());
        config.getAcquisition().setDatasetDir(datasetDir);
        return config;
    }
}
