package com.tomopipe.normalize;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.tomopipe.runtime.AcquisitionSoftware;
import com.tomopipe.runtime.ConfigurationException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MetadataNormalizerTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldCanonicalizeTomography5Dataset() throws Exception {
        Path dataset = Files.createDirectories(tempDir.resolve("session"));
        writeSidecar(dataset.resolve("TS_01.mdoc"), "-87.0");
        writeSidecar(dataset.resolve("TS_01_override.mdoc"), "-87.0");
        Files.writeString(dataset.resolve("TS_01_fractions_000.tiff"), "frame");

        NormalizationReport report = normalizer(AcquisitionSoftware.TOMOGRAPHY5, -87.0).normalize(dataset);

        Path canonical = dataset.resolve("TS_01.mrc.mdoc");
        assertTrue(Files.exists(canonical));
        assertFalse(Files.exists(dataset.resolve("TS_01.mdoc")));
        assertFalse(Files.exists(dataset.resolve("TS_01_override.mdoc")));
        assertTrue(Files.exists(dataset.resolve("Frames").resolve("TS_01_fractions_000.tiff")));
        assertTrue(Files.readString(canonical, StandardCharsets.ISO_8859_1).contains("TiltAxisAngle = -3.00"));
        assertEquals(List.of("TS_01_override.mdoc"), report.removed());
        assertEquals(-3.0, report.canonicalTiltAxis());
        assertTrue(report.consistent());
    }

    @Test
    void shouldRemoveDuplicateSidecarButKeepFramesCarryingTheSameMarker() throws Exception {
        Path dataset = Files.createDirectories(tempDir.resolve("session"));
        writeSidecar(dataset.resolve("TS_01.mdoc"), "-87.0");
        writeSidecar(dataset.resolve("TS_01_override.mdoc"), "-87.0");
        Files.writeString(dataset.resolve("TS_01_override_fractions_000.tiff"), "frame");

        NormalizationReport report = normalizer(AcquisitionSoftware.TOMOGRAPHY5, null).normalize(dataset);

        assertEquals(List.of("TS_01_override.mdoc"), report.removed());
        assertEquals(List.of("TS_01_override_fractions_000.tiff"), report.relocatedFrames());
        assertEquals("frame", Files.readString(dataset.resolve("Frames").resolve("TS_01_override_fractions_000.tiff")));
        assertFalse(Files.exists(dataset.resolve("TS_01_override_fractions_000.tiff")));
    }

    @Test
    void shouldLeaveDatasetUnchangedOnSecondRun() throws Exception {
        Path dataset = Files.createDirectories(tempDir.resolve("session"));
        writeSidecar(dataset.resolve("TS_01.mdoc"), "-87.0");
        MetadataNormalizer normalizer = normalizer(AcquisitionSoftware.TOMOGRAPHY5, -87.0);
        normalizer.normalize(dataset);
        String afterFirst = Files.readString(dataset.resolve("TS_01.mrc.mdoc"), StandardCharsets.ISO_8859_1);

        NormalizationReport second = normalizer.normalize(dataset);

        assertTrue(second.renamed().isEmpty());
        assertTrue(second.rewritten().isEmpty());
        assertTrue(second.relocatedFrames().isEmpty());
        assertEquals(afterFirst, Files.readString(dataset.resolve("TS_01.mrc.mdoc"), StandardCharsets.ISO_8859_1));
    }

    @Test
    void shouldNotRenameSerialEmSidecarsOrTouchAxisWithoutOverride() throws Exception {
        Path dataset = Files.createDirectories(tempDir.resolve("session"));
        writeSidecar(dataset.resolve("TS_02.mrc.mdoc"), "85.3");
        String before = Files.readString(dataset.resolve("TS_02.mrc.mdoc"), StandardCharsets.ISO_8859_1);

        NormalizationReport report = normalizer(AcquisitionSoftware.SERIALEM, null).normalize(dataset);

        assertTrue(report.rewritten().isEmpty());
        assertEquals(before, Files.readString(dataset.resolve("TS_02.mrc.mdoc"), StandardCharsets.ISO_8859_1));
    }

    @Test
    void shouldReportConflictWhenBothExtensionsExist() throws Exception {
        Path dataset = Files.createDirectories(tempDir.resolve("session"));
        writeSidecar(dataset.resolve("TS_03.mdoc"), "-87.0");
        writeSidecar(dataset.resolve("TS_03.mrc.mdoc"), "-87.0");

        NormalizationReport report = normalizer(AcquisitionSoftware.TOMOGRAPHY5, null).normalize(dataset);

        assertFalse(report.consistent());
        assertTrue(Files.exists(dataset.resolve("TS_03.mdoc")));
    }

    @Test
    void shouldFailDatasetWithoutSidecar() throws Exception {
        Path dataset = Files.createDirectories(tempDir.resolve("empty"));

        assertThrows(MetadataParseException.class, () -> normalizer(AcquisitionSoftware.SERIALEM, null).normalize(dataset));
    }

    @Test
    void shouldContinueBatchAfterOneDatasetFails() throws Exception {
        Path good = Files.createDirectories(tempDir.resolve("good"));
        Path bad = Files.createDirectories(tempDir.resolve("bad"));
        writeSidecar(good.resolve("TS_01.mrc.mdoc"), "85.3");

        BatchNormalizationResult result = normalizer(AcquisitionSoftware.SERIALEM, null).normalizeAll(List.of(bad, good));

        assertEquals(1, result.reports().size());
        assertTrue(result.failures().containsKey(bad));
        assertFalse(result.allSucceeded());
    }

    @Test
    void shouldRejectMissingDatasetDirectory() {
        assertThrows(ConfigurationException.class,
                () -> normalizer(AcquisitionSoftware.SERIALEM, null).normalizeAll(List.of(tempDir.resolve("missing"))));
    }

    private static MetadataNormalizer normalizer(AcquisitionSoftware software, Double tiltAxis) {
        return new MetadataNormalizer(software, tiltAxis, "fractions", "override");
    }

    private static void writeSidecar(Path path, String tiltAxis) throws Exception {
        Files.writeString(path, "PixelSpacing = 2.68\n"
                + "TiltAxisAngle = " + tiltAxis + "\n"
                + "\n"
                + "[ZValue = 0]\n"
                + "TiltAngle = 0.0\n"
                + "SubFramePath = TS_01_fractions_000.tiff\n", StandardCharsets.ISO_8859_1);
    }
}
