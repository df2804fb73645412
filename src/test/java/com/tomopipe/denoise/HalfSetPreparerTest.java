package com.tomopipe.denoise;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.tomopipe.process.CommandRunner;
import com.tomopipe.stage.UnitLease;
import com.tomopipe.stage.WorkerProcess;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HalfSetPreparerTest {

    @TempDir
    Path tempDir;

    private Path reconstructed;
    private final List<String> commands = new ArrayList<>();
    private String submitOutput = "tilt: finished successfully";

    @BeforeEach
    void setUp() throws IOException {
        reconstructed = Files.createDirectories(tempDir.resolve("Reconstructed"));
    }

    @Test
    void shouldClassifyAvailableMetadata() throws Exception {
        Path unit = Files.createDirectories(tempDir.resolve("TS_01"));
        assertEquals(MetadataStatus.NONE, HalfSetPreparer.classify(unit, "TS_01"));

        Files.writeString(unit.resolve("TS_01.tlt"), "");
        Files.writeString(unit.resolve("TS_01.xtilt"), "");
        assertEquals(MetadataStatus.NONE, HalfSetPreparer.classify(unit, "TS_01"));

        Files.writeString(unit.resolve("TS_01.xf"), "");
        assertEquals(MetadataStatus.NEWSTACK_AND_TILT, HalfSetPreparer.classify(unit, "TS_01"));

        Files.writeString(unit.resolve("TS_01_ali.mrc"), "");
        assertEquals(MetadataStatus.TILT_ONLY, HalfSetPreparer.classify(unit, "TS_01"));
    }

    @Test
    void shouldRegenerateAlignedStackThenBuildBothHalves() throws Exception {
        Path unit = unit("TS_01");
        Files.writeString(unit.resolve("TS_01.xf"), "transforms");

        HalfSetPreparer.Report report = preparer().prepareAll(List.of(reconstructed));

        assertEquals(1, report.count(HalfSetPreparer.Status.PREPARED));
        assertEquals(List.of("subm newst.com", "subm tilt_evens.com", "subm tilt_odds.com",
                "trimvol -rx TS_01_full_rec_evens.mrc TS_01_rec_evens.mrc",
                "trimvol -rx TS_01_full_rec_odds.mrc TS_01_rec_odds.mrc"), commands);
        assertTrue(Files.exists(unit.resolve("halfsets").resolve("TS_01_rec_evens.mrc")));
        assertTrue(Files.exists(unit.resolve("halfsets").resolve("TS_01_rec_odds.mrc")));
        String evens = Files.readString(unit.resolve("tilt_evens.com"));
        assertTrue(evens.contains("THICKNESS\t1200\n"));
        assertTrue(evens.contains("INCLUDE 1,3,5\n"));
        assertTrue(Files.readString(unit.resolve("newst.com")).contains("BinByFactor\t4\n"));
        assertFalse(UnitLease.isHeld(reconstructed, "TS_01"));
    }

    @Test
    void shouldReuseAlignedStackAndExistingTiltCom() throws Exception {
        Path unit = unit("TS_01");
        MrcHeaderTest.write(unit.resolve("TS_01_ali.mrc"), ByteOrder.LITTLE_ENDIAN, (byte) 0x44, 1024, 1024, 5);
        Files.writeString(unit.resolve("tilt.com"), "$tilt -StandardInput\nIMAGEBINNED 4\nTHICKNESS 900\n");

        HalfSetPreparer.Report report = preparer().prepareAll(List.of(reconstructed));

        assertEquals(HalfSetPreparer.Status.PREPARED, report.results().get(0).status());
        assertEquals("subm tilt_evens.com", commands.get(0));
        String odds = Files.readString(unit.resolve("tilt_odds.com"));
        assertTrue(odds.contains("THICKNESS 900\n"));
        assertTrue(odds.contains("IMAGEBINNED\t4\n"));
        assertTrue(odds.contains("INCLUDE 2,4\n"));
    }

    @Test
    void shouldSkipUnitsAlreadyPreparedOrWithoutMetadata() throws Exception {
        Path done = unit("TS_01");
        Files.createDirectories(done.resolve("halfsets"));
        Files.writeString(done.resolve("halfsets").resolve("TS_01_rec_evens.mrc"), "half");
        Files.writeString(done.resolve("halfsets").resolve("TS_01_rec_odds.mrc"), "half");
        Path bare = Files.createDirectories(reconstructed.resolve("TS_02"));
        MrcHeaderTest.write(bare.resolve("TS_02_rec.mrc"), ByteOrder.LITTLE_ENDIAN, (byte) 0x44, 1024, 1024, 300);

        HalfSetPreparer.Report report = preparer().prepareAll(List.of(reconstructed, tempDir.resolve("missing")));

        assertEquals(1, report.count(HalfSetPreparer.Status.ALREADY_PREPARED));
        assertEquals(1, report.count(HalfSetPreparer.Status.NO_METADATA));
        assertTrue(commands.isEmpty());
    }

    @Test
    void shouldLeaveUnitHeldByTransferForLaterPass() throws Exception {
        Path unit = unit("TS_01");
        Files.writeString(unit.resolve("TS_01.xf"), "transforms");

        try (UnitLease held = UnitLease.tryAcquire(reconstructed, "TS_01", "transfer").orElseThrow()) {
            HalfSetPreparer.Report report = preparer().prepareAll(List.of(reconstructed));

            assertEquals(1, report.count(HalfSetPreparer.Status.LEASED));
            assertTrue(commands.isEmpty());
        }
    }

    @Test
    void shouldFailUnitWhenSubmitDoesNotReportSuccess() throws Exception {
        Path unit = unit("TS_01");
        Files.writeString(unit.resolve("TS_01.xf"), "transforms");
        submitOutput = "ERROR: newstack - reading transforms";

        HalfSetPreparer.Report report = preparer().prepareAll(List.of(reconstructed));

        assertEquals(1, report.count(HalfSetPreparer.Status.FAILED));
        assertEquals(List.of("subm newst.com"), commands);
        assertFalse(Files.exists(unit.resolve("halfsets")));
    }

    private HalfSetPreparer preparer() {
        CommandRunner runner = new CommandRunner(Duration.ofSeconds(5), (workingDirectory, command) -> {
            commands.add(String.join(" ", command));
            if (command[0].equals("trimvol")) {
                try {
                    Files.writeString(workingDirectory.resolve(command[3]), "half tomogram");
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }
            return new FinishedProcess(command[0].equals("subm") ? submitOutput : "");
        });
        return new HalfSetPreparer(4, 0, "subm", new WorkerProcess(runner), tempDir.resolve("logs"));
    }

    /**
     * A reconstructed unit: 4096x4096 stack of five views and a 1024-wide tomogram 300 slices thick.
     */
    private Path unit(String series) throws IOException {
        Path unit = Files.createDirectories(reconstructed.resolve(series));
        MrcHeaderTest.write(unit.resolve(series + ".mrc"), ByteOrder.LITTLE_ENDIAN, (byte) 0x44, 4096, 4096, 5);
        MrcHeaderTest.write(unit.resolve(series + "_rec.mrc"), ByteOrder.LITTLE_ENDIAN, (byte) 0x44, 1024, 1024, 300);
        Files.writeString(unit.resolve(series + ".tlt"), "-6\n-3\n0\n3\n6\n", StandardCharsets.UTF_8);
        Files.writeString(unit.resolve(series + ".xtilt"), "0\n0\n0\n0\n0\n", StandardCharsets.UTF_8);
        return unit;
    }

    private static final class FinishedProcess extends Process {
        private final String stdout;

        FinishedProcess(String stdout) {
            this.stdout = stdout;
        }

        @Override
        public OutputStream getOutputStream() {
            return OutputStream.nullOutputStream();
        }

        @Override
        public InputStream getInputStream() {
            return new ByteArrayInputStream(stdout.getBytes(StandardCharsets.UTF_8));
        }

        @Override
        public InputStream getErrorStream() {
            return new ByteArrayInputStream(new byte[0]);
        }

        @Override
        public int waitFor() {
            return 0;
        }

        @Override
        public boolean waitFor(long timeout, TimeUnit unit) {
            return true;
        }

        @Override
        public int exitValue() {
            return 0;
        }

        @Override
        public void destroy() {
            // no-op
        }
    }
}
