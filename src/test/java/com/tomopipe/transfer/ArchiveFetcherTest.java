package com.tomopipe.transfer;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArchiveFetcherTest {

    @TempDir
    Path tempDir;

    private Path archive;
    private Path workspace;

    @BeforeEach
    void setUp() throws Exception {
        archive = tempDir.resolve("archive");
        workspace = tempDir.resolve("fetched");
        archiveUnit("mm2024-07-25-001", "TS_01");
        archiveUnit("mm2024-07-25-002", "TS_02");
        archiveUnit("mm2024-07-26-001", "TS_03");
        archiveUnit("jd2024-07-25-001", "TS_04");
    }

    @Test
    void shouldFetchOnlyTomogramsOfOperatorAndDates() throws Exception {
        ArchiveFetcher.FetchReport report = new ArchiveFetcher(new LocalArchiveStore(archive))
                .fetch("Maria Muster", List.of(LocalDate.of(2024, 7, 25)), false, workspace);

        assertEquals(List.of("mm2024-07-25-001", "mm2024-07-25-002"), report.archiveIds());
        assertEquals(2, report.copy().copied());
        assertTrue(Files.exists(workspace.resolve("mm2024-07-25-001").resolve("TS_01_rec.mrc")));
        assertFalse(Files.exists(workspace.resolve("mm2024-07-25-001").resolve("TS_01.xf")));
        assertFalse(Files.exists(workspace.resolve("jd2024-07-25-001")));
    }

    @Test
    void shouldFetchMetadataWithoutFramesAndSkipOnRerun() throws Exception {
        ArchiveFetcher fetcher = new ArchiveFetcher(new LocalArchiveStore(archive));
        List<LocalDate> dates = List.of(LocalDate.of(2024, 7, 26));

        ArchiveFetcher.FetchReport first = fetcher.fetch("Maria Muster", dates, true, workspace);
        ArchiveFetcher.FetchReport second = fetcher.fetch("Maria Muster", dates, true, workspace);

        Path fetched = workspace.resolve("mm2024-07-26-001");
        assertTrue(Files.exists(fetched.resolve("TS_03.xf")));
        assertFalse(Files.exists(fetched.resolve("Frames")));
        assertEquals(2, first.copy().copied());
        assertEquals(0, second.copy().copied());
        assertEquals(2, second.copy().skipped());
    }

    @Test
    void shouldReportNothingForDateWithoutArchives() throws Exception {
        ArchiveFetcher.FetchReport report = new ArchiveFetcher(new LocalArchiveStore(archive))
                .fetch("Maria Muster", List.of(LocalDate.of(2023, 1, 1)), false, workspace);

        assertTrue(report.archiveIds().isEmpty());
        assertTrue(report.copy().nothingCopied());
    }

    private void archiveUnit(String id, String series) throws Exception {
        Path unit = Files.createDirectories(archive.resolve(id));
        Files.writeString(unit.resolve(series + "_rec.mrc"), "tomogram");
        Files.writeString(unit.resolve(series + ".xf"), "transforms");
        Path frames = Files.createDirectories(unit.resolve("Frames"));
        Files.writeString(frames.resolve(series + "_000.tif"), "frame");
    }
}
