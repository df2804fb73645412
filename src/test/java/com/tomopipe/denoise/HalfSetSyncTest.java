package com.tomopipe.denoise;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.tomopipe.transfer.LocalArchiveStore;
import com.tomopipe.transfer.TransferLedger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HalfSetSyncTest {

    @TempDir
    Path tempDir;

    private Path done;
    private Path archiveRoot;
    private TransferLedger ledger;

    @BeforeEach
    void setUp() throws IOException {
        done = Files.createDirectories(tempDir.resolve("Aligned").resolve("Done"));
        archiveRoot = Files.createDirectories(tempDir.resolve("archive"));
        ledger = new TransferLedger(tempDir.resolve(".tomopipe").resolve("transfer-ledger.json"));
    }

    @Test
    void shouldCopyHalfSetsIntoArchivedUnitUnderItsIdentifier() throws Exception {
        Path unit = preparedUnit("TS_01");
        String id = ledger.identifierFor("session", "TS_01", "mm", LocalDate.of(2024, 7, 25), List.of());
        Files.createDirectories(archiveRoot.resolve(id));
        HalfSetSync sync = new HalfSetSync("session", ledger, new LocalArchiveStore(archiveRoot));

        HalfSetSync.UnitResult first = sync.sync(unit);
        HalfSetSync.UnitResult second = sync.sync(unit);

        assertEquals(HalfSetSync.Status.SYNCED, first.status());
        assertEquals("mm2024-07-25-001/halfsets", first.detail());
        assertEquals("evens", Files.readString(archiveRoot.resolve(id).resolve("halfsets").resolve("TS_01_rec_evens.mrc")));
        assertEquals("odds", Files.readString(archiveRoot.resolve(id).resolve("halfsets").resolve("TS_01_rec_odds.mrc")));
        assertEquals(HalfSetSync.Status.SYNCED, second.status());
    }

    @Test
    void shouldSkipUnitsTheTransferStageHasNotArchived() throws Exception {
        preparedUnit("TS_01");
        preparedUnit("TS_02");
        ledger.identifierFor("session", "TS_02", "mm", LocalDate.of(2024, 7, 25), List.of());
        Files.createDirectories(done.resolve("TS_03"));
        Files.writeString(done.resolve("TS_03").resolve("TS_03_rec.mrc"), "no halves yet");
        HalfSetSync sync = new HalfSetSync("session", ledger, new LocalArchiveStore(archiveRoot));

        List<HalfSetSync.UnitResult> results = sync.syncAll(List.of(done, tempDir.resolve("Reconstructed")));

        assertEquals(2, results.size());
        assertTrue(results.stream().allMatch(result -> result.status() == HalfSetSync.Status.NOT_ARCHIVED));
        assertFalse(Files.exists(archiveRoot.resolve("mm2024-07-25-001")));
    }

    private Path preparedUnit(String series) throws IOException {
        Path unit = Files.createDirectories(done.resolve(series));
        Files.writeString(unit.resolve(series + "_rec.mrc"), "tomogram");
        Path halfsets = Files.createDirectories(unit.resolve("halfsets"));
        Files.writeString(halfsets.resolve(series + "_rec_evens.mrc"), "evens");
        Files.writeString(halfsets.resolve(series + "_rec_odds.mrc"), "odds");
        return unit;
    }
}
