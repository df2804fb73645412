package com.tomopipe.denoise;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomopipe.transfer.ArchiveStore;
import com.tomopipe.transfer.CopyReport;
import com.tomopipe.transfer.TransferException;
import com.tomopipe.transfer.TransferLedger;

/**
 * Copies each unit's {@code halfsets/} directory into the unit's archive entry, found through the
 * identifier the transfer stage recorded. Units not archived yet are skipped; the transfer stage
 * picks their half sets up with the rest of the unit directory.
 */
public class HalfSetSync {
    private static final Logger log = LoggerFactory.getLogger(HalfSetSync.class);

    private final String dataset;
    private final TransferLedger ledger;
    private final ArchiveStore store;

    public HalfSetSync(String dataset, TransferLedger ledger, ArchiveStore store) {
        this.dataset = dataset;
        this.ledger = ledger;
        this.store = store;
    }

    public enum Status {
        SYNCED,
        NOT_ARCHIVED,
        FAILED
    }

    public record UnitResult(String unit, Status status, String detail) {
    }

    public List<UnitResult> syncAll(List<Path> roots) throws IOException {
        List<UnitResult> results = new ArrayList<>();
        for (Path root : roots) {
            if (!Files.isDirectory(root)) {
                continue;
            }
            for (Path unitDir : HalfSetPreparer.unitDirectories(root)) {
                if (HalfSetPreparer.halvesExist(unitDir, unitDir.getFileName().toString())) {
                    results.add(sync(unitDir));
                }
            }
        }
        log.info("halfsets.sync-pass dataset={} synced={} notArchived={} failed={}", dataset,
                count(results, Status.SYNCED), count(results, Status.NOT_ARCHIVED), count(results, Status.FAILED));
        return results;
    }

    public UnitResult sync(Path unitDir) throws IOException {
        String unit = unitDir.getFileName().toString();
        Optional<TransferLedger.Entry> entry = ledger.find(dataset, unit);
        if (entry.isEmpty() || !store.exists(entry.get().durableId)) {
            log.warn("halfsets.sync-skip dataset={} unit={} reason=not-in-archive", dataset, unit);
            return new UnitResult(unit, Status.NOT_ARCHIVED, null);
        }
        String destination = entry.get().durableId + "/" + HalfSetPreparer.HALFSETS_DIR;
        try {
            CopyReport report = store.upload(unitDir.resolve(HalfSetPreparer.HALFSETS_DIR), destination);
            log.info("halfsets.synced dataset={} unit={} destination={} copied={} skipped={}", dataset, unit, destination,
                    report.copied(), report.skipped());
            return new UnitResult(unit, Status.SYNCED, destination);
        } catch (TransferException e) {
            log.error("halfsets.sync-failed dataset={} unit={} reason={}", dataset, unit, e.getMessage());
            return new UnitResult(unit, Status.FAILED, e.getMessage());
        }
    }

    private static long count(List<UnitResult> results, Status status) {
        return results.stream().filter(result -> result.status() == status).count();
    }
}
