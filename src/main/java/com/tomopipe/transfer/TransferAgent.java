package com.tomopipe.transfer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomopipe.normalize.FrameReference;
import com.tomopipe.normalize.MdocDocument;
import com.tomopipe.normalize.MetadataNormalizer;
import com.tomopipe.normalize.MetadataParseException;
import com.tomopipe.process.Sleeper;
import com.tomopipe.stage.ReconstructionBinding;
import com.tomopipe.stage.StageBinding;
import com.tomopipe.stage.StageLayout;
import com.tomopipe.stage.UnitProcessingException;
import com.tomopipe.stage.WorkUnit;

/**
 * Archives reconstructed units. Each unit gets a durable identifier, its directory and raw frames
 * are copied under that identifier, and the watcher then relocates the unit to the done directory.
 */
public class TransferAgent implements StageBinding {
    private static final Logger log = LoggerFactory.getLogger(TransferAgent.class);

    public static final String STAGE = "transfer";
    public static final String ARCHIVE_FRAMES_DIR = "Frames";

    private final String dataset;
    private final String initials;
    private final Path framesDir;
    private final ArchiveStore store;
    private final TransferLedger ledger;
    private final TransferLog transferLog;
    private final int maxRetries;
    private final Duration retryBackoff;
    private final Sleeper sleeper;
    private final Clock clock;

    private final AtomicInteger archived = new AtomicInteger();
    private final AtomicInteger alreadyArchived = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();

    public TransferAgent(String dataset, String operator, Path framesDir, ArchiveStore store, TransferLedger ledger,
            TransferLog transferLog, int maxRetries, Duration retryBackoff, Sleeper sleeper, Clock clock) {
        this.dataset = dataset;
        this.initials = DurableIdentifier.initials(operator);
        this.framesDir = framesDir;
        this.store = store;
        this.ledger = ledger;
        this.transferLog = transferLog;
        this.maxRetries = maxRetries;
        this.retryBackoff = retryBackoff;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    @Override
    public List<WorkUnit> detect(Path watchDir) throws IOException {
        List<Path> dirs;
        try (Stream<Path> stream = Files.list(watchDir)) {
            dirs = stream.filter(Files::isDirectory)
                    .filter(path -> !path.getFileName().toString().startsWith("."))
                    .sorted()
                    .toList();
        }
        List<WorkUnit> units = new ArrayList<>();
        for (Path dir : dirs) {
            String series = dir.getFileName().toString();
            if (Files.isRegularFile(dir.resolve(ReconstructionBinding.tomogramName(series)))) {
                units.add(new WorkUnit(series, List.of(dir)));
            }
        }
        return units;
    }

    @Override
    public List<String> artifacts(WorkUnit unit) {
        return List.of();
    }

    @Override
    public boolean consumesInputsInPlace() {
        return false;
    }

    @Override
    public boolean requiresLease() {
        return true;
    }

    @Override
    public void process(WorkUnit unit, Path workDir, StageLayout layout) throws UnitProcessingException, InterruptedException {
        try {
            archive(unit.name(), unit.primaryInput());
        } catch (TransferException e) {
            throw new UnitProcessingException(STAGE, unit.name(), e.getMessage(), e);
        } catch (IOException e) {
            throw new UnitProcessingException(STAGE, unit.name(), "transfer bookkeeping failed: " + e.getMessage(), e);
        }
    }

    /**
     * Copies one unit and its raw frames to the archive. Safe to repeat: existing files are skipped
     * and a unit already logged as archived is never logged as archived again.
     */
    public TransferLogEntry archive(String unit, Path unitDir) throws TransferException, IOException, InterruptedException {
        LocalDate date = LocalDate.now(clock);
        String id = ledger.identifierFor(dataset, unit, initials, date, store.list(DurableIdentifier.prefix(initials, date) + "-"));
        Optional<TransferLedger.Entry> entry = ledger.find(dataset, unit);
        if (entry.isPresent() && entry.get().archivedAt != null && store.exists(id)) {
            alreadyArchived.incrementAndGet();
            log.info("transfer.skip unit={} id={} reason=already-archived", unit, id);
            return record(unit, id, TransferOutcome.ALREADY_ARCHIVED, CopyReport.EMPTY, 0, "recorded in ledger");
        }

        List<Path> frames = rawFrames(unit, unitDir);
        CopyReport report = null;
        int attempt = 0;
        while (report == null) {
            attempt++;
            try {
                report = store.upload(unitDir, id).plus(store.uploadFiles(frames, id + "/" + ARCHIVE_FRAMES_DIR));
            } catch (TransferException e) {
                if (!e.isRetryable() || attempt > maxRetries) {
                    failed.incrementAndGet();
                    log.error("transfer.failed unit={} id={} attempts={} reason={}", unit, id, attempt, e.getMessage());
                    record(unit, id, TransferOutcome.FAILED, CopyReport.EMPTY, attempt, e.getMessage());
                    throw e;
                }
                Duration backoff = retryBackoff.multipliedBy(attempt);
                log.warn("transfer.retry unit={} id={} attempt={} backoff={} reason={}", unit, id, attempt, backoff, e.getMessage());
                sleeper.sleep(backoff);
            }
        }

        ledger.markArchived(dataset, unit);
        if (transferLog.hasArchived(id)) {
            alreadyArchived.incrementAndGet();
            log.info("transfer.verified unit={} id={} copied={} skipped={}", unit, id, report.copied(), report.skipped());
            return record(unit, id, TransferOutcome.ALREADY_ARCHIVED, report, attempt, "archive already complete");
        }
        archived.incrementAndGet();
        log.info("transfer.archived unit={} id={} copied={} skipped={} frames={} bytes={}",
                unit, id, report.copied(), report.skipped(), frames.size(), report.bytesCopied());
        return record(unit, id, TransferOutcome.ARCHIVED, report, attempt, null);
    }

    /**
     * Raw frames named by the unit's sidecar that are present in the dataset's frame directory.
     */
    List<Path> rawFrames(String unit, Path unitDir) {
        Path sidecar = unitDir.resolve(unit + MetadataNormalizer.CANONICAL_SUFFIX);
        if (!Files.isRegularFile(sidecar)) {
            log.warn("transfer.no-sidecar unit={} expected={}", unit, sidecar.getFileName());
            return List.of();
        }
        List<Path> frames = new ArrayList<>();
        try {
            for (FrameReference frame : MdocDocument.read(sidecar).framesByTiltAngle()) {
                Path path = framesDir.resolve(frame.frameFileName());
                if (Files.isRegularFile(path)) {
                    frames.add(path);
                } else {
                    log.warn("transfer.frame-missing unit={} frame={}", unit, frame.frameFileName());
                }
            }
        } catch (IOException | MetadataParseException e) {
            log.warn("transfer.sidecar-unreadable unit={} reason={}", unit, e.getMessage());
        }
        return frames;
    }

    public TransferLogEntry writeSummary() throws IOException {
        String details = "archived=" + archived.get() + " alreadyArchived=" + alreadyArchived.get() + " failed=" + failed.get();
        log.info("transfer.summary dataset={} {}", dataset, details);
        TransferLogEntry entry = new TransferLogEntry(Instant.now(clock), dataset, null, null, TransferOutcome.RUN_SUMMARY,
                0, 0, 0L, 0, details);
        transferLog.append(entry);
        return entry;
    }

    private TransferLogEntry record(String unit, String id, TransferOutcome outcome, CopyReport report, int attempts, String details)
            throws IOException {
        TransferLogEntry entry = new TransferLogEntry(Instant.now(clock), dataset, unit, id, outcome,
                report.copied(), report.skipped(), report.bytesCopied(), attempts, details);
        transferLog.append(entry);
        return entry;
    }
}
