package com.tomopipe.transfer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomopipe.stage.ReconstructionBinding;

/**
 * Pulls archived units of one operator back into a workspace, by processing date. Without metadata
 * only the tomograms are copied; with metadata everything except raw frames and snapshots, which is
 * what half-set preparation needs.
 */
public class ArchiveFetcher {
    private static final Logger log = LoggerFactory.getLogger(ArchiveFetcher.class);

    public static final Set<String> METADATA_EXCLUDES = Set.of("Frames", "Snapshots");

    private final ArchiveStore store;

    public ArchiveFetcher(ArchiveStore store) {
        this.store = store;
    }

    public record FetchReport(List<String> archiveIds, CopyReport copy) {
    }

    public FetchReport fetch(String operator, List<LocalDate> dates, boolean withMetadata, Path workspace)
            throws IOException, TransferException {
        String initials = DurableIdentifier.initials(operator);
        List<String> ids = new ArrayList<>();
        CopyReport total = CopyReport.EMPTY;
        for (LocalDate date : dates) {
            for (String id : store.list(DurableIdentifier.prefix(initials, date) + "-")) {
                ids.add(id);
                CopyReport report = withMetadata
                        ? store.downloadTree(id, workspace.resolve(id), METADATA_EXCLUDES)
                        : fetchTomograms(id, workspace);
                log.info("fetch.dataset id={} copied={} skipped={}", id, report.copied(), report.skipped());
                total = total.plus(report);
            }
        }
        if (ids.isEmpty()) {
            log.warn("fetch.nothing operator={} dates={}", initials, dates);
        }
        return new FetchReport(List.copyOf(ids), total);
    }

    private CopyReport fetchTomograms(String id, Path workspace) throws IOException, TransferException {
        List<Path> tomograms;
        try (Stream<Path> stream = Files.walk(store.root().resolve(id))) {
            tomograms = stream.filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(ReconstructionBinding.TOMOGRAM_SUFFIX))
                    .sorted()
                    .toList();
        }
        CopyReport report = CopyReport.EMPTY;
        for (Path tomogram : tomograms) {
            String relative = store.root().relativize(tomogram).toString();
            Path target = workspace.resolve(tomogram.getParent().getFileName().toString());
            report = report.plus(store.downloadFile(relative, target));
        }
        return report;
    }
}
