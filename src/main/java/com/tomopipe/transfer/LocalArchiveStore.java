package com.tomopipe.transfer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Archive on a mounted filesystem. Each file is copied to a hidden temporary name first and moved
 * into place, so an interrupted copy never leaves a same-named partial file behind.
 */
public class LocalArchiveStore implements ArchiveStore {
    private static final Logger log = LoggerFactory.getLogger(LocalArchiveStore.class);

    private final Path root;

    public LocalArchiveStore(Path root) {
        this.root = root;
    }

    @Override
    public Path root() {
        return root;
    }

    @Override
    public CopyReport upload(Path source, String destination) throws TransferException {
        try {
            return execute(CopyPlan.forTree(source, root.resolve(destination), Set.of()));
        } catch (IOException e) {
            throw new TransferException("Copy of " + source + " to archive " + destination + " failed: " + e.getMessage(), true, e);
        }
    }

    @Override
    public CopyReport uploadFiles(List<Path> files, String destination) throws TransferException {
        try {
            return execute(CopyPlan.forFiles(files, root.resolve(destination)));
        } catch (IOException e) {
            throw new TransferException("Copy of " + files.size() + " file(s) to archive " + destination + " failed: " + e.getMessage(), true, e);
        }
    }

    @Override
    public CopyReport downloadFile(String source, Path destinationDir) throws TransferException {
        try {
            return execute(CopyPlan.forFiles(List.of(root.resolve(source)), destinationDir));
        } catch (IOException e) {
            throw new TransferException("Fetch of " + source + " failed: " + e.getMessage(), true, e);
        }
    }

    @Override
    public CopyReport downloadTree(String source, Path destination, Set<String> excludedDirs) throws TransferException {
        try {
            return execute(CopyPlan.forTree(root.resolve(source), destination, excludedDirs));
        } catch (IOException e) {
            throw new TransferException("Fetch of " + source + " failed: " + e.getMessage(), true, e);
        }
    }

    private CopyReport execute(CopyPlan plan) throws IOException {
        for (CopyPlan.Entry entry : plan.toCopy()) {
            Files.createDirectories(entry.target().getParent());
            Path temp = entry.target().resolveSibling("." + entry.target().getFileName() + ".part");
            Files.copy(entry.source(), temp, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
            Files.move(temp, entry.target(), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        }
        CopyReport report = plan.report();
        log.debug("archive.copy copied={} skipped={} bytes={}", report.copied(), report.skipped(), report.bytesCopied());
        return report;
    }
}
