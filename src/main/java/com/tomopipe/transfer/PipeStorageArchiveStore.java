package com.tomopipe.transfer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomopipe.process.CommandResult;
import com.tomopipe.process.CommandRunner;

/**
 * Archive behind the {@code pipe storage} CLI. The same bucket is expected to be mounted at
 * {@code mountedRoot}; the mount is only read, to decide what still needs copying and to list
 * archive entries.
 */
public class PipeStorageArchiveStore implements ArchiveStore {
    private static final Logger log = LoggerFactory.getLogger(PipeStorageArchiveStore.class);

    private final Path mountedRoot;
    private final String storageUri;
    private final CommandRunner runner;
    private final String executable;

    public PipeStorageArchiveStore(Path mountedRoot, String storageUri, CommandRunner runner) {
        this(mountedRoot, storageUri, runner, "pipe");
    }

    public PipeStorageArchiveStore(Path mountedRoot, String storageUri, CommandRunner runner, String executable) {
        this.mountedRoot = mountedRoot;
        this.storageUri = storageUri.endsWith("/") ? storageUri.substring(0, storageUri.length() - 1) : storageUri;
        this.runner = runner;
        this.executable = executable;
    }

    @Override
    public Path root() {
        return mountedRoot;
    }

    @Override
    public CopyReport upload(Path source, String destination) throws TransferException {
        CopyPlan plan = plan(() -> CopyPlan.forTree(source, mountedRoot.resolve(destination), Set.of()), source.toString());
        if (!plan.toCopy().isEmpty()) {
            boolean directory = Files.isDirectory(source);
            run(copyCommand(directory, source.toString(), uri(destination) + (directory ? "" : "/"), Set.of()));
        }
        return plan.report();
    }

    @Override
    public CopyReport uploadFiles(List<Path> files, String destination) throws TransferException {
        CopyPlan plan = plan(() -> CopyPlan.forFiles(files, mountedRoot.resolve(destination)), destination);
        for (CopyPlan.Entry entry : plan.toCopy()) {
            run(copyCommand(false, entry.source().toString(), uri(destination) + "/" + entry.source().getFileName(), Set.of()));
        }
        return plan.report();
    }

    @Override
    public CopyReport downloadFile(String source, Path destinationDir) throws TransferException {
        CopyPlan plan = plan(() -> CopyPlan.forFiles(List.of(mountedRoot.resolve(source)), destinationDir), source);
        for (CopyPlan.Entry entry : plan.toCopy()) {
            run(copyCommand(false, uri(source), entry.target().toString(), Set.of()));
        }
        return plan.report();
    }

    @Override
    public CopyReport downloadTree(String source, Path destination, Set<String> excludedDirs) throws TransferException {
        CopyPlan plan = plan(() -> CopyPlan.forTree(mountedRoot.resolve(source), destination, excludedDirs), source);
        if (!plan.toCopy().isEmpty()) {
            run(copyCommand(true, uri(source), destination.toString(), excludedDirs));
        }
        return plan.report();
    }

    List<String> copyCommand(boolean recursive, String from, String to, Set<String> excludedDirs) {
        List<String> command = new ArrayList<>(List.of(executable, "storage", "cp"));
        if (recursive) {
            command.add("-r");
        }
        command.add("--skip-existing");
        command.add("--force");
        for (String excluded : new TreeSet<>(excludedDirs)) {
            command.add("-e");
            command.add(excluded + "/*");
        }
        command.add(from);
        command.add(to);
        return command;
    }

    private String uri(String relative) {
        return storageUri + "/" + relative;
    }

    private void run(List<String> command) throws TransferException {
        CommandResult result = runner.run(null, command);
        if (!result.isSuccess()) {
            log.warn("archive.pipe-failed command={} result={}", String.join(" ", command), result.describe());
            throw new TransferException("pipe storage cp " + command.get(command.size() - 2) + " failed: " + result.describe(),
                    !result.launchFailed());
        }
    }

    private CopyPlan plan(PlanSupplier supplier, String what) throws TransferException {
        try {
            return supplier.get();
        } catch (IOException e) {
            throw new TransferException("Unable to inspect " + what + ": " + e.getMessage(), true, e);
        }
    }

    @FunctionalInterface
    private interface PlanSupplier {
        CopyPlan get() throws IOException;
    }
}
