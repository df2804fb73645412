package com.tomopipe.stage;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exclusive hold on one unit directory shared by two consumers. The lease is a file under
 * {@code <dir>/.leases/} created with {@code CREATE_NEW}; a lease whose holder process is gone is
 * broken on the next attempt.
 */
public final class UnitLease implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(UnitLease.class);

    public static final String LEASE_DIR = ".leases";

    private final Path file;
    private final String holder;

    private UnitLease(Path file, String holder) {
        this.file = file;
        this.holder = holder;
    }

    public static Path pathFor(Path unitParent, String unit) {
        return unitParent.resolve(LEASE_DIR).resolve(unit + ".lease");
    }

    public static boolean isHeld(Path unitParent, String unit) {
        return Files.exists(pathFor(unitParent, unit));
    }

    public static Optional<UnitLease> tryAcquire(Path unitParent, String unit, String holder) throws IOException {
        Path file = pathFor(unitParent, unit);
        Files.createDirectories(file.getParent());
        for (int attempt = 0; attempt < 2; attempt++) {
            try {
                Files.writeString(file, holder + " " + ProcessHandle.current().pid() + " " + Instant.now() + "\n",
                        StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                return Optional.of(new UnitLease(file, holder));
            } catch (FileAlreadyExistsException e) {
                if (!breakIfStale(file)) {
                    return Optional.empty();
                }
            }
        }
        return Optional.empty();
    }

    private static boolean breakIfStale(Path file) throws IOException {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            return false;
        }
        String[] parts = content.split("\\s+");
        if (parts.length < 2) {
            return false;
        }
        long pid;
        try {
            pid = Long.parseLong(parts[1]);
        } catch (NumberFormatException e) {
            return false;
        }
        if (pid == ProcessHandle.current().pid() || ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false)) {
            return false;
        }
        log.warn("lease.stale file={} holder={} pid={}", file, parts[0], pid);
        return Files.deleteIfExists(file);
    }

    public Path file() {
        return file;
    }

    public String holder() {
        return holder;
    }

    @Override
    public void close() throws IOException {
        Files.deleteIfExists(file);
    }
}
