package com.tomopipe.transfer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Files of a source that are missing, or of a different size, at the destination.
 */
record CopyPlan(List<Entry> toCopy, int skipped) {

    record Entry(Path source, Path target, long size) {
    }

    long bytes() {
        return toCopy.stream().mapToLong(Entry::size).sum();
    }

    CopyReport report() {
        return new CopyReport(toCopy.size(), skipped, bytes());
    }

    static CopyPlan forTree(Path source, Path destination, Set<String> excludedDirs) throws IOException {
        if (!Files.isDirectory(source)) {
            return forFiles(List.of(source), destination);
        }
        List<Path> files;
        try (Stream<Path> stream = Files.walk(source)) {
            files = stream.filter(Files::isRegularFile)
                    .filter(path -> !excluded(source.relativize(path), excludedDirs))
                    .sorted()
                    .toList();
        }
        List<Entry> toCopy = new ArrayList<>();
        int skipped = 0;
        for (Path file : files) {
            Path target = destination.resolve(source.relativize(file).toString());
            long size = Files.size(file);
            if (sameSize(target, size)) {
                skipped++;
            } else {
                toCopy.add(new Entry(file, target, size));
            }
        }
        return new CopyPlan(List.copyOf(toCopy), skipped);
    }

    static CopyPlan forFiles(List<Path> files, Path destinationDir) throws IOException {
        List<Entry> toCopy = new ArrayList<>();
        int skipped = 0;
        for (Path file : files) {
            Path target = destinationDir.resolve(file.getFileName().toString());
            long size = Files.size(file);
            if (sameSize(target, size)) {
                skipped++;
            } else {
                toCopy.add(new Entry(file, target, size));
            }
        }
        return new CopyPlan(List.copyOf(toCopy), skipped);
    }

    private static boolean excluded(Path relative, Set<String> excludedDirs) {
        return relative.getNameCount() > 1 && excludedDirs.contains(relative.getName(0).toString());
    }

    private static boolean sameSize(Path target, long size) throws IOException {
        return Files.isRegularFile(target) && Files.size(target) == size;
    }
}
