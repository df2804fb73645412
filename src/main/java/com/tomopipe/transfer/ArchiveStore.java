package com.tomopipe.transfer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Durable storage for archived units. Every copy skips files that already exist at the destination
 * with the same size. Paths inside the archive are relative to {@link #root()}, which is also where
 * the archive is visible on the local filesystem.
 */
public interface ArchiveStore {

    Path root();

    /**
     * Copies a file, or a directory tree, to {@code destination}. A directory's contents land directly
     * under {@code destination}.
     */
    CopyReport upload(Path source, String destination) throws TransferException;

    CopyReport uploadFiles(List<Path> files, String destination) throws TransferException;

    CopyReport downloadFile(String source, Path destinationDir) throws TransferException;

    CopyReport downloadTree(String source, Path destination, Set<String> excludedDirs) throws TransferException;

    default boolean exists(String relative) {
        return Files.exists(root().resolve(relative));
    }

    /**
     * Names of the top-level archive entries starting with {@code prefix}, sorted.
     */
    default List<String> list(String prefix) throws IOException {
        if (!Files.isDirectory(root())) {
            return List.of();
        }
        try (Stream<Path> stream = Files.list(root())) {
            return stream.filter(Files::isDirectory)
                    .map(path -> path.getFileName().toString())
                    .filter(name -> name.startsWith(prefix))
                    .sorted()
                    .toList();
        }
    }
}
