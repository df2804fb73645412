package com.tomopipe.transfer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Append-only JSON-lines record of transfer outcomes, one line per unit outcome or run summary.
 */
public class TransferLog {
    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();
    private final Path path;

    public TransferLog(Path path) {
        this.path = path;
    }

    public synchronized void append(TransferLogEntry entry) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        String line = mapper.writeValueAsString(entry) + System.lineSeparator();
        Files.writeString(path, line, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                StandardOpenOption.APPEND);
    }

    public synchronized List<TransferLogEntry> readAll() throws IOException {
        if (!Files.exists(path)) {
            return List.of();
        }
        List<TransferLogEntry> entries = new ArrayList<>();
        for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
            if (line == null || line.isBlank()) {
                continue;
            }
            entries.add(mapper.readValue(line, TransferLogEntry.class));
        }
        return entries;
    }

    public boolean hasArchived(String durableId) throws IOException {
        return readAll().stream()
                .anyMatch(entry -> entry.outcome() == TransferOutcome.ARCHIVED && durableId.equals(entry.durableId()));
    }

    public Path path() {
        return path;
    }
}
