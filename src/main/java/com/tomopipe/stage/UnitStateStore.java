package com.tomopipe.stage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Per-stage unit state persisted as JSON next to the pipeline state. This file, not the directory a
 * unit currently sits in, decides whether a unit is claimed, done or failed.
 */
public class UnitStateStore {
    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();
    private final Path path;
    private Map<String, UnitRecord> records;

    public UnitStateStore(Path path) {
        this.path = path;
    }

    public static UnitStateStore forStage(Path stateDir, String stage) {
        return new UnitStateStore(stateDir.resolve("units").resolve(stage + ".json"));
    }

    public synchronized Map<String, UnitRecord> all() throws IOException {
        return Map.copyOf(records());
    }

    public synchronized Optional<UnitRecord> get(String unit) throws IOException {
        return Optional.ofNullable(records().get(unit));
    }

    public synchronized UnitRecord update(String unit, UnitState state, String error) throws IOException {
        UnitRecord record = records().computeIfAbsent(unit, name -> {
            UnitRecord created = new UnitRecord();
            created.name = name;
            return created;
        });
        record.state = state;
        record.lastError = error;
        record.updatedAt = Instant.now();
        if (state == UnitState.CLAIMED) {
            record.attempts++;
            record.claimedAt = record.updatedAt;
        }
        persist();
        return record;
    }

    public synchronized void put(UnitRecord record) throws IOException {
        record.updatedAt = Instant.now();
        records().put(record.name, record);
        persist();
    }

    /**
     * Returns a {@link UnitState#FAILED} unit to {@link UnitState#PENDING} so the next scan picks it
     * up again. Any other state is left alone.
     */
    public synchronized boolean resetFailed(String unit) throws IOException {
        UnitRecord record = records().get(unit);
        if (record == null || record.state != UnitState.FAILED) {
            return false;
        }
        update(unit, UnitState.PENDING, null);
        return true;
    }

    public synchronized boolean remove(String unit) throws IOException {
        boolean removed = records().remove(unit) != null;
        if (removed) {
            persist();
        }
        return removed;
    }

    public Path path() {
        return path;
    }

    private Map<String, UnitRecord> records() throws IOException {
        if (records == null) {
            records = load();
        }
        return records;
    }

    private Map<String, UnitRecord> load() throws IOException {
        if (!Files.exists(path) || Files.size(path) == 0L) {
            return new LinkedHashMap<>();
        }
        return mapper.readValue(path.toFile(), new TypeReference<LinkedHashMap<String, UnitRecord>>() {
        });
    }

    private void persist() throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), records);
        Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
