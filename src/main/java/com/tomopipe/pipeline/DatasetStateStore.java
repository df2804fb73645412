package com.tomopipe.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * One JSON file per dataset under {@code <stateDir>/datasets/}. Lifecycle changes only move forward;
 * re-entering the current stage is a no-op.
 */
public class DatasetStateStore {
    private static final Logger log = LoggerFactory.getLogger(DatasetStateStore.class);

    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();
    private final Path directory;
    private final Clock clock;

    public DatasetStateStore(Path stateDir) {
        this(stateDir, Clock.systemUTC());
    }

    public DatasetStateStore(Path stateDir, Clock clock) {
        this.directory = stateDir.resolve("datasets");
        this.clock = clock;
    }

    public synchronized Optional<DatasetRecord> find(String name) throws IOException {
        Path file = pathFor(name);
        if (!Files.exists(file) || Files.size(file) == 0L) {
            return Optional.empty();
        }
        return Optional.of(mapper.readValue(file.toFile(), DatasetRecord.class));
    }

    public synchronized DatasetRecord loadOrCreate(String name, Path sourceDir) throws IOException {
        Optional<DatasetRecord> existing = find(name);
        if (existing.isPresent()) {
            return existing.get();
        }
        DatasetRecord record = new DatasetRecord();
        record.name = name;
        record.sourceDir = sourceDir.toAbsolutePath().normalize().toString();
        record.createdAt = Instant.now(clock);
        record.transitions.put(DatasetLifecycle.RAW, record.createdAt);
        save(record);
        return record;
    }

    public synchronized DatasetRecord advance(String name, DatasetLifecycle next) throws IOException, LifecycleTransitionException {
        DatasetRecord record = find(name).orElseThrow(() -> new IOException("No state recorded for dataset " + name));
        if (!record.lifecycle.canAdvanceTo(next)) {
            throw new LifecycleTransitionException(name, record.lifecycle, next);
        }
        if (record.lifecycle == next) {
            return record;
        }
        log.info("dataset.lifecycle dataset={} from={} to={}", name, record.lifecycle, next);
        record.lifecycle = next;
        record.transitions.put(next, Instant.now(clock));
        save(record);
        return record;
    }

    /**
     * Advances to {@code next} unless the dataset is already there or further along. Used for
     * transitions observed concurrently by several stages.
     */
    public synchronized Optional<DatasetRecord> advanceIfBehind(String name, DatasetLifecycle next)
            throws IOException, LifecycleTransitionException {
        Optional<DatasetRecord> record = find(name);
        if (record.isEmpty() || record.get().lifecycle.isAtLeast(next)) {
            return record;
        }
        return Optional.of(advance(name, next));
    }

    public synchronized void save(DatasetRecord record) throws IOException {
        record.updatedAt = Instant.now(clock);
        Path file = pathFor(record.name);
        Files.createDirectories(directory);
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), record);
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    public Path pathFor(String name) {
        return directory.resolve(name + ".json");
    }
}
