package com.tomopipe.transfer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Remembers the durable identifier given to each archived unit so a rerun reuses it instead of
 * allocating a new one.
 */
public class TransferLedger {
    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();
    private final Path path;
    private Map<String, Entry> entries;

    public TransferLedger(Path path) {
        this.path = path;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Entry {
        public String dataset;
        public String unit;
        public String durableId;
        public Instant allocatedAt;
        public Instant archivedAt;
    }

    /**
     * Returns the unit's identifier, allocating the next free sequence number for the operator and
     * date on first use. {@code archiveIds} are identifiers already present in the archive, so ids
     * handed out by another workspace are not reused.
     */
    public synchronized String identifierFor(String dataset, String unit, String initials, LocalDate date,
            Collection<String> archiveIds) throws IOException {
        Entry existing = entries().get(key(dataset, unit));
        if (existing != null) {
            return existing.durableId;
        }
        String prefix = DurableIdentifier.prefix(initials, date);
        int highest = 0;
        for (Entry entry : entries().values()) {
            highest = Math.max(highest, DurableIdentifier.sequenceOf(entry.durableId, prefix));
        }
        for (String id : archiveIds) {
            highest = Math.max(highest, DurableIdentifier.sequenceOf(id, prefix));
        }
        Entry entry = new Entry();
        entry.dataset = dataset;
        entry.unit = unit;
        entry.durableId = DurableIdentifier.format(initials, date, highest + 1);
        entry.allocatedAt = Instant.now();
        entries().put(key(dataset, unit), entry);
        persist();
        return entry.durableId;
    }

    public synchronized void markArchived(String dataset, String unit) throws IOException {
        Entry entry = entries().get(key(dataset, unit));
        if (entry == null) {
            throw new IllegalStateException("No identifier allocated for " + key(dataset, unit));
        }
        entry.archivedAt = Instant.now();
        persist();
    }

    public synchronized Optional<Entry> find(String dataset, String unit) throws IOException {
        return Optional.ofNullable(entries().get(key(dataset, unit)));
    }

    public synchronized Map<String, Entry> all() throws IOException {
        return Map.copyOf(entries());
    }

    private static String key(String dataset, String unit) {
        return dataset + "/" + unit;
    }

    private Map<String, Entry> entries() throws IOException {
        if (entries == null) {
            if (!Files.exists(path) || Files.size(path) == 0L) {
                entries = new LinkedHashMap<>();
            } else {
                entries = mapper.readValue(path.toFile(), new TypeReference<LinkedHashMap<String, Entry>>() {
                });
            }
        }
        return entries;
    }

    private void persist() throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), entries);
        Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
