package com.tomopipe.process;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * File-backed view of the running supervisor: a snapshot of its sessions plus a control directory
 * where other processes drop {@code <name>.stop} requests.
 */
public class SessionRegistry {
    public static final String ALL = "ALL";
    private static final String STOP_SUFFIX = ".stop";

    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();
    private final Path registryFile;
    private final Path controlDir;

    public SessionRegistry(Path stateDir) {
        this.registryFile = stateDir.resolve("sessions.json");
        this.controlDir = stateDir.resolve("control");
    }

    public synchronized void save(List<SessionInfo> sessions) throws IOException {
        Files.createDirectories(registryFile.getParent());
        Path temp = registryFile.resolveSibling(registryFile.getFileName() + ".tmp");
        mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), sessions);
        Files.move(temp, registryFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    public List<SessionInfo> load() throws IOException {
        if (!Files.exists(registryFile) || Files.size(registryFile) == 0L) {
            return List.of();
        }
        return mapper.readValue(registryFile.toFile(), new TypeReference<List<SessionInfo>>() {
        });
    }

    public void requestStop(String name) throws IOException {
        Files.createDirectories(controlDir);
        Path request = controlDir.resolve(name + STOP_SUFFIX);
        if (!Files.exists(request)) {
            Files.createFile(request);
        }
    }

    public List<String> drainStopRequests() throws IOException {
        if (!Files.isDirectory(controlDir)) {
            return List.of();
        }
        List<Path> requests;
        try (Stream<Path> stream = Files.list(controlDir)) {
            requests = stream.filter(path -> path.getFileName().toString().endsWith(STOP_SUFFIX)).sorted().toList();
        }
        List<String> names = new ArrayList<>();
        for (Path request : requests) {
            String fileName = request.getFileName().toString();
            names.add(fileName.substring(0, fileName.length() - STOP_SUFFIX.length()));
            Files.deleteIfExists(request);
        }
        return names;
    }
}
