package com.tomopipe.normalize;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomopipe.runtime.AcquisitionSoftware;
import com.tomopipe.runtime.ConfigurationException;

public class MetadataNormalizer {
    private static final Logger log = LoggerFactory.getLogger(MetadataNormalizer.class);

    public static final String SIDECAR_SUFFIX = ".mdoc";
    public static final String CANONICAL_SUFFIX = ".mrc.mdoc";
    public static final String FRAMES_DIR = "Frames";

    private final AcquisitionSoftware software;
    private final Double tiltAxisOverride;
    private final String framesName;
    private final String duplicateMarker;

    public MetadataNormalizer(AcquisitionSoftware software, Double tiltAxisOverride, String framesName, String duplicateMarker) {
        this.software = software;
        this.tiltAxisOverride = tiltAxisOverride;
        this.framesName = framesName;
        this.duplicateMarker = duplicateMarker.toLowerCase(Locale.ROOT);
    }

    public NormalizationReport normalize(Path datasetDir) throws ConfigurationException, MetadataParseException {
        if (!Files.isDirectory(datasetDir)) {
            throw new ConfigurationException("Dataset directory does not exist: " + datasetDir.toAbsolutePath().normalize());
        }
        try {
            List<Path> candidates = listSidecars(datasetDir).stream().filter(path -> !isDuplicate(path)).toList();
            if (candidates.isEmpty()) {
                throw new MetadataParseException(datasetDir, "No " + SIDECAR_SUFFIX + " sidecar found for dataset " + datasetDir.getFileName());
            }

            List<String> inconsistencies = new ArrayList<>();
            List<String> removed = removeDuplicates(datasetDir);
            List<String> renamed = software == AcquisitionSoftware.TOMOGRAPHY5
                    ? canonicalizeExtensions(datasetDir, inconsistencies)
                    : List.of();
            List<Path> sidecars = listSidecars(datasetDir).stream().filter(MetadataNormalizer::isCanonical).toList();
            if (sidecars.isEmpty()) {
                throw new MetadataParseException(datasetDir, "No " + CANONICAL_SUFFIX + " sidecar left after renaming in dataset "
                        + datasetDir.getFileName() + ": " + String.join("; ", inconsistencies));
            }

            Double canonicalAxis = null;
            List<String> rewritten = List.of();
            if (tiltAxisOverride != null) {
                canonicalAxis = TiltAxisConvention.toCanonical(software, tiltAxisOverride);
                rewritten = rewriteTiltAxis(sidecars, canonicalAxis);
            }
            List<String> relocated = relocateFrames(datasetDir, inconsistencies);

            for (String inconsistency : inconsistencies) {
                log.warn("normalize.inconsistency dataset={} detail={}", datasetDir.getFileName(), inconsistency);
            }
            log.info("normalize.done dataset={} software={} sidecars={} removed={} renamed={} rewritten={} relocatedFrames={} tiltAxis={}",
                    datasetDir.getFileName(), software, sidecars.size(), removed.size(), renamed.size(), rewritten.size(),
                    relocated.size(), canonicalAxis == null ? "unchanged" : TiltAxisConvention.format(canonicalAxis));
            return new NormalizationReport(datasetDir, sidecars, removed, renamed, rewritten, relocated,
                    List.copyOf(inconsistencies), canonicalAxis);
        } catch (IOException e) {
            throw new MetadataParseException(datasetDir, "Unable to normalize dataset " + datasetDir.getFileName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Normalizes each dataset independently. A metadata failure is recorded for that dataset and the
     * remaining datasets still run; a missing directory aborts the whole batch.
     */
    public BatchNormalizationResult normalizeAll(List<Path> datasetDirs) throws ConfigurationException {
        for (Path datasetDir : datasetDirs) {
            if (!Files.isDirectory(datasetDir)) {
                throw new ConfigurationException("Dataset directory does not exist: " + datasetDir.toAbsolutePath().normalize());
            }
        }
        List<NormalizationReport> reports = new ArrayList<>();
        Map<Path, String> failures = new LinkedHashMap<>();
        for (Path datasetDir : datasetDirs) {
            try {
                reports.add(normalize(datasetDir));
            } catch (MetadataParseException e) {
                log.error("normalize.failed dataset={} reason={}", datasetDir.getFileName(), e.getMessage());
                failures.put(datasetDir, e.getMessage());
            }
        }
        return new BatchNormalizationResult(reports, failures);
    }

    List<String> removeDuplicates(Path datasetDir) throws IOException {
        List<String> removed = new ArrayList<>();
        for (Path sidecar : listSidecars(datasetDir)) {
            if (isDuplicate(sidecar)) {
                Files.delete(sidecar);
                removed.add(sidecar.getFileName().toString());
                log.info("normalize.remove-duplicate dataset={} sidecar={}", datasetDir.getFileName(), sidecar.getFileName());
            }
        }
        return removed;
    }

    List<String> canonicalizeExtensions(Path datasetDir, List<String> inconsistencies) throws IOException {
        List<String> renamed = new ArrayList<>();
        for (Path sidecar : listSidecars(datasetDir)) {
            if (isCanonical(sidecar)) {
                continue;
            }
            String name = sidecar.getFileName().toString();
            Path target = sidecar.resolveSibling(name.substring(0, name.length() - SIDECAR_SUFFIX.length()) + CANONICAL_SUFFIX);
            if (Files.exists(target)) {
                inconsistencies.add("both " + name + " and " + target.getFileName() + " exist; left untouched");
                continue;
            }
            Files.move(sidecar, target, StandardCopyOption.ATOMIC_MOVE);
            renamed.add(name + " -> " + target.getFileName());
            log.info("normalize.rename dataset={} from={} to={}", datasetDir.getFileName(), name, target.getFileName());
        }
        return renamed;
    }

    List<String> rewriteTiltAxis(List<Path> sidecars, double canonicalAxis) throws IOException, MetadataParseException {
        String formatted = TiltAxisConvention.format(canonicalAxis);
        List<String> rewritten = new ArrayList<>();
        for (Path sidecar : sidecars) {
            MdocDocument document = MdocDocument.read(sidecar);
            if (document.replaceNumericValue(MdocDocument.TILT_AXIS_KEY, formatted) > 0) {
                document.write(sidecar);
                rewritten.add(sidecar.getFileName().toString());
                log.info("normalize.tilt-axis sidecar={} value={}", sidecar.getFileName(), formatted);
            }
        }
        return rewritten;
    }

    List<String> relocateFrames(Path datasetDir, List<String> inconsistencies) throws IOException {
        Path framesDir = datasetDir.resolve(FRAMES_DIR);
        List<Path> frames;
        try (Stream<Path> stream = Files.list(datasetDir)) {
            frames = stream.filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().contains(framesName))
                    .filter(path -> !isSidecar(path))
                    .sorted()
                    .toList();
        }
        if (frames.isEmpty()) {
            return List.of();
        }
        Files.createDirectories(framesDir);
        List<String> relocated = new ArrayList<>();
        for (Path frame : frames) {
            Path target = framesDir.resolve(frame.getFileName());
            if (Files.exists(target)) {
                inconsistencies.add("frame " + frame.getFileName() + " already present in " + FRAMES_DIR + "; left in place");
                continue;
            }
            Files.move(frame, target, StandardCopyOption.ATOMIC_MOVE);
            relocated.add(frame.getFileName().toString());
        }
        log.info("normalize.frames dataset={} moved={} target={}", datasetDir.getFileName(), relocated.size(), framesDir);
        return relocated;
    }

    static List<Path> listSidecars(Path datasetDir) throws IOException {
        try (Stream<Path> stream = Files.list(datasetDir)) {
            return stream.filter(Files::isRegularFile)
                    .filter(MetadataNormalizer::isSidecar)
                    .sorted()
                    .toList();
        }
    }

    public static boolean isSidecar(Path path) {
        return path.getFileName().toString().endsWith(SIDECAR_SUFFIX);
    }

    public static boolean isCanonical(Path path) {
        return path.getFileName().toString().endsWith(CANONICAL_SUFFIX);
    }

    public static String seriesName(Path canonicalSidecar) {
        String name = canonicalSidecar.getFileName().toString();
        return name.endsWith(CANONICAL_SUFFIX) ? name.substring(0, name.length() - CANONICAL_SUFFIX.length()) : name;
    }

    private boolean isDuplicate(Path sidecar) {
        return sidecar.getFileName().toString().toLowerCase(Locale.ROOT).contains(duplicateMarker);
    }
}
