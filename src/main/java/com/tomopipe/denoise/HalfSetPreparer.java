package com.tomopipe.denoise;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomopipe.imod.ImodCommands;
import com.tomopipe.process.CommandResult;
import com.tomopipe.stage.ReconstructionBinding;
import com.tomopipe.stage.Relocations;
import com.tomopipe.stage.UnitLease;
import com.tomopipe.stage.UnitProcessingException;
import com.tomopipe.stage.WorkerProcess;

/**
 * Rebuilds each reconstructed unit as two half tomograms from alternating views, the paired input
 * that noise-to-noise denoisers train on. Results land in {@code <unit>/halfsets/}.
 */
public class HalfSetPreparer {
    private static final Logger log = LoggerFactory.getLogger(HalfSetPreparer.class);

    public static final String STAGE = "denoising-prep";
    public static final String HALFSETS_DIR = "halfsets";
    static final String SUCCESS_MARKER = "finished successfully";

    private final int binning;
    private final int gpu;
    private final String submitExecutable;
    private final WorkerProcess worker;
    private final Path logDir;

    public HalfSetPreparer(int binning, int gpu, String submitExecutable, WorkerProcess worker, Path logDir) {
        this.binning = binning;
        this.gpu = gpu;
        this.submitExecutable = submitExecutable;
        this.worker = worker;
        this.logDir = logDir;
    }

    public enum Status {
        PREPARED,
        ALREADY_PREPARED,
        NO_METADATA,
        LEASED,
        FAILED
    }

    public record UnitResult(String unit, Status status, String detail) {
    }

    public record Report(List<UnitResult> results) {

        public long count(Status status) {
            return results.stream().filter(result -> result.status() == status).count();
        }
    }

    /**
     * One pass over every unit directory under {@code roots}. A unit another consumer holds is
     * reported {@link Status#LEASED} and left for a later pass.
     */
    public Report prepareAll(List<Path> roots) throws IOException, InterruptedException {
        List<UnitResult> results = new ArrayList<>();
        for (Path root : roots) {
            if (!Files.isDirectory(root)) {
                continue;
            }
            for (Path unitDir : unitDirectories(root)) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedException("half-set preparation interrupted");
                }
                results.add(prepareLeased(root, unitDir));
            }
        }
        Report report = new Report(List.copyOf(results));
        log.info("halfsets.pass prepared={} alreadyPrepared={} noMetadata={} leased={} failed={}",
                report.count(Status.PREPARED), report.count(Status.ALREADY_PREPARED), report.count(Status.NO_METADATA),
                report.count(Status.LEASED), report.count(Status.FAILED));
        return report;
    }

    static List<Path> unitDirectories(Path root) throws IOException {
        try (Stream<Path> stream = Files.list(root)) {
            return stream.filter(Files::isDirectory)
                    .filter(dir -> !dir.getFileName().toString().startsWith("."))
                    .filter(dir -> Files.isRegularFile(dir.resolve(ReconstructionBinding.tomogramName(dir.getFileName().toString()))))
                    .sorted()
                    .toList();
        }
    }

    private UnitResult prepareLeased(Path root, Path unitDir) throws IOException, InterruptedException {
        String series = unitDir.getFileName().toString();
        if (halvesExist(unitDir, series)) {
            return new UnitResult(series, Status.ALREADY_PREPARED, null);
        }
        Optional<UnitLease> lease = UnitLease.tryAcquire(root, series, STAGE);
        if (lease.isEmpty()) {
            return new UnitResult(series, Status.LEASED, "held by another consumer");
        }
        try (UnitLease held = lease.get()) {
            if (!Files.isDirectory(unitDir)) {
                return new UnitResult(series, Status.LEASED, "moved before the lease was taken");
            }
            return prepare(unitDir);
        }
    }

    public UnitResult prepare(Path unitDir) throws InterruptedException {
        String series = unitDir.getFileName().toString();
        if (halvesExist(unitDir, series)) {
            return new UnitResult(series, Status.ALREADY_PREPARED, null);
        }
        MetadataStatus status = classify(unitDir, series);
        if (status == MetadataStatus.NONE) {
            log.warn("halfsets.no-metadata unit={} dir={}", series, unitDir);
            return new UnitResult(series, Status.NO_METADATA, "needs .tlt, .xtilt and either .xf or _ali.mrc");
        }
        try {
            writeCommandFiles(unitDir, series, status);
            if (status == MetadataStatus.NEWSTACK_AND_TILT) {
                submit(unitDir, series, HalfSetCommandFiles.NEWSTACK_COM);
            }
            for (HalfSetCommandFiles.Half half : HalfSetCommandFiles.Half.values()) {
                submit(unitDir, series, half.commandFile());
            }
            Path halfsets = unitDir.resolve(HALFSETS_DIR);
            Files.createDirectories(halfsets);
            for (HalfSetCommandFiles.Half half : HalfSetCommandFiles.Half.values()) {
                worker.run(STAGE, series, unitDir, logDir,
                        List.of("trimvol", "-rx", half.fullReconstruction(series), half.reconstruction(series)));
                Relocations.move(unitDir.resolve(half.reconstruction(series)), halfsets.resolve(half.reconstruction(series)));
            }
            log.info("halfsets.prepared unit={} via={}", series, status);
            return new UnitResult(series, Status.PREPARED, status.name());
        } catch (UnitProcessingException e) {
            log.error("halfsets.failed unit={} reason={}", series, e.getMessage());
            return new UnitResult(series, Status.FAILED, e.getMessage());
        } catch (IOException e) {
            log.error("halfsets.failed unit={} reason={}", series, e.getMessage());
            return new UnitResult(series, Status.FAILED, e.getMessage());
        }
    }

    public static MetadataStatus classify(Path unitDir, String series) {
        boolean xf = Files.isRegularFile(unitDir.resolve(series + ".xf"));
        boolean ali = Files.isRegularFile(unitDir.resolve(series + "_ali.mrc"));
        boolean tlt = Files.isRegularFile(unitDir.resolve(series + ".tlt"));
        boolean xtilt = Files.isRegularFile(unitDir.resolve(series + ".xtilt"));
        if ((!xf && !ali) || !tlt || !xtilt) {
            return MetadataStatus.NONE;
        }
        return ali ? MetadataStatus.TILT_ONLY : MetadataStatus.NEWSTACK_AND_TILT;
    }

    void writeCommandFiles(Path unitDir, String series, MetadataStatus status) throws IOException {
        MrcHeader stack = MrcHeader.read(unitDir.resolve(series + ".mrc"));
        int imageBinned = binning;
        if (status == MetadataStatus.NEWSTACK_AND_TILT) {
            Files.writeString(unitDir.resolve(HalfSetCommandFiles.NEWSTACK_COM), HalfSetCommandFiles.newstack(series, binning),
                    StandardCharsets.UTF_8);
        } else {
            MrcHeader aligned = MrcHeader.read(unitDir.resolve(series + "_ali.mrc"));
            imageBinned = Math.max(1, Math.round((float) stack.nx() / aligned.nx()));
        }

        Path tiltCom = unitDir.resolve("tilt.com");
        List<String> existing = Files.isRegularFile(tiltCom) ? Files.readAllLines(tiltCom, StandardCharsets.UTF_8) : null;
        int thickness = 0;
        if (existing == null) {
            MrcHeader tomogram = MrcHeader.read(unitDir.resolve(ReconstructionBinding.tomogramName(series)));
            int tomogramBin = Math.max(1, stack.nx() / tomogram.nx());
            thickness = tomogramBin * Math.min(tomogram.ny(), tomogram.nz());
        }
        for (HalfSetCommandFiles.Half half : HalfSetCommandFiles.Half.values()) {
            String content = existing != null
                    ? HalfSetCommandFiles.tiltFromExisting(existing, series, half, imageBinned, gpu, stack.nz())
                    : HalfSetCommandFiles.freshTilt(series, half, imageBinned, gpu, stack, thickness);
            Files.writeString(unitDir.resolve(half.commandFile()), content, StandardCharsets.UTF_8);
        }
        log.info("halfsets.coms unit={} status={} fromExisting={} views={}", series, status, existing != null, stack.nz());
    }

    private void submit(Path unitDir, String series, String commandFile) throws UnitProcessingException, InterruptedException {
        CommandResult result = worker.run(STAGE, series, unitDir, logDir, ImodCommands.submit(submitExecutable, commandFile));
        if (!result.stdout().contains(SUCCESS_MARKER)) {
            throw new UnitProcessingException(STAGE, series, commandFile + " did not report '" + SUCCESS_MARKER + "'");
        }
    }

    static boolean halvesExist(Path unitDir, String series) {
        Path halfsets = unitDir.resolve(HALFSETS_DIR);
        for (HalfSetCommandFiles.Half half : HalfSetCommandFiles.Half.values()) {
            if (!Files.isRegularFile(halfsets.resolve(half.reconstruction(series)))) {
                return false;
            }
        }
        return true;
    }
}
