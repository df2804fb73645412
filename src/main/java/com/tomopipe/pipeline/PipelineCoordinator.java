package com.tomopipe.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomopipe.PipelineException;
import com.tomopipe.denoise.DeepDeWedgeRunner;
import com.tomopipe.denoise.HalfSetPreparer;
import com.tomopipe.denoise.HalfSetSync;
import com.tomopipe.imod.ImagingParameters;
import com.tomopipe.imod.MasterFiles;
import com.tomopipe.monitor.CompletionGate;
import com.tomopipe.monitor.CompletionTimeoutException;
import com.tomopipe.monitor.MonitorState;
import com.tomopipe.monitor.ProcessCompletionMonitor;
import com.tomopipe.monitor.ProcessCountSource;
import com.tomopipe.monitor.WatcherDrainGate;
import com.tomopipe.normalize.MdocDocument;
import com.tomopipe.normalize.MdocSummary;
import com.tomopipe.normalize.MetadataNormalizer;
import com.tomopipe.normalize.MetadataParseException;
import com.tomopipe.normalize.NormalizationReport;
import com.tomopipe.normalize.TiltAxisConvention;
import com.tomopipe.process.CommandRunner;
import com.tomopipe.process.ExecutableProbe;
import com.tomopipe.process.ProcessTable;
import com.tomopipe.process.SessionRegistry;
import com.tomopipe.process.Sleeper;
import com.tomopipe.process.StageLaunchException;
import com.tomopipe.process.StageSession;
import com.tomopipe.process.StageSupervisor;
import com.tomopipe.process.SystemProcessTable;
import com.tomopipe.runtime.ConfigurationException;
import com.tomopipe.runtime.GateStrategy;
import com.tomopipe.runtime.PipelineConfig;
import com.tomopipe.runtime.PipelineConfig.AcquisitionConfig;
import com.tomopipe.runtime.PipelineConfig.DeepDeWedgeConfig;
import com.tomopipe.runtime.PipelineConfig.DenoisingConfig;
import com.tomopipe.runtime.PipelineConfig.TransferConfig;
import com.tomopipe.runtime.PipelineConfigValidator;
import com.tomopipe.runtime.StorageBackend;
import com.tomopipe.stage.MotionCorrectionBinding;
import com.tomopipe.stage.ReconstructionBinding;
import com.tomopipe.stage.StageBinding;
import com.tomopipe.stage.StageLayout;
import com.tomopipe.stage.StageWatcher;
import com.tomopipe.stage.UnitProcessingException;
import com.tomopipe.stage.UnitState;
import com.tomopipe.stage.UnitStateStore;
import com.tomopipe.stage.WatcherSnapshot;
import com.tomopipe.stage.WorkerProcess;
import com.tomopipe.transfer.ArchiveStore;
import com.tomopipe.transfer.LocalArchiveStore;
import com.tomopipe.transfer.PipeStorageArchiveStore;
import com.tomopipe.transfer.TransferAgent;
import com.tomopipe.transfer.TransferLedger;
import com.tomopipe.transfer.TransferLog;

/**
 * Owns the stage graph of one dataset: prepares it, launches the watch-stages as supervised
 * sessions, gates half-set preparation on the reconstruction stage draining and records the
 * dataset lifecycle as stages are observed to progress.
 */
public class PipelineCoordinator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PipelineCoordinator.class);

    public static final String MOTION_CORRECTION_SESSION = "mc_pipeline";
    public static final String RECONSTRUCTION_SESSION = "brt_pipeline";
    public static final String TRANSFER_SESSION = "db_pipeline";
    public static final String DENOISING_SESSION = "dn_pipeline";

    static final String LEDGER_FILE = "transfer-ledger.json";
    static final String TRANSFER_LOG_FILE = "transfer-log.jsonl";

    private final PipelineConfig config;
    private final PipelineLayout layout;
    private final Collaborators collaborators;
    private final StageSupervisor supervisor;
    private final DatasetStateStore datasets;
    private final WorkerProcess worker;
    private final TransferLedger ledger;
    private final ExecutorService gateExecutor;

    private volatile StageWatcher motionCorrection;
    private volatile StageWatcher reconstruction;
    private volatile StageWatcher transfer;
    private volatile ArchiveStore archive;
    private volatile CompletionGate gate;
    private volatile boolean stopping;

    /**
     * Host-facing dependencies, replaceable in tests.
     */
    public record Collaborators(
            ProcessTable processTable,
            ExecutableProbe probe,
            CommandRunner workerRunner,
            CommandRunner transferRunner,
            Sleeper sleeper,
            Clock clock) {

        public static Collaborators system(PipelineConfig config) {
            return new Collaborators(
                    new SystemProcessTable(),
                    new ExecutableProbe(),
                    new CommandRunner(Duration.ofMillis(config.getSupervision().getWorkerTimeoutMs())),
                    new CommandRunner(Duration.ZERO),
                    Sleeper.SYSTEM,
                    Clock.systemDefaultZone());
        }
    }

    public PipelineCoordinator(PipelineConfig config, Collaborators collaborators) {
        this.config = config;
        this.layout = PipelineLayout.from(config);
        this.collaborators = collaborators;
        this.supervisor = new StageSupervisor(new SessionRegistry(layout.stateDir()));
        this.datasets = new DatasetStateStore(layout.stateDir(), collaborators.clock());
        this.worker = new WorkerProcess(collaborators.workerRunner());
        this.ledger = new TransferLedger(layout.stateDir().resolve(LEDGER_FILE));
        this.gateExecutor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "completion-gate");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Validates, prepares and launches. Returns once the sessions are running; they keep running
     * until {@link #stop()} or a kill request.
     */
    public void run() throws PipelineException, IOException, InterruptedException {
        new PipelineConfigValidator().validate(config);
        layout.validate();
        if (config.getSupervision().isCheckExecutables()) {
            collaborators.probe().require("pipeline", requiredExecutables());
        }

        AcquisitionConfig acquisition = config.getAcquisition();
        if (acquisition.isImportRawData()) {
            new RawDataImporter(collaborators.transferRunner()).importInto(acquisition, layout.datasetDir());
        }
        if (!Files.isDirectory(layout.datasetDir())) {
            throw new ConfigurationException("Dataset directory does not exist: " + layout.datasetDir());
        }

        DatasetRecord record = datasets.loadOrCreate(layout.datasetName(), layout.datasetDir());
        record.software = acquisition.getSoftware();
        record.rawTiltAxis = acquisition.getTiltAxis();
        datasets.save(record);
        log.info("pipeline.start dataset={} lifecycle={} software={}", record.name, record.lifecycle, record.software);

        normalize();
        ImagingParameters imaging = resolveImaging();
        MasterFiles.Written coms = MasterFiles.write(layout.comsDir(), layout.framesDir(), layout.reconstructedDir(),
                config.getReconstruction(), imaging);
        killStaleProcesses();
        supervisor.discardPendingControlRequests();
        launchStages(coms);
    }

    public Set<String> requiredExecutables() {
        Set<String> executables = new LinkedHashSet<>();
        if (config.getMotionCorrection().isEnabled()) {
            executables.add(config.getMotionCorrection().getExecutable());
            if (config.getMotionCorrection().isThumbnails()) {
                executables.add("mrc2tif");
            }
        }
        executables.add(config.getReconstruction().getExecutable());
        if (config.getDenoising().isEnabled()) {
            executables.add(config.getDenoising().getSubmitExecutable());
            executables.add("trimvol");
            if (config.getDenoising().getDeepDeWedge().isEnabled()) {
                executables.add(config.getDenoising().getDeepDeWedge().getExecutable());
            }
        }
        AcquisitionConfig acquisition = config.getAcquisition();
        if (acquisition.isImportRawData()) {
            executables.add(acquisition.getImportBackend() == StorageBackend.PIPE_STORAGE ? "pipe" : "rsync");
        }
        if (config.getTransfer().isEnabled() && config.getTransfer().getBackend() == StorageBackend.PIPE_STORAGE) {
            executables.add("pipe");
        }
        return executables;
    }

    /**
     * Normalizes the dataset unless an earlier run already did and every sidecar has since been
     * consumed by motion correction.
     */
    Optional<NormalizationReport> normalize() throws PipelineException, IOException {
        String name = layout.datasetName();
        DatasetRecord record = datasets.find(name).orElseThrow();
        if (record.lifecycle.isAtLeast(DatasetLifecycle.NORMALIZED) && !hasSidecars(layout.datasetDir())) {
            log.info("normalize.skip dataset={} lifecycle={} reason=no-sidecars-left", name, record.lifecycle);
            return Optional.empty();
        }
        AcquisitionConfig acquisition = config.getAcquisition();
        MetadataNormalizer normalizer = new MetadataNormalizer(acquisition.getSoftware(), acquisition.getTiltAxis(),
                acquisition.getFramesName(), acquisition.getDuplicateMarker());
        NormalizationReport report = normalizer.normalize(layout.datasetDir());
        datasets.advanceIfBehind(name, DatasetLifecycle.NORMALIZED);
        return Optional.of(report);
    }

    /**
     * Configured values win; missing ones come from the first canonical sidecar, then from what an
     * earlier run recorded.
     */
    ImagingParameters resolveImaging() throws ConfigurationException, IOException {
        AcquisitionConfig acquisition = config.getAcquisition();
        DatasetRecord record = datasets.find(layout.datasetName()).orElseThrow();
        Double pixelSize = acquisition.getPixelSize();
        Double exposure = acquisition.getExposure();
        if ((pixelSize == null || exposure == null) && acquisition.isReadMdoc()) {
            Optional<MdocSummary> summary = readSummary();
            if (summary.isPresent()) {
                pixelSize = pixelSize != null ? pixelSize : summary.get().pixelSpacingAngstrom().orElse(null);
                exposure = exposure != null ? exposure : summary.get().exposureDose().orElse(null);
            }
        }
        pixelSize = pixelSize != null ? pixelSize : record.pixelSizeAngstrom;
        exposure = exposure != null ? exposure : record.exposurePerTilt;
        if (pixelSize == null) {
            throw new ConfigurationException("Pixel size of dataset " + record.name
                    + " is neither configured (acquisition.pixelSize) nor found in its sidecars");
        }
        Double tiltAxis = acquisition.getTiltAxis() == null
                ? null
                : TiltAxisConvention.toCanonical(acquisition.getSoftware(), acquisition.getTiltAxis());
        record.pixelSizeAngstrom = pixelSize;
        record.exposurePerTilt = exposure;
        datasets.save(record);
        log.info("pipeline.imaging dataset={} pixelSizeA={} exposure={} tiltAxis={}", record.name, pixelSize, exposure,
                tiltAxis == null ? "from-sidecar" : TiltAxisConvention.format(tiltAxis));
        return new ImagingParameters(pixelSize, tiltAxis, exposure);
    }

    private Optional<MdocSummary> readSummary() throws IOException {
        for (Path dir : List.of(layout.datasetDir(), layout.processedDir(), layout.alignedDir())) {
            if (!Files.isDirectory(dir)) {
                continue;
            }
            Optional<Path> sidecar;
            try (Stream<Path> stream = Files.list(dir)) {
                sidecar = stream.filter(Files::isRegularFile).filter(MetadataNormalizer::isCanonical).sorted().findFirst();
            }
            if (sidecar.isPresent()) {
                try {
                    return Optional.of(MdocSummary.of(MdocDocument.read(sidecar.get())));
                } catch (MetadataParseException e) {
                    log.warn("pipeline.imaging-unreadable sidecar={} reason={}", sidecar.get(), e.getMessage());
                }
            }
        }
        return Optional.empty();
    }

    List<Long> killStaleProcesses() {
        List<Long> killed = new ArrayList<>();
        for (String pattern : config.getSupervision().getStalePatterns()) {
            List<Long> pids = collaborators.processTable().killMatching(pattern);
            if (!pids.isEmpty()) {
                log.warn("pipeline.stale-processes pattern={} killed={}", pattern, pids);
            }
            killed.addAll(pids);
        }
        return killed;
    }

    private void launchStages(MasterFiles.Written coms) throws PipelineException, IOException {
        String name = layout.datasetName();
        if (config.getMotionCorrection().isEnabled()) {
            AcquisitionConfig acquisition = config.getAcquisition();
            MotionCorrectionBinding binding = new MotionCorrectionBinding(config.getMotionCorrection(), layout.framesDir(),
                    acquisition.getGainPath(), Duration.ofMillis(config.getMotionCorrection().getSettleMs()), worker);
            motionCorrection = watcher(binding, layout.motionCorrection());
            StageWatcher watcher = motionCorrection;
            supervisor.launch(MOTION_CORRECTION_SESSION, layout.datasetDir(), layout.alignedDir(),
                    "alignframes for " + name, watcher::run);
            datasets.advanceIfBehind(name, DatasetLifecycle.MOTION_CORRECTING);
        } else {
            log.info("pipeline.skip stage={} reason=disabled", MotionCorrectionBinding.STAGE);
            datasets.advanceIfBehind(name, DatasetLifecycle.MOTION_CORRECTED);
        }

        reconstruction = watcher(new ReconstructionBinding(config.getReconstruction(), coms.directives(), layout.doneDir(), worker),
                layout.reconstruction());
        reconstruction.addListener(outcome -> {
            if (outcome.state() == UnitState.COMPLETED) {
                observe(DatasetLifecycle.RECONSTRUCTING);
            }
        });
        StageWatcher reconstructionWatcher = reconstruction;
        supervisor.launch(RECONSTRUCTION_SESSION, layout.alignedDir(), layout.reconstructedDir(),
                config.getReconstruction().getExecutable() + " for " + name, reconstructionWatcher::run);

        if (config.getTransfer().isEnabled()) {
            archive = archiveStore(config.getTransfer(), collaborators.transferRunner());
            TransferAgent agent = transferAgent(archive);
            transfer = watcher(agent, layout.transfer());
            StageWatcher transferWatcher = transfer;
            supervisor.launch(TRANSFER_SESSION, layout.reconstructedDir(), layout.doneDir(), "archive transfer for " + name,
                    session -> {
                        try {
                            transferWatcher.run(session);
                        } finally {
                            agent.writeSummary();
                        }
                    });
        } else {
            log.info("pipeline.skip stage={} reason=disabled", TransferAgent.STAGE);
        }

        startGate(createGate());
    }

    StageWatcher watcher(StageBinding binding, StageLayout stageLayout) {
        return new StageWatcher(binding, stageLayout, UnitStateStore.forStage(layout.stateDir(), stageLayout.stage()),
                Duration.ofMillis(config.getSupervision().getPollIntervalMs()), collaborators.sleeper());
    }

    public TransferAgent transferAgent(ArchiveStore store) {
        TransferConfig transferConfig = config.getTransfer();
        return new TransferAgent(layout.datasetName(), transferConfig.getOperator(), layout.framesDir(), store,
                ledger,
                new TransferLog(layout.stateDir().resolve(TRANSFER_LOG_FILE)),
                transferConfig.getMaxRetries(), Duration.ofMillis(transferConfig.getRetryBackoffMs()),
                collaborators.sleeper(), collaborators.clock());
    }

    public static ArchiveStore archiveStore(TransferConfig transferConfig, CommandRunner runner) {
        Path root = Path.of(transferConfig.getArchiveRoot());
        if (transferConfig.getBackend() == StorageBackend.PIPE_STORAGE) {
            return new PipeStorageArchiveStore(root, transferConfig.getStorageUri(), runner);
        }
        return new LocalArchiveStore(root);
    }

    /**
     * Process sampling when denoising asks for it; otherwise the reconstruction watcher's own drain
     * signal, which also serves to record the dataset as reconstructed.
     */
    CompletionGate createGate() {
        DenoisingConfig denoising = config.getDenoising();
        Duration poll = Duration.ofMillis(denoising.getPollIntervalMs());
        if (denoising.isEnabled() && denoising.getGate() == GateStrategy.PROCESS_SAMPLING) {
            return new ProcessCompletionMonitor(denoising.getProcessPattern(),
                    ProcessCountSource.matching(collaborators.processTable(), denoising.getProcessPattern()),
                    denoising.getWarmupThreshold(), denoising.getDrainedThreshold(), denoising.getDrainConfirmations(), poll,
                    Duration.ofMillis(denoising.getWarmupTimeoutMs()), Duration.ofMillis(denoising.getDrainTimeoutMs()),
                    collaborators.sleeper());
        }
        StageWatcher upstream = reconstruction;
        return new WatcherDrainGate(upstream::snapshot, Duration.ofMillis(denoising.getQuietPeriodMs()), poll,
                Duration.ofMillis(denoising.getDrainTimeoutMs()), collaborators.sleeper());
    }

    void startGate(CompletionGate completionGate) {
        gate = completionGate;
        log.info("gate.start gate={} denoising={}", completionGate.describe(), config.getDenoising().isEnabled());
        gateExecutor.submit(() -> awaitGate(completionGate));
    }

    /**
     * Waits for the gate and launches half-set preparation only on {@link MonitorState#DRAINED}. A
     * timeout or cancellation leaves it unlaunched. Runs on the gate thread, so nothing may escape
     * unlogged.
     */
    void awaitGate(CompletionGate completionGate) {
        try {
            openGate(completionGate);
        } catch (RuntimeException e) {
            log.error("gate.failed gate={} reason={} denoising=not-launched", completionGate.describe(), e.getMessage(), e);
        }
    }

    private void openGate(CompletionGate completionGate) {
        MonitorState state;
        try {
            state = completionGate.await();
        } catch (CompletionTimeoutException e) {
            log.error("gate.timeout gate={} reason={}", completionGate.describe(), e.getMessage());
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            completionGate.cancel();
            log.info("gate.interrupted gate={}", completionGate.describe());
            return;
        }
        if (state != MonitorState.DRAINED || stopping) {
            log.info("gate.closed gate={} state={} denoising=not-launched", completionGate.describe(), state);
            return;
        }
        observe(DatasetLifecycle.RECONSTRUCTED);
        if (config.getDenoising().isEnabled()) {
            launchDenoising();
        }
    }

    private void launchDenoising() {
        DenoisingConfig denoising = config.getDenoising();
        HalfSetPreparer preparer = new HalfSetPreparer(denoising.getBinning(), denoising.getGpu(), denoising.getSubmitExecutable(),
                worker, layout.logDir(HalfSetPreparer.STAGE));
        try {
            supervisor.launch(DENOISING_SESSION, layout.reconstructedDir(), layout.reconstructedDir(),
                    "half-set preparation for " + layout.datasetName(), session -> prepareHalfSets(preparer, session));
            observe(DatasetLifecycle.DENOISING_PREP);
        } catch (StageLaunchException e) {
            log.error("pipeline.launch-failed session={} reason={}", DENOISING_SESSION, e.getMessage());
        }
    }

    /**
     * Prepares half sets until no unit is held by another consumer, copying each pass's results into
     * units already archived, then hands them to DeepDeWedge when that is enabled.
     */
    private void prepareHalfSets(HalfSetPreparer preparer, StageSession session) throws IOException, InterruptedException {
        List<Path> roots = List.of(layout.reconstructedDir(), layout.doneDir());
        Duration poll = Duration.ofMillis(config.getSupervision().getPollIntervalMs());
        ArchiveStore store = archive;
        HalfSetSync sync = store == null ? null : new HalfSetSync(layout.datasetName(), ledger, store);
        while (!session.isCancelRequested()) {
            HalfSetPreparer.Report report = preparer.prepareAll(roots);
            session.record("prepared=" + report.count(HalfSetPreparer.Status.PREPARED)
                    + " failed=" + report.count(HalfSetPreparer.Status.FAILED)
                    + " leased=" + report.count(HalfSetPreparer.Status.LEASED));
            if (sync != null) {
                long synced = sync.syncAll(roots).stream().filter(result -> result.status() == HalfSetSync.Status.SYNCED).count();
                session.record("halfsets synced to archive=" + synced);
            }
            if (report.count(HalfSetPreparer.Status.LEASED) == 0) {
                denoise(session, roots);
                return;
            }
            collaborators.sleeper().sleep(poll);
        }
    }

    private void denoise(StageSession session, List<Path> roots) throws IOException, InterruptedException {
        DeepDeWedgeConfig deepDeWedge = config.getDenoising().getDeepDeWedge();
        if (!deepDeWedge.isEnabled()) {
            return;
        }
        DeepDeWedgeRunner runner = new DeepDeWedgeRunner(deepDeWedge, layout.deepDeWedgeDir(), worker,
                layout.logDir(DeepDeWedgeRunner.STAGE));
        try {
            Path checkpoint = runner.run(layout.datasetName(), roots);
            session.record("refined with " + checkpoint.getFileName());
        } catch (UnitProcessingException e) {
            log.error("ddw.failed dataset={} reason={}", layout.datasetName(), e.getMessage());
            session.record("DeepDeWedge failed: " + e.getMessage());
        }
    }

    /**
     * Applies pending kill requests and records lifecycle stages that can only be inferred by
     * looking at the sessions. Called from the foreground loop.
     */
    public void tick() {
        supervisor.applyControlRequests();
        Optional<DatasetRecord> record;
        try {
            record = datasets.find(layout.datasetName());
        } catch (IOException e) {
            log.warn("dataset.state-unreadable dataset={} reason={}", layout.datasetName(), e.getMessage());
            return;
        }
        if (record.isEmpty() || !record.get().lifecycle.isAtLeast(DatasetLifecycle.RECONSTRUCTED)) {
            return;
        }
        boolean denoisingDone = !config.getDenoising().isEnabled()
                || supervisor.get(DENOISING_SESSION).map(session -> !session.status().isActive()).orElse(false);
        if (!denoisingDone) {
            return;
        }
        StageWatcher transferWatcher = transfer;
        if (transferWatcher == null) {
            observe(DatasetLifecycle.DONE);
            return;
        }
        observe(DatasetLifecycle.ARCHIVE_TRANSFERRING);
        WatcherSnapshot snapshot = transferWatcher.snapshot();
        if (snapshot.lastScanAt() != null && snapshot.idle() && snapshot.detected() == 0) {
            observe(DatasetLifecycle.DONE);
        }
    }

    private void observe(DatasetLifecycle next) {
        try {
            datasets.advanceIfBehind(layout.datasetName(), next);
        } catch (IOException | LifecycleTransitionException e) {
            log.warn("dataset.lifecycle-failed dataset={} target={} reason={}", layout.datasetName(), next, e.getMessage());
        }
    }

    public boolean stopStage(String name) {
        if (DENOISING_SESSION.equals(name) && gate != null) {
            gate.cancel();
        }
        return supervisor.kill(name);
    }

    public int stop() {
        stopping = true;
        CompletionGate current = gate;
        if (current != null) {
            current.cancel();
        }
        int killed = supervisor.killAll();
        log.info("pipeline.stop dataset={} sessionsKilled={}", layout.datasetName(), killed);
        return killed;
    }

    public boolean isRunning() {
        return supervisor.hasActiveSessions();
    }

    public StageSupervisor supervisor() {
        return supervisor;
    }

    public PipelineLayout layout() {
        return layout;
    }

    public DatasetStateStore datasets() {
        return datasets;
    }

    CompletionGate gate() {
        return gate;
    }

    private static boolean hasSidecars(Path datasetDir) throws IOException {
        try (Stream<Path> stream = Files.list(datasetDir)) {
            return stream.anyMatch(path -> Files.isRegularFile(path) && MetadataNormalizer.isSidecar(path));
        }
    }

    @Override
    public void close() {
        stop();
        supervisor.close();
        gateExecutor.shutdownNow();
    }
}
