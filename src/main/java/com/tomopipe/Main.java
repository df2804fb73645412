package com.tomopipe;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomopipe.normalize.BatchNormalizationResult;
import com.tomopipe.normalize.MetadataNormalizer;
import com.tomopipe.normalize.NormalizationReport;
import com.tomopipe.pipeline.PipelineCoordinator;
import com.tomopipe.pipeline.PipelineLayout;
import com.tomopipe.process.CommandRunner;
import com.tomopipe.process.SessionInfo;
import com.tomopipe.process.SessionRegistry;
import com.tomopipe.process.Sleeper;
import com.tomopipe.runtime.AcquisitionSoftware;
import com.tomopipe.runtime.ConfigurationException;
import com.tomopipe.runtime.GateStrategy;
import com.tomopipe.runtime.PipelineConfig;
import com.tomopipe.runtime.PipelineConfigLoader;
import com.tomopipe.runtime.PipelineConfigValidator;
import com.tomopipe.runtime.ReconstructionMethod;
import com.tomopipe.runtime.StorageBackend;
import com.tomopipe.runtime.TrackingMethod;
import com.tomopipe.stage.MotionCorrectionBinding;
import com.tomopipe.stage.ReconstructionBinding;
import com.tomopipe.stage.StageWatcher;
import com.tomopipe.stage.UnitStateStore;
import com.tomopipe.transfer.ArchiveFetcher;
import com.tomopipe.transfer.TransferAgent;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "tomopipe",
        mixinStandardHelpOptions = true,
        version = "tomopipe 0.1.0",
        description = "Runs and supervises the cryo-ET motion correction, reconstruction, half-set and archive stages.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);
    static final int FATAL_EXIT_CODE = 2;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "application.yml")
    Path configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "run")
    Mode mode;

    @Option(names = "--project-dir", description = "Directory holding Aligned/, Reconstructed/, coms/ and the state directory")
    String projectDir;

    @Option(names = "--dataset-dir", description = "Acquisition session directory, relative to the project directory")
    String datasetDir;

    @Option(names = "--software", description = "Acquisition software: ${COMPLETION-CANDIDATES}")
    AcquisitionSoftware software;

    @Option(names = "--tilt-axis", description = "Tilt axis as reported by the acquisition software")
    Double tiltAxis;

    @Option(names = "--pixel-size", description = "Pixel size in Angstrom")
    Double pixelSize;

    @Option(names = "--exposure", description = "Exposure per tilt (e/A^2)")
    Double exposure;

    @Option(names = "--gain", description = "Gain reference file")
    String gainPath;

    @Option(names = "--import-from", description = "Import raw data from this directory before normalizing")
    String importFrom;

    @Option(names = "--skip-motion-correction", description = "Start from already aligned stacks")
    boolean skipMotionCorrection;

    @Option(names = "--dose-weighting", description = "Dose-weight frames during motion correction")
    Boolean doseWeighting;

    @Option(names = "--tracking", description = "Tracking method: ${COMPLETION-CANDIDATES}")
    TrackingMethod tracking;

    @Option(names = "--method", description = "Reconstruction method: ${COMPLETION-CANDIDATES}")
    ReconstructionMethod method;

    @Option(names = "--thickness", description = "Unbinned tomogram thickness in pixels")
    Integer thickness;

    @Option(names = "--denoise", description = "Prepare half sets once reconstruction has drained")
    Boolean denoise;

    @Option(names = "--gate", description = "Denoising gate: ${COMPLETION-CANDIDATES}")
    GateStrategy gate;

    @Option(names = "--skip-transfer", description = "Do not archive reconstructed units")
    boolean skipTransfer;

    @Option(names = "--operator", description = "Operator name; its initials prefix archive identifiers")
    String operator;

    @Option(names = "--archive-root", description = "Archive root directory (mounted for pipe storage)")
    String archiveRoot;

    @Option(names = "--backend", description = "Archive backend: ${COMPLETION-CANDIDATES}")
    StorageBackend backend;

    @Option(names = "--session", description = "Session name for kill mode; omit to kill every session")
    String session;

    @Option(names = "--stage", description = "Stage of the unit to retry: motion-correction, reconstruction or transfer")
    String stage;

    @Option(names = "--unit", description = "Unit (tilt series) to retry")
    String unit;

    @Option(names = "--date", split = ",", description = "Processing dates (yyyy-MM-dd) to fetch")
    List<LocalDate> dates;

    @Option(names = "--with-metadata", description = "Fetch alignment metadata as well as tomograms")
    boolean withMetadata;

    @Option(names = "--workspace", description = "Directory archived units are fetched into", defaultValue = "fetched")
    Path workspace;

    enum Mode {
        run,
        normalize,
        sessions,
        kill,
        retry,
        transfer,
        fetch
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        try {
            PipelineConfig config = loadConfig();
            log.info("Starting tomopipe in {} mode", mode);
            log.info("Using config file: {}", configPath);
            return switch (mode) {
                case run -> run(config);
                case normalize -> normalize(config);
                case sessions -> sessions(config);
                case kill -> kill(config);
                case retry -> retry(config);
                case transfer -> transfer(config);
                case fetch -> fetch(config);
            };
        } catch (PipelineException e) {
            log.error("tomopipe.fatal mode={} reason={}", mode, e.getMessage());
            return FATAL_EXIT_CODE;
        }
    }

    PipelineConfig loadConfig() throws ConfigurationException {
        PipelineConfig config = new PipelineConfigLoader().load(configPath);
        applyOverrides(config);
        return config;
    }

    void applyOverrides(PipelineConfig config) {
        PipelineConfig.AcquisitionConfig acquisition = config.getAcquisition();
        if (projectDir != null) {
            config.getLayout().setProjectDir(projectDir);
        }
        if (datasetDir != null) {
            acquisition.setDatasetDir(datasetDir);
        }
        if (software != null) {
            acquisition.setSoftware(software);
        }
        if (tiltAxis != null) {
            acquisition.setTiltAxis(tiltAxis);
        }
        if (pixelSize != null) {
            acquisition.setPixelSize(pixelSize);
        }
        if (exposure != null) {
            acquisition.setExposure(exposure);
        }
        if (gainPath != null) {
            acquisition.setGainPath(gainPath);
        }
        if (importFrom != null) {
            acquisition.setImportRawData(true);
            acquisition.setRawDataSource(importFrom);
        }
        if (skipMotionCorrection) {
            config.getMotionCorrection().setEnabled(false);
        }
        if (doseWeighting != null) {
            config.getMotionCorrection().setDoseWeighting(doseWeighting);
        }
        if (tracking != null) {
            config.getReconstruction().setTrackingMethod(tracking);
        }
        if (method != null) {
            config.getReconstruction().setMethod(method);
        }
        if (thickness != null) {
            config.getReconstruction().setThicknessUnbinned(thickness);
            config.getReconstruction().setThicknessBinned(null);
        }
        if (denoise != null) {
            config.getDenoising().setEnabled(denoise);
        }
        if (gate != null) {
            config.getDenoising().setGate(gate);
        }
        if (skipTransfer) {
            config.getTransfer().setEnabled(false);
        }
        if (operator != null) {
            config.getTransfer().setOperator(operator);
        }
        if (archiveRoot != null) {
            config.getTransfer().setArchiveRoot(archiveRoot);
        }
        if (backend != null) {
            config.getTransfer().setBackend(backend);
        }
    }

    private int run(PipelineConfig config) throws PipelineException, IOException, InterruptedException {
        Duration poll = Duration.ofMillis(config.getSupervision().getPollIntervalMs());
        try (PipelineCoordinator coordinator = new PipelineCoordinator(config, PipelineCoordinator.Collaborators.system(config))) {
            Thread shutdownHook = new Thread(coordinator::stop, "tomopipe-shutdown");
            Runtime.getRuntime().addShutdownHook(shutdownHook);
            coordinator.run();
            while (coordinator.isRunning()) {
                coordinator.tick();
                Sleeper.SYSTEM.sleep(poll);
            }
            coordinator.supervisor().list().forEach(stageSession -> log.info("Session name={} status={} lastError={}",
                    stageSession.name(), stageSession.status(), stageSession.info().lastError()));
        }
        return 0;
    }

    private int normalize(PipelineConfig config) throws ConfigurationException {
        if (config.getAcquisition().getDatasetDir() == null) {
            throw new ConfigurationException("acquisition.datasetDir is required in normalize mode");
        }
        PipelineLayout layout = PipelineLayout.from(config);
        PipelineConfig.AcquisitionConfig acquisition = config.getAcquisition();
        MetadataNormalizer normalizer = new MetadataNormalizer(acquisition.getSoftware(), acquisition.getTiltAxis(),
                acquisition.getFramesName(), acquisition.getDuplicateMarker());
        BatchNormalizationResult result = normalizer.normalizeAll(List.of(layout.datasetDir()));
        for (NormalizationReport report : result.reports()) {
            log.info("Normalized dataset={} sidecars={} removed={} renamed={} rewritten={} frames={} consistent={}",
                    report.dataset().getFileName(),
                    report.sidecars().size(),
                    report.removed().size(),
                    report.renamed().size(),
                    report.rewritten().size(),
                    report.relocatedFrames().size(),
                    report.consistent());
        }
        result.failures().forEach((dataset, reason) -> log.error("Normalization failed dataset={} reason={}", dataset, reason));
        return result.allSucceeded() ? 0 : FATAL_EXIT_CODE;
    }

    private int sessions(PipelineConfig config) throws IOException {
        List<SessionInfo> sessions = new SessionRegistry(PipelineLayout.from(config).stateDir()).load();
        if (sessions.isEmpty()) {
            log.info("No sessions recorded");
        }
        for (SessionInfo info : sessions) {
            log.info("Session name={} status={} watchDir={} outputDir={} startedAt={} endedAt={} lastError={} description={}",
                    info.name(),
                    info.status(),
                    info.watchDir(),
                    info.outputDir(),
                    info.startedAt(),
                    info.endedAt(),
                    info.lastError() == null ? "none" : info.lastError(),
                    info.description());
        }
        return 0;
    }

    private int kill(PipelineConfig config) throws IOException {
        SessionRegistry registry = new SessionRegistry(PipelineLayout.from(config).stateDir());
        String target = session == null || session.isBlank() ? SessionRegistry.ALL : session;
        registry.requestStop(target);
        log.info("Kill requested session={}", target);
        return 0;
    }

    private int retry(PipelineConfig config) throws IOException {
        if (stage == null || unit == null) {
            log.error("--stage and --unit are required in retry mode");
            return FATAL_EXIT_CODE;
        }
        if (!List.of(MotionCorrectionBinding.STAGE, ReconstructionBinding.STAGE, TransferAgent.STAGE).contains(stage)) {
            log.error("Unknown stage {}", stage);
            return FATAL_EXIT_CODE;
        }
        UnitStateStore store = UnitStateStore.forStage(PipelineLayout.from(config).stateDir(), stage);
        if (!store.resetFailed(unit)) {
            log.warn("Unit {} of stage {} is not failed; nothing to retry", unit, stage);
            return 1;
        }
        log.info("Unit {} of stage {} reset; the running watcher picks it up on its next scan", unit, stage);
        return 0;
    }

    private int transfer(PipelineConfig config) throws PipelineException, IOException, InterruptedException {
        if (config.getAcquisition().getDatasetDir() == null) {
            throw new ConfigurationException("acquisition.datasetDir is required in transfer mode");
        }
        config.getTransfer().setEnabled(true);
        new PipelineConfigValidator().validate(config);
        PipelineCoordinator.Collaborators collaborators = PipelineCoordinator.Collaborators.system(config);
        try (PipelineCoordinator coordinator = new PipelineCoordinator(config, collaborators)) {
            TransferAgent agent = coordinator.transferAgent(PipelineCoordinator.archiveStore(config.getTransfer(),
                    collaborators.transferRunner()));
            StageWatcher watcher = new StageWatcher(agent, coordinator.layout().transfer(),
                    UnitStateStore.forStage(coordinator.layout().stateDir(), TransferAgent.STAGE),
                    Duration.ofMillis(config.getSupervision().getPollIntervalMs()), collaborators.sleeper());
            int processed = watcher.runOnce();
            agent.writeSummary();
            log.info("Transfer pass finished processed={} snapshot={}", processed, watcher.snapshot());
            return watcher.snapshot().failed() > 0 ? 1 : 0;
        }
    }

    private int fetch(PipelineConfig config) throws PipelineException, IOException {
        String fetchOperator = config.getTransfer().getOperator();
        if (fetchOperator == null || dates == null || dates.isEmpty() || config.getTransfer().getArchiveRoot() == null) {
            log.error("--operator, --date and --archive-root are required in fetch mode");
            return FATAL_EXIT_CODE;
        }
        ArchiveFetcher fetcher = new ArchiveFetcher(PipelineCoordinator.archiveStore(config.getTransfer(),
                new CommandRunner(Duration.ZERO)));
        ArchiveFetcher.FetchReport report = fetcher.fetch(fetchOperator, dates, withMetadata, workspace);
        log.info("Fetched archives={} copied={} skipped={} bytes={} into {}",
                report.archiveIds(),
                report.copy().copied(),
                report.copy().skipped(),
                report.copy().bytesCopied(),
                workspace.toAbsolutePath().normalize());
        return 0;
    }
}
