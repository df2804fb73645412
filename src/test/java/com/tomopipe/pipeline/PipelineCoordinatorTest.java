package com.tomopipe.pipeline;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.tomopipe.imod.ImagingParameters;
import com.tomopipe.imod.MasterFiles;
import com.tomopipe.monitor.CompletionGate;
import com.tomopipe.monitor.CompletionTimeoutException;
import com.tomopipe.monitor.MonitorState;
import com.tomopipe.monitor.ProcessCompletionMonitor;
import com.tomopipe.normalize.NormalizationReport;
import com.tomopipe.process.CommandRunner;
import com.tomopipe.process.ExecutableProbe;
import com.tomopipe.process.ProcessTable;
import com.tomopipe.process.SessionRegistry;
import com.tomopipe.runtime.AcquisitionSoftware;
import com.tomopipe.runtime.ConfigurationException;
import com.tomopipe.runtime.GateStrategy;
import com.tomopipe.runtime.PipelineConfig;
import com.tomopipe.runtime.StorageBackend;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PipelineCoordinatorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-07-25T08:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private final FakeProcessTable processTable = new FakeProcessTable();
    private final List<PipelineCoordinator> coordinators = new ArrayList<>();

    @AfterEach
    void closeCoordinators() {
        coordinators.forEach(PipelineCoordinator::close);
    }

    @Test
    void shouldReadImagingValuesFromFirstCanonicalSidecar() throws Exception {
        PipelineCoordinator coordinator = coordinator(config());
        writeSidecar("TS_01.mrc.mdoc");
        coordinator.datasets().loadOrCreate("session", coordinator.layout().datasetDir());

        ImagingParameters imaging = coordinator.resolveImaging();

        assertEquals(2.68, imaging.pixelSizeAngstrom());
        assertEquals(3.1, imaging.exposurePerTilt());
        assertNull(imaging.tiltAxis());
        assertEquals(2.68, coordinator.datasets().find("session").orElseThrow().pixelSizeAngstrom);
    }

    @Test
    void shouldPreferConfiguredValuesAndCanonicalizeTiltAxis() throws Exception {
        PipelineConfig config = config();
        config.getAcquisition().setPixelSize(1.5);
        config.getAcquisition().setTiltAxis(-87.0);
        config.getAcquisition().setSoftware(AcquisitionSoftware.TOMOGRAPHY5);
        PipelineCoordinator coordinator = coordinator(config);
        writeSidecar("TS_01.mrc.mdoc");
        coordinator.datasets().loadOrCreate("session", coordinator.layout().datasetDir());

        ImagingParameters imaging = coordinator.resolveImaging();

        assertEquals(1.5, imaging.pixelSizeAngstrom());
        assertEquals(3.1, imaging.exposurePerTilt());
        assertEquals(-3.0, imaging.tiltAxis());
    }

    @Test
    void shouldFailWithoutAnyPixelSize() throws Exception {
        PipelineConfig config = config();
        config.getAcquisition().setReadMdoc(false);
        PipelineCoordinator coordinator = coordinator(config);
        writeSidecar("TS_01.mrc.mdoc");
        coordinator.datasets().loadOrCreate("session", coordinator.layout().datasetDir());

        ConfigurationException error = assertThrows(ConfigurationException.class, coordinator::resolveImaging);

        assertTrue(error.getMessage().contains("acquisition.pixelSize"));
    }

    @Test
    void shouldNormalizeOnceAndSkipWhenSidecarsAreConsumed() throws Exception {
        PipelineCoordinator coordinator = coordinator(config());
        Path sidecar = writeSidecar("TS_01.mrc.mdoc");
        coordinator.datasets().loadOrCreate("session", coordinator.layout().datasetDir());

        Optional<NormalizationReport> first = coordinator.normalize();
        Files.move(sidecar, Files.createDirectories(coordinator.layout().processedDir()).resolve(sidecar.getFileName()));
        Optional<NormalizationReport> second = coordinator.normalize();

        assertTrue(first.isPresent());
        assertTrue(second.isEmpty());
        assertEquals(DatasetLifecycle.NORMALIZED, coordinator.datasets().find("session").orElseThrow().lifecycle);
    }

    @Test
    void shouldKillStaleProcessesForEveryPattern() {
        processTable.pids = List.of(41L);
        PipelineCoordinator coordinator = coordinator(config());

        List<Long> killed = coordinator.killStaleProcesses();

        assertEquals(List.of("alignframes", "batchruntomo", "framewatcher", "serieswatcher"), processTable.killed);
        assertEquals(List.of(41L, 41L, 41L, 41L), killed);
    }

    @Test
    void shouldRequireExecutablesOfEnabledStagesOnly() {
        PipelineConfig config = config();
        config.getDenoising().setEnabled(true);
        config.getTransfer().setEnabled(true);
        config.getTransfer().setBackend(StorageBackend.PIPE_STORAGE);

        List<String> required = new ArrayList<>(coordinator(config).requiredExecutables());

        assertEquals(List.of("alignframes", "mrc2tif", "batchruntomo", "subm", "trimvol", "pipe"), required);

        config.getMotionCorrection().setEnabled(false);
        config.getDenoising().setEnabled(false);
        config.getTransfer().setEnabled(false);
        assertEquals(List.of("batchruntomo"), new ArrayList<>(coordinator(config).requiredExecutables()));
    }

    @Test
    void shouldSampleProcessesWhenDenoisingAsksForIt() {
        PipelineConfig config = config();
        config.getDenoising().setEnabled(true);
        config.getDenoising().setGate(GateStrategy.PROCESS_SAMPLING);

        CompletionGate gate = coordinator(config).createGate();

        assertTrue(gate instanceof ProcessCompletionMonitor);
    }

    @Test
    void shouldRecordReconstructedWhenGateDrainsWithoutDenoising() throws Exception {
        PipelineCoordinator coordinator = coordinator(config());
        coordinator.datasets().loadOrCreate("session", coordinator.layout().datasetDir());

        coordinator.awaitGate(new StubGate(MonitorState.DRAINED, false));

        assertEquals(DatasetLifecycle.RECONSTRUCTED, coordinator.datasets().find("session").orElseThrow().lifecycle);
        assertTrue(coordinator.supervisor().get(PipelineCoordinator.DENOISING_SESSION).isEmpty());
    }

    @Test
    void shouldLaunchHalfSetPreparationOnlyAfterDrain() throws Exception {
        PipelineConfig config = config();
        config.getDenoising().setEnabled(true);
        PipelineCoordinator coordinator = coordinator(config);
        coordinator.datasets().loadOrCreate("session", coordinator.layout().datasetDir());

        coordinator.awaitGate(new StubGate(MonitorState.DRAINED, false));

        assertTrue(coordinator.supervisor().get(PipelineCoordinator.DENOISING_SESSION).isPresent());
        assertEquals(DatasetLifecycle.DENOISING_PREP, coordinator.datasets().find("session").orElseThrow().lifecycle);
        assertTrue(coordinator.supervisor().awaitIdle(Duration.ofSeconds(5)));
    }

    @Test
    void shouldHandPreparedHalfSetsToDeepDeWedgeAndStopWhenFittingLeavesNoModel() throws Exception {
        PipelineConfig config = config();
        config.getDenoising().setEnabled(true);
        config.getDenoising().getDeepDeWedge().setEnabled(true);
        PipelineCoordinator coordinator = coordinator(config);
        coordinator.datasets().loadOrCreate("session", coordinator.layout().datasetDir());
        Path unit = Files.createDirectories(coordinator.layout().reconstructedDir().resolve("TS_01"));
        Files.writeString(unit.resolve("TS_01_rec.mrc"), "tomogram");
        Files.createDirectories(unit.resolve("halfsets"));
        Files.writeString(unit.resolve("halfsets").resolve("TS_01_rec_evens.mrc"), "evens");
        Files.writeString(unit.resolve("halfsets").resolve("TS_01_rec_odds.mrc"), "odds");

        coordinator.awaitGate(new StubGate(MonitorState.DRAINED, false));

        assertTrue(coordinator.supervisor().awaitIdle(Duration.ofSeconds(5)));
        Path deepDeWedgeDir = coordinator.layout().deepDeWedgeDir();
        assertTrue(Files.readString(deepDeWedgeDir.resolve("fit_config.yaml")).contains("TS_01_rec_evens.mrc"));
        assertFalse(Files.exists(deepDeWedgeDir.resolve("refine_config.yaml")));
    }

    @Test
    void shouldNotLaunchHalfSetPreparationWhenGateIsCancelled() throws Exception {
        PipelineConfig config = config();
        config.getDenoising().setEnabled(true);
        PipelineCoordinator coordinator = coordinator(config);
        coordinator.datasets().loadOrCreate("session", coordinator.layout().datasetDir());

        coordinator.awaitGate(new StubGate(MonitorState.CANCELLED, false));

        assertTrue(coordinator.supervisor().get(PipelineCoordinator.DENOISING_SESSION).isEmpty());
        assertEquals(DatasetLifecycle.RAW, coordinator.datasets().find("session").orElseThrow().lifecycle);
    }

    @Test
    void shouldNotLaunchHalfSetPreparationWhenGateTimesOut() throws Exception {
        PipelineConfig config = config();
        config.getDenoising().setEnabled(true);
        PipelineCoordinator coordinator = coordinator(config);
        coordinator.datasets().loadOrCreate("session", coordinator.layout().datasetDir());

        coordinator.awaitGate(new StubGate(MonitorState.TIMED_OUT, true));

        assertTrue(coordinator.supervisor().get(PipelineCoordinator.DENOISING_SESSION).isEmpty());
        assertEquals(DatasetLifecycle.RAW, coordinator.datasets().find("session").orElseThrow().lifecycle);
    }

    @Test
    void shouldContainUnexpectedGateFailure() throws Exception {
        PipelineConfig config = config();
        config.getDenoising().setEnabled(true);
        PipelineCoordinator coordinator = coordinator(config);
        coordinator.datasets().loadOrCreate("session", coordinator.layout().datasetDir());
        CompletionGate broken = new StubGate(MonitorState.DRAINED, false) {
            @Override
            public MonitorState await() {
                throw new IllegalStateException("process table unreadable");
            }
        };

        assertDoesNotThrow(() -> coordinator.awaitGate(broken));

        assertTrue(coordinator.supervisor().get(PipelineCoordinator.DENOISING_SESSION).isEmpty());
        assertEquals(DatasetLifecycle.RAW, coordinator.datasets().find("session").orElseThrow().lifecycle);
    }

    @Test
    void shouldFinishDatasetOnTickWhenNothingIsLeftDownstream() throws Exception {
        PipelineCoordinator coordinator = coordinator(config());
        coordinator.datasets().loadOrCreate("session", coordinator.layout().datasetDir());
        coordinator.tick();
        assertEquals(DatasetLifecycle.RAW, coordinator.datasets().find("session").orElseThrow().lifecycle);

        coordinator.datasets().advance("session", DatasetLifecycle.RECONSTRUCTED);
        coordinator.tick();

        assertEquals(DatasetLifecycle.DONE, coordinator.datasets().find("session").orElseThrow().lifecycle);
    }

    @Test
    void shouldPrepareDatasetAndLaunchReconstructionSession() throws Exception {
        PipelineConfig config = config();
        config.getMotionCorrection().setEnabled(false);
        PipelineCoordinator coordinator = coordinator(config);
        writeSidecar("TS_01.mrc.mdoc");

        coordinator.run();

        assertTrue(coordinator.isRunning());
        assertTrue(coordinator.supervisor().get(PipelineCoordinator.RECONSTRUCTION_SESSION).isPresent());
        assertTrue(coordinator.supervisor().get(PipelineCoordinator.MOTION_CORRECTION_SESSION).isEmpty());
        assertTrue(Files.exists(coordinator.layout().comsDir().resolve(MasterFiles.RECONSTRUCTION_DIRECTIVES)));
        assertEquals(DatasetLifecycle.MOTION_CORRECTED, coordinator.datasets().find("session").orElseThrow().lifecycle);
        assertEquals(4, processTable.killed.size());

        coordinator.stop();
        assertTrue(coordinator.supervisor().awaitIdle(Duration.ofSeconds(5)));
        assertFalse(coordinator.isRunning());
    }

    @Test
    void shouldNotLetKillRequestFromEarlierRunCancelNewStages() throws Exception {
        PipelineConfig config = config();
        config.getMotionCorrection().setEnabled(false);
        PipelineCoordinator coordinator = coordinator(config);
        writeSidecar("TS_01.mrc.mdoc");
        new SessionRegistry(coordinator.layout().stateDir()).requestStop(SessionRegistry.ALL);

        coordinator.run();
        coordinator.tick();

        assertTrue(coordinator.supervisor().get(PipelineCoordinator.RECONSTRUCTION_SESSION).orElseThrow().status().isActive());
        assertTrue(coordinator.isRunning());
    }

    @Test
    void shouldRefuseToRunWithoutDatasetDirectory() {
        PipelineCoordinator coordinator = coordinator(config());

        ConfigurationException error = assertThrows(ConfigurationException.class, coordinator::run);

        assertTrue(error.getMessage().contains("Dataset directory does not exist"));
    }

    private PipelineConfig config() {
        PipelineConfig config = new PipelineConfig();
        config.getLayout().setProjectDir(tempDir.toString());
        config.getAcquisition().setDatasetDir("session");
        config.getTransfer().setEnabled(false);
        config.getSupervision().setCheckExecutables(false);
        return config;
    }

    private PipelineCoordinator coordinator(PipelineConfig config) {
        CommandRunner runner = new CommandRunner(Duration.ofSeconds(5),
                (workingDirectory, command) -> new RawDataImporterTest.ExitedProcess(0));
        PipelineCoordinator coordinator = new PipelineCoordinator(config, new PipelineCoordinator.Collaborators(
                processTable, new ExecutableProbe(), runner, runner, duration -> Thread.sleep(5), CLOCK));
        coordinators.add(coordinator);
        return coordinator;
    }

    private Path writeSidecar(String name) throws Exception {
        Path dataset = Files.createDirectories(tempDir.resolve("session"));
        Path sidecar = dataset.resolve(name);
        Files.writeString(sidecar, "PixelSpacing = 2.68\n"
                + "ExposureDose = 3.1\n"
                + "TiltAxisAngle = 85.3\n"
                + "\n"
                + "[ZValue = 0]\n"
                + "TiltAngle = 0.0\n"
                + "SubFramePath = TS_01_001.tif\n", StandardCharsets.ISO_8859_1);
        return sidecar;
    }

    private static final class FakeProcessTable implements ProcessTable {
        private final List<String> killed = new ArrayList<>();
        private List<Long> pids = List.of();

        @Override
        public int count(String pattern) {
            return 0;
        }

        @Override
        public List<Long> killMatching(String pattern) {
            killed.add(pattern);
            return pids;
        }
    }

    private static class StubGate implements CompletionGate {
        private final MonitorState result;
        private final boolean timeout;
        private final CompletableFuture<MonitorState> completion = new CompletableFuture<>();

        StubGate(MonitorState result, boolean timeout) {
            this.result = result;
            this.timeout = timeout;
        }

        @Override
        public MonitorState await() throws CompletionTimeoutException {
            completion.complete(result);
            if (timeout) {
                throw new CompletionTimeoutException(describe(), MonitorState.ACTIVE, Duration.ofMinutes(5));
            }
            return result;
        }

        @Override
        public CompletableFuture<MonitorState> completion() {
            return completion;
        }

        @Override
        public MonitorState state() {
            return completion.getNow(MonitorState.NOT_STARTED);
        }

        @Override
        public void cancel() {
            completion.complete(MonitorState.CANCELLED);
        }

        @Override
        public String describe() {
            return "stub";
        }
    }
}
