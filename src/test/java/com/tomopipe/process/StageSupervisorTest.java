package com.tomopipe.process;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StageSupervisorTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldKillOneSessionWithoutTouchingOthers() throws Exception {
        SessionRegistry registry = new SessionRegistry(tempDir);
        try (StageSupervisor supervisor = new StageSupervisor(registry)) {
            CountDownLatch started = new CountDownLatch(2);
            supervisor.launch("mc_pipeline", tempDir, tempDir, "motion correction", blockingTask(started));
            supervisor.launch("brt_pipeline", tempDir, tempDir, "reconstruction", blockingTask(started));
            assertTrue(started.await(5, TimeUnit.SECONDS));

            assertTrue(supervisor.kill("mc_pipeline"));
            awaitStatus(supervisor, "mc_pipeline", SessionStatus.CANCELLED);

            assertEquals(SessionStatus.RUNNING, supervisor.get("brt_pipeline").orElseThrow().status());
            assertFalse(supervisor.kill("mc_pipeline"));
            assertFalse(supervisor.kill("unknown"));
        }
    }

    @Test
    void shouldKillAllSessionsThroughControlFiles() throws Exception {
        SessionRegistry registry = new SessionRegistry(tempDir);
        try (StageSupervisor supervisor = new StageSupervisor(registry)) {
            CountDownLatch started = new CountDownLatch(2);
            supervisor.launch("mc_pipeline", tempDir, tempDir, "motion correction", blockingTask(started));
            supervisor.launch("brt_pipeline", tempDir, tempDir, "reconstruction", blockingTask(started));
            assertTrue(started.await(5, TimeUnit.SECONDS));

            registry.requestStop(SessionRegistry.ALL);
            supervisor.applyControlRequests();

            assertTrue(supervisor.awaitIdle(Duration.ofSeconds(5)));
            assertTrue(supervisor.list().stream().allMatch(session -> session.status() == SessionStatus.CANCELLED));
            assertTrue(registry.drainStopRequests().isEmpty());
        }
    }

    @Test
    void shouldRecordFailureOfTaskAndPublishRegistry() throws Exception {
        SessionRegistry registry = new SessionRegistry(tempDir);
        try (StageSupervisor supervisor = new StageSupervisor(registry)) {
            supervisor.launch("dn_pipeline", tempDir, tempDir, "half sets", session -> {
                throw new IllegalStateException("boom");
            });
            assertTrue(supervisor.awaitIdle(Duration.ofSeconds(5)));

            assertEquals(SessionStatus.FAILED, supervisor.get("dn_pipeline").orElseThrow().status());
        }

        List<SessionInfo> published = registry.load();
        assertEquals(1, published.size());
        assertEquals(SessionStatus.FAILED, published.get(0).status());
        assertEquals("boom", published.get(0).lastError());
    }

    @Test
    void shouldRejectSecondActiveSessionWithSameName() throws Exception {
        try (StageSupervisor supervisor = new StageSupervisor(null)) {
            CountDownLatch started = new CountDownLatch(1);
            supervisor.launch("mc_pipeline", tempDir, tempDir, "motion correction", blockingTask(started));
            assertTrue(started.await(5, TimeUnit.SECONDS));

            assertThrows(StageLaunchException.class,
                    () -> supervisor.launch("mc_pipeline", tempDir, tempDir, "again", session -> {
                    }));
        }
    }

    @Test
    void shouldIgnoreKillRequestLeftBeforeLaunch() throws Exception {
        SessionRegistry registry = new SessionRegistry(tempDir);
        registry.requestStop(SessionRegistry.ALL);
        registry.requestStop("brt_pipeline");
        try (StageSupervisor supervisor = new StageSupervisor(registry)) {
            assertEquals(List.of(SessionRegistry.ALL, "brt_pipeline"), supervisor.discardPendingControlRequests());
            CountDownLatch started = new CountDownLatch(1);
            supervisor.launch("brt_pipeline", tempDir, tempDir, "reconstruction", blockingTask(started));
            assertTrue(started.await(5, TimeUnit.SECONDS));

            supervisor.applyControlRequests();

            assertEquals(SessionStatus.RUNNING, supervisor.get("brt_pipeline").orElseThrow().status());
        }
    }

    private static StageTask blockingTask(CountDownLatch started) {
        return session -> {
            started.countDown();
            while (!session.isCancelRequested()) {
                Thread.sleep(10);
            }
        };
    }

    private static void awaitStatus(StageSupervisor supervisor, String name, SessionStatus expected) throws InterruptedException {
        for (int i = 0; i < 500; i++) {
            if (supervisor.get(name).orElseThrow().status() == expected) {
                return;
            }
            Thread.sleep(10);
        }
        assertEquals(expected, supervisor.get(name).orElseThrow().status());
    }
}
