package com.tomopipe.stage;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UnitLeaseTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldGrantLeaseToOneHolderAtATime() throws Exception {
        Optional<UnitLease> first = UnitLease.tryAcquire(tempDir, "TS_01", "reconstruction");
        assertTrue(first.isPresent());
        assertTrue(UnitLease.isHeld(tempDir, "TS_01"));

        assertTrue(UnitLease.tryAcquire(tempDir, "TS_01", "denoising-prep").isEmpty());
        assertTrue(UnitLease.tryAcquire(tempDir, "TS_02", "denoising-prep").isPresent());

        first.get().close();
        assertFalse(UnitLease.isHeld(tempDir, "TS_01"));
        assertTrue(UnitLease.tryAcquire(tempDir, "TS_01", "denoising-prep").isPresent());
    }

    @Test
    void shouldBreakLeaseOfProcessThatNoLongerExists() throws Exception {
        Path file = UnitLease.pathFor(tempDir, "TS_01");
        Files.createDirectories(file.getParent());
        Files.writeString(file, "reconstruction " + deadPid() + " 2024-07-25T10:00:00Z\n", StandardCharsets.UTF_8);

        Optional<UnitLease> lease = UnitLease.tryAcquire(tempDir, "TS_01", "denoising-prep");

        assertTrue(lease.isPresent());
        assertEquals("denoising-prep", lease.get().holder());
        assertTrue(Files.readString(file).startsWith("denoising-prep " + ProcessHandle.current().pid()));
    }

    @Test
    void shouldKeepLeaseWithUnreadableHolder() throws Exception {
        Path file = UnitLease.pathFor(tempDir, "TS_01");
        Files.createDirectories(file.getParent());
        Files.writeString(file, "garbage", StandardCharsets.UTF_8);

        assertTrue(UnitLease.tryAcquire(tempDir, "TS_01", "denoising-prep").isEmpty());
    }

    private static long deadPid() {
        long pid = Integer.MAX_VALUE - 7L;
        while (ProcessHandle.of(pid).isPresent()) {
            pid--;
        }
        return pid;
    }
}
