package com.securezone.capture.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class FramePacerTest {

    @Test
    void firstCallDoesNotWait() throws InterruptedException {
        FramePacer pacer = new FramePacer(10);

        assertEquals(0, pacer.pace());
    }

    @Test
    void consecutiveCallsAreSpacedByTheFrameInterval() throws InterruptedException {
        FramePacer pacer = new FramePacer(20);

        long start = System.nanoTime();
        pacer.pace();
        pacer.pace();
        pacer.pace();
        long elapsedMs = (System.nanoTime() - start) / 1_000_000L;

        assertTrue(elapsedMs >= 90, "elapsed " + elapsedMs + " ms");
    }

    @Test
    void intervalFollowsTargetRate() {
        assertEquals(40_000_000L, new FramePacer(25).frameIntervalNanos());
    }

    @Test
    void nonPositiveRateIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new FramePacer(0));
    }
}
