package com.securezone.capture.service;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class FramePacer {

    private final long frameIntervalNanos;
    private long lastTickNanos = -1;

    public FramePacer(double targetFps) {
        if (targetFps <= 0) {
            throw new IllegalArgumentException("targetFps must be positive: " + targetFps);
        }
        this.frameIntervalNanos = (long) (1_000_000_000L / targetFps);
    }

    public long frameIntervalNanos() {
        return frameIntervalNanos;
    }

    public long pace() throws InterruptedException {
        long now = System.nanoTime();
        if (lastTickNanos < 0) {
            lastTickNanos = now;
            return 0;
        }
        long remaining = frameIntervalNanos - (now - lastTickNanos);
        long sleptMs = 0;
        if (remaining > 0) {
            sleptMs = remaining / 1_000_000L;
            Thread.sleep(sleptMs, (int) (remaining % 1_000_000L));
        } else if (-remaining > frameIntervalNanos) {
            log.trace("Processing is {} ms behind the target frame rate", -remaining / 1_000_000L);
        }
        lastTickNanos = System.nanoTime();
        return sleptMs;
    }

    public void reset() {
        lastTickNanos = -1;
    }
}
