package com.securezone.detector.service;

import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.atomic.AtomicBoolean;

import lombok.extern.slf4j.Slf4j;

/**
 * Edge-triggered quit and reset commands, written by the console or a shutdown hook and
 * consumed by the pipeline thread between ticks.
 */
@Slf4j
public class RuntimeControls {

    private final AtomicBoolean quit = new AtomicBoolean(false);
    private final AtomicBoolean reset = new AtomicBoolean(false);

    public void requestQuit() {
        if (!quit.getAndSet(true)) {
            log.info("Quit requested");
        }
    }

    public void requestReset() {
        reset.set(true);
    }

    public boolean isQuitRequested() {
        return quit.get();
    }

    public boolean consumeReset() {
        return reset.getAndSet(false);
    }

    public void handleKey(int key) {
        switch (Character.toLowerCase((char) key)) {
            case 'q':
                requestQuit();
                break;
            case 'r':
                requestReset();
                break;
            default:
                break;
        }
    }

    public Thread listen(InputStream input) {
        Thread thread = new Thread(() -> {
            try {
                int key;
                while (!isQuitRequested() && (key = input.read()) != -1) {
                    handleKey(key);
                }
            } catch (IOException e) {
                log.warn("Console control channel closed", e);
            }
        }, "runtime-controls");
        thread.setDaemon(true);
        thread.start();
        return thread;
    }
}
