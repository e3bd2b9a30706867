package com.securezone.detector.service;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Sliding vote over the last {@code window} raw motion flags; motion is confirmed once at
 * least {@code required} of them are set. A 1/1 debouncer passes flags through unchanged.
 */
public class MotionDebouncer {

    private final int window;
    private final int required;
    private final Deque<Boolean> history = new ArrayDeque<>();
    private int hits = 0;

    public MotionDebouncer(int window, int required) {
        if (window < 1 || required < 1 || required > window) {
            throw new IllegalArgumentException("invalid debounce " + required + "/" + window);
        }
        this.window = window;
        this.required = required;
    }

    public boolean offer(boolean motion) {
        history.addLast(motion);
        if (motion) {
            hits++;
        }
        if (history.size() > window && history.removeFirst()) {
            hits--;
        }
        return motion && hits >= required;
    }

    public void clear() {
        history.clear();
        hits = 0;
    }
}
