package com.securezone.detector.sink;

import com.securezone.detector.model.MotionEvent;

public interface EventLogger {

    void log(MotionEvent event);
}
