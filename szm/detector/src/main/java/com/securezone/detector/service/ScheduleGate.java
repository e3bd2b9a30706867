package com.securezone.detector.service;

import java.time.ZonedDateTime;

import com.securezone.detector.model.ScheduleWindow;

public class ScheduleGate {

    private final ScheduleWindow window;

    public ScheduleGate(ScheduleWindow window) {
        this.window = window;
    }

    public boolean isActive(ZonedDateTime now) {
        return isActiveAtHour(now.getHour());
    }

    public boolean isActiveAtHour(int hour) {
        int start = window.getStartHour();
        int end = window.getEndHour();
        if (window.isDegenerate()) {
            return true;
        }
        if (window.wrapsMidnight()) {
            return hour >= start || hour < end;
        }
        return hour >= start && hour < end;
    }
}
