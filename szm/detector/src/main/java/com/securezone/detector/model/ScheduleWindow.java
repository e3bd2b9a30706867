package com.securezone.detector.model;

import lombok.Value;

/**
 * Hours of the day during which motion raises events. {@code start > end} wraps past
 * midnight; {@code start == end} covers the whole day.
 */
@Value
public class ScheduleWindow {

    int startHour;
    int endHour;

    public static ScheduleWindow of(int[] hours) {
        if (hours == null || hours.length != 2) {
            throw new IllegalArgumentException("alert_after_hours must be [start_hour, end_hour]");
        }
        return new ScheduleWindow(hours[0], hours[1]);
    }

    public boolean wrapsMidnight() {
        return startHour > endHour;
    }

    public boolean isDegenerate() {
        return startHour == endHour;
    }
}
