package com.securezone.detector.service;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import com.securezone.detector.model.ScheduleWindow;

class ScheduleGateTest {

    private final ScheduleGate overnight = new ScheduleGate(new ScheduleWindow(22, 6));

    @ParameterizedTest
    @ValueSource(ints = {22, 23, 0, 5})
    void overnightWindowIsActiveLateAndEarly(int hour) {
        assertTrue(overnight.isActiveAtHour(hour));
    }

    @ParameterizedTest
    @ValueSource(ints = {6, 12, 21})
    void overnightWindowIsInactiveDuringTheDay(int hour) {
        assertFalse(overnight.isActiveAtHour(hour));
    }

    @Test
    void sameDayWindowIncludesStartExcludesEnd() {
        ScheduleGate officeHours = new ScheduleGate(new ScheduleWindow(9, 17));

        assertFalse(officeHours.isActiveAtHour(8));
        assertTrue(officeHours.isActiveAtHour(9));
        assertTrue(officeHours.isActiveAtHour(16));
        assertFalse(officeHours.isActiveAtHour(17));
    }

    @Test
    void equalBoundsAreAlwaysActive() {
        ScheduleGate degenerate = new ScheduleGate(new ScheduleWindow(8, 8));

        for (int hour = 0; hour < 24; hour++) {
            assertTrue(degenerate.isActiveAtHour(hour), "hour " + hour);
        }
    }

    @Test
    void fullDayWindowIsAlwaysActive() {
        ScheduleGate allDay = new ScheduleGate(new ScheduleWindow(0, 24));

        for (int hour = 0; hour < 24; hour++) {
            assertTrue(allDay.isActiveAtHour(hour), "hour " + hour);
        }
    }

    @Test
    void usesTheHourOfTheGivenTime() {
        ZonedDateTime lateNight = ZonedDateTime.of(2024, 3, 1, 23, 59, 59, 0, ZoneOffset.UTC);
        ZonedDateTime morning = ZonedDateTime.of(2024, 3, 2, 6, 0, 0, 0, ZoneOffset.UTC);

        assertTrue(overnight.isActive(lateNight));
        assertFalse(overnight.isActive(morning));
    }
}
