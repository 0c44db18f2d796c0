package com.example.timetable.slot;

import com.example.timetable.schedule.PeriodTimes;

import java.time.DayOfWeek;

/**
 * Parsed form of a {@code "DAY|period"} unavailability key.
 */
public record UnavailableSlot(DayOfWeek day, int period) {

    /**
     * @throws IllegalArgumentException when the key is not {@code DAY|period} with a scheduled day and period 1..8
     */
    public static UnavailableSlot parse(String key) {
        if (key == null) {
            throw new IllegalArgumentException("unavailable key is null");
        }
        String[] parts = key.split("\\|", -1);
        if (parts.length != 2) {
            throw new IllegalArgumentException("unavailable key '" + key + "' must look like DAY|period");
        }
        DayOfWeek day;
        try {
            day = PeriodTimes.parseDay(parts[0]);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unavailable key '" + key + "': " + e.getMessage(), e);
        }
        if (!PeriodTimes.DAYS.contains(day)) {
            throw new IllegalArgumentException("unavailable key '" + key + "': " + day + " is not a scheduled day");
        }
        int period;
        try {
            period = Integer.parseInt(parts[1].trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("unavailable key '" + key + "': period must be a whole number", e);
        }
        if (!PeriodTimes.isTeachingPeriod(period)) {
            throw new IllegalArgumentException("unavailable key '" + key + "': period must be between "
                    + PeriodTimes.FIRST_PERIOD + " and " + PeriodTimes.LAST_PERIOD);
        }
        return new UnavailableSlot(day, period);
    }
}
