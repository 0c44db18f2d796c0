package com.example.timetable.schedule;

import java.time.DayOfWeek;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Fixed shape of the Mon/Wed/Fri week: which days run, which periods belong to which round,
 * and the wall-clock labels shown next to each period.
 */
public final class PeriodTimes {

    public static final List<DayOfWeek> DAYS = List.of(DayOfWeek.MONDAY, DayOfWeek.WEDNESDAY, DayOfWeek.FRIDAY);
    public static final List<Integer> ROUNDS = List.of(1, 2, 3, 4);
    public static final int FIRST_PERIOD = 1;
    public static final int LAST_PERIOD = 8;

    private static final Map<Double, String> LABELS;
    private static final Map<Integer, String> EXAM_LABELS = Map.of(
            2, "16:00–16:15",
            3, "17:50–18:05",
            4, "20:00–20:15");

    static {
        Map<Double, String> labels = new LinkedHashMap<>();
        labels.put(1.0, "14:20–15:05");
        labels.put(1.5, "15:05–15:10");
        labels.put(2.0, "15:10–15:55");
        labels.put(2.5, "15:55–16:15");
        labels.put(3.0, "16:15–17:00");
        labels.put(3.5, "17:00–17:05");
        labels.put(4.0, "17:05–17:50");
        labels.put(4.5, "17:50–18:05");
        labels.put(5.0, "18:05–18:55");
        labels.put(5.5, "18:55–19:00");
        labels.put(6.0, "19:00–19:50");
        labels.put(6.5, "19:50–20:15");
        labels.put(7.0, "20:15–21:05");
        labels.put(7.5, "21:05–21:10");
        labels.put(8.0, "21:10–22:00");
        LABELS = Collections.unmodifiableMap(labels);
    }

    private PeriodTimes() {
    }

    /** The two periods a round occupies: R1=(1,2), R2=(3,4), R3=(5,6), R4=(7,8). */
    public static int[] periodsOf(int round) {
        if (!ROUNDS.contains(round)) {
            throw new IllegalArgumentException("Unknown round: " + round);
        }
        return new int[] { round * 2 - 1, round * 2 };
    }

    public static String label(double period) {
        return LABELS.getOrDefault(period, "");
    }

    public static String examLabel(int round) {
        return EXAM_LABELS.getOrDefault(round, "");
    }

    public static String betweenPeriodsLabel(double marker) {
        int before = (int) Math.floor(marker);
        int after = (int) Math.ceil(marker);
        String time = label(marker);
        String base = "Exam between period " + before + " and " + after;
        return time.isEmpty() ? base : base + " (" + time + ")";
    }

    public static boolean isTeachingPeriod(int period) {
        return period >= FIRST_PERIOD && period <= LAST_PERIOD;
    }

    /**
     * Parses a day written as its full name or three-letter abbreviation, case-insensitive.
     *
     * @throws IllegalArgumentException if the text is not a day of the week
     */
    public static DayOfWeek parseDay(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("day is blank");
        }
        String normalized = text.trim().toUpperCase(Locale.ROOT);
        for (DayOfWeek day : DayOfWeek.values()) {
            if (day.name().equals(normalized) || day.name().substring(0, 3).equals(normalized)) {
                return day;
            }
        }
        throw new IllegalArgumentException("unknown day '" + text + "'");
    }

    public static String dayKey(DayOfWeek day) {
        return day.name().substring(0, 3);
    }
}
