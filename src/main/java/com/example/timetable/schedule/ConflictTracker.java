package com.example.timetable.schedule;

import java.time.DayOfWeek;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Remembers which teacher already teaches at which (day, period) during one run.
 * Callers check {@link #can} before {@link #occupy}; the tracker itself never rejects.
 */
public class ConflictTracker {

    private final Set<Slot> occupied = new HashSet<>();
    private final Map<DayPeriod, Set<String>> busyByDayPeriod = new HashMap<>();

    public boolean can(DayOfWeek day, int period, String teacher) {
        return !occupied.contains(new Slot(day, period, teacher));
    }

    public void occupy(DayOfWeek day, int period, String teacher) {
        if (occupied.add(new Slot(day, period, teacher))) {
            busyByDayPeriod.computeIfAbsent(new DayPeriod(day, period), k -> new HashSet<>()).add(teacher);
        }
    }

    /** Sorted snapshot of the teachers already busy at the given slot. */
    public Set<String> busyTeachers(DayOfWeek day, int period) {
        Set<String> busy = busyByDayPeriod.get(new DayPeriod(day, period));
        return busy == null ? Collections.emptySet() : Collections.unmodifiableSet(new TreeSet<>(busy));
    }

    public int size() {
        return occupied.size();
    }

    private record Slot(DayOfWeek day, int period, String teacher) {
    }

    private record DayPeriod(DayOfWeek day, int period) {
    }
}
