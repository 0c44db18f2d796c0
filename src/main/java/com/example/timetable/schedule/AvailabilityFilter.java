package com.example.timetable.schedule;

import com.example.timetable.slot.SlotConfiguration;
import com.example.timetable.slot.TeacherConstraints;
import com.example.timetable.slot.UnavailableSlot;

import java.time.DayOfWeek;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Answers whether a teacher declared themselves unavailable at a (day, period).
 * Lookups are memoized for the lifetime of one run when the cache is enabled.
 */
public class AvailabilityFilter {

    private final Map<String, Set<UnavailableSlot>> unavailableByTeacher = new HashMap<>();
    private final Map<LookupKey, Boolean> cache;
    private final MetricsCollector metrics;

    public AvailabilityFilter(SlotConfiguration configuration, boolean cacheEnabled, MetricsCollector metrics) {
        this.metrics = metrics;
        this.cache = cacheEnabled ? new HashMap<>() : null;
        configuration.teacherConstraints().forEach((teacher, constraints) -> {
            if (constraints == null || constraints.unavailable().isEmpty()) {
                return;
            }
            unavailableByTeacher.put(teacher, parse(constraints));
        });
    }

    public boolean isAvailable(String teacher, DayOfWeek day, int period) {
        if (cache == null) {
            return !declaredUnavailable(teacher, day, period);
        }
        LookupKey key = new LookupKey(teacher, day, period);
        Boolean cached = cache.get(key);
        if (cached != null) {
            metrics.cacheHit();
            return cached;
        }
        metrics.cacheMiss();
        boolean available = !declaredUnavailable(teacher, day, period);
        cache.put(key, available);
        return available;
    }

    private boolean declaredUnavailable(String teacher, DayOfWeek day, int period) {
        Set<UnavailableSlot> slots = unavailableByTeacher.get(teacher);
        return slots != null && slots.contains(new UnavailableSlot(day, period));
    }

    private static Set<UnavailableSlot> parse(TeacherConstraints constraints) {
        Set<UnavailableSlot> slots = new HashSet<>();
        for (String key : constraints.unavailable()) {
            slots.add(UnavailableSlot.parse(key));
        }
        return slots;
    }

    private record LookupKey(String teacher, DayOfWeek day, int period) {
    }
}
