package com.example.timetable.schedule;

import com.example.timetable.slot.SlotConfiguration;

import java.util.HashMap;
import java.util.Map;

/**
 * All mutable state of a single generation run. Built fresh for every call and handed explicitly to
 * each component; nothing here outlives the run or is shared between runs.
 */
public class GenerationContext {

    private final SlotConfiguration configuration;
    private final HomeroomAssignment homerooms;
    private final ConflictTracker conflicts;
    private final AvailabilityFilter availability;
    private final MetricsCollector metrics;
    private final Map<String, Integer> loadByTeacher = new HashMap<>();

    public GenerationContext(SlotConfiguration configuration,
                             HomeroomAssignment homerooms,
                             EngineSettings settings,
                             MetricsCollector metrics) {
        this.configuration = configuration;
        this.homerooms = homerooms;
        this.metrics = metrics;
        this.conflicts = new ConflictTracker();
        this.availability = new AvailabilityFilter(configuration, settings.isAvailabilityCache(), metrics);
    }

    public SlotConfiguration configuration() { return configuration; }
    public HomeroomAssignment homerooms() { return homerooms; }
    public ConflictTracker conflicts() { return conflicts; }
    public AvailabilityFilter availability() { return availability; }
    public MetricsCollector metrics() { return metrics; }

    /** Teaching assignments given to the teacher so far in this run, across all roles. */
    public int loadOf(String teacher) {
        return loadByTeacher.getOrDefault(teacher, 0);
    }

    public void recordTeaching(String teacher) {
        loadByTeacher.merge(teacher, 1, Integer::sum);
    }
}
