package com.example.timetable.schedule;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class EngineSettings {
    private final boolean availabilityCache;
    private final boolean traceStagger;

    public EngineSettings(
            @Value("${timetable.engine.availability-cache:true}") boolean availabilityCache,
            @Value("${timetable.engine.trace-stagger:false}") boolean traceStagger) {
        this.availabilityCache = availabilityCache;
        this.traceStagger = traceStagger;
    }

    public static EngineSettings defaults() {
        return new EngineSettings(true, false);
    }

    public boolean isAvailabilityCache() { return availabilityCache; }
    public boolean isTraceStagger() { return traceStagger; }
}
