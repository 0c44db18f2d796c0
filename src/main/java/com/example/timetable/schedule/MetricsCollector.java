package com.example.timetable.schedule;

/**
 * Counts what happens during one run. A new collector is created for every call to the engine.
 */
public class MetricsCollector {

    private final long startedAtNanos;
    private int attempts;
    private int assigned;
    private int unassigned;
    private int exams;
    private int sortOperations;
    private int cacheHits;
    private int cacheMisses;

    public MetricsCollector() {
        this.startedAtNanos = System.nanoTime();
    }

    public void assignmentAttempted(boolean filled) {
        attempts++;
        if (filled) {
            assigned++;
        } else {
            unassigned++;
        }
    }

    public void examPlaced() {
        exams++;
    }

    public void sortPerformed() {
        sortOperations++;
    }

    public void cacheHit() {
        cacheHits++;
    }

    public void cacheMiss() {
        cacheMisses++;
    }

    public GenerationMetrics finish(int warningsCount, int teachersCount, int classesCount) {
        long elapsedMs = Math.round((System.nanoTime() - startedAtNanos) / 1_000_000.0);
        int lookups = cacheHits + cacheMisses;
        int hitRate = lookups == 0 ? 0 : (int) Math.round(cacheHits * 100.0 / lookups);
        return new GenerationMetrics(
                elapsedMs,
                attempts + exams,
                attempts,
                assigned,
                unassigned,
                exams,
                warningsCount,
                teachersCount,
                classesCount,
                sortOperations,
                cacheHits,
                cacheMisses,
                hitRate);
    }
}
