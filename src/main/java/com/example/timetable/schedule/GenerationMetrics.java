package com.example.timetable.schedule;

/**
 * Observational figures for one generation run. None of these feed back into assignment decisions.
 *
 * @param attempts      teaching slots the engine tried to fill
 * @param cacheHitRate  availability cache hits as a whole percentage of lookups, 0 when nothing was looked up
 */
public record GenerationMetrics(
        long generationTimeMs,
        int totalAssignments,
        int attempts,
        int assignedCount,
        int unassignedCount,
        int examCount,
        int warningsCount,
        int teachersCount,
        int classesCount,
        int sortOperations,
        int cacheHits,
        int cacheMisses,
        int cacheHitRate) {

    /** Same figures with the wall-clock duration zeroed, for comparing two runs. */
    public GenerationMetrics withoutTiming() {
        return new GenerationMetrics(0L, totalAssignments, attempts, assignedCount, unassignedCount, examCount,
                warningsCount, teachersCount, classesCount, sortOperations, cacheHits, cacheMisses, cacheHitRate);
    }
}
