package com.example.timetable.report;

/**
 * Up-front estimate of whether the pools can cover the week the stagger pattern asks for.
 *
 * @param homeroomCapacity    homerooms the eligible teachers may still take, or -1 when at least one has no cap
 * @param peakForeignDemand   most foreign slots running at the same day and period
 * @param peakPoolDemand      most homeroom plus Korean slots running at the same day and period
 * @param poolStaffCount      distinct teachers able to fill homeroom/Korean slots
 */
public record FeasibilityReport(
        int classesNeedingHomeroom,
        int eligibleHomeroomTeachers,
        int homeroomCapacity,
        boolean homeroomOk,
        int foreignPoolSize,
        int peakForeignDemand,
        boolean foreignOk,
        int poolStaffCount,
        int peakKoreanDemand,
        int peakPoolDemand,
        boolean koreanOk) {

    public boolean feasible() {
        return homeroomOk && foreignOk && koreanOk;
    }
}
