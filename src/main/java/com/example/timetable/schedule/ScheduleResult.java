package com.example.timetable.schedule;

import com.example.timetable.report.FeasibilityReport;
import com.example.timetable.report.TeacherWorkload;

import java.time.DayOfWeek;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one generation run. Owned by the caller; the engine keeps no reference to it.
 *
 * @param classSummary   class id to day to that class's assignments, sorted by period
 * @param teacherSummary teacher name to day to that teacher's assignments, sorted by period; unfilled
 *                       slots are listed under {@link TeacherRef#UNASSIGNED_LABEL}
 * @param dayGrid        day to period to the assignments running then, sorted by class
 * @param homerooms      class id to homeroom owner
 */
public record ScheduleResult(
        Map<String, Map<DayOfWeek, List<Assignment>>> classSummary,
        Map<String, Map<DayOfWeek, List<Assignment>>> teacherSummary,
        Map<DayOfWeek, Map<Double, List<Assignment>>> dayGrid,
        List<String> warnings,
        GenerationMetrics metrics,
        Map<String, TeacherRef> homerooms,
        FeasibilityReport feasibility,
        Map<String, TeacherWorkload> workloads) {

    /** Every assignment of the week, day by day in period order. */
    public List<Assignment> allAssignments() {
        return dayGrid.values().stream()
                .flatMap(periods -> periods.values().stream())
                .flatMap(List::stream)
                .toList();
    }
}
