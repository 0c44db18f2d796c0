package com.example.timetable.schedule;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Folds the run's assignments into the by-class, by-teacher and by-day/period views.
 * Every class and every teacher gets a (possibly empty) list for each scheduled day.
 */
public class ScheduleAggregator {

    private static final Comparator<Assignment> BY_CLASS = Comparator.comparing(Assignment::classId, ClassIds.ORDER);
    private static final Comparator<Assignment> BY_PERIOD = Comparator.comparingDouble(Assignment::period);

    private final Map<DayOfWeek, Map<Double, List<Assignment>>> dayGrid = new LinkedHashMap<>();
    private final Map<String, Map<DayOfWeek, List<Assignment>>> byClass = new LinkedHashMap<>();
    private final Map<String, Map<DayOfWeek, List<Assignment>>> byTeacher = new TreeMap<>();
    private final List<Assignment> assignments = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private final MetricsCollector metrics;

    public ScheduleAggregator(List<String> classIds, MetricsCollector metrics) {
        this.metrics = metrics;
        for (DayOfWeek day : PeriodTimes.DAYS) {
            dayGrid.put(day, new TreeMap<>());
        }
        for (String classId : classIds) {
            byClass.put(classId, emptyWeek());
        }
    }

    public void add(Assignment assignment) {
        assignments.add(assignment);
        dayGrid.get(assignment.day())
                .computeIfAbsent(assignment.period(), p -> new ArrayList<>())
                .add(assignment);
        byClass.computeIfAbsent(assignment.classId(), c -> emptyWeek())
                .get(assignment.day())
                .add(assignment);
        byTeacher.computeIfAbsent(assignment.teacher().name(), t -> emptyWeek())
                .get(assignment.day())
                .add(assignment);
    }

    public void warn(String warning) {
        warnings.add(warning);
    }

    public List<Assignment> assignments() {
        return Collections.unmodifiableList(assignments);
    }

    public List<String> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    /**
     * Sorts every list (day grid by class, class and teacher views by period) and returns read-only views.
     */
    public Views finish() {
        dayGrid.values().forEach(periods -> periods.values().forEach(list -> sort(list, BY_CLASS)));
        byClass.values().forEach(week -> week.values().forEach(list -> sort(list, BY_PERIOD)));
        byTeacher.values().forEach(week -> week.values().forEach(list -> sort(list, BY_PERIOD)));
        return new Views(freeze(byClass), freeze(byTeacher), freezeGrid(dayGrid), List.copyOf(warnings));
    }

    private void sort(List<Assignment> list, Comparator<Assignment> order) {
        list.sort(order);
        metrics.sortPerformed();
    }

    private static Map<DayOfWeek, List<Assignment>> emptyWeek() {
        Map<DayOfWeek, List<Assignment>> week = new LinkedHashMap<>();
        for (DayOfWeek day : PeriodTimes.DAYS) {
            week.put(day, new ArrayList<>());
        }
        return week;
    }

    private static Map<String, Map<DayOfWeek, List<Assignment>>> freeze(Map<String, Map<DayOfWeek, List<Assignment>>> source) {
        Map<String, Map<DayOfWeek, List<Assignment>>> copy = new LinkedHashMap<>();
        source.forEach((key, week) -> {
            Map<DayOfWeek, List<Assignment>> weekCopy = new LinkedHashMap<>();
            week.forEach((day, list) -> weekCopy.put(day, List.copyOf(list)));
            copy.put(key, Collections.unmodifiableMap(weekCopy));
        });
        return Collections.unmodifiableMap(copy);
    }

    private static Map<DayOfWeek, Map<Double, List<Assignment>>> freezeGrid(Map<DayOfWeek, Map<Double, List<Assignment>>> source) {
        Map<DayOfWeek, Map<Double, List<Assignment>>> copy = new LinkedHashMap<>();
        source.forEach((day, periods) -> {
            Map<Double, List<Assignment>> periodCopy = new TreeMap<>();
            periods.forEach((period, list) -> periodCopy.put(period, List.copyOf(list)));
            copy.put(day, Collections.unmodifiableMap(periodCopy));
        });
        return Collections.unmodifiableMap(copy);
    }

    public record Views(
            Map<String, Map<DayOfWeek, List<Assignment>>> classSummary,
            Map<String, Map<DayOfWeek, List<Assignment>>> teacherSummary,
            Map<DayOfWeek, Map<Double, List<Assignment>>> dayGrid,
            List<String> warnings) {
    }
}
