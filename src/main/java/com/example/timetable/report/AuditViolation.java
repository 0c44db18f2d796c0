package com.example.timetable.report;

import java.time.DayOfWeek;

/**
 * One broken rule found in a generated schedule. Day, period, class and teacher are null when the
 * rule is not tied to a single cell.
 */
public record AuditViolation(Type type, DayOfWeek day, Double period, String classId, String teacher, String message) {

    public enum Type {
        DOUBLE_BOOKING,
        OWN_HOMEROOM_AS_KOREAN,
        FOREIGN_IN_ROUND_4,
        EXAM_IN_ROUND_1,
        EXAM_PROCTOR_MISMATCH,
        UNAVAILABLE,
        HOMEROOM_DISABLED,
        MAX_HOMEROOMS_EXCEEDED,
        COVERAGE
    }
}
