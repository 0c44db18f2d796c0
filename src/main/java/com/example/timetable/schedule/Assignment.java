package com.example.timetable.schedule;

import java.time.DayOfWeek;

/**
 * One filled (or explicitly unfilled) cell of the weekly timetable.
 * Exam rows may carry a fractional period such as 2.5, meaning "between period 2 and 3".
 */
public record Assignment(
        DayOfWeek day,
        String classId,
        int round,
        double period,
        String time,
        Role role,
        TeacherRef teacher) {

    public boolean isExam() {
        return !role.isTeaching();
    }

    public boolean isUnassigned() {
        return teacher.isUnassigned();
    }
}
