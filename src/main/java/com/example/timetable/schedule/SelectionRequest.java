package com.example.timetable.schedule;

import java.time.DayOfWeek;

/**
 * The slot a candidate is wanted for, together with the class's own homeroom owner.
 */
public record SelectionRequest(DayOfWeek day, int period, int round, String classId, TeacherRef homeroomOwner) {
}
