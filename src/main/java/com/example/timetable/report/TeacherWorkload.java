package com.example.timetable.report;

import java.util.List;

public record TeacherWorkload(
        String teacher,
        List<String> homeroomClasses,
        int homeroomSessions,
        int koreanSessions,
        int foreignSessions,
        int examsProctored,
        int totalSessions) {
}
