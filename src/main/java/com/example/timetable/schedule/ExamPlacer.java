package com.example.timetable.schedule;

import com.example.timetable.slot.GlobalOptions;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Places proctoring rows for every round except the first. The class's homeroom owner always proctors.
 * <p>
 * Proctors are not checked against availability or the conflict tracker, and proctoring does not add
 * to a teacher's load.
 */
public class ExamPlacer {

    public List<Assignment> place(int round, DayOfWeek day, List<String> classIds, GenerationContext context) {
        if (round == 1) {
            return List.of();
        }
        List<Double> markers = markersFor(day, context.configuration().globalOptions());
        int anchor = PeriodTimes.periodsOf(round)[0];
        List<Assignment> exams = new ArrayList<>();
        for (String classId : classIds) {
            TeacherRef proctor = context.homerooms().ownerOf(classId);
            if (markers.isEmpty()) {
                exams.add(new Assignment(day, classId, round, anchor, PeriodTimes.examLabel(round), Role.EXAM, proctor));
            } else {
                for (double marker : markers) {
                    exams.add(new Assignment(day, classId, round, marker,
                            PeriodTimes.betweenPeriodsLabel(marker), Role.EXAM, proctor));
                }
            }
        }
        exams.forEach(exam -> context.metrics().examPlaced());
        return exams;
    }

    private List<Double> markersFor(DayOfWeek day, GlobalOptions options) {
        for (Map.Entry<String, List<Double>> entry : options.examPeriods().entrySet()) {
            if (PeriodTimes.parseDay(entry.getKey()) == day) {
                return entry.getValue();
            }
        }
        return List.of();
    }
}
