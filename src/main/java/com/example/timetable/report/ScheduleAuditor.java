package com.example.timetable.report;

import com.example.timetable.report.AuditViolation.Type;
import com.example.timetable.schedule.Assignment;
import com.example.timetable.schedule.ClassIds;
import com.example.timetable.schedule.PeriodTimes;
import com.example.timetable.schedule.Role;
import com.example.timetable.schedule.ScheduleResult;
import com.example.timetable.schedule.TeacherRef;
import com.example.timetable.slot.SlotConfiguration;
import com.example.timetable.slot.TeacherConstraints;
import com.example.timetable.slot.UnavailableSlot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Re-checks a generated schedule against its configuration. Meant for callers that want proof rather
 * than trust, and for schedules that were edited after generation.
 */
@Component
public class ScheduleAuditor {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleAuditor.class);

    public AuditReport audit(SlotConfiguration configuration, ScheduleResult result) {
        List<AuditViolation> violations = new ArrayList<>();
        List<Assignment> assignments = result.allAssignments();
        Map<String, TeacherRef> homerooms = result.homerooms();

        Set<String> seen = new HashSet<>();
        for (Assignment a : assignments) {
            TeacherRef owner = homerooms.get(a.classId());
            if (a.isExam()) {
                checkExam(a, owner, violations);
                continue;
            }
            if (!a.teacher().isAssigned()) {
                continue;
            }
            String teacher = a.teacher().name();
            if (!seen.add(a.day() + "|" + a.period() + "|" + teacher)) {
                violations.add(violation(Type.DOUBLE_BOOKING, a,
                        teacher + " teaches twice on " + a.day() + " period " + (int) a.period()));
            }
            if (a.role() == Role.KOREAN && owner != null && owner.is(teacher)) {
                violations.add(violation(Type.OWN_HOMEROOM_AS_KOREAN, a,
                        teacher + " teaches Korean to own homeroom class " + a.classId()));
            }
            if (a.role() == Role.FOREIGN && a.round() == 4) {
                violations.add(violation(Type.FOREIGN_IN_ROUND_4, a,
                        a.classId() + " has a foreign slot in round 4"));
            }
            if (isDeclaredUnavailable(configuration.constraintsFor(teacher), a.day(), (int) a.period())) {
                violations.add(violation(Type.UNAVAILABLE, a,
                        teacher + " is unavailable on " + a.day() + " period " + (int) a.period()));
            }
        }

        checkHomeroomOwnership(configuration, homerooms, violations);
        checkCoverage(configuration, result, violations);

        AuditReport report = AuditReport.of(violations);
        if (!report.valid()) {
            logger.warn("Schedule audit found {} violation(s)", violations.size());
        }
        return report;
    }

    private void checkExam(Assignment exam, TeacherRef owner, List<AuditViolation> violations) {
        if (exam.round() == 1) {
            violations.add(violation(Type.EXAM_IN_ROUND_1, exam, exam.classId() + " has an exam in round 1"));
        }
        if (owner == null || !owner.equals(exam.teacher())) {
            violations.add(violation(Type.EXAM_PROCTOR_MISMATCH, exam,
                    exam.classId() + " exam is proctored by " + exam.teacher().name() + " instead of its homeroom owner"));
        }
    }

    private void checkHomeroomOwnership(SlotConfiguration configuration, Map<String, TeacherRef> homerooms,
                                        List<AuditViolation> violations) {
        Map<String, Integer> owned = new HashMap<>();
        Map<String, Integer> pinned = new HashMap<>();
        homerooms.forEach((classId, owner) -> {
            if (!owner.isAssigned()) {
                return;
            }
            String teacher = owner.name();
            owned.merge(teacher, 1, Integer::sum);
            boolean isPinned = classId.equals(configuration.fixedHomerooms().get(teacher));
            if (isPinned) {
                pinned.merge(teacher, 1, Integer::sum);
            } else if (configuration.constraintsFor(teacher).homeroomDisabled()) {
                violations.add(new AuditViolation(Type.HOMEROOM_DISABLED, null, null, classId, teacher,
                        teacher + " owns " + classId + " although homeroom duty is disabled"));
            }
        });
        owned.forEach((teacher, count) -> {
            Integer max = configuration.constraintsFor(teacher).maxHomerooms();
            if (max != null && count > max && count > pinned.getOrDefault(teacher, 0)) {
                violations.add(new AuditViolation(Type.MAX_HOMEROOMS_EXCEEDED, null, null, null, teacher,
                        teacher + " owns " + count + " homerooms (max " + max + ")"));
            }
        });
    }

    private void checkCoverage(SlotConfiguration configuration, ScheduleResult result, List<AuditViolation> violations) {
        for (int round : PeriodTimes.ROUNDS) {
            for (String classId : ClassIds.forRound(round, configuration.globalOptions().classCount(round))) {
                Map<DayOfWeek, List<Assignment>> week = result.classSummary().get(classId);
                for (DayOfWeek day : PeriodTimes.DAYS) {
                    List<Assignment> rows = week == null ? List.of() : week.getOrDefault(day, List.of());
                    long teaching = rows.stream().filter(a -> !a.isExam()).count();
                    if (teaching != 2) {
                        violations.add(new AuditViolation(Type.COVERAGE, day, null, classId, null,
                                classId + " has " + teaching + " teaching rows on " + day + " (expected 2)"));
                    }
                }
            }
        }
    }

    private boolean isDeclaredUnavailable(TeacherConstraints constraints, DayOfWeek day, int period) {
        for (String key : constraints.unavailable()) {
            UnavailableSlot slot = UnavailableSlot.parse(key);
            if (slot.day() == day && slot.period() == period) {
                return true;
            }
        }
        return false;
    }

    private static AuditViolation violation(Type type, Assignment a, String message) {
        return new AuditViolation(type, a.day(), a.period(), a.classId(), a.teacher().name(), message);
    }
}
