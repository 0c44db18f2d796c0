package com.example.timetable.slot;

import com.example.timetable.exception.SlotConfigurationException;
import com.example.timetable.schedule.ClassIds;
import com.example.timetable.schedule.PeriodTimes;
import com.example.timetable.schedule.TeacherRef;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks a slot configuration up front so that generation never starts on input it cannot honor.
 * All problems are collected and reported together.
 */
@Component
public class SlotConfigurationValidator {

    public static final int MAX_CLASSES_PER_ROUND = 500;

    public void validate(SlotConfiguration configuration) {
        List<String> violations = findViolations(configuration);
        if (!violations.isEmpty()) {
            throw new SlotConfigurationException(violations);
        }
    }

    public List<String> findViolations(SlotConfiguration configuration) {
        List<String> violations = new ArrayList<>();
        if (configuration == null) {
            violations.add("slot configuration is missing");
            return violations;
        }
        if (configuration.teacherPools() == null) {
            violations.add("teacherPools is required");
        } else {
            checkPools(configuration.teacherPools(), violations);
        }
        if (configuration.globalOptions() == null) {
            violations.add("globalOptions is required");
        } else {
            checkRoundCounts(configuration.globalOptions(), violations);
            checkExamPeriods(configuration.globalOptions(), violations);
        }
        checkConstraints(configuration.teacherConstraints(), violations);
        if (configuration.globalOptions() != null) {
            checkFixedHomerooms(configuration, violations);
        }
        return violations;
    }

    private void checkPools(TeacherPools pools, List<String> violations) {
        Set<String> homeroom = checkPool("homeroomKoreanPool", pools.homeroomKoreanPool(), violations);
        Set<String> foreign = checkPool("foreignPool", pools.foreignPool(), violations);
        for (String teacher : homeroom) {
            if (foreign.contains(teacher)) {
                violations.add("teacher '" + teacher + "' appears in both homeroomKoreanPool and foreignPool");
            }
        }
    }

    private Set<String> checkPool(String poolName, List<String> pool, List<String> violations) {
        Set<String> seen = new LinkedHashSet<>();
        for (String teacher : pool) {
            if (teacher == null || teacher.isBlank()) {
                violations.add(poolName + " contains a blank teacher name");
                continue;
            }
            if (TeacherRef.isReservedName(teacher)) {
                violations.add(poolName + " uses reserved name '" + teacher + "'");
            }
            if (!seen.add(teacher)) {
                violations.add(poolName + " lists '" + teacher + "' more than once");
            }
        }
        return seen;
    }

    private void checkRoundCounts(GlobalOptions options, List<String> violations) {
        options.roundClassCounts().forEach((round, count) -> {
            if (!PeriodTimes.ROUNDS.contains(round)) {
                violations.add("roundClassCounts has unknown round " + round + " (expected 1-4)");
            }
            if (count == null) {
                violations.add("roundClassCounts[" + round + "] is missing a value");
            } else if (count < 0) {
                violations.add("roundClassCounts[" + round + "] must not be negative (was " + count + ")");
            } else if (count > MAX_CLASSES_PER_ROUND) {
                violations.add("roundClassCounts[" + round + "] must not exceed " + MAX_CLASSES_PER_ROUND
                        + " (was " + count + ")");
            }
        });
    }

    private void checkExamPeriods(GlobalOptions options, List<String> violations) {
        Set<DayOfWeek> seenDays = new HashSet<>();
        options.examPeriods().forEach((dayKey, markers) -> {
            DayOfWeek day;
            try {
                day = PeriodTimes.parseDay(dayKey);
            } catch (IllegalArgumentException e) {
                violations.add("examPeriods: " + e.getMessage());
                return;
            }
            if (!PeriodTimes.DAYS.contains(day)) {
                violations.add("examPeriods: " + day + " is not a scheduled day");
                return;
            }
            if (!seenDays.add(day)) {
                violations.add("examPeriods lists " + day + " more than once");
            }
            for (Double marker : markers) {
                if (marker == null || marker.isNaN()
                        || marker <= PeriodTimes.FIRST_PERIOD || marker >= PeriodTimes.LAST_PERIOD) {
                    violations.add("examPeriods[" + dayKey + "] marker " + marker
                            + " must lie strictly between " + PeriodTimes.FIRST_PERIOD + " and " + PeriodTimes.LAST_PERIOD);
                }
            }
        });
    }

    private void checkConstraints(Map<String, TeacherConstraints> constraints, List<String> violations) {
        constraints.forEach((teacher, c) -> {
            if (c == null) {
                return;
            }
            for (String key : c.unavailable()) {
                try {
                    UnavailableSlot.parse(key);
                } catch (IllegalArgumentException e) {
                    violations.add("teacherConstraints[" + teacher + "]: " + e.getMessage());
                }
            }
            if (c.maxHomerooms() != null && c.maxHomerooms() < 0) {
                violations.add("teacherConstraints[" + teacher + "].maxHomerooms must not be negative");
            }
        });
    }

    private void checkFixedHomerooms(SlotConfiguration configuration, List<String> violations) {
        GlobalOptions options = configuration.globalOptions();
        Map<String, String> ownerByClass = new HashMap<>();
        configuration.fixedHomerooms().forEach((teacher, classId) -> {
            if (teacher == null || teacher.isBlank()) {
                violations.add("fixedHomerooms contains a blank teacher name");
                return;
            }
            if (TeacherRef.isReservedName(teacher)) {
                violations.add("fixedHomerooms uses reserved name '" + teacher + "'");
                return;
            }
            if (!isKnownClass(classId, options)) {
                violations.add("fixedHomerooms pins '" + teacher + "' to unknown class " + classId);
                return;
            }
            String previous = ownerByClass.putIfAbsent(classId, teacher);
            if (previous != null) {
                violations.add("class " + classId + " is pinned to both '" + previous + "' and '" + teacher + "'");
            }
        });
    }

    // Checked arithmetically so an oversized round count never materializes its class list
    private boolean isKnownClass(String classId, GlobalOptions options) {
        if (!ClassIds.isWellFormed(classId)) {
            return false;
        }
        int round = ClassIds.roundOf(classId);
        int number = ClassIds.numberOf(classId);
        return PeriodTimes.ROUNDS.contains(round) && number >= 1 && number <= options.classCount(round);
    }
}
