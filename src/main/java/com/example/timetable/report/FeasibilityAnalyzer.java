package com.example.timetable.report;

import com.example.timetable.schedule.ClassIds;
import com.example.timetable.schedule.PeriodTimes;
import com.example.timetable.schedule.Role;
import com.example.timetable.schedule.RoleStaggerCalculator;
import com.example.timetable.slot.SlotConfiguration;
import com.example.timetable.slot.TeacherConstraints;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Replays the stagger pattern without assigning anyone and compares the resulting peak demand with
 * pool sizes. Availability constraints are ignored, so an OK here is necessary but not sufficient.
 */
@Component
public class FeasibilityAnalyzer {

    private final RoleStaggerCalculator stagger = new RoleStaggerCalculator();

    public FeasibilityReport analyze(SlotConfiguration configuration) {
        int totalClasses = 0;
        Map<String, int[]> demandBySlot = new HashMap<>(); // "day|period" -> {foreign, korean, homeroom}
        for (int round : PeriodTimes.ROUNDS) {
            List<String> classes = ClassIds.forRound(round, configuration.globalOptions().classCount(round));
            totalClasses += classes.size();
            int capacity = stagger.capacityFor(round, configuration.teacherPools());
            int[] periods = PeriodTimes.periodsOf(round);
            for (int dayIndex = 0; dayIndex < PeriodTimes.DAYS.size(); dayIndex++) {
                for (int classIndex = 0; classIndex < classes.size(); classIndex++) {
                    Role[] roles = stagger.rolesFor(round, dayIndex, classIndex, capacity);
                    for (int i = 0; i < 2; i++) {
                        int[] demand = demandBySlot.computeIfAbsent(
                                PeriodTimes.DAYS.get(dayIndex) + "|" + periods[i], k -> new int[3]);
                        switch (roles[i]) {
                            case FOREIGN -> demand[0]++;
                            case KOREAN -> demand[1]++;
                            case HOMEROOM -> demand[2]++;
                            default -> { }
                        }
                    }
                }
            }
        }

        int peakForeign = 0;
        int peakKorean = 0;
        int peakPool = 0;
        for (int[] demand : demandBySlot.values()) {
            peakForeign = Math.max(peakForeign, demand[0]);
            peakKorean = Math.max(peakKorean, demand[1]);
            peakPool = Math.max(peakPool, demand[1] + demand[2]);
        }

        List<String> homeroomPool = configuration.teacherPools().homeroomKoreanPool();
        Map<String, String> fixed = configuration.fixedHomerooms();
        int classesNeedingHomeroom = Math.max(0, totalClasses - fixed.size());
        int eligible = 0;
        long capacity = 0;
        boolean unbounded = false;
        for (String teacher : homeroomPool) {
            TeacherConstraints c = configuration.constraintsFor(teacher);
            if (c.homeroomDisabled()) {
                continue;
            }
            if (c.maxHomerooms() == null) {
                eligible++;
                unbounded = true;
                continue;
            }
            long pinned = fixed.keySet().stream().filter(teacher::equals).count();
            long remaining = Math.max(0, c.maxHomerooms() - pinned);
            if (remaining > 0) {
                eligible++;
                capacity += remaining;
            }
        }
        int homeroomCapacity = unbounded ? -1 : (int) Math.min(Integer.MAX_VALUE, capacity);
        boolean homeroomOk = classesNeedingHomeroom == 0
                || (unbounded ? eligible > 0 : homeroomCapacity >= classesNeedingHomeroom);

        Set<String> poolStaff = new LinkedHashSet<>(homeroomPool);
        if (configuration.globalOptions().homeroomsIncludedInKorean()) {
            poolStaff.addAll(fixed.keySet());
        }
        int foreignPoolSize = configuration.teacherPools().foreignPool().size();

        return new FeasibilityReport(
                classesNeedingHomeroom,
                eligible,
                homeroomCapacity,
                homeroomOk,
                foreignPoolSize,
                peakForeign,
                peakForeign <= foreignPoolSize,
                poolStaff.size(),
                peakKorean,
                peakPool,
                peakPool <= poolStaff.size());
    }
}
