package com.example.timetable.report;

import com.example.timetable.schedule.Assignment;
import com.example.timetable.schedule.HomeroomAssignment;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-teacher weekly totals, keyed by teacher name in name order. Unfilled and placeholder rows are skipped.
 */
@Component
public class WorkloadSummarizer {

    public Map<String, TeacherWorkload> summarize(HomeroomAssignment homerooms, Collection<Assignment> assignments) {
        Map<String, int[]> counts = new TreeMap<>(); // {H, K, F, EXAM}
        for (String owner : homerooms.resolvedOwners()) {
            counts.computeIfAbsent(owner, k -> new int[4]);
        }
        for (Assignment a : assignments) {
            if (!a.teacher().isAssigned()) {
                continue;
            }
            int[] c = counts.computeIfAbsent(a.teacher().name(), k -> new int[4]);
            switch (a.role()) {
                case HOMEROOM -> c[0]++;
                case KOREAN -> c[1]++;
                case FOREIGN -> c[2]++;
                case EXAM -> c[3]++;
            }
        }

        Map<String, TeacherWorkload> result = new LinkedHashMap<>();
        counts.forEach((teacher, c) -> {
            List<String> owned = homerooms.classesOwnedBy(teacher);
            result.put(teacher, new TeacherWorkload(teacher, owned, c[0], c[1], c[2], c[3], c[0] + c[1] + c[2]));
        });
        return Collections.unmodifiableMap(result);
    }
}
