package com.example.timetable.slot;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Per-teacher limits, fixed for the duration of one generation run.
 *
 * @param unavailable      {@code "DAY|period"} keys such as {@code "MON|1"} or {@code "WEDNESDAY|4"}
 * @param homeroomDisabled the teacher may never be picked as a homeroom owner
 * @param maxHomerooms     cap on owned homerooms, {@code null} for no cap
 */
public record TeacherConstraints(Set<String> unavailable, boolean homeroomDisabled, Integer maxHomerooms) {

    public TeacherConstraints {
        unavailable = unavailable == null
                ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(unavailable));
    }

    public static TeacherConstraints none() {
        return new TeacherConstraints(Set.of(), false, null);
    }

    public static TeacherConstraints unavailableAt(String... keys) {
        return new TeacherConstraints(new LinkedHashSet<>(Arrays.asList(keys)), false, null);
    }

    public static TeacherConstraints maxHomerooms(int max) {
        return new TeacherConstraints(Set.of(), false, max);
    }

    public static TeacherConstraints withHomeroomDisabled() {
        return new TeacherConstraints(Set.of(), true, null);
    }
}
