package com.example.timetable.slot;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything one generation run needs: staff pools, per-teacher constraints,
 * pinned homerooms (teacher to class id) and slot-wide options.
 */
public record SlotConfiguration(
        @NotNull(message = "teacherPools is required") @Valid TeacherPools teacherPools,
        Map<String, TeacherConstraints> teacherConstraints,
        Map<String, String> fixedHomerooms,
        @NotNull(message = "globalOptions is required") @Valid GlobalOptions globalOptions) {

    public SlotConfiguration {
        teacherConstraints = teacherConstraints == null
                ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(teacherConstraints));
        fixedHomerooms = fixedHomerooms == null
                ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fixedHomerooms));
    }

    public TeacherConstraints constraintsFor(String teacher) {
        TeacherConstraints constraints = teacherConstraints.get(teacher);
        return constraints == null ? TeacherConstraints.none() : constraints;
    }
}
