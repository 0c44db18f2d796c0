package com.example.timetable.schedule;

import com.example.timetable.slot.SlotConfiguration;
import com.example.timetable.slot.TeacherConstraints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decides who owns each class as homeroom teacher. Pinned owners are applied as given; every other
 * class goes to the eligible pool teacher with the fewest homerooms so far, ties broken by name.
 */
public class HomeroomAssigner {

    private static final Logger logger = LoggerFactory.getLogger(HomeroomAssigner.class);

    public HomeroomAssignment assign(List<String> classIds, SlotConfiguration configuration) {
        Map<String, TeacherRef> owners = new LinkedHashMap<>();
        List<String> warnings = new ArrayList<>();

        Map<String, String> pinned = new HashMap<>();
        configuration.fixedHomerooms().forEach((teacher, classId) -> pinned.put(classId, teacher));

        // Eligible pool members and their running homeroom counts, pinned classes included
        Map<String, Integer> current = new LinkedHashMap<>();
        Map<String, Integer> cap = new HashMap<>();
        for (String teacher : configuration.teacherPools().homeroomKoreanPool()) {
            TeacherConstraints c = configuration.constraintsFor(teacher);
            if (c.homeroomDisabled()) {
                continue;
            }
            cap.put(teacher, c.maxHomerooms() == null ? Integer.MAX_VALUE : c.maxHomerooms());
            int fixedCount = (int) pinned.values().stream().filter(teacher::equals).count();
            current.put(teacher, fixedCount);
        }

        for (String classId : classIds) {
            String fixed = pinned.get(classId);
            if (fixed != null) {
                owners.put(classId, TeacherRef.of(fixed));
                continue;
            }
            String pick = current.keySet().stream()
                    .filter(t -> current.get(t) < cap.get(t))
                    .min(Comparator.comparing((String t) -> current.get(t)).thenComparing(Comparator.naturalOrder()))
                    .orElse(null);
            if (pick == null) {
                TeacherRef placeholder = TeacherRef.placeholderFor(classId);
                owners.put(classId, placeholder);
                warnings.add(classId + " has no eligible homeroom teacher; using placeholder " + placeholder.name());
                continue;
            }
            owners.put(classId, TeacherRef.of(pick));
            current.merge(pick, 1, Integer::sum);
        }

        logger.debug("Homeroom owners resolved: {}", owners);
        return new HomeroomAssignment(owners, warnings);
    }
}
