package com.example.timetable.schedule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Homeroom owner for every class of the run, in class order.
 */
public record HomeroomAssignment(Map<String, TeacherRef> ownerByClass, List<String> warnings) {

    public HomeroomAssignment {
        ownerByClass = Collections.unmodifiableMap(new LinkedHashMap<>(ownerByClass));
        warnings = List.copyOf(warnings);
    }

    public TeacherRef ownerOf(String classId) {
        TeacherRef owner = ownerByClass.get(classId);
        return owner == null ? TeacherRef.placeholderFor(classId) : owner;
    }

    /** Distinct real teachers owning at least one homeroom, in first-owned class order. */
    public List<String> resolvedOwners() {
        Set<String> owners = new LinkedHashSet<>();
        for (TeacherRef owner : ownerByClass.values()) {
            if (owner.isAssigned()) {
                owners.add(owner.name());
            }
        }
        return new ArrayList<>(owners);
    }

    public List<String> classesOwnedBy(String teacher) {
        List<String> classes = new ArrayList<>();
        ownerByClass.forEach((classId, owner) -> {
            if (owner.is(teacher)) {
                classes.add(classId);
            }
        });
        return classes;
    }
}
