package com.example.timetable.schedule;

import java.util.Objects;

/**
 * Who fills an assignment: a real teacher, nobody, or the stand-in label used for a class
 * that ended up without a homeroom owner.
 */
public record TeacherRef(Kind kind, String name) {

    public static final String UNASSIGNED_LABEL = "(unassigned)";
    private static final String PLACEHOLDER_PREFIX = "H-";

    private static final TeacherRef UNASSIGNED = new TeacherRef(Kind.UNASSIGNED, UNASSIGNED_LABEL);

    public enum Kind { ASSIGNED, UNASSIGNED, PLACEHOLDER }

    public TeacherRef {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(name, "name");
    }

    /**
     * True for names a real teacher may not use: the unassigned label and anything shaped like a
     * homeroom placeholder ({@code H-R1C2}).
     */
    public static boolean isReservedName(String name) {
        if (UNASSIGNED_LABEL.equals(name)) {
            return true;
        }
        return name != null && name.startsWith(PLACEHOLDER_PREFIX)
                && ClassIds.isWellFormed(name.substring(PLACEHOLDER_PREFIX.length()));
    }

    public static TeacherRef of(String teacher) {
        return new TeacherRef(Kind.ASSIGNED, teacher);
    }

    public static TeacherRef unassigned() {
        return UNASSIGNED;
    }

    public static TeacherRef placeholderFor(String classId) {
        return new TeacherRef(Kind.PLACEHOLDER, PLACEHOLDER_PREFIX + classId);
    }

    public boolean isAssigned() {
        return kind == Kind.ASSIGNED;
    }

    public boolean isUnassigned() {
        return kind == Kind.UNASSIGNED;
    }

    public boolean isPlaceholder() {
        return kind == Kind.PLACEHOLDER;
    }

    public boolean is(String teacher) {
        return kind == Kind.ASSIGNED && name.equals(teacher);
    }

    @Override
    public String toString() {
        return name;
    }
}
