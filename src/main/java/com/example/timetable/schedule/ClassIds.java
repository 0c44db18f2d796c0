package com.example.timetable.schedule;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Class identifiers follow {@code R<round>C<n>}, e.g. {@code R2C3} is the third class of round 2.
 */
public final class ClassIds {

    private static final Pattern CLASS_ID = Pattern.compile("R(\\d{1,9})C(\\d{1,9})");

    /** Round first, then class number, so R1C10 sorts after R1C2. */
    public static final Comparator<String> ORDER = Comparator
            .comparingInt(ClassIds::roundOf)
            .thenComparingInt(ClassIds::numberOf)
            .thenComparing(Comparator.naturalOrder());

    private ClassIds() {
    }

    public static String of(int round, int number) {
        return "R" + round + "C" + number;
    }

    public static List<String> forRound(int round, int count) {
        List<String> ids = new ArrayList<>(Math.max(0, count));
        for (int i = 1; i <= count; i++) {
            ids.add(of(round, i));
        }
        return ids;
    }

    public static boolean isWellFormed(String classId) {
        return match(classId) != null;
    }

    public static int roundOf(String classId) {
        Matcher m = match(classId);
        return m == null ? Integer.MAX_VALUE : Integer.parseInt(m.group(1));
    }

    public static int numberOf(String classId) {
        Matcher m = match(classId);
        return m == null ? Integer.MAX_VALUE : Integer.parseInt(m.group(2));
    }

    private static Matcher match(String classId) {
        if (classId == null) {
            return null;
        }
        Matcher m = CLASS_ID.matcher(classId);
        return m.matches() ? m : null;
    }
}
