package com.example.timetable.schedule;

import com.example.timetable.slot.TeacherPools;

import java.util.List;
import java.util.Map;

import static com.example.timetable.schedule.Role.FOREIGN;
import static com.example.timetable.schedule.Role.HOMEROOM;
import static com.example.timetable.schedule.Role.KOREAN;

/**
 * Picks which two roles a class gets in a round's two periods on a given day.
 * <p>
 * Each round has a six-slot weekly pattern (two periods on each of the three days). Classes and days
 * are shifted through that pattern by a phase that depends on the capacity of the limiting pool, so
 * that simultaneous demand for the scarce role never piles onto the same weekday and period.
 */
public class RoleStaggerCalculator {

    public static final int PATTERN_LENGTH = 6;

    private static final List<Role> STANDARD_PATTERN = List.of(HOMEROOM, KOREAN, FOREIGN, HOMEROOM, FOREIGN, KOREAN);
    // Round 4 runs without foreign teachers: four homeroom and two Korean slots
    private static final List<Role> ROUND_FOUR_PATTERN = List.of(HOMEROOM, KOREAN, HOMEROOM, KOREAN, HOMEROOM, HOMEROOM);

    private static final Map<Integer, List<Role>> PATTERNS = Map.of(
            1, STANDARD_PATTERN,
            2, STANDARD_PATTERN,
            3, STANDARD_PATTERN,
            4, ROUND_FOUR_PATTERN);

    public static List<Role> patternFor(int round) {
        List<Role> pattern = PATTERNS.get(round);
        if (pattern == null) {
            throw new IllegalArgumentException("Unknown round: " + round);
        }
        return pattern;
    }

    /**
     * Size of the pool that limits the round: the homeroom/Korean pool in round 4, the foreign pool otherwise.
     * Never less than 1.
     */
    public int capacityFor(int round, TeacherPools pools) {
        int size = round == 4 ? pools.homeroomKoreanPool().size() : pools.foreignPool().size();
        return Math.max(1, size);
    }

    /**
     * @param dayIndex   0-based position of the day within the week's scheduled days
     * @param classIndex 0-based position of the class within its round
     * @return the roles for the round's first and second period
     */
    public Role[] rolesFor(int round, int dayIndex, int classIndex, int capacity) {
        List<Role> pattern = patternFor(round);
        int phase = (dayIndex + classIndex) % Math.max(1, capacity);
        int base = (dayIndex * 2 + phase) % PATTERN_LENGTH;
        return new Role[] { pattern.get(base), pattern.get((base + 1) % PATTERN_LENGTH) };
    }
}
