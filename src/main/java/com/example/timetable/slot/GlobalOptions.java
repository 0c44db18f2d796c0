package com.example.timetable.slot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Slot-wide options.
 *
 * @param roundClassCounts         round (1..4) to number of classes running in that round
 * @param examPeriods              day key (e.g. {@code "MON"}) to fractional "between periods" exam markers
 * @param includeHomeroomsInKorean whether other classes' homeroom owners may fill Korean-role slots;
 *                                 {@code null} means the default ({@code true})
 */
public record GlobalOptions(Map<Integer, Integer> roundClassCounts,
                            Map<String, List<Double>> examPeriods,
                            Boolean includeHomeroomsInKorean) {

    public GlobalOptions {
        roundClassCounts = roundClassCounts == null
                ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(roundClassCounts));
        if (examPeriods == null) {
            examPeriods = Map.of();
        } else {
            Map<String, List<Double>> copy = new LinkedHashMap<>();
            examPeriods.forEach((day, markers) ->
                    copy.put(day, markers == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(markers))));
            examPeriods = Collections.unmodifiableMap(copy);
        }
    }

    public static GlobalOptions ofRoundCounts(Map<Integer, Integer> roundClassCounts) {
        return new GlobalOptions(roundClassCounts, Map.of(), null);
    }

    public boolean homeroomsIncludedInKorean() {
        return includeHomeroomsInKorean == null || includeHomeroomsInKorean;
    }

    public int classCount(int round) {
        Integer count = roundClassCounts.get(round);
        return count == null ? 0 : Math.max(0, count);
    }
}
