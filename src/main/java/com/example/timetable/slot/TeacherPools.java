package com.example.timetable.slot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The two staff pools a slot draws from. Homeroom teachers and Korean-role teachers share one pool.
 */
public record TeacherPools(List<String> homeroomKoreanPool, List<String> foreignPool) {

    public TeacherPools {
        homeroomKoreanPool = homeroomKoreanPool == null
                ? List.of() : Collections.unmodifiableList(new ArrayList<>(homeroomKoreanPool));
        foreignPool = foreignPool == null
                ? List.of() : Collections.unmodifiableList(new ArrayList<>(foreignPool));
    }
}
