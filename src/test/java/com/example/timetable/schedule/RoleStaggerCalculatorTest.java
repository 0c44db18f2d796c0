package com.example.timetable.schedule;

import com.example.timetable.slot.TeacherPools;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.timetable.schedule.Role.FOREIGN;
import static com.example.timetable.schedule.Role.HOMEROOM;
import static com.example.timetable.schedule.Role.KOREAN;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoleStaggerCalculatorTest {

    private final RoleStaggerCalculator calculator = new RoleStaggerCalculator();

    @Test
    void capacityFor_usesLimitingPoolAndNeverDropsBelowOne() {
        TeacherPools pools = new TeacherPools(List.of("A", "B", "C"), List.of());

        assertThat(calculator.capacityFor(1, pools)).isEqualTo(1);
        assertThat(calculator.capacityFor(4, pools)).isEqualTo(3);
        assertThat(calculator.capacityFor(2, new TeacherPools(List.of(), List.of("F1", "F2")))).isEqualTo(2);
    }

    @Test
    void rolesFor_singleForeignTeacher_walksPatternByDay() {
        // capacity 1 keeps the phase at zero, so every class shares the day's base
        assertThat(calculator.rolesFor(1, 0, 0, 1)).containsExactly(HOMEROOM, KOREAN);
        assertThat(calculator.rolesFor(1, 1, 0, 1)).containsExactly(FOREIGN, HOMEROOM);
        assertThat(calculator.rolesFor(1, 2, 5, 1)).containsExactly(FOREIGN, KOREAN);
    }

    @Test
    void rolesFor_shiftsClassesByPhase() {
        // day 1, class 2, capacity 3: phase (1+2)%3 = 0, base 2
        assertThat(calculator.rolesFor(2, 1, 2, 3)).containsExactly(FOREIGN, HOMEROOM);
        // day 2, class 1, capacity 4: phase 3, base (4+3)%6 = 1
        assertThat(calculator.rolesFor(3, 2, 1, 4)).containsExactly(KOREAN, FOREIGN);
        // base 5 wraps to the start of the pattern
        assertThat(calculator.rolesFor(1, 2, 1, 2)).containsExactly(KOREAN, HOMEROOM);
    }

    @Test
    void rolesFor_roundFour_neverYieldsForeign() {
        for (int day = 0; day < 3; day++) {
            for (int cls = 0; cls < 10; cls++) {
                for (int capacity = 1; capacity <= 6; capacity++) {
                    assertThat(calculator.rolesFor(4, day, cls, capacity)).doesNotContain(FOREIGN);
                }
            }
        }
    }

    @Test
    void patternFor_unknownRound_throws() {
        assertThatThrownBy(() -> RoleStaggerCalculator.patternFor(5))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
