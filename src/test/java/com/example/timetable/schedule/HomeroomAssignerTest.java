package com.example.timetable.schedule;

import com.example.timetable.slot.GlobalOptions;
import com.example.timetable.slot.SlotConfiguration;
import com.example.timetable.slot.TeacherConstraints;
import com.example.timetable.slot.TeacherPools;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class HomeroomAssignerTest {

    private final HomeroomAssigner assigner = new HomeroomAssigner();

    private static SlotConfiguration config(List<String> pool,
                                            Map<String, TeacherConstraints> constraints,
                                            Map<String, String> fixed) {
        return new SlotConfiguration(new TeacherPools(pool, List.of("F1")), constraints, fixed,
                GlobalOptions.ofRoundCounts(Map.of(1, 4)));
    }

    @Test
    void assign_spreadsClassesEvenly_tiesBrokenByName() {
        HomeroomAssignment result = assigner.assign(ClassIds.forRound(1, 4),
                config(List.of("Park", "Kim"), null, null));

        assertThat(result.ownerByClass()).containsExactly(
                Map.entry("R1C1", TeacherRef.of("Kim")),
                Map.entry("R1C2", TeacherRef.of("Park")),
                Map.entry("R1C3", TeacherRef.of("Kim")),
                Map.entry("R1C4", TeacherRef.of("Park")));
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void assign_pinnedClassCountsTowardOwnersLoad() {
        HomeroomAssignment result = assigner.assign(ClassIds.forRound(1, 4),
                config(List.of("Kim", "Park"), null, Map.of("Kim", "R1C4")));

        assertThat(result.ownerOf("R1C4")).isEqualTo(TeacherRef.of("Kim"));
        assertThat(result.classesOwnedBy("Kim")).hasSize(2);
        assertThat(result.classesOwnedBy("Park")).hasSize(2);
    }

    @Test
    void assign_maxHomeroomsZero_neverOwnsAClass() {
        HomeroomAssignment result = assigner.assign(ClassIds.forRound(1, 4),
                config(List.of("Kim", "Park"), Map.of("Kim", TeacherConstraints.maxHomerooms(0)), null));

        assertThat(result.classesOwnedBy("Kim")).isEmpty();
        assertThat(result.classesOwnedBy("Park")).containsExactly("R1C1", "R1C2", "R1C3", "R1C4");
    }

    @Test
    void assign_disabledTeacher_isSkipped() {
        HomeroomAssignment result = assigner.assign(ClassIds.forRound(1, 2),
                config(List.of("Kim", "Park"), Map.of("Kim", TeacherConstraints.withHomeroomDisabled()), null));

        assertThat(result.resolvedOwners()).containsExactly("Park");
    }

    @Test
    void assign_noEligibleTeacher_usesPlaceholderAndWarns() {
        HomeroomAssignment result = assigner.assign(ClassIds.forRound(1, 3),
                config(List.of("Kim"), Map.of("Kim", TeacherConstraints.maxHomerooms(2)), null));

        TeacherRef third = result.ownerOf("R1C3");
        assertThat(third.isPlaceholder()).isTrue();
        assertThat(third.name()).isEqualTo("H-R1C3");
        assertThat(result.warnings()).singleElement().asString().contains("R1C3");
        assertThat(result.resolvedOwners()).containsExactly("Kim");
    }
}
