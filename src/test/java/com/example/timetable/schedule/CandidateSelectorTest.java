package com.example.timetable.schedule;

import com.example.timetable.slot.GlobalOptions;
import com.example.timetable.slot.SlotConfiguration;
import com.example.timetable.slot.TeacherConstraints;
import com.example.timetable.slot.TeacherPools;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CandidateSelectorTest {

    private final KoreanCandidateSelector korean = new KoreanCandidateSelector();
    private final ForeignCandidateSelector foreign = new ForeignCandidateSelector();
    private final HomeroomCandidateSelector homeroom = new HomeroomCandidateSelector();

    private static GenerationContext context(TeacherPools pools,
                                             Map<String, TeacherConstraints> constraints,
                                             Boolean includeHomerooms,
                                             Map<String, TeacherRef> owners) {
        SlotConfiguration configuration = new SlotConfiguration(pools, constraints, null,
                new GlobalOptions(Map.of(1, owners.size()), Map.of(), includeHomerooms));
        return new GenerationContext(configuration, new HomeroomAssignment(owners, List.of()),
                EngineSettings.defaults(), new MetricsCollector());
    }

    private static Map<String, TeacherRef> owners(String... pairs) {
        Map<String, TeacherRef> owners = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            owners.put(pairs[i], TeacherRef.of(pairs[i + 1]));
        }
        return owners;
    }

    private static SelectionRequest request(int round, String classId, GenerationContext context) {
        return new SelectionRequest(DayOfWeek.MONDAY, 2, round, classId, context.homerooms().ownerOf(classId));
    }

    @Test
    void korean_neverPicksTheClassesOwnHomeroomOwner() {
        GenerationContext ctx = context(new TeacherPools(List.of("A", "B"), List.of()), null, true,
                owners("R1C1", "A", "R1C2", "B"));

        assertThat(korean.select(request(1, "R1C1", ctx), ctx)).contains("B");
        assertThat(korean.select(request(1, "R1C2", ctx), ctx)).contains("A");
    }

    @Test
    void korean_prefersLowestLoadThenName() {
        GenerationContext ctx = context(new TeacherPools(List.of("Owner", "Choi", "Bae"), List.of()), null, true,
                owners("R1C1", "Owner"));

        assertThat(korean.select(request(1, "R1C1", ctx), ctx)).contains("Bae");

        ctx.recordTeaching("Bae");
        assertThat(korean.select(request(1, "R1C1", ctx), ctx)).contains("Choi");
    }

    @Test
    void korean_skipsBusyAndUnavailableTeachers() {
        GenerationContext ctx = context(new TeacherPools(List.of("Owner", "Bae", "Choi", "Dong"), List.of()),
                Map.of("Choi", TeacherConstraints.unavailableAt("MON|2")), true,
                owners("R1C1", "Owner"));
        ctx.conflicts().occupy(DayOfWeek.MONDAY, 2, "Bae");

        assertThat(korean.select(request(1, "R1C1", ctx), ctx)).contains("Dong");
    }

    @Test
    void korean_otherHomeroomOwnersJoinOnlyWhenEnabled() {
        Map<String, TeacherRef> owners = owners("R1C1", "A", "R1C2", "Outsider");
        TeacherPools pools = new TeacherPools(List.of("A"), List.of());

        GenerationContext enabled = context(pools, null, null, owners);
        GenerationContext disabled = context(pools, null, false, owners);

        assertThat(korean.select(request(1, "R1C1", enabled), enabled)).contains("Outsider");
        assertThat(korean.select(request(1, "R1C1", disabled), disabled)).isEmpty();
    }

    @Test
    void foreign_picksFromForeignPoolOnly() {
        GenerationContext ctx = context(new TeacherPools(List.of("A"), List.of("Smith", "Jones")), null, true,
                owners("R1C1", "A"));

        assertThat(foreign.select(request(1, "R1C1", ctx), ctx)).contains("Jones");
    }

    @Test
    void foreign_roundFour_isRejected() {
        GenerationContext ctx = context(new TeacherPools(List.of("A"), List.of("Smith")), null, true,
                owners("R4C1", "A"));

        assertThatThrownBy(() -> foreign.select(request(4, "R4C1", ctx), ctx))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("R4C1");
    }

    @Test
    void homeroom_onlyEverReturnsTheOwner() {
        GenerationContext ctx = context(new TeacherPools(List.of("A", "B"), List.of()),
                Map.of("B", TeacherConstraints.unavailableAt("MON|2")), true,
                owners("R1C1", "A", "R1C2", "B"));

        assertThat(homeroom.select(request(1, "R1C1", ctx), ctx)).contains("A");
        assertThat(homeroom.select(request(1, "R1C2", ctx), ctx)).isEmpty();

        ctx.conflicts().occupy(DayOfWeek.MONDAY, 2, "A");
        assertThat(homeroom.select(request(1, "R1C1", ctx), ctx)).isEmpty();
    }

    @Test
    void homeroom_placeholderOwner_leavesSlotEmpty() {
        Map<String, TeacherRef> owners = new LinkedHashMap<>();
        owners.put("R1C1", TeacherRef.placeholderFor("R1C1"));
        GenerationContext ctx = context(new TeacherPools(List.of(), List.of()), null, true, owners);

        assertThat(homeroom.select(request(1, "R1C1", ctx), ctx)).isEmpty();
    }
}
