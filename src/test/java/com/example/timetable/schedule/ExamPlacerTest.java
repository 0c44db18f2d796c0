package com.example.timetable.schedule;

import com.example.timetable.slot.GlobalOptions;
import com.example.timetable.slot.SlotConfiguration;
import com.example.timetable.slot.TeacherPools;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ExamPlacerTest {

    private final ExamPlacer placer = new ExamPlacer();

    private static GenerationContext context(Map<String, List<Double>> examPeriods, MetricsCollector metrics) {
        SlotConfiguration configuration = new SlotConfiguration(
                new TeacherPools(List.of("Kim", "Lee"), List.of("Smith")), null, null,
                new GlobalOptions(Map.of(1, 1, 2, 2), examPeriods, null));
        Map<String, TeacherRef> owners = new LinkedHashMap<>();
        owners.put("R1C1", TeacherRef.of("Kim"));
        owners.put("R2C1", TeacherRef.of("Lee"));
        owners.put("R2C2", TeacherRef.placeholderFor("R2C2"));
        return new GenerationContext(configuration, new HomeroomAssignment(owners, List.of()),
                EngineSettings.defaults(), metrics);
    }

    @Test
    void place_roundOne_hasNoExams() {
        GenerationContext ctx = context(Map.of(), new MetricsCollector());

        assertThat(placer.place(1, DayOfWeek.MONDAY, List.of("R1C1"), ctx)).isEmpty();
    }

    @Test
    void place_defaultAnchor_isRoundsFirstPeriodProctoredByOwner() {
        GenerationContext ctx = context(Map.of(), new MetricsCollector());

        List<Assignment> exams = placer.place(2, DayOfWeek.WEDNESDAY, List.of("R2C1", "R2C2"), ctx);

        assertThat(exams).hasSize(2);
        assertThat(exams).allSatisfy(exam -> {
            assertThat(exam.role()).isEqualTo(Role.EXAM);
            assertThat(exam.period()).isEqualTo(3.0);
            assertThat(exam.time()).isEqualTo("16:00–16:15");
        });
        assertThat(exams.get(0).teacher()).isEqualTo(TeacherRef.of("Lee"));
        assertThat(exams.get(1).teacher().isPlaceholder()).isTrue();
    }

    @Test
    void place_customMarkers_replaceAnchorOnThatDayOnly() {
        MetricsCollector metrics = new MetricsCollector();
        GenerationContext ctx = context(Map.of("wed", List.of(2.5, 4.5)), metrics);

        List<Assignment> wednesday = placer.place(2, DayOfWeek.WEDNESDAY, List.of("R2C1"), ctx);
        List<Assignment> friday = placer.place(2, DayOfWeek.FRIDAY, List.of("R2C1"), ctx);

        assertThat(wednesday).extracting(Assignment::period).containsExactly(2.5, 4.5);
        assertThat(wednesday.get(1).time()).isEqualTo("Exam between period 4 and 5 (17:50–18:05)");
        assertThat(friday).extracting(Assignment::period).containsExactly(3.0);
        assertThat(metrics.finish(0, 0, 0).examCount()).isEqualTo(3);
    }

    @Test
    void place_neverTouchesConflictsOrLoad() {
        GenerationContext ctx = context(Map.of(), new MetricsCollector());

        placer.place(2, DayOfWeek.MONDAY, List.of("R2C1"), ctx);

        assertThat(ctx.conflicts().size()).isZero();
        assertThat(ctx.loadOf("Lee")).isZero();
    }
}
