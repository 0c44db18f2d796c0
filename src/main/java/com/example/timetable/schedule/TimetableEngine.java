package com.example.timetable.schedule;

import com.example.timetable.report.FeasibilityAnalyzer;
import com.example.timetable.report.FeasibilityReport;
import com.example.timetable.report.TeacherWorkload;
import com.example.timetable.report.WorkloadSummarizer;
import com.example.timetable.slot.SlotConfiguration;
import com.example.timetable.slot.SlotConfigurationValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds one week of Mon/Wed/Fri assignments from a slot configuration.
 * <p>
 * Rounds run in order 1 to 4, days in week order, classes in class order. For every class the stagger
 * calculator picks the roles of the round's two periods and the matching selector picks a teacher;
 * a slot nobody can fill becomes an unassigned row plus a warning, and generation carries on.
 * The bean keeps no state between calls, so concurrent callers never see each other's runs.
 */
@Service
public class TimetableEngine {

    private static final Logger logger = LoggerFactory.getLogger(TimetableEngine.class);

    private final SlotConfigurationValidator validator;
    private final EngineSettings settings;
    private final FeasibilityAnalyzer feasibilityAnalyzer;
    private final WorkloadSummarizer workloadSummarizer;
    private final HomeroomAssigner homeroomAssigner = new HomeroomAssigner();
    private final RoleStaggerCalculator stagger = new RoleStaggerCalculator();
    private final ExamPlacer examPlacer = new ExamPlacer();
    private final Map<Role, CandidateSelector> selectors = new EnumMap<>(Role.class);

    public TimetableEngine(SlotConfigurationValidator validator,
                           EngineSettings settings,
                           FeasibilityAnalyzer feasibilityAnalyzer,
                           WorkloadSummarizer workloadSummarizer) {
        this.validator = validator;
        this.settings = settings;
        this.feasibilityAnalyzer = feasibilityAnalyzer;
        this.workloadSummarizer = workloadSummarizer;
        for (CandidateSelector selector : List.of(
                new HomeroomCandidateSelector(), new KoreanCandidateSelector(), new ForeignCandidateSelector())) {
            selectors.put(selector.role(), selector);
        }
    }

    /**
     * @throws com.example.timetable.exception.SlotConfigurationException if the configuration is invalid;
     *         nothing is generated in that case
     */
    public ScheduleResult generate(SlotConfiguration configuration) {
        validator.validate(configuration);
        MetricsCollector metrics = new MetricsCollector();

        Map<Integer, List<String>> classesByRound = new LinkedHashMap<>();
        List<String> allClasses = new ArrayList<>();
        for (int round : PeriodTimes.ROUNDS) {
            List<String> classes = ClassIds.forRound(round, configuration.globalOptions().classCount(round));
            classesByRound.put(round, classes);
            allClasses.addAll(classes);
        }

        HomeroomAssignment homerooms = homeroomAssigner.assign(allClasses, configuration);
        GenerationContext context = new GenerationContext(configuration, homerooms, settings, metrics);

        FeasibilityReport feasibility = feasibilityAnalyzer.analyze(configuration);
        if (!feasibility.feasible()) {
            logger.warn("Configuration may not be fully schedulable: {}", feasibility);
        }

        ScheduleAggregator aggregator = new ScheduleAggregator(allClasses, metrics);
        homerooms.warnings().forEach(aggregator::warn);

        for (int round : PeriodTimes.ROUNDS) {
            List<String> classes = classesByRound.get(round);
            if (classes.isEmpty()) {
                continue;
            }
            int capacity = stagger.capacityFor(round, configuration.teacherPools());
            int[] periods = PeriodTimes.periodsOf(round);
            for (int dayIndex = 0; dayIndex < PeriodTimes.DAYS.size(); dayIndex++) {
                DayOfWeek day = PeriodTimes.DAYS.get(dayIndex);
                examPlacer.place(round, day, classes, context).forEach(aggregator::add);
                for (int classIndex = 0; classIndex < classes.size(); classIndex++) {
                    String classId = classes.get(classIndex);
                    Role[] roles = stagger.rolesFor(round, dayIndex, classIndex, capacity);
                    if (settings.isTraceStagger()) {
                        logger.debug("{} {} {} -> {}", PeriodTimes.dayKey(day), classId, round, Arrays.toString(roles));
                    }
                    for (int i = 0; i < periods.length; i++) {
                        assignOne(day, periods[i], round, classId, roles[i], context, aggregator);
                    }
                }
            }
        }

        ScheduleAggregator.Views views = aggregator.finish();
        Set<String> teachers = aggregator.assignments().stream()
                .filter(a -> a.teacher().isAssigned())
                .map(a -> a.teacher().name())
                .collect(Collectors.toSet());
        GenerationMetrics generationMetrics = metrics.finish(views.warnings().size(), teachers.size(), allClasses.size());
        Map<String, TeacherWorkload> workloads = workloadSummarizer.summarize(homerooms, aggregator.assignments());

        logger.info("Generated timetable: {} classes, {} assignments ({} unassigned), {} exams, {} warnings in {} ms",
                generationMetrics.classesCount(), generationMetrics.totalAssignments(),
                generationMetrics.unassignedCount(), generationMetrics.examCount(),
                generationMetrics.warningsCount(), generationMetrics.generationTimeMs());

        return new ScheduleResult(
                views.classSummary(),
                views.teacherSummary(),
                views.dayGrid(),
                views.warnings(),
                generationMetrics,
                homerooms.ownerByClass(),
                feasibility,
                workloads);
    }

    private void assignOne(DayOfWeek day, int period, int round, String classId, Role role,
                           GenerationContext context, ScheduleAggregator aggregator) {
        String time = PeriodTimes.label(period);
        String slot = "[" + PeriodTimes.dayKey(day) + " " + period + "] " + classId + " " + role.getCode();

        if (role == Role.FOREIGN && round == 4) {
            context.metrics().assignmentAttempted(false);
            aggregator.warn(slot + " skipped: round 4 has no foreign slots");
            aggregator.add(new Assignment(day, classId, round, period, time, role, TeacherRef.unassigned()));
            return;
        }

        SelectionRequest request = new SelectionRequest(day, period, round, classId, context.homerooms().ownerOf(classId));
        Optional<String> pick = selectors.get(role).select(request, context);
        if (pick.isPresent()) {
            String teacher = pick.get();
            context.conflicts().occupy(day, period, teacher);
            context.recordTeaching(teacher);
            context.metrics().assignmentAttempted(true);
            aggregator.add(new Assignment(day, classId, round, period, time, role, TeacherRef.of(teacher)));
            logger.debug("{} -> {}", slot, teacher);
            return;
        }

        context.metrics().assignmentAttempted(false);
        aggregator.warn(slot + " assignment failed: no available candidate");
        aggregator.add(new Assignment(day, classId, round, period, time, role, TeacherRef.unassigned()));
    }
}
