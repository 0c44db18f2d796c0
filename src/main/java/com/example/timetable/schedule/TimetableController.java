package com.example.timetable.schedule;

import com.example.timetable.common.ApiResponse;
import com.example.timetable.report.AuditReport;
import com.example.timetable.report.FeasibilityAnalyzer;
import com.example.timetable.report.FeasibilityReport;
import com.example.timetable.report.ScheduleAuditor;
import com.example.timetable.slot.SlotConfiguration;
import com.example.timetable.slot.SlotConfigurationValidator;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/timetable")
public class TimetableController {

    private static final Logger logger = LoggerFactory.getLogger(TimetableController.class);

    private final TimetableEngine engine;
    private final SlotConfigurationValidator validator;
    private final FeasibilityAnalyzer feasibilityAnalyzer;
    private final ScheduleAuditor auditor;

    public TimetableController(TimetableEngine engine,
                               SlotConfigurationValidator validator,
                               FeasibilityAnalyzer feasibilityAnalyzer,
                               ScheduleAuditor auditor) {
        this.engine = engine;
        this.validator = validator;
        this.feasibilityAnalyzer = feasibilityAnalyzer;
        this.auditor = auditor;
    }

    @PostMapping("/generate")
    public ResponseEntity<ApiResponse<ScheduleResult>> generate(@Valid @RequestBody SlotConfiguration configuration) {
        ScheduleResult result = engine.generate(configuration);
        Map<String, Object> meta = buildMeta(result);
        String message = result.warnings().isEmpty()
                ? "Timetable generated"
                : "Timetable generated with " + result.warnings().size() + " warning(s)";
        return ResponseEntity.ok(ApiResponse.success(message, result, meta));
    }

    @PostMapping("/feasibility")
    public ResponseEntity<ApiResponse<FeasibilityReport>> feasibility(@Valid @RequestBody SlotConfiguration configuration) {
        validator.validate(configuration);
        FeasibilityReport report = feasibilityAnalyzer.analyze(configuration);
        Map<String, Object> meta = new HashMap<>();
        meta.put("feasible", report.feasible());
        return ResponseEntity.ok(ApiResponse.success(
                report.feasible() ? "Pools cover peak demand" : "Pools fall short of peak demand", report, meta));
    }

    // Generates a fresh timetable and checks it against the same configuration
    @PostMapping("/audit")
    public ResponseEntity<ApiResponse<AuditReport>> audit(@Valid @RequestBody SlotConfiguration configuration) {
        ScheduleResult result = engine.generate(configuration);
        AuditReport report = auditor.audit(configuration, result);
        Map<String, Object> meta = buildMeta(result);
        meta.put("violationsCount", report.violations().size());
        logger.info("Audit finished: valid={}, violations={}", report.valid(), report.violations().size());
        return ResponseEntity.ok(ApiResponse.success(
                report.valid() ? "Timetable passed audit" : "Timetable failed audit", report, meta));
    }

    private Map<String, Object> buildMeta(ScheduleResult result) {
        Map<String, Object> meta = new HashMap<>();
        meta.put("metrics", result.metrics());
        meta.put("warningsCount", result.warnings().size());
        meta.put("classesCount", result.metrics().classesCount());
        meta.put("unassignedCount", result.metrics().unassignedCount());
        meta.put("feasible", result.feasibility().feasible());
        return meta;
    }
}
