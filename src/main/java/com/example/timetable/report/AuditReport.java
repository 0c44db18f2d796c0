package com.example.timetable.report;

import java.util.List;

public record AuditReport(boolean valid, List<AuditViolation> violations) {

    public AuditReport {
        violations = List.copyOf(violations);
    }

    public static AuditReport of(List<AuditViolation> violations) {
        return new AuditReport(violations.isEmpty(), violations);
    }

    public long count(AuditViolation.Type type) {
        return violations.stream().filter(v -> v.type() == type).count();
    }
}
