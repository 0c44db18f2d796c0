package com.example.timetable.exception;

import java.util.List;

/**
 * Raised before any assignment work when a slot configuration cannot be scheduled as given.
 * Carries every problem found, not just the first one.
 */
public class SlotConfigurationException extends BusinessException {

    public static final String ERROR_CODE = "INVALID_SLOT_CONFIGURATION";

    private final List<String> violations;

    public SlotConfigurationException(List<String> violations) {
        super(ERROR_CODE, buildMessage(violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }

    private static String buildMessage(List<String> violations) {
        if (violations.size() == 1) {
            return "Invalid slot configuration: " + violations.get(0);
        }
        return "Invalid slot configuration (" + violations.size() + " problems): " + String.join("; ", violations);
    }
}
