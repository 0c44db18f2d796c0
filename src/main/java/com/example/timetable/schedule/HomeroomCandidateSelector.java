package com.example.timetable.schedule;

import java.util.Optional;

/**
 * A homeroom slot is only ever taught by the class's own homeroom owner. When the owner cannot take
 * it, the slot stays empty rather than going to somebody else.
 */
public class HomeroomCandidateSelector implements CandidateSelector {

    @Override
    public Role role() {
        return Role.HOMEROOM;
    }

    @Override
    public Optional<String> select(SelectionRequest request, GenerationContext context) {
        TeacherRef owner = request.homeroomOwner();
        if (!owner.isAssigned()) {
            return Optional.empty();
        }
        String teacher = owner.name();
        if (!context.availability().isAvailable(teacher, request.day(), request.period())) {
            return Optional.empty();
        }
        if (!context.conflicts().can(request.day(), request.period(), teacher)) {
            return Optional.empty();
        }
        return Optional.of(teacher);
    }
}
