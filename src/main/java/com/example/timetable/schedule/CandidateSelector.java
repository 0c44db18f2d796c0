package com.example.timetable.schedule;

import java.util.Optional;

/**
 * Chooses the teacher for one role at one slot, or nobody when no candidate survives filtering.
 * Implementations never mutate the context; the caller occupies the slot once it commits.
 */
public interface CandidateSelector {

    Role role();

    Optional<String> select(SelectionRequest request, GenerationContext context);
}
