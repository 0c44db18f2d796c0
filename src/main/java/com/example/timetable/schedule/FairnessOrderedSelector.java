package com.example.timetable.schedule;

import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Shared filtering and ordering for pool-based roles: drop teachers who are unavailable or already
 * teaching at the slot, then take the one with the lowest running load, ties broken by name.
 */
public abstract class FairnessOrderedSelector implements CandidateSelector {

    protected Optional<String> pickLeastLoaded(List<String> candidates, SelectionRequest request,
                                               GenerationContext context) {
        return new LinkedHashSet<>(candidates).stream()
                .filter(t -> context.availability().isAvailable(t, request.day(), request.period()))
                .filter(t -> context.conflicts().can(request.day(), request.period(), t))
                .min(Comparator.comparingInt(context::loadOf).thenComparing(Comparator.naturalOrder()));
    }
}
