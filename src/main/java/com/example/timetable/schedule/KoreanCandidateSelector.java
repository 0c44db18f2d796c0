package com.example.timetable.schedule;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Korean slots draw from the homeroom/Korean pool and, when enabled, from the homeroom owners of
 * other classes. The class's own homeroom owner is never a candidate.
 */
public class KoreanCandidateSelector extends FairnessOrderedSelector {

    @Override
    public Role role() {
        return Role.KOREAN;
    }

    @Override
    public Optional<String> select(SelectionRequest request, GenerationContext context) {
        List<String> candidates = new ArrayList<>(context.configuration().teacherPools().homeroomKoreanPool());
        if (context.configuration().globalOptions().homeroomsIncludedInKorean()) {
            candidates.addAll(context.homerooms().resolvedOwners());
        }
        TeacherRef ownOwner = request.homeroomOwner();
        candidates.removeIf(ownOwner::is);
        return pickLeastLoaded(candidates, request, context);
    }
}
