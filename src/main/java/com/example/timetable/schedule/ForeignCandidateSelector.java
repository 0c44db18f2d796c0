package com.example.timetable.schedule;

import java.util.Optional;

public class ForeignCandidateSelector extends FairnessOrderedSelector {

    @Override
    public Role role() {
        return Role.FOREIGN;
    }

    @Override
    public Optional<String> select(SelectionRequest request, GenerationContext context) {
        if (request.round() == 4) {
            throw new IllegalStateException("Foreign slots are not scheduled in round 4 (class " + request.classId() + ")");
        }
        return pickLeastLoaded(context.configuration().teacherPools().foreignPool(), request, context);
    }
}
