package io.github.drompincen.mockjira.runtime.model;

import java.time.Instant;

public record Sprint(
        long id,
        long boardId,
        String name,
        SprintState state,
        Instant startDate,
        Instant endDate,
        Instant completeDate,
        String goal
) {

    public Sprint withState(SprintState newState, Instant now) {
        Instant start = startDate;
        Instant complete = completeDate;
        if (newState == SprintState.ACTIVE && start == null) {
            start = now;
        }
        if (newState == SprintState.CLOSED && complete == null) {
            complete = now;
        }
        return new Sprint(id, boardId, name, newState, start, endDate, complete, goal);
    }

    public Sprint withDetails(String newName, Instant newStart, Instant newEnd, String newGoal) {
        return new Sprint(id, boardId,
                newName != null ? newName : name,
                state,
                newStart != null ? newStart : startDate,
                newEnd != null ? newEnd : endDate,
                completeDate,
                newGoal != null ? newGoal : goal);
    }
}
