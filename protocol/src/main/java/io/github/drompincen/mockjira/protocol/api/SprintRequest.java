package io.github.drompincen.mockjira.protocol.api;

/**
 * Create or partial-update body for a sprint. Absent fields are left unchanged on update.
 */
public record SprintRequest(
        String name,
        Long originBoardId,
        String state,
        String startDate,
        String endDate,
        String goal
) {}
