package io.github.drompincen.mockjira.protocol.api;

import java.time.Instant;

public record TraceEntry(
        String requestId,
        String method,
        String path,
        String query,
        int status,
        String principal,
        long durationMs,
        Instant timestamp
) {}
