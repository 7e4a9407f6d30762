package io.github.drompincen.mockjira.protocol.api;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Body of issue create and edit calls: {@code {"fields": {...}}}.
 */
public record IssueRequest(ObjectNode fields) {}
