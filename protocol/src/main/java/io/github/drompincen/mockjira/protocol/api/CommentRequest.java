package io.github.drompincen.mockjira.protocol.api;

import com.fasterxml.jackson.databind.JsonNode;

public record CommentRequest(JsonNode body) {}
