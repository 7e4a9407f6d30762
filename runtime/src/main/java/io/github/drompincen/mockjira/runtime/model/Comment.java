package io.github.drompincen.mockjira.runtime.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record Comment(String id, String authorId, JsonNode body, Instant created) {}
