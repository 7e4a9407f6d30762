package io.github.drompincen.mockjira.protocol.api;

import java.time.Instant;
import java.util.List;

public record WebhookDto(String id, String url, List<String> events, String jqlFilter, String createdBy, Instant createdAt) {}
