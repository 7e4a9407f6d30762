package io.github.drompincen.mockjira.protocol.api;

import java.util.Map;

public record ImportResult(String status, Map<String, Integer> counts) {}
