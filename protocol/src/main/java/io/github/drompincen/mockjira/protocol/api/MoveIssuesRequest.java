package io.github.drompincen.mockjira.protocol.api;

import java.util.List;

public record MoveIssuesRequest(List<String> issues) {}
