package io.github.drompincen.mockjira.protocol.api;

import java.util.List;

public record SearchRequest(String jql, Integer startAt, Integer maxResults, List<String> fields, List<String> expand) {}
