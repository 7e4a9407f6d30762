package io.github.drompincen.mockjira.runtime.model;

import java.time.Instant;
import java.util.List;

public record ChangelogEntry(String id, String authorId, Instant created, List<ChangeItem> items) {}
