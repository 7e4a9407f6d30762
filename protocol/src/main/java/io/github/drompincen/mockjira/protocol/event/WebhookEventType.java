package io.github.drompincen.mockjira.protocol.event;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Event types a webhook can subscribe to. The wire name is what appears in registrations and in the
 * {@code webhookEvent} field of delivered payloads.
 */
public enum WebhookEventType {
    ISSUE_CREATED("jira:issue_created", "item_created", "issue_created"),
    ISSUE_UPDATED("jira:issue_updated", "item_updated", "issue_updated"),
    COMMENT_CREATED("comment_created"),
    ISSUELINK_CREATED("issuelink_created"),
    SPRINT_CREATED("sprint_created"),
    SPRINT_UPDATED("sprint_updated");

    private final String wireName;
    private final List<String> aliases;

    WebhookEventType(String wireName, String... aliases) {
        this.wireName = wireName;
        this.aliases = List.of(aliases);
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<WebhookEventType> fromWire(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(normalized) || t.aliases.contains(normalized))
                .findFirst();
    }
}
