package io.github.drompincen.mockjira.protocol.event;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WebhookEventTypeTest {

    @Test
    void wireNamesResolve() {
        assertThat(WebhookEventType.fromWire("jira:issue_created")).contains(WebhookEventType.ISSUE_CREATED);
        assertThat(WebhookEventType.fromWire("comment_created")).contains(WebhookEventType.COMMENT_CREATED);
        assertThat(WebhookEventType.fromWire("sprint_updated")).contains(WebhookEventType.SPRINT_UPDATED);
    }

    @Test
    void aliasesResolveCaseInsensitively() {
        assertThat(WebhookEventType.fromWire("item_created")).contains(WebhookEventType.ISSUE_CREATED);
        assertThat(WebhookEventType.fromWire(" Item_Updated ")).contains(WebhookEventType.ISSUE_UPDATED);
    }

    @Test
    void unknownNamesAreEmpty() {
        assertThat(WebhookEventType.fromWire("board_deleted")).isEmpty();
        assertThat(WebhookEventType.fromWire(null)).isEmpty();
    }
}
