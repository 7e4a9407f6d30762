package io.github.drompincen.mockjira.runtime.store;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.mockjira.protocol.event.WebhookEventType;
import io.github.drompincen.mockjira.runtime.query.AttributeSet;

import java.time.Instant;

/**
 * A state change published by the store.
 *
 * @param payload    webhook body, already rendered
 * @param attributes flattened fields webhook filters are matched against
 */
public record StoreEvent(
        String eventId,
        WebhookEventType type,
        ObjectNode payload,
        AttributeSet attributes,
        Instant timestamp
) {}
