package io.github.drompincen.mockjira.runtime.webhook;

public enum DeliveryOutcome {
    DELIVERED,
    FAILED
}
