package io.github.drompincen.mockjira.protocol.api;

import java.util.List;

public record WebhookRegistrationResponse(List<Result> webhookRegistrationResult) {

    public record Result(String createdWebhookId, List<String> errors) {}
}
