package io.github.drompincen.mockjira.protocol.api;

import java.util.List;

public record WebhookRegistrationRequest(String url, List<WebhookDetails> webhooks) {

    public record WebhookDetails(String url, List<String> events, String jqlFilter, String jql) {

        public String filter() {
            return jqlFilter != null ? jqlFilter : jql;
        }
    }
}
