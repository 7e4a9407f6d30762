package io.github.drompincen.mockjira.runtime.store;

import java.util.List;

/**
 * One entry of a webhook registration request.
 */
public record WebhookSpec(String url, List<String> events, String jqlFilter) {}
