package io.github.drompincen.mockjira.protocol.api;

public record ApprovalDecisionRequest(String decision) {}
