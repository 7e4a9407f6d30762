package io.github.drompincen.mockjira.protocol.api;

public record IssueLinkRequest(LinkTypeRef type, IssueRef inwardIssue, IssueRef outwardIssue) {

    public record LinkTypeRef(String id, String name) {}

    public record IssueRef(String id, String key) {}
}
