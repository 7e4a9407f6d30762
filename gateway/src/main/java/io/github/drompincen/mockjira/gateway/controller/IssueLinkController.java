package io.github.drompincen.mockjira.gateway.controller;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.mockjira.gateway.web.AuthGateInterceptor;
import io.github.drompincen.mockjira.protocol.api.IssueLinkRequest;
import io.github.drompincen.mockjira.runtime.auth.AuthenticatedPrincipal;
import io.github.drompincen.mockjira.runtime.error.ValidationException;
import io.github.drompincen.mockjira.runtime.model.IssueLink;
import io.github.drompincen.mockjira.runtime.store.InMemoryStore;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/rest/api/3/issueLink")
public class IssueLinkController {

    private final InMemoryStore store;

    public IssueLinkController(InMemoryStore store) {
        this.store = store;
    }

    @PostMapping
    public ResponseEntity<ObjectNode> create(
            @RequestAttribute(AuthGateInterceptor.PRINCIPAL_ATTRIBUTE) AuthenticatedPrincipal principal,
            @RequestBody IssueLinkRequest request) {
        if (request.type() == null) {
            throw ValidationException.field("type", "A link type is required");
        }
        String type = request.type().name() != null ? request.type().name() : request.type().id();
        IssueLink link = store.createIssueLink(type, issueRef(request.inwardIssue()),
                issueRef(request.outwardIssue()), principal.accountId());
        return ResponseEntity.status(HttpStatus.CREATED).body(store.renderIssueLink(link));
    }

    private static String issueRef(IssueLinkRequest.IssueRef ref) {
        if (ref == null) {
            return null;
        }
        return ref.key() != null ? ref.key() : ref.id();
    }
}
