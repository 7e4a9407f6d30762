package io.github.drompincen.mockjira.gateway.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.mockjira.gateway.web.AuthGateInterceptor;
import io.github.drompincen.mockjira.gateway.web.RequestFields;
import io.github.drompincen.mockjira.protocol.api.CommentRequest;
import io.github.drompincen.mockjira.protocol.api.IssueRequest;
import io.github.drompincen.mockjira.protocol.api.PageResponse;
import io.github.drompincen.mockjira.protocol.api.TransitionRequest;
import io.github.drompincen.mockjira.runtime.auth.AuthenticatedPrincipal;
import io.github.drompincen.mockjira.runtime.error.ValidationException;
import io.github.drompincen.mockjira.runtime.model.Comment;
import io.github.drompincen.mockjira.runtime.model.WorkItem;
import io.github.drompincen.mockjira.runtime.store.InMemoryStore;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Work item CRUD plus the transition and comment sub-resources.
 */
@RestController
@RequestMapping("/rest/api/3/issue")
public class IssueController {

    private static final Set<String> CREATE_FIELDS = Set.of("project", "issuetype", "summary", "description",
            "reporter");

    private final InMemoryStore store;
    private final ObjectMapper objectMapper;

    public IssueController(InMemoryStore store, ObjectMapper objectMapper) {
        this.store = store;
        this.objectMapper = objectMapper;
    }

    @PostMapping
    public ResponseEntity<ObjectNode> create(
            @RequestAttribute(AuthGateInterceptor.PRINCIPAL_ATTRIBUTE) AuthenticatedPrincipal principal,
            @RequestBody IssueRequest request) {
        ObjectNode fields = requireFields(request);
        String reporter = RequestFields.reference(fields.get("reporter"), "accountId", "id");
        Map<String, JsonNode> extras = new LinkedHashMap<>();
        fields.fields().forEachRemaining(e -> {
            if (!CREATE_FIELDS.contains(e.getKey())) {
                extras.put(e.getKey(), e.getValue());
            }
        });
        WorkItem item = store.createWorkItem(
                RequestFields.reference(fields.get("project"), "key", "id"),
                RequestFields.reference(fields.get("issuetype"), "id", "name"),
                RequestFields.text(fields.get("summary")),
                fields.get("description"),
                reporter != null ? reporter : principal.accountId(),
                extras);
        return ResponseEntity.status(HttpStatus.CREATED).body(store.renderIssue(item));
    }

    @GetMapping("/{idOrKey}")
    public ResponseEntity<ObjectNode> get(@PathVariable String idOrKey,
                                          @RequestParam(required = false) String expand) {
        return ResponseEntity.ok(store.getIssue(idOrKey, expand != null && expand.contains("changelog")));
    }

    @PutMapping("/{idOrKey}")
    public ResponseEntity<ObjectNode> update(
            @RequestAttribute(AuthGateInterceptor.PRINCIPAL_ATTRIBUTE) AuthenticatedPrincipal principal,
            @PathVariable String idOrKey,
            @RequestBody IssueRequest request) {
        ObjectNode fields = requireFields(request);
        Map<String, JsonNode> changes = new LinkedHashMap<>();
        fields.fields().forEachRemaining(e -> changes.put(e.getKey(), e.getValue()));
        WorkItem updated = store.updateWorkItem(idOrKey, changes, principal.accountId());
        return ResponseEntity.ok(store.renderIssue(updated));
    }

    @GetMapping("/{idOrKey}/transitions")
    public ResponseEntity<ObjectNode> transitions(@PathVariable String idOrKey) {
        List<ObjectNode> transitions = store.listTransitions(idOrKey);
        ObjectNode body = objectMapper.createObjectNode();
        body.putArray("transitions").addAll(transitions);
        return ResponseEntity.ok(body);
    }

    @PostMapping("/{idOrKey}/transitions")
    public ResponseEntity<ObjectNode> transition(
            @RequestAttribute(AuthGateInterceptor.PRINCIPAL_ATTRIBUTE) AuthenticatedPrincipal principal,
            @PathVariable String idOrKey,
            @RequestBody TransitionRequest request) {
        String transitionId = request.transitionId();
        if (transitionId == null || transitionId.isBlank()) {
            throw ValidationException.field("transition.id", "A transition id is required");
        }
        WorkItem moved = store.applyTransition(idOrKey, transitionId, principal.accountId());
        ObjectNode body = objectMapper.createObjectNode();
        body.set("issue", store.renderIssue(moved));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/{idOrKey}/comment")
    public ResponseEntity<ObjectNode> comments(@PathVariable String idOrKey,
                                               @RequestParam(defaultValue = "0") int startAt,
                                               @RequestParam(defaultValue = "50") int maxResults) {
        PageResponse<ObjectNode> page = PageResponse.of(store.listComments(idOrKey), startAt, maxResults);
        ObjectNode body = objectMapper.valueToTree(page);
        body.set("comments", body.get("values").deepCopy());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/{idOrKey}/comment")
    public ResponseEntity<ObjectNode> addComment(
            @RequestAttribute(AuthGateInterceptor.PRINCIPAL_ATTRIBUTE) AuthenticatedPrincipal principal,
            @PathVariable String idOrKey,
            @RequestBody CommentRequest request) {
        Comment comment = store.addComment(idOrKey, principal.accountId(), request.body());
        return ResponseEntity.status(HttpStatus.CREATED).body(store.renderComment(comment));
    }

    private static ObjectNode requireFields(IssueRequest request) {
        if (request == null || request.fields() == null) {
            throw ValidationException.field("fields", "A fields object is required");
        }
        return request.fields();
    }
}
