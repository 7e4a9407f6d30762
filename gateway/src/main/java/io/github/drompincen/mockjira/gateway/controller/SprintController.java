package io.github.drompincen.mockjira.gateway.controller;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.mockjira.gateway.web.AuthGateInterceptor;
import io.github.drompincen.mockjira.protocol.api.MoveIssuesRequest;
import io.github.drompincen.mockjira.protocol.api.PageResponse;
import io.github.drompincen.mockjira.protocol.api.SprintRequest;
import io.github.drompincen.mockjira.runtime.auth.AuthenticatedPrincipal;
import io.github.drompincen.mockjira.runtime.error.ValidationException;
import io.github.drompincen.mockjira.runtime.model.Sprint;
import io.github.drompincen.mockjira.runtime.store.InMemoryStore;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

@RestController
@RequestMapping("/rest/agile/1.0/sprint")
public class SprintController {

    private final InMemoryStore store;

    public SprintController(InMemoryStore store) {
        this.store = store;
    }

    @PostMapping
    public ResponseEntity<ObjectNode> create(@RequestBody SprintRequest request) {
        Sprint sprint = store.createSprint(request.name(), request.originBoardId(), request.state(),
                instant("startDate", request.startDate()), instant("endDate", request.endDate()), request.goal());
        return ResponseEntity.status(HttpStatus.CREATED).body(store.renderSprint(sprint));
    }

    @GetMapping("/{sprintId}")
    public ResponseEntity<ObjectNode> get(@PathVariable long sprintId) {
        return ResponseEntity.ok(store.getSprint(sprintId));
    }

    /**
     * Partial update; fields missing from the body are left unchanged.
     */
    @PostMapping("/{sprintId}")
    public ResponseEntity<ObjectNode> update(@PathVariable long sprintId, @RequestBody SprintRequest request) {
        Sprint sprint = store.updateSprint(sprintId, request.name(), request.state(),
                instant("startDate", request.startDate()), instant("endDate", request.endDate()), request.goal());
        return ResponseEntity.ok(store.renderSprint(sprint));
    }

    @GetMapping("/{sprintId}/issue")
    public ResponseEntity<PageResponse<ObjectNode>> issues(@PathVariable long sprintId,
                                                           @RequestParam(defaultValue = "0") int startAt,
                                                           @RequestParam(defaultValue = "50") int maxResults) {
        return ResponseEntity.ok(PageResponse.of(store.sprintIssues(sprintId), startAt, maxResults));
    }

    @PostMapping("/{sprintId}/issue")
    public ResponseEntity<Void> moveIssues(
            @RequestAttribute(AuthGateInterceptor.PRINCIPAL_ATTRIBUTE) AuthenticatedPrincipal principal,
            @PathVariable long sprintId,
            @RequestBody MoveIssuesRequest request) {
        store.moveItemsToSprint(sprintId, request.issues(), principal.accountId());
        return ResponseEntity.noContent().build();
    }

    static Instant instant(String field, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            throw ValidationException.field(field, "Invalid date '" + value + "', expected ISO-8601");
        }
    }
}
