package io.github.drompincen.mockjira.gateway.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.mockjira.gateway.web.AuthGateInterceptor;
import io.github.drompincen.mockjira.gateway.web.RequestFields;
import io.github.drompincen.mockjira.protocol.api.ApprovalDecisionRequest;
import io.github.drompincen.mockjira.protocol.api.PageResponse;
import io.github.drompincen.mockjira.protocol.api.ServiceRequestCreate;
import io.github.drompincen.mockjira.runtime.auth.AuthenticatedPrincipal;
import io.github.drompincen.mockjira.runtime.model.ServiceRequest;
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

/**
 * Service desk subset. Listings also accept the {@code start}/{@code limit} paging parameters
 * used by the service desk API.
 */
@RestController
@RequestMapping("/rest/servicedeskapi")
public class ServiceDeskController {

    private final InMemoryStore store;

    public ServiceDeskController(InMemoryStore store) {
        this.store = store;
    }

    @GetMapping("/servicedesk")
    public ResponseEntity<PageResponse<ObjectNode>> serviceDesks(
            @RequestParam(defaultValue = "0") int startAt,
            @RequestParam(defaultValue = "50") int maxResults,
            @RequestParam(required = false) Integer start,
            @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(PageResponse.of(store.listServiceDesks(),
                start != null ? start : startAt, limit != null ? limit : maxResults));
    }

    @GetMapping("/request")
    public ResponseEntity<PageResponse<ObjectNode>> requests(
            @RequestParam(defaultValue = "0") int startAt,
            @RequestParam(defaultValue = "50") int maxResults,
            @RequestParam(required = false) Integer start,
            @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(PageResponse.of(store.listServiceRequests(),
                start != null ? start : startAt, limit != null ? limit : maxResults));
    }

    @PostMapping("/request")
    public ResponseEntity<ObjectNode> create(
            @RequestAttribute(AuthGateInterceptor.PRINCIPAL_ATTRIBUTE) AuthenticatedPrincipal principal,
            @RequestBody ServiceRequestCreate request) {
        ObjectNode values = request.requestFieldValues();
        JsonNode summary = values != null ? values.get("summary") : null;
        JsonNode description = values != null ? values.get("description") : null;
        ServiceRequest created = store.createServiceRequest(request.serviceDeskId(), request.requestTypeId(),
                RequestFields.text(summary), description, principal.accountId());
        return ResponseEntity.status(HttpStatus.CREATED).body(store.renderServiceRequest(created));
    }

    @GetMapping("/request/{requestIdOrKey}")
    public ResponseEntity<ObjectNode> get(@PathVariable String requestIdOrKey) {
        return ResponseEntity.ok(store.getServiceRequest(requestIdOrKey));
    }

    @GetMapping("/request/{requestIdOrKey}/approval")
    public ResponseEntity<PageResponse<ObjectNode>> approvals(@PathVariable String requestIdOrKey,
                                                              @RequestParam(defaultValue = "0") int startAt,
                                                              @RequestParam(defaultValue = "50") int maxResults) {
        return ResponseEntity.ok(PageResponse.of(store.listApprovals(requestIdOrKey), startAt, maxResults));
    }

    @PostMapping("/request/{requestIdOrKey}/approval/{approvalId}")
    public ResponseEntity<ObjectNode> decide(
            @RequestAttribute(AuthGateInterceptor.PRINCIPAL_ATTRIBUTE) AuthenticatedPrincipal principal,
            @PathVariable String requestIdOrKey,
            @PathVariable String approvalId,
            @RequestBody ApprovalDecisionRequest request) {
        ServiceRequest updated = store.decideApproval(requestIdOrKey, approvalId, request.decision(),
                principal.accountId());
        return ResponseEntity.ok(store.renderServiceRequest(updated));
    }
}
