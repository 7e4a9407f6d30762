package io.github.drompincen.mockjira.gateway.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.mockjira.protocol.api.PageResponse;
import io.github.drompincen.mockjira.runtime.store.InMemoryStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

@RestController
@RequestMapping("/rest/api/3")
public class MetadataController {

    private final InMemoryStore store;

    public MetadataController(InMemoryStore store) {
        this.store = store;
    }

    @GetMapping("/project")
    public ResponseEntity<PageResponse<ObjectNode>> projects(@RequestParam(defaultValue = "0") int startAt,
                                                             @RequestParam(defaultValue = "50") int maxResults) {
        return ResponseEntity.ok(PageResponse.of(store.listProjects(), startAt, maxResults));
    }

    @GetMapping("/project/{keyOrId}")
    public ResponseEntity<ObjectNode> project(@PathVariable String keyOrId) {
        return ResponseEntity.ok(store.getProject(keyOrId));
    }

    @GetMapping("/issuetype")
    public ResponseEntity<PageResponse<ObjectNode>> issueTypes(@RequestParam(defaultValue = "0") int startAt,
                                                               @RequestParam(defaultValue = "50") int maxResults) {
        return ResponseEntity.ok(PageResponse.of(store.listIssueTypes(), startAt, maxResults));
    }

    @GetMapping("/status")
    public ResponseEntity<PageResponse<ObjectNode>> statuses(@RequestParam(defaultValue = "0") int startAt,
                                                             @RequestParam(defaultValue = "50") int maxResults) {
        return ResponseEntity.ok(PageResponse.of(store.listStatuses(), startAt, maxResults));
    }

    @GetMapping("/field")
    public ResponseEntity<PageResponse<JsonNode>> fields(@RequestParam(defaultValue = "0") int startAt,
                                                         @RequestParam(defaultValue = "50") int maxResults) {
        List<JsonNode> fields = new ArrayList<>();
        store.listFields().forEach(fields::add);
        return ResponseEntity.ok(PageResponse.of(fields, startAt, maxResults));
    }

    @GetMapping("/issueLinkType")
    public ResponseEntity<PageResponse<ObjectNode>> linkTypes(@RequestParam(defaultValue = "0") int startAt,
                                                              @RequestParam(defaultValue = "50") int maxResults) {
        return ResponseEntity.ok(PageResponse.of(store.listLinkTypes(), startAt, maxResults));
    }
}
