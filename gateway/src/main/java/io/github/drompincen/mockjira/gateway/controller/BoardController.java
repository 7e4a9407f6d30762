package io.github.drompincen.mockjira.gateway.controller;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.mockjira.gateway.web.AuthGateInterceptor;
import io.github.drompincen.mockjira.protocol.api.MoveIssuesRequest;
import io.github.drompincen.mockjira.protocol.api.PageResponse;
import io.github.drompincen.mockjira.runtime.auth.AuthenticatedPrincipal;
import io.github.drompincen.mockjira.runtime.store.InMemoryStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/rest/agile/1.0")
public class BoardController {

    private final InMemoryStore store;

    public BoardController(InMemoryStore store) {
        this.store = store;
    }

    @GetMapping("/board")
    public ResponseEntity<PageResponse<ObjectNode>> boards(@RequestParam(defaultValue = "0") int startAt,
                                                           @RequestParam(defaultValue = "50") int maxResults) {
        return ResponseEntity.ok(PageResponse.of(store.listBoards(), startAt, maxResults));
    }

    @GetMapping("/board/{boardId}")
    public ResponseEntity<ObjectNode> board(@PathVariable long boardId) {
        return ResponseEntity.ok(store.getBoard(boardId));
    }

    @GetMapping("/board/{boardId}/sprint")
    public ResponseEntity<PageResponse<ObjectNode>> sprints(@PathVariable long boardId,
                                                            @RequestParam(required = false) String state,
                                                            @RequestParam(defaultValue = "0") int startAt,
                                                            @RequestParam(defaultValue = "50") int maxResults) {
        return ResponseEntity.ok(PageResponse.of(store.listSprints(boardId, state), startAt, maxResults));
    }

    @GetMapping("/board/{boardId}/backlog")
    public ResponseEntity<PageResponse<ObjectNode>> backlog(@PathVariable long boardId,
                                                            @RequestParam(defaultValue = "0") int startAt,
                                                            @RequestParam(defaultValue = "50") int maxResults) {
        return ResponseEntity.ok(PageResponse.of(store.backlog(boardId), startAt, maxResults));
    }

    @PostMapping("/backlog/issue")
    public ResponseEntity<Void> moveToBacklog(
            @RequestAttribute(AuthGateInterceptor.PRINCIPAL_ATTRIBUTE) AuthenticatedPrincipal principal,
            @RequestBody MoveIssuesRequest request) {
        store.moveItemsToBacklog(request.issues(), principal.accountId());
        return ResponseEntity.noContent().build();
    }
}
