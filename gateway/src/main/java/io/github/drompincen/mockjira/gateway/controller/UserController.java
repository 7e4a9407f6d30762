package io.github.drompincen.mockjira.gateway.controller;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.mockjira.gateway.web.AuthGateInterceptor;
import io.github.drompincen.mockjira.protocol.api.PageResponse;
import io.github.drompincen.mockjira.runtime.auth.AuthenticatedPrincipal;
import io.github.drompincen.mockjira.runtime.store.InMemoryStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/rest/api/3")
public class UserController {

    private final InMemoryStore store;

    public UserController(InMemoryStore store) {
        this.store = store;
    }

    @GetMapping("/myself")
    public ResponseEntity<ObjectNode> myself(
            @RequestAttribute(AuthGateInterceptor.PRINCIPAL_ATTRIBUTE) AuthenticatedPrincipal principal) {
        return ResponseEntity.ok(store.renderUser(principal.accountId()));
    }

    @GetMapping("/user/search")
    public ResponseEntity<PageResponse<ObjectNode>> search(@RequestParam(required = false) String query,
                                                           @RequestParam(defaultValue = "0") int startAt,
                                                           @RequestParam(defaultValue = "50") int maxResults) {
        return ResponseEntity.ok(PageResponse.of(store.searchUsers(query), startAt, maxResults));
    }
}
