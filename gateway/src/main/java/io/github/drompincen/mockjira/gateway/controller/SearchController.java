package io.github.drompincen.mockjira.gateway.controller;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.mockjira.gateway.web.AuthGateInterceptor;
import io.github.drompincen.mockjira.protocol.api.PageResponse;
import io.github.drompincen.mockjira.protocol.api.SearchRequest;
import io.github.drompincen.mockjira.protocol.api.SearchResponse;
import io.github.drompincen.mockjira.runtime.auth.AuthenticatedPrincipal;
import io.github.drompincen.mockjira.runtime.query.QueryParser;
import io.github.drompincen.mockjira.runtime.query.QueryPlan;
import io.github.drompincen.mockjira.runtime.query.QuerySyntaxException;
import io.github.drompincen.mockjira.runtime.store.InMemoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

/**
 * Query search. Unsupported query syntax does not fail the call: every item is returned and the
 * fallback is reported in {@code warningMessages}.
 */
@RestController
@RequestMapping("/rest/api/3/search")
public class SearchController {

    private static final Logger log = LoggerFactory.getLogger(SearchController.class);
    private static final int DEFAULT_MAX_RESULTS = 50;

    private final InMemoryStore store;

    public SearchController(InMemoryStore store) {
        this.store = store;
    }

    @GetMapping
    public ResponseEntity<SearchResponse> search(
            @RequestAttribute(AuthGateInterceptor.PRINCIPAL_ATTRIBUTE) AuthenticatedPrincipal principal,
            @RequestParam(required = false) String jql,
            @RequestParam(defaultValue = "0") int startAt,
            @RequestParam(defaultValue = "50") int maxResults,
            @RequestParam(required = false) String expand) {
        boolean changelog = expand != null && expand.contains("changelog");
        return ResponseEntity.ok(run(principal, jql, startAt, maxResults, changelog));
    }

    @PostMapping
    public ResponseEntity<SearchResponse> searchPost(
            @RequestAttribute(AuthGateInterceptor.PRINCIPAL_ATTRIBUTE) AuthenticatedPrincipal principal,
            @RequestBody(required = false) SearchRequest request) {
        SearchRequest body = request != null ? request : new SearchRequest(null, null, null, null, null);
        boolean changelog = body.expand() != null && body.expand().stream().anyMatch(e -> e.contains("changelog"));
        return ResponseEntity.ok(run(principal, body.jql(),
                body.startAt() != null ? body.startAt() : 0,
                body.maxResults() != null ? body.maxResults() : DEFAULT_MAX_RESULTS,
                changelog));
    }

    private SearchResponse run(AuthenticatedPrincipal principal, String jql, int startAt, int maxResults,
                               boolean changelog) {
        List<String> warnings = new ArrayList<>();
        QueryPlan plan;
        try {
            plan = QueryParser.parse(jql);
        } catch (QuerySyntaxException e) {
            log.debug("Unsupported query '{}', returning all issues: {}", jql, e.getMessage());
            warnings.add("The query could not be fully parsed (" + e.getMessage() + "); all issues are returned.");
            plan = QueryPlan.EMPTY;
        }
        List<JsonNode> issues = new ArrayList<>(store.searchIssues(plan, principal.accountId(), changelog));
        return SearchResponse.from(PageResponse.of(issues, startAt, maxResults), warnings);
    }
}
