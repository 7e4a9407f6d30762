package io.github.drompincen.mockjira.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.mockjira.gateway.config.JacksonConfig;
import io.github.drompincen.mockjira.gateway.controller.BoardController;
import io.github.drompincen.mockjira.gateway.controller.IssueController;
import io.github.drompincen.mockjira.gateway.controller.IssueLinkController;
import io.github.drompincen.mockjira.gateway.controller.MetadataController;
import io.github.drompincen.mockjira.gateway.controller.MockAdminController;
import io.github.drompincen.mockjira.gateway.controller.SearchController;
import io.github.drompincen.mockjira.gateway.controller.ServiceDeskController;
import io.github.drompincen.mockjira.gateway.controller.SprintController;
import io.github.drompincen.mockjira.gateway.controller.UserController;
import io.github.drompincen.mockjira.gateway.controller.WebhookController;
import io.github.drompincen.mockjira.gateway.controller.WebhookInspectionController;
import io.github.drompincen.mockjira.gateway.web.ApiExceptionHandler;
import io.github.drompincen.mockjira.gateway.web.AuthGateInterceptor;
import io.github.drompincen.mockjira.gateway.web.RequestTraceFilter;
import io.github.drompincen.mockjira.gateway.web.RequestTraceLog;
import io.github.drompincen.mockjira.runtime.auth.AuthGate;
import io.github.drompincen.mockjira.runtime.auth.CostWindowRateLimiter;
import io.github.drompincen.mockjira.runtime.auth.RateLimitSettings;
import io.github.drompincen.mockjira.runtime.seed.DefaultSeed;
import io.github.drompincen.mockjira.runtime.seed.SeedGenerator;
import io.github.drompincen.mockjira.runtime.store.InMemoryStore;
import io.github.drompincen.mockjira.runtime.webhook.WebhookDispatcher;
import io.github.drompincen.mockjira.runtime.webhook.WebhookSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Drives the routers over HTTP semantics with the real store, gate, limiter and dispatcher.
 */
class MockJiraFlowTest {

    private static final String ALICE = "Bearer " + DefaultSeed.MOCK_TOKEN;
    private static final String CAROL = "Bearer " + DefaultSeed.READ_ONLY_TOKEN;

    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);
    private final ObjectMapper mapper = JacksonConfig.mockJiraMapper();
    private final List<String> sentUrls = new CopyOnWriteArrayList<>();

    private InMemoryStore store;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        store = new InMemoryStore(mapper, clock);
        store.importState(DefaultSeed.snapshot(clock));
        CostWindowRateLimiter limiter = new CostWindowRateLimiter(RateLimitSettings.defaults(), clock);
        AuthGate gate = new AuthGate(store, limiter);
        WebhookSettings webhookSettings = new WebhookSettings("secret", "2", true, Duration.ZERO, Duration.ZERO,
                0.0, Duration.ofMillis(500), 100, 1000, 7L);
        WebhookDispatcher dispatcher = new WebhookDispatcher(store, (url, headers, body, timeout) -> {
            sentUrls.add(url);
            return 200;
        }, webhookSettings, mapper, clock, Runnable::run);
        dispatcher.attach();
        RequestTraceLog traceLog = new RequestTraceLog(50);

        mvc = MockMvcBuilders.standaloneSetup(
                        new MetadataController(store),
                        new UserController(store),
                        new IssueController(store, mapper),
                        new SearchController(store),
                        new IssueLinkController(store),
                        new BoardController(store),
                        new SprintController(store),
                        new ServiceDeskController(store),
                        new WebhookController(store),
                        new WebhookInspectionController(dispatcher),
                        new MockAdminController(store, limiter, dispatcher, new SeedGenerator(clock), traceLog,
                                clock, "test"))
                .setControllerAdvice(new ApiExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(mapper))
                .addMappedInterceptors(new String[]{"/rest/**", "/_mock/webhooks/**"}, new AuthGateInterceptor(gate))
                .addFilters(new RequestTraceFilter(traceLog, clock))
                .build();
    }

    private JsonNode json(MvcResult result) throws Exception {
        return mapper.readTree(result.getResponse().getContentAsString());
    }

    @Test
    void missingTokenIsRejectedWithEnvelope() throws Exception {
        mvc.perform(get("/rest/api/3/myself"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.errorMessages[0]").value("Missing bearer token"));
        mvc.perform(get("/rest/api/3/myself").header("Authorization", "Bearer nope"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void myselfCarriesRateLimitHeaders() throws Exception {
        mvc.perform(get("/rest/api/3/myself").header("Authorization", ALICE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accountId").value(DefaultSeed.ALICE))
                .andExpect(header().string("X-RateLimit-Limit", "100"))
                .andExpect(header().string("X-RateLimit-Remaining", "99"));
    }

    @Test
    void operatorEndpointsAreNotGated() throws Exception {
        mvc.perform(get("/_mock/health")).andExpect(status().isOk()).andExpect(jsonPath("$.status").value("ok"));
        mvc.perform(get("/_mock/info"))
                .andExpect(jsonPath("$.seed.issues").value(4))
                .andExpect(jsonPath("$.webhookSignature.version").value("2"));
        mvc.perform(get("/_mock/webhooks/deliveries")).andExpect(status().isUnauthorized());
    }

    @Test
    void createFetchAndUpdateIssue() throws Exception {
        String body = """
                {"fields": {"project": {"key": "DEV"}, "issuetype": {"id": "10001"},
                            "summary": "Add audit log", "description": "Track admin actions", "labels": ["audit"]}}
                """;
        mvc.perform(post("/rest/api/3/issue").header("Authorization", ALICE)
                        .contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.key").value("DEV-4"))
                .andExpect(jsonPath("$.fields.summary").value("Add audit log"))
                .andExpect(jsonPath("$.fields.description.type").value("doc"));

        mvc.perform(put("/rest/api/3/issue/DEV-4").header("Authorization", ALICE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fields\": {\"assignee\": {\"accountId\": \"" + DefaultSeed.BOB + "\"}}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.fields.assignee.accountId").value(DefaultSeed.BOB));

        MvcResult fetched = mvc.perform(get("/rest/api/3/issue/DEV-4").param("expand", "changelog")
                        .header("Authorization", ALICE))
                .andExpect(status().isOk())
                .andReturn();
        assertThat(json(fetched).path("changelog").path("histories")).hasSize(1);
    }

    @Test
    void createWithoutSummaryReportsFieldError() throws Exception {
        mvc.perform(post("/rest/api/3/issue").header("Authorization", ALICE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fields\": {\"project\": {\"key\": \"DEV\"}}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors.summary").exists());
    }

    @Test
    void malformedJsonIsABadRequest() throws Exception {
        mvc.perform(post("/rest/api/3/issue").header("Authorization", ALICE)
                        .contentType(MediaType.APPLICATION_JSON).content("{\"fields\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorMessages[0]").value("Request body is not valid JSON"));
    }

    @Test
    void unknownIssueIs404() throws Exception {
        mvc.perform(get("/rest/api/3/issue/DEV-999").header("Authorization", ALICE))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorMessages").isArray());
    }

    @Test
    void transitionOnlyFromCurrentStatus() throws Exception {
        mvc.perform(get("/rest/api/3/issue/DEV-2/transitions").header("Authorization", ALICE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.transitions[0].id").value("11"));

        String move = "{\"transition\": {\"id\": \"11\"}}";
        mvc.perform(post("/rest/api/3/issue/DEV-2/transitions").header("Authorization", ALICE)
                        .contentType(MediaType.APPLICATION_JSON).content(move))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.issue.fields.status.id").value(DefaultSeed.STATUS_IN_PROGRESS));
        mvc.perform(post("/rest/api/3/issue/DEV-2/transitions").header("Authorization", ALICE)
                        .contentType(MediaType.APPLICATION_JSON).content(move))
                .andExpect(status().isConflict());
    }

    @Test
    void commentsAreCreatedAndListed() throws Exception {
        mvc.perform(post("/rest/api/3/issue/DEV-3/comment").header("Authorization", ALICE)
                        .contentType(MediaType.APPLICATION_JSON).content("{\"body\": \"Looks good\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.author.accountId").value(DefaultSeed.ALICE));

        mvc.perform(get("/rest/api/3/issue/DEV-3/comment").header("Authorization", ALICE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.comments[0].body.type").value("doc"));
    }

    @Test
    void searchFiltersAndWarnsOnUnsupportedSyntax() throws Exception {
        mvc.perform(get("/rest/api/3/search").param("jql", "project = DEV AND status = \"To Do\"")
                        .header("Authorization", ALICE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(2))
                .andExpect(jsonPath("$.warningMessages").doesNotExist());

        mvc.perform(post("/rest/api/3/search").header("Authorization", ALICE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"jql\": \"project = DEV OR project = SUP\", \"maxResults\": 2}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(4))
                .andExpect(jsonPath("$.issues.length()").value(2))
                .andExpect(jsonPath("$.isLast").value(false))
                .andExpect(jsonPath("$.warningMessages[0]").exists());
    }

    @Test
    void readOnlyTokenCannotWriteButCanSearch() throws Exception {
        mvc.perform(post("/rest/api/3/issue/DEV-1/comment").header("Authorization", CAROL)
                        .contentType(MediaType.APPLICATION_JSON).content("{\"body\": \"hi\"}"))
                .andExpect(status().isForbidden());
        mvc.perform(post("/rest/api/3/search").header("Authorization", CAROL)
                        .contentType(MediaType.APPLICATION_JSON).content("{\"jql\": \"project = DEV\"}"))
                .andExpect(status().isOk());
    }

    @Test
    void forcedRateLimit() throws Exception {
        mvc.perform(get("/rest/api/3/project").header("Authorization", ALICE).header("X-Force-429", "1"))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "5"));
    }

    @Test
    void fiftyWritesThenRejected() throws Exception {
        for (int i = 0; i < 50; i++) {
            mvc.perform(post("/rest/api/3/issue/DEV-1/comment").header("Authorization", ALICE)
                            .contentType(MediaType.APPLICATION_JSON).content("{\"body\": \"note " + i + "\"}"))
                    .andExpect(status().isCreated());
        }
        MvcResult rejected = mvc.perform(post("/rest/api/3/issue/DEV-1/comment").header("Authorization", ALICE)
                        .contentType(MediaType.APPLICATION_JSON).content("{\"body\": \"one too many\"}"))
                .andExpect(status().isTooManyRequests())
                .andReturn();
        assertThat(Long.parseLong(rejected.getResponse().getHeader("Retry-After"))).isPositive();
    }

    @Test
    void webhookDeliveredForMatchingEventOnly() throws Exception {
        String registration = """
                {"url": "http://hooks.test/jira",
                 "webhooks": [{"events": ["jira:issue_created"], "jqlFilter": "project = SUP"}]}
                """;
        mvc.perform(post("/rest/api/3/webhook").header("Authorization", ALICE)
                        .contentType(MediaType.APPLICATION_JSON).content(registration))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.webhookRegistrationResult[0].createdWebhookId").exists());

        mvc.perform(post("/rest/api/3/issue").header("Authorization", ALICE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fields\": {\"project\": {\"key\": \"DEV\"}, \"summary\": \"not watched\"}}"))
                .andExpect(status().isCreated());
        mvc.perform(post("/rest/servicedeskapi/request").header("Authorization", ALICE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"serviceDeskId\": \"10001\", \"requestFieldValues\": {\"summary\": \"VPN access\"}}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.issueKey").value("SUP-2"));

        assertThat(sentUrls).containsExactly("http://hooks.test/jira");
        mvc.perform(get("/_mock/webhooks/deliveries").header("Authorization", ALICE))
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.values[0].outcome").value("DELIVERED"))
                .andExpect(jsonPath("$.values[0].eventType").value("jira:issue_created"));
        mvc.perform(get("/_mock/webhooks/logs").header("Authorization", ALICE))
                .andExpect(jsonPath("$.values[0].statusCode").value(200));
    }

    @Test
    void webhookWithInvalidFilterIsRejectedAndListEmpty() throws Exception {
        mvc.perform(post("/rest/api/3/webhook").header("Authorization", ALICE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\": \"http://hooks.test\", \"webhooks\": [{\"events\": [\"jira:issue_created\"],"
                                + " \"jqlFilter\": \"project = DEV OR project = SUP\"}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors['webhooks[0].jqlFilter']").exists());
        mvc.perform(get("/rest/api/3/webhook").header("Authorization", ALICE))
                .andExpect(jsonPath("$.total").value(0));
        mvc.perform(delete("/rest/api/3/webhook/40000").header("Authorization", ALICE))
                .andExpect(status().isNotFound());
    }

    @Test
    void sprintLifecycleAndMove() throws Exception {
        MvcResult created = mvc.perform(post("/rest/agile/1.0/sprint").header("Authorization", ALICE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Hardening\", \"originBoardId\": 1,"
                                + " \"startDate\": \"2024-05-06T09:00:00Z\", \"endDate\": \"2024-05-20T17:00:00Z\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.state").value("future"))
                .andReturn();
        long sprintId = json(created).get("id").asLong();

        mvc.perform(post("/rest/agile/1.0/sprint/" + sprintId + "/issue").header("Authorization", ALICE)
                        .contentType(MediaType.APPLICATION_JSON).content("{\"issues\": [\"DEV-3\"]}"))
                .andExpect(status().isNoContent());
        mvc.perform(get("/rest/agile/1.0/sprint/" + sprintId + "/issue").header("Authorization", ALICE))
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.values[0].key").value("DEV-3"));

        mvc.perform(post("/rest/agile/1.0/sprint/" + sprintId).header("Authorization", ALICE)
                        .contentType(MediaType.APPLICATION_JSON).content("{\"state\": \"closed\"}"))
                .andExpect(status().isConflict());
        mvc.perform(post("/rest/agile/1.0/sprint/" + sprintId).header("Authorization", ALICE)
                        .contentType(MediaType.APPLICATION_JSON).content("{\"state\": \"active\", \"goal\": \"Ship\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("active"))
                .andExpect(jsonPath("$.goal").value("Ship"));
        mvc.perform(post("/rest/agile/1.0/sprint/" + sprintId).header("Authorization", ALICE)
                        .contentType(MediaType.APPLICATION_JSON).content("{\"state\": \"closed\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("closed"));
    }

    @Test
    void invalidSprintDateIsABadRequest() throws Exception {
        mvc.perform(post("/rest/agile/1.0/sprint").header("Authorization", ALICE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"x\", \"originBoardId\": 1, \"startDate\": \"next monday\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors.startDate").exists());
    }

    @Test
    void nonNumericBoardIdIsABadRequest() throws Exception {
        mvc.perform(get("/rest/agile/1.0/board/abc").header("Authorization", ALICE))
                .andExpect(status().isBadRequest());
    }

    @Test
    void approvalsMoveTheRequestAndCannotRepeat() throws Exception {
        mvc.perform(post("/rest/servicedeskapi/request/30000/approval/1").header("Authorization", ALICE)
                        .contentType(MediaType.APPLICATION_JSON).content("{\"decision\": \"approve\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.approvals[0].decision").value("approved"))
                .andExpect(jsonPath("$.currentStatus.statusCategory").value("done"));
        mvc.perform(post("/rest/servicedeskapi/request/30000/approval/1").header("Authorization", ALICE)
                        .contentType(MediaType.APPLICATION_JSON).content("{\"decision\": \"decline\"}"))
                .andExpect(status().isConflict());
        mvc.perform(get("/rest/servicedeskapi/request/30000/approval").header("Authorization", ALICE))
                .andExpect(jsonPath("$.total").value(1));
    }

    @Test
    void issueLinkIsCreated() throws Exception {
        mvc.perform(post("/rest/api/3/issueLink").header("Authorization", ALICE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\": {\"name\": \"Blocks\"}, \"inwardIssue\": {\"key\": \"DEV-1\"},"
                                + " \"outwardIssue\": {\"key\": \"DEV-2\"}}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.type.name").value("Blocks"))
                .andExpect(jsonPath("$.outwardIssue.key").value("DEV-2"));
        mvc.perform(get("/rest/api/3/issue/DEV-2").header("Authorization", ALICE))
                .andExpect(jsonPath("$.fields.issuelinks[0].inwardIssue.key").value("DEV-1"));
    }

    @Test
    void exportResetAndImportRoundTrip() throws Exception {
        MvcResult exported = mvc.perform(get("/_mock/seed/export")).andExpect(status().isOk()).andReturn();
        String snapshot = exported.getResponse().getContentAsString();

        mvc.perform(post("/_mock/reset"))
                .andExpect(jsonPath("$.counts.issues").value(0));
        mvc.perform(get("/rest/api/3/myself").header("Authorization", ALICE))
                .andExpect(status().isUnauthorized());

        mvc.perform(post("/_mock/seed/import").contentType(MediaType.APPLICATION_JSON).content(snapshot))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("imported"))
                .andExpect(jsonPath("$.counts.issues").value(4));
        MvcResult again = mvc.perform(get("/_mock/seed/export")).andReturn();
        assertThat(json(again)).isEqualTo(json(exported));
    }

    @Test
    void requestIdIsEchoedAndTraced() throws Exception {
        mvc.perform(get("/rest/api/3/project").header("Authorization", ALICE).header("X-Request-Id", "trace-me"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Request-Id", "trace-me"));

        mvc.perform(get("/_mock/trace/trace-me"))
                .andExpect(jsonPath("$.entries[0].path").value("/rest/api/3/project"))
                .andExpect(jsonPath("$.entries[0].status").value(200))
                .andExpect(jsonPath("$.entries[0].principal").value(DefaultSeed.ALICE));
    }

    @Test
    void listsUseThePageEnvelope() throws Exception {
        mvc.perform(get("/rest/api/3/project").header("Authorization", ALICE))
                .andExpect(jsonPath("$.total").value(2))
                .andExpect(jsonPath("$.isLast").value(true))
                .andExpect(jsonPath("$.values[0].key").exists());
        mvc.perform(get("/rest/agile/1.0/board/1/sprint").param("state", "active").header("Authorization", ALICE))
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.values[0].state").value("active"));
        mvc.perform(get("/rest/servicedeskapi/servicedesk").header("Authorization", ALICE))
                .andExpect(jsonPath("$.values[0].projectKey").value("SUP"));
        mvc.perform(get("/rest/api/3/user/search").param("query", "bob").header("Authorization", ALICE))
                .andExpect(jsonPath("$.values[0].accountId").value(DefaultSeed.BOB));
    }
}
