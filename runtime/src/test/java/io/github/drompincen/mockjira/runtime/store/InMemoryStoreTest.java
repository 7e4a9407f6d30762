package io.github.drompincen.mockjira.runtime.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.github.drompincen.mockjira.protocol.event.WebhookEventType;
import io.github.drompincen.mockjira.runtime.MutableClock;
import io.github.drompincen.mockjira.runtime.error.ConflictException;
import io.github.drompincen.mockjira.runtime.error.NotFoundException;
import io.github.drompincen.mockjira.runtime.error.ValidationException;
import io.github.drompincen.mockjira.runtime.model.ServiceRequest;
import io.github.drompincen.mockjira.runtime.model.Sprint;
import io.github.drompincen.mockjira.runtime.model.SprintState;
import io.github.drompincen.mockjira.runtime.model.User;
import io.github.drompincen.mockjira.runtime.model.WorkItem;
import io.github.drompincen.mockjira.runtime.query.QueryParser;
import io.github.drompincen.mockjira.runtime.seed.DefaultSeed;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.github.drompincen.mockjira.runtime.seed.DefaultSeed.ALICE;
import static io.github.drompincen.mockjira.runtime.seed.DefaultSeed.BOB;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class InMemoryStoreTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private MutableClock clock;
    private InMemoryStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-05-01T10:00:00Z");
        store = new InMemoryStore(objectMapper, clock);
        store.importState(DefaultSeed.snapshot(clock));
    }

    @Test
    void createdKeysAreSequentialAndUnique() {
        Set<String> keys = new HashSet<>();
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 5; i++) {
            WorkItem item = store.createWorkItem("DEV", "Bug", "Item " + i, null, ALICE, Map.of());
            keys.add(item.key());
            ids.add(item.id());
        }

        assertThat(keys).containsExactlyInAnyOrder("DEV-4", "DEV-5", "DEV-6", "DEV-7", "DEV-8");
        assertThat(ids).hasSize(5);
    }

    @Test
    void createAcceptsProjectIdAndDefaultsTypeToTask() {
        WorkItem item = store.createWorkItem("10000", null, "  Padded  ", TextNode.valueOf("Hello"), ALICE, Map.of());

        assertThat(item.projectKey()).isEqualTo("DEV");
        assertThat(item.issueTypeId()).isEqualTo(DefaultSeed.TYPE_TASK);
        assertThat(item.summary()).isEqualTo("Padded");
        assertThat(item.statusId()).isEqualTo(DefaultSeed.STATUS_TO_DO);
        assertThat(item.description().path("type").asText()).isEqualTo("doc");
    }

    @Test
    void createReportsEveryInvalidField() {
        ValidationException e = catchThrowableOfType(() -> store.createWorkItem("NOPE", "Epic", " ", null, "ghost",
                Map.of("labels", TextNode.valueOf("not-an-array"))), ValidationException.class);

        assertThat(e.getFieldErrors()).containsKeys("project", "issuetype", "summary", "reporter", "labels");
        assertThat(store.counts()).containsEntry("issues", 4);
    }

    @Test
    void createKeepsCustomFieldsAndSprint() {
        ObjectNode points = objectMapper.createObjectNode().put("value", 5);
        WorkItem item = store.createWorkItem("DEV", "Story", "Sprinted", null, ALICE,
                Map.of("customfield_10020", objectMapper.valueToTree(2), "customfield_10016", points));

        assertThat(item.sprintId()).isEqualTo(2L);
        assertThat(item.customFields()).containsKey("customfield_10016");
        assertThat(store.getIssue(item.key(), false).path("fields").path("customfield_10020").get(0).path("name")
                .asText()).isEqualTo("Sprint 2");
    }

    @Test
    void createRejectsClosedSprint() {
        assertThatThrownBy(() -> store.createWorkItem("DEV", "Story", "Late", null, ALICE,
                Map.of("customfield_10020", objectMapper.valueToTree(1))))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void createInServiceDeskRecordsRequest() {
        WorkItem item = store.createWorkItem("SUP", "Service Request", "Printer on fire", null, BOB, Map.of());

        ObjectNode request = store.getServiceRequest(item.key());

        assertThat(request.path("issueKey").asText()).isEqualTo(item.key());
        assertThat(store.counts()).containsEntry("requests", 2);
    }

    @Test
    void updateRecordsAssigneeChangeInChangelog() {
        clock.advance(Duration.ofMinutes(5));

        WorkItem updated = store.updateWorkItem("DEV-3", Map.of("assignee", TextNode.valueOf(BOB)), ALICE);

        assertThat(updated.assigneeId()).isEqualTo(BOB);
        assertThat(updated.updated()).isAfter(updated.created());
        assertThat(updated.changelog()).hasSize(1);
        assertThat(updated.changelog().get(0).items().get(0).toDisplay()).isEqualTo("Bob Smith");
    }

    @Test
    void updateRefusesStatusChange() {
        ValidationException e = catchThrowableOfType(
                () -> store.updateWorkItem("DEV-1", Map.of("status", TextNode.valueOf("4")), ALICE),
                ValidationException.class);

        assertThat(e.getFieldErrors()).containsKey("status");
    }

    @Test
    void transitionOfferedFromCurrentStatusMovesItem() {
        assertThat(store.listTransitions("DEV-2")).extracting(t -> t.path("id").asText()).containsExactly("11");

        WorkItem moved = store.applyTransition("DEV-2", "11", ALICE);

        assertThat(moved.statusId()).isEqualTo(DefaultSeed.STATUS_IN_PROGRESS);
        assertThat(moved.changelog().get(0).items().get(0).field()).isEqualTo("status");
        assertThat(store.listTransitions("DEV-2")).extracting(t -> t.path("id").asText())
                .containsExactly("21", "31");
    }

    @Test
    void transitionNotOfferedIsConflict() {
        assertThatThrownBy(() -> store.applyTransition("DEV-2", "21", ALICE)).isInstanceOf(ConflictException.class);
        assertThat(store.getWorkItem("DEV-2").statusId()).isEqualTo(DefaultSeed.STATUS_TO_DO);
    }

    @Test
    void transitionWithoutIdIsValidationError() {
        ValidationException e = catchThrowableOfType(() -> store.applyTransition("DEV-2", null, ALICE),
                ValidationException.class);

        assertThat(e.getFieldErrors()).containsKey("transition.id");
    }

    @Test
    void unknownItemIsNotFound() {
        assertThatThrownBy(() -> store.getIssue("DEV-99", false))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining("DEV-99");
    }

    @Test
    void blankCommentIsRejected() {
        assertThatThrownBy(() -> store.addComment("DEV-1", ALICE, TextNode.valueOf("   ")))
                .isInstanceOf(ValidationException.class);

        store.addComment("DEV-1", ALICE, TextNode.valueOf("Looks good"));

        assertThat(store.listComments("DEV-1")).hasSize(1);
    }

    @Test
    void issueLinkIsRecordedOnBothItems() {
        store.createIssueLink("Blocks", "DEV-1", "DEV-2", ALICE);

        assertThat(store.getWorkItem("DEV-1").links()).hasSize(1);
        assertThat(store.getWorkItem("DEV-2").links()).hasSize(1);
        assertThatThrownBy(() -> store.createIssueLink("Blocks", "DEV-1", "DEV-1", ALICE))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void searchAppliesFiltersAndOrdering() {
        clock.advance(Duration.ofMinutes(1));
        WorkItem second = store.createWorkItem("SUP", null, "Second", null, BOB, Map.of());
        clock.advance(Duration.ofMinutes(1));
        store.applyTransition("SUP-1", "11", BOB);
        store.applyTransition("SUP-1", "21", BOB);
        clock.advance(Duration.ofMinutes(1));
        store.updateWorkItem(second.key(), Map.of("summary", TextNode.valueOf("Second, edited")), BOB);

        List<WorkItem> found = store.searchWorkItems(
                QueryParser.parse("project = SUP AND status IN (\"To Do\", \"Done\") ORDER BY updated DESC"), ALICE);

        assertThat(found).extracting(WorkItem::key).containsExactly(second.key(), "SUP-1");
    }

    @Test
    void searchResolvesCurrentUser() {
        List<WorkItem> mine = store.searchWorkItems(QueryParser.parse("assignee = currentUser()"), ALICE);

        assertThat(mine).extracting(WorkItem::key).containsExactly("DEV-2");
    }

    @Test
    void defaultOrderIsCreationThenKeyNumber() {
        List<WorkItem> all = store.searchWorkItems(QueryParser.parse("project = DEV"), ALICE);

        assertThat(all).extracting(WorkItem::key).containsExactly("DEV-1", "DEV-2", "DEV-3");
    }

    @Test
    void approvalMovesRequestToDoneAndRejectsDuplicates() {
        ServiceRequest request = store.decideApproval("SUP-1", "1", "approve", BOB);

        assertThat(request.approvals()).hasSize(1);
        assertThat(store.getWorkItem("SUP-1").statusId()).isEqualTo(DefaultSeed.STATUS_DONE);
        assertThatThrownBy(() -> store.decideApproval("SUP-1", "1", "decline", BOB))
                .isInstanceOf(ConflictException.class);
        assertThatThrownBy(() -> store.decideApproval("SUP-1", "2", "maybe", BOB))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void declineMovesRequestInProgress() {
        store.decideApproval("30000", "7", "declined", BOB);

        assertThat(store.getWorkItem("SUP-1").statusId()).isEqualTo(DefaultSeed.STATUS_IN_PROGRESS);
    }

    @Test
    void sprintStateOnlyMovesForward() {
        Sprint started = store.updateSprint(3, null, "active", null, null, null);

        assertThat(started.state()).isEqualTo(SprintState.ACTIVE);
        assertThatThrownBy(() -> store.updateSprint(1, null, "active", null, null, null))
                .isInstanceOf(ConflictException.class);
        assertThatThrownBy(() -> store.updateSprint(2, null, "sleeping", null, null, null))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void closingSprintStampsCompleteDate() {
        clock.advance(Duration.ofHours(2));

        Sprint closed = store.updateSprint(2, null, "closed", null, null, null);

        assertThat(closed.completeDate()).isEqualTo(clock.instant());
    }

    @Test
    void createdSprintContinuesSequence() {
        Sprint sprint = store.createSprint(null, 1L, null, null, null, "Ship it");

        assertThat(sprint.id()).isEqualTo(4L);
        assertThat(sprint.name()).isEqualTo("Sprint 4");
        assertThat(sprint.state()).isEqualTo(SprintState.FUTURE);
        assertThatThrownBy(() -> store.createSprint("x", 99L, null, null, null, null))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void movingItemsBetweenSprintAndBacklog() {
        store.moveItemsToSprint(3, List.of("DEV-2", "DEV-3"), ALICE);

        assertThat(store.sprintIssues(3)).hasSize(2);
        assertThat(store.backlog(1)).isEmpty();
        assertThatThrownBy(() -> store.moveItemsToSprint(1, List.of("DEV-2"), ALICE))
                .isInstanceOf(ConflictException.class);

        store.moveItemsToBacklog(List.of("DEV-2"), ALICE);

        assertThat(store.backlog(1)).extracting(n -> n.path("key").asText()).containsExactly("DEV-2");
    }

    @Test
    void listSprintsFiltersByState() {
        assertThat(store.listSprints(1, "active,future")).hasSize(2);
        assertThat(store.listSprints(1, null)).hasSize(3);
        assertThatThrownBy(() -> store.listSprints(42, null)).isInstanceOf(NotFoundException.class);
    }

    @Test
    void exportThenImportRestoresStateAndCounters() {
        StoreSnapshot exported = store.exportState();
        store.createWorkItem("DEV", "Bug", "Transient", null, ALICE, Map.of());
        store.registerWebhook("http://localhost:9/hook", List.of("jira:issue_created"), null, ALICE);

        store.importState(exported);

        assertThat(store.exportState()).isEqualTo(exported);
        assertThat(store.listWebhooks()).isEmpty();
        assertThat(store.createWorkItem("DEV", "Bug", "Again", null, ALICE, Map.of()).key()).isEqualTo("DEV-4");
    }

    @Test
    void inconsistentImportLeavesStoreUntouched() {
        StoreSnapshot good = store.exportState();
        List<User> users = new ArrayList<>(good.users());
        users.removeIf(u -> u.accountId().equals(BOB));
        StoreSnapshot broken = new StoreSnapshot(users, good.tokens(), good.statusCategories(), good.statuses(),
                good.transitions(), good.issueTypes(), good.linkTypes(), good.projects(), good.boards(),
                good.sprints(), good.items(), good.serviceRequests(), good.webhooks(), good.projectCounters(),
                good.sequences());

        ValidationException e = catchThrowableOfType(() -> store.importState(broken), ValidationException.class);

        assertThat(e.getFieldErrors()).isNotEmpty();
        assertThat(store.exportState()).isEqualTo(good);
    }

    @Test
    void resetEmptiesEverything() {
        store.resetTo(null);

        assertThat(store.counts().values()).allMatch(n -> n == 0);
        assertThat(store.findToken(DefaultSeed.MOCK_TOKEN)).isEmpty();
    }

    @Test
    void resetToSnapshotSwapsStateOrKeepsItWhenInvalid() {
        StoreSnapshot seeded = store.exportState();
        store.createWorkItem("DEV", "Bug", "Discarded", null, ALICE, Map.of());

        store.resetTo(DefaultSeed.snapshot(clock));

        assertThat(store.exportState()).isEqualTo(seeded);
        assertThat(store.findToken(DefaultSeed.MOCK_TOKEN)).isPresent();

        StoreSnapshot broken = withItemsAndRequests(seeded, seeded.items(), List.of());
        assertThatThrownBy(() -> store.resetTo(broken)).isInstanceOf(ValidationException.class);
        assertThat(store.exportState()).isEqualTo(seeded);
    }

    @Test
    void importOfKeylessItemIsAValidationError() {
        StoreSnapshot good = store.exportState();
        WorkItem keyless = new WorkItem("1", null, "DEV", null, null, null, null, null, null, null, null, null,
                null, null, null, null, null);

        ValidationException e = catchThrowableOfType(() -> store.importState(
                withItemsAndRequests(good, List.of(keyless), List.of())), ValidationException.class);

        assertThat(e.getFieldErrors()).containsKey("items");
        assertThat(store.exportState()).isEqualTo(good);
    }

    @Test
    void serviceDeskItemsNeedARequestOnImport() {
        StoreSnapshot good = store.exportState();

        ValidationException e = catchThrowableOfType(() -> store.importState(
                withItemsAndRequests(good, good.items(), List.of())), ValidationException.class);

        assertThat(e.getFieldErrors()).containsOnlyKeys("items[SUP-1].serviceRequest");
    }

    @Test
    void webhookBatchIsAllOrNothing() {
        ValidationException e = catchThrowableOfType(() -> store.registerWebhooks(List.of(
                        new WebhookSpec("http://localhost:9/ok", List.of("jira:issue_created"), null),
                        new WebhookSpec("ftp://nope", List.of("jira:issue_created"), null),
                        new WebhookSpec("http://localhost:9/ok", List.of("issue_updated"), "project = DEV OR x")),
                ALICE), ValidationException.class);

        assertThat(e.getFieldErrors()).containsKeys("webhooks[1].url", "webhooks[2].jqlFilter");
        assertThat(store.listWebhooks()).isEmpty();
    }

    @Test
    void webhookEventAliasesAreCanonicalised() {
        store.registerWebhook("https://example.test/hook", List.of("item_created", "jira:issue_created",
                "issue_updated"), "project = DEV", ALICE);

        assertThat(store.listWebhooks().get(0).events())
                .containsExactly("jira:issue_created", "jira:issue_updated");
        assertThatThrownBy(() -> store.deleteWebhook("1")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void listenersReceiveRenderedEvents() {
        List<StoreEvent> events = new ArrayList<>();
        store.addListener(events::add);
        store.addListener(e -> {
            throw new IllegalStateException("listener failures stay contained");
        });

        store.createWorkItem("DEV", "Bug", "Observed", null, ALICE, Map.of());

        assertThat(events).hasSize(1);
        StoreEvent event = events.get(0);
        assertThat(event.type()).isEqualTo(WebhookEventType.ISSUE_CREATED);
        assertThat(event.payload().path("webhookEvent").asText()).isEqualTo("jira:issue_created");
        assertThat(event.payload().path("issue").path("key").asText()).isEqualTo("DEV-4");
        assertThat(event.attributes().get("project")).contains("dev");
    }

    @Test
    void returnedItemsAreDetachedCopies() {
        WorkItem item = store.getWorkItem("DEV-1");
        ((ObjectNode) item.description()).put("type", "tampered");

        JsonNode stored = store.getIssue("DEV-1", false).path("fields").path("description");

        assertThat(stored.path("type").asText()).isEqualTo("doc");
    }

    private static StoreSnapshot withItemsAndRequests(StoreSnapshot base, List<WorkItem> items,
                                                      List<ServiceRequest> requests) {
        return new StoreSnapshot(base.users(), base.tokens(), base.statusCategories(), base.statuses(),
                base.transitions(), base.issueTypes(), base.linkTypes(), base.projects(), base.boards(),
                base.sprints(), items, requests, base.webhooks(), base.projectCounters(), base.sequences());
    }
}
