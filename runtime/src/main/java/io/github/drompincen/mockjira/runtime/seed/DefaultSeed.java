package io.github.drompincen.mockjira.runtime.seed;

import io.github.drompincen.mockjira.protocol.document.Documents;
import io.github.drompincen.mockjira.runtime.model.AuthToken;
import io.github.drompincen.mockjira.runtime.model.Board;
import io.github.drompincen.mockjira.runtime.model.IssueLinkType;
import io.github.drompincen.mockjira.runtime.model.IssueType;
import io.github.drompincen.mockjira.runtime.model.Project;
import io.github.drompincen.mockjira.runtime.model.ProjectType;
import io.github.drompincen.mockjira.runtime.model.ServiceRequest;
import io.github.drompincen.mockjira.runtime.model.Sprint;
import io.github.drompincen.mockjira.runtime.model.SprintState;
import io.github.drompincen.mockjira.runtime.model.Status;
import io.github.drompincen.mockjira.runtime.model.StatusCategory;
import io.github.drompincen.mockjira.runtime.model.Transition;
import io.github.drompincen.mockjira.runtime.model.User;
import io.github.drompincen.mockjira.runtime.model.WorkItem;
import io.github.drompincen.mockjira.runtime.store.StoreSnapshot;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * The small, fixed sample data set the server starts with: two projects, three users, one scrum
 * board with a closed, an active and a future sprint, and four issues.
 */
public final class DefaultSeed {

    public static final String ALICE = "5b10a2844c20165700ede21g";
    public static final String BOB = "5b10a2844c20165700ede20f";
    public static final String CAROL = "5b10a2844c20165700ede20e";

    public static final String MOCK_TOKEN = "mock-token";
    public static final String READ_ONLY_TOKEN = "readonly-token";

    public static final String STATUS_TO_DO = "1";
    public static final String STATUS_IN_PROGRESS = "3";
    public static final String STATUS_DONE = "4";

    public static final String TYPE_BUG = "10000";
    public static final String TYPE_TASK = "10001";
    public static final String TYPE_STORY = "10002";
    public static final String TYPE_SERVICE_REQUEST = "10003";

    private DefaultSeed() {
    }

    public static StoreSnapshot snapshot(Clock clock) {
        Instant now = clock.instant();
        List<User> users = List.of(
                new User(ALICE, "Alice Johnson", "alice@example.com", "UTC"),
                new User(BOB, "Bob Smith", "bob@example.com", "UTC"),
                new User(CAROL, "Carol Williams", "carol@example.com", "UTC"));
        List<AuthToken> tokens = List.of(
                new AuthToken(MOCK_TOKEN, ALICE, false, true),
                new AuthToken(READ_ONLY_TOKEN, CAROL, true, false));
        List<Project> projects = List.of(
                new Project("10000", "DEV", "Development", ProjectType.SOFTWARE, ALICE),
                new Project("10001", "SUP", "Support", ProjectType.SERVICE_DESK, BOB));
        List<Board> boards = List.of(
                new Board(1, "DEV Scrum", "scrum", "DEV"),
                new Board(2, "DEV Kanban", "kanban", "DEV"));
        List<Sprint> sprints = List.of(
                new Sprint(1, 1, "Sprint 1", SprintState.CLOSED, now.minus(days(21)), now.minus(days(7)),
                        now.minus(days(7)), "Initial release"),
                new Sprint(2, 1, "Sprint 2", SprintState.ACTIVE, now.minus(days(6)), now.plus(days(8)), null,
                        "Polish features"),
                new Sprint(3, 1, "Sprint 3", SprintState.FUTURE, now.plus(days(9)), now.plus(days(23)), null, null));

        List<WorkItem> items = List.of(
                item("10000", "DEV-1", TYPE_STORY, "User can sign up", "Implement sign-up flow", STATUS_IN_PROGRESS,
                        ALICE, BOB, List.of("backend"), 2L, now),
                item("10001", "DEV-2", TYPE_BUG, "Fix payment bug", "Resolve gateway timeout", STATUS_TO_DO,
                        BOB, ALICE, List.of("urgent"), null, now),
                item("10002", "DEV-3", TYPE_TASK, "Improve onboarding", "Add product tour", STATUS_TO_DO,
                        ALICE, null, List.of(), null, now),
                item("10003", "SUP-1", TYPE_SERVICE_REQUEST, "Cannot login", "Customer reports login failure",
                        STATUS_TO_DO, CAROL, BOB, List.of(), null, now));
        List<ServiceRequest> requests = List.of(
                new ServiceRequest("30000", "SUP-1", "10001", "100", List.of(), now));

        return new StoreSnapshot(users, tokens, statusCategories(), statuses(), transitions(), issueTypes(),
                linkTypes(), projects, boards, sprints, items, requests, List.of(),
                Map.of("DEV", 3L, "SUP", 1L), Map.of());
    }

    public static List<StatusCategory> statusCategories() {
        return List.of(
                new StatusCategory(2, StatusCategory.NEW, "To Do"),
                new StatusCategory(4, StatusCategory.IN_PROGRESS, "In Progress"),
                new StatusCategory(3, StatusCategory.DONE, "Done"));
    }

    public static List<Status> statuses() {
        return List.of(
                new Status(STATUS_TO_DO, "To Do", StatusCategory.NEW),
                new Status(STATUS_IN_PROGRESS, "In Progress", StatusCategory.IN_PROGRESS),
                new Status(STATUS_DONE, "Done", StatusCategory.DONE));
    }

    public static List<Transition> transitions() {
        return List.of(
                new Transition("11", "Start Progress", STATUS_TO_DO, STATUS_IN_PROGRESS),
                new Transition("21", "Resolve", STATUS_IN_PROGRESS, STATUS_DONE),
                new Transition("31", "Reopen", STATUS_IN_PROGRESS, STATUS_TO_DO),
                new Transition("41", "Reopen", STATUS_DONE, STATUS_IN_PROGRESS));
    }

    public static List<IssueType> issueTypes() {
        return List.of(
                new IssueType(TYPE_BUG, "Bug", false),
                new IssueType(TYPE_TASK, "Task", false),
                new IssueType(TYPE_STORY, "Story", false),
                new IssueType(TYPE_SERVICE_REQUEST, "Service Request", false));
    }

    public static List<IssueLinkType> linkTypes() {
        return List.of(
                new IssueLinkType("10000", "Blocks", "is blocked by", "blocks"),
                new IssueLinkType("10001", "Relates", "relates to", "relates to"),
                new IssueLinkType("10002", "Duplicates", "is duplicated by", "duplicates"),
                new IssueLinkType("10003", "Clones", "is cloned by", "clones"));
    }

    private static WorkItem item(String id, String key, String typeId, String summary, String description,
                                 String statusId, String reporterId, String assigneeId, List<String> labels,
                                 Long sprintId, Instant created) {
        return new WorkItem(id, key, key.substring(0, key.indexOf('-')), typeId, summary,
                Documents.fromText(description), statusId, reporterId, assigneeId, labels, created, created,
                sprintId, List.of(), Map.of(), List.of(), List.of());
    }

    private static Duration days(long n) {
        return Duration.ofDays(n);
    }
}
