package io.github.drompincen.mockjira.runtime.seed;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.mockjira.protocol.document.Documents;
import io.github.drompincen.mockjira.runtime.model.AuthToken;
import io.github.drompincen.mockjira.runtime.model.Board;
import io.github.drompincen.mockjira.runtime.model.ChangeItem;
import io.github.drompincen.mockjira.runtime.model.ChangelogEntry;
import io.github.drompincen.mockjira.runtime.model.Comment;
import io.github.drompincen.mockjira.runtime.model.IssueLink;
import io.github.drompincen.mockjira.runtime.model.Project;
import io.github.drompincen.mockjira.runtime.model.ProjectType;
import io.github.drompincen.mockjira.runtime.model.ServiceRequest;
import io.github.drompincen.mockjira.runtime.model.Sprint;
import io.github.drompincen.mockjira.runtime.model.SprintState;
import io.github.drompincen.mockjira.runtime.model.Status;
import io.github.drompincen.mockjira.runtime.model.User;
import io.github.drompincen.mockjira.runtime.model.WorkItem;
import io.github.drompincen.mockjira.runtime.store.StoreSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Builds a larger synthetic data set from a {@link GeneratorConfig}. The same config and clock
 * always produce the same snapshot.
 */
public class SeedGenerator {

    private static final Logger log = LoggerFactory.getLogger(SeedGenerator.class);

    private static final List<String> SUMMARY_TOPICS = List.of(
            "Checkout fails with HTTP 500",
            "Latency spike on search endpoint",
            "Add SSO support for administrators",
            "Password reset flow is broken",
            "Mobile push notification bug",
            "Improve structured logging",
            "Customer satisfaction drop investigation",
            "Refactor payments client",
            "Analytics pipeline intermittently stalls",
            "Upgrade database driver");
    private static final List<String> COMMENT_TEMPLATES = List.of(
            "Investigating the report",
            "Able to reproduce the problem",
            "Working on a potential fix",
            "Need more diagnostic logs",
            "Verifying with the QA checklist",
            "Coordinating with on-call engineer");
    private static final List<String> SPRINT_GOALS = List.of(
            "Stabilise core flows",
            "New feature experiments",
            "Bugfix and polish",
            "Platform hardening");
    private static final List<String> REQUEST_SUMMARIES = List.of(
            "Reset VPN access",
            "Provision new laptop",
            "Restore deleted mailbox",
            "Troubleshoot billing discrepancy");
    private static final List<String> REQUEST_DESCRIPTIONS = List.of(
            "Customer reported an outage while accessing the dashboard.",
            "High priority ticket from premium tenant awaiting action.",
            "Requester is blocked on completing onboarding tasks.",
            "Follow-up needed with the infrastructure team.");
    private static final List<String> LABEL_POOL = List.of(
            "backend", "frontend", "infra", "needs-info", "p1", "p2", "regression");
    private static final List<String> SOFTWARE_TYPES = List.of(
            DefaultSeed.TYPE_BUG, DefaultSeed.TYPE_TASK, DefaultSeed.TYPE_STORY);

    private final Clock clock;

    public SeedGenerator(Clock clock) {
        this.clock = clock;
    }

    public StoreSnapshot generate(GeneratorConfig config) {
        Run run = new Run(config, new Random(config.seed()), clock.instant());
        run.users();
        run.projects();
        run.boardsAndSprints();
        run.items();
        run.links();
        StoreSnapshot snapshot = run.snapshot();
        log.info("Generated seed {}: {} projects, {} issues, {} sprints", config.seed(),
                snapshot.projects().size(), snapshot.items().size(), snapshot.sprints().size());
        return snapshot;
    }

    private static final class Run {
        private final GeneratorConfig config;
        private final Random rng;
        private final Instant now;
        private final Instant earliest;
        private final List<User> users = new ArrayList<>();
        private final List<Project> projects = new ArrayList<>();
        private final List<Board> boards = new ArrayList<>();
        private final List<Sprint> sprints = new ArrayList<>();
        private final Map<String, WorkItem> items = new LinkedHashMap<>();
        private final List<ServiceRequest> requests = new ArrayList<>();
        private final Map<String, Long> counters = new LinkedHashMap<>();
        private final Map<String, String> statusNames = new LinkedHashMap<>();
        private long nextIssueId = 10000;
        private long nextCommentId = 20000;
        private long nextRequestId = 30000;
        private long nextLinkId = 60000;
        private long nextChangelogId = 70000;

        private Run(GeneratorConfig config, Random rng, Instant now) {
            this.config = config;
            this.rng = rng;
            this.now = now;
            this.earliest = now.minus(Duration.ofDays(config.days()));
            for (Status status : DefaultSeed.statuses()) {
                statusNames.put(status.id(), status.name());
            }
        }

        void users() {
            users.add(new User("alice", "Alice Smith", "alice@example.com", "UTC"));
            users.add(new User("bob", "Bob Jones", "bob@example.com", "UTC"));
            users.add(new User("carol", "Carol Brown", "carol@example.com", "UTC"));
            users.add(new User("dave", "Dave Novak", "dave@example.com", "UTC"));
            users.add(new User("eva", "Eva Kral", "eva@example.com", "UTC"));
            for (int i = 1; i <= 3; i++) {
                users.add(new User("junior" + i, "Junior Engineer " + i, "junior" + i + "@example.com", "UTC"));
            }
        }

        void projects() {
            for (int i = 0; i < config.softwareProjects(); i++) {
                String key = config.softwareProjects() == 1 ? "DEV" : "DEV" + (i + 1);
                projects.add(new Project(String.valueOf(10000 + i), key, "Development " + (i + 1),
                        ProjectType.SOFTWARE, "alice"));
            }
            for (int i = 0; i < config.serviceDeskProjects(); i++) {
                projects.add(new Project(String.valueOf(11000 + i), "SUP" + (i + 1), "Support " + (i + 1),
                        ProjectType.SERVICE_DESK, "bob"));
            }
        }

        void boardsAndSprints() {
            long boardId = 1;
            long sprintId = 1;
            Duration length = Duration.ofDays(config.sprintLengthDays());
            for (Project project : projects) {
                if (project.isServiceDesk()) {
                    continue;
                }
                for (int b = 0; b < config.boardsPerSoftwareProject(); b++) {
                    boards.add(new Board(boardId, project.key() + " Scrum " + boardId, "scrum", project.key()));
                    for (int s = 0; s < config.sprintsPerBoard(); s++) {
                        Instant start = earliest.plus(length.multipliedBy(s));
                        Instant end = start.plus(length);
                        SprintState state = end.isBefore(now) ? SprintState.CLOSED
                                : !start.isAfter(now) ? SprintState.ACTIVE : SprintState.FUTURE;
                        sprints.add(new Sprint(sprintId++, boardId, "Sprint " + (s + 1), state, start, end,
                                state == SprintState.CLOSED ? end : null, pick(SPRINT_GOALS)));
                    }
                    boardId++;
                }
            }
        }

        void items() {
            for (Project project : projects) {
                for (int i = 0; i < config.issuesPerProject(); i++) {
                    Instant created = clamp(earliest.plus(Duration.ofDays(rng.nextInt(config.days() + 1)))
                            .plus(Duration.ofHours(rng.nextInt(9)))
                            .plus(Duration.ofMinutes(rng.nextInt(51))));
                    String reporter = pick(users).accountId();
                    String assignee = pick(users).accountId();
                    String typeId;
                    String summary;
                    JsonNode description;
                    if (project.isServiceDesk()) {
                        typeId = DefaultSeed.TYPE_SERVICE_REQUEST;
                        summary = pick(REQUEST_SUMMARIES);
                        description = Documents.fromText(pick(REQUEST_DESCRIPTIONS));
                    } else {
                        typeId = pick(SOFTWARE_TYPES);
                        summary = pick(SUMMARY_TOPICS);
                        description = Documents.fromText("Auto-generated sample issue");
                    }
                    long number = counters.merge(project.key(), 1L, Long::sum);
                    String key = project.key() + "-" + number;
                    WorkItem item = new WorkItem(String.valueOf(nextIssueId++), key, project.key(), typeId, summary,
                            description, DefaultSeed.STATUS_TO_DO, reporter, assignee, labels(), created, created,
                            sprintFor(project.key()), List.of(), Map.of(), List.of(), List.of());
                    item = withComments(item);
                    item = withTransitions(item);
                    item = withAssigneeChurn(item);
                    items.put(key, item);
                    if (project.isServiceDesk()) {
                        requests.add(new ServiceRequest(String.valueOf(nextRequestId++), key, project.id(), "100",
                                List.of(), created));
                    }
                }
            }
        }

        void links() {
            List<String> keys = new ArrayList<>(items.keySet());
            if (keys.size() < 2) {
                return;
            }
            Set<String> seen = new HashSet<>();
            for (String key : keys) {
                if (rng.nextDouble() >= config.linkProbability()) {
                    continue;
                }
                String other = pick(keys);
                if (other.equals(key) || seen.contains(key + "|" + other) || seen.contains(other + "|" + key)) {
                    continue;
                }
                seen.add(key + "|" + other);
                String typeName = rng.nextBoolean() ? "Relates" : "Blocks";
                IssueLink link = new IssueLink(String.valueOf(nextLinkId++), typeName, key, other);
                WorkItem left = items.get(key);
                WorkItem right = items.get(other);
                Instant touched = left.updated().isAfter(right.updated()) ? left.updated() : right.updated();
                items.put(key, left.toBuilder().addLink(link).updated(touched).build());
                items.put(other, right.toBuilder().addLink(link).updated(touched).build());
            }
        }

        StoreSnapshot snapshot() {
            List<AuthToken> tokens = List.of(
                    new AuthToken(DefaultSeed.MOCK_TOKEN, "alice", false, true),
                    new AuthToken(DefaultSeed.READ_ONLY_TOKEN, "carol", true, false));
            return new StoreSnapshot(users, tokens, DefaultSeed.statusCategories(), DefaultSeed.statuses(),
                    DefaultSeed.transitions(), DefaultSeed.issueTypes(), DefaultSeed.linkTypes(), projects, boards,
                    sprints, new ArrayList<>(items.values()), requests, List.of(), counters, Map.of());
        }

        private WorkItem withComments(WorkItem item) {
            int expected = Math.max(0, (int) (rng.nextGaussian() + config.commentsPerIssueAvg()));
            WorkItem.Builder builder = item.toBuilder();
            Instant updated = item.updated();
            for (int i = 0; i < expected; i++) {
                Instant at = clamp(item.created().plus(Duration.ofDays(rng.nextInt(7)))
                        .plus(Duration.ofHours(rng.nextInt(9))));
                builder.addComment(new Comment(String.valueOf(nextCommentId++), pick(users).accountId(),
                        Documents.fromText(pick(COMMENT_TEMPLATES)), at));
                updated = later(updated, at);
            }
            return builder.updated(updated).build();
        }

        private WorkItem withTransitions(WorkItem item) {
            if (rng.nextDouble() >= config.transitionRate()) {
                return item;
            }
            Instant started = clamp(item.created().plus(Duration.ofDays(rng.nextInt(6))));
            item = moveTo(item, DefaultSeed.STATUS_IN_PROGRESS, started);
            if (rng.nextDouble() < 0.7) {
                Instant done = clamp(started.plus(Duration.ofDays(1 + rng.nextInt(10))));
                item = moveTo(item, DefaultSeed.STATUS_DONE, done);
            }
            return item;
        }

        private WorkItem moveTo(WorkItem item, String statusId, Instant at) {
            String author = item.assigneeId() != null ? item.assigneeId() : pick(users).accountId();
            ChangeItem change = new ChangeItem("status", item.statusId(), statusNames.get(item.statusId()),
                    statusId, statusNames.get(statusId));
            return item.toBuilder()
                    .statusId(statusId)
                    .updated(later(item.updated(), at))
                    .addChangelog(new ChangelogEntry(String.valueOf(nextChangelogId++), author, at, List.of(change)))
                    .build();
        }

        private WorkItem withAssigneeChurn(WorkItem item) {
            if (rng.nextDouble() >= config.assigneeChurnProbability() || users.size() < 2) {
                return item;
            }
            Instant at = clamp(item.created().plus(Duration.ofDays(rng.nextInt(8))));
            String previous = item.assigneeId();
            int index = rng.nextInt(users.size());
            User replacement = users.get(index);
            if (replacement.accountId().equals(previous)) {
                replacement = users.get((index + 1) % users.size());
            }
            ChangeItem change = new ChangeItem("assignee", previous, displayName(previous),
                    replacement.accountId(), replacement.displayName());
            return item.toBuilder()
                    .assigneeId(replacement.accountId())
                    .updated(later(item.updated(), at))
                    .addChangelog(new ChangelogEntry(String.valueOf(nextChangelogId++), replacement.accountId(), at,
                            List.of(change)))
                    .build();
        }

        private Long sprintFor(String projectKey) {
            List<Board> projectBoards = boards.stream().filter(b -> b.projectKey().equals(projectKey)).toList();
            if (projectBoards.isEmpty() || rng.nextDouble() < 0.35) {
                return null;
            }
            long boardId = pick(projectBoards).id();
            List<Sprint> boardSprints = sprints.stream().filter(s -> s.boardId() == boardId).toList();
            return boardSprints.isEmpty() ? null : pick(boardSprints).id();
        }

        private List<String> labels() {
            List<String> pool = new ArrayList<>(LABEL_POOL);
            int count = rng.nextInt(3);
            List<String> picked = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                picked.add(pool.remove(rng.nextInt(pool.size())));
            }
            return picked;
        }

        private String displayName(String accountId) {
            return users.stream().filter(u -> u.accountId().equals(accountId)).map(User::displayName)
                    .findFirst().orElse(null);
        }

        private <T> T pick(List<T> values) {
            return values.get(rng.nextInt(values.size()));
        }

        private Instant clamp(Instant instant) {
            return instant.isAfter(now) ? now : instant;
        }

        private static Instant later(Instant a, Instant b) {
            return b.isAfter(a) ? b : a;
        }
    }
}
