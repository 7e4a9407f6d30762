package io.github.drompincen.mockjira.runtime.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.github.drompincen.mockjira.protocol.document.Documents;
import io.github.drompincen.mockjira.protocol.event.WebhookEventType;
import io.github.drompincen.mockjira.runtime.error.ConflictException;
import io.github.drompincen.mockjira.runtime.error.NotFoundException;
import io.github.drompincen.mockjira.runtime.error.ValidationException;
import io.github.drompincen.mockjira.runtime.model.Approval;
import io.github.drompincen.mockjira.runtime.model.AuthToken;
import io.github.drompincen.mockjira.runtime.model.Board;
import io.github.drompincen.mockjira.runtime.model.ChangeItem;
import io.github.drompincen.mockjira.runtime.model.ChangelogEntry;
import io.github.drompincen.mockjira.runtime.model.Comment;
import io.github.drompincen.mockjira.runtime.model.IssueLink;
import io.github.drompincen.mockjira.runtime.model.IssueLinkType;
import io.github.drompincen.mockjira.runtime.model.IssueType;
import io.github.drompincen.mockjira.runtime.model.Project;
import io.github.drompincen.mockjira.runtime.model.ServiceRequest;
import io.github.drompincen.mockjira.runtime.model.Sprint;
import io.github.drompincen.mockjira.runtime.model.SprintState;
import io.github.drompincen.mockjira.runtime.model.Status;
import io.github.drompincen.mockjira.runtime.model.StatusCategory;
import io.github.drompincen.mockjira.runtime.model.Transition;
import io.github.drompincen.mockjira.runtime.model.User;
import io.github.drompincen.mockjira.runtime.model.WebhookRegistration;
import io.github.drompincen.mockjira.runtime.model.WorkItem;
import io.github.drompincen.mockjira.runtime.query.AttributeSet;
import io.github.drompincen.mockjira.runtime.query.QueryEvaluator;
import io.github.drompincen.mockjira.runtime.query.QueryParser;
import io.github.drompincen.mockjira.runtime.query.QueryPlan;
import io.github.drompincen.mockjira.runtime.query.QuerySyntaxException;
import io.github.drompincen.mockjira.runtime.render.IssueRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Single owner of all mock state. Mutations run under one write lock, reads share the read lock, and
 * callers only ever receive immutable records or freshly rendered JSON.
 */
@Service
public class InMemoryStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryStore.class);

    private static final String DEFAULT_REQUEST_TYPE = "100";
    private static final String SERVICE_REQUEST_TYPE_NAME = "Service Request";
    private static final String DEFAULT_ISSUE_TYPE_NAME = "Task";
    private static final String REQUEST_TYPE_FIELD = "requestTypeId";
    private static final Set<String> RESERVED_FIELDS = Set.of(
            "summary", "description", "assignee", "labels", "reporter", "issuetype", "project", "status",
            IssueRenderer.SPRINT_FIELD, REQUEST_TYPE_FIELD);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<StoreEventListener> listeners = new CopyOnWriteArrayList<>();
    private final Clock clock;
    private final IssueRenderer renderer;
    private final QueryEvaluator evaluator;
    private StoreState state = new StoreState();

    public InMemoryStore(ObjectMapper objectMapper, Clock clock) {
        this.clock = clock;
        this.renderer = new IssueRenderer(objectMapper);
        this.evaluator = new QueryEvaluator(clock);
    }

    public void addListener(StoreEventListener listener) {
        listeners.add(listener);
    }

    // ------------------------------------------------------------------ identity

    public Optional<AuthToken> findToken(String token) {
        return read(s -> Optional.ofNullable(token == null ? null : s.tokens.get(token)));
    }

    public ObjectNode renderUser(String accountId) {
        return read(s -> renderer.user(s.user(accountId)
                .orElseThrow(() -> NotFoundException.of("User", accountId))));
    }

    public List<ObjectNode> searchUsers(String query) {
        String needle = query == null ? "" : query.toLowerCase(Locale.ROOT);
        return read(s -> s.users.values().stream()
                .filter(u -> u.displayName().toLowerCase(Locale.ROOT).contains(needle)
                        || u.email().toLowerCase(Locale.ROOT).contains(needle)
                        || u.accountId().equalsIgnoreCase(needle))
                .map(renderer::user)
                .toList());
    }

    // ------------------------------------------------------------------ metadata

    public List<ObjectNode> listProjects() {
        return read(s -> s.projects.values().stream().map(p -> renderer.project(p, s)).toList());
    }

    public ObjectNode getProject(String keyOrId) {
        return read(s -> renderer.project(s.project(keyOrId)
                .orElseThrow(() -> NotFoundException.of("Project", keyOrId)), s));
    }

    public List<ObjectNode> listIssueTypes() {
        return read(s -> s.issueTypes.values().stream().map(renderer::issueType).toList());
    }

    public List<ObjectNode> listStatuses() {
        return read(s -> s.statuses.values().stream().map(st -> renderer.status(st, s)).toList());
    }

    public List<ObjectNode> listLinkTypes() {
        return read(s -> s.linkTypes.values().stream().map(renderer::linkType).toList());
    }

    public ArrayNode listFields() {
        return renderer.fields();
    }

    // ------------------------------------------------------------------ work items

    public WorkItem getWorkItem(String idOrKey) {
        return read(s -> requireItem(s, idOrKey).deepCopy());
    }

    public ObjectNode getIssue(String idOrKey, boolean expandChangelog) {
        return read(s -> renderer.issue(requireItem(s, idOrKey), s, expandChangelog));
    }

    public ObjectNode renderIssue(WorkItem item) {
        return read(s -> renderer.issue(item, s, false));
    }

    /**
     * Creates an item under {@code projectKey} (key or id).
     *
     * @param typeId      issue type id or name; null selects the default type
     * @param extraFields assignee, labels, sprint ({@code customfield_10020}), request type and custom fields
     */
    public WorkItem createWorkItem(String projectKey, String typeId, String summary, JsonNode description,
                                   String reporterId, Map<String, JsonNode> extraFields) {
        return write(s -> {
            Map<String, JsonNode> extras = extraFields != null ? extraFields : Map.of();
            Map<String, String> errors = new LinkedHashMap<>();
            Optional<Project> project = s.project(projectKey);
            if (project.isEmpty()) {
                errors.put("project", "Specify a valid project ID or key");
            }
            Optional<IssueType> type = typeId == null || typeId.isBlank()
                    ? s.issueType(DEFAULT_ISSUE_TYPE_NAME).or(() -> s.issueTypes.values().stream().findFirst())
                    : s.issueType(typeId);
            if (type.isEmpty()) {
                errors.put("issuetype", "Specify a valid issue type");
            }
            if (summary == null || summary.isBlank()) {
                errors.put("summary", "You must specify a summary of the issue.");
            }
            if (s.user(reporterId).isEmpty()) {
                errors.put("reporter", "Specify a valid reporter");
            }
            String assigneeId = accountIdOf(extras.get("assignee"));
            if (assigneeId != null && s.user(assigneeId).isEmpty()) {
                errors.put("assignee", "User '" + assigneeId + "' does not exist");
            }
            JsonNode doc = normalizeDocument(description, "description", errors);
            List<String> labels = labelsOf(extras.get("labels"), errors);
            Long sprintId = sprintIdOf(extras.get(IssueRenderer.SPRINT_FIELD), s, errors);
            Optional<Status> initial = s.firstStatusInCategory(StatusCategory.NEW)
                    .or(() -> s.statuses.values().stream().findFirst());
            if (initial.isEmpty()) {
                errors.put("status", "No workflow statuses are configured");
            }
            if (!errors.isEmpty()) {
                throw new ValidationException("Issue could not be created", errors);
            }

            Project p = project.get();
            Instant now = clock.instant();
            Map<String, JsonNode> custom = new LinkedHashMap<>();
            extras.forEach((field, value) -> {
                if (!RESERVED_FIELDS.contains(field) && value != null && !value.isNull()) {
                    custom.put(field, value.deepCopy());
                }
            });
            WorkItem item = new WorkItem(
                    Long.toString(s.nextSequence(StoreState.SEQ_ISSUE)),
                    p.key() + "-" + s.nextKeyNumber(p.key()),
                    p.key(), type.get().id(), summary.strip(), doc, initial.get().id(), reporterId, assigneeId,
                    labels, now, now, sprintId, List.of(), custom, List.of(), List.of());
            s.putItem(item);
            if (p.isServiceDesk()) {
                JsonNode requestType = extras.get(REQUEST_TYPE_FIELD);
                createRequestRecord(s, item, p,
                        requestType != null && !requestType.isNull() ? requestType.asText() : DEFAULT_REQUEST_TYPE);
            }
            log.debug("Created work item {} in project {}", item.key(), p.key());
            emitIssueEvent(s, WebhookEventType.ISSUE_CREATED, "issue_created", item, reporterId, null);
            return item.deepCopy();
        });
    }

    /**
     * Merges {@code changes} (keyed like the {@code fields} object of an edit request) into the item.
     */
    public WorkItem updateWorkItem(String idOrKey, Map<String, JsonNode> changes, String actorId) {
        return write(s -> {
            WorkItem current = requireItem(s, idOrKey);
            Map<String, String> errors = new LinkedHashMap<>();
            WorkItem.Builder builder = current.toBuilder();
            List<ChangeItem> changeItems = new ArrayList<>();

            for (Map.Entry<String, JsonNode> entry : changes.entrySet()) {
                String field = entry.getKey();
                JsonNode value = entry.getValue();
                switch (field) {
                    case "summary" -> {
                        if (value == null || !value.isTextual() || value.asText().isBlank()) {
                            errors.put("summary", "You must specify a summary of the issue.");
                        } else {
                            builder.summary(value.asText().strip());
                        }
                    }
                    case "description" -> builder.description(normalizeDocument(value, "description", errors));
                    case "assignee" -> {
                        String assigneeId = accountIdOf(value);
                        if (assigneeId != null && s.user(assigneeId).isEmpty()) {
                            errors.put("assignee", "User '" + assigneeId + "' does not exist");
                        } else if (!Objects.equals(assigneeId, current.assigneeId())) {
                            builder.assigneeId(assigneeId);
                            changeItems.add(userChange(s, "assignee", current.assigneeId(), assigneeId));
                        }
                    }
                    case "reporter" -> {
                        String reporterId = accountIdOf(value);
                        if (reporterId == null || s.user(reporterId).isEmpty()) {
                            errors.put("reporter", "Specify a valid reporter");
                        } else {
                            builder.reporterId(reporterId);
                        }
                    }
                    case "labels" -> builder.labels(labelsOf(value, errors));
                    case "issuetype" -> {
                        String typeRef = value != null && value.isObject()
                                ? value.path("id").asText(value.path("name").asText(null))
                                : value != null ? value.asText() : null;
                        Optional<IssueType> type = s.issueType(typeRef);
                        if (type.isEmpty()) {
                            errors.put("issuetype", "Specify a valid issue type");
                        } else {
                            builder.issueTypeId(type.get().id());
                        }
                    }
                    case IssueRenderer.SPRINT_FIELD -> {
                        Long sprintId = sprintIdOf(value, s, errors);
                        if (!errors.containsKey(IssueRenderer.SPRINT_FIELD)
                                && !Objects.equals(sprintId, current.sprintId())) {
                            builder.sprintId(sprintId);
                            changeItems.add(sprintChange(s, current.sprintId(), sprintId));
                        }
                    }
                    case "project" -> errors.put("project", "Moving issues between projects is not supported");
                    case "status" -> errors.put("status", "Use a transition to change the status");
                    default -> builder.customField(field, value);
                }
            }
            if (!errors.isEmpty()) {
                throw new ValidationException("Issue could not be updated", errors);
            }
            ChangelogEntry entry = null;
            if (!changeItems.isEmpty()) {
                entry = changelog(s, actorId, changeItems);
                builder.addChangelog(entry);
            }
            WorkItem updated = builder.updated(clock.instant()).build();
            s.putItem(updated);
            emitIssueEvent(s, WebhookEventType.ISSUE_UPDATED, "issue_updated", updated, actorId, entry);
            return updated.deepCopy();
        });
    }

    public List<WorkItem> searchWorkItems(QueryPlan plan, String principalId) {
        return read(s -> filter(s, plan, principalId).stream().map(WorkItem::deepCopy).toList());
    }

    public List<ObjectNode> searchIssues(QueryPlan plan, String principalId, boolean expandChangelog) {
        return read(s -> filter(s, plan, principalId).stream()
                .map(i -> renderer.issue(i, s, expandChangelog))
                .toList());
    }

    public List<ObjectNode> listTransitions(String idOrKey) {
        return read(s -> s.transitionsFrom(requireItem(s, idOrKey).statusId()).stream()
                .map(t -> renderer.transition(t, s))
                .toList());
    }

    /**
     * Moves the item along {@code transitionId}, which must start at the item's current status.
     *
     * @throws ValidationException if no transition id is given
     * @throws ConflictException   if the transition is not offered from the current status
     */
    public WorkItem applyTransition(String idOrKey, String transitionId, String actorId) {
        return write(s -> {
            WorkItem item = requireItem(s, idOrKey);
            if (transitionId == null || transitionId.isBlank()) {
                throw ValidationException.field("transition.id", "Transition id is required");
            }
            Transition transition = s.transitionsFrom(item.statusId()).stream()
                    .filter(t -> t.id().equals(transitionId))
                    .findFirst()
                    .orElseThrow(() -> new ConflictException("Transition " + transitionId
                            + " is not allowed from the current status of " + item.key()));
            WorkItem updated = moveToStatus(s, item, transition.toStatusId(), actorId);
            log.debug("Transitioned {} via {} to status {}", item.key(), transitionId, transition.toStatusId());
            return updated.deepCopy();
        });
    }

    public List<ObjectNode> listComments(String idOrKey) {
        return read(s -> requireItem(s, idOrKey).comments().stream().map(c -> renderer.comment(c, s)).toList());
    }

    public Comment addComment(String idOrKey, String authorId, JsonNode body) {
        return write(s -> {
            WorkItem item = requireItem(s, idOrKey);
            if (s.user(authorId).isEmpty()) {
                throw ValidationException.field("author", "Specify a valid author");
            }
            Map<String, String> errors = new LinkedHashMap<>();
            JsonNode doc = normalizeDocument(body, "body", errors);
            if (errors.isEmpty() && Documents.isBlank(doc)) {
                errors.put("body", "Comment body can not be empty!");
            }
            if (!errors.isEmpty()) {
                throw new ValidationException("Comment could not be added", errors);
            }
            Instant now = clock.instant();
            Comment comment = new Comment(Long.toString(s.nextSequence(StoreState.SEQ_COMMENT)), authorId, doc, now);
            WorkItem updated = item.toBuilder().addComment(comment).updated(now).build();
            s.putItem(updated);

            ObjectNode payload = basePayload(WebhookEventType.COMMENT_CREATED, authorId, s);
            payload.set("comment", renderer.comment(comment, s));
            payload.set("issue", renderer.issue(updated, s, false));
            emit(WebhookEventType.COMMENT_CREATED, payload, ItemAttributes.of(updated, s));
            return new Comment(comment.id(), comment.authorId(), doc.deepCopy(), comment.created());
        });
    }

    public ObjectNode renderComment(Comment comment) {
        return read(s -> renderer.comment(comment, s));
    }

    /**
     * Links two distinct existing items; the link is recorded on both.
     */
    public IssueLink createIssueLink(String linkType, String inwardKey, String outwardKey, String actorId) {
        return write(s -> {
            Map<String, String> errors = new LinkedHashMap<>();
            Optional<IssueLinkType> type = s.linkType(linkType);
            if (type.isEmpty()) {
                errors.put("type", "Issue link type '" + linkType + "' does not exist");
            }
            Optional<WorkItem> inward = s.item(inwardKey);
            Optional<WorkItem> outward = s.item(outwardKey);
            if (inward.isEmpty()) {
                errors.put("inwardIssue", "Issue '" + inwardKey + "' does not exist");
            }
            if (outward.isEmpty()) {
                errors.put("outwardIssue", "Issue '" + outwardKey + "' does not exist");
            }
            if (inward.isPresent() && outward.isPresent() && inward.get().key().equals(outward.get().key())) {
                errors.put("outwardIssue", "An issue cannot be linked to itself");
            }
            if (!errors.isEmpty()) {
                throw new ValidationException("Issue link could not be created", errors);
            }
            IssueLink link = new IssueLink(Long.toString(s.nextSequence(StoreState.SEQ_LINK)), type.get().name(),
                    inward.get().key(), outward.get().key());
            Instant now = clock.instant();
            s.putItem(inward.get().toBuilder().addLink(link).updated(now).build());
            s.putItem(outward.get().toBuilder().addLink(link).updated(now).build());

            ObjectNode payload = basePayload(WebhookEventType.ISSUELINK_CREATED, actorId, s);
            ObjectNode linkNode = payload.putObject("issueLink");
            linkNode.put("id", link.id());
            linkNode.put("sourceIssueId", inward.get().id());
            linkNode.put("destinationIssueId", outward.get().id());
            linkNode.set("issueLinkType", renderer.linkType(type.get()));
            emit(WebhookEventType.ISSUELINK_CREATED, payload, ItemAttributes.of(s.items.get(inward.get().key()), s));
            return link;
        });
    }

    public ObjectNode renderIssueLink(IssueLink link) {
        return read(s -> {
            ObjectNode node = renderer.object();
            node.put("id", link.id());
            s.linkType(link.typeName()).ifPresent(t -> node.set("type", renderer.linkType(t)));
            s.item(link.inwardKey()).ifPresent(i -> node.set("inwardIssue", renderer.issueSummary(i, s)));
            s.item(link.outwardKey()).ifPresent(i -> node.set("outwardIssue", renderer.issueSummary(i, s)));
            return node;
        });
    }

    // ------------------------------------------------------------------ agile

    public List<ObjectNode> listBoards() {
        return read(s -> s.boards.values().stream().map(b -> renderer.board(b, s)).toList());
    }

    public ObjectNode getBoard(long boardId) {
        return read(s -> renderer.board(requireBoard(s, boardId), s));
    }

    /**
     * @param state optional comma-separated list of sprint states to keep
     */
    public List<ObjectNode> listSprints(long boardId, String state) {
        return read(s -> {
            requireBoard(s, boardId);
            Set<SprintState> states = parseStates(state);
            return s.sprints.values().stream()
                    .filter(sp -> sp.boardId() == boardId)
                    .filter(sp -> states.isEmpty() || states.contains(sp.state()))
                    .map(renderer::sprint)
                    .toList();
        });
    }

    public ObjectNode getSprint(long sprintId) {
        return read(s -> renderer.sprint(requireSprint(s, sprintId)));
    }

    public ObjectNode renderSprint(Sprint sprint) {
        return renderer.sprint(sprint);
    }

    public List<ObjectNode> sprintIssues(long sprintId) {
        return read(s -> {
            requireSprint(s, sprintId);
            return s.items.values().stream()
                    .filter(i -> Long.valueOf(sprintId).equals(i.sprintId()))
                    .sorted(ItemOrdering.of(List.of(), s))
                    .map(i -> renderer.issue(i, s, false))
                    .toList();
        });
    }

    /**
     * Items of the board's project that are not in any sprint.
     */
    public List<ObjectNode> backlog(long boardId) {
        return read(s -> {
            Board board = requireBoard(s, boardId);
            return s.items.values().stream()
                    .filter(i -> i.projectKey().equals(board.projectKey()) && i.sprintId() == null)
                    .sorted(ItemOrdering.of(List.of(), s))
                    .map(i -> renderer.issue(i, s, false))
                    .toList();
        });
    }

    public Sprint createSprint(String name, Long boardId, String state, Instant startDate, Instant endDate,
                               String goal) {
        return write(s -> {
            if (boardId == null || s.board(boardId).isEmpty()) {
                throw ValidationException.field("originBoardId", "Board " + boardId + " does not exist");
            }
            SprintState initial = state == null ? SprintState.FUTURE : sprintState(state);
            long id = s.nextSequence(StoreState.SEQ_SPRINT);
            Sprint sprint = new Sprint(id, boardId,
                    name == null || name.isBlank() ? "Sprint " + id : name.strip(),
                    SprintState.FUTURE, startDate, endDate, null, goal);
            if (initial != SprintState.FUTURE) {
                sprint = sprint.withState(initial, clock.instant());
            }
            s.sprints.put(id, sprint);
            ObjectNode payload = basePayload(WebhookEventType.SPRINT_CREATED, null, s);
            payload.set("sprint", renderer.sprint(sprint));
            emit(WebhookEventType.SPRINT_CREATED, payload, ItemAttributes.ofSprint(sprint, s));
            log.info("Created sprint {} on board {}", id, boardId);
            return sprint;
        });
    }

    /**
     * Partial update. A state change must move forward along future, active, closed.
     */
    public Sprint updateSprint(long sprintId, String name, String state, Instant startDate, Instant endDate,
                               String goal) {
        return write(s -> {
            Sprint current = requireSprint(s, sprintId);
            Sprint updated = current.withDetails(name, startDate, endDate, goal);
            if (state != null) {
                SprintState next = sprintState(state);
                if (!current.state().canMoveTo(next)) {
                    throw new ConflictException("Sprint " + sprintId + " cannot move from "
                            + current.state().wireName() + " to " + next.wireName());
                }
                updated = updated.withState(next, clock.instant());
            }
            s.sprints.put(sprintId, updated);
            ObjectNode payload = basePayload(WebhookEventType.SPRINT_UPDATED, null, s);
            payload.set("sprint", renderer.sprint(updated));
            payload.set("oldValue", renderer.sprint(current));
            emit(WebhookEventType.SPRINT_UPDATED, payload, ItemAttributes.ofSprint(updated, s));
            return updated;
        });
    }

    public void moveItemsToSprint(long sprintId, List<String> keys, String actorId) {
        write(s -> {
            Sprint sprint = requireSprint(s, sprintId);
            if (sprint.state() == SprintState.CLOSED) {
                throw new ConflictException("Cannot move issues to closed sprint " + sprintId);
            }
            moveItems(s, keys, sprintId, actorId);
            return null;
        });
    }

    public void moveItemsToBacklog(List<String> keys, String actorId) {
        write(s -> {
            moveItems(s, keys, null, actorId);
            return null;
        });
    }

    // ------------------------------------------------------------------ service desk

    public List<ObjectNode> listServiceDesks() {
        return read(s -> s.projects.values().stream()
                .filter(Project::isServiceDesk)
                .map(renderer::serviceDesk)
                .toList());
    }

    public List<ObjectNode> listServiceRequests() {
        return read(s -> s.serviceRequests.values().stream()
                .map(r -> renderer.serviceRequest(r, s.items.get(r.issueKey()), s))
                .toList());
    }

    public ObjectNode getServiceRequest(String requestIdOrKey) {
        return read(s -> {
            ServiceRequest request = requireRequest(s, requestIdOrKey);
            return renderer.serviceRequest(request, s.items.get(request.issueKey()), s);
        });
    }

    public ObjectNode renderServiceRequest(ServiceRequest request) {
        return read(s -> renderer.serviceRequest(request, s.items.get(request.issueKey()), s));
    }

    public List<ObjectNode> listApprovals(String requestIdOrKey) {
        return read(s -> requireRequest(s, requestIdOrKey).approvals().stream()
                .map(a -> renderer.approval(a, s))
                .toList());
    }

    /**
     * Raises a request in a service desk project.
     *
     * @param serviceDeskId project id of the service desk; null selects the first one
     */
    public ServiceRequest createServiceRequest(String serviceDeskId, String requestTypeId, String summary,
                                               JsonNode description, String reporterId) {
        String projectKey = read(s -> {
            Optional<Project> desk = serviceDeskId == null || serviceDeskId.isBlank()
                    ? s.projects.values().stream().filter(Project::isServiceDesk).findFirst()
                    : s.project(serviceDeskId).filter(Project::isServiceDesk);
            return desk.map(Project::key)
                    .orElseThrow(() -> ValidationException.field("serviceDeskId",
                            "Service desk " + serviceDeskId + " does not exist"));
        });
        String typeId = read(s -> s.issueType(SERVICE_REQUEST_TYPE_NAME).map(IssueType::id).orElse(null));
        Map<String, JsonNode> extras = new LinkedHashMap<>();
        extras.put(REQUEST_TYPE_FIELD, TextNode.valueOf(
                requestTypeId == null || requestTypeId.isBlank() ? DEFAULT_REQUEST_TYPE : requestTypeId));
        WorkItem item = createWorkItem(projectKey, typeId, summary, description, reporterId, extras);
        return read(s -> s.serviceRequestFor(item.key())
                .orElseThrow(() -> new IllegalStateException("No request recorded for " + item.key())));
    }

    /**
     * Appends an approval decision and moves the underlying item: approval to the first done status,
     * decline to the first in-progress status.
     *
     * @throws ConflictException if {@code approvalId} has already been decided
     */
    public ServiceRequest decideApproval(String requestIdOrKey, String approvalId, String decision,
                                         String deciderId) {
        return write(s -> {
            ServiceRequest request = requireRequest(s, requestIdOrKey);
            String normalized = decision == null ? "" : decision.trim().toLowerCase(Locale.ROOT);
            boolean approve;
            if (normalized.equals("approve") || normalized.equals(Approval.APPROVED)) {
                approve = true;
            } else if (normalized.equals("decline") || normalized.equals(Approval.DECLINED)) {
                approve = false;
            } else {
                throw ValidationException.field("decision", "Decision must be 'approve' or 'decline'");
            }
            if (request.hasApproval(approvalId)) {
                throw new ConflictException("Approval " + approvalId + " has already been decided");
            }
            Approval approval = new Approval(approvalId, approve ? Approval.APPROVED : Approval.DECLINED,
                    deciderId, clock.instant());
            ServiceRequest updated = request.withApproval(approval);
            s.serviceRequests.put(updated.id(), updated);

            String category = approve ? StatusCategory.DONE : StatusCategory.IN_PROGRESS;
            Optional<Status> target = s.firstStatusInCategory(category);
            WorkItem item = s.items.get(request.issueKey());
            if (target.isPresent() && !target.get().id().equals(item.statusId())) {
                moveToStatus(s, item, target.get().id(), deciderId);
            } else {
                WorkItem touched = item.toBuilder().updated(clock.instant()).build();
                s.putItem(touched);
                emitIssueEvent(s, WebhookEventType.ISSUE_UPDATED, "issue_updated", touched, deciderId, null);
            }
            log.info("Approval {} on request {} {}", approvalId, request.id(), approval.decision());
            return updated;
        });
    }

    // ------------------------------------------------------------------ webhooks

    public WebhookRegistration registerWebhook(String url, List<String> eventTypes, String filterExpr,
                                               String createdBy) {
        return registerWebhooks(List.of(new WebhookSpec(url, eventTypes, filterExpr)), createdBy).get(0);
    }

    /**
     * Registers every spec or none of them. Field errors are keyed by {@code webhooks[i].field}.
     */
    public List<WebhookRegistration> registerWebhooks(List<WebhookSpec> specs, String createdBy) {
        return write(s -> {
            if (specs == null || specs.isEmpty()) {
                throw ValidationException.field("webhooks", "At least one webhook is required");
            }
            Map<String, String> errors = new LinkedHashMap<>();
            List<List<String>> canonicalEvents = new ArrayList<>();
            for (int i = 0; i < specs.size(); i++) {
                WebhookSpec spec = specs.get(i);
                String prefix = "webhooks[" + i + "].";
                if (!isHttpUrl(spec.url())) {
                    errors.put(prefix + "url", "A valid http or https URL is required");
                }
                List<String> events = new ArrayList<>();
                if (spec.events() == null || spec.events().isEmpty()) {
                    errors.put(prefix + "events", "At least one event is required");
                } else {
                    for (String name : spec.events()) {
                        Optional<WebhookEventType> type = WebhookEventType.fromWire(name);
                        if (type.isEmpty()) {
                            errors.put(prefix + "events", "Unsupported event '" + name + "'");
                        } else if (!events.contains(type.get().wireName())) {
                            events.add(type.get().wireName());
                        }
                    }
                }
                canonicalEvents.add(events);
                if (spec.jqlFilter() != null && !spec.jqlFilter().isBlank()) {
                    try {
                        QueryParser.parse(spec.jqlFilter());
                    } catch (QuerySyntaxException e) {
                        errors.put(prefix + "jqlFilter", e.getMessage());
                    }
                }
            }
            if (!errors.isEmpty()) {
                throw new ValidationException("Webhooks could not be registered", errors);
            }
            List<WebhookRegistration> created = new ArrayList<>();
            Instant now = clock.instant();
            for (int i = 0; i < specs.size(); i++) {
                WebhookSpec spec = specs.get(i);
                String filter = spec.jqlFilter() == null || spec.jqlFilter().isBlank() ? null : spec.jqlFilter();
                WebhookRegistration registration = new WebhookRegistration(
                        Long.toString(s.nextSequence(StoreState.SEQ_WEBHOOK)), spec.url(), canonicalEvents.get(i),
                        filter, createdBy, now);
                s.webhooks.put(registration.id(), registration);
                created.add(registration);
                log.info("Registered webhook {} -> {} for {}", registration.id(), registration.url(),
                        registration.events());
            }
            return created;
        });
    }

    public List<WebhookRegistration> listWebhooks() {
        return read(s -> List.copyOf(s.webhooks.values()));
    }

    public void deleteWebhook(String id) {
        write(s -> {
            if (s.webhooks.remove(id) == null) {
                throw NotFoundException.of("Webhook", id);
            }
            log.info("Deleted webhook {}", id);
            return null;
        });
    }

    // ------------------------------------------------------------------ operator

    public StoreSnapshot exportState() {
        return read(StoreState::toSnapshot);
    }

    /**
     * Replaces the whole state with {@code snapshot}. Nothing changes if the snapshot is inconsistent.
     *
     * @throws ValidationException listing every broken reference
     */
    public void importState(StoreSnapshot snapshot) {
        StoreState next = validated(snapshot);
        swap(next);
        log.info("Imported snapshot: {}", counts());
    }

    /**
     * Swaps in an empty state, or the contents of {@code snapshot}, under a single write lock so that no
     * reader observes the store in between.
     */
    public void resetTo(StoreSnapshot snapshot) {
        StoreState next = snapshot != null ? validated(snapshot) : new StoreState();
        swap(next);
        log.info("Store reset: {}", counts());
    }

    public Map<String, Integer> counts() {
        return read(s -> {
            Map<String, Integer> counts = new LinkedHashMap<>();
            counts.put("users", s.users.size());
            counts.put("projects", s.projects.size());
            counts.put("issues", s.items.size());
            counts.put("boards", s.boards.size());
            counts.put("sprints", s.sprints.size());
            counts.put("requests", s.serviceRequests.size());
            counts.put("webhooks", s.webhooks.size());
            return counts;
        });
    }

    // ------------------------------------------------------------------ internals

    private static StoreState validated(StoreSnapshot snapshot) {
        Map<String, String> errors = SnapshotValidator.validate(snapshot);
        if (!errors.isEmpty()) {
            log.warn("Rejected snapshot with {} error(s)", errors.size());
            throw new ValidationException("Snapshot is inconsistent", errors);
        }
        return StoreState.from(snapshot);
    }

    private void swap(StoreState next) {
        write(s -> {
            state = next;
            return null;
        });
    }

    private <T> T read(Function<StoreState, T> action) {
        lock.readLock().lock();
        try {
            return action.apply(state);
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T write(Function<StoreState, T> action) {
        lock.writeLock().lock();
        try {
            return action.apply(state);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private List<WorkItem> filter(StoreState s, QueryPlan plan, String principalId) {
        return s.items.values().stream()
                .filter(i -> !plan.hasFilters() || evaluator.matches(plan, ItemAttributes.of(i, s), principalId))
                .sorted(ItemOrdering.of(plan.sortKeys(), s))
                .toList();
    }

    private WorkItem moveToStatus(StoreState s, WorkItem item, String statusId, String actorId) {
        ChangelogEntry entry = changelog(s, actorId, List.of(new ChangeItem("status",
                item.statusId(), statusName(s, item.statusId()), statusId, statusName(s, statusId))));
        WorkItem updated = item.toBuilder()
                .statusId(statusId)
                .updated(clock.instant())
                .addChangelog(entry)
                .build();
        s.putItem(updated);
        emitIssueEvent(s, WebhookEventType.ISSUE_UPDATED, "issue_generic", updated, actorId, entry);
        return updated;
    }

    private void moveItems(StoreState s, List<String> keys, Long sprintId, String actorId) {
        if (keys == null || keys.isEmpty()) {
            throw ValidationException.field("issues", "At least one issue is required");
        }
        List<WorkItem> targets = new ArrayList<>();
        for (String key : keys) {
            targets.add(s.item(key).orElseThrow(() ->
                    ValidationException.field("issues", "Issue '" + key + "' does not exist")));
        }
        for (WorkItem item : targets) {
            if (Objects.equals(item.sprintId(), sprintId)) {
                continue;
            }
            ChangelogEntry entry = changelog(s, actorId, List.of(sprintChange(s, item.sprintId(), sprintId)));
            WorkItem updated = item.toBuilder()
                    .sprintId(sprintId)
                    .updated(clock.instant())
                    .addChangelog(entry)
                    .build();
            s.putItem(updated);
            emitIssueEvent(s, WebhookEventType.ISSUE_UPDATED, "issue_updated", updated, actorId, entry);
        }
    }

    private ServiceRequest createRequestRecord(StoreState s, WorkItem item, Project project, String requestTypeId) {
        ServiceRequest request = new ServiceRequest(Long.toString(s.nextSequence(StoreState.SEQ_REQUEST)),
                item.key(), project.id(), requestTypeId, List.of(), item.created());
        s.serviceRequests.put(request.id(), request);
        return request;
    }

    private ChangelogEntry changelog(StoreState s, String actorId, List<ChangeItem> items) {
        return new ChangelogEntry(Long.toString(s.nextSequence(StoreState.SEQ_CHANGELOG)), actorId,
                clock.instant(), items);
    }

    private ChangeItem userChange(StoreState s, String field, String from, String to) {
        return new ChangeItem(field, from, s.user(from).map(User::displayName).orElse(null),
                to, s.user(to).map(User::displayName).orElse(null));
    }

    private ChangeItem sprintChange(StoreState s, Long from, Long to) {
        return new ChangeItem("Sprint",
                from == null ? null : from.toString(),
                from == null ? null : s.sprint(from).map(Sprint::name).orElse(null),
                to == null ? null : to.toString(),
                to == null ? null : s.sprint(to).map(Sprint::name).orElse(null));
    }

    private static String statusName(StoreState s, String statusId) {
        return s.status(statusId).map(Status::name).orElse(statusId);
    }

    private void emitIssueEvent(StoreState s, WebhookEventType type, String issueEventType, WorkItem item,
                                String actorId, ChangelogEntry entry) {
        ObjectNode payload = basePayload(type, actorId, s);
        payload.put("issue_event_type_name", issueEventType);
        payload.set("issue", renderer.issue(item, s, false));
        if (entry != null) {
            ObjectNode changelog = renderer.history(entry, s);
            changelog.remove("author");
            changelog.remove("created");
            payload.set("changelog", changelog);
        }
        emit(type, payload, ItemAttributes.of(item, s));
    }

    private ObjectNode basePayload(WebhookEventType type, String actorId, StoreState s) {
        ObjectNode payload = renderer.object();
        payload.put("timestamp", clock.millis());
        payload.put("webhookEvent", type.wireName());
        s.user(actorId).ifPresent(u -> payload.set("user", renderer.user(u)));
        return payload;
    }

    private void emit(WebhookEventType type, ObjectNode payload, AttributeSet attributes) {
        StoreEvent event = new StoreEvent(UUID.randomUUID().toString(), type, payload, attributes, clock.instant());
        for (StoreEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Store event listener failed for {} event {}", type.wireName(), event.eventId(), e);
            }
        }
    }

    private static WorkItem requireItem(StoreState s, String idOrKey) {
        return s.item(idOrKey).orElseThrow(() -> NotFoundException.of("Issue", idOrKey));
    }

    private static Board requireBoard(StoreState s, long boardId) {
        return s.board(boardId).orElseThrow(() -> NotFoundException.of("Board", boardId));
    }

    private static Sprint requireSprint(StoreState s, long sprintId) {
        return s.sprint(sprintId).orElseThrow(() -> NotFoundException.of("Sprint", sprintId));
    }

    private static ServiceRequest requireRequest(StoreState s, String idOrKey) {
        ServiceRequest byId = s.serviceRequests.get(idOrKey);
        if (byId != null) {
            return byId;
        }
        return s.item(idOrKey)
                .flatMap(i -> s.serviceRequestFor(i.key()))
                .orElseThrow(() -> NotFoundException.of("Request", idOrKey));
    }

    private static SprintState sprintState(String state) {
        try {
            return SprintState.fromWire(state);
        } catch (IllegalArgumentException e) {
            throw ValidationException.field("state", "Unknown sprint state '" + state + "'");
        }
    }

    private static Set<SprintState> parseStates(String states) {
        if (states == null || states.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(states.split(","))
                .map(String::trim)
                .filter(v -> !v.isEmpty())
                .map(InMemoryStore::sprintState)
                .collect(Collectors.toSet());
    }

    private static JsonNode normalizeDocument(JsonNode value, String field, Map<String, String> errors) {
        try {
            return Documents.normalize(value);
        } catch (IllegalArgumentException e) {
            errors.put(field, "Expected text or a document");
            return Documents.empty();
        }
    }

    static String accountIdOf(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        if (value.isObject()) {
            JsonNode id = value.has("accountId") ? value.get("accountId") : value.get("id");
            return id == null || id.isNull() ? null : id.asText();
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private static List<String> labelsOf(JsonNode value, Map<String, String> errors) {
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (!value.isArray()) {
            errors.put("labels", "Labels must be an array of strings");
            return List.of();
        }
        List<String> labels = new ArrayList<>();
        for (JsonNode label : value) {
            if (!label.isTextual() || label.asText().isBlank() || label.asText().contains(" ")) {
                errors.put("labels", "Labels must be non-empty strings without spaces");
            } else if (!labels.contains(label.asText())) {
                labels.add(label.asText());
            }
        }
        return labels;
    }

    private static Long sprintIdOf(JsonNode value, StoreState s, Map<String, String> errors) {
        if (value == null || value.isNull()) {
            return null;
        }
        JsonNode raw = value;
        if (raw.isArray()) {
            if (raw.isEmpty()) {
                return null;
            }
            raw = raw.get(0);
        }
        if (raw.isObject()) {
            raw = raw.path("id");
        }
        long id;
        try {
            id = raw.isNumber() ? raw.asLong() : Long.parseLong(raw.asText().trim());
        } catch (NumberFormatException e) {
            errors.put(IssueRenderer.SPRINT_FIELD, "Sprint id must be a number");
            return null;
        }
        Optional<Sprint> sprint = s.sprint(id);
        if (sprint.isEmpty()) {
            errors.put(IssueRenderer.SPRINT_FIELD, "Sprint " + id + " does not exist");
            return null;
        }
        if (sprint.get().state() == SprintState.CLOSED) {
            errors.put(IssueRenderer.SPRINT_FIELD, "Sprint " + id + " is closed");
            return null;
        }
        return id;
    }

    private static boolean isHttpUrl(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme();
            return uri.getHost() != null
                    && ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme));
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
