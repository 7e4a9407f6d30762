package io.github.drompincen.mockjira.runtime.render;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.mockjira.protocol.document.Documents;
import io.github.drompincen.mockjira.runtime.model.Approval;
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
import io.github.drompincen.mockjira.runtime.model.Status;
import io.github.drompincen.mockjira.runtime.model.StatusCategory;
import io.github.drompincen.mockjira.runtime.model.Transition;
import io.github.drompincen.mockjira.runtime.model.User;
import io.github.drompincen.mockjira.runtime.model.WorkItem;
import io.github.drompincen.mockjira.runtime.store.EntityLookup;

import java.time.Instant;
import java.util.List;

/**
 * Builds the JSON resource views returned by the API and embedded in webhook payloads.
 * Every JSON tree taken from an entity is deep-copied.
 */
public class IssueRenderer {

    public static final String SPRINT_FIELD = "customfield_10020";

    private final ObjectMapper mapper;

    public IssueRenderer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectNode object() {
        return mapper.createObjectNode();
    }

    public ObjectNode user(User user) {
        ObjectNode node = mapper.createObjectNode();
        node.put("accountId", user.accountId());
        node.put("accountType", "atlassian");
        node.put("displayName", user.displayName());
        node.put("emailAddress", user.email());
        node.put("timeZone", user.timeZone());
        node.put("active", true);
        return node;
    }

    public ObjectNode projectRef(Project project) {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", project.id());
        node.put("key", project.key());
        node.put("name", project.name());
        node.put("projectTypeKey", project.type().key());
        return node;
    }

    public ObjectNode project(Project project, EntityLookup lookup) {
        ObjectNode node = projectRef(project);
        lookup.user(project.leadAccountId()).ifPresent(lead -> node.set("lead", user(lead)));
        return node;
    }

    public ObjectNode issueType(IssueType type) {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", type.id());
        node.put("name", type.name());
        node.put("subtask", type.subtask());
        return node;
    }

    public ObjectNode statusCategory(StatusCategory category) {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", category.id());
        node.put("key", category.key());
        node.put("name", category.name());
        return node;
    }

    public ObjectNode status(Status status, EntityLookup lookup) {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", status.id());
        node.put("name", status.name());
        lookup.statusCategory(status.categoryKey())
                .ifPresent(c -> node.set("statusCategory", statusCategory(c)));
        return node;
    }

    public ObjectNode transition(Transition transition, EntityLookup lookup) {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", transition.id());
        node.put("name", transition.name());
        lookup.status(transition.toStatusId()).ifPresent(s -> node.set("to", status(s, lookup)));
        return node;
    }

    public ObjectNode linkType(IssueLinkType type) {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", type.id());
        node.put("name", type.name());
        node.put("inward", type.inward());
        node.put("outward", type.outward());
        return node;
    }

    public ObjectNode comment(Comment comment, EntityLookup lookup) {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", comment.id());
        lookup.user(comment.authorId()).ifPresent(u -> node.set("author", user(u)));
        node.set("body", comment.body() != null ? comment.body().deepCopy() : Documents.empty());
        node.put("created", comment.created().toString());
        node.put("updated", comment.created().toString());
        return node;
    }

    public ObjectNode sprint(Sprint sprint) {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", sprint.id());
        node.put("name", sprint.name());
        node.put("state", sprint.state().wireName());
        node.put("originBoardId", sprint.boardId());
        putInstant(node, "startDate", sprint.startDate());
        putInstant(node, "endDate", sprint.endDate());
        putInstant(node, "completeDate", sprint.completeDate());
        if (sprint.goal() != null) {
            node.put("goal", sprint.goal());
        }
        return node;
    }

    public ObjectNode board(Board board, EntityLookup lookup) {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", board.id());
        node.put("name", board.name());
        node.put("type", board.type());
        ObjectNode location = node.putObject("location");
        location.put("projectKey", board.projectKey());
        lookup.project(board.projectKey()).ifPresent(p -> {
            location.put("projectId", p.id());
            location.put("projectName", p.name());
            location.put("displayName", p.name() + " (" + p.key() + ")");
        });
        return node;
    }

    public ObjectNode issue(WorkItem item, EntityLookup lookup, boolean expandChangelog) {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", item.id());
        node.put("key", item.key());
        ObjectNode fields = node.putObject("fields");
        fields.put("summary", item.summary());
        fields.set("description", item.description() != null ? item.description().deepCopy() : Documents.empty());
        lookup.issueType(item.issueTypeId()).ifPresent(t -> fields.set("issuetype", issueType(t)));
        lookup.project(item.projectKey()).ifPresent(p -> fields.set("project", projectRef(p)));
        lookup.status(item.statusId()).ifPresent(s -> fields.set("status", status(s, lookup)));
        fields.set("reporter", userOrNull(item.reporterId(), lookup));
        fields.set("assignee", userOrNull(item.assigneeId(), lookup));
        ArrayNode labels = fields.putArray("labels");
        item.labels().forEach(labels::add);
        fields.put("created", item.created().toString());
        fields.put("updated", item.updated().toString());

        ObjectNode comments = fields.putObject("comment");
        ArrayNode commentValues = comments.putArray("comments");
        item.comments().forEach(c -> commentValues.add(comment(c, lookup)));
        comments.put("startAt", 0);
        comments.put("maxResults", item.comments().size());
        comments.put("total", item.comments().size());

        ArrayNode links = fields.putArray("issuelinks");
        item.links().forEach(l -> links.add(issueLink(l, item, lookup)));

        item.customFields().forEach((id, value) -> fields.set(id, value.deepCopy()));
        if (item.sprintId() != null) {
            ArrayNode sprints = fields.putArray(SPRINT_FIELD);
            lookup.sprint(item.sprintId()).ifPresent(s -> sprints.add(sprint(s)));
        } else {
            fields.putNull(SPRINT_FIELD);
        }

        if (expandChangelog) {
            node.set("changelog", changelog(item.changelog(), lookup));
        }
        return node;
    }

    public ObjectNode changelog(List<ChangelogEntry> entries, EntityLookup lookup) {
        ObjectNode node = mapper.createObjectNode();
        node.put("startAt", 0);
        node.put("maxResults", entries.size());
        node.put("total", entries.size());
        ArrayNode histories = node.putArray("histories");
        entries.forEach(e -> histories.add(history(e, lookup)));
        return node;
    }

    public ObjectNode history(ChangelogEntry entry, EntityLookup lookup) {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", entry.id());
        lookup.user(entry.authorId()).ifPresent(u -> node.set("author", user(u)));
        node.put("created", entry.created().toString());
        ArrayNode items = node.putArray("items");
        for (ChangeItem change : entry.items()) {
            ObjectNode item = items.addObject();
            item.put("field", change.field());
            item.put("from", change.from());
            item.put("fromString", change.fromDisplay());
            item.put("to", change.to());
            item.put("toString", change.toDisplay());
        }
        return node;
    }

    /**
     * A link as seen from {@code self}: the other end is rendered as inward or outward issue.
     */
    public ObjectNode issueLink(IssueLink link, WorkItem self, EntityLookup lookup) {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", link.id());
        lookup.linkType(link.typeName()).ifPresent(t -> node.set("type", linkType(t)));
        boolean selfIsInward = self.key().equals(link.inwardKey());
        String otherKey = selfIsInward ? link.outwardKey() : link.inwardKey();
        lookup.item(otherKey).ifPresent(other ->
                node.set(selfIsInward ? "outwardIssue" : "inwardIssue", issueSummary(other, lookup)));
        return node;
    }

    public ObjectNode issueSummary(WorkItem item, EntityLookup lookup) {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", item.id());
        node.put("key", item.key());
        ObjectNode fields = node.putObject("fields");
        fields.put("summary", item.summary());
        lookup.status(item.statusId()).ifPresent(s -> fields.set("status", status(s, lookup)));
        lookup.issueType(item.issueTypeId()).ifPresent(t -> fields.set("issuetype", issueType(t)));
        return node;
    }

    public ObjectNode serviceDesk(Project project) {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", project.id());
        node.put("projectId", project.id());
        node.put("projectKey", project.key());
        node.put("projectName", project.name());
        return node;
    }

    public ObjectNode serviceRequest(ServiceRequest request, WorkItem item, EntityLookup lookup) {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", request.id());
        node.put("issueId", item.id());
        node.put("issueKey", item.key());
        node.put("serviceDeskId", request.serviceDeskId());
        node.put("requestTypeId", request.requestTypeId());
        node.put("createdDate", request.created().toString());
        node.set("reporter", userOrNull(item.reporterId(), lookup));
        lookup.status(item.statusId()).ifPresent(s -> {
            node.set("status", status(s, lookup));
            ObjectNode current = node.putObject("currentStatus");
            current.put("status", s.name());
            current.put("statusCategory", s.categoryKey());
            current.put("statusDate", item.updated().toString());
        });
        ObjectNode fieldValues = node.putObject("requestFieldValues");
        fieldValues.put("summary", item.summary());
        fieldValues.set("description",
                item.description() != null ? item.description().deepCopy() : Documents.empty());
        ArrayNode approvals = node.putArray("approvals");
        request.approvals().forEach(a -> approvals.add(approval(a, lookup)));
        return node;
    }

    public ObjectNode approval(Approval approval, EntityLookup lookup) {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", approval.id());
        node.put("decision", approval.decision());
        node.put("finalDecision", approval.decision());
        lookup.user(approval.deciderId()).ifPresent(u -> node.set("decider", user(u)));
        node.put("completedDate", approval.created().toString());
        return node;
    }

    public ArrayNode fields() {
        ArrayNode fields = mapper.createArrayNode();
        addField(fields, "summary", "Summary", "string", false);
        addField(fields, "description", "Description", "doc", false);
        addField(fields, "labels", "Labels", "array", false);
        addField(fields, "assignee", "Assignee", "user", false);
        addField(fields, "reporter", "Reporter", "user", false);
        addField(fields, "status", "Status", "status", false);
        addField(fields, "issuetype", "Issue Type", "issuetype", false);
        addField(fields, "project", "Project", "project", false);
        addField(fields, "created", "Created", "datetime", false);
        addField(fields, "updated", "Updated", "datetime", false);
        addField(fields, SPRINT_FIELD, "Sprint", "array", true);
        return fields;
    }

    private void addField(ArrayNode fields, String id, String name, String type, boolean custom) {
        ObjectNode field = fields.addObject();
        field.put("id", id);
        field.put("key", id);
        field.put("name", name);
        field.put("custom", custom);
        field.put("searchable", true);
        field.putObject("schema").put("type", type);
    }

    private JsonNode userOrNull(String accountId, EntityLookup lookup) {
        return lookup.user(accountId).<JsonNode>map(this::user).orElse(mapper.nullNode());
    }

    private static void putInstant(ObjectNode node, String field, Instant value) {
        if (value != null) {
            node.put(field, value.toString());
        }
    }
}
