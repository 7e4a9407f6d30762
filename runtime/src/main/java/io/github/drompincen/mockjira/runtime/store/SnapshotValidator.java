package io.github.drompincen.mockjira.runtime.store;

import io.github.drompincen.mockjira.runtime.model.Approval;
import io.github.drompincen.mockjira.runtime.model.Board;
import io.github.drompincen.mockjira.runtime.model.Comment;
import io.github.drompincen.mockjira.runtime.model.IssueLink;
import io.github.drompincen.mockjira.runtime.model.Project;
import io.github.drompincen.mockjira.runtime.model.ServiceRequest;
import io.github.drompincen.mockjira.runtime.model.Sprint;
import io.github.drompincen.mockjira.runtime.model.Status;
import io.github.drompincen.mockjira.runtime.model.Transition;
import io.github.drompincen.mockjira.runtime.model.WebhookRegistration;
import io.github.drompincen.mockjira.runtime.model.WorkItem;
import io.github.drompincen.mockjira.runtime.query.QueryParser;
import io.github.drompincen.mockjira.runtime.query.QuerySyntaxException;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Referential integrity checks run before a snapshot replaces the store.
 */
public final class SnapshotValidator {

    private SnapshotValidator() {
    }

    /**
     * @return broken references keyed by the path of the offending entity; empty when the snapshot is consistent
     */
    public static Map<String, String> validate(StoreSnapshot snapshot) {
        Map<String, String> errors = new LinkedHashMap<>();
        if (snapshot == null) {
            errors.put("snapshot", "Snapshot body is required");
            return errors;
        }
        Set<String> users = ids(snapshot.users(), u -> u.accountId(), "users", errors);
        Set<String> categories = ids(snapshot.statusCategories(), c -> c.key(), "statusCategories", errors);
        Set<String> statuses = ids(snapshot.statuses(), s -> s.id(), "statuses", errors);
        Set<String> issueTypes = ids(snapshot.issueTypes(), t -> t.id(), "issueTypes", errors);
        Set<String> linkTypeNames = snapshot.linkTypes().stream().map(t -> t.name()).collect(Collectors.toSet());
        Set<String> projects = ids(snapshot.projects(), p -> p.key(), "projects", errors);
        Set<Long> boards = snapshot.boards().stream().map(Board::id).collect(Collectors.toSet());
        Set<Long> sprints = snapshot.sprints().stream().map(Sprint::id).collect(Collectors.toSet());
        Set<String> items = ids(snapshot.items(), i -> i.key(), "items", errors);
        ids(snapshot.items(), i -> i.id(), "items", errors);
        ids(snapshot.tokens(), t -> t.token(), "tokens", errors);
        Set<String> deskProjects = snapshot.projects().stream()
                .filter(Project::isServiceDesk)
                .map(Project::key)
                .collect(Collectors.toSet());

        snapshot.tokens().forEach(t -> require(users, t.accountId(), "tokens[" + t.token() + "].accountId", errors));
        for (Status status : snapshot.statuses()) {
            require(categories, status.categoryKey(), "statuses[" + status.id() + "].categoryKey", errors);
        }
        for (Transition t : snapshot.transitions()) {
            require(statuses, t.fromStatusId(), "transitions[" + t.id() + "].fromStatusId", errors);
            require(statuses, t.toStatusId(), "transitions[" + t.id() + "].toStatusId", errors);
        }
        for (Project p : snapshot.projects()) {
            require(users, p.leadAccountId(), "projects[" + p.key() + "].leadAccountId", errors);
        }
        for (Board b : snapshot.boards()) {
            require(projects, b.projectKey(), "boards[" + b.id() + "].projectKey", errors);
        }
        for (Sprint s : snapshot.sprints()) {
            if (!boards.contains(s.boardId())) {
                errors.put("sprints[" + s.id() + "].boardId", "Board " + s.boardId() + " does not exist");
            }
            if (s.state() == null) {
                errors.put("sprints[" + s.id() + "].state", "Sprint state is required");
            }
        }
        for (WorkItem item : snapshot.items()) {
            if (item.key() == null || item.key().isBlank()) {
                continue;
            }
            String path = "items[" + item.key() + "]";
            require(projects, item.projectKey(), path + ".projectKey", errors);
            if (!item.key().startsWith(item.projectKey() + "-") || item.keyNumber() < 1) {
                errors.put(path + ".key", "Key must be " + item.projectKey() + "-<number>");
            }
            require(issueTypes, item.issueTypeId(), path + ".issueTypeId", errors);
            require(statuses, item.statusId(), path + ".statusId", errors);
            require(users, item.reporterId(), path + ".reporterId", errors);
            if (item.assigneeId() != null) {
                require(users, item.assigneeId(), path + ".assigneeId", errors);
            }
            if (item.sprintId() != null && !sprints.contains(item.sprintId())) {
                errors.put(path + ".sprintId", "Sprint " + item.sprintId() + " does not exist");
            }
            if (item.created() == null || item.updated() == null || item.updated().isBefore(item.created())) {
                errors.put(path + ".updated", "Updated must not be before created");
            }
            for (Comment c : item.comments()) {
                require(users, c.authorId(), path + ".comments[" + c.id() + "].authorId", errors);
            }
            for (IssueLink l : item.links()) {
                require(linkTypeNames, l.typeName(), path + ".links[" + l.id() + "].typeName", errors);
                require(items, l.inwardKey(), path + ".links[" + l.id() + "].inwardKey", errors);
                require(items, l.outwardKey(), path + ".links[" + l.id() + "].outwardKey", errors);
            }
        }
        Set<String> requestItems = new HashSet<>();
        for (ServiceRequest r : snapshot.serviceRequests()) {
            require(items, r.issueKey(), "serviceRequests[" + r.id() + "].issueKey", errors);
            if (!requestItems.add(r.issueKey())) {
                errors.put("serviceRequests[" + r.id() + "].issueKey", "Issue " + r.issueKey()
                        + " already has a request");
            }
            for (Approval a : r.approvals()) {
                if (a.id() == null || a.id().isBlank()) {
                    errors.put("serviceRequests[" + r.id() + "].approvals", "Every approval needs an identifier");
                }
            }
        }
        for (WorkItem item : snapshot.items()) {
            if (item.key() != null && deskProjects.contains(item.projectKey()) && !requestItems.contains(item.key())) {
                errors.put("items[" + item.key() + "].serviceRequest", "Service-desk issue " + item.key()
                        + " has no request");
            }
        }
        for (WebhookRegistration w : snapshot.webhooks()) {
            if (w.jqlFilter() != null && !w.jqlFilter().isBlank()) {
                try {
                    QueryParser.parse(w.jqlFilter());
                } catch (QuerySyntaxException e) {
                    errors.put("webhooks[" + w.id() + "].jqlFilter", e.getMessage());
                }
            }
        }
        return errors;
    }

    private static <T> Set<String> ids(Iterable<T> entities, Function<T, String> id, String path,
                                       Map<String, String> errors) {
        Set<String> seen = new HashSet<>();
        for (T entity : entities) {
            String value = id.apply(entity);
            if (value == null || value.isBlank()) {
                errors.put(path, "Every entry needs an identifier");
            } else if (!seen.add(value)) {
                errors.put(path + "[" + value + "]", "Duplicate identifier " + value);
            }
        }
        return seen;
    }

    private static void require(Set<String> known, String value, String path, Map<String, String> errors) {
        if (value == null || !known.contains(value)) {
            errors.put(path, "Unknown reference '" + value + "'");
        }
    }
}
