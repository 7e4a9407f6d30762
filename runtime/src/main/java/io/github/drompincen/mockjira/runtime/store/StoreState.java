package io.github.drompincen.mockjira.runtime.store;

import io.github.drompincen.mockjira.runtime.model.AuthToken;
import io.github.drompincen.mockjira.runtime.model.Board;
import io.github.drompincen.mockjira.runtime.model.IssueLinkType;
import io.github.drompincen.mockjira.runtime.model.IssueType;
import io.github.drompincen.mockjira.runtime.model.Project;
import io.github.drompincen.mockjira.runtime.model.ServiceRequest;
import io.github.drompincen.mockjira.runtime.model.Sprint;
import io.github.drompincen.mockjira.runtime.model.Status;
import io.github.drompincen.mockjira.runtime.model.StatusCategory;
import io.github.drompincen.mockjira.runtime.model.Transition;
import io.github.drompincen.mockjira.runtime.model.User;
import io.github.drompincen.mockjira.runtime.model.WebhookRegistration;
import io.github.drompincen.mockjira.runtime.model.WorkItem;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable collections behind {@link InMemoryStore}. Only touched while holding the store lock.
 */
final class StoreState implements EntityLookup {

    static final String SEQ_ISSUE = "issue";
    static final String SEQ_COMMENT = "comment";
    static final String SEQ_REQUEST = "request";
    static final String SEQ_WEBHOOK = "webhook";
    static final String SEQ_LINK = "link";
    static final String SEQ_CHANGELOG = "changelog";
    static final String SEQ_SPRINT = "sprint";

    static final Map<String, Long> SEQUENCE_STARTS = Map.of(
            SEQ_ISSUE, 10000L,
            SEQ_COMMENT, 20000L,
            SEQ_REQUEST, 30000L,
            SEQ_WEBHOOK, 40000L,
            SEQ_LINK, 60000L,
            SEQ_CHANGELOG, 70000L,
            SEQ_SPRINT, 1L);

    final Map<String, User> users = new LinkedHashMap<>();
    final Map<String, AuthToken> tokens = new LinkedHashMap<>();
    final Map<String, StatusCategory> statusCategories = new LinkedHashMap<>();
    final Map<String, Status> statuses = new LinkedHashMap<>();
    final List<Transition> transitions = new ArrayList<>();
    final Map<String, IssueType> issueTypes = new LinkedHashMap<>();
    final Map<String, IssueLinkType> linkTypes = new LinkedHashMap<>();
    final Map<String, Project> projects = new LinkedHashMap<>();
    final Map<Long, Board> boards = new LinkedHashMap<>();
    final Map<Long, Sprint> sprints = new LinkedHashMap<>();
    final Map<String, WorkItem> items = new LinkedHashMap<>();
    final Map<String, String> itemKeysById = new LinkedHashMap<>();
    final Map<String, ServiceRequest> serviceRequests = new LinkedHashMap<>();
    final Map<String, WebhookRegistration> webhooks = new LinkedHashMap<>();
    final Map<String, Long> projectCounters = new LinkedHashMap<>();
    final Map<String, Long> sequences = new LinkedHashMap<>(SEQUENCE_STARTS);

    static StoreState from(StoreSnapshot snapshot) {
        StoreState state = new StoreState();
        snapshot.users().forEach(u -> state.users.put(u.accountId(), u));
        snapshot.tokens().forEach(t -> state.tokens.put(t.token(), t));
        snapshot.statusCategories().forEach(c -> state.statusCategories.put(c.key(), c));
        snapshot.statuses().forEach(s -> state.statuses.put(s.id(), s));
        state.transitions.addAll(snapshot.transitions());
        snapshot.issueTypes().forEach(t -> state.issueTypes.put(t.id(), t));
        snapshot.linkTypes().forEach(t -> state.linkTypes.put(t.id(), t));
        snapshot.projects().forEach(p -> state.projects.put(p.key(), p));
        snapshot.boards().forEach(b -> state.boards.put(b.id(), b));
        snapshot.sprints().forEach(s -> state.sprints.put(s.id(), s));
        snapshot.items().forEach(state::putItem);
        snapshot.serviceRequests().forEach(r -> state.serviceRequests.put(r.id(), r));
        snapshot.webhooks().forEach(w -> state.webhooks.put(w.id(), w));
        state.projectCounters.putAll(snapshot.projectCounters());
        state.sequences.putAll(snapshot.sequences());
        state.reconcileCounters();
        return state;
    }

    StoreSnapshot toSnapshot() {
        return new StoreSnapshot(
                new ArrayList<>(users.values()),
                new ArrayList<>(tokens.values()),
                new ArrayList<>(statusCategories.values()),
                new ArrayList<>(statuses.values()),
                new ArrayList<>(transitions),
                new ArrayList<>(issueTypes.values()),
                new ArrayList<>(linkTypes.values()),
                new ArrayList<>(projects.values()),
                new ArrayList<>(boards.values()),
                new ArrayList<>(sprints.values()),
                items.values().stream().map(WorkItem::deepCopy).toList(),
                new ArrayList<>(serviceRequests.values()),
                new ArrayList<>(webhooks.values()),
                new LinkedHashMap<>(projectCounters),
                new LinkedHashMap<>(sequences));
    }

    void putItem(WorkItem item) {
        items.put(item.key(), item);
        itemKeysById.put(item.id(), item.key());
    }

    long nextSequence(String name) {
        long value = sequences.getOrDefault(name, SEQUENCE_STARTS.getOrDefault(name, 1L));
        sequences.put(name, value + 1);
        return value;
    }

    long nextKeyNumber(String projectKey) {
        long next = projectCounters.getOrDefault(projectKey, 0L) + 1;
        projectCounters.put(projectKey, next);
        return next;
    }

    /**
     * Raises counters and sequences so they never hand out an id that already exists.
     */
    private void reconcileCounters() {
        for (WorkItem item : items.values()) {
            projectCounters.merge(item.projectKey(), item.keyNumber(), Math::max);
            bump(SEQ_ISSUE, item.id());
            item.comments().forEach(c -> bump(SEQ_COMMENT, c.id()));
            item.changelog().forEach(c -> bump(SEQ_CHANGELOG, c.id()));
            item.links().forEach(l -> bump(SEQ_LINK, l.id()));
        }
        serviceRequests.keySet().forEach(id -> bump(SEQ_REQUEST, id));
        webhooks.keySet().forEach(id -> bump(SEQ_WEBHOOK, id));
        sprints.keySet().forEach(id -> bump(SEQ_SPRINT, Long.toString(id)));
    }

    private void bump(String sequence, String id) {
        try {
            long numeric = Long.parseLong(id);
            long current = sequences.getOrDefault(sequence, SEQUENCE_STARTS.getOrDefault(sequence, 1L));
            sequences.put(sequence, Math.max(current, numeric + 1));
        } catch (NumberFormatException e) {
            // non-numeric ids never collide with generated ones
            sequences.putIfAbsent(sequence, SEQUENCE_STARTS.getOrDefault(sequence, 1L));
        }
    }

    Optional<Status> firstStatusInCategory(String categoryKey) {
        return statuses.values().stream().filter(s -> s.categoryKey().equals(categoryKey)).findFirst();
    }

    List<Transition> transitionsFrom(String statusId) {
        return transitions.stream().filter(t -> t.fromStatusId().equals(statusId)).toList();
    }

    Optional<ServiceRequest> serviceRequestFor(String issueKey) {
        return serviceRequests.values().stream().filter(r -> r.issueKey().equals(issueKey)).findFirst();
    }

    @Override
    public Optional<User> user(String accountId) {
        return accountId == null ? Optional.empty() : Optional.ofNullable(users.get(accountId));
    }

    @Override
    public Optional<Status> status(String statusId) {
        if (statusId == null) {
            return Optional.empty();
        }
        Status byId = statuses.get(statusId);
        if (byId != null) {
            return Optional.of(byId);
        }
        return statuses.values().stream().filter(s -> s.name().equalsIgnoreCase(statusId)).findFirst();
    }

    @Override
    public Optional<StatusCategory> statusCategory(String key) {
        return key == null ? Optional.empty() : Optional.ofNullable(statusCategories.get(key));
    }

    @Override
    public Optional<IssueType> issueType(String idOrName) {
        if (idOrName == null) {
            return Optional.empty();
        }
        IssueType byId = issueTypes.get(idOrName);
        if (byId != null) {
            return Optional.of(byId);
        }
        return issueTypes.values().stream().filter(t -> t.name().equalsIgnoreCase(idOrName)).findFirst();
    }

    @Override
    public Optional<Project> project(String keyOrId) {
        if (keyOrId == null) {
            return Optional.empty();
        }
        Project byKey = projects.get(keyOrId);
        if (byKey != null) {
            return Optional.of(byKey);
        }
        return projects.values().stream()
                .filter(p -> p.id().equals(keyOrId) || p.key().equalsIgnoreCase(keyOrId))
                .findFirst();
    }

    @Override
    public Optional<Board> board(long boardId) {
        return Optional.ofNullable(boards.get(boardId));
    }

    @Override
    public Optional<Sprint> sprint(long sprintId) {
        return Optional.ofNullable(sprints.get(sprintId));
    }

    @Override
    public Optional<WorkItem> item(String idOrKey) {
        if (idOrKey == null) {
            return Optional.empty();
        }
        WorkItem byKey = items.get(idOrKey);
        if (byKey != null) {
            return Optional.of(byKey);
        }
        String key = itemKeysById.get(idOrKey);
        if (key != null) {
            return Optional.ofNullable(items.get(key));
        }
        return Optional.ofNullable(items.get(idOrKey.toUpperCase(Locale.ROOT)));
    }

    @Override
    public Optional<IssueLinkType> linkType(String idOrName) {
        if (idOrName == null) {
            return Optional.empty();
        }
        IssueLinkType byId = linkTypes.get(idOrName);
        if (byId != null) {
            return Optional.of(byId);
        }
        return linkTypes.values().stream().filter(t -> t.name().equalsIgnoreCase(idOrName)).findFirst();
    }
}
