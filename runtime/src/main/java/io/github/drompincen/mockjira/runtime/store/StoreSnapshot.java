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

import java.util.List;
import java.util.Map;

/**
 * Complete, serialisable copy of the store: every entity plus the key counters and id sequences.
 */
public record StoreSnapshot(
        List<User> users,
        List<AuthToken> tokens,
        List<StatusCategory> statusCategories,
        List<Status> statuses,
        List<Transition> transitions,
        List<IssueType> issueTypes,
        List<IssueLinkType> linkTypes,
        List<Project> projects,
        List<Board> boards,
        List<Sprint> sprints,
        List<WorkItem> items,
        List<ServiceRequest> serviceRequests,
        List<WebhookRegistration> webhooks,
        Map<String, Long> projectCounters,
        Map<String, Long> sequences
) {

    public StoreSnapshot {
        users = nonNull(users);
        tokens = nonNull(tokens);
        statusCategories = nonNull(statusCategories);
        statuses = nonNull(statuses);
        transitions = nonNull(transitions);
        issueTypes = nonNull(issueTypes);
        linkTypes = nonNull(linkTypes);
        projects = nonNull(projects);
        boards = nonNull(boards);
        sprints = nonNull(sprints);
        items = nonNull(items);
        serviceRequests = nonNull(serviceRequests);
        webhooks = nonNull(webhooks);
        projectCounters = projectCounters != null ? Map.copyOf(projectCounters) : Map.of();
        sequences = sequences != null ? Map.copyOf(sequences) : Map.of();
    }

    private static <T> List<T> nonNull(List<T> list) {
        return list != null ? List.copyOf(list) : List.of();
    }
}
