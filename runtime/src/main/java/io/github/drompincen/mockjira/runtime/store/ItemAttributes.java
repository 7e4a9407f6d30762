package io.github.drompincen.mockjira.runtime.store;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.mockjira.runtime.model.Sprint;
import io.github.drompincen.mockjira.runtime.model.User;
import io.github.drompincen.mockjira.runtime.model.WorkItem;
import io.github.drompincen.mockjira.runtime.query.AttributeSet;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Flattens work items into the {@link AttributeSet} shape filters are matched against.
 */
final class ItemAttributes {

    private ItemAttributes() {
    }

    static AttributeSet of(WorkItem item, EntityLookup lookup) {
        Map<String, List<String>> values = new LinkedHashMap<>();
        values.put("project", lookup.project(item.projectKey())
                .map(p -> lower(p.key(), p.id(), p.name()))
                .orElse(lower(item.projectKey())));
        values.put("key", lower(item.key(), item.id()));
        values.put("id", lower(item.id()));
        values.put("summary", lower(item.summary()));
        values.put("labels", item.labels().stream().map(ItemAttributes::lower1).toList());
        lookup.status(item.statusId()).ifPresent(s -> {
            values.put("status", lower(s.name(), s.id()));
            values.put("statuscategory", lookup.statusCategory(s.categoryKey())
                    .map(c -> lower(c.key(), c.name(), Integer.toString(c.id())))
                    .orElse(lower(s.categoryKey())));
        });
        lookup.issueType(item.issueTypeId()).ifPresent(t -> values.put("issuetype", lower(t.name(), t.id())));
        values.put("assignee", user(item.assigneeId(), lookup));
        values.put("reporter", user(item.reporterId(), lookup));
        if (item.sprintId() != null) {
            values.put("sprint", lookup.sprint(item.sprintId())
                    .map(s -> lower(Long.toString(s.id()), s.name()))
                    .orElse(lower(Long.toString(item.sprintId()))));
        } else {
            values.put("sprint", List.of());
        }
        item.customFields().forEach((field, value) -> values.put(field.toLowerCase(Locale.ROOT), text(value)));
        return new AttributeSet(values, item.created(), item.updated());
    }

    static AttributeSet ofSprint(Sprint sprint, EntityLookup lookup) {
        Map<String, List<String>> values = new LinkedHashMap<>();
        values.put("sprint", lower(Long.toString(sprint.id()), sprint.name()));
        values.put("board", lower(Long.toString(sprint.boardId())));
        lookup.board(sprint.boardId())
                .flatMap(b -> lookup.project(b.projectKey()))
                .ifPresent(p -> values.put("project", lower(p.key(), p.id(), p.name())));
        values.put("state", lower(sprint.state().wireName()));
        return new AttributeSet(values, sprint.startDate(), sprint.startDate());
    }

    private static List<String> user(String accountId, EntityLookup lookup) {
        if (accountId == null) {
            return List.of();
        }
        return lookup.user(accountId)
                .map(ItemAttributes::userValues)
                .orElse(lower(accountId));
    }

    private static List<String> userValues(User u) {
        return lower(u.accountId(), u.displayName(), u.email());
    }

    private static List<String> text(JsonNode value) {
        List<String> out = new ArrayList<>();
        if (value.isArray()) {
            value.forEach(v -> out.addAll(text(v)));
        } else if (value.isObject()) {
            Stream.of("value", "name", "key", "id", "accountId")
                    .map(value::get)
                    .filter(Objects::nonNull)
                    .map(JsonNode::asText)
                    .map(ItemAttributes::lower1)
                    .forEach(out::add);
        } else if (!value.isNull()) {
            out.add(lower1(value.asText()));
        }
        return out;
    }

    private static List<String> lower(String... values) {
        return Stream.of(values).filter(Objects::nonNull).map(ItemAttributes::lower1).distinct().toList();
    }

    private static String lower1(String value) {
        return value.toLowerCase(Locale.ROOT);
    }
}
