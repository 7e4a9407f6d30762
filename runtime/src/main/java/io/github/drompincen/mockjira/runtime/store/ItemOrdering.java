package io.github.drompincen.mockjira.runtime.store;

import io.github.drompincen.mockjira.runtime.model.WorkItem;
import io.github.drompincen.mockjira.runtime.query.SortKey;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Comparator for ORDER BY clauses. Unsorted queries order by creation time; key is always the final
 * tiebreak.
 */
final class ItemOrdering {

    private static final Comparator<WorkItem> BY_KEY = Comparator
            .comparing(WorkItem::projectKey)
            .thenComparingLong(WorkItem::keyNumber);

    private ItemOrdering() {
    }

    static Comparator<WorkItem> of(List<SortKey> sortKeys, EntityLookup lookup) {
        if (sortKeys.isEmpty()) {
            return Comparator.comparing(WorkItem::created).thenComparing(BY_KEY);
        }
        Comparator<WorkItem> comparator = null;
        for (SortKey key : sortKeys) {
            Comparator<WorkItem> next = single(key.field(), lookup);
            if (key.descending()) {
                next = next.reversed();
            }
            comparator = comparator == null ? next : comparator.thenComparing(next);
        }
        return comparator.thenComparing(BY_KEY);
    }

    private static Comparator<WorkItem> single(String field, EntityLookup lookup) {
        return switch (field) {
            case "created" -> Comparator.comparing(WorkItem::created);
            case "updated" -> Comparator.comparing(WorkItem::updated);
            case "key", "id" -> BY_KEY;
            case "project" -> Comparator.comparing(WorkItem::projectKey);
            case "summary" -> Comparator.comparing(i -> i.summary().toLowerCase(Locale.ROOT));
            case "status" -> Comparator.comparing(i -> lookup.status(i.statusId()).map(s -> s.name()).orElse(""));
            case "issuetype" -> Comparator.comparing(i -> lookup.issueType(i.issueTypeId())
                    .map(t -> t.name()).orElse(""));
            case "assignee" -> Comparator.comparing(i -> displayName(i.assigneeId(), lookup),
                    Comparator.nullsLast(Comparator.naturalOrder()));
            case "reporter" -> Comparator.comparing(i -> displayName(i.reporterId(), lookup),
                    Comparator.nullsLast(Comparator.naturalOrder()));
            case "sprint" -> Comparator.comparing(WorkItem::sprintId, Comparator.nullsLast(Comparator.naturalOrder()));
            default -> Comparator.comparing(i -> ItemAttributes.of(i, lookup).get(field).stream()
                    .findFirst().orElse(null), Comparator.nullsLast(Comparator.naturalOrder()));
        };
    }

    private static String displayName(String accountId, EntityLookup lookup) {
        return lookup.user(accountId).map(u -> u.displayName()).orElse(null);
    }
}
