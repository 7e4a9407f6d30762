package io.github.drompincen.mockjira.runtime.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An issue. Immutable; the store replaces the whole value on every change.
 */
public record WorkItem(
        String id,
        String key,
        String projectKey,
        String issueTypeId,
        String summary,
        JsonNode description,
        String statusId,
        String reporterId,
        String assigneeId,
        List<String> labels,
        Instant created,
        Instant updated,
        Long sprintId,
        List<Comment> comments,
        Map<String, JsonNode> customFields,
        List<ChangelogEntry> changelog,
        List<IssueLink> links
) {

    public WorkItem {
        labels = labels != null ? List.copyOf(labels) : List.of();
        comments = comments != null ? List.copyOf(comments) : List.of();
        customFields = customFields != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(customFields))
                : Map.of();
        changelog = changelog != null ? List.copyOf(changelog) : List.of();
        links = links != null ? List.copyOf(links) : List.of();
    }

    /**
     * Numeric suffix of the key, e.g. 12 for {@code DEV-12}.
     */
    public long keyNumber() {
        return keyNumber(key);
    }

    public static long keyNumber(String key) {
        int dash = key.lastIndexOf('-');
        if (dash < 0) {
            return -1;
        }
        try {
            return Long.parseLong(key.substring(dash + 1));
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    /**
     * Copy whose JSON trees are detached from this instance.
     */
    public WorkItem deepCopy() {
        Map<String, JsonNode> fields = new LinkedHashMap<>();
        customFields.forEach((k, v) -> fields.put(k, v.deepCopy()));
        List<Comment> copiedComments = comments.stream()
                .map(c -> new Comment(c.id(), c.authorId(), c.body() != null ? c.body().deepCopy() : null, c.created()))
                .toList();
        return new WorkItem(id, key, projectKey, issueTypeId, summary,
                description != null ? description.deepCopy() : null, statusId, reporterId, assigneeId,
                labels, created, updated, sprintId, copiedComments, fields, changelog, links);
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static final class Builder {
        private final String id;
        private final String key;
        private final String projectKey;
        private final Instant created;
        private String issueTypeId;
        private String summary;
        private JsonNode description;
        private String statusId;
        private String reporterId;
        private String assigneeId;
        private List<String> labels;
        private Instant updated;
        private Long sprintId;
        private final List<Comment> comments;
        private final Map<String, JsonNode> customFields;
        private final List<ChangelogEntry> changelog;
        private final List<IssueLink> links;

        private Builder(WorkItem item) {
            this.id = item.id;
            this.key = item.key;
            this.projectKey = item.projectKey;
            this.created = item.created;
            this.issueTypeId = item.issueTypeId;
            this.summary = item.summary;
            this.description = item.description;
            this.statusId = item.statusId;
            this.reporterId = item.reporterId;
            this.assigneeId = item.assigneeId;
            this.labels = item.labels;
            this.updated = item.updated;
            this.sprintId = item.sprintId;
            this.comments = new ArrayList<>(item.comments);
            this.customFields = new LinkedHashMap<>(item.customFields);
            this.changelog = new ArrayList<>(item.changelog);
            this.links = new ArrayList<>(item.links);
        }

        public Builder issueTypeId(String issueTypeId) {
            this.issueTypeId = issueTypeId;
            return this;
        }

        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        public Builder description(JsonNode description) {
            this.description = description;
            return this;
        }

        public Builder statusId(String statusId) {
            this.statusId = statusId;
            return this;
        }

        public Builder reporterId(String reporterId) {
            this.reporterId = reporterId;
            return this;
        }

        public Builder assigneeId(String assigneeId) {
            this.assigneeId = assigneeId;
            return this;
        }

        public Builder labels(List<String> labels) {
            this.labels = labels;
            return this;
        }

        public Builder updated(Instant updated) {
            this.updated = updated;
            return this;
        }

        public Builder sprintId(Long sprintId) {
            this.sprintId = sprintId;
            return this;
        }

        public Builder addComment(Comment comment) {
            this.comments.add(comment);
            return this;
        }

        public Builder customField(String fieldId, JsonNode value) {
            if (value == null || value.isNull()) {
                this.customFields.remove(fieldId);
            } else {
                this.customFields.put(fieldId, value.deepCopy());
            }
            return this;
        }

        public Builder addChangelog(ChangelogEntry entry) {
            this.changelog.add(entry);
            return this;
        }

        public Builder addLink(IssueLink link) {
            this.links.add(link);
            return this;
        }

        public WorkItem build() {
            return new WorkItem(id, key, projectKey, issueTypeId, summary, description, statusId,
                    reporterId, assigneeId, labels, created, updated, sprintId, comments,
                    customFields, changelog, links);
        }
    }
}
