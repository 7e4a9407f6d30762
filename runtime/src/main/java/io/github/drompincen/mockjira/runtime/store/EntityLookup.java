package io.github.drompincen.mockjira.runtime.store;

import io.github.drompincen.mockjira.runtime.model.Board;
import io.github.drompincen.mockjira.runtime.model.IssueLinkType;
import io.github.drompincen.mockjira.runtime.model.IssueType;
import io.github.drompincen.mockjira.runtime.model.Project;
import io.github.drompincen.mockjira.runtime.model.Sprint;
import io.github.drompincen.mockjira.runtime.model.Status;
import io.github.drompincen.mockjira.runtime.model.StatusCategory;
import io.github.drompincen.mockjira.runtime.model.User;
import io.github.drompincen.mockjira.runtime.model.WorkItem;

import java.util.Optional;

/**
 * Read-only resolution of references between entities.
 */
public interface EntityLookup {

    Optional<User> user(String accountId);

    Optional<Status> status(String statusId);

    Optional<StatusCategory> statusCategory(String key);

    Optional<IssueType> issueType(String issueTypeId);

    Optional<Project> project(String keyOrId);

    Optional<Board> board(long boardId);

    Optional<Sprint> sprint(long sprintId);

    Optional<WorkItem> item(String idOrKey);

    Optional<IssueLinkType> linkType(String idOrName);
}
