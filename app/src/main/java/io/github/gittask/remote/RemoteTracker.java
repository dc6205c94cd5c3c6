package io.github.gittask.remote;

import io.github.gittask.exception.GitTaskException;
import java.util.Iterator;
import java.util.List;

/**
 * Uniform access to one project on an issue tracker. Listing methods are lazy: pages are fetched as the iterator
 * advances, and a failure while paging surfaces as
 * {@link io.github.gittask.exception.RemoteFailureException.Unchecked}.
 *
 * <p>Failures are reported as {@link io.github.gittask.exception.NotFoundException} for a missing issue or
 * comment, {@link io.github.gittask.exception.RemoteFailureException} for transport and server errors, and
 * {@link io.github.gittask.exception.UnsupportedRemoteOperationException} where the tracker lacks the feature.
 */
public interface RemoteTracker {
    TrackerKind kind();

    Iterator<RemoteIssue> listIssues(IssueQuery query) throws GitTaskException;

    RemoteIssue getIssue(String id) throws GitTaskException;

    /** @return the id of the new issue */
    String createIssue(IssueFields fields) throws GitTaskException;

    void updateIssue(String id, IssueFields fields) throws GitTaskException;

    void deleteIssue(String id) throws GitTaskException;

    Iterator<RemoteComment> listComments(String issueId) throws GitTaskException;

    /** @return the id of the new comment */
    String createComment(String issueId, String body) throws GitTaskException;

    void updateComment(String issueId, String commentId, String body) throws GitTaskException;

    void deleteComment(String issueId, String commentId) throws GitTaskException;

    List<RemoteLabel> listLabels() throws GitTaskException;

    void createLabel(RemoteLabel label) throws GitTaskException;

    void updateLabel(RemoteLabel label) throws GitTaskException;

    /** Whether the tracker has labels at all; {@link #createLabel} throws when this is false. */
    default boolean supportsLabelCreation() {
        return true;
    }
}
