package io.github.gittask.remote;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.gittask.exception.GitTaskException;
import io.github.gittask.exception.NotFoundException;
import io.github.gittask.exception.RemoteFailureException;
import io.github.gittask.exception.UnsupportedRemoteOperationException;
import io.github.gittask.exception.ValidationException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Redmine REST API. Journals with notes are the comments of an issue; Redmine has no labels.
 */
public class RedmineTracker extends HttpTracker {
    private static final Logger logger = LogManager.getLogger(RedmineTracker.class);
    static final int PAGE_SIZE = 100;

    private final String projectId;
    private @Nullable List<StatusInfo> statusesCache;

    record StatusInfo(long id, String name, boolean closed) {}

    public RedmineTracker(OkHttpClient client, String baseUrl, String projectId) throws ValidationException {
        super(client, baseUrl);
        if (projectId.isBlank()) {
            throw new ValidationException("Redmine project is not configured (task.redmine.project.id)");
        }
        this.projectId = projectId;
    }

    @Override
    public TrackerKind kind() {
        return TrackerKind.REDMINE;
    }

    private HttpUrl.Builder json(String... segments) {
        var builder = baseUrl.newBuilder();
        for (int i = 0; i < segments.length; i++) {
            builder.addPathSegment(i == segments.length - 1 ? segments[i] + ".json" : segments[i]);
        }
        return builder;
    }

    synchronized List<StatusInfo> statuses() throws GitTaskException {
        if (statusesCache == null) {
            var result = new ArrayList<StatusInfo>();
            for (JsonNode node : get(json("issue_statuses").build(), "issue statuses").path("issue_statuses")) {
                result.add(new StatusInfo(
                        node.path("id").asLong(), node.path("name").asText(), node.path("is_closed").asBoolean(false)));
            }
            statusesCache = List.copyOf(result);
        }
        return statusesCache;
    }

    private boolean isClosed(JsonNode status) throws GitTaskException {
        if (status.has("is_closed")) {
            return status.path("is_closed").asBoolean();
        }
        long id = status.path("id").asLong();
        return statuses().stream().anyMatch(s -> s.id() == id && s.closed());
    }

    RemoteIssue toIssue(JsonNode node) throws GitTaskException {
        JsonNode status = node.path("status");
        int comments = 0;
        for (JsonNode journal : node.path("journals")) {
            if (!journal.path("notes").asText("").isEmpty()) {
                comments++;
            }
        }
        return new RemoteIssue(
                node.path("id").asText(),
                node.path("subject").asText(""),
                node.path("description").asText(""),
                node.path("author").path("name").asText(""),
                RemoteDates.toEpochSeconds(node.path("created_on").asText(null)),
                !isClosed(status),
                status.path("name").asText(null),
                List.of(),
                comments);
    }

    @Override
    public Iterator<RemoteIssue> listIssues(IssueQuery query) throws GitTaskException {
        if (query.ids() != null) {
            return PagedIterator.ofSingles(query.ids(), id -> {
                try {
                    var issue = getIssue(id);
                    return query.accepts(issue) ? issue : null;
                } catch (NotFoundException e) {
                    logger.warn("Redmine issue {} not found, skipping", id);
                    return null;
                } catch (GitTaskException e) {
                    throw HttpErrors.forListing(kind(), e);
                }
            }, query.limit());
        }
        return new PagedIterator<>(page -> {
            var url = json("issues")
                    .addQueryParameter("project_id", projectId)
                    .addQueryParameter("sort", "created_on:desc")
                    .addQueryParameter("offset", Integer.toString(page * PAGE_SIZE))
                    .addQueryParameter("limit", Integer.toString(PAGE_SIZE))
                    .addQueryParameter("status_id", switch (query.state()) {
                        case OPEN -> "open";
                        case CLOSED -> "closed";
                        case ALL -> "*";
                    });
            if (query.since() != null) {
                url.addQueryParameter("created_on", ">=" + RemoteDates.toIso(query.since()));
            }
            var root = getPage(url.build(), "issues of " + projectId);
            var result = new ArrayList<RemoteIssue>();
            try {
                for (JsonNode node : root.path("issues")) {
                    result.add(toIssue(node));
                }
            } catch (GitTaskException e) {
                throw HttpErrors.forListing(kind(), e);
            }
            int total = root.path("total_count").asInt(0);
            return new PagedIterator.Page<>(result, result.isEmpty() || (page * PAGE_SIZE) + result.size() >= total);
        }, query.limit());
    }

    @Override
    public RemoteIssue getIssue(String id) throws GitTaskException {
        var url = json("issues", id).addQueryParameter("include", "journals").build();
        return toIssue(get(url, "issue " + id).path("issue"));
    }

    @Override
    public String createIssue(IssueFields fields) throws GitTaskException {
        var body = mapper.createObjectNode();
        var issue = body.putObject("issue");
        issue.put("project_id", projectId);
        issue.put("subject", fields.title());
        issue.put("description", fields.body());
        var created = send("POST", json("issues").build(), body, "new issue");
        String id = created.path("issue").path("id").asText();
        if (!fields.open() || fields.statusText() != null) {
            var target = targetStatus(fields);
            if (target != null) {
                var update = mapper.createObjectNode();
                update.putObject("issue").put("status_id", target.id());
                send("PUT", json("issues", id).build(), update, "issue " + id);
            }
        }
        logger.info("Created Redmine issue {} in {}", id, projectId);
        return id;
    }

    /** The status named like the local one, or else the first one on the requested side of open/closed. */
    private @Nullable StatusInfo targetStatus(IssueFields fields) throws GitTaskException {
        var statuses = statuses();
        if (fields.statusText() != null) {
            for (StatusInfo status : statuses) {
                if (status.name().equalsIgnoreCase(fields.statusText())) {
                    return status;
                }
            }
        }
        return statuses.stream().filter(s -> s.closed() != fields.open()).findFirst().orElse(null);
    }

    @Override
    public void updateIssue(String id, IssueFields fields) throws GitTaskException {
        var current = getIssue(id);
        var body = mapper.createObjectNode();
        ObjectNode issue = body.putObject("issue");
        issue.put("subject", fields.title());
        issue.put("description", fields.body());
        boolean statusDiffers = fields.statusText() != null
                ? !fields.statusText().equalsIgnoreCase(current.statusText())
                : current.open() != fields.open();
        if (statusDiffers) {
            var target = targetStatus(fields);
            if (target == null) {
                throw new RemoteFailureException(kind(), RemoteFailureException.Reason.HTTP, false,
                        "No Redmine status matches " + (fields.statusText() != null ? fields.statusText()
                                : fields.open() ? "an open state" : "a closed state"));
            }
            issue.put("status_id", target.id());
        }
        send("PUT", json("issues", id).build(), body, "issue " + id);
    }

    @Override
    public void deleteIssue(String id) throws GitTaskException {
        send("DELETE", json("issues", id).build(), null, "issue " + id);
    }

    private List<RemoteComment> journals(String issueId) throws GitTaskException {
        var url = json("issues", issueId).addQueryParameter("include", "journals").build();
        var result = new ArrayList<RemoteComment>();
        for (JsonNode journal : get(url, "issue " + issueId).path("issue").path("journals")) {
            String notes = journal.path("notes").asText("");
            if (!notes.isEmpty()) {
                result.add(new RemoteComment(
                        journal.path("id").asText(),
                        journal.path("user").path("name").asText(""),
                        RemoteDates.toEpochSeconds(journal.path("created_on").asText(null)),
                        notes));
            }
        }
        return result;
    }

    @Override
    public Iterator<RemoteComment> listComments(String issueId) throws GitTaskException {
        return new PagedIterator<>(page -> {
            try {
                return new PagedIterator.Page<>(journals(issueId), true);
            } catch (GitTaskException e) {
                throw HttpErrors.forListing(kind(), e);
            }
        }, null);
    }

    /** Redmine does not return the journal it creates, so the newest journal with the same notes is taken. */
    @Override
    public String createComment(String issueId, String body) throws GitTaskException {
        var request = mapper.createObjectNode();
        request.putObject("issue").put("notes", body);
        send("PUT", json("issues", issueId).build(), request, "issue " + issueId);
        String id = null;
        for (RemoteComment comment : journals(issueId)) {
            if (comment.body().equals(body)) {
                id = comment.id();
            }
        }
        if (id == null) {
            throw new RemoteFailureException(kind(), RemoteFailureException.Reason.HTTP, false,
                    "Redmine did not record the note on issue " + issueId);
        }
        return id;
    }

    @Override
    public void updateComment(String issueId, String commentId, String body) throws GitTaskException {
        var request = mapper.createObjectNode();
        request.putObject("journal").put("notes", body);
        send("PUT", json("journals", commentId).build(), request, "journal " + commentId);
    }

    /** Clearing the notes removes a journal that has no other changes. */
    @Override
    public void deleteComment(String issueId, String commentId) throws GitTaskException {
        updateComment(issueId, commentId, "");
    }

    @Override
    public List<RemoteLabel> listLabels() {
        return List.of();
    }

    @Override
    public boolean supportsLabelCreation() {
        return false;
    }

    @Override
    public void createLabel(RemoteLabel label) throws GitTaskException {
        throw new UnsupportedRemoteOperationException(kind(), "labels");
    }

    @Override
    public void updateLabel(RemoteLabel label) throws GitTaskException {
        throw new UnsupportedRemoteOperationException(kind(), "labels");
    }
}
