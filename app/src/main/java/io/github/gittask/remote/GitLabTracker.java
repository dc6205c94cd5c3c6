package io.github.gittask.remote;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.gittask.exception.GitTaskException;
import io.github.gittask.exception.NotFoundException;
import io.github.gittask.exception.RemoteFailureException;
import io.github.gittask.exception.ValidationException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/** GitLab REST v4. Issues are addressed by their project-scoped {@code iid}; notes serve as comments. */
public class GitLabTracker extends HttpTracker {
    private static final Logger logger = LogManager.getLogger(GitLabTracker.class);

    public static final String DEFAULT_URL = "https://gitlab.com";
    static final int PAGE_SIZE = 100;

    private final String project;

    /**
     * @param url instance root, e.g. {@code https://gitlab.com}
     * @param project {@code namespace/name} path or numeric project id
     */
    public GitLabTracker(OkHttpClient client, String url, String project) throws ValidationException {
        super(client, stripTrailingSlash(url) + "/api/v4");
        if (project.isBlank()) {
            throw new ValidationException("GitLab project is not configured");
        }
        this.project = project;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    @Override
    public TrackerKind kind() {
        return TrackerKind.GITLAB;
    }

    private HttpUrl.Builder projectUrl(String... segments) {
        var builder = url("projects", project);
        for (String segment : segments) {
            builder.addPathSegment(segment);
        }
        return builder;
    }

    @Override
    public Iterator<RemoteIssue> listIssues(IssueQuery query) throws GitTaskException {
        if (query.ids() != null) {
            return PagedIterator.ofSingles(query.ids(), id -> fetchById(query, id), query.limit());
        }
        return new PagedIterator<>(page -> {
            var url = projectUrl("issues")
                    .addQueryParameter("scope", "all")
                    .addQueryParameter("order_by", "created_at")
                    .addQueryParameter("sort", "desc")
                    .addQueryParameter("page", Integer.toString(page + 1))
                    .addQueryParameter("per_page", Integer.toString(PAGE_SIZE));
            switch (query.state()) {
                case OPEN -> url.addQueryParameter("state", "opened");
                case CLOSED -> url.addQueryParameter("state", "closed");
                case ALL -> {}
            }
            if (query.since() != null) {
                url.addQueryParameter("created_after", RemoteDates.toIso(query.since()));
            }
            var result = new ArrayList<RemoteIssue>();
            var issues = getPage(url.build(), "issues of " + project);
            for (JsonNode node : issues) {
                result.add(toIssue(node));
            }
            logger.debug("Fetched {} GitLab issues (page {}) for {}", result.size(), page + 1, project);
            return PagedIterator.Page.of(result, issues.size(), PAGE_SIZE);
        }, query.limit());
    }

    private @Nullable RemoteIssue fetchById(IssueQuery query, String id) throws RemoteFailureException {
        try {
            var issue = getIssue(id);
            return query.accepts(issue) ? issue : null;
        } catch (NotFoundException e) {
            logger.warn("GitLab issue {} not found in {}, skipping", id, project);
            return null;
        } catch (GitTaskException e) {
            throw HttpErrors.forListing(kind(), e);
        }
    }

    static RemoteIssue toIssue(JsonNode node) {
        var labels = new ArrayList<String>();
        for (JsonNode label : node.path("labels")) {
            labels.add(label.isObject() ? label.path("name").asText() : label.asText());
        }
        return new RemoteIssue(
                node.path("iid").asText(),
                node.path("title").asText(""),
                node.path("description").asText(""),
                node.path("author").path("username").asText(""),
                RemoteDates.toEpochSeconds(node.path("created_at").asText(null)),
                !"closed".equals(node.path("state").asText()),
                null,
                labels,
                node.path("user_notes_count").asInt(0));
    }

    @Override
    public RemoteIssue getIssue(String id) throws GitTaskException {
        return toIssue(get(projectUrl("issues", id).build(), "issue " + id));
    }

    private ObjectNode issueBody(IssueFields fields) {
        var body = mapper.createObjectNode();
        body.put("title", fields.title());
        body.put("description", fields.body());
        if (fields.labels() != null) {
            body.put("labels", String.join(",", fields.labels()));
        }
        return body;
    }

    @Override
    public String createIssue(IssueFields fields) throws GitTaskException {
        var created = send("POST", projectUrl("issues").build(), issueBody(fields), "new issue");
        String iid = created.path("iid").asText();
        if (!fields.open()) {
            var close = mapper.createObjectNode().put("state_event", "close");
            send("PUT", projectUrl("issues", iid).build(), close, "issue " + iid);
        }
        logger.info("Created GitLab issue {} in {}", iid, project);
        return iid;
    }

    @Override
    public void updateIssue(String id, IssueFields fields) throws GitTaskException {
        var body = issueBody(fields);
        body.put("state_event", fields.open() ? "reopen" : "close");
        send("PUT", projectUrl("issues", id).build(), body, "issue " + id);
    }

    @Override
    public void deleteIssue(String id) throws GitTaskException {
        send("DELETE", projectUrl("issues", id).build(), null, "issue " + id);
    }

    @Override
    public Iterator<RemoteComment> listComments(String issueId) throws GitTaskException {
        return new PagedIterator<>(page -> {
            var url = projectUrl("issues", issueId, "notes")
                    .addQueryParameter("sort", "asc")
                    .addQueryParameter("order_by", "created_at")
                    .addQueryParameter("page", Integer.toString(page + 1))
                    .addQueryParameter("per_page", Integer.toString(PAGE_SIZE))
                    .build();
            var result = new ArrayList<RemoteComment>();
            var notes = getPage(url, "notes of issue " + issueId);
            for (JsonNode note : notes) {
                // system notes record events such as label changes
                if (!note.path("system").asBoolean(false)) {
                    result.add(new RemoteComment(
                            note.path("id").asText(),
                            note.path("author").path("username").asText(""),
                            RemoteDates.toEpochSeconds(note.path("created_at").asText(null)),
                            note.path("body").asText("")));
                }
            }
            return PagedIterator.Page.of(result, notes.size(), PAGE_SIZE);
        }, null);
    }

    @Override
    public String createComment(String issueId, String body) throws GitTaskException {
        var created = send("POST", projectUrl("issues", issueId, "notes").build(),
                mapper.createObjectNode().put("body", body), "note on issue " + issueId);
        return created.path("id").asText();
    }

    @Override
    public void updateComment(String issueId, String commentId, String body) throws GitTaskException {
        send("PUT", projectUrl("issues", issueId, "notes", commentId).build(),
                mapper.createObjectNode().put("body", body), "note " + commentId);
    }

    @Override
    public void deleteComment(String issueId, String commentId) throws GitTaskException {
        send("DELETE", projectUrl("issues", issueId, "notes", commentId).build(), null, "note " + commentId);
    }

    @Override
    public List<RemoteLabel> listLabels() throws GitTaskException {
        var result = new ArrayList<RemoteLabel>();
        var labels = new PagedIterator<RemoteLabel>(page -> {
            var url = projectUrl("labels")
                    .addQueryParameter("page", Integer.toString(page + 1))
                    .addQueryParameter("per_page", Integer.toString(PAGE_SIZE))
                    .build();
            var pageLabels = new ArrayList<RemoteLabel>();
            for (JsonNode node : getPage(url, "labels of " + project)) {
                pageLabels.add(new RemoteLabel(
                        node.path("name").asText(),
                        node.path("color").asText("").replace("#", ""),
                        node.hasNonNull("description") ? node.get("description").asText() : null));
            }
            return PagedIterator.Page.of(pageLabels, pageLabels.size(), PAGE_SIZE);
        }, null);
        try {
            labels.forEachRemaining(result::add);
        } catch (RemoteFailureException.Unchecked e) {
            throw e.getCause();
        }
        return result;
    }

    @Override
    public void createLabel(RemoteLabel label) throws GitTaskException {
        var body = mapper.createObjectNode()
                .put("name", label.name())
                .put("color", "#" + LabelColors.toHex(label.color()));
        if (label.description() != null) {
            body.put("description", label.description());
        }
        send("POST", projectUrl("labels").build(), body, "label " + label.name());
    }

    @Override
    public void updateLabel(RemoteLabel label) throws GitTaskException {
        var body = mapper.createObjectNode().put("color", "#" + LabelColors.toHex(label.color()));
        if (label.description() != null) {
            body.put("description", label.description());
        }
        send("PUT", projectUrl("labels", label.name()).build(), body, "label " + label.name());
    }
}
