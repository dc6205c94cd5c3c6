package io.github.gittask.remote;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.gittask.exception.GitTaskException;
import io.github.gittask.exception.NotFoundException;
import io.github.gittask.exception.RemoteFailureException;
import io.github.gittask.exception.UnsupportedRemoteOperationException;
import io.github.gittask.exception.ValidationException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Jira REST v2. Remote ids are issue keys such as {@code PROJ-12}; a bare number is qualified with the project
 * key. Open/closed follows the status category, and state changes go through the issue's transitions.
 */
public class JiraTracker extends HttpTracker {
    private static final Logger logger = LogManager.getLogger(JiraTracker.class);
    private static final DateTimeFormatter JQL_DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm");
    private static final String DONE_CATEGORY = "done";
    static final int PAGE_SIZE = 50;
    static final String ISSUE_FIELDS = "summary,description,status,created,creator,reporter,labels,comment";

    private final String projectKey;
    private final String issueType;

    public JiraTracker(OkHttpClient client, String baseUrl, String projectKey, String issueType)
            throws ValidationException {
        super(client, baseUrl);
        if (projectKey.isBlank()) {
            throw new ValidationException("Jira project key is not configured (task.jira.project)");
        }
        this.projectKey = projectKey;
        this.issueType = issueType;
    }

    @Override
    public TrackerKind kind() {
        return TrackerKind.JIRA;
    }

    String issueKey(String id) {
        return id.chars().allMatch(Character::isDigit) ? projectKey + "-" + id : id;
    }

    private HttpUrl.Builder api(String... segments) {
        var builder = url("rest", "api", "2");
        for (String segment : segments) {
            builder.addPathSegment(segment);
        }
        return builder;
    }

    String buildJql(IssueQuery query) {
        var jql = new StringBuilder("project = \"").append(projectKey.replace("\"", "\\\"")).append('"');
        switch (query.state()) {
            case OPEN -> jql.append(" AND statusCategory != Done");
            case CLOSED -> jql.append(" AND statusCategory = Done");
            case ALL -> {}
        }
        if (query.since() != null) {
            jql.append(" AND created >= \"")
                    .append(JQL_DATE_FORMATTER.format(Instant.ofEpochSecond(query.since()).atZone(ZoneOffset.UTC)))
                    .append('"');
        }
        jql.append(" ORDER BY created DESC");
        return jql.toString();
    }

    @Override
    public Iterator<RemoteIssue> listIssues(IssueQuery query) throws GitTaskException {
        if (query.ids() != null) {
            return PagedIterator.ofSingles(query.ids(), id -> {
                try {
                    var issue = getIssue(id);
                    return query.accepts(issue) ? issue : null;
                } catch (NotFoundException e) {
                    logger.warn("Jira issue {} not found, skipping", issueKey(id));
                    return null;
                } catch (GitTaskException e) {
                    throw HttpErrors.forListing(kind(), e);
                }
            }, query.limit());
        }
        String jql = buildJql(query);
        logger.debug("Executing Jira JQL query: {}", jql);
        return new PagedIterator<>(page -> {
            var url = api("search")
                    .addQueryParameter("jql", jql)
                    .addQueryParameter("fields", ISSUE_FIELDS)
                    .addQueryParameter("startAt", Integer.toString(page * PAGE_SIZE))
                    .addQueryParameter("maxResults", Integer.toString(PAGE_SIZE))
                    .build();
            var root = getPage(url, "issues of " + projectKey);
            var result = new ArrayList<RemoteIssue>();
            for (JsonNode node : root.path("issues")) {
                result.add(toIssue(node));
            }
            int total = root.path("total").asInt(0);
            boolean last = result.isEmpty() || (page * PAGE_SIZE) + result.size() >= total;
            return new PagedIterator.Page<>(result, last);
        }, query.limit());
    }

    static RemoteIssue toIssue(JsonNode node) {
        JsonNode fields = node.path("fields");
        var labels = new ArrayList<String>();
        for (JsonNode label : fields.path("labels")) {
            labels.add(label.asText());
        }
        JsonNode status = fields.path("status");
        String author = fields.path("creator").path("displayName").asText(
                fields.path("reporter").path("displayName").asText(""));
        return new RemoteIssue(
                node.path("key").asText(),
                fields.path("summary").asText(""),
                fields.path("description").isTextual() ? fields.path("description").asText() : "",
                author,
                RemoteDates.toEpochSeconds(fields.path("created").asText(null)),
                !DONE_CATEGORY.equals(status.path("statusCategory").path("key").asText()),
                status.path("name").asText(null),
                labels,
                fields.path("comment").path("total").asInt(0));
    }

    @Override
    public RemoteIssue getIssue(String id) throws GitTaskException {
        String key = issueKey(id);
        var url = api("issue", key).addQueryParameter("fields", ISSUE_FIELDS).build();
        return toIssue(get(url, "issue " + key));
    }

    private ObjectNode fieldsBody(IssueFields fields) {
        var body = mapper.createObjectNode();
        var node = body.putObject("fields");
        node.put("summary", fields.title());
        node.put("description", fields.body());
        if (fields.labels() != null) {
            var labels = node.putArray("labels");
            // Jira labels cannot contain spaces
            fields.labels().forEach(label -> labels.add(label.replace(' ', '_')));
        }
        return body;
    }

    @Override
    public String createIssue(IssueFields fields) throws GitTaskException {
        var body = fieldsBody(fields);
        var node = (ObjectNode) body.get("fields");
        node.putObject("project").put("key", projectKey);
        node.putObject("issuetype").put("name", issueType);
        var created = send("POST", api("issue").build(), body, "new issue");
        String key = created.path("key").asText();
        if (!fields.open() || fields.statusText() != null) {
            transition(key, fields, true, null);
        }
        logger.info("Created Jira issue {}", key);
        return key;
    }

    @Override
    public void updateIssue(String id, IssueFields fields) throws GitTaskException {
        String key = issueKey(id);
        var current = getIssue(key);
        send("PUT", api("issue", key).build(), fieldsBody(fields), "issue " + key);
        transition(key, fields, current.open(), current.statusText());
    }

    /** Moves the issue to the named status, or across the done boundary when only open/closed is known. */
    private void transition(String key, IssueFields fields, boolean currentlyOpen, @Nullable String currentStatus)
            throws GitTaskException {
        String wantedName = fields.statusText();
        if (wantedName != null && wantedName.equalsIgnoreCase(currentStatus)) {
            return;
        }
        if (wantedName == null && currentlyOpen == fields.open()) {
            return;
        }
        var transitions = get(api("issue", key, "transitions").build(), "transitions of " + key);
        String transitionId = null;
        for (JsonNode transition : transitions.path("transitions")) {
            JsonNode to = transition.path("to");
            boolean toDone = DONE_CATEGORY.equals(to.path("statusCategory").path("key").asText());
            if (wantedName != null) {
                if (to.path("name").asText("").equalsIgnoreCase(wantedName)) {
                    transitionId = transition.path("id").asText();
                    break;
                }
            } else if (toDone != fields.open()) {
                transitionId = transition.path("id").asText();
                break;
            }
        }
        if (transitionId == null) {
            throw new RemoteFailureException(kind(), RemoteFailureException.Reason.HTTP, false,
                    "No Jira transition of " + key + " leads to "
                            + (wantedName != null ? wantedName : fields.open() ? "an open status" : "a done status"));
        }
        var body = mapper.createObjectNode();
        body.putObject("transition").put("id", transitionId);
        send("POST", api("issue", key, "transitions").build(), body, "transition of " + key);
        logger.debug("Transitioned Jira issue {} via {}", key, transitionId);
    }

    @Override
    public void deleteIssue(String id) throws GitTaskException {
        String key = issueKey(id);
        send("DELETE", api("issue", key).build(), null, "issue " + key);
    }

    @Override
    public Iterator<RemoteComment> listComments(String issueId) throws GitTaskException {
        String key = issueKey(issueId);
        return new PagedIterator<>(page -> {
            var url = api("issue", key, "comment")
                    .addQueryParameter("startAt", Integer.toString(page * PAGE_SIZE))
                    .addQueryParameter("maxResults", Integer.toString(PAGE_SIZE))
                    .build();
            var root = getPage(url, "comments of " + key);
            var result = new ArrayList<RemoteComment>();
            for (JsonNode node : root.path("comments")) {
                result.add(new RemoteComment(
                        node.path("id").asText(),
                        node.path("author").path("displayName").asText(""),
                        RemoteDates.toEpochSeconds(node.path("created").asText(null)),
                        node.path("body").asText("")));
            }
            int total = root.path("total").asInt(0);
            return new PagedIterator.Page<>(result, result.isEmpty() || (page * PAGE_SIZE) + result.size() >= total);
        }, null);
    }

    @Override
    public String createComment(String issueId, String body) throws GitTaskException {
        String key = issueKey(issueId);
        var created = send("POST", api("issue", key, "comment").build(),
                mapper.createObjectNode().put("body", body), "comment on " + key);
        return created.path("id").asText();
    }

    @Override
    public void updateComment(String issueId, String commentId, String body) throws GitTaskException {
        String key = issueKey(issueId);
        send("PUT", api("issue", key, "comment", commentId).build(),
                mapper.createObjectNode().put("body", body), "comment " + commentId);
    }

    @Override
    public void deleteComment(String issueId, String commentId) throws GitTaskException {
        String key = issueKey(issueId);
        send("DELETE", api("issue", key, "comment", commentId).build(), null, "comment " + commentId);
    }

    @Override
    public List<RemoteLabel> listLabels() throws GitTaskException {
        var result = new ArrayList<RemoteLabel>();
        var labels = new PagedIterator<RemoteLabel>(page -> {
            var url = api("label")
                    .addQueryParameter("startAt", Integer.toString(page * PAGE_SIZE))
                    .addQueryParameter("maxResults", Integer.toString(PAGE_SIZE))
                    .build();
            var root = getPage(url, "labels");
            var pageLabels = new ArrayList<RemoteLabel>();
            for (JsonNode value : root.path("values")) {
                pageLabels.add(new RemoteLabel(value.asText(), LabelColors.DEFAULT_HEX, null));
            }
            return new PagedIterator.Page<>(pageLabels, pageLabels.isEmpty() || root.path("isLast").asBoolean(true));
        }, null);
        try {
            labels.forEachRemaining(result::add);
        } catch (RemoteFailureException.Unchecked e) {
            throw e.getCause();
        }
        return result;
    }

    /** Jira labels are free-form and come into existence when first set on an issue. */
    @Override
    public void createLabel(RemoteLabel label) {
        logger.debug("Jira label {} will be created on first use", label.name());
    }

    @Override
    public void updateLabel(RemoteLabel label) throws GitTaskException {
        throw new UnsupportedRemoteOperationException(kind(), "label colors");
    }
}
