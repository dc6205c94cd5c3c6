package io.github.gittask.remote;

import io.github.gittask.exception.GitTaskException;
import io.github.gittask.exception.NotFoundException;
import io.github.gittask.exception.RemoteFailureException;
import io.github.gittask.exception.UnsupportedRemoteOperationException;
import io.github.gittask.exception.ValidationException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.kohsuke.github.GHException;
import org.kohsuke.github.GHIssue;
import org.kohsuke.github.GHIssueComment;
import org.kohsuke.github.GHIssueState;
import org.kohsuke.github.GHLabel;
import org.kohsuke.github.GHRepository;
import org.kohsuke.github.GHUser;
import org.kohsuke.github.GitHub;
import org.kohsuke.github.GitHubBuilder;
import org.kohsuke.github.HttpException;

/**
 * GitHub issues through the kohsuke client. Pull requests share the issue number space and are skipped. GitHub
 * cannot delete issues over REST.
 */
public class GitHubTracker implements RemoteTracker {
    private static final Logger logger = LogManager.getLogger(GitHubTracker.class);
    static final int PAGE_SIZE = 100;

    private final GitHub github;
    private final String owner;
    private final String repoName;
    private @Nullable GHRepository repository;

    public GitHubTracker(GitHub github, String owner, String repoName) {
        this.github = github;
        this.owner = owner;
        this.repoName = repoName;
    }

    /**
     * @param host GitHub Enterprise host, or null for github.com
     */
    public static GitHubTracker connect(@Nullable String token, @Nullable String host, String owner, String repoName)
            throws GitTaskException {
        if (owner.isBlank() || repoName.isBlank()) {
            throw new ValidationException("GitHub repository is not configured");
        }
        var builder = new GitHubBuilder();
        if (host != null && !host.isBlank() && !host.contains("github.com")) {
            String enterpriseHost = host.replaceFirst("^https?://", "").replaceFirst("/$", "");
            builder.withEndpoint("https://" + enterpriseHost + "/api/v3");
            logger.debug("Configuring GitHub client for enterprise host: {}", enterpriseHost);
        }
        if (token != null && !token.isBlank()) {
            builder.withOAuthToken(token);
        } else {
            logger.info("No GitHub token configured. Proceeding anonymously for {}/{}", owner, repoName);
        }
        try {
            return new GitHubTracker(builder.build(), owner, repoName);
        } catch (IOException e) {
            throw HttpErrors.fromIOException(TrackerKind.GITHUB, e, "connection");
        }
    }

    @Override
    public TrackerKind kind() {
        return TrackerKind.GITHUB;
    }

    private synchronized GHRepository repo() throws GitTaskException {
        if (repository == null) {
            repository = call("repository " + owner + "/" + repoName, () -> github.getRepository(owner + "/" + repoName));
            logger.debug("Connected to GitHub repository {}/{}", owner, repoName);
        }
        return repository;
    }

    @FunctionalInterface
    private interface GitHubCall<T> {
        T run() throws IOException;
    }

    private <T> T call(String what, GitHubCall<T> call) throws GitTaskException {
        try {
            return call.run();
        } catch (IOException e) {
            throw map(e, what);
        } catch (GHException e) {
            throw mapForListing(e, what);
        }
    }

    private GitTaskException map(IOException e, String what) {
        int code = e instanceof HttpException http ? http.getResponseCode() : -1;
        return HttpErrors.fromIOException(kind(), e, what, code);
    }

    private RemoteFailureException mapForListing(RuntimeException e, String what) {
        if (e.getCause() instanceof IOException io) {
            return HttpErrors.forListing(kind(), map(io, what));
        }
        return new RemoteFailureException(kind(), RemoteFailureException.Reason.NETWORK, true,
                "GitHub listing of " + what + " failed: " + e.getMessage(), e);
    }

    private static int number(String id) throws ValidationException {
        String numeric = id.startsWith("#") ? id.substring(1) : id;
        try {
            return Integer.parseInt(numeric);
        } catch (NumberFormatException e) {
            throw new ValidationException("Invalid GitHub issue number: " + id, e);
        }
    }

    private static String login(@Nullable GHUser user) {
        if (user == null) {
            return "";
        }
        String login = user.getLogin();
        return login == null ? "" : login;
    }

    RemoteIssue toIssue(GHIssue issue) throws IOException {
        var labels = new ArrayList<String>();
        for (GHLabel label : issue.getLabels()) {
            labels.add(label.getName());
        }
        return new RemoteIssue(
                Integer.toString(issue.getNumber()),
                issue.getTitle() == null ? "" : issue.getTitle(),
                issue.getBody() == null ? "" : issue.getBody(),
                login(issue.getUser()),
                issue.getCreatedAt() == null ? 0 : issue.getCreatedAt().getTime() / 1000,
                issue.getState() != GHIssueState.CLOSED,
                null,
                labels,
                issue.getCommentsCount());
    }

    @Override
    public Iterator<RemoteIssue> listIssues(IssueQuery query) throws GitTaskException {
        if (query.ids() != null) {
            return PagedIterator.ofSingles(query.ids(), id -> {
                try {
                    var issue = getIssue(id);
                    return query.accepts(issue) ? issue : null;
                } catch (NotFoundException e) {
                    logger.warn("GitHub issue #{} not found in {}/{}, skipping", id, owner, repoName);
                    return null;
                } catch (GitTaskException e) {
                    throw HttpErrors.forListing(kind(), e);
                }
            }, query.limit());
        }
        var state = switch (query.state()) {
            case OPEN -> GHIssueState.OPEN;
            case CLOSED -> GHIssueState.CLOSED;
            case ALL -> GHIssueState.ALL;
        };
        var repo = repo();
        String what = "issues of " + owner + "/" + repoName;
        var pages = call(what, () -> repo.listIssues(state).withPageSize(PAGE_SIZE).iterator());
        return new PagedIterator<>(page -> {
            try {
                return call(what, () -> {
                    if (!pages.hasNext()) {
                        return new PagedIterator.Page<RemoteIssue>(List.of(), true);
                    }
                    var result = new ArrayList<RemoteIssue>();
                    for (GHIssue issue : pages.nextPage()) {
                        if (issue.isPullRequest()) {
                            continue;
                        }
                        var remote = toIssue(issue);
                        if (query.accepts(remote)) {
                            result.add(remote);
                        }
                    }
                    return new PagedIterator.Page<>(result, !pages.hasNext());
                });
            } catch (GitTaskException e) {
                throw HttpErrors.forListing(kind(), e);
            }
        }, query.limit());
    }

    private GHIssue issue(String id) throws GitTaskException {
        int number = number(id);
        var repo = repo();
        return call("issue #" + number, () -> repo.getIssue(number));
    }

    @Override
    public RemoteIssue getIssue(String id) throws GitTaskException {
        var issue = issue(id);
        return call("issue #" + id, () -> toIssue(issue));
    }

    @Override
    public String createIssue(IssueFields fields) throws GitTaskException {
        var repo = repo();
        return call("new issue", () -> {
            var builder = repo.createIssue(fields.title()).body(fields.body());
            if (fields.labels() != null) {
                for (String label : fields.labels()) {
                    builder.label(label);
                }
            }
            GHIssue created = builder.create();
            if (!fields.open()) {
                created.close();
            }
            logger.info("Created GitHub issue #{} in {}/{}", created.getNumber(), owner, repoName);
            return Integer.toString(created.getNumber());
        });
    }

    @Override
    public void updateIssue(String id, IssueFields fields) throws GitTaskException {
        var issue = issue(id);
        call("issue #" + id, () -> {
            if (!fields.title().equals(issue.getTitle())) {
                issue.setTitle(fields.title());
            }
            if (!fields.body().equals(issue.getBody() == null ? "" : issue.getBody())) {
                issue.setBody(fields.body());
            }
            boolean open = issue.getState() != GHIssueState.CLOSED;
            if (open && !fields.open()) {
                issue.close();
            } else if (!open && fields.open()) {
                issue.reopen();
            }
            if (fields.labels() != null) {
                issue.setLabels(fields.labels().toArray(new String[0]));
            }
            return null;
        });
    }

    @Override
    public void deleteIssue(String id) throws GitTaskException {
        throw new UnsupportedRemoteOperationException(kind(), "deleting issues");
    }

    @Override
    public Iterator<RemoteComment> listComments(String issueId) throws GitTaskException {
        var issue = issue(issueId);
        String what = "comments of issue #" + issueId;
        var pages = call(what, () -> issue.listComments().withPageSize(PAGE_SIZE).iterator());
        return new PagedIterator<>(page -> {
            try {
                return call(what, () -> {
                    if (!pages.hasNext()) {
                        return new PagedIterator.Page<RemoteComment>(List.of(), true);
                    }
                    var result = new ArrayList<RemoteComment>();
                    for (GHIssueComment comment : pages.nextPage()) {
                        result.add(toComment(comment));
                    }
                    return new PagedIterator.Page<>(result, !pages.hasNext());
                });
            } catch (GitTaskException e) {
                throw HttpErrors.forListing(kind(), e);
            }
        }, null);
    }

    private static RemoteComment toComment(GHIssueComment comment) throws IOException {
        return new RemoteComment(
                Long.toString(comment.getId()),
                login(comment.getUser()),
                comment.getCreatedAt() == null ? 0 : comment.getCreatedAt().getTime() / 1000,
                comment.getBody() == null ? "" : comment.getBody());
    }

    private GHIssueComment comment(String issueId, String commentId) throws GitTaskException {
        var issue = issue(issueId);
        var found = call("comments of issue #" + issueId, () -> {
            for (GHIssueComment comment : issue.listComments()) {
                if (Long.toString(comment.getId()).equals(commentId)) {
                    return comment;
                }
            }
            return null;
        });
        if (found == null) {
            throw new NotFoundException("GitHub comment " + commentId + " not found on issue #" + issueId);
        }
        return found;
    }

    @Override
    public String createComment(String issueId, String body) throws GitTaskException {
        var issue = issue(issueId);
        return call("comment on issue #" + issueId, () -> Long.toString(issue.comment(body).getId()));
    }

    @Override
    public void updateComment(String issueId, String commentId, String body) throws GitTaskException {
        var comment = comment(issueId, commentId);
        call("comment " + commentId, () -> {
            comment.update(body);
            return null;
        });
    }

    @Override
    public void deleteComment(String issueId, String commentId) throws GitTaskException {
        var comment = comment(issueId, commentId);
        call("comment " + commentId, () -> {
            comment.delete();
            return null;
        });
    }

    @Override
    public List<RemoteLabel> listLabels() throws GitTaskException {
        var repo = repo();
        return call("labels of " + owner + "/" + repoName, () -> {
            var result = new ArrayList<RemoteLabel>();
            for (GHLabel label : repo.listLabels().withPageSize(PAGE_SIZE)) {
                result.add(new RemoteLabel(label.getName(), label.getColor(), label.getDescription()));
            }
            return result;
        });
    }

    @Override
    public void createLabel(RemoteLabel label) throws GitTaskException {
        var repo = repo();
        call("label " + label.name(), () -> repo.createLabel(label.name(), LabelColors.toHex(label.color()),
                label.description() == null ? "" : label.description()));
        logger.debug("Created GitHub label {}", label.name());
    }

    @Override
    public void updateLabel(RemoteLabel label) throws GitTaskException {
        var repo = repo();
        call("label " + label.name(), () -> {
            var updater = repo.getLabel(label.name()).update().color(LabelColors.toHex(label.color()));
            if (label.description() != null) {
                updater = updater.description(label.description());
            }
            return updater.done();
        });
    }
}
