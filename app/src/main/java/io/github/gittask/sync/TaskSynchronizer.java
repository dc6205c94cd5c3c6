package io.github.gittask.sync;

import io.github.gittask.config.StatusTable;
import io.github.gittask.config.TaskConfig;
import io.github.gittask.exception.ErrorKind;
import io.github.gittask.exception.GitTaskException;
import io.github.gittask.exception.NotFoundException;
import io.github.gittask.exception.RemoteFailureException;
import io.github.gittask.exception.ValidationException;
import io.github.gittask.model.Comment;
import io.github.gittask.model.Label;
import io.github.gittask.model.Task;
import io.github.gittask.remote.IssueFields;
import io.github.gittask.remote.IssueQuery;
import io.github.gittask.remote.RemoteComment;
import io.github.gittask.remote.RemoteIssue;
import io.github.gittask.remote.RemoteLabel;
import io.github.gittask.remote.RemoteTracker;
import io.github.gittask.remote.TrackerKind;
import io.github.gittask.repository.TaskMutation;
import io.github.gittask.repository.TaskRepository;
import io.github.gittask.util.ExecutorServiceUtil;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Reconciles local tasks with one remote tracker.
 *
 * <p>Pull overwrites name, description, author, status and (optionally) the label set of linked tasks, adds
 * remote comments it has not seen, and creates tasks for unlinked issues. Everything a pull changes is committed
 * in one transaction.
 *
 * <p>Push runs each task on its own worker. A failing task never stops the others, and the links created along
 * the way are recorded in one transaction at the end.
 */
public class TaskSynchronizer {
    private static final Logger logger = LogManager.getLogger(TaskSynchronizer.class);

    private final TaskRepository repository;
    private final TaskConfig config;
    private final StatusTable statuses;

    public TaskSynchronizer(TaskRepository repository, TaskConfig config, StatusTable statuses) {
        this.repository = repository;
        this.config = config;
        this.statuses = statuses;
    }

    // ---------------------------------------------------------------- pull

    public SyncReport pull(RemoteTracker tracker, PullOptions options) throws GitTaskException {
        var kind = tracker.kind();
        var mapping = new StatusMapping(config, statuses, kind);
        var results = new ArrayList<ItemResult>();

        var issues = fetchIssues(tracker, options, mapping, results);
        boolean withLabels = options.includeLabels() && tracker.supportsLabelCreation();
        var labelCatalog = withLabels ? labelCatalog(tracker) : Map.<String, RemoteLabel>of();

        var linked = new HashMap<String, Task>();
        for (Task task : repository.loadAll()) {
            task.link(kind).ifPresent(remoteId -> linked.putIfAbsent(remoteId, task));
        }

        var mutations = new ArrayList<TaskMutation>();
        var updated = new ArrayList<ItemResult>();
        var createdFrom = new ArrayList<String>();
        var seen = new HashSet<String>();
        for (RemoteIssue issue : issues) {
            // offset paging can return an issue again when the listing shifts between pages
            if (!seen.add(issue.id())) {
                logger.debug("Skipping {} issue {}, already pulled", kind.getDisplayName(), issue.id());
                continue;
            }
            var existing = linked.get(issue.id());
            List<RemoteComment> comments;
            try {
                comments = options.includeComments() ? drain(tracker.listComments(issue.id())) : List.of();
            } catch (GitTaskException e) {
                logger.error("Fetching comments of {} issue {} failed", kind.getDisplayName(), issue.id(), e);
                results.add(ItemResult.failed(existing == null ? 0 : existing.id(), null, issue.id(), e));
                continue;
            }

            var remote = new PulledIssue(kind, issue, comments, labelCatalog, mapping, withLabels,
                    options.includeComments());
            if (existing != null) {
                if (remote.applyTo(existing.copy())) {
                    mutations.add(TaskMutation.update(existing.id(), remote::applyTo));
                    updated.add(ItemResult.of(existing.id(), issue.id(), ItemResult.Outcome.UPDATED,
                            "Task ID " + existing.id() + " updated"));
                } else {
                    results.add(ItemResult.of(existing.id(), issue.id(), ItemResult.Outcome.UNCHANGED,
                            "Task ID " + existing.id() + " skipped, nothing to update"));
                }
            } else {
                var draft = new Task(0);
                remote.applyTo(draft);
                if (issue.created() > 0) {
                    draft.setProperty(Task.CREATED, Long.toString(issue.created()));
                }
                draft.setLink(kind, issue.id());
                mutations.add(TaskMutation.create(draft));
                createdFrom.add(issue.id());
            }
        }

        if (!mutations.isEmpty()) {
            var transaction = repository.applyTransaction(mutations,
                    "Pull " + mutations.size() + " task(s) from " + kind.getDisplayName());
            results.addAll(updated);
            for (int i = 0; i < createdFrom.size(); i++) {
                long id = transaction.createdIds().get(i);
                results.add(ItemResult.of(id, createdFrom.get(i), ItemResult.Outcome.CREATED,
                        "Task ID " + id + " created from " + kind.getDisplayName() + " issue " + createdFrom.get(i)));
            }
            logger.info("Pulled {} issue(s) from {}: {} created, {} updated",
                    issues.size(), kind.getDisplayName(), createdFrom.size(), updated.size());
        } else {
            logger.info("Pulled {} issue(s) from {}, nothing to update", issues.size(), kind.getDisplayName());
        }
        return new SyncReport(kind, results);
    }

    private List<RemoteIssue> fetchIssues(RemoteTracker tracker, PullOptions options, StatusMapping mapping,
            List<ItemResult> results) throws ValidationException {
        var issues = new ArrayList<RemoteIssue>();
        if (options.remoteIds() != null) {
            for (String remoteId : options.remoteIds()) {
                if (options.limit() != null && issues.size() >= options.limit()) {
                    break;
                }
                try {
                    issues.add(tracker.getIssue(remoteId));
                } catch (GitTaskException e) {
                    logger.warn("Fetching {} issue {} failed: {}", tracker.kind().getDisplayName(), remoteId,
                            e.getMessage());
                    results.add(ItemResult.failed(0, null, remoteId, e));
                }
            }
            return issues;
        }

        var state = IssueQuery.State.ALL;
        if (options.status() != null) {
            String status = statuses.canonical(options.status());
            state = mapping.toRemoteOpen(status) ? IssueQuery.State.OPEN : IssueQuery.State.CLOSED;
        }
        var query = IssueQuery.all().withState(state).withLimit(options.limit());
        GitTaskException failure = null;
        try {
            var iterator = tracker.listIssues(query);
            while (iterator.hasNext()) {
                issues.add(iterator.next());
            }
        } catch (RemoteFailureException.Unchecked e) {
            failure = e.getCause();
        } catch (GitTaskException e) {
            failure = e;
        }
        if (failure != null) {
            // issues read before the failure are still applied
            logger.error("Listing {} issues failed after {} issue(s)", tracker.kind().getDisplayName(),
                    issues.size(), failure);
            results.add(ItemResult.failed(0, null, null, failure));
        }
        return issues;
    }

    private static Map<String, RemoteLabel> labelCatalog(RemoteTracker tracker) {
        var catalog = new HashMap<String, RemoteLabel>();
        try {
            for (RemoteLabel label : tracker.listLabels()) {
                catalog.put(label.name(), label);
            }
        } catch (GitTaskException e) {
            logger.warn("Could not list {} labels, new labels get the default color: {}",
                    tracker.kind().getDisplayName(), e.getMessage());
        }
        return catalog;
    }

    /** Drains a lazy listing, unwrapping failures raised while paging. */
    static <T> List<T> drain(Iterator<T> iterator) throws RemoteFailureException {
        var result = new ArrayList<T>();
        try {
            iterator.forEachRemaining(result::add);
        } catch (RemoteFailureException.Unchecked e) {
            throw e.getCause();
        }
        return result;
    }

    /** The remote state of one issue, applied to a local task field by field. */
    private record PulledIssue(
            TrackerKind kind,
            RemoteIssue issue,
            List<RemoteComment> comments,
            Map<String, RemoteLabel> labelCatalog,
            StatusMapping mapping,
            boolean withLabels,
            boolean withComments) {

        /** @return whether {@code task} changed */
        boolean applyTo(Task task) {
            boolean changed = setIfDifferent(task, Task.NAME, issue.title());
            changed |= setIfDifferent(task, Task.DESCRIPTION, issue.body());
            if (!issue.author().isBlank()) {
                changed |= setIfDifferent(task, Task.AUTHOR, issue.author());
            }
            changed |= setIfDifferent(task, Task.STATUS, mapping.toLocal(issue));
            if (withLabels) {
                changed |= applyLabels(task);
            }
            if (withComments) {
                changed |= applyComments(task);
            }
            return changed;
        }

        private static boolean setIfDifferent(Task task, String name, String value) {
            if (value.equals(task.getProperty(name))) {
                return false;
            }
            task.setProperty(name, value);
            return true;
        }

        private boolean applyLabels(Task task) {
            var labels = new ArrayList<Label>();
            for (String name : issue.labels()) {
                var label = task.findLabel(name).orElseGet(() -> {
                    var remote = labelCatalog.get(name);
                    return remote == null
                            ? Label.named(name)
                            : new Label(name, remote.color(), remote.description());
                });
                labels.add(label.link(kind).isPresent() ? label : label.withLink(kind, name));
            }
            if (labels.equals(task.labels())) {
                return false;
            }
            task.setLabels(labels);
            return true;
        }

        /** Adds comments not linked yet and refreshes the text of linked ones; local comments are never removed. */
        private boolean applyComments(Task task) {
            boolean changed = false;
            for (RemoteComment remote : comments) {
                var local = task.findCommentByLink(kind, remote.id());
                if (local.isPresent()) {
                    if (!local.get().text().equals(remote.body())) {
                        task.replaceComment(local.get().withText(remote.body()));
                        changed = true;
                    }
                } else {
                    task.addComment(new Comment(task.nextCommentId(), remote.author(), remote.created(), remote.body())
                            .withLink(kind, remote.id()));
                    changed = true;
                }
            }
            return changed;
        }
    }

    // ---------------------------------------------------------------- push

    /** Results of one pushed task, plus its remote creations keyed to the link each still needs locally. */
    private record TaskPush(List<ItemResult> results, Map<ItemResult, TaskMutation> links) {
        static TaskPush of(ItemResult result) {
            return new TaskPush(List.of(result), Map.of());
        }
    }

    public SyncReport push(RemoteTracker tracker, List<Long> ids, PushOptions options) throws GitTaskException {
        var kind = tracker.kind();
        var mapping = new StatusMapping(config, statuses, kind);
        var tasks = new HashMap<Long, Task>();
        for (Task task : repository.loadAll()) {
            tasks.put(task.id(), task);
        }
        boolean withLabels = options.includeLabels() && tracker.supportsLabelCreation();
        var labels = withLabels ? new LabelRegistry(tracker) : null;

        var results = new ArrayList<ItemResult>();
        var links = new LinkedHashMap<ItemResult, TaskMutation>();
        if (ids.isEmpty()) {
            return new SyncReport(kind, results);
        }

        var executor = ExecutorServiceUtil.newFixedThreadExecutor(
                Math.min(options.parallelism(), ids.size()), "git-task-push-");
        try {
            var completionService = new ExecutorCompletionService<TaskPush>(executor);
            var submitted = new IdentityHashMap<Future<TaskPush>, Long>();
            for (long id : ids) {
                Callable<TaskPush> job = () -> pushTask(tracker, tasks.get(id), id, mapping, labels, options);
                submitted.put(completionService.submit(job), id);
            }

            var pending = new HashSet<>(submitted.keySet());
            try {
                for (int i = 0; i < submitted.size(); i++) {
                    var future = completionService.take();
                    pending.remove(future);
                    long id = submitted.get(future);
                    try {
                        var push = future.get();
                        results.addAll(push.results());
                        links.putAll(push.links());
                    } catch (ExecutionException e) {
                        logger.error("Pushing task ID {} failed unexpectedly", id, e.getCause());
                        results.add(new ItemResult(id, null, tasks.containsKey(id) ? tasks.get(id).link(kind).orElse(null) : null,
                                ItemResult.Outcome.FAILED, ErrorKind.REMOTE_FAILURE, String.valueOf(e.getCause())));
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                for (var future : pending) {
                    future.cancel(true);
                    results.add(new ItemResult(submitted.get(future), null, null, ItemResult.Outcome.FAILED,
                            ErrorKind.REMOTE_FAILURE, "Push interrupted"));
                }
            }
        } finally {
            executor.shutdownNow();
        }

        results.addAll(persistLinks(kind, links));
        var report = new SyncReport(kind, results);
        logger.info("Pushed {} task(s) to {}: {} created, {} updated, {} failed", ids.size(), kind.getDisplayName(),
                report.count(ItemResult.Outcome.CREATED), report.count(ItemResult.Outcome.UPDATED),
                report.failures().size());
        return report;
    }

    private TaskPush pushTask(RemoteTracker tracker, @Nullable Task task, long id, StatusMapping mapping,
            @Nullable LabelRegistry labels, PushOptions options) {
        var kind = tracker.kind();
        if (task == null) {
            return TaskPush.of(ItemResult.failed(id, null, null, NotFoundException.task(id)));
        }
        logger.debug("Pushing task ID {} to {}", id, kind.getDisplayName());
        var results = new ArrayList<ItemResult>();
        var links = new LinkedHashMap<ItemResult, TaskMutation>();

        if (labels != null) {
            for (Label label : task.labels()) {
                var error = labels.ensure(label);
                if (error != null) {
                    results.add(ItemResult.failed(id, null, label.name(), error));
                }
            }
        } else if (options.includeLabels() && !task.labels().isEmpty() && !tracker.supportsLabelCreation()) {
            results.add(ItemResult.skipped(id, null, ErrorKind.UNSUPPORTED_OPERATION,
                    kind.getDisplayName() + " has no labels; labels of task ID " + id + " were not pushed"));
        }

        var fields = toFields(task, mapping, labels != null);
        String remoteId = task.link(kind).orElse(null);
        try {
            if (remoteId != null) {
                var remote = tracker.getIssue(remoteId);
                if (differs(kind, remote, fields, task.status(), mapping, labels != null)) {
                    tracker.updateIssue(remoteId, fields);
                    results.add(ItemResult.of(id, remoteId, ItemResult.Outcome.UPDATED,
                            kind.getDisplayName() + " issue " + remoteId + " has been updated"));
                } else {
                    results.add(ItemResult.of(id, remoteId, ItemResult.Outcome.UNCHANGED, "Nothing to sync"));
                }
            } else if (options.createMissing()) {
                remoteId = tracker.createIssue(fields);
                var created = ItemResult.of(id, remoteId, ItemResult.Outcome.CREATED,
                        "Created " + kind.getDisplayName() + " issue " + remoteId + " for task ID " + id);
                links.put(created, TaskMutation.link(id, kind, remoteId));
            } else {
                results.add(ItemResult.of(id, null, ItemResult.Outcome.SKIPPED,
                        "Task ID " + id + " is not linked to " + kind.getDisplayName()));
                return new TaskPush(results, links);
            }
        } catch (GitTaskException e) {
            logger.error("Pushing task ID {} to {} failed", id, kind.getDisplayName(), e);
            results.add(ItemResult.failed(id, null, remoteId, e));
            return new TaskPush(results, links);
        }

        if (options.includeComments()) {
            for (Comment comment : task.comments()) {
                if (comment.link(kind).isPresent()) {
                    continue;
                }
                try {
                    String commentId = tracker.createComment(remoteId, comment.text());
                    var created = ItemResult.comment(id, comment.id(), commentId, ItemResult.Outcome.CREATED,
                            "Created " + kind.getDisplayName() + " comment " + commentId);
                    links.put(created, TaskMutation.linkComment(id, comment.id(), kind, commentId));
                } catch (GitTaskException e) {
                    logger.error("Pushing comment {} of task ID {} failed", comment.id(), id, e);
                    results.add(ItemResult.failed(id, comment.id(), null, e));
                }
            }
        }
        return new TaskPush(results, links);
    }

    IssueFields toFields(Task task, StatusMapping mapping, boolean withLabels) {
        String status = task.status();
        var labelNames = withLabels ? task.labels().stream().map(Label::name).toList() : null;
        return new IssueFields(task.name(), task.getPropertyOrEmpty(Task.DESCRIPTION), mapping.toRemoteOpen(status),
                mapping.toRemoteStatusText(status), labelNames);
    }

    private static boolean differs(TrackerKind kind, RemoteIssue remote, IssueFields fields, String status,
            StatusMapping mapping, boolean withLabels) {
        if (!remote.title().equals(fields.title()) || !remote.body().equals(fields.body())) {
            return true;
        }
        if (!mapping.matches(status, remote)) {
            return true;
        }
        return withLabels && fields.labels() != null
                && !labelKeys(kind, remote.labels()).equals(labelKeys(kind, fields.labels()));
    }

    /** Jira stores labels without spaces. */
    private static Set<String> labelKeys(TrackerKind kind, List<String> names) {
        var keys = new HashSet<String>();
        for (String name : names) {
            keys.add(kind == TrackerKind.JIRA ? name.replace(' ', '_') : name);
        }
        return keys;
    }

    /** Creates each missing remote label once per push. */
    private static final class LabelRegistry {
        private final RemoteTracker tracker;
        private @Nullable Set<String> known;
        private final Map<String, GitTaskException> failed = new HashMap<>();

        LabelRegistry(RemoteTracker tracker) {
            this.tracker = tracker;
        }

        synchronized @Nullable GitTaskException ensure(Label label) {
            if (known == null) {
                known = new HashSet<>();
                try {
                    tracker.listLabels().forEach(remote -> known.add(remote.name()));
                } catch (GitTaskException e) {
                    logger.warn("Could not list {} labels: {}", tracker.kind().getDisplayName(), e.getMessage());
                }
            }
            if (known.contains(label.name())) {
                return null;
            }
            if (failed.containsKey(label.name())) {
                return failed.get(label.name());
            }
            try {
                tracker.createLabel(new RemoteLabel(label.name(), label.color(), label.description()));
                known.add(label.name());
                logger.debug("Created {} label {}", tracker.kind().getDisplayName(), label.name());
                return null;
            } catch (GitTaskException e) {
                logger.warn("Creating {} label {} failed: {}", tracker.kind().getDisplayName(), label.name(),
                        e.getMessage());
                failed.put(label.name(), e);
                return e;
            }
        }
    }

    /**
     * Records links of remote creations in one transaction. When that fails the remote side already changed, so
     * the affected items are reported rather than rolled back.
     */
    private List<ItemResult> persistLinks(TrackerKind kind, Map<ItemResult, TaskMutation> links) {
        if (links.isEmpty()) {
            return List.of();
        }
        try {
            repository.applyTransaction(List.copyOf(links.values()),
                    "Link " + links.size() + " item(s) to " + kind.getDisplayName());
            return List.copyOf(links.keySet());
        } catch (GitTaskException e) {
            logger.error("Recording {} link(s) to {} failed", links.size(), kind.getDisplayName(), e);
            var results = new ArrayList<ItemResult>();
            for (ItemResult created : links.keySet()) {
                results.add(new ItemResult(created.taskId(), created.commentId(), created.remoteId(),
                        ItemResult.Outcome.LINK_NOT_PERSISTED, e.kind(),
                        created.message() + ", but the link was not saved: " + e.getMessage()));
            }
            return results;
        }
    }

    // ---------------------------------------------------------------- single items

    /** Creates {@code commentId} on the issue linked to the task and links it. */
    public ItemResult pushComment(RemoteTracker tracker, long taskId, long commentId) {
        var kind = tracker.kind();
        try {
            var task = repository.get(taskId);
            var comment = task.findComment(commentId).orElseThrow(() -> NotFoundException.comment(taskId, commentId));
            String issueId = linkedIssue(task, kind);
            String remoteCommentId = tracker.createComment(issueId, comment.text());
            var created = ItemResult.comment(taskId, commentId, remoteCommentId, ItemResult.Outcome.CREATED,
                    "Created " + kind.getDisplayName() + " comment " + remoteCommentId);
            return persistLinks(kind, Map.of(created, TaskMutation.linkComment(taskId, commentId, kind,
                    remoteCommentId))).get(0);
        } catch (GitTaskException e) {
            logger.error("Pushing comment {} of task ID {} failed", commentId, taskId, e);
            return ItemResult.failed(taskId, commentId, null, e);
        }
    }

    /** Sends the current text of a comment; comments never pushed before are created. */
    public ItemResult pushCommentUpdate(RemoteTracker tracker, long taskId, long commentId) {
        var kind = tracker.kind();
        try {
            var task = repository.get(taskId);
            var comment = task.findComment(commentId).orElseThrow(() -> NotFoundException.comment(taskId, commentId));
            var remoteCommentId = comment.link(kind);
            if (remoteCommentId.isEmpty()) {
                return pushComment(tracker, taskId, commentId);
            }
            tracker.updateComment(linkedIssue(task, kind), remoteCommentId.get(), comment.text());
            return ItemResult.comment(taskId, commentId, remoteCommentId.get(), ItemResult.Outcome.UPDATED,
                    kind.getDisplayName() + " comment " + remoteCommentId.get() + " has been updated");
        } catch (GitTaskException e) {
            logger.error("Updating remote comment {} of task ID {} failed", commentId, taskId, e);
            return ItemResult.failed(taskId, commentId, null, e);
        }
    }

    /**
     * Deletes the remote counterpart of a comment that was already removed locally.
     *
     * @param before the task as it was before the local deletion
     */
    public ItemResult pushCommentDelete(RemoteTracker tracker, Task before, long commentId) {
        var kind = tracker.kind();
        long taskId = before.id();
        var remoteCommentId = before.findComment(commentId).flatMap(c -> c.link(kind));
        if (remoteCommentId.isEmpty()) {
            return ItemResult.comment(taskId, commentId, null, ItemResult.Outcome.SKIPPED,
                    "Comment " + commentId + " is not linked to " + kind.getDisplayName());
        }
        try {
            tracker.deleteComment(linkedIssue(before, kind), remoteCommentId.get());
            return ItemResult.comment(taskId, commentId, remoteCommentId.get(), ItemResult.Outcome.DELETED,
                    kind.getDisplayName() + " comment " + remoteCommentId.get() + " has been deleted");
        } catch (GitTaskException e) {
            logger.error("Deleting remote comment {} of task ID {} failed", commentId, taskId, e);
            return ItemResult.failed(taskId, commentId, remoteCommentId.get(), e);
        }
    }

    /** Deletes the remote issues of tasks that were already deleted locally. */
    public SyncReport pushDelete(RemoteTracker tracker, List<Task> deleted) {
        var kind = tracker.kind();
        var results = new ArrayList<ItemResult>();
        for (Task task : deleted) {
            var remoteId = task.link(kind);
            if (remoteId.isEmpty()) {
                results.add(ItemResult.of(task.id(), null, ItemResult.Outcome.SKIPPED,
                        "Task ID " + task.id() + " is not linked to " + kind.getDisplayName()));
                continue;
            }
            try {
                tracker.deleteIssue(remoteId.get());
                results.add(ItemResult.of(task.id(), remoteId.get(), ItemResult.Outcome.DELETED,
                        kind.getDisplayName() + " issue " + remoteId.get() + " has been deleted"));
            } catch (GitTaskException e) {
                logger.error("Deleting {} issue {} failed", kind.getDisplayName(), remoteId.get(), e);
                results.add(ItemResult.failed(task.id(), null, remoteId.get(), e));
            }
        }
        return new SyncReport(kind, results);
    }

    private static String linkedIssue(Task task, TrackerKind kind) throws ValidationException {
        return task.link(kind).orElseThrow(() -> new ValidationException(
                "Task ID " + task.id() + " is not linked to " + kind.getDisplayName() + "; push it first"));
    }
}
