package io.github.gittask.cli;

import io.github.gittask.exception.GitTaskException;
import io.github.gittask.exception.StoreException;
import io.github.gittask.exception.ValidationException;
import io.github.gittask.remote.TrackerKind;
import io.github.gittask.repository.TaskMutation;
import io.github.gittask.selector.SelectorResolver;
import io.github.gittask.sync.ItemResult;
import io.github.gittask.sync.PushOptions;
import io.github.gittask.sync.SyncReport;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.LongFunction;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

/**
 * Base of every subcommand. Failures surface as {@code ERROR: <message>} on stderr and exit code 1.
 */
abstract class TaskCommand implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(TaskCommand.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    /** Options of commands that can forward their change to a remote tracker. */
    static class RemoteOptions {
        @CommandLine.Option(names = "--push", description = "Push the change to the remote tracker.")
        boolean push;

        @CommandLine.Option(names = {"-r", "--remote"}, description = "Git remote to use when several match.")
        @Nullable
        String remote;

        @CommandLine.Option(
                names = "--connector",
                description = "Tracker to use: github, gitlab, jira or redmine. Detected from the remotes by default.")
        @Nullable
        String connector;
    }

    /** Option shared by every command that prints tasks. */
    static class ColorOptions {
        @CommandLine.Option(names = "--no-color", description = "Disable colored output.")
        boolean noColor;
    }

    protected CliContext context() {
        return ((GitTaskCli) spec.root().userObject()).context();
    }

    protected PrintStream out() {
        return context().out();
    }

    protected PrintStream err() {
        return context().err();
    }

    @Override
    public Integer call() {
        try {
            return run();
        } catch (GitTaskException e) {
            logger.debug("{} failed", spec.qualifiedName(), e);
            err().println("ERROR: " + e.getMessage());
            return 1;
        }
    }

    protected abstract int run() throws GitTaskException;

    static List<Long> parseIds(String selector) throws ValidationException {
        var ids = SelectorResolver.parse(selector);
        if (ids.isEmpty()) {
            throw new ValidationException("No task IDs given");
        }
        return ids;
    }

    /**
     * Applies one mutation per task, each in its own transaction, so that a missing task does not block the others.
     *
     * @return IDs of the tasks that were updated
     */
    protected List<Long> applyEach(List<Long> ids, LongFunction<TaskMutation> mutation, String message)
            throws StoreException {
        var repository = context().repository();
        var updated = new ArrayList<Long>();
        for (long id : ids) {
            try {
                repository.applyTransaction(mutation.apply(id), message + " " + id);
                out().println("Task ID " + id + " updated");
                updated.add(id);
            } catch (StoreException e) {
                throw e;
            } catch (GitTaskException e) {
                err().println("ERROR: " + e.getMessage());
            }
        }
        return updated;
    }

    /** Pushes {@code ids} when {@code --push} was given. */
    protected int pushIfRequested(RemoteOptions remote, List<Long> ids) throws GitTaskException {
        if (!remote.push || ids.isEmpty()) {
            return 0;
        }
        var tracker = context().tracker(remote.connector, remote.remote);
        return report(context().synchronizer().push(tracker, ids, PushOptions.defaults()));
    }

    /** Prints one line per item, failures to stderr, and returns 1 when any item failed. */
    protected int report(SyncReport report) {
        for (ItemResult item : report.items()) {
            switch (item.outcome()) {
                case FAILED, LINK_NOT_PERSISTED -> err().println("ERROR: " + describe(item) + ": "
                        + (item.errorKind() == null ? item.outcome() : item.errorKind()) + ": " + item.message());
                case SKIPPED -> err().println(describe(item) + " skipped: " + item.message());
                default -> out().println(describe(item) + ": " + item.message());
            }
        }
        var failures = report.failures();
        if (!failures.isEmpty()) {
            err().println(failures.size() + " of " + report.items().size() + " item(s) failed");
            return 1;
        }
        return 0;
    }

    protected int report(ItemResult item, TrackerKind kind) {
        return report(new SyncReport(kind, List.of(item)));
    }

    private static String describe(ItemResult item) {
        var text = new StringBuilder();
        text.append(item.taskId() > 0 ? "Task ID " + item.taskId() : "Remote task");
        if (item.commentId() != null) {
            text.append(" comment ID ").append(item.commentId());
        }
        if (item.remoteId() != null) {
            text.append(" (remote ").append(item.remoteId()).append(')');
        }
        return text.toString();
    }
}
