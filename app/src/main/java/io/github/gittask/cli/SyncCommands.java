package io.github.gittask.cli;

import io.github.gittask.exception.GitTaskException;
import io.github.gittask.exception.ValidationException;
import io.github.gittask.sync.ItemResult.Outcome;
import io.github.gittask.sync.PullOptions;
import io.github.gittask.sync.PushOptions;
import io.github.gittask.sync.SyncReport;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

/** {@code pull} and {@code push} against the tracker detected from the git remotes. */
final class SyncCommands {
    private SyncCommands() {}

    /** Tracker selection and scope of a sync. */
    static class TrackerOptions {
        @CommandLine.Option(names = {"-r", "--remote"}, description = "Git remote to use when several match.")
        @Nullable
        String remote;

        @CommandLine.Option(
                names = "--connector",
                description = "Tracker to use: github, gitlab, jira or redmine. Detected from the remotes by default.")
        @Nullable
        String connector;

        @CommandLine.Option(names = "--no-comments", description = "Do not sync comments.")
        boolean noComments;

        @CommandLine.Option(names = "--no-labels", description = "Do not sync labels.")
        boolean noLabels;
    }

    static String summary(String verb, SyncReport report) {
        return verb + " " + report.trackerKind().getDisplayName() + ": "
                + report.count(Outcome.CREATED) + " created, "
                + report.count(Outcome.UPDATED) + " updated, "
                + report.count(Outcome.UNCHANGED) + " unchanged, "
                + report.failures().size() + " failed";
    }

    @CommandLine.Command(name = "pull", description = "Import issues from the remote tracker.")
    static final class PullCommand extends TaskCommand {
        @CommandLine.Parameters(index = "0", arity = "0..1", split = ",", description = "Remote issue IDs or keys.")
        @Nullable
        List<String> remoteIds;

        @CommandLine.Option(names = {"-l", "--limit"}, description = "Pull at most this many issues.")
        @Nullable
        Integer limit;

        @CommandLine.Option(
                names = {"-s", "--status"},
                description = "Only pull issues that are open or closed like this status.")
        @Nullable
        String status;

        @CommandLine.Mixin
        TrackerOptions tracker = new TrackerOptions();

        @Override
        protected int run() throws GitTaskException {
            var context = context();
            var remote = context.tracker(tracker.connector, tracker.remote);
            out().println("Pulling tasks from " + remote.kind().getDisplayName() + "...");
            var options = new PullOptions(remoteIds, status, limit, !tracker.noComments, !tracker.noLabels);
            var report = context.synchronizer().pull(remote, options);
            if (report.items().isEmpty()) {
                out().println("No tasks found");
                return 0;
            }
            int exit = report(report);
            out().println(summary("Pulled from", report));
            return exit;
        }
    }

    @CommandLine.Command(name = "push", description = "Create or update remote issues from local tasks.")
    static final class PushCommand extends TaskCommand {
        @CommandLine.Parameters(index = "0", description = "Task IDs, e.g. 2..5,10.")
        String ids = "";

        @CommandLine.Option(names = "--no-create", description = "Only update tasks that are already linked.")
        boolean noCreate;

        @CommandLine.Option(
                names = {"-j", "--parallelism"},
                description = "Tasks pushed concurrently (default: ${DEFAULT-VALUE}).")
        int parallelism = PushOptions.DEFAULT_PARALLELISM;

        @CommandLine.Mixin
        TrackerOptions tracker = new TrackerOptions();

        @Override
        protected int run() throws GitTaskException {
            var context = context();
            var selected = parseIds(ids);
            if (parallelism < 1) {
                throw new ValidationException("--parallelism must be at least 1");
            }
            var remote = context.tracker(tracker.connector, tracker.remote);
            var options = new PushOptions(!noCreate, !tracker.noComments, !tracker.noLabels, parallelism);
            var report = context.synchronizer().push(remote, selected, options);
            int exit = report(report);
            out().println(summary("Pushed to", report));
            return exit;
        }
    }
}
