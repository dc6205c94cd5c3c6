package io.github.gittask.cli;

import io.github.gittask.exception.GitTaskException;
import io.github.gittask.model.Label;
import io.github.gittask.repository.TaskMutation;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

@CommandLine.Command(
        name = "label",
        description = "Add or delete task labels.",
        subcommands = {LabelCommand.Add.class, LabelCommand.Delete.class})
final class LabelCommand extends TaskCommand {
    @Override
    protected int run() {
        spec.commandLine().usage(out());
        return 0;
    }

    @CommandLine.Command(name = "add", description = "Add a label to a task, or replace one of the same name.")
    static final class Add extends TaskCommand {
        @CommandLine.Parameters(index = "0", description = "Task ID.")
        long taskId;

        @CommandLine.Parameters(index = "1", description = "Label name.")
        String name = "";

        @CommandLine.Option(names = {"-c", "--color"}, description = "Color name or #rrggbb.")
        @Nullable
        String color;

        @CommandLine.Option(names = {"-d", "--description"}, description = "Label description.")
        @Nullable
        String description;

        @CommandLine.Mixin
        RemoteOptions remote = new RemoteOptions();

        @Override
        protected int run() throws GitTaskException {
            var label = new Label(name, color == null ? Label.DEFAULT_COLOR : color, description);
            context().repository().applyTransaction(TaskMutation.addLabel(taskId, label), "Label task " + taskId);
            out().println("Task ID " + taskId + " updated");
            return pushIfRequested(remote, List.of(taskId));
        }
    }

    @CommandLine.Command(name = "delete", description = "Remove a label from a task.")
    static final class Delete extends TaskCommand {
        @CommandLine.Parameters(index = "0", description = "Task ID.")
        long taskId;

        @CommandLine.Parameters(index = "1", description = "Label name.")
        String name = "";

        @CommandLine.Mixin
        RemoteOptions remote = new RemoteOptions();

        @Override
        protected int run() throws GitTaskException {
            context().repository().applyTransaction(TaskMutation.removeLabel(taskId, name), "Unlabel task " + taskId);
            out().println("Task ID " + taskId + " updated");
            return pushIfRequested(remote, List.of(taskId));
        }
    }
}
