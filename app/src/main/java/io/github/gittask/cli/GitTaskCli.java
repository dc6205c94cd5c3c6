package io.github.gittask.cli;

import java.io.PrintWriter;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

@CommandLine.Command(
        name = "git-task",
        mixinStandardHelpOptions = true,
        version = "git-task 1.0",
        description = "Local-first task tracker that keeps its tasks inside the git repository.",
        subcommands = {
            TaskCommands.ListCommand.class,
            TaskCommands.ShowCommand.class,
            TaskCommands.CreateCommand.class,
            TaskCommands.StatusCommand.class,
            TaskCommands.GetCommand.class,
            TaskCommands.SetCommand.class,
            TaskCommands.UnsetCommand.class,
            TaskCommands.EditCommand.class,
            TaskCommands.ReplaceCommand.class,
            LabelCommand.class,
            CommentCommand.class,
            TaskCommands.ImportCommand.class,
            TaskCommands.ExportCommand.class,
            SyncCommands.PullCommand.class,
            SyncCommands.PushCommand.class,
            TaskCommands.StatsCommand.class,
            TaskCommands.DeleteCommand.class,
            TaskCommands.ClearCommand.class,
            ConfigCommand.class,
            CommandLine.HelpCommand.class
        })
public final class GitTaskCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(GitTaskCli.class);

    private final CliContext context;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public GitTaskCli(CliContext context) {
        this.context = context;
    }

    CliContext context() {
        return context;
    }

    public static void main(String[] args) {
        int exitCode;
        try (var context = CliContext.system()) {
            exitCode = execute(context, args);
        }
        System.exit(exitCode);
    }

    public static int execute(CliContext context, String... args) {
        logger.debug("Running git-task {}", String.join(" ", args));
        return new CommandLine(new GitTaskCli(context))
                .setOut(new PrintWriter(context.out(), true))
                .setErr(new PrintWriter(context.err(), true))
                .execute(args);
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(context.out());
        return 0;
    }
}
