package io.github.gittask.cli;

import io.github.gittask.exception.EncodingException;
import io.github.gittask.exception.GitTaskException;
import io.github.gittask.exception.NotFoundException;
import io.github.gittask.exception.ValidationException;
import io.github.gittask.model.Task;
import io.github.gittask.repository.TaskDocument;
import io.github.gittask.repository.TaskMutation;
import io.github.gittask.selector.SelectorResolver;
import io.github.gittask.selector.TaskFilter;
import io.github.gittask.selector.TaskSorter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

/** Commands that read and change tasks in the local repository. */
final class TaskCommands {
    private static final Logger logger = LogManager.getLogger(TaskCommands.class);

    private static final String JSON = "json";
    private static final int TOP_AUTHORS = 10;

    private TaskCommands() {}

    static void requireJson(@Nullable String format) throws ValidationException {
        if (format != null && !format.toLowerCase(Locale.ROOT).equals(JSON)) {
            throw new ValidationException("Only JSON format is supported");
        }
    }

    @CommandLine.Command(name = "list", description = "List tasks, sorted by task.list.sort.")
    static final class ListCommand extends TaskCommand {
        @CommandLine.Option(names = {"-s", "--status"}, split = ",", description = "Show only these statuses.")
        @Nullable
        List<String> statuses;

        @CommandLine.Option(names = {"-k", "--keyword"}, description = "Show tasks with a property containing it.")
        @Nullable
        String keyword;

        @CommandLine.Option(names = {"-f", "--from"}, description = "Created on or after: yyyy-MM-dd, today, yesterday.")
        @Nullable
        String from;

        @CommandLine.Option(names = {"-u", "--until"}, description = "Created on or before: yyyy-MM-dd, today, yesterday.")
        @Nullable
        String until;

        @CommandLine.Option(names = {"-a", "--author"}, description = "Show tasks by this author.")
        @Nullable
        String author;

        @CommandLine.Option(names = {"-c", "--columns"}, split = ",", description = "Columns to show.")
        @Nullable
        List<String> columns;

        @CommandLine.Option(names = "--sort", split = ",", description = "Sort keys, e.g. 'status, id desc'.")
        @Nullable
        List<String> sort;

        @CommandLine.Option(names = {"-l", "--limit"}, description = "Show at most this many tasks.")
        @Nullable
        Integer limit;

        @CommandLine.Mixin
        ColorOptions color = new ColorOptions();

        @Override
        protected int run() throws GitTaskException {
            var context = context();
            var config = context.config();
            var properties = context.properties();
            var sorter = sort == null ? new TaskSorter(config.listSort(), properties) : new TaskSorter(sort, properties);
            var filter = TaskFilter.all()
                    .withStatuses(statuses == null ? null : SelectorResolver.resolveStatuses(statuses, context.statuses()))
                    .withKeyword(keyword)
                    .withAuthor(author)
                    .withCreatedBetween(
                            from == null ? null : TaskFilter.parseFrom(from, context.zone()),
                            until == null ? null : TaskFilter.parseUntil(until, context.zone()))
                    .withLimit(limit);
            var shown = columns == null ? config.listColumns() : columns.stream().map(String::trim).toList();
            var printer = context.printer(color.noColor);
            for (Task task : filter.apply(sorter.sort(context.repository().loadAll()))) {
                out().println(printer.line(task, shown));
            }
            return 0;
        }
    }

    @CommandLine.Command(name = "show", description = "Show a task with its comments.")
    static final class ShowCommand extends TaskCommand {
        @CommandLine.Parameters(index = "0", description = "Task ID.")
        long id;

        @CommandLine.Mixin
        ColorOptions color = new ColorOptions();

        @Override
        protected int run() throws GitTaskException {
            var task = context().repository().get(id);
            out().println(context().printer(color.noColor).details(task));
            return 0;
        }
    }

    @CommandLine.Command(name = "create", description = "Create a task in the starting status.")
    static final class CreateCommand extends TaskCommand {
        @CommandLine.Parameters(index = "0", description = "Task name.")
        String name = "";

        @CommandLine.Option(names = {"-d", "--description"}, description = "Description; opens the editor if omitted.")
        @Nullable
        String description;

        @CommandLine.Option(names = {"-n", "--no-desc"}, description = "Create without a description.")
        boolean noDescription;

        @CommandLine.Mixin
        RemoteOptions remote = new RemoteOptions();

        @Override
        protected int run() throws GitTaskException {
            var context = context();
            String text = description;
            if (text == null) {
                text = noDescription ? "" : context.editText("");
            }
            var draft = Task.draft(name, text, context.statuses().starting().name());
            String author = context.author();
            if (!author.isEmpty()) {
                draft.setProperty(Task.AUTHOR, author);
            }
            var result = context.repository().applyTransaction(TaskMutation.create(draft), "Create task");
            long id = result.createdIds().get(0);
            out().println("Task ID " + id + " created");
            return pushIfRequested(remote, List.of(id));
        }
    }

    @CommandLine.Command(name = "status", description = "Set the status of tasks, by name or shortcut.")
    static final class StatusCommand extends TaskCommand {
        @CommandLine.Parameters(index = "0", description = "Task IDs, e.g. 2..5,10.")
        String ids = "";

        @CommandLine.Parameters(index = "1", description = "Status name or shortcut.")
        String status = "";

        @CommandLine.Mixin
        RemoteOptions remote = new RemoteOptions();

        @Override
        protected int run() throws GitTaskException {
            var selected = parseIds(ids);
            String canonical = context().statuses().canonical(status);
            var updated = applyEach(selected, id -> TaskMutation.setProperty(id, Task.STATUS, canonical), "Set status of");
            int pushed = pushIfRequested(remote, updated);
            return updated.size() == selected.size() ? pushed : 1;
        }
    }

    @CommandLine.Command(name = "get", description = "Print one property of a task.")
    static final class GetCommand extends TaskCommand {
        @CommandLine.Parameters(index = "0", description = "Task ID.")
        long id;

        @CommandLine.Parameters(index = "1", description = "Property name.")
        String property = "";

        @Override
        protected int run() throws GitTaskException {
            var task = context().repository().get(id);
            String value = property.equals("id") ? Long.toString(task.id()) : task.getProperty(property);
            if (value == null) {
                throw new NotFoundException("Task property " + property + " not found");
            }
            out().println(value);
            return 0;
        }
    }

    @CommandLine.Command(name = "set", description = "Set a property of tasks.")
    static final class SetCommand extends TaskCommand {
        @CommandLine.Parameters(index = "0", description = "Task IDs, e.g. 2..5,10.")
        String ids = "";

        @CommandLine.Parameters(index = "1", description = "Property name.")
        String property = "";

        @CommandLine.Parameters(index = "2", description = "New value.")
        String value = "";

        @CommandLine.Mixin
        RemoteOptions remote = new RemoteOptions();

        @Override
        protected int run() throws GitTaskException {
            if (property.equals("id")) {
                throw new ValidationException("Task IDs are assigned by the repository and cannot be changed");
            }
            var selected = parseIds(ids);
            var updated = applyEach(selected, id -> TaskMutation.setProperty(id, property, value), "Set " + property + " of");
            int pushed = pushIfRequested(remote, updated);
            return updated.size() == selected.size() ? pushed : 1;
        }
    }

    @CommandLine.Command(name = "unset", description = "Remove a property from tasks.")
    static final class UnsetCommand extends TaskCommand {
        @CommandLine.Parameters(index = "0", description = "Task IDs, e.g. 2..5,10.")
        String ids = "";

        @CommandLine.Parameters(index = "1", description = "Property name.")
        String property = "";

        @Override
        protected int run() throws GitTaskException {
            var selected = parseIds(ids);
            var updated = applyEach(selected, id -> TaskMutation.unsetProperty(id, property), "Unset " + property + " of");
            return updated.size() == selected.size() ? 0 : 1;
        }
    }

    @CommandLine.Command(name = "edit", description = "Edit a property of a task in the editor.")
    static final class EditCommand extends TaskCommand {
        @CommandLine.Parameters(index = "0", description = "Task ID.")
        long id;

        @CommandLine.Parameters(index = "1", description = "Property name.")
        String property = "";

        @CommandLine.Mixin
        RemoteOptions remote = new RemoteOptions();

        @Override
        protected int run() throws GitTaskException {
            var context = context();
            var task = context.repository().get(id);
            String value = task.getProperty(property);
            if (value == null) {
                throw new NotFoundException("Task property " + property + " not found");
            }
            String edited = context.editText(value);
            if (edited.equals(value)) {
                out().println("Task ID " + id + " not changed");
                return 0;
            }
            context.repository().applyTransaction(TaskMutation.setProperty(id, property, edited), "Edit " + property + " of " + id);
            out().println("Task ID " + id + " updated");
            return pushIfRequested(remote, List.of(id));
        }
    }

    @CommandLine.Command(name = "replace", description = "Replace text inside a property of tasks.")
    static final class ReplaceCommand extends TaskCommand {
        @CommandLine.Parameters(index = "0", description = "Task IDs, e.g. 2..5,10.")
        String ids = "";

        @CommandLine.Parameters(index = "1", description = "Property name.")
        String property = "";

        @CommandLine.Parameters(index = "2", description = "Text to search for.")
        String search = "";

        @CommandLine.Parameters(index = "3", description = "Replacement.")
        String replacement = "";

        @CommandLine.Option(names = "--regex", description = "Treat the search text as a regular expression.")
        boolean regex;

        @CommandLine.Mixin
        RemoteOptions remote = new RemoteOptions();

        @Override
        protected int run() throws GitTaskException {
            var selected = parseIds(ids);
            var pattern = compile();
            String with = regex ? replacement : Matcher.quoteReplacement(replacement);
            var updated = applyEach(selected, id -> TaskMutation.update(id, task -> {
                String value = task.getProperty(property);
                if (value == null) {
                    throw new NotFoundException("Task ID " + id + ": property " + property + " not found");
                }
                task.setProperty(property, pattern.matcher(value).replaceAll(with));
            }), "Replace in " + property + " of");
            int pushed = pushIfRequested(remote, updated);
            return updated.size() == selected.size() ? pushed : 1;
        }

        private Pattern compile() throws ValidationException {
            try {
                return regex ? Pattern.compile(search) : Pattern.compile(Pattern.quote(search));
            } catch (PatternSyntaxException e) {
                throw new ValidationException("Invalid regular expression: " + e.getDescription(), e);
            }
        }
    }

    @CommandLine.Command(name = "delete", description = "Delete tasks by ID or by status.")
    static final class DeleteCommand extends TaskCommand {
        @CommandLine.Parameters(index = "0", arity = "0..1", description = "Task IDs, e.g. 2..5,10.")
        @Nullable
        String ids;

        @CommandLine.Option(names = {"-s", "--status"}, split = ",", description = "Delete all tasks in these statuses.")
        @Nullable
        List<String> statuses;

        @CommandLine.Mixin
        RemoteOptions remote = new RemoteOptions();

        @Override
        protected int run() throws GitTaskException {
            var context = context();
            var repository = context.repository();
            var deleted = new ArrayList<Task>();
            if (statuses != null) {
                var filter = TaskFilter.all()
                        .withStatuses(SelectorResolver.resolveStatuses(statuses, context.statuses()));
                deleted.addAll(filter.apply(repository.loadAll()));
            } else if (ids != null) {
                for (long id : parseIds(ids)) {
                    deleted.add(repository.get(id));
                }
            } else {
                throw new ValidationException("Give task IDs or --status");
            }
            if (deleted.isEmpty()) {
                out().println("No tasks found");
                return 0;
            }
            var mutations = deleted.stream().map(task -> TaskMutation.delete(task.id())).toList();
            repository.applyTransaction(mutations, "Delete " + deleted.size() + " task(s)");
            out().println("Task(s) " + deleted.stream().map(t -> Long.toString(t.id())).collect(Collectors.joining(", "))
                    + " deleted");
            if (!remote.push) {
                return 0;
            }
            var tracker = context.tracker(remote.connector, remote.remote);
            return report(context.synchronizer().pushDelete(tracker, deleted));
        }
    }

    @CommandLine.Command(name = "clear", description = "Delete all tasks. IDs are not reused afterwards.")
    static final class ClearCommand extends TaskCommand {
        @Override
        protected int run() throws GitTaskException {
            var repository = context().repository();
            int count = repository.loadAll().size();
            repository.applyTransaction(TaskMutation.clear(), "Clear tasks");
            out().println(count + " task(s) deleted");
            return 0;
        }
    }

    @CommandLine.Command(name = "stats", description = "Count tasks by status and author.")
    static final class StatsCommand extends TaskCommand {
        @CommandLine.Mixin
        ColorOptions color = new ColorOptions();

        @Override
        protected int run() throws GitTaskException {
            var context = context();
            var tasks = context.repository().loadAll();
            var printer = context.printer(color.noColor);
            var byStatus = new LinkedHashMap<String, Integer>();
            var byAuthor = new LinkedHashMap<String, Integer>();
            for (Task task : tasks) {
                byStatus.merge(task.status(), 1, Integer::sum);
                String author = task.getProperty(Task.AUTHOR);
                if (author != null && !author.isEmpty()) {
                    byAuthor.merge(author, 1, Integer::sum);
                }
            }
            out().println("Total tasks: " + tasks.size());
            out().println();
            for (var status : context.statuses().statuses()) {
                Integer count = byStatus.get(status.name());
                if (count != null) {
                    out().println(printer.formatStatus(status.name()) + ": " + count);
                }
            }
            if (!byAuthor.isEmpty()) {
                out().println();
                out().println("Top " + TOP_AUTHORS + " authors:");
                byAuthor.entrySet().stream()
                        .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                                .thenComparing(Map.Entry.<String, Integer>comparingByKey()))
                        .limit(TOP_AUTHORS)
                        .forEach(e -> out().println(printer.formatValue(Task.AUTHOR, e.getKey(), Map.of()) + ": "
                                + e.getValue()));
            }
            return 0;
        }
    }

    @CommandLine.Command(name = "import", description = "Import tasks as JSON from standard input.")
    static final class ImportCommand extends TaskCommand {
        @CommandLine.Parameters(index = "0", arity = "0..1", description = "Only import these task IDs.")
        @Nullable
        String ids;

        @CommandLine.Option(names = "--format", description = "Input format; only json is supported.")
        @Nullable
        String format;

        @Override
        protected int run() throws GitTaskException {
            requireJson(format);
            var context = context();
            String input = context.readStdin();
            if (input.isBlank()) {
                throw new ValidationException("Can't read from pipe");
            }
            var repository = context.repository();
            List<Task> tasks;
            try {
                tasks = new TaskDocument(repository.codec()).read(input, ids == null ? null : parseIds(ids));
            } catch (EncodingException e) {
                logger.debug("Rejected import input", e);
                throw new ValidationException("Can't deserialize input", e);
            }
            if (tasks.isEmpty()) {
                out().println("No tasks found");
                return 0;
            }
            var mutations = tasks.stream().map(TaskMutation::importTask).toList();
            var result = repository.applyTransaction(mutations, "Import " + tasks.size() + " task(s)");
            var created = result.createdIds().iterator();
            for (Task task : tasks) {
                long id = task.id() > 0 ? task.id() : created.next();
                out().println("Task ID " + id + " imported");
            }
            return 0;
        }
    }

    @CommandLine.Command(name = "export", description = "Export tasks as JSON.")
    static final class ExportCommand extends TaskCommand {
        @CommandLine.Parameters(index = "0", arity = "0..1", description = "Only export these task IDs.")
        @Nullable
        String ids;

        @CommandLine.Option(names = {"-s", "--status"}, split = ",", description = "Only export these statuses.")
        @Nullable
        List<String> statuses;

        @CommandLine.Option(names = {"-l", "--limit"}, description = "Export at most this many tasks.")
        @Nullable
        Integer limit;

        @CommandLine.Option(names = "--format", description = "Output format; only json is supported.")
        @Nullable
        String format;

        @CommandLine.Option(names = "--pretty", description = "Indent the output.")
        boolean pretty;

        @Override
        protected int run() throws GitTaskException {
            requireJson(format);
            var context = context();
            var repository = context.repository();
            var filter = TaskFilter.all()
                    .withIds(ids == null ? null : parseIds(ids))
                    .withStatuses(statuses == null ? null : SelectorResolver.resolveStatuses(statuses, context.statuses()))
                    .withLimit(limit);
            out().println(new TaskDocument(repository.codec()).write(filter.apply(repository.loadAll()), pretty));
            return 0;
        }
    }
}
