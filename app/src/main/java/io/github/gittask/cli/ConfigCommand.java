package io.github.gittask.cli;

import io.github.gittask.config.PropertyTable;
import io.github.gittask.config.StatusTable;
import io.github.gittask.config.TaskConfig;
import io.github.gittask.exception.GitTaskException;
import io.github.gittask.exception.NotFoundException;
import io.github.gittask.exception.ValidationException;
import io.github.gittask.model.PropertyDefinition;
import io.github.gittask.model.PropertyDefinition.ValueType;
import io.github.gittask.model.StatusDefinition;
import io.github.gittask.model.Task;
import io.github.gittask.remote.TrackerKind;
import io.github.gittask.repository.TaskMutation;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

@CommandLine.Command(
        name = "config",
        description = "Read and change git-task settings.",
        subcommands = {
            ConfigCommand.Get.class,
            ConfigCommand.Set.class,
            ConfigCommand.ListKeys.class,
            ConfigCommand.StatusConfig.class,
            ConfigCommand.PropertiesConfig.class
        })
final class ConfigCommand extends TaskCommand {
    private static final List<String> TRACKER_KEYS = List.of(
            "task.github.url",
            "task.github.token",
            "task.github.repo",
            "task.gitlab.url",
            "task.gitlab.token",
            "task.gitlab.project",
            "task.jira.url",
            "task.jira.user",
            "task.jira.token",
            "task.jira.project",
            "task.jira.issue.type",
            "task.redmine.url",
            "task.redmine.api.key",
            "task.redmine.project.id");

    /** Every key accepted by {@code config get} and {@code config set}. */
    static List<String> knownKeys() {
        var keys = new ArrayList<String>(List.of(
                TaskConfig.LIST_COLUMNS,
                TaskConfig.LIST_SORT,
                TaskConfig.STATUS_OPEN,
                TaskConfig.STATUS_CLOSED,
                TaskConfig.REF));
        keys.addAll(TRACKER_KEYS);
        for (TrackerKind kind : TrackerKind.values()) {
            keys.add("task." + kind.key() + ".status.open");
            keys.add("task." + kind.key() + ".status.closed");
        }
        return keys;
    }

    static void requireKnown(String key) throws ValidationException {
        if (!knownKeys().contains(key)) {
            throw new ValidationException("Unknown parameter: " + key);
        }
    }

    @Override
    protected int run() {
        spec.commandLine().usage(out());
        return 0;
    }

    @CommandLine.Command(name = "get", description = "Print a setting, or its default.")
    static final class Get extends TaskCommand {
        @CommandLine.Parameters(index = "0", description = "Setting name, e.g. task.list.sort.")
        String key = "";

        @Override
        protected int run() throws GitTaskException {
            requireKnown(key);
            var config = context().config();
            String value = key.equals(TaskConfig.REF)
                    ? config.ref()
                    : config.get(key).orElseThrow(() -> new NotFoundException(key + " is not set"));
            out().println(value);
            return 0;
        }
    }

    @CommandLine.Command(name = "set", description = "Change a setting.")
    static final class Set extends TaskCommand {
        @CommandLine.Parameters(index = "0", description = "Setting name, e.g. task.list.sort.")
        String key = "";

        @CommandLine.Parameters(index = "1", description = "New value.")
        String value = "";

        @CommandLine.Option(names = "--move-ref", description = "With task.ref: move the existing tasks to the new ref.")
        boolean moveRef;

        @Override
        protected int run() throws GitTaskException {
            requireKnown(key);
            var context = context();
            String stored = value;
            if (key.equals(TaskConfig.REF)) {
                stored = TaskConfig.normalizeRef(value);
                if (moveRef) {
                    context.store().moveRef(context.config().ref(), stored, true);
                }
            }
            context.configStore().set(key, stored);
            out().println(key + " has been updated");
            return 0;
        }
    }

    @CommandLine.Command(name = "list", description = "List the supported settings.")
    static final class ListKeys extends TaskCommand {
        @Override
        protected int run() {
            knownKeys().forEach(out()::println);
            return 0;
        }
    }

    @CommandLine.Command(
            name = "status",
            description = "Manage the status table.",
            subcommands = {
                StatusList.class,
                StatusAdd.class,
                StatusDelete.class,
                StatusGet.class,
                StatusSet.class,
                StatusImport.class,
                StatusExport.class,
                StatusReset.class
            })
    static final class StatusConfig extends TaskCommand {
        @Override
        protected int run() {
            spec.commandLine().usage(out());
            return 0;
        }
    }

    @CommandLine.Command(name = "list", description = "List statuses.")
    static final class StatusList extends TaskCommand {
        @Override
        protected int run() throws GitTaskException {
            out().println("Name\tShortcut\tColor\tStyle\tIs DONE");
            for (StatusDefinition status : context().statuses().statuses()) {
                out().println(String.join("\t", status.name(), status.shortcut(), status.color(),
                        status.style() == null ? "" : status.style(), Boolean.toString(status.closing())));
            }
            return 0;
        }
    }

    @CommandLine.Command(name = "add", description = "Add a status.")
    static final class StatusAdd extends TaskCommand {
        @CommandLine.Parameters(index = "0", description = "Status name.")
        String name = "";

        @CommandLine.Parameters(index = "1", description = "Single-character shortcut.")
        String shortcut = "";

        @CommandLine.Parameters(index = "2", description = "Color.")
        String color = "";

        @CommandLine.Option(names = "--style", description = "Comma-separated styles, e.g. bold,italic.")
        @Nullable
        String style;

        @CommandLine.Option(names = "--is-done", description = "Tasks in this status count as done.")
        boolean done;

        @Override
        protected int run() throws GitTaskException {
            var context = context();
            context.statuses()
                    .add(new StatusDefinition(name, null, shortcut, color, style, done))
                    .save(context.configStore());
            out().println("Status has been added");
            return 0;
        }
    }

    @CommandLine.Command(name = "delete", description = "Delete a status.")
    static final class StatusDelete extends TaskCommand {
        @CommandLine.Parameters(index = "0", description = "Status name or shortcut.")
        String name = "";

        @CommandLine.Option(names = "--force", description = "Delete even if tasks still have the status.")
        boolean force;

        @Override
        protected int run() throws GitTaskException {
            var context = context();
            var statuses = context.statuses();
            String canonical = statuses.canonical(name);
            if (!force && context.repository().loadAll().stream().anyMatch(t -> t.status().equals(canonical))) {
                throw new ValidationException(
                        "Can't delete a status, some tasks still have it. Use --force option to override.");
            }
            statuses.remove(canonical).save(context.configStore());
            out().println("Status has been deleted");
            return 0;
        }
    }

    @CommandLine.Command(name = "get", description = "Print one field of a status.")
    static final class StatusGet extends TaskCommand {
        @CommandLine.Parameters(index = "0", description = "Status name or shortcut.")
        String name = "";

        @CommandLine.Parameters(index = "1", description = "Field: name, display, shortcut, color, style or is_done.")
        String field = "";

        @Override
        protected int run() throws GitTaskException {
            var statuses = context().statuses();
            var status = statuses.find(statuses.canonical(name)).orElseThrow();
            out().println(StatusTable.getField(status, field));
            return 0;
        }
    }

    @CommandLine.Command(name = "set", description = "Change one field of a status; renaming updates the tasks too.")
    static final class StatusSet extends TaskCommand {
        @CommandLine.Parameters(index = "0", description = "Status name or shortcut.")
        String name = "";

        @CommandLine.Parameters(index = "1", description = "Field: name, display, shortcut, color, style or is_done.")
        String field = "";

        @CommandLine.Parameters(index = "2", description = "New value.")
        String value = "";

        @Override
        protected int run() throws GitTaskException {
            var context = context();
            var statuses = context.statuses();
            String canonical = statuses.canonical(name);
            statuses.set(canonical, field, value).save(context.configStore());
            out().println(canonical + " " + field + " has been updated");
            if (field.equalsIgnoreCase("name") && !value.equals(canonical)) {
                var repository = context.repository();
                var mutations = repository.loadAll().stream()
                        .filter(task -> task.status().equals(canonical))
                        .map(task -> TaskMutation.setProperty(task.id(), Task.STATUS, value))
                        .toList();
                if (!mutations.isEmpty()) {
                    repository.applyTransaction(mutations, "Rename status " + canonical + " to " + value);
                    out().println(mutations.size() + " task(s) updated");
                }
            }
            return 0;
        }
    }

    @CommandLine.Command(name = "import", description = "Replace the status table with JSON from standard input.")
    static final class StatusImport extends TaskCommand {
        @Override
        protected int run() throws GitTaskException {
            var context = context();
            String input = context.readStdin();
            if (input.isBlank()) {
                throw new ValidationException("Can't read from pipe");
            }
            StatusTable.fromJson(input).save(context.configStore());
            out().println("Import successful");
            return 0;
        }
    }

    @CommandLine.Command(name = "export", description = "Print the status table as JSON.")
    static final class StatusExport extends TaskCommand {
        @CommandLine.Option(names = "--pretty", description = "Indent the output.")
        boolean pretty;

        @Override
        protected int run() throws GitTaskException {
            out().println(context().statuses().toJson(pretty));
            return 0;
        }
    }

    @CommandLine.Command(name = "reset", description = "Restore the default statuses.")
    static final class StatusReset extends TaskCommand {
        @Override
        protected int run() throws GitTaskException {
            StatusTable.reset(context().configStore());
            out().println("Statuses have been reset");
            return 0;
        }
    }

    @CommandLine.Command(
            name = "properties",
            description = "Manage how task properties are displayed.",
            subcommands = {
                PropertyList.class,
                PropertyAdd.class,
                PropertyDelete.class,
                PropertyGet.class,
                PropertySet.class,
                PropertyImport.class,
                PropertyExport.class,
                PropertyReset.class,
                EnumConfig.class,
                ConditionConfig.class
            })
    static final class PropertiesConfig extends TaskCommand {
        @Override
        protected int run() {
            spec.commandLine().usage(out());
            return 0;
        }
    }

    static ValueType parseValueType(String text) throws ValidationException {
        try {
            return ValueType.parse(text);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown value type: " + text, e);
        }
    }

    @CommandLine.Command(name = "list", description = "List property definitions.")
    static final class PropertyList extends TaskCommand {
        @Override
        protected int run() throws GitTaskException {
            out().println("Name\tValue type\tColor\tStyle\tEnum values");
            for (PropertyDefinition property : context().properties().properties()) {
                String enums = property.enumValues().stream()
                        .map(v -> v.name() + "," + v.color() + (v.style() == null ? "" : "," + v.style()))
                        .collect(Collectors.joining(";"));
                out().println(String.join("\t", property.name(), PropertyTable.getField(property, "value_type"),
                        property.color(), property.style() == null ? "" : property.style(), enums));
            }
            return 0;
        }
    }

    @CommandLine.Command(name = "add", description = "Add a property definition.")
    static final class PropertyAdd extends TaskCommand {
        @CommandLine.Parameters(index = "0", description = "Property name.")
        String name = "";

        @CommandLine.Parameters(index = "1", description = "Value type: string, text, integer, datetime or enum.")
        String valueType = "";

        @CommandLine.Parameters(index = "2", description = "Color.")
        String color = "";

        @CommandLine.Option(names = "--style", description = "Comma-separated styles, e.g. bold,italic.")
        @Nullable
        String style;

        @Override
        protected int run() throws GitTaskException {
            var context = context();
            var definition = new PropertyDefinition(name, parseValueType(valueType), color).withStyle(style);
            context.properties().add(definition).save(context.configStore());
            out().println("Property " + name + " has been added");
            return 0;
        }
    }

    @CommandLine.Command(name = "delete", description = "Delete a property definition.")
    static final class PropertyDelete extends TaskCommand {
        @CommandLine.Parameters(index = "0", description = "Property name.")
        String name = "";

        @CommandLine.Option(names = "--force", description = "Delete even if tasks still have the property.")
        boolean force;

        @Override
        protected int run() throws GitTaskException {
            var context = context();
            if (!force && context.repository().loadAll().stream().anyMatch(t -> t.getProperty(name) != null)) {
                throw new ValidationException(
                        "Can't delete a property, some tasks still have it. Use --force option to override.");
            }
            context.properties().remove(name).save(context.configStore());
            out().println("Property " + name + " has been deleted");
            return 0;
        }
    }

    @CommandLine.Command(name = "get", description = "Print one field of a property definition.")
    static final class PropertyGet extends TaskCommand {
        @CommandLine.Parameters(index = "0", description = "Property name.")
        String name = "";

        @CommandLine.Parameters(index = "1", description = "Field: name, value_type, color or style.")
        String field = "";

        @Override
        protected int run() throws GitTaskException {
            var property = context().properties().find(name)
                    .orElseThrow(() -> new NotFoundException("Property " + name + " not found"));
            out().println(PropertyTable.getField(property, field));
            return 0;
        }
    }

    @CommandLine.Command(name = "set", description = "Change one field of a property; renaming updates the tasks too.")
    static final class PropertySet extends TaskCommand {
        @CommandLine.Parameters(index = "0", description = "Property name.")
        String name = "";

        @CommandLine.Parameters(index = "1", description = "Field: name, value_type, color or style.")
        String field = "";

        @CommandLine.Parameters(index = "2", description = "New value.")
        String value = "";

        @Override
        protected int run() throws GitTaskException {
            var context = context();
            context.properties().set(name, field, value).save(context.configStore());
            out().println(name + " " + field + " has been updated");
            if (field.equalsIgnoreCase("name") && !value.equals(name)) {
                var repository = context.repository();
                var mutations = repository.loadAll().stream()
                        .filter(task -> task.getProperty(name) != null)
                        .map(task -> TaskMutation.update(task.id(), t -> {
                            String current = t.getProperty(name);
                            if (current != null) {
                                t.removeProperty(name);
                                t.setProperty(value, current);
                            }
                        }))
                        .toList();
                if (!mutations.isEmpty()) {
                    repository.applyTransaction(mutations, "Rename property " + name + " to " + value);
                    out().println(mutations.size() + " task(s) updated");
                }
            }
            return 0;
        }
    }

    @CommandLine.Command(name = "import", description = "Replace the property table with JSON from standard input.")
    static final class PropertyImport extends TaskCommand {
        @Override
        protected int run() throws GitTaskException {
            var context = context();
            String input = context.readStdin();
            if (input.isBlank()) {
                throw new ValidationException("Can't read from pipe");
            }
            PropertyTable.fromJson(input).save(context.configStore());
            out().println("Import successful");
            return 0;
        }
    }

    @CommandLine.Command(name = "export", description = "Print the property table as JSON.")
    static final class PropertyExport extends TaskCommand {
        @CommandLine.Option(names = "--pretty", description = "Indent the output.")
        boolean pretty;

        @Override
        protected int run() throws GitTaskException {
            out().println(context().properties().toJson(pretty));
            return 0;
        }
    }

    @CommandLine.Command(name = "reset", description = "Restore the default property definitions.")
    static final class PropertyReset extends TaskCommand {
        @Override
        protected int run() throws GitTaskException {
            PropertyTable.reset(context().configStore());
            out().println("Properties have been reset");
            return 0;
        }
    }

    @CommandLine.Command(
            name = "enum",
            description = "Manage the colors of enum values.",
            subcommands = {EnumList.class, EnumAdd.class, EnumDelete.class})
    static final class EnumConfig extends TaskCommand {
        @Override
        protected int run() {
            spec.commandLine().usage(out());
            return 0;
        }
    }

    static PropertyDefinition property(CliContext context, String name) throws GitTaskException {
        return context.properties().find(name).orElseThrow(() -> new NotFoundException("Property " + name + " not found"));
    }

    @CommandLine.Command(name = "list", description = "List the enum values of a property.")
    static final class EnumList extends TaskCommand {
        @CommandLine.Parameters(index = "0", description = "Property name.")
        String name = "";

        @Override
        protected int run() throws GitTaskException {
            out().println("Name\tColor\tStyle");
            for (PropertyDefinition.EnumValue value : property(context(), name).enumValues()) {
                out().println(String.join("\t", value.name(), value.color(), value.style() == null ? "" : value.style()));
            }
            return 0;
        }
    }

    @CommandLine.Command(name = "add", description = "Add or replace an enum value.")
    static final class EnumAdd extends TaskCommand {
        @CommandLine.Parameters(index = "0", description = "Property name.")
        String name = "";

        @CommandLine.Parameters(index = "1", description = "Enum value.")
        String value = "";

        @CommandLine.Parameters(index = "2", description = "Color.")
        String color = "";

        @CommandLine.Option(names = "--style", description = "Comma-separated styles, e.g. bold,italic.")
        @Nullable
        String style;

        @Override
        protected int run() throws GitTaskException {
            var context = context();
            var property = property(context, name);
            var values = new ArrayList<>(property.enumValues());
            values.removeIf(v -> v.name().equals(value));
            values.add(new PropertyDefinition.EnumValue(value, color, style));
            context.properties().replace(name, property.withEnumValues(values)).save(context.configStore());
            out().println(name + " enum values have been updated");
            return 0;
        }
    }

    @CommandLine.Command(name = "delete", description = "Delete an enum value.")
    static final class EnumDelete extends TaskCommand {
        @CommandLine.Parameters(index = "0", description = "Property name.")
        String name = "";

        @CommandLine.Parameters(index = "1", description = "Enum value.")
        String value = "";

        @Override
        protected int run() throws GitTaskException {
            var context = context();
            var property = property(context, name);
            var values = new ArrayList<>(property.enumValues());
            if (!values.removeIf(v -> v.name().equals(value))) {
                throw new NotFoundException("Enum value " + value + " not found in property " + name);
            }
            context.properties().replace(name, property.withEnumValues(values)).save(context.configStore());
            out().println(name + " enum values have been updated");
            return 0;
        }
    }

    @CommandLine.Command(
            name = "cond-format",
            description = "Manage conditional formatting of a property.",
            subcommands = {ConditionList.class, ConditionAdd.class, ConditionClear.class})
    static final class ConditionConfig extends TaskCommand {
        @Override
        protected int run() {
            spec.commandLine().usage(out());
            return 0;
        }
    }

    @CommandLine.Command(name = "list", description = "List the formatting conditions of a property.")
    static final class ConditionList extends TaskCommand {
        @CommandLine.Parameters(index = "0", description = "Property name.")
        String name = "";

        @Override
        protected int run() throws GitTaskException {
            out().println("Condition\tColor\tStyle");
            for (PropertyDefinition.Condition condition : property(context(), name).conditions()) {
                out().println(String.join("\t", condition.condition(), condition.color(),
                        condition.style() == null ? "" : condition.style()));
            }
            return 0;
        }
    }

    @CommandLine.Command(name = "add", description = "Add a condition; the first matching one wins.")
    static final class ConditionAdd extends TaskCommand {
        @CommandLine.Parameters(index = "0", description = "Property name.")
        String name = "";

        @CommandLine.Parameters(index = "1", description = "Expression over task properties, e.g. priority == 'HIGH'.")
        String expression = "";

        @CommandLine.Parameters(index = "2", description = "Color.")
        String color = "";

        @CommandLine.Option(names = "--style", description = "Comma-separated styles, e.g. bold,italic.")
        @Nullable
        String style;

        @Override
        protected int run() throws GitTaskException {
            var context = context();
            // reject expressions that do not parse
            new SimpleExpressionEvaluator().test(expression, Map.of());
            var property = property(context, name);
            var conditions = new ArrayList<>(property.conditions());
            conditions.add(new PropertyDefinition.Condition(expression, color, style));
            context.properties().replace(name, property.withConditions(conditions)).save(context.configStore());
            out().println(name + " conditional formatting has been updated");
            return 0;
        }
    }

    @CommandLine.Command(name = "clear", description = "Remove all formatting conditions of a property.")
    static final class ConditionClear extends TaskCommand {
        @CommandLine.Parameters(index = "0", description = "Property name.")
        String name = "";

        @Override
        protected int run() throws GitTaskException {
            var context = context();
            var property = property(context, name);
            context.properties().replace(name, property.withConditions(List.of())).save(context.configStore());
            out().println(name + " conditional formatting has been cleared");
            return 0;
        }
    }
}
