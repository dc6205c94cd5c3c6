package io.github.gittask.selector;

import io.github.gittask.config.PropertyTable;
import io.github.gittask.exception.ValidationException;
import io.github.gittask.model.PropertyDefinition.ValueType;
import io.github.gittask.model.Task;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import org.jetbrains.annotations.Nullable;

/**
 * Orders tasks by a {@code task.list.sort} expression: comma-separated property names, each optionally followed by
 * {@code asc} or {@code desc}. {@code id} and integer or datetime properties compare numerically, everything else
 * case-insensitively.
 */
public final class TaskSorter {
    private final Comparator<Task> comparator;

    public TaskSorter(String expression, PropertyTable properties) throws ValidationException {
        this(List.of(expression.split(",")), properties);
    }

    public TaskSorter(List<String> keys, PropertyTable properties) throws ValidationException {
        Comparator<Task> result = null;
        for (String raw : keys) {
            String key = raw.trim();
            if (key.isEmpty()) {
                continue;
            }
            boolean descending = false;
            String lower = key.toLowerCase(Locale.ROOT);
            if (lower.endsWith(" desc")) {
                descending = true;
                key = key.substring(0, key.length() - " desc".length()).trim();
            } else if (lower.endsWith(" asc")) {
                key = key.substring(0, key.length() - " asc".length()).trim();
            }
            if (key.isEmpty() || key.contains(" ")) {
                throw new ValidationException("Invalid sort key: " + raw.trim());
            }
            var single = keyComparator(key, properties);
            if (descending) {
                single = single.reversed();
            }
            result = result == null ? single : result.thenComparing(single);
        }
        this.comparator = result == null ? Comparator.comparingLong(Task::id).reversed() : result;
    }

    private static Comparator<Task> keyComparator(String key, PropertyTable properties) {
        if ("id".equals(key)) {
            return Comparator.comparingLong(Task::id);
        }
        var type = properties.valueType(key);
        if (type == ValueType.INTEGER || type == ValueType.DATETIME) {
            return Comparator.comparingLong(task -> parseLong(task.getProperty(key)));
        }
        return Comparator.comparing(task -> task.getPropertyOrEmpty(key).toLowerCase(Locale.ROOT));
    }

    private static long parseLong(@Nullable String value) {
        if (value == null) {
            return 0;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    public Comparator<Task> comparator() {
        return comparator;
    }

    public List<Task> sort(List<Task> tasks) {
        var sorted = new ArrayList<>(tasks);
        sorted.sort(comparator);
        return sorted;
    }
}
