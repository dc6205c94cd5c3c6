package io.github.gittask.selector;

import io.github.gittask.exception.ValidationException;
import io.github.gittask.model.Task;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * Criteria applied to a full scan of the repository. Unset criteria match everything.
 *
 * @param from inclusive lower bound on {@code created}, epoch seconds
 * @param until inclusive upper bound on {@code created}, epoch seconds
 * @param limit maximum number of matches, counted after sorting by the caller
 */
public record TaskFilter(
        @Nullable Set<Long> ids,
        @Nullable Set<String> statuses,
        @Nullable Long from,
        @Nullable Long until,
        @Nullable String author,
        @Nullable String keyword,
        @Nullable Integer limit) {

    public static TaskFilter all() {
        return new TaskFilter(null, null, null, null, null, null, null);
    }

    public TaskFilter withIds(@Nullable Collection<Long> newIds) {
        return new TaskFilter(newIds == null ? null : Set.copyOf(newIds), statuses, from, until, author, keyword, limit);
    }

    public TaskFilter withStatuses(@Nullable Set<String> newStatuses) {
        return new TaskFilter(ids, newStatuses, from, until, author, keyword, limit);
    }

    public TaskFilter withCreatedBetween(@Nullable Long newFrom, @Nullable Long newUntil) {
        return new TaskFilter(ids, statuses, newFrom, newUntil, author, keyword, limit);
    }

    public TaskFilter withAuthor(@Nullable String newAuthor) {
        return new TaskFilter(ids, statuses, from, until, newAuthor, keyword, limit);
    }

    public TaskFilter withKeyword(@Nullable String newKeyword) {
        return new TaskFilter(ids, statuses, from, until, author, newKeyword, limit);
    }

    public TaskFilter withLimit(@Nullable Integer newLimit) {
        return new TaskFilter(ids, statuses, from, until, author, keyword, newLimit);
    }

    public boolean matches(Task task) {
        if (ids != null && !ids.contains(task.id())) {
            return false;
        }
        if (statuses != null && !statuses.contains(task.status())) {
            return false;
        }
        if (keyword != null && task.properties().values().stream().noneMatch(v -> v.contains(keyword))) {
            return false;
        }
        var created = task.getProperty(Task.CREATED);
        if (created != null && (from != null || until != null)) {
            long seconds;
            try {
                seconds = Long.parseLong(created.trim());
            } catch (NumberFormatException e) {
                return false;
            }
            if ((from != null && seconds < from) || (until != null && seconds > until)) {
                return false;
            }
        }
        // tasks without an author are not excluded by an author filter
        var taskAuthor = task.getProperty(Task.AUTHOR);
        return author == null || taskAuthor == null || author.equalsIgnoreCase(taskAuthor);
    }

    /** Keeps matching tasks in their given order, up to {@link #limit()}. */
    public List<Task> apply(List<Task> tasks) {
        var result = new ArrayList<Task>();
        for (Task task : tasks) {
            if (limit != null && result.size() >= limit) {
                break;
            }
            if (matches(task)) {
                result.add(task);
            }
        }
        return result;
    }

    /** Start of the given day or instant: {@code 2024-05-01}, {@code 2024-05-01T10:00} or epoch seconds. */
    public static long parseFrom(String text, ZoneId zone) throws ValidationException {
        return parseDate(text, zone, false);
    }

    /** End of the given day, or the given instant. */
    public static long parseUntil(String text, ZoneId zone) throws ValidationException {
        return parseDate(text, zone, true);
    }

    private static long parseDate(String text, ZoneId zone, boolean endOfDay) throws ValidationException {
        String value = text.trim().toLowerCase(Locale.ROOT);
        if (!value.isEmpty() && value.chars().allMatch(Character::isDigit)) {
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException e) {
                throw new ValidationException("Timestamp out of range: " + text, e);
            }
        }
        LocalDate day;
        switch (value) {
            case "today" -> day = LocalDate.now(zone);
            case "yesterday" -> day = LocalDate.now(zone).minusDays(1);
            default -> {
                try {
                    if (value.contains("t")) {
                        return LocalDateTime.parse(text.trim()).atZone(zone).toEpochSecond();
                    }
                    day = LocalDate.parse(value);
                } catch (DateTimeParseException e) {
                    throw new ValidationException("Unrecognized date: " + text, e);
                }
            }
        }
        return endOfDay
                ? day.plusDays(1).atStartOfDay(zone).toEpochSecond() - 1
                : day.atStartOfDay(zone).toEpochSecond();
    }
}
