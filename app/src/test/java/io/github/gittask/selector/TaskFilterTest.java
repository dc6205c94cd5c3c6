package io.github.gittask.selector;

import static org.junit.jupiter.api.Assertions.*;

import io.github.gittask.exception.ValidationException;
import io.github.gittask.model.Task;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

public class TaskFilterTest {
    private static final ZoneId UTC = ZoneOffset.UTC;

    private static Task task(long id, String status, long created, String author, String name) {
        var task = Task.draft(name, "", status);
        task.setId(id);
        task.setProperty(Task.CREATED, Long.toString(created));
        task.setProperty(Task.AUTHOR, author);
        return task;
    }

    private static final List<Task> TASKS = List.of(
            task(1, "OPEN", 1_714_521_600L, "ann", "Write docs"),
            task(2, "CLOSED", 1_714_608_000L, "bob", "Fix crash"),
            task(3, "OPEN", 1_714_694_400L, "Ann", "Fix typo"));

    private static List<Long> ids(List<Task> tasks) {
        return tasks.stream().map(Task::id).toList();
    }

    @Test
    void testAllMatchesEverything() {
        assertEquals(List.of(1L, 2L, 3L), ids(TaskFilter.all().apply(TASKS)));
    }

    @Test
    void testStatusAndKeyword() {
        assertEquals(List.of(1L, 3L), ids(TaskFilter.all().withStatuses(Set.of("OPEN")).apply(TASKS)));
        assertEquals(List.of(2L, 3L), ids(TaskFilter.all().withKeyword("Fix").apply(TASKS)));
        assertEquals(List.of(), ids(TaskFilter.all().withKeyword("fix").apply(TASKS)), "Keyword is case-sensitive");
    }

    @Test
    void testAuthorIgnoresCase() {
        assertEquals(List.of(1L, 3L), ids(TaskFilter.all().withAuthor("ANN").apply(TASKS)));
    }

    @Test
    void testTasksWithoutAuthorAreKept() {
        var anonymous = Task.draft("orphan", "", "OPEN");
        anonymous.setId(9);
        assertEquals(List.of(9L), ids(TaskFilter.all().withAuthor("bob").apply(List.of(anonymous))));
    }

    @Test
    void testCreatedRangeIsInclusive() {
        var filter = TaskFilter.all().withCreatedBetween(1_714_608_000L, 1_714_694_400L);
        assertEquals(List.of(2L, 3L), ids(filter.apply(TASKS)));
    }

    @Test
    void testLimitCountsMatchesOnly() {
        var filter = TaskFilter.all().withStatuses(Set.of("OPEN")).withLimit(1);
        assertEquals(List.of(1L), ids(filter.apply(TASKS)));
    }

    @Test
    void testIds() {
        assertEquals(List.of(3L), ids(TaskFilter.all().withIds(List.of(3L, 99L)).apply(TASKS)));
    }

    @Test
    void testParseDates() throws Exception {
        assertEquals(1_714_521_600L, TaskFilter.parseFrom("2024-05-01", UTC));
        assertEquals(1_714_607_999L, TaskFilter.parseUntil("2024-05-01", UTC));
        assertEquals(1_714_557_600L, TaskFilter.parseFrom("2024-05-01T10:00", UTC));
        assertEquals(123L, TaskFilter.parseUntil("123", UTC));
        assertThrows(ValidationException.class, () -> TaskFilter.parseFrom("next week", UTC));
    }

    @Test
    void testTodayAndYesterday() throws Exception {
        long today = TaskFilter.parseFrom("today", UTC);
        long yesterday = TaskFilter.parseFrom("yesterday", UTC);
        assertEquals(86_400L, today - yesterday);
        assertEquals(today + 86_399L, TaskFilter.parseUntil("Today", UTC));
    }
}
