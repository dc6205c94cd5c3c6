package io.github.gittask.selector;

import static org.junit.jupiter.api.Assertions.*;

import io.github.gittask.config.PropertyTable;
import io.github.gittask.exception.ValidationException;
import io.github.gittask.model.Task;
import java.util.List;
import org.junit.jupiter.api.Test;

public class TaskSorterTest {

    private static Task task(long id, String status, String name, String created) {
        var task = Task.draft(name, "", status);
        task.setId(id);
        task.setProperty(Task.CREATED, created);
        return task;
    }

    private static final List<Task> TASKS = List.of(
            task(1, "OPEN", "banana", "900"),
            task(2, "CLOSED", "Apple", "1000"),
            task(3, "OPEN", "cherry", "80"));

    private static List<Long> sorted(String expression) throws ValidationException {
        return new TaskSorter(expression, PropertyTable.defaults()).sort(TASKS).stream().map(Task::id).toList();
    }

    @Test
    void testDefaultIsNewestFirst() throws Exception {
        assertEquals(List.of(3L, 2L, 1L), sorted(""));
        assertEquals(List.of(3L, 2L, 1L), sorted("id desc"));
    }

    @Test
    void testTextIgnoresCase() throws Exception {
        assertEquals(List.of(2L, 1L, 3L), sorted("name"));
        assertEquals(List.of(3L, 1L, 2L), sorted("name DESC"));
    }

    @Test
    void testIntegerPropertiesCompareNumerically() throws Exception {
        assertEquals(List.of(3L, 1L, 2L), sorted("created asc"), "80 < 900 < 1000");
    }

    @Test
    void testCompositeKeys() throws Exception {
        assertEquals(List.of(2L, 3L, 1L), sorted("status, id desc"));
    }

    @Test
    void testInvalidKey() {
        assertThrows(ValidationException.class, () -> sorted("name sideways"));
    }
}
