package io.github.gittask.repository;

import io.github.gittask.exception.NotFoundException;
import io.github.gittask.exception.ValidationException;
import io.github.gittask.model.Task;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import org.jetbrains.annotations.Nullable;

/**
 * The in-memory state one transaction attempt mutates. Built fresh from a snapshot on every attempt, so mutations
 * must only touch the store through this object.
 */
public final class WorkingSet {
    private final TreeMap<Long, Task> tasks;
    private final Set<Long> changed = new LinkedHashSet<>();
    private final Set<Long> deleted = new LinkedHashSet<>();
    private final List<Long> created = new ArrayList<>();
    private final long now;
    private long lastId;
    private final long initialLastId;

    WorkingSet(Map<Long, Task> tasks, long lastId, long now) {
        this.tasks = new TreeMap<>(tasks);
        this.lastId = Math.max(lastId, this.tasks.isEmpty() ? 0 : this.tasks.lastKey());
        this.initialLastId = lastId;
        this.now = now;
    }

    /** Transaction time in epoch seconds. */
    public long now() {
        return now;
    }

    public boolean contains(long id) {
        return tasks.containsKey(id);
    }

    /** Read-only access; changes to the returned copy are not recorded. */
    public Optional<Task> find(long id) {
        var task = tasks.get(id);
        return task == null ? Optional.empty() : Optional.of(task.copy());
    }

    /** Copies of all tasks in ID order. */
    public List<Task> tasks() {
        return tasks.values().stream().map(Task::copy).toList();
    }

    /** Returns the live task and marks it for writing. */
    public Task edit(long id) throws NotFoundException {
        var task = tasks.get(id);
        if (task == null) {
            throw NotFoundException.task(id);
        }
        changed.add(id);
        return task;
    }

    public long nextId() {
        return lastId + 1;
    }

    /** Assigns the next ID to {@code draft} and stores it; {@code created} defaults to the transaction time. */
    public long create(Task draft) throws ValidationException {
        var task = draft.copy();
        long id = nextId();
        task.setId(id);
        if (task.getProperty(Task.CREATED) == null) {
            task.setProperty(Task.CREATED, Long.toString(now));
        }
        validate(task);
        lastId = id;
        put(task);
        created.add(id);
        return id;
    }

    /** Stores {@code task} under its own ID, replacing any existing record. */
    public void put(Task task) throws ValidationException {
        validate(task);
        tasks.put(task.id(), task.copy());
        lastId = Math.max(lastId, task.id());
        changed.add(task.id());
        deleted.remove(task.id());
    }

    public void delete(long id) throws NotFoundException {
        if (tasks.remove(id) == null) {
            throw NotFoundException.task(id);
        }
        changed.remove(id);
        deleted.add(id);
    }

    /** Deletes every task; the ID high-water mark is kept. */
    public void clear() {
        for (Long id : List.copyOf(tasks.keySet())) {
            tasks.remove(id);
            changed.remove(id);
            deleted.add(id);
        }
    }

    static void validate(Task task) throws ValidationException {
        if (task.id() <= 0) {
            throw new ValidationException("Task ID must be positive, got " + task.id());
        }
        for (String name : task.properties().keySet()) {
            if (name.isBlank()) {
                throw new ValidationException("Property name must not be blank in task " + task.id());
            }
        }
        validateProperty(Task.CREATED, task.getProperty(Task.CREATED));
    }

    static void validateProperty(String name, @Nullable String value)
            throws ValidationException {
        if (Task.CREATED.equals(name) && value != null) {
            try {
                Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                throw new ValidationException("Property created must be epoch seconds, got '" + value + "'", e);
            }
        }
    }

    Set<Long> changedIds() {
        return Collections.unmodifiableSet(changed);
    }

    Set<Long> deletedIds() {
        return Collections.unmodifiableSet(deleted);
    }

    List<Long> createdIds() {
        return Collections.unmodifiableList(created);
    }

    long lastId() {
        return lastId;
    }

    boolean lastIdChanged() {
        return lastId != initialLastId;
    }

    Task live(long id) {
        return tasks.get(id);
    }
}
