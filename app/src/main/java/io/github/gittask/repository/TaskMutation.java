package io.github.gittask.repository;

import io.github.gittask.exception.GitTaskException;
import io.github.gittask.exception.NotFoundException;
import io.github.gittask.exception.ValidationException;
import io.github.gittask.model.Comment;
import io.github.gittask.model.Label;
import io.github.gittask.model.Task;
import io.github.gittask.remote.TrackerKind;

/**
 * One logical change, replayed against a fresh {@link WorkingSet} on every transaction attempt. Implementations
 * must be deterministic and free of side effects outside the working set.
 */
@FunctionalInterface
public interface TaskMutation {
    void apply(WorkingSet workingSet) throws GitTaskException;

    /** Changes to a single task that may fail, used by {@link #update(long, TaskEditor)}. */
    @FunctionalInterface
    interface TaskEditor {
        void edit(Task task) throws GitTaskException;
    }

    static TaskMutation create(Task draft) {
        return ws -> ws.create(draft);
    }

    /** Stores a full record under its own ID; drafts without an ID get a new one. */
    static TaskMutation importTask(Task task) {
        return ws -> {
            if (task.id() <= 0) {
                ws.create(task);
            } else {
                ws.put(task);
            }
        };
    }

    static TaskMutation setProperty(long id, String name, String value) {
        return ws -> {
            if (name.isBlank()) {
                throw new ValidationException("Property name must not be blank");
            }
            WorkingSet.validateProperty(name, value);
            ws.edit(id).setProperty(name, value);
        };
    }

    static TaskMutation unsetProperty(long id, String name) {
        return ws -> {
            if (!ws.edit(id).removeProperty(name)) {
                throw new NotFoundException("Property " + name + " not found in task ID " + id);
            }
        };
    }

    static TaskMutation update(long id, TaskEditor editor) {
        return ws -> {
            var task = ws.edit(id);
            editor.edit(task);
            WorkingSet.validate(task);
        };
    }

    static TaskMutation delete(long id) {
        return ws -> ws.delete(id);
    }

    static TaskMutation clear() {
        return WorkingSet::clear;
    }

    static TaskMutation addComment(long taskId, String author, String text) {
        return ws -> {
            var task = ws.edit(taskId);
            task.addComment(new Comment(task.nextCommentId(), author, ws.now(), text));
        };
    }

    /** Adds {@code comment}, renumbering it when its ID is unset or already taken. */
    static TaskMutation addComment(long taskId, Comment comment) {
        return ws -> {
            var task = ws.edit(taskId);
            var toAdd = comment.id() <= 0 || task.findComment(comment.id()).isPresent()
                    ? comment.withId(task.nextCommentId())
                    : comment;
            task.addComment(toAdd);
        };
    }

    static TaskMutation updateComment(long taskId, long commentId, String text) {
        return ws -> {
            var task = ws.edit(taskId);
            var comment = task.findComment(commentId)
                    .orElseThrow(() -> NotFoundException.comment(taskId, commentId));
            task.replaceComment(comment.withText(text));
        };
    }

    static TaskMutation deleteComment(long taskId, long commentId) {
        return ws -> {
            if (!ws.edit(taskId).removeComment(commentId)) {
                throw NotFoundException.comment(taskId, commentId);
            }
        };
    }

    static TaskMutation addLabel(long taskId, Label label) {
        return ws -> {
            if (label.name().isBlank()) {
                throw new ValidationException("Label name must not be blank");
            }
            ws.edit(taskId).putLabel(label);
        };
    }

    static TaskMutation removeLabel(long taskId, String name) {
        return ws -> {
            if (!ws.edit(taskId).removeLabel(name)) {
                throw new NotFoundException("Label " + name + " not found in task ID " + taskId);
            }
        };
    }

    static TaskMutation link(long taskId, TrackerKind kind, String remoteId) {
        return ws -> ws.edit(taskId).setLink(kind, remoteId);
    }

    static TaskMutation linkComment(long taskId, long commentId, TrackerKind kind, String remoteId) {
        return ws -> {
            var task = ws.edit(taskId);
            var comment = task.findComment(commentId)
                    .orElseThrow(() -> NotFoundException.comment(taskId, commentId));
            task.replaceComment(comment.withLink(kind, remoteId));
        };
    }

    static TaskMutation linkLabel(long taskId, String labelName, TrackerKind kind, String remoteId) {
        return ws -> {
            var task = ws.edit(taskId);
            var label = task.findLabel(labelName)
                    .orElseThrow(() -> new NotFoundException("Label " + labelName + " not found in task ID " + taskId));
            task.putLabel(label.withLink(kind, remoteId));
        };
    }
}
