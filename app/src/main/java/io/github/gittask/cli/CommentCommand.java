package io.github.gittask.cli;

import io.github.gittask.exception.GitTaskException;
import io.github.gittask.exception.NotFoundException;
import io.github.gittask.exception.ValidationException;
import io.github.gittask.repository.TaskMutation;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

@CommandLine.Command(
        name = "comment",
        description = "Add, edit or delete task comments.",
        subcommands = {CommentCommand.Add.class, CommentCommand.Edit.class, CommentCommand.Delete.class})
final class CommentCommand extends TaskCommand {
    @Override
    protected int run() {
        spec.commandLine().usage(out());
        return 0;
    }

    @CommandLine.Command(name = "add", description = "Add a comment; opens the editor if no text is given.")
    static final class Add extends TaskCommand {
        @CommandLine.Parameters(index = "0", description = "Task ID.")
        long taskId;

        @CommandLine.Parameters(index = "1", arity = "0..1", description = "Comment text.")
        @Nullable
        String text;

        @CommandLine.Mixin
        RemoteOptions remote = new RemoteOptions();

        @Override
        protected int run() throws GitTaskException {
            var context = context();
            var repository = context.repository();
            repository.get(taskId);
            String body = text == null ? context.editText("") : text;
            if (body.isBlank()) {
                throw new ValidationException("No text specified");
            }
            repository.applyTransaction(
                    TaskMutation.addComment(taskId, context.author(), body), "Comment on task " + taskId);
            var comments = repository.get(taskId).comments();
            long commentId = comments.get(comments.size() - 1).id();
            out().println("Task ID " + taskId + " updated");
            if (!remote.push) {
                return 0;
            }
            var tracker = context.tracker(remote.connector, remote.remote);
            return report(context.synchronizer().pushComment(tracker, taskId, commentId), tracker.kind());
        }
    }

    @CommandLine.Command(name = "edit", description = "Edit a comment in the editor.")
    static final class Edit extends TaskCommand {
        @CommandLine.Parameters(index = "0", description = "Task ID.")
        long taskId;

        @CommandLine.Parameters(index = "1", description = "Comment ID.")
        long commentId;

        @CommandLine.Mixin
        RemoteOptions remote = new RemoteOptions();

        @Override
        protected int run() throws GitTaskException {
            var context = context();
            var repository = context.repository();
            var comment = repository.get(taskId).findComment(commentId)
                    .orElseThrow(() -> NotFoundException.comment(taskId, commentId));
            String body = context.editText(comment.text());
            if (body.isBlank()) {
                throw new ValidationException("No text specified");
            }
            repository.applyTransaction(
                    TaskMutation.updateComment(taskId, commentId, body), "Edit comment " + commentId + " of task " + taskId);
            out().println("Task ID " + taskId + " updated");
            if (!remote.push) {
                return 0;
            }
            var tracker = context.tracker(remote.connector, remote.remote);
            return report(context.synchronizer().pushCommentUpdate(tracker, taskId, commentId), tracker.kind());
        }
    }

    @CommandLine.Command(name = "delete", description = "Delete a comment.")
    static final class Delete extends TaskCommand {
        @CommandLine.Parameters(index = "0", description = "Task ID.")
        long taskId;

        @CommandLine.Parameters(index = "1", description = "Comment ID.")
        long commentId;

        @CommandLine.Mixin
        RemoteOptions remote = new RemoteOptions();

        @Override
        protected int run() throws GitTaskException {
            var context = context();
            var repository = context.repository();
            var before = repository.get(taskId);
            repository.applyTransaction(
                    TaskMutation.deleteComment(taskId, commentId), "Delete comment " + commentId + " of task " + taskId);
            out().println("Task ID " + taskId + " updated");
            if (!remote.push) {
                return 0;
            }
            var tracker = context.tracker(remote.connector, remote.remote);
            return report(context.synchronizer().pushCommentDelete(tracker, before, commentId), tracker.kind());
        }
    }
}
