package io.github.gittask.sync;

import io.github.gittask.exception.ErrorKind;
import io.github.gittask.exception.GitTaskException;
import java.util.Comparator;
import org.jetbrains.annotations.Nullable;

/**
 * Result of syncing one task or comment.
 *
 * @param taskId local task id, 0 when the remote issue never became a task
 * @param commentId local comment id when the item is a comment
 * @param remoteId remote issue or comment id, when known
 */
public record ItemResult(
        long taskId,
        @Nullable Long commentId,
        @Nullable String remoteId,
        Outcome outcome,
        @Nullable ErrorKind errorKind,
        String message) {

    public enum Outcome {
        CREATED,
        UPDATED,
        UNCHANGED,
        DELETED,
        SKIPPED,
        FAILED,
        /** The remote change succeeded but recording the link locally did not. */
        LINK_NOT_PERSISTED
    }

    static final Comparator<ItemResult> ORDER = Comparator.comparingLong(ItemResult::taskId)
            .thenComparing(ItemResult::commentId, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(ItemResult::remoteId, Comparator.nullsFirst(Comparator.naturalOrder()));

    public static ItemResult of(long taskId, @Nullable String remoteId, Outcome outcome, String message) {
        return new ItemResult(taskId, null, remoteId, outcome, null, message);
    }

    public static ItemResult comment(long taskId, long commentId, @Nullable String remoteId, Outcome outcome,
            String message) {
        return new ItemResult(taskId, commentId, remoteId, outcome, null, message);
    }

    public static ItemResult failed(long taskId, @Nullable Long commentId, @Nullable String remoteId,
            GitTaskException e) {
        return new ItemResult(taskId, commentId, remoteId, Outcome.FAILED, e.kind(), String.valueOf(e.getMessage()));
    }

    public static ItemResult skipped(long taskId, @Nullable String remoteId, ErrorKind kind, String message) {
        return new ItemResult(taskId, null, remoteId, Outcome.SKIPPED, kind, message);
    }

    public boolean isFailure() {
        return outcome == Outcome.FAILED || outcome == Outcome.LINK_NOT_PERSISTED;
    }
}
