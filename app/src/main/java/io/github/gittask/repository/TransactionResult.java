package io.github.gittask.repository;

import java.util.List;
import org.eclipse.jgit.lib.ObjectId;
import org.jetbrains.annotations.Nullable;

/**
 * Outcome of a committed transaction.
 *
 * @param commitId the commit the task ref points at afterwards, null if the ref still does not exist
 * @param createdIds IDs allocated by {@code create} mutations, in allocation order
 * @param attempts how many snapshots the mutations were applied to
 * @param committed false when the mutations left the tree unchanged and no commit was written
 */
public record TransactionResult(@Nullable ObjectId commitId, List<Long> createdIds, int attempts, boolean committed) {
    public TransactionResult {
        createdIds = List.copyOf(createdIds);
    }
}
