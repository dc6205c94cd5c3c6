package io.github.gittask.store;

import io.github.gittask.exception.ConcurrentUpdateException;
import io.github.gittask.exception.StoreException;
import java.util.List;
import java.util.Optional;
import org.eclipse.jgit.lib.ObjectId;
import org.jetbrains.annotations.Nullable;

/**
 * Minimal contract over a content-addressed object store with atomically updatable refs. Implementations never
 * retry: a moved ref is reported to the caller, who owns the retry policy.
 */
public interface ObjectStore {

    /** Reads the tree of the commit {@code ref} points at, or empty when the ref does not exist yet. */
    Optional<Snapshot> readTree(String ref) throws StoreException;

    /**
     * Writes a new commit whose tree is the tree of {@code expectedOld} with {@code mutations} applied and whose
     * parent is {@code expectedOld}, then moves {@code ref} to it only if the ref still points at
     * {@code expectedOld} ({@code null} meaning the ref must not exist).
     *
     * @return the id of the new commit
     * @throws ConcurrentUpdateException if the ref moved in the meantime; the ref is left untouched
     */
    ObjectId writeTransaction(String ref, @Nullable ObjectId expectedOld, List<TreeMutation> mutations, String message)
            throws StoreException, ConcurrentUpdateException;

    /** Points {@code to} at the commit {@code from} points at, optionally deleting {@code from} afterwards. */
    void moveRef(String from, String to, boolean deleteOld) throws StoreException;

    /** Deletes {@code ref} if it exists. */
    void deleteRef(String ref) throws StoreException;
}
