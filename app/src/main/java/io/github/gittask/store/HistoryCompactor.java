package io.github.gittask.store;

import io.github.gittask.exception.ConcurrentUpdateException;
import io.github.gittask.exception.StoreException;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.lib.ObjectId;

/**
 * Maintenance utility that squashes the history of the task ref into one commit. Not part of the transactional
 * path: the old commits become unreachable and are left to {@code git gc}.
 */
public class HistoryCompactor {
    private static final Logger logger = LogManager.getLogger(HistoryCompactor.class);

    private final GitObjectStore store;

    public HistoryCompactor(GitObjectStore store) {
        this.store = store;
    }

    /** @return the new root commit, or empty when the ref does not exist */
    public Optional<ObjectId> compact(String ref) throws StoreException, ConcurrentUpdateException {
        var snapshot = store.readTree(ref);
        if (snapshot.isEmpty()) {
            return Optional.empty();
        }
        var commitId = store.writeRootCommit(ref, snapshot.get().commitId(), "compact task history");
        logger.info("Compacted history of {} into {}", ref, commitId.name());
        return Optional.of(commitId);
    }
}
