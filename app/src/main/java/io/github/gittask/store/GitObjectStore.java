package io.github.gittask.store;

import io.github.gittask.exception.ConcurrentUpdateException;
import io.github.gittask.exception.StoreException;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.dircache.DirCache;
import org.eclipse.jgit.dircache.DirCacheBuilder;
import org.eclipse.jgit.dircache.DirCacheEditor;
import org.eclipse.jgit.dircache.DirCacheEntry;
import org.eclipse.jgit.lib.CommitBuilder;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.FileMode;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.ObjectInserter;
import org.eclipse.jgit.lib.PersonIdent;
import org.eclipse.jgit.lib.RefUpdate;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.eclipse.jgit.treewalk.TreeWalk;
import org.jetbrains.annotations.Nullable;

/**
 * {@link ObjectStore} backed by a JGit {@link Repository}. Each transaction builds the new tree in an in-core
 * {@link DirCache} seeded from the parent commit, so only the mutated paths are re-hashed.
 */
public class GitObjectStore implements ObjectStore, Closeable {
    private static final Logger logger = LogManager.getLogger(GitObjectStore.class);

    private static final String DEFAULT_IDENT = "git-task";

    private final Repository repository;
    private final boolean ownsRepository;

    public GitObjectStore(Repository repository) {
        this(repository, false);
    }

    private GitObjectStore(Repository repository, boolean ownsRepository) {
        this.repository = repository;
        this.ownsRepository = ownsRepository;
    }

    /** Opens the repository at or above {@code dir}. */
    public static GitObjectStore open(Path dir) throws StoreException {
        var builder = new FileRepositoryBuilder();
        builder.findGitDir(dir.toFile());
        if (builder.getGitDir() == null) {
            throw new StoreException("No git repo found at or above " + dir, new IOException("not a git repository"));
        }
        try {
            var repository = builder.build();
            logger.trace("Opened git dir {} for {}", repository.getDirectory(), dir);
            return new GitObjectStore(repository, true);
        } catch (IOException e) {
            throw new StoreException("Failed to open repository at " + dir, e);
        }
    }

    public Repository getRepository() {
        return repository;
    }

    @Override
    public Optional<Snapshot> readTree(String ref) throws StoreException {
        try {
            var current = repository.exactRef(ref);
            if (current == null || current.getObjectId() == null) {
                return Optional.empty();
            }
            try (var walk = new RevWalk(repository);
                    var treeWalk = new TreeWalk(repository)) {
                RevCommit commit = walk.parseCommit(current.getObjectId());
                treeWalk.addTree(commit.getTree());
                treeWalk.setRecursive(true);
                var entries = new LinkedHashMap<String, byte[]>();
                while (treeWalk.next()) {
                    var loader = repository.open(treeWalk.getObjectId(0), Constants.OBJ_BLOB);
                    entries.put(treeWalk.getPathString(), loader.getBytes());
                }
                logger.trace("Read {} entries from {} at {}", entries.size(), ref, commit.name());
                return Optional.of(new Snapshot(commit.getId().copy(), entries));
            }
        } catch (IOException e) {
            throw new StoreException("Failed to read " + ref, e);
        }
    }

    @Override
    public ObjectId writeTransaction(
            String ref, @Nullable ObjectId expectedOld, List<TreeMutation> mutations, String message)
            throws StoreException, ConcurrentUpdateException {
        ObjectId commitId;
        try (ObjectInserter inserter = repository.newObjectInserter();
                var walk = new RevWalk(repository)) {
            var index = DirCache.newInCore();
            if (expectedOld != null) {
                RevCommit parent = walk.parseCommit(expectedOld);
                DirCacheBuilder builder = index.builder();
                builder.addTree(new byte[0], DirCacheEntry.STAGE_0, walk.getObjectReader(), parent.getTree());
                builder.finish();
            }

            DirCacheEditor editor = index.editor();
            for (TreeMutation mutation : mutations) {
                if (mutation instanceof TreeMutation.Put put) {
                    ObjectId blobId = inserter.insert(Constants.OBJ_BLOB, put.content());
                    editor.add(new DirCacheEditor.PathEdit(put.path()) {
                        @Override
                        public void apply(DirCacheEntry entry) {
                            entry.setFileMode(FileMode.REGULAR_FILE);
                            entry.setObjectId(blobId);
                        }
                    });
                } else {
                    editor.add(new DirCacheEditor.DeletePath(mutation.path()));
                }
            }
            editor.finish();

            var commit = newCommit(index.writeTree(inserter), message);
            if (expectedOld != null) {
                commit.setParentId(expectedOld);
            }
            commitId = inserter.insert(commit);
            inserter.flush();
        } catch (IOException e) {
            throw new StoreException("Failed to write objects for " + ref, e);
        }

        updateRef(ref, expectedOld, commitId, message);
        logger.debug("Moved {} to {} ({} mutation(s))", ref, commitId.name(), mutations.size());
        return commitId;
    }

    /**
     * Replaces the history of {@code ref} with a single parentless commit holding the tree of {@code expectedOld}.
     * Used by {@link HistoryCompactor}.
     */
    ObjectId writeRootCommit(String ref, ObjectId expectedOld, String message)
            throws StoreException, ConcurrentUpdateException {
        ObjectId commitId;
        try (ObjectInserter inserter = repository.newObjectInserter();
                var walk = new RevWalk(repository)) {
            RevCommit current = walk.parseCommit(expectedOld);
            commitId = inserter.insert(newCommit(current.getTree(), message));
            inserter.flush();
        } catch (IOException e) {
            throw new StoreException("Failed to write root commit for " + ref, e);
        }
        updateRef(ref, expectedOld, commitId, message);
        return commitId;
    }

    private CommitBuilder newCommit(ObjectId treeId, String message) {
        var ident = identity();
        var commit = new CommitBuilder();
        commit.setTreeId(treeId);
        commit.setAuthor(ident);
        commit.setCommitter(ident);
        commit.setMessage(message);
        return commit;
    }

    private PersonIdent identity() {
        var config = repository.getConfig();
        String name = config.getString("user", null, "name");
        String email = config.getString("user", null, "email");
        return new PersonIdent(name == null ? DEFAULT_IDENT : name, email == null ? DEFAULT_IDENT : email);
    }

    private void updateRef(String ref, @Nullable ObjectId expectedOld, ObjectId newId, String message)
            throws StoreException, ConcurrentUpdateException {
        try {
            RefUpdate update = repository.updateRef(ref);
            update.setExpectedOldObjectId(expectedOld == null ? ObjectId.zeroId() : expectedOld);
            update.setNewObjectId(newId);
            // the expected-old guard already prevents lost updates; force allows history rewrites
            update.setForceUpdate(true);
            update.setRefLogMessage(message, false);
            RefUpdate.Result result = update.update();
            switch (result) {
                case NEW, FAST_FORWARD, FORCED, NO_CHANGE -> {}
                case LOCK_FAILURE -> throw new ConcurrentUpdateException(
                        ref + " was updated concurrently (expected " + nameOf(expectedOld) + ")");
                default -> throw new StoreException(
                        "Failed to update " + ref, new IOException("ref update returned " + result));
            }
        } catch (IOException e) {
            throw new StoreException("Failed to update " + ref, e);
        }
    }

    private static String nameOf(@Nullable ObjectId id) {
        return id == null ? "no ref" : id.name();
    }

    @Override
    public void moveRef(String from, String to, boolean deleteOld) throws StoreException {
        try {
            var source = repository.exactRef(from);
            if (source == null || source.getObjectId() == null) {
                logger.debug("Nothing to move: {} does not exist", from);
                return;
            }
            RefUpdate update = repository.updateRef(to);
            update.setNewObjectId(source.getObjectId());
            update.setForceUpdate(true);
            update.setRefLogMessage("move tasks from " + from, false);
            var result = update.update();
            if (result != RefUpdate.Result.NEW
                    && result != RefUpdate.Result.FORCED
                    && result != RefUpdate.Result.FAST_FORWARD
                    && result != RefUpdate.Result.NO_CHANGE) {
                throw new StoreException("Failed to create " + to, new IOException("ref update returned " + result));
            }
            logger.info("Copied {} to {}", from, to);
            if (deleteOld && !from.equals(to)) {
                deleteRef(from);
            }
        } catch (IOException e) {
            throw new StoreException("Failed to move " + from + " to " + to, e);
        }
    }

    @Override
    public void deleteRef(String ref) throws StoreException {
        try {
            if (repository.exactRef(ref) == null) {
                return;
            }
            RefUpdate delete = repository.updateRef(ref);
            delete.setForceUpdate(true);
            var result = delete.delete();
            if (result != RefUpdate.Result.FORCED && result != RefUpdate.Result.NO_CHANGE) {
                throw new StoreException("Failed to delete " + ref, new IOException("ref delete returned " + result));
            }
            logger.info("Deleted {}", ref);
        } catch (IOException e) {
            throw new StoreException("Failed to delete " + ref, e);
        }
    }

    @Override
    public void close() {
        if (ownsRepository) {
            repository.close();
        }
    }
}
