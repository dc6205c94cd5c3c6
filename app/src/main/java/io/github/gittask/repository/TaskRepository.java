package io.github.gittask.repository;

import io.github.gittask.config.TaskConfig;
import io.github.gittask.exception.ConcurrentUpdateException;
import io.github.gittask.exception.EncodingException;
import io.github.gittask.exception.GitTaskException;
import io.github.gittask.exception.NotFoundException;
import io.github.gittask.exception.StoreException;
import io.github.gittask.model.Task;
import io.github.gittask.store.ObjectStore;
import io.github.gittask.store.Snapshot;
import io.github.gittask.store.TreeMutation;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.lib.ObjectId;
import org.jetbrains.annotations.Nullable;

/**
 * Document store for tasks on top of an {@link ObjectStore}. The tree under the task ref holds one JSON blob per
 * task, named by its ID, plus a {@value #META_PATH} blob with the highest ID ever allocated.
 *
 * <p>{@link #applyTransaction} is the only write path. It replays the logical mutations against the newest
 * snapshot whenever the ref moved underneath it, for at most {@value #MAX_ATTEMPTS} attempts.
 */
public class TaskRepository {
    private static final Logger logger = LogManager.getLogger(TaskRepository.class);

    public static final int MAX_ATTEMPTS = 5;
    static final String META_PATH = ".meta";

    private final ObjectStore store;
    private final String ref;
    private final TaskCodec codec;
    private final Clock clock;

    public TaskRepository(ObjectStore store, TaskConfig config) {
        this(store, config, new TaskCodec(), Clock.systemUTC());
    }

    public TaskRepository(ObjectStore store, TaskConfig config, TaskCodec codec, Clock clock) {
        this.store = store;
        this.ref = config.ref();
        this.codec = codec;
        this.clock = clock;
    }

    public String ref() {
        return ref;
    }

    public TaskCodec codec() {
        return codec;
    }

    private record State(@Nullable ObjectId commitId, Map<Long, Task> tasks, Map<Long, byte[]> blobs, long lastId) {}

    private State readState() throws StoreException, EncodingException {
        Optional<Snapshot> snapshot = store.readTree(ref);
        if (snapshot.isEmpty()) {
            return new State(null, Map.of(), Map.of(), 0);
        }
        var tasks = new LinkedHashMap<Long, Task>();
        var blobs = new LinkedHashMap<Long, byte[]>();
        long lastId = 0;
        for (var entry : snapshot.get().entries().entrySet()) {
            String path = entry.getKey();
            if (META_PATH.equals(path)) {
                lastId = codec.decodeMeta(entry.getValue());
                continue;
            }
            long id;
            try {
                id = Long.parseLong(path);
            } catch (NumberFormatException e) {
                logger.debug("Skipping foreign entry {} under {}", path, ref);
                continue;
            }
            tasks.put(id, decodeAt(path, id, entry.getValue()));
            blobs.put(id, entry.getValue());
        }
        return new State(snapshot.get().commitId(), tasks, blobs, lastId);
    }

    /** All tasks in ascending ID order. */
    public List<Task> loadAll() throws StoreException, EncodingException {
        var state = readState();
        return state.tasks().values().stream()
                .sorted((a, b) -> Long.compare(a.id(), b.id()))
                .toList();
    }

    public Optional<Task> find(long id) throws StoreException, EncodingException {
        var snapshot = store.readTree(ref);
        if (snapshot.isEmpty()) {
            return Optional.empty();
        }
        String path = Long.toString(id);
        var blob = snapshot.get().entries().get(path);
        return blob == null ? Optional.empty() : Optional.of(decodeAt(path, id, blob));
    }

    private Task decodeAt(String path, long id, byte[] blob) throws EncodingException {
        var task = codec.decode(blob);
        if (task.id() != id) {
            throw new EncodingException("Blob " + path + " holds task ID " + task.id());
        }
        return task;
    }

    public Task get(long id) throws NotFoundException, StoreException, EncodingException {
        return find(id).orElseThrow(() -> NotFoundException.task(id));
    }

    /** The ID the next created task receives; IDs of deleted tasks are never handed out again. */
    public long nextId() throws StoreException, EncodingException {
        var state = readState();
        return new WorkingSet(state.tasks(), state.lastId(), 0).nextId();
    }

    public TransactionResult applyTransaction(List<TaskMutation> mutations) throws GitTaskException {
        return applyTransaction(mutations, "update tasks");
    }

    public TransactionResult applyTransaction(TaskMutation mutation, String message) throws GitTaskException {
        return applyTransaction(List.of(mutation), message);
    }

    /**
     * Applies all {@code mutations} as one commit. Validation and lookup failures abort before anything is
     * written.
     *
     * @throws ConcurrentUpdateException if the ref kept moving for {@value #MAX_ATTEMPTS} attempts
     */
    public TransactionResult applyTransaction(List<TaskMutation> mutations, String message) throws GitTaskException {
        for (int attempt = 1; ; attempt++) {
            var state = readState();
            var workingSet = new WorkingSet(state.tasks(), state.lastId(), clock.instant().getEpochSecond());
            for (TaskMutation mutation : mutations) {
                mutation.apply(workingSet);
            }

            var treeMutations = toTreeMutations(state, workingSet);
            if (treeMutations.isEmpty()) {
                logger.debug("Transaction '{}' changed nothing", message);
                return new TransactionResult(state.commitId(), workingSet.createdIds(), attempt, false);
            }

            try {
                var commitId = store.writeTransaction(ref, state.commitId(), treeMutations, message);
                logger.debug("Committed '{}' as {} after {} attempt(s)", message, commitId.name(), attempt);
                return new TransactionResult(commitId, workingSet.createdIds(), attempt, true);
            } catch (ConcurrentUpdateException e) {
                if (attempt >= MAX_ATTEMPTS) {
                    logger.error("Giving up on '{}' after {} attempts", message, attempt);
                    throw new ConcurrentUpdateException(
                            "Task ref " + ref + " kept changing; gave up after " + attempt + " attempts");
                }
                logger.warn("Task ref {} moved during '{}', retrying (attempt {})", ref, message, attempt + 1);
            }
        }
    }

    private List<TreeMutation> toTreeMutations(State state, WorkingSet workingSet) throws EncodingException {
        var result = new ArrayList<TreeMutation>();
        for (long id : workingSet.changedIds()) {
            byte[] content = codec.encode(workingSet.live(id));
            // edited but equal records produce no tree change
            if (!Arrays.equals(content, state.blobs().get(id))) {
                result.add(TreeMutation.put(Long.toString(id), content));
            }
        }
        for (long id : workingSet.deletedIds()) {
            if (state.blobs().containsKey(id)) {
                result.add(TreeMutation.delete(Long.toString(id)));
            }
        }
        if (workingSet.lastIdChanged()) {
            result.add(TreeMutation.put(META_PATH, codec.encodeMeta(workingSet.lastId())));
        }
        return result;
    }
}
