package io.github.gittask.store;

import static org.junit.jupiter.api.Assertions.*;

import io.github.gittask.model.Task;
import io.github.gittask.repository.TaskMutation;
import io.github.gittask.testutil.TempGitRepo;
import java.nio.file.Path;
import java.util.List;
import org.eclipse.jgit.revwalk.RevWalk;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class HistoryCompactorTest {

    @TempDir
    Path tempDir;

    @Test
    void testCompactKeepsTreeAndDropsHistory() throws Exception {
        try (var repo = TempGitRepo.init(tempDir)) {
            var tasks = repo.repository();
            tasks.applyTransaction(TaskMutation.create(Task.draft("one", "", "OPEN")), "create");
            tasks.applyTransaction(TaskMutation.create(Task.draft("two", "", "OPEN")), "create");
            tasks.applyTransaction(TaskMutation.delete(1), "delete");
            var before = tasks.loadAll();

            var compacted = new HistoryCompactor(repo.store()).compact(tasks.ref()).orElseThrow();

            try (var walk = new RevWalk(repo.store().getRepository())) {
                assertEquals(0, walk.parseCommit(compacted).getParentCount(), "Compacted commit is a root");
            }
            assertEquals(before, tasks.loadAll());
            assertEquals(3, tasks.nextId(), "Deleted IDs stay retired after compaction");
        }
    }

    @Test
    void testCompactMissingRef() throws Exception {
        try (var repo = TempGitRepo.init(tempDir)) {
            assertTrue(new HistoryCompactor(repo.store()).compact("refs/tasks/none").isEmpty());
            assertEquals(List.of(), repo.repository().loadAll());
        }
    }
}
