package io.github.gittask.store;

import static org.junit.jupiter.api.Assertions.*;

import io.github.gittask.exception.ConcurrentUpdateException;
import io.github.gittask.testutil.TempGitRepo;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.revwalk.RevWalk;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class GitObjectStoreTest {
    private static final String REF = "refs/tasks/tasks";

    @TempDir
    Path tempDir;

    private TempGitRepo repo;
    private GitObjectStore store;

    @BeforeEach
    void setUp() throws Exception {
        repo = TempGitRepo.init(tempDir);
        store = repo.store();
    }

    @AfterEach
    void tearDown() {
        repo.close();
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void testReadMissingRefIsEmpty() throws Exception {
        assertTrue(store.readTree(REF).isEmpty(), "A ref that was never written has no snapshot");
    }

    @Test
    void testWriteAndReadBack() throws Exception {
        var first = store.writeTransaction(REF, null, List.of(TreeMutation.put("1", bytes("one"))), "create 1");
        var snapshot = store.readTree(REF).orElseThrow();
        assertEquals(first, snapshot.commitId());
        assertArrayEquals(bytes("one"), snapshot.entries().get("1"));

        var second = store.writeTransaction(REF, first,
                List.of(TreeMutation.put("2", bytes("two")), TreeMutation.delete("1")), "replace");
        snapshot = store.readTree(REF).orElseThrow();
        assertEquals(second, snapshot.commitId());
        assertEquals(List.of("2"), List.copyOf(snapshot.entries().keySet()));
    }

    @Test
    void testCommitsChainToTheirParent() throws Exception {
        var first = store.writeTransaction(REF, null, List.of(TreeMutation.put("1", bytes("a"))), "first");
        var second = store.writeTransaction(REF, first, List.of(TreeMutation.put("1", bytes("b"))), "second");

        try (var walk = new RevWalk(store.getRepository())) {
            var commit = walk.parseCommit(second);
            assertEquals(1, commit.getParentCount());
            assertEquals(first, commit.getParent(0).getId());
            assertEquals("second", commit.getFullMessage());
            assertEquals("Test User", commit.getAuthorIdent().getName());
        }
    }

    @Test
    void testStaleExpectedOldIsRejected() throws Exception {
        var first = store.writeTransaction(REF, null, List.of(TreeMutation.put("1", bytes("a"))), "first");
        store.writeTransaction(REF, first, List.of(TreeMutation.put("2", bytes("b"))), "second");

        assertThrows(ConcurrentUpdateException.class,
                () -> store.writeTransaction(REF, first, List.of(TreeMutation.put("3", bytes("c"))), "stale"));
        assertFalse(store.readTree(REF).orElseThrow().entries().containsKey("3"),
                "The losing writer must leave the ref untouched");
    }

    @Test
    void testCreatingAnExistingRefIsRejected() throws Exception {
        store.writeTransaction(REF, null, List.of(TreeMutation.put("1", bytes("a"))), "first");
        assertThrows(ConcurrentUpdateException.class,
                () -> store.writeTransaction(REF, null, List.of(TreeMutation.put("1", bytes("b"))), "again"));
    }

    @Test
    void testTaskRefDoesNotTouchWorkingBranch() throws Exception {
        store.writeTransaction(REF, null, List.of(TreeMutation.put("1", bytes("a"))), "first");
        assertNull(store.getRepository().exactRef("refs/heads/main"), "No commit lands on the checked-out branch");
    }

    @Test
    void testMoveRef() throws Exception {
        ObjectId id = store.writeTransaction(REF, null, List.of(TreeMutation.put("1", bytes("a"))), "first");

        store.moveRef(REF, "refs/tasks/archive", false);
        assertEquals(id, store.readTree("refs/tasks/archive").orElseThrow().commitId());
        assertTrue(store.readTree(REF).isPresent(), "Source is kept without deleteOld");

        store.moveRef("refs/tasks/archive", "refs/tasks/other", true);
        assertTrue(store.readTree("refs/tasks/archive").isEmpty());
        assertEquals(id, store.readTree("refs/tasks/other").orElseThrow().commitId());
    }

    @Test
    void testDeleteRef() throws Exception {
        store.writeTransaction(REF, null, List.of(TreeMutation.put("1", bytes("a"))), "first");
        store.deleteRef(REF);
        assertTrue(store.readTree(REF).isEmpty());
        // deleting again is a no-op
        store.deleteRef(REF);
    }

    @Test
    void testOpenFindsRepositoryFromSubdirectory() throws Exception {
        var nested = tempDir.resolve("a/b");
        Files.createDirectories(nested);
        try (var opened = GitObjectStore.open(nested)) {
            assertEquals(tempDir.resolve(".git").toRealPath(), opened.getRepository().getDirectory().toPath().toRealPath());
        }
    }
}
