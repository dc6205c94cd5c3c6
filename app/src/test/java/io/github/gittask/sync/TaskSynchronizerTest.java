package io.github.gittask.sync;

import static org.junit.jupiter.api.Assertions.*;

import io.github.gittask.config.StatusTable;
import io.github.gittask.exception.ConcurrentUpdateException;
import io.github.gittask.exception.ErrorKind;
import io.github.gittask.exception.StoreException;
import io.github.gittask.model.Label;
import io.github.gittask.model.Task;
import io.github.gittask.remote.IssueFields;
import io.github.gittask.remote.TrackerKind;
import io.github.gittask.repository.TaskMutation;
import io.github.gittask.repository.TaskRepository;
import io.github.gittask.store.ObjectStore;
import io.github.gittask.store.Snapshot;
import io.github.gittask.store.TreeMutation;
import io.github.gittask.testutil.FakeRemoteTracker;
import io.github.gittask.testutil.TempGitRepo;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.eclipse.jgit.lib.ObjectId;
import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class TaskSynchronizerTest {
    @TempDir
    Path tempDir;

    private TempGitRepo repo;
    private TaskRepository repository;
    private FakeRemoteTracker tracker;
    private TaskSynchronizer synchronizer;

    @BeforeEach
    void setUp() throws Exception {
        repo = TempGitRepo.init(tempDir);
        repository = repo.repository();
        tracker = new FakeRemoteTracker(TrackerKind.GITHUB);
        synchronizer = new TaskSynchronizer(repository, repo.config(), StatusTable.defaults());
    }

    @AfterEach
    void tearDown() {
        repo.close();
    }

    private long createTask(String name) throws Exception {
        return repository.applyTransaction(TaskMutation.create(Task.draft(name, "About " + name, "OPEN")), "Create " + name)
                .createdIds().get(0);
    }

    private static List<Long> ids(long from, long to) {
        var ids = new ArrayList<Long>();
        for (long id = from; id <= to; id++) {
            ids.add(id);
        }
        return ids;
    }

    @Test
    void testPullCreatesLinkedTasks() throws Exception {
        tracker.addIssue("Crash on start", "Stack trace", true, "bug");
        tracker.addIssue("Old request", "", false);

        var report = synchronizer.pull(tracker, PullOptions.defaults());

        assertEquals(2, report.count(ItemResult.Outcome.CREATED));
        assertFalse(report.hasFailures());
        var first = repository.get(1);
        assertEquals("Crash on start", first.name());
        assertEquals("Stack trace", first.getProperty(Task.DESCRIPTION));
        assertEquals("remote-user", first.getProperty(Task.AUTHOR));
        assertEquals("1700000000", first.getProperty(Task.CREATED), "created comes from the issue");
        assertEquals("OPEN", first.status());
        assertEquals("1", first.link(TrackerKind.GITHUB).orElseThrow());
        assertEquals(List.of("bug"), first.labels().stream().map(Label::name).toList());
        assertEquals("CLOSED", repository.get(2).status());
    }

    @Test
    void testPullKeepsLocalOnlyProperties() throws Exception {
        String issueId = tracker.addIssue("Crash", "Trace", true);
        synchronizer.pull(tracker, PullOptions.defaults());
        repository.applyTransaction(TaskMutation.setProperty(1, "priority", "HIGH"), "Set priority");
        tracker.updateIssue(issueId, new IssueFields("Crash on start", "Trace", false, null, List.of()));

        var report = synchronizer.pull(tracker, PullOptions.defaults());

        assertEquals(1, report.count(ItemResult.Outcome.UPDATED));
        assertEquals(0, report.count(ItemResult.Outcome.CREATED), "Linked issues never create a second task");
        var task = repository.get(1);
        assertEquals("Crash on start", task.name());
        assertEquals("CLOSED", task.status());
        assertEquals("HIGH", task.getProperty("priority"));
        assertEquals(1, repository.loadAll().size());
    }

    @Test
    void testPullThenPushIsIdempotent() throws Exception {
        String issueId = tracker.addIssue("Crash", "Trace", true, "bug", "ui");
        tracker.addComment(issueId, "Seen it too");
        synchronizer.pull(tracker, PullOptions.defaults());

        var push = synchronizer.push(tracker, List.of(1L), PushOptions.defaults());

        assertEquals(1, push.count(ItemResult.Outcome.UNCHANGED));
        assertEquals(0, tracker.updateCalls());
        assertEquals(0, tracker.createCalls());
        assertEquals(1, tracker.comments(issueId).size(), "Pulled comments are linked and not pushed back");

        var repull = synchronizer.pull(tracker, PullOptions.defaults());
        assertEquals(1, repull.count(ItemResult.Outcome.UNCHANGED));
    }

    @Test
    void testPullAddsRemoteComments() throws Exception {
        String issueId = tracker.addIssue("Crash", "Trace", true);
        String commentId = tracker.addComment(issueId, "Seen it too");

        synchronizer.pull(tracker, PullOptions.defaults());

        var comments = repository.get(1).comments();
        assertEquals(1, comments.size());
        assertEquals("commenter", comments.get(0).author());
        assertEquals("Seen it too", comments.get(0).text());
        assertEquals(commentId, comments.get(0).link(TrackerKind.GITHUB).orElseThrow());
    }

    @Test
    void testPullByStatusAndIds() throws Exception {
        tracker.addIssue("Open one", "", true);
        tracker.addIssue("Closed one", "", false);

        var closedOnly = synchronizer.pull(tracker, new PullOptions(null, "c", null, true, true));
        assertEquals(1, closedOnly.count(ItemResult.Outcome.CREATED));
        assertEquals("Closed one", repository.get(1).name());

        var byId = synchronizer.pull(tracker, new PullOptions(List.of("1", "99"), null, null, true, true));
        assertEquals(1, byId.count(ItemResult.Outcome.CREATED));
        assertEquals(1, byId.failures().size());
        assertEquals(ErrorKind.NOT_FOUND, byId.failures().get(0).errorKind());
        assertEquals("99", byId.failures().get(0).remoteId());
    }

    @Test
    void testListingFailureKeepsIssuesReadBefore() throws Exception {
        tracker.addIssue("One", "", true);
        tracker.addIssue("Two", "", true);
        tracker.addIssue("Three", "", true);
        tracker.failListingAfter(2);

        var report = synchronizer.pull(tracker, PullOptions.defaults());

        assertEquals(2, report.count(ItemResult.Outcome.CREATED));
        assertEquals(1, report.failures().size());
        assertEquals(ErrorKind.REMOTE_FAILURE, report.failures().get(0).errorKind());
        assertEquals(List.of("One", "Two"), repository.loadAll().stream().map(Task::name).sorted().toList());
    }

    @Test
    void testPushFailureIsolatedToOneTask() throws Exception {
        for (int i = 1; i <= 5; i++) {
            createTask("Task " + i);
        }
        tracker.failOnTitle("Task 3");

        var report = synchronizer.push(tracker, ids(1, 5), PushOptions.defaults());

        assertEquals(4, report.count(ItemResult.Outcome.CREATED));
        assertEquals(1, report.failures().size());
        var failure = report.failures().get(0);
        assertEquals(3, failure.taskId());
        assertEquals(ErrorKind.REMOTE_FAILURE, failure.errorKind());
        assertEquals(5, report.items().size(), "One result per task");
        for (long id : List.of(1L, 2L, 4L, 5L)) {
            assertTrue(repository.get(id).link(TrackerKind.GITHUB).isPresent(), "task " + id + " is linked");
        }
        assertTrue(repository.get(3).link(TrackerKind.GITHUB).isEmpty());
        assertEquals(5, tracker.createCalls());
        assertEquals(4, tracker.issues().size());
    }

    @Test
    void testPushUpdatesChangedTask() throws Exception {
        long id = createTask("Write docs");
        synchronizer.push(tracker, List.of(id), PushOptions.defaults());
        String remoteId = repository.get(id).link(TrackerKind.GITHUB).orElseThrow();
        repository.applyTransaction(TaskMutation.setProperty(id, Task.STATUS, "CLOSED"), "Close");

        var report = synchronizer.push(tracker, List.of(id), PushOptions.defaults());

        assertEquals(1, report.count(ItemResult.Outcome.UPDATED));
        assertFalse(tracker.issues().get(remoteId).open());
    }

    @Test
    void testPushWithoutCreateSkipsUnlinked() throws Exception {
        long id = createTask("Local only");

        var report = synchronizer.push(tracker, List.of(id, 42L), new PushOptions(false, true, true, 2));

        assertEquals(1, report.count(ItemResult.Outcome.SKIPPED));
        assertEquals(ErrorKind.NOT_FOUND, report.failures().get(0).errorKind(), "task 42 does not exist");
        assertEquals(0, tracker.createCalls());
    }

    @Test
    void testPushCreatesAndLinksComments() throws Exception {
        long id = createTask("Discuss");
        repository.applyTransaction(TaskMutation.addComment(id, "ann", "First thought"), "Comment");

        var report = synchronizer.push(tracker, List.of(id), PushOptions.defaults());

        var commentResult = report.items().stream().filter(item -> item.commentId() != null).findFirst().orElseThrow();
        assertEquals(ItemResult.Outcome.CREATED, commentResult.outcome());
        var comment = repository.get(id).findComment(1).orElseThrow();
        assertEquals(commentResult.remoteId(), comment.link(TrackerKind.GITHUB).orElseThrow());
        String issueId = repository.get(id).link(TrackerKind.GITHUB).orElseThrow();
        assertEquals("First thought", tracker.comments(issueId).get(0).body());

        synchronizer.push(tracker, List.of(id), PushOptions.defaults());
        assertEquals(1, tracker.comments(issueId).size(), "Linked comments are not created twice");
    }

    @Test
    void testPushLabelsCreatesMissingRemoteLabels() throws Exception {
        long id = createTask("Styled");
        repository.applyTransaction(TaskMutation.addLabel(id, new Label("ui", "Blue", "Interface")), "Label");

        synchronizer.push(tracker, List.of(id), PushOptions.defaults());

        assertEquals("Blue", tracker.labels().get("ui").color());
        String issueId = repository.get(id).link(TrackerKind.GITHUB).orElseThrow();
        assertEquals(List.of("ui"), tracker.issues().get(issueId).labels());
    }

    @Test
    void testTrackerWithoutLabelsSkipsThem() throws Exception {
        var redmine = new FakeRemoteTracker(TrackerKind.REDMINE, false);
        long id = createTask("Labelled");
        repository.applyTransaction(TaskMutation.addLabel(id, Label.named("bug")), "Label");

        var report = synchronizer.push(redmine, List.of(id), PushOptions.defaults());

        assertFalse(report.hasFailures());
        assertEquals(1, report.count(ItemResult.Outcome.CREATED));
        var skipped = report.items().stream()
                .filter(item -> item.outcome() == ItemResult.Outcome.SKIPPED)
                .findFirst()
                .orElseThrow();
        assertEquals(ErrorKind.UNSUPPORTED_OPERATION, skipped.errorKind());
    }

    @Test
    void testPushDelete() throws Exception {
        long linked = createTask("Linked");
        long local = createTask("Local");
        synchronizer.push(tracker, List.of(linked), PushOptions.defaults());
        var linkedTask = repository.get(linked);
        var localTask = repository.get(local);
        String remoteId = linkedTask.link(TrackerKind.GITHUB).orElseThrow();
        repository.applyTransaction(List.of(TaskMutation.delete(linked), TaskMutation.delete(local)), "Delete");

        var report = synchronizer.pushDelete(tracker, List.of(linkedTask, localTask));

        assertEquals(1, report.count(ItemResult.Outcome.DELETED));
        assertEquals(1, report.count(ItemResult.Outcome.SKIPPED));
        assertFalse(tracker.issues().containsKey(remoteId));

        var again = synchronizer.pushDelete(tracker, List.of(linkedTask));
        assertEquals(ErrorKind.NOT_FOUND, again.failures().get(0).errorKind());
    }

    @Test
    void testSingleCommentOperations() throws Exception {
        long id = createTask("Chat");
        synchronizer.push(tracker, List.of(id), PushOptions.defaults());
        String issueId = repository.get(id).link(TrackerKind.GITHUB).orElseThrow();
        repository.applyTransaction(TaskMutation.addComment(id, "ann", "Draft"), "Comment");

        var created = synchronizer.pushComment(tracker, id, 1);
        assertEquals(ItemResult.Outcome.CREATED, created.outcome());

        repository.applyTransaction(TaskMutation.updateComment(id, 1, "Final"), "Edit");
        var updated = synchronizer.pushCommentUpdate(tracker, id, 1);
        assertEquals(ItemResult.Outcome.UPDATED, updated.outcome());
        assertEquals("Final", tracker.comments(issueId).get(0).body());

        var before = repository.get(id);
        repository.applyTransaction(TaskMutation.deleteComment(id, 1), "Delete comment");
        var deleted = synchronizer.pushCommentDelete(tracker, before, 1);
        assertEquals(ItemResult.Outcome.DELETED, deleted.outcome());
        assertTrue(tracker.comments(issueId).isEmpty());
    }

    @Test
    void testCommentOnUnlinkedTaskFails() throws Exception {
        long id = createTask("Unlinked");
        repository.applyTransaction(TaskMutation.addComment(id, "ann", "Hello"), "Comment");

        var result = synchronizer.pushComment(tracker, id, 1);

        assertEquals(ItemResult.Outcome.FAILED, result.outcome());
        assertEquals(ErrorKind.VALIDATION, result.errorKind());
        assertTrue(result.message().contains("push it first"), result.message());
    }

    @Test
    void testPullSkipsIssueListedTwice() throws Exception {
        tracker.addIssue("Crash", "Stack trace", true, "bug");
        tracker.listTwice("1");

        var report = synchronizer.pull(tracker, PullOptions.defaults());

        assertEquals(1, report.count(ItemResult.Outcome.CREATED));
        assertFalse(report.hasFailures());
        assertEquals(1, repository.loadAll().size());
    }

    @Test
    void testPushWithoutLabelsKeepsRemoteLabels() throws Exception {
        tracker.addIssue("Crash", "Stack trace", true, "bug", "ui");
        synchronizer.pull(tracker, PullOptions.defaults());
        repository.applyTransaction(TaskMutation.setProperty(1, Task.NAME, "Crash on start"), "Rename");

        var report = synchronizer.push(tracker, List.of(1L), new PushOptions(true, true, false, 1));

        assertEquals(1, report.count(ItemResult.Outcome.UPDATED));
        var remote = tracker.issues().get("1");
        assertEquals("Crash on start", remote.title());
        assertEquals(List.of("bug", "ui"), remote.labels());
    }

    @Test
    void testLinkCommitFailureIsReportedSeparately() throws Exception {
        createTask("Write docs");
        createTask("Fix build");
        var rejecting = new TaskSynchronizer(new TaskRepository(new RejectingStore(repo.store()), repo.config()),
                repo.config(), StatusTable.defaults());

        var report = rejecting.push(tracker, ids(1, 2), new PushOptions(true, true, true, 2));

        assertEquals(2, tracker.issues().size(), "The remote issues exist");
        assertEquals(2, report.items().size());
        for (ItemResult item : report.items()) {
            assertEquals(ItemResult.Outcome.LINK_NOT_PERSISTED, item.outcome());
            assertEquals(ErrorKind.CONCURRENT_MODIFICATION, item.errorKind());
            assertNotNull(item.remoteId());
        }
        assertTrue(report.hasFailures());
        assertEquals(2, report.failures().size());
        assertTrue(repository.get(1).link(TrackerKind.GITHUB).isEmpty());
    }

    /** Reads pass through; every write loses the race. */
    private static final class RejectingStore implements ObjectStore {
        private final ObjectStore delegate;

        RejectingStore(ObjectStore delegate) {
            this.delegate = delegate;
        }

        @Override
        public Optional<Snapshot> readTree(String ref) throws StoreException {
            return delegate.readTree(ref);
        }

        @Override
        public ObjectId writeTransaction(
                String ref, @Nullable ObjectId expectedOld, List<TreeMutation> mutations, String message)
                throws ConcurrentUpdateException {
            throw new ConcurrentUpdateException("Ref " + ref + " moved");
        }

        @Override
        public void moveRef(String from, String to, boolean deleteOld) throws StoreException {
            delegate.moveRef(from, to, deleteOld);
        }

        @Override
        public void deleteRef(String ref) throws StoreException {
            delegate.deleteRef(ref);
        }
    }
}
