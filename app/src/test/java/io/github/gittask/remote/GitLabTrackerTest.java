package io.github.gittask.remote;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.gittask.exception.NotFoundException;
import io.github.gittask.exception.RemoteFailureException;
import io.github.gittask.exception.ValidationException;
import io.github.gittask.testutil.CannedHttp;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class GitLabTrackerTest {
    private static final String BASE = "/api/v4/projects/group%2Fapp";

    private CannedHttp http;
    private GitLabTracker tracker;

    @BeforeEach
    void setUp() throws Exception {
        http = new CannedHttp();
        tracker = new GitLabTracker(http.client(), "https://gitlab.example.com/", "group/app");
    }

    private static String issue(int iid, String title, String state, String... labels) {
        var mapper = new ObjectMapper();
        var node = mapper.createObjectNode();
        node.put("iid", iid);
        node.put("title", title);
        node.put("description", "Body of " + title);
        node.putObject("author").put("username", "ann");
        node.put("created_at", "2024-05-01T10:00:00.000Z");
        node.put("state", state);
        var labelArray = node.putArray("labels");
        for (String label : labels) {
            labelArray.add(label);
        }
        node.put("user_notes_count", 2);
        return node.toString();
    }

    @Test
    void testGetIssueMapsFields() throws Exception {
        http.on("GET", BASE + "/issues/7", 200, issue(7, "Crash", "closed", "bug", "ui"));

        var issue = tracker.getIssue("7");

        assertEquals("7", issue.id());
        assertEquals("Crash", issue.title());
        assertEquals("Body of Crash", issue.body());
        assertEquals("ann", issue.author());
        assertEquals(1_714_557_600L, issue.created());
        assertFalse(issue.open());
        assertEquals(List.of("bug", "ui"), issue.labels());
        assertEquals(2, issue.commentCount());
    }

    @Test
    void testListingIsLazyAndPaged() throws Exception {
        var firstPage = new ArrayList<String>();
        for (int i = 1; i <= GitLabTracker.PAGE_SIZE; i++) {
            firstPage.add(issue(i, "Issue " + i, "opened"));
        }
        http.on("GET", BASE + "/issues", Map.of("page", "1"), 200, "[" + String.join(",", firstPage) + "]");
        http.on("GET", BASE + "/issues", Map.of("page", "2"), 200, "[" + issue(101, "Last", "opened") + "]");

        var limited = tracker.listIssues(IssueQuery.all().withLimit(3));
        for (int i = 0; i < 3; i++) {
            limited.next();
        }
        assertFalse(limited.hasNext());
        assertEquals(1, http.requests().size(), "A limit inside the first page never fetches the second");

        var all = new ArrayList<RemoteIssue>();
        tracker.listIssues(IssueQuery.all().withState(IssueQuery.State.OPEN)).forEachRemaining(all::add);
        assertEquals(101, all.size());
        var lastRequest = http.requests().get(http.requests().size() - 1);
        assertEquals("2", lastRequest.query("page"));
        assertEquals("opened", lastRequest.query("state"));
        assertEquals("100", lastRequest.query("per_page"));
    }

    @Test
    void testListingFailureSurfacesFromIterator() throws Exception {
        http.on("GET", BASE + "/issues", 503, "{}");
        var iterator = tracker.listIssues(IssueQuery.all());

        var e = assertThrows(RemoteFailureException.Unchecked.class, iterator::hasNext);
        assertTrue(e.getCause().isRetryable(), "5xx is worth retrying");
        assertEquals(TrackerKind.GITLAB, e.getCause().trackerKind());
    }

    @Test
    void testCreateClosedIssue() throws Exception {
        http.on("POST", BASE + "/issues", 201, issue(12, "New", "opened"));
        http.on("PUT", BASE + "/issues/12", 200, issue(12, "New", "closed"));

        String id = tracker.createIssue(new IssueFields("New", "Text", false, null, List.of("bug")));

        assertEquals("12", id);
        var post = http.requests("POST").get(0);
        var body = new ObjectMapper().readTree(post.body());
        assertEquals("New", body.path("title").asText());
        assertEquals("bug", body.path("labels").asText());
        var put = new ObjectMapper().readTree(http.requests("PUT").get(0).body());
        assertEquals("close", put.path("state_event").asText());
    }

    @Test
    void testUpdateReopens() throws Exception {
        http.on("PUT", BASE + "/issues/3", 200, issue(3, "T", "opened"));

        tracker.updateIssue("3", new IssueFields("T", "B", true, null, List.of()));

        var put = new ObjectMapper().readTree(http.requests("PUT").get(0).body());
        assertEquals("reopen", put.path("state_event").asText());
        assertEquals("", put.path("labels").asText());
    }

    @Test
    void testUpdateWithoutLabelsLeavesThemAlone() throws Exception {
        http.on("PUT", BASE + "/issues/3", 200, issue(3, "T", "opened", "bug"));

        tracker.updateIssue("3", new IssueFields("T", "B", true, null, null));

        var put = new ObjectMapper().readTree(http.requests("PUT").get(0).body());
        assertFalse(put.has("labels"), put.toString());
        assertEquals("T", put.path("title").asText());
    }

    @Test
    void testCommentsSkipSystemNotes() throws Exception {
        http.on("GET", BASE + "/issues/3/notes", 200, """
                [{"id": 11, "body": "added ~bug label", "system": true, "author": {"username": "bot"}},
                 {"id": 12, "body": "Looks good", "system": false, "author": {"username": "bob"},
                  "created_at": "2024-05-02T00:00:00Z"}]
                """);

        var comments = new ArrayList<RemoteComment>();
        tracker.listComments("3").forEachRemaining(comments::add);

        assertEquals(List.of(new RemoteComment("12", "bob", 1_714_608_000L, "Looks good")), comments);
    }

    @Test
    void testCommentLifecycle() throws Exception {
        http.on("POST", BASE + "/issues/3/notes", 201, "{\"id\": 44}");
        http.on("PUT", BASE + "/issues/3/notes/44", 200, "{\"id\": 44}");
        http.on("DELETE", BASE + "/issues/3/notes/44", 204, "");

        assertEquals("44", tracker.createComment("3", "hello"));
        tracker.updateComment("3", "44", "edited");
        tracker.deleteComment("3", "44");

        assertEquals(List.of("POST", "PUT", "DELETE"), http.requests().stream().map(CannedHttp.Recorded::method).toList());
    }

    @Test
    void testLabels() throws Exception {
        http.on("GET", BASE + "/labels", 200, "[{\"name\": \"bug\", \"color\": \"#d73a4a\", \"description\": null}]");
        http.on("POST", BASE + "/labels", 201, "{}");

        assertEquals(List.of(new RemoteLabel("bug", "d73a4a", null)), tracker.listLabels());
        tracker.createLabel(new RemoteLabel("docs", "Blue", "Documentation"));

        var body = new ObjectMapper().readTree(http.requests("POST").get(0).body());
        assertEquals("#1d76db", body.path("color").asText());
        assertEquals("Documentation", body.path("description").asText());
    }

    @Test
    void testErrorMapping() {
        http.on("GET", BASE + "/issues/404", 404, "{}");
        http.on("GET", BASE + "/issues/401", 401, "{}");
        http.on("GET", BASE + "/issues/429", 429, "{}");

        assertThrows(NotFoundException.class, () -> tracker.getIssue("404"));
        var auth = assertThrows(RemoteFailureException.class, () -> tracker.getIssue("401"));
        assertEquals(RemoteFailureException.Reason.AUTH, auth.reason());
        assertFalse(auth.isRetryable());
        var limited = assertThrows(RemoteFailureException.class, () -> tracker.getIssue("429"));
        assertEquals(RemoteFailureException.Reason.RATE_LIMIT, limited.reason());
        assertTrue(limited.isRetryable());
    }

    @Test
    void testBlankProjectIsRejected() {
        assertThrows(ValidationException.class, () -> new GitLabTracker(http.client(), GitLabTracker.DEFAULT_URL, " "));
    }
}
