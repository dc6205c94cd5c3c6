package io.github.gittask.remote;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.gittask.exception.UnsupportedRemoteOperationException;
import io.github.gittask.testutil.CannedHttp;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class RedmineTrackerTest {
    private static final String STATUSES = """
            {"issue_statuses": [
              {"id": 1, "name": "New", "is_closed": false},
              {"id": 2, "name": "In Progress", "is_closed": false},
              {"id": 5, "name": "Closed", "is_closed": true}]}
            """;

    private static final String ISSUE = """
            {"issue": {"id": 9, "subject": "Slow page", "description": "Takes 10s",
              "status": {"id": 5, "name": "Closed"},
              "author": {"name": "Ann"}, "created_on": "2024-05-01T10:00:00Z",
              "journals": [
                {"id": 70, "notes": "", "user": {"name": "Ann"}},
                {"id": 71, "notes": "Profiled it", "user": {"name": "Bob"}, "created_on": "2024-05-02T00:00:00Z"}]}}
            """;

    private CannedHttp http;
    private RedmineTracker tracker;
    private final ObjectMapper mapper = new ObjectMapper();

    @BeforeEach
    void setUp() throws Exception {
        http = new CannedHttp();
        tracker = new RedmineTracker(http.client(), "https://redmine.example.com", "web");
        http.on("GET", "/issue_statuses.json", 200, STATUSES);
    }

    @Test
    void testGetIssueResolvesClosedStateFromStatusList() throws Exception {
        http.on("GET", "/issues/9.json", 200, ISSUE);

        var issue = tracker.getIssue("9");

        assertEquals("Slow page", issue.title());
        assertEquals("Ann", issue.author());
        assertFalse(issue.open());
        assertEquals("Closed", issue.statusText());
        assertEquals(1, issue.commentCount(), "Journals without notes are not comments");
        assertEquals("journals", http.requests().get(0).query("include"));
    }

    @Test
    void testListComments() throws Exception {
        http.on("GET", "/issues/9.json", 200, ISSUE);

        var comments = new ArrayList<RemoteComment>();
        tracker.listComments("9").forEachRemaining(comments::add);

        assertEquals(List.of(new RemoteComment("71", "Bob", 1_714_608_000L, "Profiled it")), comments);
    }

    @Test
    void testCreateClosedIssueSetsStatus() throws Exception {
        http.on("POST", "/issues.json", 201, "{\"issue\": {\"id\": 10}}");
        http.on("PUT", "/issues/10.json", 204, "");

        assertEquals("10", tracker.createIssue(new IssueFields("New", "Body", false, null, List.of())));

        var create = mapper.readTree(http.requests("POST").get(0).body());
        assertEquals("web", create.path("issue").path("project_id").asText());
        var update = mapper.readTree(http.requests("PUT").get(0).body());
        assertEquals(5, update.path("issue").path("status_id").asInt());
    }

    @Test
    void testUpdateToNamedStatus() throws Exception {
        http.on("GET", "/issues/9.json", 200, ISSUE);
        http.on("PUT", "/issues/9.json", 204, "");

        tracker.updateIssue("9", new IssueFields("Slow page", "Takes 10s", true, "In Progress", List.of()));

        var update = mapper.readTree(http.requests("PUT").get(0).body());
        assertEquals(2, update.path("issue").path("status_id").asInt());
    }

    @Test
    void testCreateCommentFindsNewJournal() throws Exception {
        http.on("PUT", "/issues/9.json", 204, "");
        http.on("GET", "/issues/9.json", 200, ISSUE);

        assertEquals("71", tracker.createComment("9", "Profiled it"));
        var update = mapper.readTree(http.requests("PUT").get(0).body());
        assertEquals("Profiled it", update.path("issue").path("notes").asText());
    }

    @Test
    void testNoLabels() throws Exception {
        assertFalse(tracker.supportsLabelCreation());
        assertEquals(List.of(), tracker.listLabels());
        assertThrows(UnsupportedRemoteOperationException.class,
                () -> tracker.createLabel(new RemoteLabel("bug", "Red", null)));
    }
}
