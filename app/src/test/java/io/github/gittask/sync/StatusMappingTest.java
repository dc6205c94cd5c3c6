package io.github.gittask.sync;

import static org.junit.jupiter.api.Assertions.*;

import io.github.gittask.config.StatusTable;
import io.github.gittask.config.TaskConfig;
import io.github.gittask.remote.RemoteIssue;
import io.github.gittask.remote.TrackerKind;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class StatusMappingTest {

    private static RemoteIssue issue(boolean open, String statusText) {
        return new RemoteIssue("1", "t", "", "ann", 0, open, statusText, List.of(), 0);
    }

    @Test
    void testOpenClosedMapping() {
        var mapping = new StatusMapping(TaskConfig.of(Map.of()), StatusTable.defaults(), TrackerKind.GITHUB);

        assertEquals("OPEN", mapping.toLocal(issue(true, null)));
        assertEquals("CLOSED", mapping.toLocal(issue(false, null)));
        assertTrue(mapping.toRemoteOpen("IN_PROGRESS"));
        assertFalse(mapping.toRemoteOpen("CLOSED"));
        assertNull(mapping.toRemoteStatusText("OPEN"));
        assertEquals("IN_PROGRESS", mapping.toRemoteStatusText("IN_PROGRESS"));
    }

    @Test
    void testNamedRemoteStatusWins() {
        var mapping = new StatusMapping(TaskConfig.of(Map.of()), StatusTable.defaults(), TrackerKind.JIRA);

        assertEquals("IN_PROGRESS", mapping.toLocal(issue(true, "IN_PROGRESS")));
        assertEquals("OPEN", mapping.toLocal(issue(true, "Triage")), "Unknown names fall back to open/closed");
        assertTrue(mapping.matches("IN_PROGRESS", issue(true, "IN_PROGRESS")));
        assertFalse(mapping.matches("OPEN", issue(true, "IN_PROGRESS")));
        assertTrue(mapping.matches("OPEN", issue(true, "Triage")));
    }

    @Test
    void testPerTrackerStatusNames() {
        var config = TaskConfig.of(Map.of(
                "task.status.closed", "CLOSED",
                "task.gitlab.status.closed", "IN_PROGRESS"));

        var gitlab = new StatusMapping(config, StatusTable.defaults(), TrackerKind.GITLAB);
        var github = new StatusMapping(config, StatusTable.defaults(), TrackerKind.GITHUB);

        assertEquals("IN_PROGRESS", gitlab.toLocal(issue(false, null)));
        assertFalse(gitlab.toRemoteOpen("IN_PROGRESS"));
        assertEquals("CLOSED", github.toLocal(issue(false, null)));
    }
}
