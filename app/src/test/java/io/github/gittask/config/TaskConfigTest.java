package io.github.gittask.config;

import static org.junit.jupiter.api.Assertions.*;

import io.github.gittask.remote.TrackerKind;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

public class TaskConfigTest {

    @Test
    void testDefaults() {
        var config = TaskConfig.of(Map.of());
        assertEquals("refs/tasks/tasks", config.ref());
        assertEquals(List.of("id", "created", "status", "name"), config.listColumns());
        assertEquals("id desc", config.listSort());
        assertEquals("OPEN", config.openStatus(TrackerKind.GITHUB));
        assertEquals("CLOSED", config.closedStatus(TrackerKind.JIRA));
        assertTrue(config.values().isEmpty(), "Defaults are not reported as explicit values");
    }

    @Test
    void testNormalizeRef() {
        assertEquals("refs/heads/tasks", TaskConfig.normalizeRef("tasks"));
        assertEquals("refs/tasks/mine", TaskConfig.normalizeRef("tasks/mine"));
        assertEquals("refs/tasks/mine", TaskConfig.normalizeRef(" refs/tasks/mine "));
    }

    @Test
    void testPerTrackerStatusWins() {
        var config = TaskConfig.of(Map.of(
                TaskConfig.STATUS_CLOSED, "DONE",
                "task.jira.status.closed", "RESOLVED"));
        assertEquals("RESOLVED", config.closedStatus(TrackerKind.JIRA));
        assertEquals("DONE", config.closedStatus(TrackerKind.GITLAB));
    }

    @Test
    void testSettingFallsBackToEnvironment() {
        var env = Map.of("GITHUB_TOKEN", "from-env", "GH_TOKEN", "second");
        var config = TaskConfig.load(new MapConfigStore(), env::get);
        assertEquals(Optional.of("from-env"), config.setting("task.github.token", "GITHUB_TOKEN", "GH_TOKEN"));

        var configured = config.with("task.github.token", "from-config");
        assertEquals(Optional.of("from-config"), configured.setting("task.github.token", "GITHUB_TOKEN"));
        assertEquals(Optional.empty(), configured.setting("task.gitlab.token", "GITLAB_TOKEN"));
    }

    @Test
    void testColumnsAreTrimmed() {
        var config = TaskConfig.of(Map.of(TaskConfig.LIST_COLUMNS, " id ,name,, priority"));
        assertEquals(List.of("id", "name", "priority"), config.listColumns());
    }
}
