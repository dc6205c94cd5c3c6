package io.github.gittask.remote;

import io.github.gittask.config.TaskConfig;
import org.jetbrains.annotations.Nullable;

/**
 * Connection settings of one tracker. {@code project} is {@code owner/repo} for GitHub, the project path or id for
 * GitLab, the project key for Jira and the project identifier for Redmine.
 */
public record TrackerSettings(
        TrackerKind kind,
        @Nullable String url,
        @Nullable String token,
        @Nullable String user,
        @Nullable String project,
        @Nullable String issueType) {

    public static final String DEFAULT_JIRA_ISSUE_TYPE = "Task";

    /** Reads {@code task.<kind>.*} keys, falling back to the usual environment variables of each tracker. */
    public static TrackerSettings resolve(TaskConfig config, TrackerKind kind) {
        return switch (kind) {
            case GITHUB -> new TrackerSettings(kind,
                    config.setting("task.github.url").orElse(null),
                    config.setting("task.github.token", "GITHUB_TOKEN", "GH_TOKEN").orElse(null),
                    null,
                    config.setting("task.github.repo").orElse(null),
                    null);
            case GITLAB -> new TrackerSettings(kind,
                    config.setting("task.gitlab.url", "GITLAB_URL").orElse(null),
                    config.setting("task.gitlab.token", "GITLAB_TOKEN", "GITLAB_API_TOKEN").orElse(null),
                    null,
                    config.setting("task.gitlab.project", "GITLAB_PROJECT").orElse(null),
                    null);
            case JIRA -> new TrackerSettings(kind,
                    config.setting("task.jira.url", "JIRA_URL", "JIRA_BASE_URL").orElse(null),
                    config.setting("task.jira.token", "JIRA_TOKEN", "JIRA_API_TOKEN").orElse(null),
                    config.setting("task.jira.user", "JIRA_USER", "JIRA_EMAIL").orElse(null),
                    config.setting("task.jira.project", "JIRA_PROJECT").orElse(null),
                    config.setting("task.jira.issue.type").orElse(DEFAULT_JIRA_ISSUE_TYPE));
            case REDMINE -> new TrackerSettings(kind,
                    config.setting("task.redmine.url", "REDMINE_URL").orElse(null),
                    config.setting("task.redmine.api.key", "REDMINE_API_KEY", "REDMINE_TOKEN").orElse(null),
                    null,
                    config.setting("task.redmine.project.id", "REDMINE_PROJECT").orElse(null),
                    null);
        };
    }

    public TrackerSettings withProject(@Nullable String newProject) {
        return new TrackerSettings(kind, url, token, user, newProject, issueType);
    }

    public TrackerSettings withUrl(@Nullable String newUrl) {
        return new TrackerSettings(kind, newUrl, token, user, project, issueType);
    }

    /** Whether the tracker can be reached without a git remote pointing at it. */
    public boolean isConfigured() {
        return url != null && !url.isBlank() && project != null && !project.isBlank();
    }
}
