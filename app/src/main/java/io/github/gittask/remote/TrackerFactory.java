package io.github.gittask.remote;

import com.google.common.base.Splitter;
import io.github.gittask.config.TaskConfig;
import io.github.gittask.exception.GitTaskException;
import io.github.gittask.exception.ValidationException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import okhttp3.OkHttpClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Chooses and builds the {@link RemoteTracker} for a repository. GitHub and GitLab are recognized from the git
 * remote URLs; Jira and Redmine only from their configured URL and project.
 */
public class TrackerFactory {
    private static final Logger logger = LogManager.getLogger(TrackerFactory.class);

    /** Host and path of a parsed git remote URL. */
    public record RemoteLocation(String host, List<String> path) {
        public String owner() {
            return String.join("/", path.subList(0, path.size() - 1));
        }

        public String repo() {
            return path.get(path.size() - 1);
        }

        public String fullPath() {
            return String.join("/", path);
        }
    }

    private final TaskConfig config;
    private final Map<String, String> remotes;

    /**
     * @param remotes git remote name to fetch URL
     */
    public TrackerFactory(TaskConfig config, Map<String, String> remotes) {
        this.config = config;
        this.remotes = new LinkedHashMap<>(remotes);
    }

    /**
     * Parses {@code https://host/owner/repo.git}, {@code git@host:owner/repo.git} and {@code ssh://git@host/owner/repo}
     * forms. Returns null when fewer than two path segments follow the host.
     */
    public static @Nullable RemoteLocation parseRemoteUrl(String remoteUrl) {
        if (remoteUrl.isBlank()) {
            return null;
        }
        String cleaned = remoteUrl.trim();
        if (cleaned.endsWith(".git")) {
            cleaned = cleaned.substring(0, cleaned.length() - 4);
        }
        cleaned = cleaned.replace('\\', '/');
        int protocolIndex = cleaned.indexOf("://");
        if (protocolIndex >= 0) {
            cleaned = cleaned.substring(protocolIndex + 3);
        }
        int atIndex = cleaned.indexOf('@');
        if (atIndex >= 0) {
            cleaned = cleaned.substring(atIndex + 1);
        }
        var segments = Splitter.on(Pattern.compile("[/:]+")).omitEmptyStrings().splitToList(cleaned);
        if (segments.size() < 3) {
            logger.debug("Unable to parse owner/repo from remote URL: {}", remoteUrl);
            return null;
        }
        String host = segments.get(0).toLowerCase(Locale.ROOT);
        var path = segments.subList(1, segments.size());
        // ssh URLs with an explicit port put it in front of the path
        if (path.get(0).chars().allMatch(Character::isDigit) && path.size() > 2) {
            path = path.subList(1, path.size());
        }
        return new RemoteLocation(host, List.copyOf(path));
    }

    private static @Nullable String hostOf(@Nullable String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        var location = parseRemoteUrl(url + "/x/y");
        return location == null ? null : location.host();
    }

    /** Tracker kind served by the given host, if any. */
    @Nullable TrackerKind kindOfHost(String host) {
        String githubHost = hostOf(config.get("task.github.url").orElse(null));
        String gitlabHost = hostOf(TrackerSettings.resolve(config, TrackerKind.GITLAB).url());
        if (host.equals("github.com") || host.equals(githubHost)) {
            return TrackerKind.GITHUB;
        }
        if (host.equals("gitlab.com") || host.equals(gitlabHost)) {
            return TrackerKind.GITLAB;
        }
        return null;
    }

    /**
     * Resolves the settings of the tracker to use.
     *
     * @param kind explicitly requested tracker, or null to detect it
     * @param remoteName git remote to use, or null to consider all of them
     */
    public TrackerSettings resolve(@Nullable TrackerKind kind, @Nullable String remoteName) throws ValidationException {
        Map<String, String> candidates = remotes;
        if (remoteName != null) {
            String url = remotes.get(remoteName);
            if (url == null) {
                throw new ValidationException("Unknown git remote: " + remoteName);
            }
            candidates = Map.of(remoteName, url);
        }

        var matches = new ArrayList<TrackerSettings>();
        for (var entry : candidates.entrySet()) {
            var location = parseRemoteUrl(entry.getValue());
            if (location == null) {
                continue;
            }
            var remoteKind = kindOfHost(location.host());
            if (remoteKind == null || (kind != null && remoteKind != kind)) {
                continue;
            }
            var settings = fromRemote(remoteKind, location);
            if (!matches.contains(settings)) {
                matches.add(settings);
            }
            logger.debug("Remote {} matches {}", entry.getKey(), remoteKind.getDisplayName());
        }
        if (matches.size() > 1) {
            throw new ValidationException("More than one passing remote found. Please specify with --remote option.");
        }
        if (matches.size() == 1) {
            return matches.get(0);
        }

        if (kind != null) {
            var settings = TrackerSettings.resolve(config, kind);
            if (kind == TrackerKind.GITHUB && settings.project() != null) {
                return settings;
            }
            if (settings.isConfigured()) {
                return settings;
            }
            throw new ValidationException(kind.getDisplayName() + " is not configured for this repository");
        }
        for (var candidate : List.of(TrackerKind.JIRA, TrackerKind.REDMINE, TrackerKind.GITLAB)) {
            var settings = TrackerSettings.resolve(config, candidate);
            if (settings.isConfigured()) {
                return settings;
            }
        }
        throw new ValidationException("No passing remotes");
    }

    private TrackerSettings fromRemote(TrackerKind kind, RemoteLocation location) {
        var settings = TrackerSettings.resolve(config, kind);
        if (kind == TrackerKind.GITHUB) {
            return settings.withProject(location.owner() + "/" + location.repo());
        }
        var withUrl = settings.url() == null ? settings.withUrl("https://" + location.host()) : settings;
        return settings.project() == null ? withUrl.withProject(location.fullPath()) : withUrl;
    }

    public RemoteTracker create(@Nullable TrackerKind kind, @Nullable String remoteName) throws GitTaskException {
        return create(resolve(kind, remoteName));
    }

    public static RemoteTracker create(TrackerSettings settings) throws GitTaskException {
        String project = settings.project() == null ? "" : settings.project();
        logger.debug("Creating {} tracker for {}", settings.kind().getDisplayName(), project);
        return switch (settings.kind()) {
            case GITHUB -> {
                int slash = project.lastIndexOf('/');
                if (slash <= 0) {
                    throw new ValidationException("GitHub repository must be given as owner/repo: " + project);
                }
                yield GitHubTracker.connect(settings.token(), settings.url(),
                        project.substring(0, slash), project.substring(slash + 1));
            }
            case GITLAB -> new GitLabTracker(
                    TrackerAuth.buildClient(TrackerKind.GITLAB, "PRIVATE-TOKEN", settings.token()),
                    settings.url() == null ? GitLabTracker.DEFAULT_URL : settings.url(),
                    project);
            case JIRA -> new JiraTracker(jiraClient(settings), required(settings.url(), "Jira URL"), project,
                    settings.issueType() == null ? TrackerSettings.DEFAULT_JIRA_ISSUE_TYPE : settings.issueType());
            case REDMINE -> new RedmineTracker(
                    TrackerAuth.buildClient(TrackerKind.REDMINE, "X-Redmine-API-Key", settings.token()),
                    required(settings.url(), "Redmine URL"),
                    project);
        };
    }

    private static OkHttpClient jiraClient(TrackerSettings settings) {
        String token = settings.token();
        if (token == null || token.isBlank()) {
            return TrackerAuth.buildClient(TrackerKind.JIRA, "Authorization", null);
        }
        String header = settings.user() != null && !settings.user().isBlank()
                ? TrackerAuth.basic(settings.user(), token)
                : TrackerAuth.bearer(token);
        return TrackerAuth.buildClient(TrackerKind.JIRA, "Authorization", header);
    }

    private static String required(@Nullable String value, String what) throws ValidationException {
        if (value == null || value.isBlank()) {
            throw new ValidationException(what + " is not configured");
        }
        return value;
    }
}
