package io.github.gittask.sync;

import io.github.gittask.config.StatusTable;
import io.github.gittask.config.TaskConfig;
import io.github.gittask.remote.RemoteIssue;
import io.github.gittask.remote.TrackerKind;
import org.jetbrains.annotations.Nullable;

/**
 * Translates between local statuses and a tracker's open/closed state. Trackers with named states report them in
 * {@link RemoteIssue#statusText()}; a name that matches a local status is taken as is.
 */
public final class StatusMapping {
    private final StatusTable statuses;
    private final String openStatus;
    private final String closedStatus;

    public StatusMapping(TaskConfig config, StatusTable statuses, TrackerKind kind) {
        this.statuses = statuses;
        this.openStatus = config.openStatus(kind);
        this.closedStatus = config.closedStatus(kind);
    }

    public String openStatus() {
        return openStatus;
    }

    public String closedStatus() {
        return closedStatus;
    }

    public String toLocal(RemoteIssue issue) {
        String text = issue.statusText();
        if (text != null) {
            var named = statuses.find(text);
            if (named.isPresent()) {
                return named.get().name();
            }
        }
        return issue.open() ? openStatus : closedStatus;
    }

    public boolean toRemoteOpen(String status) {
        return !status.equals(closedStatus) && !statuses.isClosing(status);
    }

    /** The status to send as free text, or null when open/closed already says it all. */
    public @Nullable String toRemoteStatusText(String status) {
        return status.equals(openStatus) || status.equals(closedStatus) ? null : status;
    }

    /** Whether the remote state already represents {@code status}. */
    public boolean matches(String status, RemoteIssue issue) {
        if (issue.statusText() != null && statuses.find(issue.statusText()).isPresent()) {
            return issue.statusText().equals(status);
        }
        return toRemoteOpen(status) == issue.open();
    }
}
