package io.github.gittask.remote;

import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Values pushed to a remote issue.
 *
 * @param statusText the local status when it is neither the open nor the closed one; trackers with named states
 *     may use it, the rest ignore it
 * @param labels label names, or null to leave the labels of the remote issue as they are
 */
public record IssueFields(
        String title, String body, boolean open, @Nullable String statusText, @Nullable List<String> labels) {
    public IssueFields {
        labels = labels == null ? null : List.copyOf(labels);
    }
}
