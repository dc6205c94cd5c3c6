package io.github.gittask.remote;

import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * An issue as a tracker reports it.
 *
 * @param created epoch seconds
 * @param statusText the tracker's own status name where it has richer states than open/closed
 */
public record RemoteIssue(
        String id,
        String title,
        String body,
        String author,
        long created,
        boolean open,
        @Nullable String statusText,
        List<String> labels,
        int commentCount) {

    public RemoteIssue {
        labels = List.copyOf(labels);
    }
}
