package io.github.gittask.sync;

import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * @param remoteIds remote issues to pull; null pulls the listing
 * @param status only pull issues in the remote state of this local status (name or shortcut)
 */
public record PullOptions(
        @Nullable List<String> remoteIds,
        @Nullable String status,
        @Nullable Integer limit,
        boolean includeComments,
        boolean includeLabels) {

    public PullOptions {
        remoteIds = remoteIds == null ? null : List.copyOf(remoteIds);
    }

    public static PullOptions defaults() {
        return new PullOptions(null, null, null, true, true);
    }
}
