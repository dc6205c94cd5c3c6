package io.github.gittask.remote;

import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Criteria for {@link RemoteTracker#listIssues}.
 *
 * @param ids remote ids to fetch; null lists the whole project
 * @param since only issues created at or after this epoch second
 */
public record IssueQuery(@Nullable List<String> ids, State state, @Nullable Integer limit, @Nullable Long since) {
    public enum State {
        ALL,
        OPEN,
        CLOSED
    }

    public IssueQuery {
        ids = ids == null ? null : List.copyOf(ids);
    }

    public static IssueQuery all() {
        return new IssueQuery(null, State.ALL, null, null);
    }

    public IssueQuery withState(State newState) {
        return new IssueQuery(ids, newState, limit, since);
    }

    public IssueQuery withLimit(@Nullable Integer newLimit) {
        return new IssueQuery(ids, state, newLimit, since);
    }

    public IssueQuery withIds(@Nullable List<String> newIds) {
        return new IssueQuery(newIds, state, limit, since);
    }

    public boolean accepts(RemoteIssue issue) {
        boolean stateMatches = switch (state) {
            case ALL -> true;
            case OPEN -> issue.open();
            case CLOSED -> !issue.open();
        };
        return stateMatches && (since == null || issue.created() >= since);
    }
}
