package io.github.gittask.sync;

import io.github.gittask.remote.TrackerKind;
import java.util.ArrayList;
import java.util.List;

/** Per-item results of a pull or push, ordered by task id and then comment id. */
public record SyncReport(TrackerKind trackerKind, List<ItemResult> items) {
    public SyncReport {
        var sorted = new ArrayList<>(items);
        sorted.sort(ItemResult.ORDER);
        items = List.copyOf(sorted);
    }

    public List<ItemResult> failures() {
        return items.stream().filter(ItemResult::isFailure).toList();
    }

    public boolean hasFailures() {
        return items.stream().anyMatch(ItemResult::isFailure);
    }

    public long count(ItemResult.Outcome outcome) {
        return items.stream().filter(item -> item.outcome() == outcome).count();
    }
}
