package io.github.gittask.model;

import io.github.gittask.remote.TrackerKind;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * A comment on a task. IDs are only unique inside the owning task.
 *
 * @param created epoch seconds
 */
public record Comment(long id, String author, long created, String text, Map<TrackerKind, String> links) {

    public Comment {
        links = links.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(links));
    }

    public Comment(long id, String author, long created, String text) {
        this(id, author, created, text, Map.of());
    }

    public Optional<String> link(TrackerKind kind) {
        return Optional.ofNullable(links.get(kind));
    }

    public Comment withId(long newId) {
        return new Comment(newId, author, created, text, links);
    }

    public Comment withText(String newText) {
        return new Comment(id, author, created, newText, links);
    }

    public Comment withLink(TrackerKind kind, String remoteId) {
        var updated = new EnumMap<TrackerKind, String>(TrackerKind.class);
        updated.putAll(links);
        updated.put(kind, remoteId);
        return new Comment(id, author, created, text, updated);
    }
}
