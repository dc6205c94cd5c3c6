package io.github.gittask.model;

import io.github.gittask.remote.TrackerKind;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

public record Label(String name, String color, @Nullable String description, Map<TrackerKind, String> links) {
    public static final String DEFAULT_COLOR = "White";

    public Label {
        links = links.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(links));
    }

    public Label(String name, String color, @Nullable String description) {
        this(name, color, description, Map.of());
    }

    public static Label named(String name) {
        return new Label(name, DEFAULT_COLOR, null);
    }

    public Optional<String> link(TrackerKind kind) {
        return Optional.ofNullable(links.get(kind));
    }

    public Label withLink(TrackerKind kind, String remoteId) {
        var updated = new EnumMap<TrackerKind, String>(TrackerKind.class);
        updated.putAll(links);
        updated.put(kind, remoteId);
        return new Label(name, color, description, updated);
    }
}
