package io.github.gittask.remote;

import java.util.Locale;
import org.jetbrains.annotations.Nullable;

public enum TrackerKind {
    GITHUB,
    GITLAB,
    JIRA,
    REDMINE;

    public String getDisplayName() {
        return switch (this) {
            case GITHUB -> "GitHub";
            case GITLAB -> "GitLab";
            case JIRA -> "Jira";
            case REDMINE -> "Redmine";
        };
    }

    /** Key used for this kind in stored remote links and in {@code task.<key>.*} config entries. */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static @Nullable TrackerKind fromString(@Nullable String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        for (TrackerKind kind : values()) {
            if (kind.name().equalsIgnoreCase(text.trim())
                    || kind.getDisplayName().equalsIgnoreCase(text.trim())) {
                return kind;
            }
        }
        return null;
    }
}
