package io.github.gittask.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jetbrains.annotations.Nullable;

/**
 * A canonical task status.
 *
 * @param shortcut single character accepted wherever a status name is
 * @param closing whether a task in this status counts as done, which decides the remote open/closed state
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatusDefinition(
        String name,
        @Nullable String displayName,
        String shortcut,
        String color,
        @Nullable String style,
        boolean closing) {

    public StatusDefinition(String name, String shortcut, String color, boolean closing) {
        this(name, null, shortcut, color, null, closing);
    }

    public String label() {
        return displayName == null || displayName.isBlank() ? name : displayName;
    }
}
