package io.github.gittask.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.github.gittask.exception.NotFoundException;
import io.github.gittask.exception.StoreException;
import io.github.gittask.exception.ValidationException;
import io.github.gittask.model.StatusDefinition;
import io.github.gittask.util.Json;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * The ordered set of canonical statuses. The first entry is the starting status of new tasks. Stored as JSON
 * under {@code task.statuses}; absent means {@link #defaults()}.
 */
public final class StatusTable {
    private final List<StatusDefinition> statuses;

    public StatusTable(List<StatusDefinition> statuses) throws ValidationException {
        validate(statuses);
        this.statuses = List.copyOf(statuses);
    }

    public static StatusTable defaults() {
        try {
            return new StatusTable(List.of(
                    new StatusDefinition("OPEN", "o", "Red", false),
                    new StatusDefinition("IN_PROGRESS", "i", "Yellow", false),
                    new StatusDefinition("CLOSED", "c", "Green", true)));
        } catch (ValidationException e) {
            throw new AssertionError(e);
        }
    }

    public static StatusTable load(TaskConfig config) throws ValidationException {
        var json = config.values().get(TaskConfig.STATUSES);
        return json == null || json.isBlank() ? defaults() : fromJson(json);
    }

    public static StatusTable fromJson(String json) throws ValidationException {
        try {
            return new StatusTable(Json.fromJson(json, new TypeReference<List<StatusDefinition>>() {}));
        } catch (JsonProcessingException e) {
            throw new ValidationException("Invalid status table: " + e.getOriginalMessage(), e);
        }
    }

    public String toJson(boolean pretty) {
        try {
            return Json.toJson(statuses, pretty);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Status definitions must serialize", e);
        }
    }

    public void save(ConfigStore store) throws StoreException {
        store.set(TaskConfig.STATUSES, toJson(false));
    }

    public static void reset(ConfigStore store) throws StoreException {
        store.unset(TaskConfig.STATUSES);
    }

    public List<StatusDefinition> statuses() {
        return statuses;
    }

    public StatusDefinition starting() {
        return statuses.get(0);
    }

    public Optional<StatusDefinition> find(String name) {
        return statuses.stream().filter(s -> s.name().equals(name)).findFirst();
    }

    /** Matches the exact canonical name first, then the shortcut. */
    public Optional<StatusDefinition> resolve(String nameOrShortcut) {
        var byName = find(nameOrShortcut);
        if (byName.isPresent()) {
            return byName;
        }
        return statuses.stream().filter(s -> s.shortcut().equals(nameOrShortcut)).findFirst();
    }

    public String canonical(String nameOrShortcut) throws ValidationException {
        return resolve(nameOrShortcut)
                .map(StatusDefinition::name)
                .orElseThrow(() -> new ValidationException("Unknown status: " + nameOrShortcut));
    }

    public boolean isClosing(String name) {
        return find(name).map(StatusDefinition::closing).orElse(false);
    }

    public StatusTable add(StatusDefinition status) throws ValidationException {
        var updated = new ArrayList<>(statuses);
        updated.add(status);
        return new StatusTable(updated);
    }

    public StatusTable remove(String name) throws ValidationException, NotFoundException {
        var updated = new ArrayList<>(statuses);
        if (!updated.removeIf(s -> s.name().equals(name))) {
            throw new NotFoundException("Status " + name + " not found");
        }
        return new StatusTable(updated);
    }

    public static String getField(StatusDefinition status, String field) throws ValidationException {
        return switch (field.toLowerCase(Locale.ROOT)) {
            case "name" -> status.name();
            case "display", "display_name", "displayname" -> status.displayName() == null ? "" : status.displayName();
            case "shortcut" -> status.shortcut();
            case "color" -> status.color();
            case "style" -> status.style() == null ? "" : status.style();
            case "closing", "is_done" -> Boolean.toString(status.closing());
            default -> throw new ValidationException("Unknown status field: " + field);
        };
    }

    /** Replaces one field of the named status. */
    public StatusTable set(String name, String field, String value) throws ValidationException, NotFoundException {
        var current = find(name).orElseThrow(() -> new NotFoundException("Status " + name + " not found"));
        var changed = switch (field.toLowerCase(Locale.ROOT)) {
            case "name" -> new StatusDefinition(
                    value, current.displayName(), current.shortcut(), current.color(), current.style(), current.closing());
            case "display", "display_name", "displayname" -> new StatusDefinition(
                    current.name(), emptyToNull(value), current.shortcut(), current.color(), current.style(),
                    current.closing());
            case "shortcut" -> new StatusDefinition(
                    current.name(), current.displayName(), value, current.color(), current.style(), current.closing());
            case "color" -> new StatusDefinition(
                    current.name(), current.displayName(), current.shortcut(), value, current.style(), current.closing());
            case "style" -> new StatusDefinition(
                    current.name(), current.displayName(), current.shortcut(), current.color(), emptyToNull(value),
                    current.closing());
            case "closing", "is_done" -> new StatusDefinition(
                    current.name(), current.displayName(), current.shortcut(), current.color(), current.style(),
                    parseBoolean(value));
            default -> throw new ValidationException("Unknown status field: " + field);
        };
        var updated = new ArrayList<StatusDefinition>();
        for (StatusDefinition status : statuses) {
            updated.add(status.name().equals(name) ? changed : status);
        }
        return new StatusTable(updated);
    }

    private static boolean parseBoolean(String value) throws ValidationException {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true", "yes", "1" -> true;
            case "false", "no", "0" -> false;
            default -> throw new ValidationException("Expected true or false, got " + value);
        };
    }

    private static @Nullable String emptyToNull(String value) {
        return value.isBlank() ? null : value;
    }

    private static void validate(List<StatusDefinition> statuses) throws ValidationException {
        if (statuses.isEmpty()) {
            throw new ValidationException("At least one status must be defined");
        }
        var names = new HashSet<String>();
        var shortcuts = new HashSet<String>();
        for (StatusDefinition status : statuses) {
            if (status.name() == null || status.name().isBlank()) {
                throw new ValidationException("Status name must not be blank");
            }
            if (!names.add(status.name())) {
                throw new ValidationException("Duplicate status: " + status.name());
            }
            if (status.shortcut() == null || status.shortcut().length() != 1) {
                throw new ValidationException("Shortcut of " + status.name() + " must be a single character");
            }
            if (!shortcuts.add(status.shortcut())) {
                throw new ValidationException("Duplicate status shortcut: " + status.shortcut());
            }
        }
    }
}
