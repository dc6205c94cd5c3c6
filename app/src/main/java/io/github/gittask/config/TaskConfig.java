package io.github.gittask.config;

import io.github.gittask.remote.TrackerKind;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import org.jetbrains.annotations.Nullable;

/**
 * Immutable view of the {@code task.*} settings plus the environment, handed explicitly to the repository, the
 * sync engine and the CLI. Missing keys fall back to {@link #DEFAULTS}.
 */
public final class TaskConfig {
    public static final String REF = "task.ref";
    public static final String LIST_SORT = "task.list.sort";
    public static final String LIST_COLUMNS = "task.list.columns";
    public static final String STATUS_OPEN = "task.status.open";
    public static final String STATUS_CLOSED = "task.status.closed";
    public static final String STATUSES = "task.statuses";
    public static final String PROPERTIES = "task.properties";

    public static final String DEFAULT_REF = "refs/tasks/tasks";

    public static final Map<String, String> DEFAULTS;

    static {
        var defaults = new LinkedHashMap<String, String>();
        defaults.put(REF, DEFAULT_REF);
        defaults.put(LIST_COLUMNS, "id, created, status, name");
        defaults.put(LIST_SORT, "id desc");
        defaults.put(STATUS_OPEN, "OPEN");
        defaults.put(STATUS_CLOSED, "CLOSED");
        DEFAULTS = Collections.unmodifiableMap(defaults);
    }

    private final Map<String, String> values;
    private final Function<String, @Nullable String> env;

    private TaskConfig(Map<String, String> values, Function<String, @Nullable String> env) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.env = env;
    }

    public static TaskConfig load(ConfigStore store) {
        return load(store, System::getenv);
    }

    public static TaskConfig load(ConfigStore store, Function<String, @Nullable String> env) {
        return new TaskConfig(store.entries(), env);
    }

    /** Config without any environment, mostly for tests. */
    public static TaskConfig of(Map<String, String> values) {
        return new TaskConfig(values, name -> null);
    }

    public TaskConfig with(String key, String value) {
        var copy = new LinkedHashMap<>(values);
        copy.put(key, value);
        return new TaskConfig(copy, env);
    }

    public Optional<String> get(String key) {
        String value = values.get(key);
        if (value == null) {
            value = DEFAULTS.get(key);
        }
        return Optional.ofNullable(value);
    }

    public String getOrDefault(String key, String fallback) {
        return get(key).orElse(fallback);
    }

    /** Explicitly configured entries only, without defaults. */
    public Map<String, String> values() {
        return values;
    }

    public String ref() {
        return normalizeRef(getOrDefault(REF, DEFAULT_REF));
    }

    public List<String> listColumns() {
        return splitList(getOrDefault(LIST_COLUMNS, DEFAULTS.get(LIST_COLUMNS)));
    }

    public String listSort() {
        return getOrDefault(LIST_SORT, DEFAULTS.get(LIST_SORT));
    }

    /** Status given to tasks whose remote issue is open; {@code task.<kind>.status.open} wins over the global key. */
    public String openStatus(TrackerKind kind) {
        return get("task." + kind.key() + ".status.open").orElseGet(() -> getOrDefault(STATUS_OPEN, "OPEN"));
    }

    public String closedStatus(TrackerKind kind) {
        return get("task." + kind.key() + ".status.closed").orElseGet(() -> getOrDefault(STATUS_CLOSED, "CLOSED"));
    }

    /** First non-blank environment variable among {@code names}. */
    public Optional<String> env(String... names) {
        for (String name : names) {
            String value = env.apply(name);
            if (value != null && !value.isBlank()) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    /** A config key, falling back to the given environment variables. */
    public Optional<String> setting(String key, String... envNames) {
        var value = get(key).filter(v -> !v.isBlank());
        return value.isPresent() ? value : env(envNames);
    }

    /**
     * Expands a short ref name: {@code foo} becomes the branch {@code refs/heads/foo}, {@code tasks/foo} becomes
     * {@code refs/tasks/foo}, and full names are kept.
     */
    public static String normalizeRef(String ref) {
        String trimmed = ref.trim();
        if (trimmed.startsWith("refs/")) {
            return trimmed;
        }
        if (!trimmed.contains("/")) {
            return "refs/heads/" + trimmed;
        }
        return "refs/" + trimmed;
    }

    static List<String> splitList(String text) {
        return Arrays.stream(text.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
