package io.github.gittask.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** In-memory {@link ConfigStore}, for repositories without a config file and for tests. */
public class MapConfigStore implements ConfigStore {
    private final Map<String, String> values = new LinkedHashMap<>();

    public MapConfigStore() {}

    public MapConfigStore(Map<String, String> initial) {
        values.putAll(initial);
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public void set(String key, String value) {
        values.put(key, value);
    }

    @Override
    public boolean unset(String key) {
        return values.remove(key) != null;
    }

    @Override
    public Map<String, String> entries() {
        return Collections.unmodifiableMap(values);
    }
}
