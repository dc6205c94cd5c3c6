package io.github.gittask.config;

import io.github.gittask.exception.StoreException;
import java.util.Map;
import java.util.Optional;

/** Named key/value settings, e.g. {@code task.list.sort}. */
public interface ConfigStore {
    Optional<String> get(String key);

    void set(String key, String value) throws StoreException;

    /** @return whether the key was present */
    boolean unset(String key) throws StoreException;

    /** All entries under the {@code task} section. */
    Map<String, String> entries();
}
