package io.github.gittask.config;

import io.github.gittask.exception.StoreException;
import io.github.gittask.exception.ValidationException;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.lib.StoredConfig;
import org.jetbrains.annotations.Nullable;

/**
 * {@link ConfigStore} over the repository's own git config. A key {@code a.b.c} maps to section {@code a},
 * subsection {@code b} and name {@code c}; middle segments beyond one are joined into the subsection, the way
 * {@code git config} treats them.
 */
public class GitConfigStore implements ConfigStore {
    private static final Logger logger = LogManager.getLogger(GitConfigStore.class);

    private final StoredConfig config;

    public GitConfigStore(StoredConfig config) {
        this.config = config;
    }

    record Key(String section, @Nullable String subsection, String name) {}

    static Key parseKey(String key) throws ValidationException {
        int first = key.indexOf('.');
        int last = key.lastIndexOf('.');
        if (first <= 0 || last == key.length() - 1) {
            throw new ValidationException("Invalid config key: " + key);
        }
        String section = key.substring(0, first);
        String name = key.substring(last + 1);
        String subsection = first == last ? null : key.substring(first + 1, last);
        return new Key(section, subsection, name);
    }

    @Override
    public Optional<String> get(String key) {
        try {
            var k = parseKey(key);
            return Optional.ofNullable(config.getString(k.section(), k.subsection(), k.name()));
        } catch (ValidationException e) {
            logger.debug("Ignoring lookup of malformed key {}", key);
            return Optional.empty();
        }
    }

    @Override
    public void set(String key, String value) throws StoreException {
        try {
            var k = parseKey(key);
            config.setString(k.section(), k.subsection(), k.name(), value);
            config.save();
            logger.debug("Set {}", key);
        } catch (ValidationException e) {
            throw new StoreException(e.getMessage(), new IOException(e));
        } catch (IOException e) {
            throw new StoreException("Failed to save " + key, e);
        }
    }

    @Override
    public boolean unset(String key) throws StoreException {
        try {
            var k = parseKey(key);
            if (config.getString(k.section(), k.subsection(), k.name()) == null) {
                return false;
            }
            config.unset(k.section(), k.subsection(), k.name());
            config.save();
            return true;
        } catch (ValidationException e) {
            return false;
        } catch (IOException e) {
            throw new StoreException("Failed to save removal of " + key, e);
        }
    }

    @Override
    public Map<String, String> entries() {
        var result = new LinkedHashMap<String, String>();
        String section = "task";
        for (String name : config.getNames(section)) {
            result.put(section + "." + name, config.getString(section, null, name));
        }
        for (String subsection : config.getSubsections(section)) {
            for (String name : config.getNames(section, subsection)) {
                result.put(section + "." + subsection + "." + name, config.getString(section, subsection, name));
            }
        }
        return result;
    }
}
