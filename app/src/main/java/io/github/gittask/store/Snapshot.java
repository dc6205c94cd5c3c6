package io.github.gittask.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.eclipse.jgit.lib.ObjectId;

/**
 * The tree reachable from the task ref at one point in time.
 *
 * @param commitId the commit the ref pointed at; the expected value for the next compare-and-swap
 * @param entries blob content by path, in tree order
 */
public record Snapshot(ObjectId commitId, Map<String, byte[]> entries) {
    public Snapshot {
        entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }
}
