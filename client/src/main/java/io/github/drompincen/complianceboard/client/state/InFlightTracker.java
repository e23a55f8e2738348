package io.github.drompincen.complianceboard.client.state;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Busy flags keyed per entity, e.g. {@code auditor:run:<id>}, so that one busy auditor does not disable the
 * controls of another.
 */
public class InFlightTracker {

    private final Set<String> busy = ConcurrentHashMap.newKeySet();

    public static String key(String entity, String action, String id) {
        return entity + ":" + action + ":" + id;
    }

    /** Marks the key busy. Returns false when it already was. */
    public boolean begin(String key) {
        return busy.add(key);
    }

    public void end(String key) {
        busy.remove(key);
    }

    public boolean isBusy(String key) {
        return busy.contains(key);
    }

    public int size() {
        return busy.size();
    }
}
