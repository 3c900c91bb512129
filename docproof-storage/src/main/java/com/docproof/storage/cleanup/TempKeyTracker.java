package com.docproof.storage.cleanup;

import com.docproof.storage.TempKeys;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Keys a run wrote to the temp store, so cleanup can remove exactly those. Thread-safe.
 * Only counts and categories should be logged, never the keys.
 */
public final class TempKeyTracker {

    private final Map<String, String> categoriesByKey = new LinkedHashMap<>();

    public synchronized void track(String key, String category) {
        categoriesByKey.put(key, category != null ? category : TempKeys.categoryOf(key));
    }

    public synchronized void untrack(String key) {
        categoriesByKey.remove(key);
    }

    /** Tracked keys in tracking order. */
    public synchronized List<String> keys() {
        return List.copyOf(categoriesByKey.keySet());
    }

    public synchronized String categoryOf(String key) {
        String c = categoriesByKey.get(key);
        return c != null ? c : TempKeys.categoryOf(key);
    }

    public synchronized int size() {
        return categoriesByKey.size();
    }

    /** Category → number of tracked keys, sorted by category. */
    public synchronized Map<String, Integer> countsByCategory() {
        Map<String, Integer> out = new TreeMap<>();
        for (String c : categoriesByKey.values()) {
            out.merge(c, 1, Integer::sum);
        }
        return out;
    }

    public synchronized void clear() {
        categoriesByKey.clear();
    }
}
