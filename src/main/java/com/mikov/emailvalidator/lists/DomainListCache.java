package com.mikov.emailvalidator.lists;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loaded domain lists keyed by their location. Owned by whoever creates the
 * {@link DomainListFetcher}, so two fetchers never share loaded state.
 */
public final class DomainListCache {
    private final Map<String, List<String>> lists = new ConcurrentHashMap<>();

    public List<String> get(final String location) {
        return lists.get(location);
    }

    public void put(final String location, final List<String> domains) {
        lists.put(location, List.copyOf(domains));
    }

    public boolean contains(final String location) {
        return lists.containsKey(location);
    }

    public int size() {
        return lists.size();
    }

    public void clear() {
        lists.clear();
    }
}
