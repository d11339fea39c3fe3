package io.syncbeat.core;

import java.util.Map;
import java.util.TreeMap;

/**
 * Test double for the shared schedule store.
 */
public class InMemoryScheduleStore implements ScheduleStore {

    private final Map<String, String> entries = new TreeMap<>();
    private boolean unavailable;
    private int reads;

    @Override
    public synchronized void addOrReplace(String name, String serializedSpec) {
        entries.put(name, serializedSpec);
    }

    @Override
    public synchronized boolean remove(String name) {
        return entries.remove(name) != null;
    }

    @Override
    public synchronized Map<String, String> listAll() {
        reads++;
        if (unavailable) {
            throw new ScheduleStoreUnavailableException("store down", new IllegalStateException("connection refused"));
        }
        return new TreeMap<>(entries);
    }

    public synchronized void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    public synchronized int reads() {
        return reads;
    }
}
