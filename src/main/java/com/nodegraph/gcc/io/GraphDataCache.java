package com.nodegraph.gcc.io;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide cache {@code (graphRootId, graphId) -> graphData}.
 *
 * <p>
 * A cross-call optimization only: a miss means recomputation, never an error.
 * All access is serialized by one lock.
 */
public final class GraphDataCache {
    private static final GraphDataCache SHARED = new GraphDataCache();

    private record Key(String graphRootId, String graphId) {
    }

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Key, Map<String, Object>> entries = new HashMap<>();

    public static GraphDataCache shared() {
        return SHARED;
    }

    public Map<String, Object> get(String graphRootId, String graphId) {
        lock.lock();
        try {
            return entries.get(new Key(graphRootId, graphId));
        } finally {
            lock.unlock();
        }
    }

    public void put(String graphRootId, String graphId, Map<String, Object> graphData) {
        lock.lock();
        try {
            entries.put(new Key(graphRootId, graphId), graphData);
        } finally {
            lock.unlock();
        }
    }

    public boolean evict(String graphRootId, String graphId) {
        lock.lock();
        try {
            return entries.remove(new Key(graphRootId, graphId)) != null;
        } finally {
            lock.unlock();
        }
    }

    /** Evicts every entry of {@code graphRootId} whose graph id starts with {@code prefix}. */
    public int evictByPrefix(String graphRootId, String prefix) {
        lock.lock();
        try {
            int before = entries.size();
            entries.keySet().removeIf(k -> k.graphRootId().equals(graphRootId) && k.graphId().startsWith(prefix));
            return before - entries.size();
        } finally {
            lock.unlock();
        }
    }

    /** Evicts every entry of {@code graphRootId} whose graph id ends with {@code suffix}. */
    public int evictBySuffix(String graphRootId, String suffix) {
        lock.lock();
        try {
            int before = entries.size();
            entries.keySet().removeIf(k -> k.graphRootId().equals(graphRootId) && k.graphId().endsWith(suffix));
            return before - entries.size();
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }
}
