package com.projectdesk;

import java.io.IOException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One lock per (project, relative path). Operations on different paths never contend.
 * A path's entry lives only while some thread holds or waits for it.
 */
public class PathLocks {

    @FunctionalInterface
    public interface LockedAction<T> {
        T run() throws IOException;
    }

    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        // guarded by the map's per-key compute
        private int users;
    }

    private final ConcurrentHashMap<String, Entry> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String projectId, String relativePath, LockedAction<T> action) throws IOException {
        String key = key(projectId, relativePath);
        Entry entry = locks.compute(key, (k, existing) -> {
            Entry e = existing != null ? existing : new Entry();
            e.users++;
            return e;
        });
        entry.lock.lock();
        try {
            return action.run();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(key, (k, e) -> --e.users == 0 ? null : e);
        }
    }

    int trackedPaths() {
        return locks.size();
    }

    private static String key(String projectId, String relativePath) {
        return projectId + '\u0000' + relativePath;
    }
}
