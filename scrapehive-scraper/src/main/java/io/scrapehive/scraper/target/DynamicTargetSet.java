package io.scrapehive.scraper.target;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Targets found by discovery, keyed by a discovery-specific identity (for pods,
 * {@code namespace/name}).
 * <p>
 * Written by the discovery watcher and read by the {@link TargetResolver}. Every access holds the
 * lock only for the copy or merge itself.
 */
public class DynamicTargetSet {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, ScrapeTarget> targets = new LinkedHashMap<>();

    public void put(String key, ScrapeTarget target) {
        lock.lock();
        try {
            targets.put(key, target);
        } finally {
            lock.unlock();
        }
    }

    public void remove(String key) {
        lock.lock();
        try {
            targets.remove(key);
        } finally {
            lock.unlock();
        }
    }

    public void replaceAll(Map<String, ScrapeTarget> current) {
        Map<String, ScrapeTarget> copy = new LinkedHashMap<>(current);
        lock.lock();
        try {
            targets.clear();
            targets.putAll(copy);
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            targets.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Point-in-time copy of the current targets.
     */
    public List<ScrapeTarget> snapshot() {
        lock.lock();
        try {
            return new ArrayList<>(targets.values());
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return targets.size();
        } finally {
            lock.unlock();
        }
    }
}
