package com.ryuqq.resilience.adapter.inmemory.metrics;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only log with a fixed capacity.
 *
 * <p>When an append would exceed the capacity, the oldest entry is dropped. Append and trim happen
 * under the same lock, so readers never observe more than {@code capacity} entries.</p>
 *
 * @param <T> entry type
 * @author Resilience Team
 * @since 1.0.0
 */
public final class BoundedLog<T> {

    private final int capacity;
    private final ArrayDeque<T> entries;
    private final ReentrantLock lock = new ReentrantLock();

    public BoundedLog(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive (current: " + capacity + ")");
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    public void append(T entry) {
        if (entry == null) {
            throw new IllegalArgumentException("entry cannot be null");
        }
        lock.lock();
        try {
            entries.addLast(entry);
            while (entries.size() > capacity) {
                entries.pollFirst();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Latest entries, oldest first.
     *
     * @param limit maximum number of entries
     * @return at most {@code limit} most recent entries
     */
    public List<T> recent(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit cannot be negative (current: " + limit + ")");
        }
        lock.lock();
        try {
            int count = Math.min(limit, entries.size());
            List<T> result = new ArrayList<>(count);
            Iterator<T> newestFirst = entries.descendingIterator();
            for (int i = 0; i < count; i++) {
                result.add(newestFirst.next());
            }
            Collections.reverse(result);
            return result;
        } finally {
            lock.unlock();
        }
    }

    public List<T> snapshot() {
        lock.lock();
        try {
            return new ArrayList<>(entries);
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

    public int capacity() {
        return capacity;
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }
}
