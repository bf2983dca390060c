package com.healloop.core.memory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Fixed-capacity, append-only history that drops its oldest entry when full.
 * <p>
 * All access goes through one lock so concurrent executions never lose an append.
 * Reads return copies.
 */
public class BoundedHistory<T> {

    private final int capacity;
    private final Deque<T> entries;
    private final ReentrantLock lock = new ReentrantLock();

    public BoundedHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    public void append(T entry) {
        lock.lock();
        try {
            if (entries.size() >= capacity) {
                entries.removeFirst();
            }
            entries.addLast(entry);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Appends {@code entry} and counts the retained entries matching {@code filter},
     * the new entry included, under a single lock.
     */
    public long appendAndCount(T entry, Predicate<T> filter) {
        lock.lock();
        try {
            append(entry);
            return entries.stream().filter(filter).count();
        } finally {
            lock.unlock();
        }
    }

    /** Oldest first. */
    public List<T> snapshot() {
        lock.lock();
        try {
            return new ArrayList<>(entries);
        } finally {
            lock.unlock();
        }
    }

    /** The newest {@code limit} entries, oldest first. */
    public List<T> latest(int limit) {
        lock.lock();
        try {
            var all = new ArrayList<>(entries);
            int from = Math.max(0, all.size() - Math.max(0, limit));
            return new ArrayList<>(all.subList(from, all.size()));
        } finally {
            lock.unlock();
        }
    }

    public long count(Predicate<T> filter) {
        lock.lock();
        try {
            return entries.stream().filter(filter).count();
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
}
