package com.conduit.monitor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

/**
 * Fixed-capacity history, oldest evicted first. Reads return copies in insertion order.
 */
public class SampleRingBuffer<T> {

    private final Object[] slots;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private int head;
    private int size;

    public SampleRingBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.slots = new Object[capacity];
    }

    public void add(T sample) {
        lock.writeLock().lock();
        try {
            slots[head] = sample;
            head = (head + 1) % slots.length;
            if (size < slots.length) {
                size++;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<T> snapshot() {
        lock.readLock().lock();
        try {
            return copyLast(size);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * The newest {@code count} samples, oldest first.
     */
    public List<T> latest(int count) {
        lock.readLock().lock();
        try {
            return copyLast(Math.min(count, size));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<T> latest() {
        lock.readLock().lock();
        try {
            if (size == 0) {
                return Optional.empty();
            }
            return Optional.of(at(size - 1));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Drops every sample matching {@code filter}, keeping the order of the rest.
     *
     * @return how many samples were dropped
     */
    public int removeIf(Predicate<T> filter) {
        lock.writeLock().lock();
        try {
            List<T> kept = new ArrayList<>(size);
            for (T sample : copyLast(size)) {
                if (!filter.test(sample)) {
                    kept.add(sample);
                }
            }
            int removed = size - kept.size();
            if (removed == 0) {
                return 0;
            }

            Arrays.fill(slots, null);
            for (int i = 0; i < kept.size(); i++) {
                slots[i] = kept.get(i);
            }
            size = kept.size();
            head = size % slots.length;
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return size;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int capacity() {
        return slots.length;
    }

    private List<T> copyLast(int count) {
        List<T> result = new ArrayList<>(count);
        for (int i = size - count; i < size; i++) {
            result.add(at(i));
        }
        return result;
    }

    /** i-th oldest sample. */
    @SuppressWarnings("unchecked")
    private T at(int i) {
        int start = (head - size + slots.length) % slots.length;
        return (T) slots[(start + i) % slots.length];
    }
}
