package com.cronhooks.schedule;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

/**
 * Keyed triggers guarded by a read/write lock. At most one trigger exists per key; installing
 * a new one cancels its predecessor inside the same critical section.
 */
public class TriggerRegistry<K, T extends ScheduledTrigger> {
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<K, T> triggers = new HashMap<>();

    /**
     * Stores {@code trigger} under {@code key}, cancelling any predecessor, and arms it when asked.
     * If arming throws, the new trigger is removed and cancelled before the exception propagates.
     */
    public void install(K key, T trigger, boolean arm) {
        lock.writeLock().lock();
        try {
            T previous = triggers.put(key, trigger);
            if (previous != null) {
                previous.cancel();
            }
            if (arm) {
                try {
                    trigger.arm();
                } catch (RuntimeException e) {
                    triggers.remove(key, trigger);
                    trigger.cancel();
                    throw e;
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Cancels and removes the trigger for {@code key}.
     *
     * @return true if there was one
     */
    public boolean remove(K key) {
        lock.writeLock().lock();
        try {
            T previous = triggers.remove(key);
            if (previous == null) {
                return false;
            }
            previous.cancel();
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Cancels and removes every trigger whose key matches.
     *
     * @return the number removed
     */
    public int removeIf(Predicate<K> keyFilter) {
        lock.writeLock().lock();
        try {
            int removed = 0;
            Iterator<Map.Entry<K, T>> it = triggers.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<K, T> entry = it.next();
                if (keyFilter.test(entry.getKey())) {
                    entry.getValue().cancel();
                    it.remove();
                    removed++;
                }
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Drops the entry only while it still maps to {@code trigger}; a replacement is left alone.
     */
    public boolean removeIfSame(K key, T trigger) {
        lock.writeLock().lock();
        try {
            return triggers.remove(key, trigger);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<T> get(K key) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(triggers.get(key));
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(K key) {
        lock.readLock().lock();
        try {
            return triggers.containsKey(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<K> keys() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(triggers.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Copy of the current triggers, for arming or disarming outside the lock.
     */
    public List<T> triggers() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(triggers.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return triggers.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
