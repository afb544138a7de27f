package com.cronhooks.service;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Most recent primary webhook response per job id.
 */
public class OutputCache {
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, String> outputs = new HashMap<>();

    public void put(String jobId, String output) {
        lock.writeLock().lock();
        try {
            outputs.put(jobId, output);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<String> get(String jobId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(outputs.get(jobId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public void remove(String jobId) {
        lock.writeLock().lock();
        try {
            outputs.remove(jobId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return outputs.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
