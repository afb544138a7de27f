package com.cronhooks.repository;

import com.cronhooks.model.Job;
import com.cronhooks.model.Reminder;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

public class InMemoryJobRepository implements JobRepository {
    protected final ReadWriteLock lock = new ReentrantReadWriteLock();
    protected final List<Job> jobs = new ArrayList<>();

    @Override
    public Optional<Job> getJob(String id) {
        lock.readLock().lock();
        try {
            return jobs.stream()
                    .filter(job -> job.getId().equals(id))
                    .findFirst()
                    .map(Job::new);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Job> getAllJobs() {
        lock.readLock().lock();
        try {
            return jobs.stream().map(Job::new).collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void upsertJob(Job job) {
        Objects.requireNonNull(job.getId(), "job id");
        Job copy = new Job(job);
        lock.writeLock().lock();
        try {
            for (int i = 0; i < jobs.size(); i++) {
                if (jobs.get(i).getId().equals(job.getId())) {
                    jobs.set(i, copy);
                    return;
                }
            }
            jobs.add(copy);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void deleteJob(String id) throws NotFoundException {
        lock.writeLock().lock();
        try {
            if (!jobs.removeIf(job -> job.getId().equals(id))) {
                throw NotFoundException.job(id);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void deleteReminder(String jobId, String reminderId) throws NotFoundException {
        lock.writeLock().lock();
        try {
            Job job = jobs.stream()
                    .filter(candidate -> candidate.getId().equals(jobId))
                    .findFirst()
                    .orElseThrow(() -> NotFoundException.job(jobId));

            Iterator<Reminder> it = job.getReminders().iterator();
            while (it.hasNext()) {
                if (it.next().getId().equals(reminderId)) {
                    it.remove();
                    return;
                }
            }
            throw NotFoundException.reminder(jobId, reminderId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Nothing to save for a purely in-memory store.
     */
    @Override
    public void persist() throws PersistenceException {
    }
}
