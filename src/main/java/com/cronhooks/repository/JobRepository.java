package com.cronhooks.repository;

import com.cronhooks.model.Job;

import java.util.List;
import java.util.Optional;

/**
 * Storage for job definitions. Every job handed out is a copy the caller may freely modify.
 */
public interface JobRepository {

    Optional<Job> getJob(String id);

    /**
     * Snapshot of all jobs in insertion order.
     */
    List<Job> getAllJobs();

    /**
     * Inserts the job or replaces the existing job with the same id.
     */
    void upsertJob(Job job);

    void deleteJob(String id) throws NotFoundException;

    void deleteReminder(String jobId, String reminderId) throws NotFoundException;

    /**
     * Durably saves the current state.
     */
    void persist() throws PersistenceException;
}
