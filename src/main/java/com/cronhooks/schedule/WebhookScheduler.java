package com.cronhooks.schedule;

import akka.actor.typed.ActorRef;
import com.cronhooks.message.ExecutionMessages.ExecuteJob;
import com.cronhooks.message.ExecutionMessages.Trigger;
import com.cronhooks.model.Job;
import com.cronhooks.model.Reminder;
import com.cronhooks.repository.JobRepository;
import com.cronhooks.repository.NotFoundException;
import com.cronhooks.service.OutputCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the management layer: keeps cron triggers, reminder timers and the output cache
 * in line with the jobs it is given.
 */
public class WebhookScheduler {
    private static final Logger logger = LoggerFactory.getLogger(WebhookScheduler.class);

    private final JobRepository jobRepository;
    private final CronEngine cronEngine;
    private final ReminderManager reminderManager;
    private final OutputCache outputCache;
    private final ActorRef<Object> dispatcher;

    public WebhookScheduler(JobRepository jobRepository,
                            CronEngine cronEngine,
                            ReminderManager reminderManager,
                            OutputCache outputCache,
                            ActorRef<Object> dispatcher) {
        this.jobRepository = jobRepository;
        this.cronEngine = cronEngine;
        this.reminderManager = reminderManager;
        this.outputCache = outputCache;
        this.dispatcher = dispatcher;
    }

    public void start() {
        cronEngine.start();
        reminderManager.start();
        logger.info("🎯 Webhook scheduler started");
    }

    public void stop() {
        cronEngine.stop();
        reminderManager.stop();
        logger.info("Webhook scheduler stopped");
    }

    /**
     * Validates the schedule and (re)installs the job's cron trigger and reminder timers.
     * Disabled jobs keep their definition but get neither.
     *
     * @throws ScheduleParseException if the schedule is invalid; existing registrations are kept
     */
    public void addOrUpdateJob(Job job) throws ScheduleParseException {
        cronEngine.register(job);
        reminderManager.cancelAll(job.getId());

        if (!job.isEnabled()) {
            logger.info("Job {} is disabled, no triggers installed", job.getId());
            return;
        }

        int scheduled = 0;
        if (job.getReminders() != null) {
            for (Reminder reminder : job.getReminders()) {
                if (reminderManager.schedule(job, reminder)) {
                    scheduled++;
                }
            }
        }
        logger.info("Job {} registered with {} pending reminders", job.getId(), scheduled);
    }

    public void removeJob(String jobId) {
        cronEngine.unregister(jobId);
        reminderManager.cancelAll(jobId);
        outputCache.remove(jobId);
        logger.info("Removed job {} from the scheduler", jobId);
    }

    public void removeReminder(String jobId, String reminderId) {
        reminderManager.cancel(jobId, reminderId);
    }

    /**
     * Runs the job once, right away and asynchronously. The recurring schedule is not touched.
     *
     * @throws NotFoundException if the repository has no such job
     */
    public void testJob(String jobId) throws NotFoundException {
        Job job = jobRepository.getJob(jobId).orElseThrow(() -> NotFoundException.job(jobId));
        logger.info("Manual execution requested for job {}", jobId);
        dispatcher.tell(new ExecuteJob(job, Trigger.MANUAL));
    }

    /**
     * Registers every job in the repository. A job that fails to register is logged and skipped.
     *
     * @return the number of jobs registered
     */
    public int loadJobs() {
        int loaded = 0;
        for (Job job : jobRepository.getAllJobs()) {
            try {
                addOrUpdateJob(job);
                loaded++;
            } catch (ScheduleParseException e) {
                logger.error("❌ Failed to load job {}: {}", job.getId(), e.getMessage());
            } catch (RuntimeException e) {
                logger.error("❌ Failed to load job {}", job.getId(), e);
            }
        }
        logger.info("Loaded {} jobs", loaded);
        return loaded;
    }
}
