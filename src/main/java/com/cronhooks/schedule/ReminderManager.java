package com.cronhooks.schedule;

import akka.actor.Cancellable;
import akka.actor.typed.ActorRef;
import akka.actor.typed.Scheduler;
import com.cronhooks.message.ExecutionMessages.ExecuteReminder;
import com.cronhooks.model.Job;
import com.cronhooks.model.Reminder;
import com.cronhooks.model.ReminderKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scala.concurrent.ExecutionContext;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * One-shot reminder timers keyed by (job id, reminder id).
 */
public class ReminderManager {
    private static final Logger logger = LoggerFactory.getLogger(ReminderManager.class);

    private final Scheduler scheduler;
    private final ExecutionContext executionContext;
    private final ActorRef<Object> dispatcher;
    private final Clock clock;
    private final TriggerRegistry<ReminderKey, ReminderTimer> timers = new TriggerRegistry<>();
    private volatile boolean running;

    public ReminderManager(Scheduler scheduler, ExecutionContext executionContext, ActorRef<Object> dispatcher, Clock clock) {
        this.scheduler = scheduler;
        this.executionContext = executionContext;
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    /**
     * Installs a timer for the reminder, replacing any timer with the same key. A reminder that is
     * not in the future is skipped and left in its job untouched.
     *
     * @return true if a timer was installed
     */
    public boolean schedule(Job job, Reminder reminder) {
        if (reminder.getDatetime() == null) {
            logger.warn("Reminder {} of job {} has no datetime, skipping", reminder.getId(), job.getId());
            return false;
        }

        Duration delay = Duration.between(clock.instant(), reminder.getDatetime().toInstant());
        if (delay.isNegative() || delay.isZero()) {
            logger.info("Reminder {} of job {} is in the past, skipping", reminder.getId(), job.getId());
            return false;
        }

        ReminderKey key = new ReminderKey(job.getId(), reminder.getId());
        boolean arm = running;
        // An armed timer waits for the delay accepted here even if the reminder falls due meanwhile
        timers.install(key, new ReminderTimer(key, new Job(job), new Reminder(reminder), arm ? delay : null), arm);
        logger.info("Scheduled reminder {} for job {} in {}", reminder.getId(), job.getId(), delay);
        return true;
    }

    public boolean cancel(String jobId, String reminderId) {
        boolean removed = timers.remove(new ReminderKey(jobId, reminderId));
        if (removed) {
            logger.info("Cancelled reminder {} of job {}", reminderId, jobId);
        }
        return removed;
    }

    public int cancelAll(String jobId) {
        int removed = timers.removeIf(key -> key.belongsTo(jobId));
        if (removed > 0) {
            logger.info("Cancelled {} reminders of job {}", removed, jobId);
        }
        return removed;
    }

    public boolean isScheduled(String jobId, String reminderId) {
        return timers.contains(new ReminderKey(jobId, reminderId));
    }

    /**
     * The datetime the reminder's timer is waiting for, empty when no timer is registered.
     */
    public Optional<OffsetDateTime> nextFireTime(String jobId, String reminderId) {
        return timers.get(new ReminderKey(jobId, reminderId)).map(timer -> timer.reminder.getDatetime());
    }

    public int scheduledCount() {
        return timers.size();
    }

    public void start() {
        running = true;
        List<ReminderTimer> all = timers.triggers();
        for (ReminderTimer timer : all) {
            try {
                timer.arm();
            } catch (RuntimeException e) {
                logger.error("❌ Could not arm reminder {} of job {}", timer.key.getReminderId(), timer.key.getJobId(), e);
            }
        }
        logger.info("Reminder manager started with {} timers", all.size());
    }

    /**
     * Halts firing; timers stay registered and are re-armed by {@link #start()}.
     */
    public void stop() {
        running = false;
        timers.triggers().forEach(ReminderTimer::disarm);
        logger.info("Reminder manager stopped");
    }

    class ReminderTimer implements ScheduledTrigger {
        private final ReminderKey key;
        private final Job job;
        private final Reminder reminder;
        private Cancellable pending;
        private long generation;
        private boolean done;
        private Duration acceptedDelay;

        ReminderTimer(ReminderKey key, Job job, Reminder reminder, Duration acceptedDelay) {
            this.key = key;
            this.job = job;
            this.reminder = reminder;
            this.acceptedDelay = acceptedDelay;
        }

        @Override
        public void arm() {
            boolean expired;
            synchronized (this) {
                if (done || pending != null) {
                    return;
                }
                Duration delay = acceptedDelay != null ? acceptedDelay : remaining();
                acceptedDelay = null;
                expired = delay.isNegative() || delay.isZero();
                if (expired) {
                    done = true;
                } else {
                    waitFor(delay, ++generation);
                }
            }
            if (expired) {
                // Passed while the engine was stopped
                logger.info("Reminder {} of job {} expired before it could be armed, dropping", key.getReminderId(), key.getJobId());
                timers.removeIfSame(key, this);
            }
        }

        private Duration remaining() {
            return Duration.between(clock.instant(), reminder.getDatetime().toInstant());
        }

        private void waitFor(Duration delay, long token) {
            if (delay.compareTo(MAX_TIMER_DELAY) > 0) {
                pending = scheduler.scheduleOnce(MAX_TIMER_DELAY, () -> wake(token), executionContext);
                return;
            }
            if (delay.isNegative()) {
                delay = Duration.ZERO;
            }
            pending = scheduler.scheduleOnce(delay, () -> fire(token), executionContext);
        }

        private synchronized void wake(long token) {
            if (done || token != generation || !running) {
                return;
            }
            waitFor(remaining(), token);
        }

        @Override
        public synchronized void disarm() {
            generation++;
            if (pending != null) {
                pending.cancel();
                pending = null;
            }
        }

        @Override
        public synchronized void cancel() {
            done = true;
            disarm();
        }

        private void fire(long token) {
            synchronized (this) {
                if (done || token != generation || !running) {
                    return;
                }
                done = true;
                pending = null;
            }
            timers.removeIfSame(key, this);
            logger.info("⏰ Reminder {} of job {} is due", key.getReminderId(), key.getJobId());
            dispatcher.tell(new ExecuteReminder(new Job(job), new Reminder(reminder)));
        }
    }
}
