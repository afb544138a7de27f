package com.cronhooks.schedule;

import akka.actor.Cancellable;
import akka.actor.typed.ActorRef;
import akka.actor.typed.Scheduler;
import com.cronhooks.message.ExecutionMessages.ExecuteJob;
import com.cronhooks.message.ExecutionMessages.Trigger;
import com.cronhooks.model.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scala.concurrent.ExecutionContext;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Recurring cron triggers, one per job id. Each firing sends a snapshot of the job to the dispatcher
 * and re-arms for the following fire time.
 */
public class CronEngine {
    private static final Logger logger = LoggerFactory.getLogger(CronEngine.class);

    private final Scheduler scheduler;
    private final ExecutionContext executionContext;
    private final ActorRef<Object> dispatcher;
    private final Clock clock;
    private final TriggerRegistry<String, CronTrigger> triggers = new TriggerRegistry<>();
    private volatile boolean running;

    public CronEngine(Scheduler scheduler, ExecutionContext executionContext, ActorRef<Object> dispatcher, Clock clock) {
        this.scheduler = scheduler;
        this.executionContext = executionContext;
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    /**
     * Installs or replaces the trigger for {@code job}. A disabled job only loses its existing trigger.
     *
     * @throws ScheduleParseException if the schedule is not a valid cron expression; nothing changes then
     */
    public void register(Job job) throws ScheduleParseException {
        CronSchedule schedule = CronSchedule.parse(job.getSchedule());

        if (!job.isEnabled()) {
            if (triggers.remove(job.getId())) {
                logger.info("Job {} is disabled, removed its cron trigger", job.getId());
            }
            return;
        }

        triggers.install(job.getId(), new CronTrigger(new Job(job), schedule), running);
        logger.info("Registered job {} with schedule '{}'", job.getId(), schedule);
    }

    public void unregister(String jobId) {
        if (triggers.remove(jobId)) {
            logger.info("Unregistered cron trigger for job {}", jobId);
        }
    }

    public boolean isRegistered(String jobId) {
        return triggers.contains(jobId);
    }

    public List<String> registeredJobIds() {
        return triggers.keys();
    }

    /**
     * The instant the job's trigger is currently waiting for, empty when unknown or not armed.
     */
    public Optional<ZonedDateTime> nextFireTime(String jobId) {
        return triggers.get(jobId).flatMap(CronTrigger::getNextFire);
    }

    public void start() {
        running = true;
        List<CronTrigger> all = triggers.triggers();
        for (CronTrigger trigger : all) {
            try {
                trigger.arm();
            } catch (RuntimeException e) {
                logger.error("❌ Could not arm cron trigger for job {}", trigger.job.getId(), e);
            }
        }
        logger.info("Cron engine started with {} triggers", all.size());
    }

    /**
     * Halts firing; registrations stay and are re-armed by {@link #start()}.
     */
    public void stop() {
        running = false;
        triggers.triggers().forEach(CronTrigger::disarm);
        logger.info("Cron engine stopped");
    }

    public boolean isRunning() {
        return running;
    }

    class CronTrigger implements ScheduledTrigger {
        private final Job job;
        private final CronSchedule schedule;
        private Cancellable pending;
        private ZonedDateTime nextFire;
        private ZonedDateTime lastFire;
        private long generation;
        private boolean cancelled;

        CronTrigger(Job job, CronSchedule schedule) {
            this.job = job;
            this.schedule = schedule;
        }

        @Override
        public synchronized void arm() {
            if (cancelled || pending != null) {
                return;
            }
            scheduleNext();
        }

        @Override
        public synchronized void disarm() {
            generation++;
            if (pending != null) {
                pending.cancel();
                pending = null;
            }
            nextFire = null;
        }

        @Override
        public synchronized void cancel() {
            cancelled = true;
            disarm();
        }

        synchronized Optional<ZonedDateTime> getNextFire() {
            return Optional.ofNullable(nextFire);
        }

        private void scheduleNext() {
            ZonedDateTime now = ZonedDateTime.now(clock);
            // Never pick the same slot twice if the timer went off a little early
            ZonedDateTime from = lastFire != null && !now.isAfter(lastFire) ? lastFire : now;
            Optional<ZonedDateTime> next = schedule.nextExecution(from);
            if (next.isEmpty()) {
                logger.warn("Schedule '{}' of job {} has no future fire time", schedule, job.getId());
                return;
            }

            nextFire = next.get();
            waitUntilNextFire(now, ++generation);
            logger.debug("Job {} next fires at {}", job.getId(), nextFire);
        }

        private void waitUntilNextFire(ZonedDateTime now, long token) {
            Duration delay = Duration.between(now, nextFire);
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
            if (cancelled || token != generation || !running) {
                return;
            }
            waitUntilNextFire(ZonedDateTime.now(clock), token);
        }

        private synchronized void fire(long token) {
            if (cancelled || token != generation || !running) {
                return;
            }
            pending = null;
            lastFire = nextFire;
            logger.info("⏰ Cron trigger fired for job {}", job.getId());
            dispatcher.tell(new ExecuteJob(new Job(job), Trigger.CRON));
            scheduleNext();
        }
    }
}
