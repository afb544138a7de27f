package com.cronhooks.schedule;

import akka.actor.testkit.typed.javadsl.ActorTestKit;
import akka.actor.testkit.typed.javadsl.TestProbe;
import com.cronhooks.message.ExecutionMessages.ExecuteJob;
import com.cronhooks.message.ExecutionMessages.ExecuteReminder;
import com.cronhooks.message.ExecutionMessages.Trigger;
import com.cronhooks.model.Job;
import com.cronhooks.model.Reminder;
import com.cronhooks.repository.InMemoryJobRepository;
import com.cronhooks.repository.NotFoundException;
import com.cronhooks.service.OutputCache;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebhookSchedulerTest {

    private static final ActorTestKit testKit = ActorTestKit.create(ConfigFactory.load());

    private TestProbe<Object> dispatcher;
    private InMemoryJobRepository repository;
    private CronEngine cronEngine;
    private ReminderManager reminderManager;
    private OutputCache cache;
    private WebhookScheduler scheduler;

    @AfterAll
    static void cleanup() {
        testKit.shutdownTestKit();
    }

    @BeforeEach
    void setUp() {
        dispatcher = testKit.createTestProbe(Object.class);
        repository = new InMemoryJobRepository();
        Clock clock = Clock.systemUTC();
        cronEngine = new CronEngine(testKit.system().scheduler(), testKit.system().executionContext(), dispatcher.getRef(), clock);
        reminderManager = new ReminderManager(testKit.system().scheduler(), testKit.system().executionContext(), dispatcher.getRef(), clock);
        cache = new OutputCache();
        scheduler = new WebhookScheduler(repository, cronEngine, reminderManager, cache, dispatcher.getRef());
        scheduler.start();
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
    }

    @Test
    void addOrUpdateRegistersTriggerAndFutureReminders() throws Exception {
        Job job = CronEngineTest.job("job-1", "0 9 * * *");
        job.getReminders().add(new Reminder("future", "soon", OffsetDateTime.now().plusHours(1)));
        job.getReminders().add(new Reminder("past", "gone", OffsetDateTime.now().minusHours(1)));

        scheduler.addOrUpdateJob(job);

        assertThat(cronEngine.isRegistered("job-1")).isTrue();
        assertThat(reminderManager.isScheduled("job-1", "future")).isTrue();
        assertThat(reminderManager.isScheduled("job-1", "past")).isFalse();
    }

    @Test
    void updateDropsRemindersNoLongerListed() throws Exception {
        Job job = CronEngineTest.job("job-1", "0 9 * * *");
        job.getReminders().add(new Reminder("a", "first", OffsetDateTime.now().plusHours(1)));
        scheduler.addOrUpdateJob(job);

        job.getReminders().clear();
        job.getReminders().add(new Reminder("b", "second", OffsetDateTime.now().plusHours(1)));
        scheduler.addOrUpdateJob(job);

        assertThat(reminderManager.isScheduled("job-1", "a")).isFalse();
        assertThat(reminderManager.isScheduled("job-1", "b")).isTrue();
    }

    @Test
    void disabledJobGetsNoTriggers() throws Exception {
        Job job = CronEngineTest.job("job-1", "0 9 * * *");
        job.getReminders().add(new Reminder("a", "first", OffsetDateTime.now().plusHours(1)));
        scheduler.addOrUpdateJob(job);

        job.setEnabled(false);
        scheduler.addOrUpdateJob(job);

        assertThat(cronEngine.isRegistered("job-1")).isFalse();
        assertThat(reminderManager.scheduledCount()).isZero();
    }

    @Test
    void invalidScheduleLeavesPreviousRegistration() throws Exception {
        Job job = CronEngineTest.job("job-1", "0 9 * * *");
        job.getReminders().add(new Reminder("a", "first", OffsetDateTime.now().plusHours(1)));
        scheduler.addOrUpdateJob(job);

        Job broken = CronEngineTest.job("job-1", "every day");
        assertThatThrownBy(() -> scheduler.addOrUpdateJob(broken)).isInstanceOf(ScheduleParseException.class);

        assertThat(cronEngine.isRegistered("job-1")).isTrue();
        assertThat(reminderManager.isScheduled("job-1", "a")).isTrue();
    }

    @Test
    void removeJobCancelsEverything() throws Exception {
        Job job = CronEngineTest.job("job-1", "0 9 * * *");
        job.getReminders().add(new Reminder("a", "first", OffsetDateTime.now().plusHours(1)));
        scheduler.addOrUpdateJob(job);
        cache.put("job-1", "{}");

        scheduler.removeJob("job-1");
        scheduler.removeJob("job-1");

        assertThat(cronEngine.isRegistered("job-1")).isFalse();
        assertThat(reminderManager.scheduledCount()).isZero();
        assertThat(cache.get("job-1")).isEmpty();
    }

    @Test
    void removedJobsPendingReminderNeverFires() throws Exception {
        Job job = CronEngineTest.job("job-1", "0 9 * * *");
        job.getReminders().add(new Reminder("a", "first", OffsetDateTime.now().plus(Duration.ofMillis(400))));
        scheduler.addOrUpdateJob(job);

        scheduler.removeJob("job-1");

        dispatcher.expectNoMessage(Duration.ofMillis(800));
    }

    @Test
    void removeReminderCancelsOnlyThatTimer() throws Exception {
        Job job = CronEngineTest.job("job-1", "0 9 * * *");
        job.getReminders().add(new Reminder("a", "first", OffsetDateTime.now().plus(Duration.ofMillis(400))));
        job.getReminders().add(new Reminder("b", "second", OffsetDateTime.now().plusHours(1)));
        scheduler.addOrUpdateJob(job);

        scheduler.removeReminder("job-1", "a");

        assertThat(reminderManager.isScheduled("job-1", "b")).isTrue();
        dispatcher.expectNoMessage(Duration.ofMillis(800));
    }

    @Test
    void scheduledReminderReachesDispatcher() throws Exception {
        Job job = CronEngineTest.job("job-1", "0 9 * * *");
        job.getReminders().add(new Reminder("a", "first", OffsetDateTime.now().plus(Duration.ofMillis(300))));
        scheduler.addOrUpdateJob(job);

        ExecuteReminder fired = dispatcher.expectMessageClass(ExecuteReminder.class, Duration.ofSeconds(3));
        assertThat(fired.getReminder().getId()).isEqualTo("a");
    }

    @Test
    void testJobSendsManualExecution() throws Exception {
        repository.upsertJob(CronEngineTest.job("job-1", "0 9 * * *"));

        scheduler.testJob("job-1");

        ExecuteJob execution = dispatcher.expectMessageClass(ExecuteJob.class);
        assertThat(execution.getTrigger()).isEqualTo(Trigger.MANUAL);
        assertThat(execution.getJob().getId()).isEqualTo("job-1");
    }

    @Test
    void testJobOnUnknownIdFails() {
        assertThatThrownBy(() -> scheduler.testJob("missing"))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining("missing");
        dispatcher.expectNoMessage(Duration.ofMillis(200));
    }

    @Test
    void loadJobsSkipsBrokenDefinitions() {
        repository.upsertJob(CronEngineTest.job("good", "*/10 * * * *"));
        repository.upsertJob(CronEngineTest.job("bad", "not cron"));

        assertThat(scheduler.loadJobs()).isEqualTo(1);
        assertThat(cronEngine.registeredJobIds()).containsExactly("good");
    }
}
