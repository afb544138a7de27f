package com.cronhooks;

import akka.actor.typed.ActorSystem;
import akka.actor.typed.DispatcherSelector;

import com.cronhooks.actor.JobDispatcherActor;
import com.cronhooks.config.EngineSettings;
import com.cronhooks.repository.PersistenceException;
import com.cronhooks.repository.YamlFileJobRepository;
import com.cronhooks.schedule.CronEngine;
import com.cronhooks.schedule.ReminderManager;
import com.cronhooks.schedule.WebhookScheduler;
import com.cronhooks.service.*;
import com.cronhooks.template.TemplateEngine;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        // Load configuration
        Config config = ConfigFactory.load();
        EngineSettings settings = EngineSettings.fromConfig(config);
        logger.info("Starting with {}", settings);

        YamlFileJobRepository jobRepository = new YamlFileJobRepository(settings.getJobsFile());
        try {
            jobRepository.load();
        } catch (PersistenceException e) {
            logger.error("Failed to load jobs from {}: {}", settings.getJobsFile(), e.getMessage(), e);
            System.exit(1);
        }

        // Create services
        WebhookExecutor webhookExecutor = new WebhookExecutor(settings.getDefaultTimeout(), settings.getConnectTimeout());
        VariableExtractor variableExtractor = new VariableExtractor();
        TemplateEngine templateEngine = new TemplateEngine();
        OutputCache outputCache = new OutputCache();

        JobRunner jobRunner = new JobRunner(webhookExecutor, variableExtractor, templateEngine, outputCache);
        ReminderRunner reminderRunner = new ReminderRunner(webhookExecutor, variableExtractor, templateEngine,
            outputCache, jobRepository);

        // The guardian is the dispatcher every trigger reports to
        ActorSystem<Object> system = ActorSystem.create(
            JobDispatcherActor.create(
                jobRunner,
                reminderRunner,
                DispatcherSelector.fromConfig(EngineSettings.WEBHOOK_DISPATCHER_PATH),
                settings.getMaxConcurrentExecutions(),
                settings.getMaxQueuedExecutions()
            ),
            "cron-webhook-system",
            config
        );

        Clock clock = Clock.systemDefaultZone();
        CronEngine cronEngine = new CronEngine(system.scheduler(), system.executionContext(), system, clock);
        ReminderManager reminderManager = new ReminderManager(system.scheduler(), system.executionContext(), system, clock);
        WebhookScheduler scheduler = new WebhookScheduler(jobRepository, cronEngine, reminderManager, outputCache, system);

        int loaded = scheduler.loadJobs();
        scheduler.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown hook triggered, stopping scheduler...");
            scheduler.stop();
            system.terminate();
            logger.info("Cron webhook service shutdown complete");
        }));

        logger.info("🎯 Cron webhook service started with {} jobs from {}", loaded, settings.getJobsFile());
        logger.info("⏹️  Press Ctrl+C to stop the application");

        try {
            system.getWhenTerminated().toCompletableFuture().join();
        } catch (RuntimeException e) {
            logger.error("Actor system terminated abnormally: {}", e.getMessage(), e);
        }
    }
}
