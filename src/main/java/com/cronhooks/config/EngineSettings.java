package com.cronhooks.config;

import com.typesafe.config.Config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Settings read from the {@code cron-webhook} block of application.conf.
 */
public class EngineSettings {
    public static final String WEBHOOK_DISPATCHER_PATH = "cron-webhook.webhook-dispatcher";

    private final Path jobsFile;
    private final Duration defaultTimeout;
    private final Duration connectTimeout;
    private final int maxConcurrentExecutions;
    private final int maxQueuedExecutions;

    public EngineSettings(Path jobsFile, Duration defaultTimeout, Duration connectTimeout,
                          int maxConcurrentExecutions, int maxQueuedExecutions) {
        this.jobsFile = jobsFile;
        this.defaultTimeout = defaultTimeout;
        this.connectTimeout = connectTimeout;
        this.maxConcurrentExecutions = maxConcurrentExecutions;
        this.maxQueuedExecutions = maxQueuedExecutions;
    }

    public static EngineSettings fromConfig(Config config) {
        Config root = config.getConfig("cron-webhook");
        return new EngineSettings(
            Paths.get(root.getString("jobs-file")),
            root.getDuration("webhook.default-timeout"),
            root.getDuration("webhook.connect-timeout"),
            root.getInt("dispatcher.max-concurrent"),
            root.getInt("dispatcher.max-queued")
        );
    }

    public Path getJobsFile() { return jobsFile; }
    public Duration getDefaultTimeout() { return defaultTimeout; }
    public Duration getConnectTimeout() { return connectTimeout; }
    public int getMaxConcurrentExecutions() { return maxConcurrentExecutions; }
    public int getMaxQueuedExecutions() { return maxQueuedExecutions; }

    @Override
    public String toString() {
        return "EngineSettings{" +
                "jobsFile=" + jobsFile +
                ", defaultTimeout=" + defaultTimeout +
                ", connectTimeout=" + connectTimeout +
                ", maxConcurrentExecutions=" + maxConcurrentExecutions +
                ", maxQueuedExecutions=" + maxQueuedExecutions +
                '}';
    }
}
