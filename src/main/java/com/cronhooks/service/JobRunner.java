package com.cronhooks.service;

import com.cronhooks.model.Job;
import com.cronhooks.model.WebhookConfig;
import com.cronhooks.service.ExecutionResult.SecondaryOutcome;
import com.cronhooks.template.TemplateEngine;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * Runs a job's primary webhook and, when configured, the secondary webhook fed from the
 * primary response. Errors are logged and folded into the returned {@link ExecutionResult}.
 */
public class JobRunner {
    private static final Logger logger = LoggerFactory.getLogger(JobRunner.class);

    private final WebhookExecutor webhookExecutor;
    private final VariableExtractor variableExtractor;
    private final TemplateEngine templateEngine;
    private final OutputCache outputCache;

    public JobRunner(WebhookExecutor webhookExecutor,
                     VariableExtractor variableExtractor,
                     TemplateEngine templateEngine,
                     OutputCache outputCache) {
        this.webhookExecutor = webhookExecutor;
        this.variableExtractor = variableExtractor;
        this.templateEngine = templateEngine;
        this.outputCache = outputCache;
    }

    public ExecutionResult run(Job job) {
        logger.info("🚀 Executing job: {} (ID: {})", job.getName(), job.getId());

        String output;
        try {
            output = webhookExecutor.execute(job.getPrimary());
        } catch (WebhookException e) {
            logger.error("❌ Primary webhook failed for job {}: {}", job.getId(), e.getMessage());
            return new ExecutionResult(job.getId(), false, null, SecondaryOutcome.SKIPPED, null, e.getMessage());
        }
        logger.info("✅ Primary webhook succeeded for job {}", job.getId());

        if (job.isSaveOutput() && !output.isEmpty()) {
            outputCache.put(job.getId(), output);
            logger.debug("Saved output for job {} ({} chars)", job.getId(), output.length());
        } else if (job.isSaveOutput()) {
            logger.info("No output to save for job {}", job.getId());
        }

        WebhookConfig secondary = job.getSecondary();
        if (secondary == null) {
            logger.debug("No secondary webhook configured for job {}", job.getId());
            return finished(job, output, SecondaryOutcome.NOT_CONFIGURED, null, null);
        }
        if (!secondary.isEnabled()) {
            logger.info("Secondary webhook is disabled for job {}", job.getId());
            return finished(job, output, SecondaryOutcome.DISABLED, null, null);
        }

        String body;
        if (job.isSaveOutput()) {
            Optional<String> cached = outputCache.get(job.getId());
            if (cached.isEmpty()) {
                logger.warn("No saved output available for job {}, skipping secondary webhook", job.getId());
                return finished(job, output, SecondaryOutcome.SKIPPED, null, null);
            }

            Map<String, JsonNode> variables = extractQuietly(job.getId(), cached.get(), secondary);
            if (secondary.isOnlyIfVarsNonEmpty() && secondary.hasJqSelectors()
                    && !VariableExtractor.hasNonEmptyValue(variables)) {
                logger.info("Extracted variables are empty for job {}, skipping secondary webhook", job.getId());
                return finished(job, output, SecondaryOutcome.SKIPPED, null, null);
            }

            if (secondary.hasBodyTemplate()) {
                body = templateEngine.render(secondary.getBodyTemplate(), variables);
                logger.debug("Rendered secondary body template for job {}: {}", job.getId(), body);
            } else {
                body = cached.get();
                logger.debug("Using raw saved output as secondary body for job {}", job.getId());
            }
        } else if (secondary.hasBody()) {
            body = secondary.getBody();
        } else if (secondary.hasBodyTemplate()) {
            body = templateEngine.render(secondary.getBodyTemplate(), Collections.emptyMap());
        } else {
            body = null;
        }

        WebhookConfig request = new WebhookConfig(secondary);
        request.setBody(body);
        try {
            webhookExecutor.execute(request);
            logger.info("✅ Secondary webhook succeeded for job {}", job.getId());
            return finished(job, output, SecondaryOutcome.SUCCEEDED, body, null);
        } catch (WebhookException e) {
            logger.error("❌ Secondary webhook failed for job {}: {}", job.getId(), e.getMessage());
            return finished(job, output, SecondaryOutcome.FAILED, body, e.getMessage());
        }
    }

    private Map<String, JsonNode> extractQuietly(String jobId, String document, WebhookConfig secondary) {
        try {
            Map<String, JsonNode> variables = variableExtractor.extract(document, secondary.getJqSelectors());
            if (secondary.hasJqSelectors()) {
                logger.info("Extracted {} variables for job {}", variables.size(), jobId);
            }
            return variables;
        } catch (JsonDocumentException e) {
            logger.error("Failed to extract variables for job {}: {}", jobId, e.getMessage());
            return Collections.emptyMap();
        }
    }

    private ExecutionResult finished(Job job, String output, SecondaryOutcome outcome, String body, String error) {
        logger.info("Finished executing job: {} (ID: {})", job.getName(), job.getId());
        return new ExecutionResult(job.getId(), true, output, outcome, body, error);
    }
}
