package com.cronhooks.service;

import com.cronhooks.model.Job;
import com.cronhooks.model.Reminder;
import com.cronhooks.model.WebhookConfig;
import com.cronhooks.repository.JobRepository;
import com.cronhooks.repository.NotFoundException;
import com.cronhooks.repository.PersistenceException;
import com.cronhooks.service.ExecutionResult.SecondaryOutcome;
import com.cronhooks.template.TemplateEngine;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fires a reminder: sends the job's primary webhook with the reminder text injected, optionally
 * chains the secondary webhook, then removes the reminder from the repository whatever the outcome.
 */
public class ReminderRunner {
    private static final Logger logger = LoggerFactory.getLogger(ReminderRunner.class);
    static final String MESSAGE = "message";

    private final WebhookExecutor webhookExecutor;
    private final VariableExtractor variableExtractor;
    private final TemplateEngine templateEngine;
    private final OutputCache outputCache;
    private final JobRepository jobRepository;
    private final ObjectMapper objectMapper;

    public ReminderRunner(WebhookExecutor webhookExecutor,
                          VariableExtractor variableExtractor,
                          TemplateEngine templateEngine,
                          OutputCache outputCache,
                          JobRepository jobRepository) {
        this.webhookExecutor = webhookExecutor;
        this.variableExtractor = variableExtractor;
        this.templateEngine = templateEngine;
        this.outputCache = outputCache;
        this.jobRepository = jobRepository;
        this.objectMapper = new ObjectMapper();
    }

    public ExecutionResult fire(Job job, Reminder reminder) {
        logger.info("⏰ Executing reminder {} for job: {}", reminder.getId(), job.getName());
        try {
            return execute(job, reminder);
        } finally {
            cleanUp(job.getId(), reminder.getId());
        }
    }

    private ExecutionResult execute(Job job, Reminder reminder) {
        String text = reminder.getText() != null ? reminder.getText() : "";

        WebhookConfig primary = new WebhookConfig(job.getPrimary());
        if (primary.hasBody()) {
            primary.setBody(templateEngine.renderReminder(primary.getBody(), text));
            logger.debug("Reminder primary body: {}", primary.getBody());
        }

        String response = "";
        boolean primarySucceeded = false;
        String error = null;
        try {
            response = webhookExecutor.execute(primary);
            primarySucceeded = true;
            logger.info("✅ Primary webhook for reminder {} executed successfully", reminder.getId());
        } catch (WebhookException e) {
            error = e.getMessage();
            logger.error("❌ Primary webhook failed for reminder {}: {}", reminder.getId(), e.getMessage());
        }

        if (job.isSaveOutput() && !response.isEmpty()) {
            outputCache.put(job.getId(), response);
        }

        WebhookConfig secondary = job.getSecondary();
        if (secondary == null) {
            logger.debug("No secondary webhook configured for reminder {}", reminder.getId());
            return new ExecutionResult(job.getId(), primarySucceeded, response, SecondaryOutcome.NOT_CONFIGURED, null, error);
        }
        if (!secondary.isEnabled()) {
            logger.info("Secondary webhook is disabled for reminder {}", reminder.getId());
            return new ExecutionResult(job.getId(), primarySucceeded, response, SecondaryOutcome.DISABLED, null, error);
        }

        String body = response.isEmpty()
                ? bodyWithoutResponse(secondary, text)
                : bodyFromResponse(job.getId(), secondary, text, response);
        if (body == null) {
            return new ExecutionResult(job.getId(), primarySucceeded, response, SecondaryOutcome.SKIPPED, null, error);
        }

        WebhookConfig request = new WebhookConfig(secondary);
        request.setBody(body);
        try {
            webhookExecutor.execute(request);
            logger.info("✅ Secondary webhook for reminder {} executed successfully", reminder.getId());
            return new ExecutionResult(job.getId(), primarySucceeded, response, SecondaryOutcome.SUCCEEDED, body, error);
        } catch (WebhookException e) {
            logger.error("❌ Secondary webhook failed for reminder {}: {}", reminder.getId(), e.getMessage());
            return new ExecutionResult(job.getId(), primarySucceeded, response, SecondaryOutcome.FAILED, body,
                    error != null ? error : e.getMessage());
        }
    }

    /**
     * Returns null when the secondary call should be suppressed.
     */
    private String bodyFromResponse(String jobId, WebhookConfig secondary, String text, String response) {
        Map<String, JsonNode> variables = new LinkedHashMap<>();
        variables.put(TemplateEngine.REMINDER, TextNode.valueOf(text));

        if (secondary.hasJqSelectors()) {
            try {
                Map<String, JsonNode> extracted = variableExtractor.extract(response, secondary.getJqSelectors());
                logger.info("Extracted {} variables for reminder of job {}", extracted.size(), jobId);
                if (secondary.isOnlyIfVarsNonEmpty() && !VariableExtractor.hasNonEmptyValue(extracted)) {
                    logger.info("Extracted variables are empty for job {}, skipping secondary webhook", jobId);
                    return null;
                }
                extracted.forEach(variables::putIfAbsent);
            } catch (JsonDocumentException e) {
                logger.error("Failed to extract variables for reminder of job {}: {}", jobId, e.getMessage());
                if (secondary.isOnlyIfVarsNonEmpty()) {
                    return null;
                }
            }
        }
        variables.putIfAbsent(MESSAGE, TextNode.valueOf(response));

        if (secondary.hasBodyTemplate()) {
            return templateEngine.render(secondary.getBodyTemplate(), variables);
        }
        if (secondary.hasBody()) {
            return templateEngine.render(secondary.getBody(), variables);
        }
        return response;
    }

    private String bodyWithoutResponse(WebhookConfig secondary, String text) {
        Map<String, JsonNode> variables = new LinkedHashMap<>();
        variables.put(TemplateEngine.REMINDER, TextNode.valueOf(text));
        variables.put(MESSAGE, TextNode.valueOf(text));

        if (secondary.hasBodyTemplate()) {
            return templateEngine.render(secondary.getBodyTemplate(), variables);
        }
        if (secondary.hasBody()) {
            return templateEngine.render(secondary.getBody(), variables);
        }
        return reminderDocument(text);
    }

    String reminderDocument(String text) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("reminder", text);
        node.put(MESSAGE, text);
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            logger.warn("Failed to serialize reminder document: {}", e.getMessage());
            return node.toString();
        }
    }

    private void cleanUp(String jobId, String reminderId) {
        try {
            jobRepository.deleteReminder(jobId, reminderId);
            logger.info("Deleted reminder {} from job {}", reminderId, jobId);
        } catch (NotFoundException e) {
            logger.warn("Reminder {} of job {} was already gone: {}", reminderId, jobId, e.getMessage());
            return;
        }

        try {
            jobRepository.persist();
            logger.debug("Jobs saved after deleting reminder {}", reminderId);
        } catch (PersistenceException e) {
            logger.error("Failed to save jobs after deleting reminder {}: {}", reminderId, e.getMessage(), e);
        }
    }
}
