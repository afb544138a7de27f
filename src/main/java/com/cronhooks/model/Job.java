package com.cronhooks.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A scheduled webhook job: a cron schedule, a primary webhook, an optional chained
 * secondary webhook and any pending one-shot reminders.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Job {
    private String id;
    private String name;
    private String schedule;
    private boolean enabled;
    private WebhookConfig primary;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private WebhookConfig secondary;

    @JsonProperty("save_output")
    @JsonInclude(JsonInclude.Include.NON_DEFAULT)
    private boolean saveOutput;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private String description;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private List<Reminder> reminders = new ArrayList<>();

    public Job() {}

    public Job(String id, String name, String schedule) {
        this.id = id;
        this.name = name;
        this.schedule = schedule;
        this.enabled = true;
    }

    /**
     * Deep copy, used to hand executions a snapshot that later edits cannot touch.
     */
    public Job(Job other) {
        this.id = other.id;
        this.name = other.name;
        this.schedule = other.schedule;
        this.enabled = other.enabled;
        this.primary = other.primary != null ? new WebhookConfig(other.primary) : null;
        this.secondary = other.secondary != null ? new WebhookConfig(other.secondary) : null;
        this.saveOutput = other.saveOutput;
        this.description = other.description;
        this.reminders = other.reminders == null ? new ArrayList<>() : other.reminders.stream()
                .map(Reminder::new)
                .collect(Collectors.toCollection(ArrayList::new));
    }

    // Getters and Setters
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getSchedule() { return schedule; }
    public void setSchedule(String schedule) { this.schedule = schedule; }

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public WebhookConfig getPrimary() { return primary; }
    public void setPrimary(WebhookConfig primary) { this.primary = primary; }

    public WebhookConfig getSecondary() { return secondary; }
    public void setSecondary(WebhookConfig secondary) { this.secondary = secondary; }

    public boolean isSaveOutput() { return saveOutput; }
    public void setSaveOutput(boolean saveOutput) { this.saveOutput = saveOutput; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public List<Reminder> getReminders() { return reminders; }
    public void setReminders(List<Reminder> reminders) { this.reminders = reminders; }

    @Override
    public String toString() {
        return "Job{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", schedule='" + schedule + '\'' +
                ", enabled=" + enabled +
                ", saveOutput=" + saveOutput +
                ", secondary=" + (secondary != null) +
                ", reminders=" + (reminders != null ? reminders.size() : 0) +
                '}';
    }
}
