package com.cronhooks.model;

import java.util.Objects;

/**
 * Identifies one reminder timer. Both parts are compared separately, so ids may contain any character.
 */
public final class ReminderKey {
    private final String jobId;
    private final String reminderId;

    public ReminderKey(String jobId, String reminderId) {
        this.jobId = Objects.requireNonNull(jobId, "jobId");
        this.reminderId = Objects.requireNonNull(reminderId, "reminderId");
    }

    public String getJobId() { return jobId; }
    public String getReminderId() { return reminderId; }

    public boolean belongsTo(String jobId) {
        return this.jobId.equals(jobId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReminderKey)) return false;
        ReminderKey that = (ReminderKey) o;
        return jobId.equals(that.jobId) && reminderId.equals(that.reminderId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(jobId, reminderId);
    }

    @Override
    public String toString() {
        return "ReminderKey{" +
                "jobId='" + jobId + '\'' +
                ", reminderId='" + reminderId + '\'' +
                '}';
    }
}
