package com.cronhooks.service;

/**
 * What happened during one primary/secondary chain.
 */
public class ExecutionResult {

    public enum SecondaryOutcome {
        NOT_CONFIGURED,
        DISABLED,
        SKIPPED,
        SUCCEEDED,
        FAILED
    }

    private final String jobId;
    private final boolean primarySucceeded;
    private final String primaryResponse;
    private final SecondaryOutcome secondaryOutcome;
    private final String secondaryBody;
    private final String errorMessage;

    public ExecutionResult(String jobId, boolean primarySucceeded, String primaryResponse,
                           SecondaryOutcome secondaryOutcome, String secondaryBody, String errorMessage) {
        this.jobId = jobId;
        this.primarySucceeded = primarySucceeded;
        this.primaryResponse = primaryResponse;
        this.secondaryOutcome = secondaryOutcome;
        this.secondaryBody = secondaryBody;
        this.errorMessage = errorMessage;
    }

    public String getJobId() { return jobId; }
    public boolean isPrimarySucceeded() { return primarySucceeded; }
    public String getPrimaryResponse() { return primaryResponse; }
    public SecondaryOutcome getSecondaryOutcome() { return secondaryOutcome; }

    /**
     * The body sent (or that would have been sent) to the secondary webhook, if one was computed.
     */
    public String getSecondaryBody() { return secondaryBody; }

    /**
     * First error of the chain, null when everything succeeded.
     */
    public String getErrorMessage() { return errorMessage; }

    public boolean isSuccess() {
        return primarySucceeded && secondaryOutcome != SecondaryOutcome.FAILED;
    }

    @Override
    public String toString() {
        return "ExecutionResult{" +
                "jobId='" + jobId + '\'' +
                ", primarySucceeded=" + primarySucceeded +
                ", secondaryOutcome=" + secondaryOutcome +
                ", errorMessage='" + errorMessage + '\'' +
                '}';
    }
}
