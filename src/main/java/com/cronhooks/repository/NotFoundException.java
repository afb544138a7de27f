package com.cronhooks.repository;

public class NotFoundException extends Exception {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException job(String jobId) {
        return new NotFoundException("job with id " + jobId + " not found");
    }

    public static NotFoundException reminder(String jobId, String reminderId) {
        return new NotFoundException("reminder with id " + reminderId + " not found in job " + jobId);
    }
}
