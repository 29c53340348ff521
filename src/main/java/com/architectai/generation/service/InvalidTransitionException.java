package com.architectai.generation.service;

import com.architectai.generation.model.JobStatus;

/**
 * Attempted job state change that the lifecycle does not allow, e.g. touching a job that is
 * already completed. Always a bug or a broken concurrency contract.
 */
public class InvalidTransitionException extends RuntimeException {

    private final String jobId;
    private final JobStatus from;
    private final JobStatus to;

    public InvalidTransitionException(String jobId, JobStatus from, JobStatus to) {
        super("Job " + jobId + " cannot move from " + from.wireValue() + " to " + (to != null ? to.wireValue() : "null"));
        this.jobId = jobId;
        this.from = from;
        this.to = to;
    }

    public String getJobId() {
        return jobId;
    }

    public JobStatus getFrom() {
        return from;
    }

    public JobStatus getTo() {
        return to;
    }
}
