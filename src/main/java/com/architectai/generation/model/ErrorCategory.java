package com.architectai.generation.model;

/**
 * Classification attached to a failed job.
 */
public enum ErrorCategory {
    /** The content generator reported an error or returned nothing usable. */
    GENERATION_FAILURE,
    /** The version store could not durably write the result. */
    STORE_UNAVAILABLE,
    /** The worker pool refused the job. */
    SCHEDULING_FAILURE
}
