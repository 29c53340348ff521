package com.architectai.generation.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of a generation job: {@code queued -> running -> completed | failed}.
 */
public enum JobStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Whether a job in this state may move to {@code next}. Terminal states accept nothing,
     * and a queued job has to pass through {@link #RUNNING} first.
     */
    public boolean canTransitionTo(JobStatus next) {
        if (next == null) {
            return false;
        }
        return switch (this) {
            case QUEUED -> next == RUNNING;
            case RUNNING -> next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static JobStatus fromWireValue(String value) {
        return value == null ? null : JobStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
