package com.architectai.generation.client;

import java.time.Duration;

/**
 * How often and for how long a client polls a job before giving up on it.
 */
public final class PollPolicy {

    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(2);
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(120);

    private final Duration interval;
    private final Duration timeout;

    public PollPolicy(Duration interval, Duration timeout) {
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative");
        }
        this.interval = interval;
        this.timeout = timeout;
    }

    public static PollPolicy defaults() {
        return new PollPolicy(DEFAULT_INTERVAL, DEFAULT_TIMEOUT);
    }

    public Duration getInterval() {
        return interval;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
