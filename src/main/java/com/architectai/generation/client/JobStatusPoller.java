package com.architectai.generation.client;

import com.architectai.generation.model.GenerationJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Function;

/**
 * Polls a job until it reaches a terminal status. Timing out only means this caller stopped
 * waiting; the job keeps running on the server.
 */
public class JobStatusPoller {

    private static final Logger logger = LoggerFactory.getLogger(JobStatusPoller.class);

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final Function<String, Optional<GenerationJob>> lookup;
    private final PollPolicy policy;
    private final Clock clock;
    private final Sleeper sleeper;

    public JobStatusPoller(Function<String, Optional<GenerationJob>> lookup, PollPolicy policy) {
        this(lookup, policy, Clock.systemUTC(), duration -> Thread.sleep(duration.toMillis()));
    }

    public JobStatusPoller(Function<String, Optional<GenerationJob>> lookup, PollPolicy policy, Clock clock, Sleeper sleeper) {
        this.lookup = lookup;
        this.policy = policy;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Polls at every interval and once more exactly at the deadline.
     *
     * @return the terminal job snapshot, or empty if the deadline passed first
     * @throws IllegalStateException if the server does not know the job
     */
    public Optional<GenerationJob> awaitTerminal(String jobId) {
        Instant deadline = clock.instant().plus(policy.getTimeout());
        while (true) {
            GenerationJob job = lookup.apply(jobId)
                    .orElseThrow(() -> new IllegalStateException("Job " + jobId + " not found"));
            if (job.getStatus() != null && job.getStatus().isTerminal()) {
                return Optional.of(job);
            }
            Instant now = clock.instant();
            if (!now.isBefore(deadline)) {
                logger.warn("Gave up waiting for job {} after {} (last status: {}, progress {}%)",
                        jobId, policy.getTimeout(), job.getStatus(), job.getProgress());
                return Optional.empty();
            }
            // the last wait is shortened so one final poll lands on the deadline
            Duration remaining = Duration.between(now, deadline);
            try {
                sleeper.sleep(remaining.compareTo(policy.getInterval()) < 0 ? remaining : policy.getInterval());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while waiting for job {}", jobId);
                return Optional.empty();
            }
        }
    }
}
