package com.sitecheck.core.queue;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Queue policy. The grace window and the staleness threshold default to the same length:
 * a reservation stops protecting its owner when the owner's claim becomes reclaimable.
 */
@Configuration
@ConfigurationProperties(prefix = "sitecheck.queue")
@Getter
@Setter
public class QueueProperties {

    /** Claim attempts per queue entry before it fails for good. */
    private int maxRetries = 3;

    /** Pending entries inspected per tick, oldest first. */
    private int batchSize = 20;

    /** Hard execution ceiling of the host running a tick. */
    private Duration executionLimit = Duration.ofMinutes(5);

    /** Time kept in reserve below the execution limit to answer the trigger. */
    private Duration safetyMargin = Duration.ofSeconds(30);

    /** Age after which an email reservation is considered abandoned. */
    private Duration reservationGraceWindow = Duration.ofMinutes(10);

    /** Age after which a processing entry is considered stuck. */
    private Duration staleThreshold = Duration.ofMinutes(10);

    /** Threads running audits, including ones that outlive their tick. */
    private int workerThreads = 4;

    private Scheduler scheduler = new Scheduler();

    /**
     * Soft deadline for the work of one tick.
     */
    public Duration getSoftDeadline() {
        Duration deadline = executionLimit.minus(safetyMargin);
        return deadline.isNegative() ? Duration.ZERO : deadline;
    }

    @Getter
    @Setter
    public static class Scheduler {
        /** Run ticks in-process in addition to the external trigger. */
        private boolean enabled = false;
        private long fixedDelayMs = 60_000;
    }
}
