package com.delta.jobharvester.harvest.model;

import java.time.Instant;

public record DaemonStatusResponse(
    boolean running,
    int intervalSeconds,
    Instant lastSweepStartedAt,
    Instant lastSweepFinishedAt,
    int lastSweepPolled,
    int lastSweepProcessed,
    int lastSweepTimedOut,
    long nonTerminalTasks
) {
}
