package com.delta.jobharvester.harvest.service;

import com.delta.jobharvester.config.HarvesterProperties;
import com.delta.jobharvester.harvest.model.DaemonStatusResponse;
import com.delta.jobharvester.harvest.model.ExternalTask;
import com.delta.jobharvester.harvest.model.HarvestOutcome;
import com.delta.jobharvester.harvest.persistence.ExternalTaskRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One thread, one sweep per interval: fail timed-out tasks, then poll the rest in order.
 */
@Service
public class TaskPollingDaemon {
    private static final Logger log = LoggerFactory.getLogger(TaskPollingDaemon.class);
    private static final int SWEEP_LIMIT = 200;

    private final TaskOrchestratorService orchestrator;
    private final ExternalTaskRepository taskRepository;
    private final HarvesterProperties properties;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();

    private ScheduledExecutorService scheduler;
    private volatile Instant lastSweepStartedAt;
    private volatile Instant lastSweepFinishedAt;
    private volatile int lastSweepPolled;
    private volatile int lastSweepProcessed;
    private volatile int lastSweepTimedOut;

    public TaskPollingDaemon(
        TaskOrchestratorService orchestrator,
        ExternalTaskRepository taskRepository,
        HarvesterProperties properties,
        Clock clock
    ) {
        this.orchestrator = orchestrator;
        this.taskRepository = taskRepository;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getPolling().isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            int intervalSeconds = properties.getPolling().getIntervalSeconds();
            scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("task-polling-daemon");
                thread.setDaemon(true);
                return thread;
            });
            running.set(true);
            scheduler.scheduleWithFixedDelay(this::safeSweep, 0, intervalSeconds, TimeUnit.SECONDS);
            log.info("Task polling daemon started, interval {}s", intervalSeconds);
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            if (scheduler != null) {
                scheduler.shutdownNow();
                try {
                    scheduler.awaitTermination(5, TimeUnit.SECONDS);
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
                scheduler = null;
            }
            log.info("Task polling daemon stopped");
        }
    }

    public DaemonStatusResponse getStatus() {
        long nonTerminal;
        try {
            nonTerminal = taskRepository.countNonTerminal();
        } catch (Exception e) {
            log.warn("Failed to count open tasks", e);
            nonTerminal = -1;
        }
        return new DaemonStatusResponse(
            running.get(),
            properties.getPolling().getIntervalSeconds(),
            lastSweepStartedAt,
            lastSweepFinishedAt,
            lastSweepPolled,
            lastSweepProcessed,
            lastSweepTimedOut,
            nonTerminal
        );
    }

    /**
     * Runs one sweep on the calling thread.
     */
    public void sweepOnce() {
        lastSweepStartedAt = clock.instant();
        int timedOut = orchestrator.sweepTimeouts();
        List<ExternalTask> tasks = taskRepository.findPollable(SWEEP_LIMIT);
        int polled = 0;
        int processed = 0;
        for (ExternalTask task : tasks) {
            if (Thread.currentThread().isInterrupted()) {
                break;
            }
            try {
                HarvestOutcome outcome = orchestrator.pollAndProcess(task.id());
                polled++;
                if (outcome.disposition() == HarvestOutcome.Disposition.PROCESSED) {
                    processed++;
                }
            } catch (Exception e) {
                log.warn("Sweep failed on task {}", task.id(), e);
            }
        }
        lastSweepPolled = polled;
        lastSweepProcessed = processed;
        lastSweepTimedOut = timedOut;
        lastSweepFinishedAt = clock.instant();
        if (polled > 0 || timedOut > 0) {
            log.info("Sweep polled {} tasks, processed {}, timed out {}", polled, processed, timedOut);
        }
    }

    private void safeSweep() {
        if (!running.get()) {
            return;
        }
        try {
            sweepOnce();
        } catch (Exception e) {
            log.warn("Polling sweep failed", e);
        }
    }
}
