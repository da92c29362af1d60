package com.delta.jobharvester.harvest.service;

import com.delta.jobharvester.config.HarvesterProperties;
import com.delta.jobharvester.harvest.model.DaemonStatusResponse;
import com.delta.jobharvester.harvest.model.ExternalTask;
import com.delta.jobharvester.harvest.model.HarvestOutcome;
import com.delta.jobharvester.harvest.model.TaskKind;
import com.delta.jobharvester.harvest.model.TaskState;
import com.delta.jobharvester.harvest.persistence.ExternalTaskRepository;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TaskPollingDaemonTest {
    private static final Instant NOW = Instant.parse("2026-01-10T12:00:00Z");

    @Test
    void sweepFailsStaleTasksThenPollsTheRest() {
        TaskOrchestratorService orchestrator = mock(TaskOrchestratorService.class);
        ExternalTaskRepository repository = mock(ExternalTaskRepository.class);
        HarvesterProperties properties = new HarvesterProperties();
        properties.getPolling().setEnabled(false);
        TaskPollingDaemon daemon = new TaskPollingDaemon(orchestrator, repository, properties, Clock.fixed(NOW, ZoneOffset.UTC));

        when(orchestrator.sweepTimeouts()).thenReturn(2);
        when(repository.findPollable(anyInt())).thenReturn(List.of(task(1L), task(2L), task(3L)));
        when(orchestrator.pollAndProcess(1L)).thenReturn(new HarvestOutcome(1L, HarvestOutcome.Disposition.PROCESSED, 10, 4, "processed"));
        when(orchestrator.pollAndProcess(2L)).thenReturn(HarvestOutcome.skipped(2L, "results not ready"));
        when(orchestrator.pollAndProcess(3L)).thenThrow(new IllegalStateException("boom"));
        when(repository.countNonTerminal()).thenReturn(2L);

        daemon.sweepOnce();
        DaemonStatusResponse status = daemon.getStatus();

        InOrder order = inOrder(orchestrator, repository);
        order.verify(orchestrator).sweepTimeouts();
        order.verify(repository).findPollable(anyInt());
        order.verify(orchestrator).pollAndProcess(1L);
        assertThat(status.running()).isFalse();
        assertThat(status.lastSweepTimedOut()).isEqualTo(2);
        assertThat(status.lastSweepPolled()).isEqualTo(2);
        assertThat(status.lastSweepProcessed()).isEqualTo(1);
        assertThat(status.lastSweepFinishedAt()).isEqualTo(NOW);
        assertThat(status.nonTerminalTasks()).isEqualTo(2L);
    }

    @Test
    void startAndStopAreIdempotent() {
        TaskOrchestratorService orchestrator = mock(TaskOrchestratorService.class);
        ExternalTaskRepository repository = mock(ExternalTaskRepository.class);
        HarvesterProperties properties = new HarvesterProperties();
        properties.getPolling().setIntervalSeconds(3600);
        TaskPollingDaemon daemon = new TaskPollingDaemon(orchestrator, repository, properties, Clock.fixed(NOW, ZoneOffset.UTC));

        daemon.start();
        daemon.start();
        assertThat(daemon.getStatus().running()).isTrue();

        daemon.stop();
        daemon.stop();
        assertThat(daemon.getStatus().running()).isFalse();
    }

    private ExternalTask task(long id) {
        return new ExternalTask(id, "req-" + id, "dana", TaskKind.INDEED_JOBS, TaskState.SUBMITTED,
            null, NOW, null, 0, 0, null, NOW);
    }
}
