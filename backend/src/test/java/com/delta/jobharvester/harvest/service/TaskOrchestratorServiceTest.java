package com.delta.jobharvester.harvest.service;

import com.delta.jobharvester.config.HarvesterProperties;
import com.delta.jobharvester.harvest.classify.ReconciliationViolationException;
import com.delta.jobharvester.harvest.http.ExternalServiceException;
import com.delta.jobharvester.harvest.model.ClassificationResult;
import com.delta.jobharvester.harvest.model.ClassificationTags;
import com.delta.jobharvester.harvest.model.DedupDecision;
import com.delta.jobharvester.harvest.model.ExternalTask;
import com.delta.jobharvester.harvest.model.Fingerprint;
import com.delta.jobharvester.harvest.model.HarvestOutcome;
import com.delta.jobharvester.harvest.model.HarvestReport;
import com.delta.jobharvester.harvest.model.HarvestedPosting;
import com.delta.jobharvester.harvest.model.NotificationType;
import com.delta.jobharvester.harvest.model.PostingStatus;
import com.delta.jobharvester.harvest.model.Provenance;
import com.delta.jobharvester.harvest.model.ProviderState;
import com.delta.jobharvester.harvest.model.ProviderStatus;
import com.delta.jobharvester.harvest.model.QualityTier;
import com.delta.jobharvester.harvest.model.RawPosting;
import com.delta.jobharvester.harvest.model.ResultBundle;
import com.delta.jobharvester.harvest.model.SearchParams;
import com.delta.jobharvester.harvest.model.TaskKind;
import com.delta.jobharvester.harvest.model.TaskState;
import com.delta.jobharvester.harvest.model.WebhookAck;
import com.delta.jobharvester.harvest.persistence.ExternalTaskRepository;
import com.delta.jobharvester.harvest.persistence.HarvestedPostingRepository;
import com.delta.jobharvester.harvest.scrape.ScrapeResultParser;
import com.delta.jobharvester.harvest.scrape.ScrapingProviderClient;
import com.delta.jobharvester.harvest.util.FailureClass;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TaskOrchestratorServiceTest {
    private static final Instant NOW = Instant.parse("2026-01-10T12:00:00Z");
    private static final SearchParams PARAMS = new SearchParams("CDL-A driver", "Dallas, TX", 100, false);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ExternalTaskRepository taskRepository;
    private HarvestedPostingRepository postingRepository;
    private ScrapingProviderClient provider;
    private HarvestProcessor harvestProcessor;
    private OwnerNotificationService notifier;
    private TaskOrchestratorService orchestrator;

    @BeforeEach
    void setUp() {
        taskRepository = mock(ExternalTaskRepository.class);
        postingRepository = mock(HarvestedPostingRepository.class);
        provider = mock(ScrapingProviderClient.class);
        harvestProcessor = mock(HarvestProcessor.class);
        notifier = mock(OwnerNotificationService.class);
        orchestrator = new TaskOrchestratorService(
            taskRepository,
            postingRepository,
            provider,
            new ScrapeResultParser(),
            harvestProcessor,
            notifier,
            new HarvesterProperties(),
            Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }

    @Test
    void runningProviderStatusLeavesTaskSubmitted() {
        ExternalTask task = task(7L, TaskState.SUBMITTED);
        when(taskRepository.findById(7L)).thenReturn(Optional.of(task));
        when(provider.fetchStatus("req-7")).thenReturn(new ProviderStatus(ProviderState.RUNNING, "Pending", null, null));

        HarvestOutcome outcome = orchestrator.pollAndProcess(7L);

        assertThat(outcome.disposition()).isEqualTo(HarvestOutcome.Disposition.SKIPPED);
        verify(taskRepository, never()).claimForProcessing(anyLong(), anyString(), any(), any());
        verify(taskRepository, never()).markFailed(anyLong(), anyString(), any());
        verify(taskRepository, never()).markRetrieved(anyLong(), anyString(), anyInt(), any());
        verify(notifier, never()).notify(anyString(), anyString(), any(), any());
    }

    @Test
    void submitRecordsRequestIdAndNotifiesOwner() {
        when(taskRepository.insertPending(eq("dana"), eq(TaskKind.GOOGLE_JOBS), any(), eq(NOW))).thenReturn(3L);
        when(taskRepository.findById(3L)).thenReturn(Optional.of(task(3L, TaskState.PENDING)), Optional.of(task(3L, TaskState.SUBMITTED)));
        when(provider.submit(TaskKind.GOOGLE_JOBS, PARAMS, null)).thenReturn("req-3");
        when(taskRepository.markSubmitted(3L, "req-3", NOW)).thenReturn(true);

        ExternalTask submitted = orchestrator.submit("dana", TaskKind.GOOGLE_JOBS, PARAMS);

        assertThat(submitted.state()).isEqualTo(TaskState.SUBMITTED);
        verify(notifier).notify(eq("dana"), contains("req-3"), eq(NotificationType.SEARCH_SUBMITTED), eq(3L));
    }

    @Test
    void submitFailureFailsTaskNotifiesAndPropagates() {
        when(taskRepository.insertPending(any(), any(), any(), any())).thenReturn(4L);
        when(taskRepository.findById(4L)).thenReturn(Optional.of(task(4L, TaskState.PENDING)));
        when(provider.submit(any(), any(), any()))
            .thenThrow(new ExternalServiceException(FailureClass.CLIENT_ERROR, "scraper returned HTTP 401"));

        assertThatThrownBy(() -> orchestrator.submit("dana", TaskKind.GOOGLE_JOBS, PARAMS))
            .isInstanceOf(TaskSubmissionException.class)
            .hasMessageContaining("HTTP 401");

        verify(taskRepository).markFailed(eq(4L), contains("HTTP 401"), eq(NOW));
        verify(taskRepository, never()).markSubmitted(anyLong(), anyString(), any());
        verify(notifier).notify(eq("dana"), anyString(), eq(NotificationType.ERROR), eq(4L));
    }

    @Test
    void unexpectedSubmitErrorStillFailsTask() {
        when(taskRepository.insertPending(any(), any(), any(), any())).thenReturn(5L);
        when(taskRepository.findById(5L)).thenReturn(Optional.of(task(5L, TaskState.PENDING)));
        when(provider.submit(any(), any(), any())).thenThrow(new IllegalArgumentException("URI is not absolute"));

        assertThatThrownBy(() -> orchestrator.submit("dana", TaskKind.GOOGLE_JOBS, PARAMS))
            .isInstanceOf(TaskSubmissionException.class)
            .hasCauseInstanceOf(IllegalArgumentException.class);

        verify(taskRepository).markFailed(eq(5L), contains("URI is not absolute"), eq(NOW));
        verify(notifier).notify(eq("dana"), anyString(), eq(NotificationType.ERROR), eq(5L));
    }

    @Test
    void submitRejectsBlankSearch() {
        assertThatThrownBy(() -> orchestrator.submit("dana", TaskKind.GOOGLE_JOBS, new SearchParams(" ", "Dallas", 10, false)))
            .isInstanceOf(IllegalArgumentException.class);
        verify(taskRepository, never()).insertPending(any(), any(), any(), any());
    }

    @Test
    void providerErrorFailsTaskAndNotifies() {
        ExternalTask task = task(8L, TaskState.SUBMITTED);
        when(taskRepository.findById(8L)).thenReturn(Optional.of(task));
        when(provider.fetchStatus("req-8")).thenReturn(new ProviderStatus(ProviderState.ERROR, "Error", "quota exceeded", null));
        when(taskRepository.markFailed(eq(8L), anyString(), eq(NOW))).thenReturn(true);

        HarvestOutcome outcome = orchestrator.pollAndProcess(8L);

        assertThat(outcome.disposition()).isEqualTo(HarvestOutcome.Disposition.FAILED);
        verify(taskRepository).markFailed(eq(8L), contains("quota exceeded"), eq(NOW));
        verify(notifier).notify(eq("dana"), contains("quota exceeded"), eq(NotificationType.ERROR), eq(8L));
    }

    @Test
    void transportErrorWhilePollingIsNotReady() {
        ExternalTask task = task(9L, TaskState.SUBMITTED);
        when(taskRepository.findById(9L)).thenReturn(Optional.of(task));
        when(provider.fetchStatus("req-9")).thenThrow(new ExternalServiceException(FailureClass.TRANSIENT_NETWORK, "timeout"));

        HarvestOutcome outcome = orchestrator.pollAndProcess(9L);

        assertThat(outcome.disposition()).isEqualTo(HarvestOutcome.Disposition.SKIPPED);
        verify(taskRepository, never()).markFailed(anyLong(), anyString(), any());
    }

    @Test
    void successfulPollProcessesAndReportsQualityCount() throws Exception {
        ExternalTask task = task(10L, TaskState.SUBMITTED);
        when(taskRepository.findById(10L)).thenReturn(Optional.of(task));
        when(provider.fetchStatus("req-10")).thenReturn(new ProviderStatus(
            ProviderState.SUCCESS,
            "Success",
            null,
            objectMapper.readTree("[[{\"title\":\"CDL-A Driver\",\"company_name\":\"Acme\",\"location\":\"Dallas, TX\"}]]")
        ));
        when(taskRepository.claimForProcessing(eq(10L), anyString(), eq(NOW), any())).thenReturn(true);
        when(taskRepository.markRetrieved(eq(10L), anyString(), eq(1), eq(NOW))).thenReturn(true);
        when(harvestProcessor.process(anyList(), eq("Dallas, TX"), eq(false))).thenReturn(report(QualityTier.GOOD));
        when(taskRepository.renewLease(eq(10L), anyString(), eq(NOW), any())).thenReturn(true);
        when(taskRepository.markProcessed(eq(10L), anyString(), eq(1), eq(1), eq(NOW))).thenReturn(true);

        HarvestOutcome outcome = orchestrator.pollAndProcess(10L);

        assertThat(outcome.disposition()).isEqualTo(HarvestOutcome.Disposition.PROCESSED);
        assertThat(outcome.qualityJobCount()).isEqualTo(1);
        verify(postingRepository).replaceForTask(eq(10L), anyList(), eq(NOW));

        ArgumentCaptor<String> claimedBy = ArgumentCaptor.forClass(String.class);
        verify(taskRepository).claimForProcessing(eq(10L), claimedBy.capture(), eq(NOW), any());
        verify(taskRepository).renewLease(eq(10L), eq(claimedBy.getValue()), eq(NOW), any());
        verify(taskRepository).markProcessed(eq(10L), eq(claimedBy.getValue()), eq(1), eq(1), eq(NOW));
        verify(notifier).notify(eq("dana"), contains("1 quality jobs"), eq(NotificationType.SEARCH_COMPLETE), eq(10L));
    }

    @Test
    void lostLeaseStoresNothingAndDoesNotNotify() {
        when(taskRepository.findById(15L)).thenReturn(Optional.of(task(15L, TaskState.SUBMITTED)));
        when(taskRepository.claimForProcessing(eq(15L), anyString(), any(), any())).thenReturn(true);
        when(harvestProcessor.process(anyList(), any(), anyBoolean())).thenReturn(report(QualityTier.GOOD));
        when(taskRepository.renewLease(eq(15L), anyString(), any(), any())).thenReturn(false);

        HarvestOutcome outcome = orchestrator.processCompletion(15L, new ResultBundle(List.of(), NOW));

        assertThat(outcome.disposition()).isEqualTo(HarvestOutcome.Disposition.SKIPPED);
        assertThat(outcome.message()).contains("lease lost");
        verify(postingRepository, never()).replaceForTask(anyLong(), anyList(), any());
        verify(taskRepository, never()).markProcessed(anyLong(), anyString(), anyInt(), anyInt(), any());
        verify(notifier, never()).notify(anyString(), anyString(), any(), any());
    }

    @Test
    void processingLeaseOutlastsClassificationBatch() {
        HarvesterProperties properties = new HarvesterProperties();
        properties.getPolling().setLockTtlSeconds(60);
        properties.getClassifier().setBatchTimeoutSeconds(900);
        TaskOrchestratorService shortLease = new TaskOrchestratorService(
            taskRepository, postingRepository, provider, new ScrapeResultParser(), harvestProcessor, notifier,
            properties, Clock.fixed(NOW, ZoneOffset.UTC)
        );
        when(taskRepository.findById(16L)).thenReturn(Optional.of(task(16L, TaskState.SUBMITTED)));
        when(taskRepository.claimForProcessing(eq(16L), anyString(), any(), any())).thenReturn(false);

        shortLease.processCompletion(16L, new ResultBundle(List.of(), NOW));

        ArgumentCaptor<Instant> lockedUntil = ArgumentCaptor.forClass(Instant.class);
        verify(taskRepository).claimForProcessing(eq(16L), anyString(), eq(NOW), lockedUntil.capture());
        assertThat(lockedUntil.getValue()).isAfter(NOW.plusSeconds(900));
    }

    @Test
    void eachClaimUsesItsOwnLockOwner() {
        when(taskRepository.findById(17L)).thenReturn(Optional.of(task(17L, TaskState.PROCESSING)));
        when(taskRepository.claimForProcessing(eq(17L), anyString(), any(), any())).thenReturn(false);

        orchestrator.processCompletion(17L, new ResultBundle(List.of(), NOW));
        orchestrator.processCompletion(17L, new ResultBundle(List.of(), NOW));

        ArgumentCaptor<String> owners = ArgumentCaptor.forClass(String.class);
        verify(taskRepository, times(2)).claimForProcessing(eq(17L), owners.capture(), any(), any());
        assertThat(owners.getAllValues().get(0)).isNotEqualTo(owners.getAllValues().get(1));
    }

    @Test
    void forceFreshSearchIsPassedToProcessing() {
        ExternalTask forced = new ExternalTask(18L, "req-18", "dana", TaskKind.GOOGLE_JOBS, TaskState.SUBMITTED,
            new SearchParams("CDL-A driver", "Dallas, TX", 100, true), NOW.minusSeconds(600), null, 0, 0, null,
            NOW.minusSeconds(700));
        when(taskRepository.findById(18L)).thenReturn(Optional.of(forced));
        when(taskRepository.claimForProcessing(eq(18L), anyString(), any(), any())).thenReturn(true);
        when(harvestProcessor.process(anyList(), eq("Dallas, TX"), eq(true))).thenReturn(report(QualityTier.GOOD));
        when(taskRepository.renewLease(eq(18L), anyString(), any(), any())).thenReturn(true);
        when(taskRepository.markProcessed(eq(18L), anyString(), anyInt(), anyInt(), any())).thenReturn(true);

        HarvestOutcome outcome = orchestrator.processCompletion(18L, new ResultBundle(List.of(), NOW));

        assertThat(outcome.disposition()).isEqualTo(HarvestOutcome.Disposition.PROCESSED);
        verify(harvestProcessor).process(anyList(), eq("Dallas, TX"), eq(true));
    }

    @Test
    void completionOnTerminalTaskHasNoSideEffects() {
        when(taskRepository.findById(11L)).thenReturn(Optional.of(task(11L, TaskState.PROCESSED)));

        HarvestOutcome outcome = orchestrator.processCompletion(11L, new ResultBundle(List.of(), NOW));

        assertThat(outcome.disposition()).isEqualTo(HarvestOutcome.Disposition.SKIPPED);
        verify(taskRepository, never()).claimForProcessing(anyLong(), anyString(), any(), any());
        verify(postingRepository, never()).replaceForTask(anyLong(), anyList(), any());
        verify(notifier, never()).notify(anyString(), anyString(), any(), any());
    }

    @Test
    void completionWithoutLeaseIsSkipped() {
        when(taskRepository.findById(12L)).thenReturn(Optional.of(task(12L, TaskState.PROCESSING)));
        when(taskRepository.claimForProcessing(eq(12L), anyString(), any(), any())).thenReturn(false);

        HarvestOutcome outcome = orchestrator.processCompletion(12L, new ResultBundle(List.of(), NOW));

        assertThat(outcome.disposition()).isEqualTo(HarvestOutcome.Disposition.SKIPPED);
        verify(harvestProcessor, never()).process(anyList(), any(), anyBoolean());
    }

    @Test
    void reconciliationViolationFailsTaskAndPropagates() {
        when(taskRepository.findById(13L)).thenReturn(Optional.of(task(13L, TaskState.SUBMITTED)));
        when(taskRepository.claimForProcessing(eq(13L), anyString(), any(), any())).thenReturn(true);
        when(harvestProcessor.process(anyList(), any(), anyBoolean())).thenThrow(new ReconciliationViolationException("3 of 4 fingerprints"));
        when(taskRepository.markFailed(eq(13L), anyString(), any())).thenReturn(true);

        assertThatThrownBy(() -> orchestrator.processCompletion(13L, new ResultBundle(List.of(), NOW)))
            .isInstanceOf(ReconciliationViolationException.class);

        verify(taskRepository).markFailed(eq(13L), contains("3 of 4"), eq(NOW));
        verify(notifier).notify(eq("dana"), anyString(), eq(NotificationType.ERROR), eq(13L));
    }

    @Test
    void webhookForUnknownRequestIsIgnored() {
        when(taskRepository.findNonTerminalByRequestId("req-gone")).thenReturn(Optional.empty());

        WebhookAck ack = orchestrator.handleWebhook("req-gone", "Success", null);

        assertThat(ack.status()).isEqualTo("ignored");
        verify(harvestProcessor, never()).process(anyList(), any(), anyBoolean());
    }

    @Test
    void webhookErrorStatusFailsTask() {
        when(taskRepository.findNonTerminalByRequestId("req-14")).thenReturn(Optional.of(task(14L, TaskState.SUBMITTED)));
        when(taskRepository.markFailed(eq(14L), anyString(), any())).thenReturn(true);

        WebhookAck ack = orchestrator.handleWebhook("req-14", "Error", null);

        assertThat(ack.status()).isEqualTo("failed");
        assertThat(ack.taskId()).isEqualTo(14L);
    }

    @Test
    void timeoutSweepFailsOnlyTasksStillOpen() {
        when(taskRepository.findStaleNonTerminal(NOW.minusSeconds(3600)))
            .thenReturn(List.of(task(20L, TaskState.SUBMITTED), task(21L, TaskState.PROCESSING)));
        when(taskRepository.markFailed(eq(20L), anyString(), eq(NOW))).thenReturn(true);
        when(taskRepository.markFailed(eq(21L), anyString(), eq(NOW))).thenReturn(false);

        int failed = orchestrator.sweepTimeouts();

        assertThat(failed).isEqualTo(1);
        verify(notifier).notify(eq("dana"), contains("Timed out"), eq(NotificationType.ERROR), eq(20L));
        verify(notifier, never()).notify(anyString(), anyString(), any(), eq(21L));
    }

    @Test
    void unknownTaskIsNotFound() {
        when(taskRepository.findById(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> orchestrator.pollAndProcess(99L)).isInstanceOf(TaskNotFoundException.class);
        verify(provider, never()).fetchStatus(anyString());
    }

    private ExternalTask task(long id, TaskState state) {
        return new ExternalTask(
            id,
            state == TaskState.PENDING ? null : "req-" + id,
            "dana",
            TaskKind.GOOGLE_JOBS,
            state,
            PARAMS,
            state == TaskState.PENDING ? null : NOW.minusSeconds(600),
            null,
            0,
            0,
            null,
            NOW.minusSeconds(700)
        );
    }

    private HarvestReport report(QualityTier tier) {
        RawPosting posting = new RawPosting("CDL-A Driver", "Acme", "Dallas, TX", null, "google", List.of(), NOW);
        DedupDecision decision = DedupDecision.kept(0, posting, new Fingerprint("f".repeat(64)), "Dallas");
        ClassificationResult result = new ClassificationResult(tier, "ok", "ok", ClassificationTags.unknown(), Provenance.FRESHLY_CLASSIFIED);
        return new HarvestReport(List.of(new HarvestedPosting(decision, new PostingStatus.FreshlyClassified(), result)), 1, 0, 0, 0, 1, 0);
    }
}
