package com.delta.jobharvester.harvest.service;

import com.delta.jobharvester.config.HarvesterProperties;
import com.delta.jobharvester.harvest.classify.ReconciliationViolationException;
import com.delta.jobharvester.harvest.http.ExternalServiceException;
import com.delta.jobharvester.harvest.model.ExternalTask;
import com.delta.jobharvester.harvest.model.HarvestOutcome;
import com.delta.jobharvester.harvest.model.HarvestReport;
import com.delta.jobharvester.harvest.model.NotificationType;
import com.delta.jobharvester.harvest.model.PollOutcome;
import com.delta.jobharvester.harvest.model.ProviderState;
import com.delta.jobharvester.harvest.model.ProviderStatus;
import com.delta.jobharvester.harvest.model.ResultBundle;
import com.delta.jobharvester.harvest.model.SearchParams;
import com.delta.jobharvester.harvest.model.TaskKind;
import com.delta.jobharvester.harvest.model.WebhookAck;
import com.delta.jobharvester.harvest.persistence.ExternalTaskRepository;
import com.delta.jobharvester.harvest.persistence.HarvestedPostingRepository;
import com.delta.jobharvester.harvest.scrape.ScrapeResultParser;
import com.delta.jobharvester.harvest.scrape.ScrapingProviderClient;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.lang.management.ManagementFactory;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Drives external scraping tasks through
 * {@code PENDING -> SUBMITTED -> PROCESSING -> RETRIEVED -> PROCESSED}, or to {@code FAILED}.
 * Task state is always re-read from the store before acting on it.
 */
@Service
public class TaskOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(TaskOrchestratorService.class);

    private final ExternalTaskRepository taskRepository;
    private final HarvestedPostingRepository postingRepository;
    private final ScrapingProviderClient provider;
    private final ScrapeResultParser resultParser;
    private final HarvestProcessor harvestProcessor;
    private final OwnerNotificationService notifier;
    private final HarvesterProperties properties;
    private final Clock clock;
    private final String instanceId;

    public TaskOrchestratorService(
        ExternalTaskRepository taskRepository,
        HarvestedPostingRepository postingRepository,
        ScrapingProviderClient provider,
        ScrapeResultParser resultParser,
        HarvestProcessor harvestProcessor,
        OwnerNotificationService notifier,
        HarvesterProperties properties,
        Clock clock
    ) {
        this.taskRepository = taskRepository;
        this.postingRepository = postingRepository;
        this.provider = provider;
        this.resultParser = resultParser;
        this.harvestProcessor = harvestProcessor;
        this.notifier = notifier;
        this.properties = properties;
        this.clock = clock;
        this.instanceId = "harvester-" + ManagementFactory.getRuntimeMXBean().getName();
    }

    public ExternalTask submit(String owner, TaskKind kind, SearchParams params) {
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("owner is required");
        }
        if (kind == null) {
            throw new IllegalArgumentException("task kind is required");
        }
        if (params == null || params.primaryTerm().isBlank()) {
            throw new IllegalArgumentException("search terms are required");
        }
        SearchParams effective = params.limit() > 0
            ? params
            : new SearchParams(params.searchTerms(), params.location(), properties.getScraper().getDefaultLimit(),
                params.forceFreshClassification());
        long taskId = taskRepository.insertPending(owner.trim(), kind, effective, clock.instant());
        ExternalTask pending = requireTask(taskId);

        String requestId;
        try {
            requestId = provider.submit(kind, effective, properties.getScraper().getWebhookUrl());
        } catch (ExternalServiceException e) {
            log.warn("Task {} submission failed ({})", taskId, e.failureClass());
            throw submissionFailed(pending, e);
        } catch (RuntimeException e) {
            log.error("Task {} submission failed unexpectedly", taskId, e);
            throw submissionFailed(pending, e);
        }

        if (!taskRepository.markSubmitted(taskId, requestId, clock.instant())) {
            throw new IllegalStateException("Task " + taskId + " left PENDING before its request id was recorded");
        }
        notifier.notify(pending.owner(), "Search submitted: " + pending.describeSearch() + " (request " + requestId + ")",
            NotificationType.SEARCH_SUBMITTED, taskId);
        log.info("Task {} submitted for {} with request id {}", taskId, pending.owner(), requestId);
        return requireTask(taskId);
    }

    private TaskSubmissionException submissionFailed(ExternalTask pending, RuntimeException cause) {
        String error = "Submission failed: " + cause.getMessage();
        taskRepository.markFailed(pending.id(), error, clock.instant());
        notifier.notify(pending.owner(), "Could not start " + pending.describeSearch() + ": " + cause.getMessage(),
            NotificationType.ERROR, pending.id());
        return new TaskSubmissionException(pending.id(), error, cause);
    }

    /**
     * Asks the provider once. Transport problems are reported as not ready; a provider-side error fails the task.
     */
    public PollOutcome poll(ExternalTask task) {
        if (task.isTerminal() || task.requestId() == null) {
            return PollOutcome.notReady();
        }
        ProviderStatus status;
        try {
            status = provider.fetchStatus(task.requestId());
        } catch (ExternalServiceException e) {
            log.warn("Polling task {} ({}) failed, will retry next sweep: {}", task.id(), e.failureClass(), e.getMessage());
            return PollOutcome.notReady();
        }
        if (status.state() == ProviderState.RUNNING) {
            return PollOutcome.notReady();
        }
        if (status.state() == ProviderState.ERROR) {
            String error = status.errorMessage() == null ? "provider reported an error" : status.errorMessage();
            failTask(task, "Scrape failed: " + error);
            return new PollOutcome.Failed(error);
        }
        try {
            return new PollOutcome.Ready(resultParser.parse(status.data(), task.kind(), clock.instant()));
        } catch (RuntimeException e) {
            log.warn("Could not parse results for task {}: {}", task.id(), e.getMessage());
            return PollOutcome.notReady();
        }
    }

    public HarvestOutcome pollAndProcess(long taskId) {
        ExternalTask task = requireTask(taskId);
        if (task.isTerminal()) {
            return HarvestOutcome.skipped(taskId, "task already " + task.state());
        }
        PollOutcome outcome = poll(task);
        if (outcome instanceof PollOutcome.Ready ready) {
            return processCompletion(taskId, ready.bundle());
        }
        if (outcome instanceof PollOutcome.Failed failed) {
            return HarvestOutcome.failed(taskId, failed.errorMessage());
        }
        return HarvestOutcome.skipped(taskId, "results not ready");
    }

    /**
     * Shared by the poll path and the webhook path. Only the holder of the processing lease does any
     * work; a terminal task is left untouched. The lease is renewed before results are stored, and a
     * processor that lost its lease stores nothing.
     */
    public HarvestOutcome processCompletion(long taskId, ResultBundle bundle) {
        ExternalTask task = requireTask(taskId);
        if (task.isTerminal()) {
            log.debug("Task {} already {}; ignoring completion", taskId, task.state());
            return HarvestOutcome.skipped(taskId, "task already " + task.state());
        }
        Instant now = clock.instant();
        Duration lease = processingLease();
        String lockOwner = instanceId + "#" + UUID.randomUUID();
        if (!taskRepository.claimForProcessing(taskId, lockOwner, now, now.plus(lease))) {
            log.info("Task {} is being processed elsewhere or already finished", taskId);
            return HarvestOutcome.skipped(taskId, "task claimed by another processor");
        }

        int rawCount = bundle.postings().size();
        try {
            taskRepository.markRetrieved(taskId, lockOwner, rawCount, clock.instant());
            SearchParams params = task.searchParams();
            HarvestReport report = harvestProcessor.process(
                bundle.postings(),
                params == null ? null : params.location(),
                params != null && params.forceFreshClassification()
            );
            Instant storeAt = clock.instant();
            if (!taskRepository.renewLease(taskId, lockOwner, storeAt, storeAt.plus(lease))) {
                log.warn("Task {} lease was lost during processing; discarding this run's results", taskId);
                return HarvestOutcome.skipped(taskId, "processing lease lost");
            }
            postingRepository.replaceForTask(taskId, report.postings(), storeAt);
            int quality = report.qualityJobCount();
            if (!taskRepository.markProcessed(taskId, lockOwner, rawCount, quality, clock.instant())) {
                log.warn("Task {} changed state while processing; results stored but state not advanced", taskId);
                return HarvestOutcome.skipped(taskId, "task state changed during processing");
            }
            notifier.notify(task.owner(),
                "Search complete: " + task.describeSearch() + ". " + quality + " quality jobs ready ("
                    + rawCount + " scraped, " + report.duplicateCount() + " duplicates, "
                    + report.filteredCount() + " filtered).",
                NotificationType.SEARCH_COMPLETE, taskId);
            log.info("Task {} processed: {} raw, {} duplicates, {} filtered, {} from cache, {} fresh, {} errors, {} quality",
                taskId, rawCount, report.duplicateCount(), report.filteredCount(), report.cacheHitCount(),
                report.freshCount(), report.errorCount(), quality);
            return new HarvestOutcome(taskId, HarvestOutcome.Disposition.PROCESSED, rawCount, quality, "processed");
        } catch (ReconciliationViolationException e) {
            log.error("Reconciliation violation while processing task {}", taskId, e);
            failTask(task, "Processing failed: " + e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.warn("Processing task {} failed", taskId, e);
            failTask(task, "Processing failed: " + e.getMessage());
            return HarvestOutcome.failed(taskId, e.getMessage());
        }
    }

    public WebhookAck handleWebhook(String requestId, String status, JsonNode data) {
        ExternalTask task = taskRepository.findNonTerminalByRequestId(requestId).orElse(null);
        if (task == null) {
            log.info("Webhook for unknown or finished request {} ignored", requestId);
            return new WebhookAck("ignored", "no active task for request id (possibly already processed)", requestId, null);
        }
        ProviderState state = ProviderState.fromProviderStatus(status);
        if (state == ProviderState.ERROR) {
            failTask(task, "Scrape failed: provider reported status " + status);
            return new WebhookAck("failed", "task marked failed", requestId, task.id());
        }
        if (state == ProviderState.RUNNING) {
            return new WebhookAck("acknowledged", "task still running", requestId, task.id());
        }
        HarvestOutcome outcome;
        if (data != null && !data.isNull() && !data.isMissingNode() && data.size() > 0) {
            ResultBundle bundle = resultParser.parse(data, task.kind(), clock.instant());
            outcome = processCompletion(task.id(), bundle);
        } else {
            outcome = pollAndProcess(task.id());
        }
        return new WebhookAck(
            outcome.disposition().name().toLowerCase(Locale.ROOT),
            outcome.message(),
            requestId,
            task.id()
        );
    }

    /**
     * Fails every non-terminal task older than the configured threshold.
     */
    public int sweepTimeouts() {
        int timeoutMinutes = properties.getPolling().getTaskTimeoutMinutes();
        Instant cutoff = clock.instant().minus(Duration.ofMinutes(timeoutMinutes));
        List<ExternalTask> stale = taskRepository.findStaleNonTerminal(cutoff);
        int failed = 0;
        for (ExternalTask task : stale) {
            if (failTask(task, "Timed out after " + timeoutMinutes + " minutes without completion")) {
                failed++;
            }
        }
        if (failed > 0) {
            log.info("Timeout sweep failed {} stuck tasks", failed);
        }
        return failed;
    }

    /**
     * Never shorter than a full classification batch plus one request timeout per side.
     */
    Duration processingLease() {
        long configured = properties.getPolling().getLockTtlSeconds();
        long batch = properties.getClassifier().getBatchTimeoutSeconds() + 2L * properties.getRequestTimeoutSeconds();
        return Duration.ofSeconds(Math.max(configured, batch));
    }

    public ExternalTask requireTask(long taskId) {
        return taskRepository.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    private boolean failTask(ExternalTask task, String error) {
        if (!taskRepository.markFailed(task.id(), error, clock.instant())) {
            return false;
        }
        log.warn("Task {} failed: {}", task.id(), error);
        notifier.notify(task.owner(), task.describeSearch() + ": " + error, NotificationType.ERROR, task.id());
        return true;
    }
}
