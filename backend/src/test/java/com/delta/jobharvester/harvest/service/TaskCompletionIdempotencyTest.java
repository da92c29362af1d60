package com.delta.jobharvester.harvest.service;

import com.delta.jobharvester.harvest.classify.ClassificationClient;
import com.delta.jobharvester.harvest.model.ClassificationResult;
import com.delta.jobharvester.harvest.model.ClassificationTags;
import com.delta.jobharvester.harvest.model.ExternalTask;
import com.delta.jobharvester.harvest.model.HarvestOutcome;
import com.delta.jobharvester.harvest.model.HarvestedPostingView;
import com.delta.jobharvester.harvest.model.NotificationType;
import com.delta.jobharvester.harvest.model.Provenance;
import com.delta.jobharvester.harvest.model.QualityTier;
import com.delta.jobharvester.harvest.model.RawPosting;
import com.delta.jobharvester.harvest.model.ResultBundle;
import com.delta.jobharvester.harvest.model.SearchParams;
import com.delta.jobharvester.harvest.model.TaskKind;
import com.delta.jobharvester.harvest.model.TaskState;
import com.delta.jobharvester.harvest.model.WebhookAck;
import com.delta.jobharvester.harvest.persistence.ExternalTaskRepository;
import com.delta.jobharvester.harvest.persistence.HarvestedPostingRepository;
import com.delta.jobharvester.harvest.persistence.NotificationRepository;
import com.delta.jobharvester.harvest.scrape.ScrapingProviderClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SpringBootTest
@ActiveProfiles("test")
class TaskCompletionIdempotencyTest {

    @MockBean
    private ScrapingProviderClient provider;

    @MockBean
    private ClassificationClient classificationClient;

    @Autowired
    private TaskOrchestratorService orchestrator;

    @Autowired
    private ExternalTaskRepository taskRepository;

    @Autowired
    private HarvestedPostingRepository postingRepository;

    @Autowired
    private NotificationRepository notificationRepository;

    private String company;

    @BeforeEach
    void setUp() {
        company = "Idempotent Freight " + UUID.randomUUID().toString().substring(0, 8);
        when(provider.submit(any(), any(), any())).thenAnswer(invocation -> "req-" + UUID.randomUUID());
        when(classificationClient.classify(any())).thenReturn(new ClassificationResult(
            QualityTier.GOOD,
            "Entry-level local",
            "Home daily, W-2",
            new ClassificationTags("Local", "unknown", null, "none", true),
            Provenance.FRESHLY_CLASSIFIED
        ));
    }

    @Test
    void secondCompletionForSameTaskHasNoSideEffects() {
        ExternalTask task = orchestrator.submit("robin", TaskKind.GOOGLE_JOBS, new SearchParams("CDL-A driver", "Dallas, TX", 50, false));
        ResultBundle bundle = bundle();

        HarvestOutcome first = orchestrator.processCompletion(task.id(), bundle);
        HarvestOutcome second = orchestrator.processCompletion(task.id(), bundle);

        assertThat(first.disposition()).isEqualTo(HarvestOutcome.Disposition.PROCESSED);
        assertThat(first.resultCount()).isEqualTo(3);
        assertThat(second.disposition()).isEqualTo(HarvestOutcome.Disposition.SKIPPED);
        assertThat(postingRepository.countByTask(task.id())).isEqualTo(3);
        assertThat(notificationRepository.countForTask(task.id(), NotificationType.SEARCH_COMPLETE)).isEqualTo(1);
        verify(classificationClient, times(2)).classify(any());

        ExternalTask stored = taskRepository.findById(task.id()).orElseThrow();
        assertThat(stored.state()).isEqualTo(TaskState.PROCESSED);
        assertThat(stored.qualityJobCount()).isEqualTo(2);
    }

    @Test
    void lateWebhookAfterPollCompletionIsIgnored() {
        ExternalTask task = orchestrator.submit("robin", TaskKind.GOOGLE_JOBS, new SearchParams("CDL-A driver", "Dallas, TX", 50, false));
        orchestrator.processCompletion(task.id(), bundle());

        WebhookAck ack = orchestrator.handleWebhook(task.requestId(), "Success", null);

        assertThat(ack.status()).isEqualTo("ignored");
        assertThat(notificationRepository.countForTask(task.id(), NotificationType.SEARCH_COMPLETE)).isEqualTo(1);
    }

    @Test
    void storedPostingsCarryStatusAndClassification() {
        ExternalTask task = orchestrator.submit("robin", TaskKind.GOOGLE_JOBS, new SearchParams("CDL-A driver", "Dallas, TX", 50, false));
        orchestrator.processCompletion(task.id(), bundle());

        List<HarvestedPostingView> postings = postingRepository.findByTask(task.id());

        assertThat(postings).hasSize(3);
        assertThat(postings.get(0).status()).isEqualTo("freshly_classified");
        assertThat(postings.get(1).status()).isEqualTo("filtered: exact duplicate");
        assertThat(postings.get(0).market()).isEqualTo("Dallas");
    }

    @Test
    void repeatedSearchGetsItsOwnRequestId() {
        SearchParams params = new SearchParams("CDL-A driver", "Dallas, TX", 50, false);

        ExternalTask first = orchestrator.submit("robin", TaskKind.GOOGLE_JOBS, params);
        ExternalTask second = orchestrator.submit("robin", TaskKind.GOOGLE_JOBS, params);

        assertThat(first.id()).isNotEqualTo(second.id());
        assertThat(first.requestId()).isNotEqualTo(second.requestId());
        assertThat(notificationRepository.countForTask(first.id(), NotificationType.SEARCH_SUBMITTED)).isEqualTo(1);
    }

    private ResultBundle bundle() {
        Instant now = Instant.now();
        return new ResultBundle(List.of(
            new RawPosting("Local CDL-A Driver", company, "Dallas, TX", "Home daily", "google", List.of("https://a.example/1"), now),
            new RawPosting("Local CDL-A Driver", company, "Dallas, TX", "Home daily", "google", List.of("https://a.example/2"), now),
            new RawPosting("Yard Hostler", company, "Irving, TX", "Nights", "google", List.of("https://a.example/3"), now)
        ), now);
    }
}
