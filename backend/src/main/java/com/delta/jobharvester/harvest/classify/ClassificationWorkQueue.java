package com.delta.jobharvester.harvest.classify;

import com.delta.jobharvester.config.HarvesterProperties;
import com.delta.jobharvester.harvest.http.ExternalServiceException;
import com.delta.jobharvester.harvest.http.RetryPolicy;
import com.delta.jobharvester.harvest.model.ClassificationItem;
import com.delta.jobharvester.harvest.model.ClassificationResult;
import com.delta.jobharvester.harvest.model.ItemClassification;
import com.delta.jobharvester.harvest.model.Provenance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Classifies a batch of items with a bounded pool of workers sharing one to-do queue.
 * The returned list always has one entry per input item, in input order. Item ids must be unique
 * within a batch.
 */
@Service
public class ClassificationWorkQueue {
    private static final Logger log = LoggerFactory.getLogger(ClassificationWorkQueue.class);
    static final String MISSING_RESULT = "Missing result";

    private final ClassificationClient client;
    private final ExecutorService executor;
    private final RetryPolicy retryPolicy;
    private final int concurrency;
    private final Duration batchTimeout;

    @Autowired
    public ClassificationWorkQueue(
        ClassificationClient client,
        HarvesterProperties properties,
        @Qualifier("classificationExecutor") ExecutorService executor
    ) {
        this(
            client,
            executor,
            RetryPolicy.forExternalCalls(
                properties.getClassifier().getMaxAttempts(),
                Duration.ofMillis(properties.getClassifier().getRetryBaseDelayMs()),
                Duration.ofMillis(properties.getClassifier().getRetryMaxDelayMs())
            ),
            properties.getClassifier().getConcurrency(),
            Duration.ofSeconds(properties.getClassifier().getBatchTimeoutSeconds())
        );
    }

    public ClassificationWorkQueue(
        ClassificationClient client,
        ExecutorService executor,
        RetryPolicy retryPolicy,
        int concurrency,
        Duration batchTimeout
    ) {
        this.client = client;
        this.executor = executor;
        this.retryPolicy = retryPolicy;
        this.concurrency = Math.max(1, concurrency);
        this.batchTimeout = batchTimeout;
    }

    public List<ItemClassification> classifyBatch(List<ClassificationItem> items) {
        if (items == null || items.isEmpty()) {
            return List.of();
        }
        requireDistinctIds(items);
        Queue<Integer> todo = new ConcurrentLinkedQueue<>();
        for (int i = 0; i < items.size(); i++) {
            todo.add(i);
        }
        Map<Integer, ClassificationResult> results = new ConcurrentHashMap<>();
        AtomicBoolean stopDequeuing = new AtomicBoolean(false);

        int workerCount = Math.min(concurrency, items.size());
        List<CompletableFuture<Void>> workers = new ArrayList<>(workerCount);
        try {
            for (int w = 0; w < workerCount; w++) {
                workers.add(CompletableFuture.runAsync(() -> drain(items, todo, results, stopDequeuing), executor));
            }
            CompletableFuture.allOf(workers.toArray(new CompletableFuture[0]))
                .get(batchTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            stopDequeuing.set(true);
            log.warn("Classification batch of {} timed out after {}s with {} results",
                items.size(), batchTimeout.toSeconds(), results.size());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopDequeuing.set(true);
            log.warn("Classification batch interrupted with {} of {} results", results.size(), items.size());
        } catch (ExecutionException | RejectedExecutionException e) {
            stopDequeuing.set(true);
            log.error("Classification worker failed unexpectedly", e);
        }
        return reconcile(items, Map.copyOf(results));
    }

    private static void requireDistinctIds(List<ClassificationItem> items) {
        Set<String> seen = new HashSet<>();
        for (ClassificationItem item : items) {
            if (!seen.add(item.itemId())) {
                throw new ReconciliationViolationException(
                    "item id " + item.itemId() + " appears more than once in a batch of " + items.size()
                );
            }
        }
    }

    private void drain(
        List<ClassificationItem> items,
        Queue<Integer> todo,
        Map<Integer, ClassificationResult> results,
        AtomicBoolean stopDequeuing
    ) {
        Integer index;
        while (!stopDequeuing.get() && (index = todo.poll()) != null) {
            results.put(index, classifyOne(items.get(index)));
        }
    }

    private ClassificationResult classifyOne(ClassificationItem item) {
        try {
            ClassificationResult result = retryPolicy.execute("classify " + item.itemId(), () -> client.classify(item));
            if (result == null || !result.isComplete()) {
                return ClassificationResult.errorFallback("incomplete classification response");
            }
            return result.withProvenance(Provenance.FRESHLY_CLASSIFIED);
        } catch (ExternalServiceException e) {
            log.warn("Classification of {} failed ({}): {}", item.itemId(), e.failureClass(), e.getMessage());
            return ClassificationResult.errorFallback(e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Classification of {} failed unexpectedly", item.itemId(), e);
            return ClassificationResult.errorFallback("unexpected error: " + e.getMessage());
        }
    }

    private List<ItemClassification> reconcile(List<ClassificationItem> items, Map<Integer, ClassificationResult> results) {
        List<ItemClassification> out = new ArrayList<>(items.size());
        int missing = 0;
        for (int i = 0; i < items.size(); i++) {
            ClassificationResult result = results.get(i);
            if (result == null) {
                missing++;
                result = ClassificationResult.errorFallback(MISSING_RESULT);
            }
            out.add(new ItemClassification(i, items.get(i).itemId(), result));
        }
        if (missing > 0) {
            log.warn("Synthesized {} error results for items without a classification", missing);
        }
        return out;
    }
}
