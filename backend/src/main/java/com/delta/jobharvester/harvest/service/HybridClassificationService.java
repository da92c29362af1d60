package com.delta.jobharvester.harvest.service;

import com.delta.jobharvester.config.HarvesterProperties;
import com.delta.jobharvester.harvest.classify.ClassificationItemFactory;
import com.delta.jobharvester.harvest.classify.ClassificationWorkQueue;
import com.delta.jobharvester.harvest.classify.ReconciliationViolationException;
import com.delta.jobharvester.harvest.model.ClassificationItem;
import com.delta.jobharvester.harvest.model.ClassificationResult;
import com.delta.jobharvester.harvest.model.DedupDecision;
import com.delta.jobharvester.harvest.model.Fingerprint;
import com.delta.jobharvester.harvest.model.ItemClassification;
import com.delta.jobharvester.harvest.model.RawPosting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serves cache hits from memory and sends only the misses to the work queue.
 */
@Service
public class HybridClassificationService {
    private static final Logger log = LoggerFactory.getLogger(HybridClassificationService.class);

    private final ClassificationCacheService cacheService;
    private final ClassificationWorkQueue workQueue;
    private final ClassificationItemFactory itemFactory;
    private final HarvesterProperties properties;

    public HybridClassificationService(
        ClassificationCacheService cacheService,
        ClassificationWorkQueue workQueue,
        ClassificationItemFactory itemFactory,
        HarvesterProperties properties
    ) {
        this.cacheService = cacheService;
        this.workQueue = workQueue;
        this.itemFactory = itemFactory;
        this.properties = properties;
    }

    /**
     * @param forceFresh skip the cache lookup and classify every posting again; fresh results are
     *                   still written back
     * @return one result per distinct fingerprint among {@code postings}
     */
    public Map<Fingerprint, ClassificationResult> classify(List<DedupDecision> postings, boolean forceFresh) {
        Map<Fingerprint, RawPosting> unique = new LinkedHashMap<>();
        for (DedupDecision decision : postings) {
            unique.putIfAbsent(decision.fingerprint(), decision.posting());
        }
        if (unique.isEmpty()) {
            return Map.of();
        }

        Map<Fingerprint, ClassificationResult> hits = forceFresh ? Map.of() : cacheService.lookup(unique.keySet());
        if (forceFresh) {
            log.info("Forced fresh classification of {} postings, cache lookup skipped", unique.size());
        }
        Map<Fingerprint, ClassificationResult> merged = new LinkedHashMap<>(hits);

        List<Fingerprint> misses = new ArrayList<>();
        List<ClassificationItem> items = new ArrayList<>();
        for (Map.Entry<Fingerprint, RawPosting> entry : unique.entrySet()) {
            if (!hits.containsKey(entry.getKey())) {
                misses.add(entry.getKey());
                items.add(itemFactory.create(entry.getKey(), entry.getValue()));
            }
        }

        if (!items.isEmpty()) {
            List<ItemClassification> classified = workQueue.classifyBatch(items);
            Map<Fingerprint, ClassificationResult> fresh = new LinkedHashMap<>();
            for (ItemClassification item : classified) {
                // bookkeeping uses our own index, never an id echoed back by the classifier
                fresh.put(misses.get(item.index()), item.result());
            }
            int written = cacheService.write(fresh);
            merged.putAll(fresh);
            log.info("Classified {} postings: {} from cache, {} fresh, {} written back",
                unique.size(), hits.size(), fresh.size(), written);
        } else {
            log.info("Classified {} postings entirely from cache", unique.size());
        }

        if (properties.getCache().isRefreshOnHit() && !hits.isEmpty()) {
            cacheService.refresh(hits.keySet());
        }

        if (!merged.keySet().containsAll(unique.keySet())) {
            throw new ReconciliationViolationException(
                "classification results cover " + merged.size() + " of " + unique.size() + " fingerprints"
            );
        }
        return merged;
    }
}
