package com.delta.jobharvester.harvest.service;

import com.delta.jobharvester.config.HarvesterProperties;
import com.delta.jobharvester.harvest.model.CacheStats;
import com.delta.jobharvester.harvest.model.ClassificationResult;
import com.delta.jobharvester.harvest.model.Fingerprint;
import com.delta.jobharvester.harvest.persistence.ClassificationCacheRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Fingerprint-keyed memory of prior classifications. An entry is a hit while
 * {@code now - classified_at <= ttl}.
 */
@Service
public class ClassificationCacheService {
    private static final Logger log = LoggerFactory.getLogger(ClassificationCacheService.class);

    private final ClassificationCacheRepository repository;
    private final HarvesterProperties properties;
    private final Clock clock;

    public ClassificationCacheService(ClassificationCacheRepository repository, HarvesterProperties properties, Clock clock) {
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
    }

    public Duration defaultTtl() {
        return Duration.ofHours(properties.getCache().getTtlHours());
    }

    public Map<Fingerprint, ClassificationResult> lookup(Collection<Fingerprint> fingerprints) {
        return lookup(fingerprints, defaultTtl());
    }

    public Map<Fingerprint, ClassificationResult> lookup(Collection<Fingerprint> fingerprints, Duration ttl) {
        Map<Fingerprint, ClassificationResult> hits = new LinkedHashMap<>();
        if (fingerprints == null || fingerprints.isEmpty()) {
            return hits;
        }
        Instant cutoff = clock.instant().minus(ttl);
        List<String> keys = new ArrayList<>(new LinkedHashSet<>(fingerprints.stream().map(Fingerprint::value).toList()));
        int batchSize = properties.getCache().getLookupBatchSize();
        for (int start = 0; start < keys.size(); start += batchSize) {
            List<String> chunk = keys.subList(start, Math.min(keys.size(), start + batchSize));
            repository.findClassifiedSince(chunk, cutoff)
                .forEach((fingerprint, cached) -> hits.put(fingerprint, cached.result()));
        }
        log.debug("Cache lookup: {} of {} fingerprints hit within {}h", hits.size(), keys.size(), ttl.toHours());
        return hits;
    }

    /**
     * Upserts complete, non-error results. Returns the number written.
     */
    public int write(Map<Fingerprint, ClassificationResult> results) {
        if (results == null || results.isEmpty()) {
            return 0;
        }
        Instant now = clock.instant();
        int written = 0;
        for (Map.Entry<Fingerprint, ClassificationResult> entry : results.entrySet()) {
            ClassificationResult result = entry.getValue();
            if (result == null || !result.isCacheable()) {
                log.warn("Refusing to cache incomplete or error classification for {}", entry.getKey());
                continue;
            }
            repository.upsert(entry.getKey(), result, now);
            written++;
        }
        return written;
    }

    public int refresh(Collection<Fingerprint> fingerprints) {
        if (fingerprints == null || fingerprints.isEmpty()) {
            return 0;
        }
        List<String> keys = fingerprints.stream().map(Fingerprint::value).distinct().toList();
        Instant now = clock.instant();
        int batchSize = properties.getCache().getLookupBatchSize();
        int refreshed = 0;
        for (int start = 0; start < keys.size(); start += batchSize) {
            refreshed += repository.touch(keys.subList(start, Math.min(keys.size(), start + batchSize)), now);
        }
        return refreshed;
    }

    public int purgeOlderThan(Duration retention) {
        int deleted = repository.deleteClassifiedBefore(clock.instant().minus(retention));
        log.info("Purged {} cache entries older than {} days", deleted, retention.toDays());
        return deleted;
    }

    public CacheStats stats() {
        return repository.stats(clock.instant().minus(defaultTtl()), properties.getCache().getTtlHours());
    }
}
