package com.delta.jobharvester.harvest.api;

import com.delta.jobharvester.config.HarvesterProperties;
import com.delta.jobharvester.harvest.model.CacheStats;
import com.delta.jobharvester.harvest.service.ClassificationCacheService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.Map;

@RestController
@RequestMapping("/api/cache")
public class CacheController {
    private final ClassificationCacheService cacheService;
    private final HarvesterProperties properties;

    public CacheController(ClassificationCacheService cacheService, HarvesterProperties properties) {
        this.cacheService = cacheService;
        this.properties = properties;
    }

    @GetMapping("/stats")
    public CacheStats stats() {
        return cacheService.stats();
    }

    @PostMapping("/purge")
    public Map<String, Integer> purge(@RequestParam(name = "olderThanDays", required = false) Integer olderThanDays) {
        int days = olderThanDays == null ? properties.getCache().getRetentionDays() : Math.max(1, olderThanDays);
        return Map.of("deleted", cacheService.purgeOlderThan(Duration.ofDays(days)));
    }
}
