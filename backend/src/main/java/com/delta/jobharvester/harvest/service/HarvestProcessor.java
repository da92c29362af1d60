package com.delta.jobharvester.harvest.service;

import com.delta.jobharvester.harvest.dedup.DedupEngine;
import com.delta.jobharvester.harvest.dedup.PostingRuleFilter;
import com.delta.jobharvester.harvest.model.ClassificationResult;
import com.delta.jobharvester.harvest.model.DedupDecision;
import com.delta.jobharvester.harvest.model.DedupResult;
import com.delta.jobharvester.harvest.model.Fingerprint;
import com.delta.jobharvester.harvest.model.HarvestReport;
import com.delta.jobharvester.harvest.model.HarvestedPosting;
import com.delta.jobharvester.harvest.model.PostingStatus;
import com.delta.jobharvester.harvest.model.Provenance;
import com.delta.jobharvester.harvest.model.RawPosting;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Raw postings to a fully classified record set: dedup, rule filters, then hybrid classification.
 */
@Service
public class HarvestProcessor {
    private final DedupEngine dedupEngine;
    private final PostingRuleFilter ruleFilter;
    private final HybridClassificationService classificationService;

    public HarvestProcessor(
        DedupEngine dedupEngine,
        PostingRuleFilter ruleFilter,
        HybridClassificationService classificationService
    ) {
        this.dedupEngine = dedupEngine;
        this.ruleFilter = ruleFilter;
        this.classificationService = classificationService;
    }

    public HarvestReport process(List<RawPosting> postings, String searchLocation, boolean forceFreshClassification) {
        DedupResult dedup = dedupEngine.deduplicate(postings, searchLocation);

        List<DedupDecision> toClassify = new ArrayList<>();
        PostingStatus[] statuses = new PostingStatus[dedup.decisions().size()];
        int duplicates = 0;
        int filtered = 0;
        for (DedupDecision decision : dedup.decisions()) {
            if (!decision.kept()) {
                statuses[decision.index()] = new PostingStatus.Filtered(decision.collapseReason());
                duplicates++;
                continue;
            }
            Optional<String> exclusion = ruleFilter.exclusionReason(decision.posting());
            if (exclusion.isPresent()) {
                statuses[decision.index()] = new PostingStatus.Filtered(exclusion.get());
                filtered++;
            } else {
                toClassify.add(decision);
            }
        }

        Map<Fingerprint, ClassificationResult> classifications = classificationService.classify(toClassify, forceFreshClassification);

        List<HarvestedPosting> out = new ArrayList<>(dedup.decisions().size());
        int cacheHits = 0;
        int fresh = 0;
        int errors = 0;
        for (DedupDecision decision : dedup.decisions()) {
            PostingStatus status = statuses[decision.index()];
            ClassificationResult result = null;
            if (status == null) {
                result = classifications.get(decision.fingerprint());
                status = PostingStatus.forResult(result);
                if (result == null || result.provenance() == Provenance.ERROR_FALLBACK) {
                    errors++;
                } else if (result.provenance() == Provenance.FROM_CACHE) {
                    cacheHits++;
                } else {
                    fresh++;
                }
            }
            out.add(new HarvestedPosting(decision, status, result));
        }
        return new HarvestReport(out, postings.size(), duplicates, filtered, cacheHits, fresh, errors);
    }
}
