package com.delta.jobharvester.harvest.dedup;

import com.delta.jobharvester.config.HarvesterProperties;
import com.delta.jobharvester.harvest.model.DedupDecision;
import com.delta.jobharvester.harvest.model.DedupResult;
import com.delta.jobharvester.harvest.model.Fingerprint;
import com.delta.jobharvester.harvest.model.RawPosting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Collapses near-duplicate postings of one harvest batch in three fixed passes. Every pass keeps the
 * first posting by arrival order and only looks at postings that are still kept.
 */
@Service
public class DedupEngine {
    private static final Logger log = LoggerFactory.getLogger(DedupEngine.class);

    public static final String EXACT_DUPLICATE = "exact duplicate";
    public static final String SAME_COMPANY_TITLE_MARKET = "same company+title+market";
    public static final String SAME_COMPANY_MARKET_SIMILAR_TITLE = "same company+market, similar title";

    private final PostingFingerprinter fingerprinter;
    private final MarketResolver marketResolver;
    private final HarvesterProperties properties;

    public DedupEngine(PostingFingerprinter fingerprinter, MarketResolver marketResolver, HarvesterProperties properties) {
        this.fingerprinter = fingerprinter;
        this.marketResolver = marketResolver;
        this.properties = properties;
    }

    public DedupResult deduplicate(List<RawPosting> postings) {
        return deduplicate(postings, null);
    }

    /**
     * @param searchLocation location the harvest targeted; used as the market for postings whose own
     *                       location does not resolve, when fallback is enabled
     */
    public DedupResult deduplicate(List<RawPosting> postings, String searchLocation) {
        if (postings == null || postings.isEmpty()) {
            return new DedupResult(List.of(), 0);
        }
        String fallbackMarket = null;
        if (properties.getDedup().isFallbackToSearchMarket()) {
            fallbackMarket = marketResolver.resolve(searchLocation).orElse(null);
        }

        List<DedupDecision> decisions = new ArrayList<>(postings.size());
        for (int i = 0; i < postings.size(); i++) {
            RawPosting posting = postings.get(i);
            Fingerprint fingerprint = fingerprinter.fingerprint(posting);
            String market = marketResolver.resolve(posting.location()).orElse(fallbackMarket);
            decisions.add(DedupDecision.kept(i, posting, fingerprint, market));
        }

        int exact = collapsePass(decisions, false, decision -> decision.fingerprint().value(), EXACT_DUPLICATE);
        int companyTitle = collapsePass(decisions, true, DedupEngine::companyTitleMarketKey, SAME_COMPANY_TITLE_MARKET);

        int similar = 0;
        int restored = 0;
        if (properties.getDedup().isSimilarTitlePassEnabled()) {
            Set<String> companiesBefore = survivingCompanies(decisions);
            Set<Integer> before = keptIndexes(decisions);
            similar = collapsePass(decisions, true, DedupEngine::similarTitleKey, SAME_COMPANY_MARKET_SIMILAR_TITLE);
            Set<Integer> collapsedBySimilar = new TreeSet<>(before);
            collapsedBySimilar.removeAll(keptIndexes(decisions));
            for (Integer index : collapsedBySimilar) {
                DedupDecision decision = decisions.get(index);
                log.debug("Similar-title collapse: '{}' at {} folded into posting #{}",
                    decision.posting().title(), decision.posting().company(), decision.collapsedInto());
            }
            restored = restoreEmptiedCompanies(decisions, companiesBefore, collapsedBySimilar);
        }

        log.info(
            "Dedup of {} postings: {} exact, {} company+title+market, {} similar-title collapsed, {} restored",
            postings.size(), exact, companyTitle, similar, restored
        );
        return new DedupResult(decisions, restored);
    }

    private int collapsePass(
        List<DedupDecision> decisions,
        boolean requiresMarket,
        Function<DedupDecision, String> keyFn,
        String reason
    ) {
        Map<String, Integer> firstByKey = new HashMap<>();
        int collapsed = 0;
        for (int i = 0; i < decisions.size(); i++) {
            DedupDecision decision = decisions.get(i);
            if (!decision.kept() || (requiresMarket && !decision.hasMarket())) {
                continue;
            }
            String key = keyFn.apply(decision);
            Integer first = firstByKey.putIfAbsent(key, decision.index());
            if (first != null) {
                decisions.set(i, decision.collapse(reason, first));
                collapsed++;
            }
        }
        return collapsed;
    }

    /**
     * Any company that had a survivor before the similar-title pass but none after gets its
     * earliest posting collapsed by that pass back.
     * <p>
     * The similar-title key starts with the company and every pass keeps the first posting of a
     * group, so with the current keys this restores nothing when called from {@link #deduplicate}.
     * It stays as a guard for key changes that could group postings across companies.
     */
    static int restoreEmptiedCompanies(
        List<DedupDecision> decisions,
        Set<String> companiesBefore,
        Set<Integer> collapsedBySimilar
    ) {
        Set<String> companiesAfter = survivingCompanies(decisions);
        int restored = 0;
        for (String company : companiesBefore) {
            if (companiesAfter.contains(company)) {
                continue;
            }
            Integer earliest = null;
            for (DedupDecision decision : decisions) {
                if (collapsedBySimilar.contains(decision.index())
                    && companyKey(decision).equals(company)
                    && (earliest == null || decision.index() < earliest)) {
                    earliest = decision.index();
                }
            }
            if (earliest != null) {
                DedupDecision decision = decisions.get(earliest);
                decisions.set(earliest, decision.restore());
                log.warn("Restored posting #{} ('{}') so company '{}' keeps at least one posting",
                    earliest, decision.posting().title(), decision.posting().company());
                restored++;
            }
        }
        return restored;
    }

    private static Set<String> survivingCompanies(List<DedupDecision> decisions) {
        Set<String> companies = new LinkedHashSet<>();
        for (DedupDecision decision : decisions) {
            if (decision.kept()) {
                companies.add(companyKey(decision));
            }
        }
        return companies;
    }

    private static Set<Integer> keptIndexes(List<DedupDecision> decisions) {
        Set<Integer> kept = new TreeSet<>();
        for (DedupDecision decision : decisions) {
            if (decision.kept()) {
                kept.add(decision.index());
            }
        }
        return kept;
    }

    private static String companyKey(DedupDecision decision) {
        return PostingFingerprinter.normalize(decision.posting().company());
    }

    private static String companyTitleMarketKey(DedupDecision decision) {
        return companyKey(decision)
            + "|" + PostingFingerprinter.normalize(decision.posting().title())
            + "|" + decision.market().toLowerCase(Locale.ROOT);
    }

    private static String similarTitleKey(DedupDecision decision) {
        return companyKey(decision)
            + "|" + decision.market().toLowerCase(Locale.ROOT)
            + "|" + TitleNormalizer.similarTitleKey(decision.posting().title());
    }
}
