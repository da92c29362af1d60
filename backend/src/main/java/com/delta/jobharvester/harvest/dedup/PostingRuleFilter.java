package com.delta.jobharvester.harvest.dedup;

import com.delta.jobharvester.config.HarvesterProperties;
import com.delta.jobharvester.harvest.model.RawPosting;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Business-rule exclusions applied to dedup survivors before they are classified.
 */
@Component
public class PostingRuleFilter {
    public static final String SPAM_SOURCE = "spam source";
    public static final String OWNER_OPERATOR = "owner-operator";
    public static final String SCHOOL_BUS = "school bus";

    private final HarvesterProperties properties;

    public PostingRuleFilter(HarvesterProperties properties) {
        this.properties = properties;
    }

    public Optional<String> exclusionReason(RawPosting posting) {
        HarvesterProperties.Filters filters = properties.getFilters();
        String company = PostingFingerprinter.normalize(posting.company());
        if (filters.getSpamCompanies().stream().map(PostingFingerprinter::normalize).anyMatch(company::equals)) {
            return Optional.of(SPAM_SOURCE);
        }
        for (String url : posting.sourceUrls()) {
            String lowerUrl = url == null ? "" : url.toLowerCase(Locale.ROOT);
            if (filters.getSpamDomains().stream().anyMatch(domain -> lowerUrl.contains(domain.toLowerCase(Locale.ROOT)))) {
                return Optional.of(SPAM_SOURCE);
            }
        }
        String text = PostingFingerprinter.normalize(posting.title()) + " " + PostingFingerprinter.normalize(posting.description());
        if (containsAny(text, filters.getOwnerOperatorKeywords())) {
            return Optional.of(OWNER_OPERATOR);
        }
        String titleAndCompany = PostingFingerprinter.normalize(posting.title()) + " " + company;
        if (containsAny(titleAndCompany, filters.getSchoolBusKeywords())) {
            return Optional.of(SCHOOL_BUS);
        }
        return Optional.empty();
    }

    private boolean containsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (keyword == null || keyword.isBlank()) {
                continue;
            }
            // word boundaries keep short keywords like "isd" from matching inside other words
            Pattern pattern = Pattern.compile("\\b" + Pattern.quote(keyword.toLowerCase(Locale.ROOT).trim()) + "\\b");
            if (pattern.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }
}
