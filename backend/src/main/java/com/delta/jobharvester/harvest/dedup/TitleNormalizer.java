package com.delta.jobharvester.harvest.dedup;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical title key for the similar-title pass: punctuation stripped, synonym groups folded.
 */
public final class TitleNormalizer {
    private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{N}_\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    // order matters: "truck driver" must fold before the bare "driver" rule sees it
    private static final List<SynonymRule> SYNONYMS = List.of(
        new SynonymRule("\\b(no exp|no experience|entry level|recent grad)\\b", "noexp"),
        new SynonymRule("\\b(class a|cdl a|cdl-a)\\b", "cdla"),
        new SynonymRule("\\b(truck driver|driver)\\b", "driver"),
        new SynonymRule("\\b(dry van|van)\\b", "dryvan")
    );

    private TitleNormalizer() {
    }

    public static String similarTitleKey(String title) {
        if (title == null) {
            return "";
        }
        String value = WHITESPACE.matcher(title.toLowerCase(Locale.ROOT).trim()).replaceAll(" ");
        value = PUNCTUATION.matcher(value).replaceAll("");
        for (SynonymRule rule : SYNONYMS) {
            value = rule.pattern().matcher(value).replaceAll(rule.replacement());
        }
        return WHITESPACE.matcher(value.trim()).replaceAll(" ");
    }

    private record SynonymRule(Pattern pattern, String replacement) {
        SynonymRule(String regex, String replacement) {
            this(Pattern.compile(regex), replacement);
        }
    }
}
