package com.delta.jobharvester.harvest.dedup;

import com.delta.jobharvester.harvest.model.Fingerprint;
import com.delta.jobharvester.harvest.model.RawPosting;
import com.delta.jobharvester.harvest.util.HashUtils;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

@Component
public class PostingFingerprinter {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final String SEPARATOR = "|";

    public Fingerprint fingerprint(RawPosting posting) {
        return fingerprint(posting.company(), posting.location(), posting.title());
    }

    public Fingerprint fingerprint(String company, String location, String title) {
        String key = normalize(company) + SEPARATOR + normalize(location) + SEPARATOR + normalize(title);
        return new Fingerprint(HashUtils.sha256Hex(key));
    }

    public static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return WHITESPACE.matcher(value.toLowerCase(Locale.ROOT).trim()).replaceAll(" ");
    }
}
