package com.delta.jobharvester.harvest.classify;

import com.delta.jobharvester.config.HarvesterProperties;
import com.delta.jobharvester.harvest.model.ClassificationItem;
import com.delta.jobharvester.harvest.model.Fingerprint;
import com.delta.jobharvester.harvest.model.RawPosting;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

@Component
public class ClassificationItemFactory {
    private final HarvesterProperties properties;

    public ClassificationItemFactory(HarvesterProperties properties) {
        this.properties = properties;
    }

    public ClassificationItem create(Fingerprint fingerprint, RawPosting posting) {
        return new ClassificationItem(
            fingerprint.value(),
            clean(posting.title()),
            clean(posting.company()),
            clean(posting.location()),
            plainText(posting.description())
        );
    }

    private String plainText(String description) {
        if (description == null || description.isBlank()) {
            return "";
        }
        String text = Jsoup.parse(description).text();
        int max = properties.getClassifier().getMaxDescriptionChars();
        return text.length() > max ? text.substring(0, max) : text;
    }

    private String clean(String value) {
        return value == null ? "" : value.trim();
    }
}
