package com.delta.jobharvester.harvest.dedup;

import com.delta.jobharvester.config.HarvesterProperties;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Component
public class CsvMarketResolver implements MarketResolver {
    private static final Logger log = LoggerFactory.getLogger(CsvMarketResolver.class);

    private final List<MarketKeyword> keywords;

    @Autowired
    public CsvMarketResolver(HarvesterProperties properties, ResourceLoader resourceLoader) {
        this(load(resourceLoader.getResource(properties.getDedup().getMarketsResource())));
    }

    CsvMarketResolver(List<MarketKeyword> keywords) {
        List<MarketKeyword> sorted = new ArrayList<>(keywords);
        // longest keyword wins so "fort worth" is not shadowed by a shorter match
        sorted.sort(Comparator.comparingInt((MarketKeyword entry) -> entry.keyword().length()).reversed());
        this.keywords = List.copyOf(sorted);
    }

    public static CsvMarketResolver fromReader(Reader reader) throws IOException {
        return new CsvMarketResolver(parse(reader));
    }

    @Override
    public Optional<String> resolve(String locationText) {
        if (locationText == null || locationText.isBlank()) {
            return Optional.empty();
        }
        String lower = locationText.toLowerCase(Locale.ROOT);
        for (MarketKeyword entry : keywords) {
            if (lower.contains(entry.keyword())) {
                return Optional.of(entry.market());
            }
        }
        return Optional.empty();
    }

    public int size() {
        return keywords.size();
    }

    private static List<MarketKeyword> load(Resource resource) {
        if (resource == null || !resource.exists()) {
            log.warn("Market mapping resource not found; market-scoped dedup passes will be skipped");
            return List.of();
        }
        try (Reader reader = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8)) {
            List<MarketKeyword> parsed = parse(reader);
            log.info("Loaded {} market keywords from {}", parsed.size(), resource.getDescription());
            return parsed;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load market mapping from " + resource.getDescription(), e);
        }
    }

    private static List<MarketKeyword> parse(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .setIgnoreEmptyLines(true)
            .setCommentMarker('#')
            .build();
        List<MarketKeyword> out = new ArrayList<>();
        try (CSVParser parser = format.parse(reader)) {
            for (CSVRecord record : parser) {
                if (!record.isSet("keyword") || !record.isSet("market")) {
                    continue;
                }
                String keyword = record.get("keyword").trim().toLowerCase(Locale.ROOT);
                String market = record.get("market").trim();
                if (!keyword.isEmpty() && !market.isEmpty()) {
                    out.add(new MarketKeyword(keyword, market));
                }
            }
        }
        return out;
    }

    record MarketKeyword(String keyword, String market) {
    }
}
