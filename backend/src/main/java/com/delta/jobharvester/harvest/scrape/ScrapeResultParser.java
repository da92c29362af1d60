package com.delta.jobharvester.harvest.scrape;

import com.delta.jobharvester.harvest.model.RawPosting;
import com.delta.jobharvester.harvest.model.ResultBundle;
import com.delta.jobharvester.harvest.model.TaskKind;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Flattens the provider's nested result arrays into raw postings.
 */
@Component
public class ScrapeResultParser {

    public ResultBundle parse(JsonNode data, TaskKind kind, Instant retrievedAt) {
        List<JsonNode> rows = new ArrayList<>();
        flatten(data, rows);
        List<RawPosting> postings = new ArrayList<>(rows.size());
        for (JsonNode row : rows) {
            RawPosting posting = toPosting(row, kind, retrievedAt);
            if (posting != null) {
                postings.add(posting);
            }
        }
        return new ResultBundle(postings, retrievedAt);
    }

    private void flatten(JsonNode node, List<JsonNode> out) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return;
        }
        if (node.isArray()) {
            for (JsonNode child : node) {
                flatten(child, out);
            }
            return;
        }
        if (node.isObject()) {
            out.add(node);
        }
    }

    private RawPosting toPosting(JsonNode row, TaskKind kind, Instant scrapedAt) {
        String title = text(row, "title");
        if (title == null) {
            return null;
        }
        boolean google = kind == TaskKind.GOOGLE_JOBS || (kind == null && row.has("company_name"));
        String company = google ? text(row, "company_name", "company") : text(row, "company", "company_name");
        List<String> urls = new ArrayList<>();
        if (google) {
            JsonNode applyOptions = row.path("apply_options");
            if (applyOptions.isArray() && !applyOptions.isEmpty()) {
                addUrl(urls, text(applyOptions.get(0), "link"));
            }
            addUrl(urls, text(row, "link", "share_link"));
        } else {
            addUrl(urls, text(row, "link", "url", "viewjob_link"));
            addUrl(urls, text(row, "apply_link"));
        }
        String platform = google ? TaskKind.GOOGLE_JOBS.platform() : TaskKind.INDEED_JOBS.platform();
        return new RawPosting(
            title,
            company,
            text(row, "location", "formatted_location"),
            text(row, "description", "snippet"),
            platform,
            urls,
            scrapedAt
        );
    }

    private void addUrl(List<String> urls, String url) {
        if (url != null && !urls.contains(url)) {
            urls.add(url);
        }
    }

    private String text(JsonNode row, String... fields) {
        if (row == null) {
            return null;
        }
        for (String field : fields) {
            JsonNode value = row.get(field);
            if (value != null && value.isValueNode() && !value.asText().isBlank()) {
                return value.asText().trim();
            }
        }
        return null;
    }
}
