package com.delta.jobharvester.harvest.persistence;

import com.delta.jobharvester.harvest.model.ClassificationResult;
import com.delta.jobharvester.harvest.model.DedupDecision;
import com.delta.jobharvester.harvest.model.HarvestedPosting;
import com.delta.jobharvester.harvest.model.HarvestedPostingView;
import com.delta.jobharvester.harvest.model.RawPosting;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Repository
public class HarvestedPostingRepository {
    private final NamedParameterJdbcTemplate jdbc;

    public HarvestedPostingRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * Replaces the task's rows so re-processing after an expired lease does not duplicate output.
     */
    @Transactional
    public int replaceForTask(long taskId, List<HarvestedPosting> postings, Instant now) {
        jdbc.update(
            "DELETE FROM harvested_postings WHERE task_id = :taskId",
            new MapSqlParameterSource("taskId", taskId)
        );
        if (postings.isEmpty()) {
            return 0;
        }
        List<MapSqlParameterSource> batch = new ArrayList<>(postings.size());
        for (HarvestedPosting posting : postings) {
            DedupDecision decision = posting.decision();
            RawPosting raw = decision.posting();
            ClassificationResult classification = posting.classification();
            batch.add(new MapSqlParameterSource()
                .addValue("taskId", taskId)
                .addValue("arrivalIndex", decision.index())
                .addValue("fingerprint", decision.fingerprint().value())
                .addValue("title", raw.title())
                .addValue("company", raw.company())
                .addValue("location", raw.location())
                .addValue("market", decision.market())
                .addValue("platform", raw.platform())
                .addValue("sourceUrl", raw.primarySourceUrl())
                .addValue("status", posting.status().label())
                .addValue("tier", classification == null ? null : classification.tier().wireValue())
                .addValue("reason", classification == null ? null : classification.reason())
                .addValue("summary", classification == null ? null : classification.summary())
                .addValue("provenance", classification == null || classification.provenance() == null
                    ? null : classification.provenance().name())
                .addValue("scrapedAt", raw.scrapedAt() == null ? null : Timestamp.from(raw.scrapedAt()))
                .addValue("now", Timestamp.from(now)));
        }
        int[] counts = jdbc.batchUpdate(
            """
                INSERT INTO harvested_postings (
                    task_id, arrival_index, fingerprint, title, company, location_text, market, platform,
                    source_url, posting_status, quality_tier, reason, summary, provenance, scraped_at, created_at
                )
                VALUES (
                    :taskId, :arrivalIndex, :fingerprint, :title, :company, :location, :market, :platform,
                    :sourceUrl, :status, :tier, :reason, :summary, :provenance, :scrapedAt, :now
                )
                """,
            batch.toArray(new MapSqlParameterSource[0])
        );
        return counts.length;
    }

    public List<HarvestedPostingView> findByTask(long taskId) {
        return jdbc.query(
            """
                SELECT *
                FROM harvested_postings
                WHERE task_id = :taskId
                ORDER BY arrival_index ASC
                """,
            new MapSqlParameterSource("taskId", taskId),
            (rs, rowNum) -> new HarvestedPostingView(
                rs.getLong("task_id"),
                rs.getInt("arrival_index"),
                rs.getString("fingerprint"),
                rs.getString("title"),
                rs.getString("company"),
                rs.getString("location_text"),
                rs.getString("market"),
                rs.getString("platform"),
                rs.getString("source_url"),
                rs.getString("posting_status"),
                rs.getString("quality_tier"),
                rs.getString("reason"),
                rs.getString("summary"),
                rs.getString("provenance"),
                rs.getTimestamp("scraped_at") == null ? null : rs.getTimestamp("scraped_at").toInstant()
            )
        );
    }

    public int countByTask(long taskId) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM harvested_postings WHERE task_id = :taskId",
            new MapSqlParameterSource("taskId", taskId),
            Integer.class
        );
        return count == null ? 0 : count;
    }
}
