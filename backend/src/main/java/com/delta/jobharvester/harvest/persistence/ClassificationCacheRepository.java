package com.delta.jobharvester.harvest.persistence;

import com.delta.jobharvester.harvest.model.CacheStats;
import com.delta.jobharvester.harvest.model.ClassificationResult;
import com.delta.jobharvester.harvest.model.ClassificationTags;
import com.delta.jobharvester.harvest.model.Fingerprint;
import com.delta.jobharvester.harvest.model.Provenance;
import com.delta.jobharvester.harvest.model.QualityTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Repository
public class ClassificationCacheRepository {
    private static final Logger log = LoggerFactory.getLogger(ClassificationCacheRepository.class);

    private final NamedParameterJdbcTemplate jdbc;
    private final boolean postgres;

    public ClassificationCacheRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.postgres = detectPostgres(jdbc);
    }

    public Map<Fingerprint, CachedClassification> findClassifiedSince(Collection<String> fingerprints, Instant cutoff) {
        Map<Fingerprint, CachedClassification> out = new LinkedHashMap<>();
        if (fingerprints == null || fingerprints.isEmpty()) {
            return out;
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("fingerprints", fingerprints)
            .addValue("cutoff", Timestamp.from(cutoff));
        jdbc.query(
            """
                SELECT fingerprint, quality_tier, reason, summary, route_type, fair_chance,
                       endorsements, career_pathway, training_provided, classified_at
                FROM classification_cache
                WHERE fingerprint IN (:fingerprints)
                  AND classified_at >= :cutoff
                """,
            params,
            rs -> {
                QualityTier tier = QualityTier.fromWire(rs.getString("quality_tier"));
                if (tier == null) {
                    log.warn("Ignoring cache row {} with unknown tier", rs.getString("fingerprint"));
                    return;
                }
                Object training = rs.getObject("training_provided");
                ClassificationResult result = new ClassificationResult(
                    tier,
                    rs.getString("reason"),
                    rs.getString("summary"),
                    new ClassificationTags(
                        rs.getString("route_type"),
                        rs.getString("fair_chance"),
                        rs.getString("endorsements"),
                        rs.getString("career_pathway"),
                        training == null ? null : rs.getBoolean("training_provided")
                    ),
                    Provenance.FROM_CACHE
                );
                out.put(
                    new Fingerprint(rs.getString("fingerprint")),
                    new CachedClassification(result, rs.getTimestamp("classified_at").toInstant())
                );
            }
        );
        return out;
    }

    public void upsert(Fingerprint fingerprint, ClassificationResult result, Instant classifiedAt) {
        ClassificationTags tags = result.tags();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("fingerprint", fingerprint.value())
            .addValue("tier", result.tier().wireValue())
            .addValue("reason", result.reason())
            .addValue("summary", result.summary())
            .addValue("routeType", tags.routeType())
            .addValue("fairChance", tags.fairChance())
            .addValue("endorsements", tags.endorsements())
            .addValue("careerPathway", tags.careerPathway())
            .addValue("trainingProvided", tags.trainingProvided())
            .addValue("classifiedAt", Timestamp.from(classifiedAt));

        if (postgres) {
            jdbc.update(
                """
                    INSERT INTO classification_cache (
                        fingerprint, quality_tier, reason, summary, route_type, fair_chance,
                        endorsements, career_pathway, training_provided, classified_at, created_at, updated_at
                    )
                    VALUES (
                        :fingerprint, :tier, :reason, :summary, :routeType, :fairChance,
                        :endorsements, :careerPathway, :trainingProvided, :classifiedAt, :classifiedAt, :classifiedAt
                    )
                    ON CONFLICT (fingerprint) DO UPDATE SET
                        quality_tier = EXCLUDED.quality_tier,
                        reason = EXCLUDED.reason,
                        summary = EXCLUDED.summary,
                        route_type = EXCLUDED.route_type,
                        fair_chance = EXCLUDED.fair_chance,
                        endorsements = EXCLUDED.endorsements,
                        career_pathway = EXCLUDED.career_pathway,
                        training_provided = EXCLUDED.training_provided,
                        classified_at = EXCLUDED.classified_at,
                        updated_at = EXCLUDED.updated_at
                    """,
                params
            );
            return;
        }

        int updated = jdbc.update(
            """
                UPDATE classification_cache
                SET quality_tier = :tier,
                    reason = :reason,
                    summary = :summary,
                    route_type = :routeType,
                    fair_chance = :fairChance,
                    endorsements = :endorsements,
                    career_pathway = :careerPathway,
                    training_provided = :trainingProvided,
                    classified_at = :classifiedAt,
                    updated_at = :classifiedAt
                WHERE fingerprint = :fingerprint
                """,
            params
        );
        if (updated == 0) {
            jdbc.update(
                """
                    INSERT INTO classification_cache (
                        fingerprint, quality_tier, reason, summary, route_type, fair_chance,
                        endorsements, career_pathway, training_provided, classified_at, created_at, updated_at
                    )
                    VALUES (
                        :fingerprint, :tier, :reason, :summary, :routeType, :fairChance,
                        :endorsements, :careerPathway, :trainingProvided, :classifiedAt, :classifiedAt, :classifiedAt
                    )
                    """,
                params
            );
        }
    }

    public int touch(Collection<String> fingerprints, Instant classifiedAt) {
        if (fingerprints == null || fingerprints.isEmpty()) {
            return 0;
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("fingerprints", fingerprints)
            .addValue("classifiedAt", Timestamp.from(classifiedAt));
        return jdbc.update(
            """
                UPDATE classification_cache
                SET classified_at = :classifiedAt,
                    updated_at = :classifiedAt
                WHERE fingerprint IN (:fingerprints)
                """,
            params
        );
    }

    public int deleteClassifiedBefore(Instant cutoff) {
        return jdbc.update(
            "DELETE FROM classification_cache WHERE classified_at < :cutoff",
            new MapSqlParameterSource("cutoff", Timestamp.from(cutoff))
        );
    }

    public CacheStats stats(Instant freshCutoff, int ttlHours) {
        List<CacheStats> rows = jdbc.query(
            """
                SELECT COUNT(*) AS total_entries,
                       SUM(CASE WHEN classified_at >= :cutoff THEN 1 ELSE 0 END) AS fresh_entries,
                       MIN(classified_at) AS oldest,
                       MAX(classified_at) AS newest
                FROM classification_cache
                """,
            new MapSqlParameterSource("cutoff", Timestamp.from(freshCutoff)),
            (rs, rowNum) -> new CacheStats(
                rs.getLong("total_entries"),
                rs.getLong("fresh_entries"),
                toInstant(rs.getTimestamp("oldest")),
                toInstant(rs.getTimestamp("newest")),
                ttlHours
            )
        );
        return rows.isEmpty() ? new CacheStats(0, 0, null, null, ttlHours) : rows.get(0);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private boolean detectPostgres(NamedParameterJdbcTemplate jdbcTemplate) {
        if (jdbcTemplate.getJdbcTemplate().getDataSource() == null) {
            return false;
        }
        try (Connection connection = jdbcTemplate.getJdbcTemplate().getDataSource().getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String productName = metaData == null ? null : metaData.getDatabaseProductName();
            String url = metaData == null ? null : metaData.getURL();
            if (url != null && url.toLowerCase(Locale.ROOT).startsWith("jdbc:h2:")) {
                return false;
            }
            return productName != null && productName.toLowerCase(Locale.ROOT).contains("postgres");
        } catch (Exception e) {
            log.warn("Could not detect database product; using portable upsert", e);
            return false;
        }
    }

    public record CachedClassification(ClassificationResult result, Instant classifiedAt) {
    }
}
