package com.delta.jobharvester.harvest.persistence;

import com.delta.jobharvester.harvest.model.NotificationType;
import com.delta.jobharvester.harvest.model.OwnerNotification;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

@Repository
public class NotificationRepository {
    private final NamedParameterJdbcTemplate jdbc;

    public NotificationRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public void insert(String owner, String message, NotificationType type, Long taskId, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("owner", owner)
            .addValue("message", message)
            .addValue("type", type.name())
            .addValue("taskId", taskId)
            .addValue("now", Timestamp.from(now));
        jdbc.update(
            """
                INSERT INTO owner_notifications (owner_name, message, notification_type, task_id, is_read, created_at)
                VALUES (:owner, :message, :type, :taskId, FALSE, :now)
                """,
            params
        );
    }

    public List<OwnerNotification> findForOwner(String owner, boolean unreadOnly, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("owner", owner)
            .addValue("limit", Math.max(1, limit));
        String sql = unreadOnly
            ? """
                SELECT * FROM owner_notifications
                WHERE owner_name = :owner AND is_read = FALSE
                ORDER BY created_at DESC, id DESC
                LIMIT :limit
                """
            : """
                SELECT * FROM owner_notifications
                WHERE owner_name = :owner
                ORDER BY created_at DESC, id DESC
                LIMIT :limit
                """;
        return jdbc.query(
            sql,
            params,
            (rs, rowNum) -> new OwnerNotification(
                rs.getLong("id"),
                rs.getString("owner_name"),
                rs.getString("message"),
                NotificationType.valueOf(rs.getString("notification_type")),
                rs.getObject("task_id") == null ? null : rs.getLong("task_id"),
                rs.getBoolean("is_read"),
                rs.getTimestamp("created_at").toInstant()
            )
        );
    }

    public int countForTask(long taskId, NotificationType type) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM owner_notifications WHERE task_id = :taskId AND notification_type = :type",
            new MapSqlParameterSource()
                .addValue("taskId", taskId)
                .addValue("type", type.name()),
            Integer.class
        );
        return count == null ? 0 : count;
    }

    public boolean markRead(long notificationId) {
        return jdbc.update(
            "UPDATE owner_notifications SET is_read = TRUE WHERE id = :id",
            new MapSqlParameterSource("id", notificationId)
        ) == 1;
    }
}
