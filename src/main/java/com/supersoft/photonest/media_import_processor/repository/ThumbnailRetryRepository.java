package com.supersoft.photonest.media_import_processor.repository;

import com.supersoft.photonest.media_import_processor.domain.ThumbnailRetryRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * One row per media id. The unique key on {@code media_id} plus attempt-guarded updates keep at
 * most one pending retry per media.
 */
@Slf4j
@Repository
public class ThumbnailRetryRepository {

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private static final RowMapper<ThumbnailRetryRecord> ROW_MAPPER = new RowMapper<ThumbnailRetryRecord>() {
        @Override
        public ThumbnailRetryRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            return ThumbnailRetryRecord.builder()
                    .id(rs.getLong("id"))
                    .mediaId(rs.getLong("media_id"))
                    .status(ThumbnailRetryRecord.RetryStatus.valueOf(rs.getString("status")))
                    .attempts(rs.getInt("attempts"))
                    .forceRegenerate(rs.getBoolean("force_regenerate"))
                    .blockersJson(rs.getString("blockers_json"))
                    .scheduledJobId(rs.getString("scheduled_job_id"))
                    .scheduledFor(rs.getTimestamp("scheduled_for") != null ? rs.getTimestamp("scheduled_for").toLocalDateTime() : null)
                    .disabled(rs.getBoolean("disabled"))
                    .monitorReported(rs.getBoolean("monitor_reported"))
                    .createdAt(rs.getTimestamp("created_at").toLocalDateTime())
                    .updatedAt(rs.getTimestamp("updated_at").toLocalDateTime())
                    .build();
        }
    };

    public Optional<ThumbnailRetryRecord> findByMediaId(Long mediaId) {
        String sql = "SELECT * FROM thumbnail_retry WHERE media_id = ?";
        List<ThumbnailRetryRecord> rows = jdbcTemplate.query(sql, ROW_MAPPER, mediaId);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public ThumbnailRetryRecord getOrCreate(Long mediaId, boolean forceRegenerate, LocalDateTime now) {
        Optional<ThumbnailRetryRecord> existing = findByMediaId(mediaId);
        if (existing.isPresent()) {
            return existing.get();
        }
        try {
            String sql = "INSERT INTO thumbnail_retry (media_id, status, attempts, force_regenerate, created_at, updated_at) VALUES (?, 'IDLE', 0, ?, ?, ?)";
            Timestamp at = Timestamp.valueOf(now);
            jdbcTemplate.update(sql, mediaId, forceRegenerate, at, at);
        } catch (DuplicateKeyException e) {
            log.debug("Retry record for media {} created concurrently", mediaId);
        }
        return findByMediaId(mediaId)
                .orElseThrow(() -> new IllegalStateException("Retry record for media " + mediaId + " vanished after insert"));
    }

    /**
     * Stores a freshly scheduled retry. Guarded by the attempt count read before scheduling.
     */
    public boolean persistScheduled(Long mediaId, int expectedAttempts, String jobId, LocalDateTime scheduledFor,
                                    boolean forceRegenerate, String blockersJson, LocalDateTime now) {
        String sql = "UPDATE thumbnail_retry SET status = 'SCHEDULED', attempts = ?, scheduled_job_id = ?, scheduled_for = ?, " +
                "force_regenerate = ?, blockers_json = ?, updated_at = ? " +
                "WHERE media_id = ? AND attempts = ? AND disabled = FALSE";
        return jdbcTemplate.update(sql,
                expectedAttempts + 1,
                jobId,
                Timestamp.valueOf(scheduledFor),
                forceRegenerate,
                blockersJson,
                Timestamp.valueOf(now),
                mediaId,
                expectedAttempts) > 0;
    }

    public boolean markExhausted(Long mediaId, String blockersJson, LocalDateTime now) {
        String sql = "UPDATE thumbnail_retry SET status = 'EXHAUSTED', disabled = TRUE, scheduled_job_id = NULL, scheduled_for = NULL, " +
                "blockers_json = ?, updated_at = ? WHERE media_id = ? AND disabled = FALSE";
        return jdbcTemplate.update(sql, blockersJson, Timestamp.valueOf(now), mediaId) > 0;
    }

    public boolean clearSuccess(Long mediaId, LocalDateTime now) {
        String sql = "UPDATE thumbnail_retry SET status = 'SUCCEEDED', attempts = 0, scheduled_job_id = NULL, scheduled_for = NULL, " +
                "blockers_json = NULL, disabled = FALSE, monitor_reported = FALSE, updated_at = ? WHERE media_id = ?";
        return jdbcTemplate.update(sql, Timestamp.valueOf(now), mediaId) > 0;
    }

    public boolean cancel(Long mediaId, LocalDateTime now) {
        String sql = "UPDATE thumbnail_retry SET status = 'CANCELED', scheduled_job_id = NULL, scheduled_for = NULL, updated_at = ? " +
                "WHERE media_id = ? AND status IN ('IDLE', 'SCHEDULED', 'RUNNING')";
        return jdbcTemplate.update(sql, Timestamp.valueOf(now), mediaId) > 0;
    }

    /**
     * Takes ownership of one scheduled delivery. Either the delayed message or the monitor wins.
     */
    public boolean markRunning(Long mediaId, String jobId, LocalDateTime now) {
        String sql = "UPDATE thumbnail_retry SET status = 'RUNNING', updated_at = ? WHERE media_id = ? AND status = 'SCHEDULED' AND scheduled_job_id = ?";
        return jdbcTemplate.update(sql, Timestamp.valueOf(now), mediaId, jobId) > 0;
    }

    public List<ThumbnailRetryRecord> findDue(LocalDateTime dueBefore, int limit) {
        String sql = "SELECT * FROM thumbnail_retry WHERE status = 'SCHEDULED' AND scheduled_for <= ? ORDER BY scheduled_for LIMIT ?";
        return jdbcTemplate.query(sql, ROW_MAPPER, Timestamp.valueOf(dueBefore), limit);
    }

    public List<ThumbnailRetryRecord> findDisabled(int limit) {
        String sql = "SELECT * FROM thumbnail_retry WHERE disabled = TRUE ORDER BY updated_at DESC LIMIT ?";
        return jdbcTemplate.query(sql, ROW_MAPPER, limit);
    }

    public List<ThumbnailRetryRecord> findDisabledUnreported(int limit) {
        String sql = "SELECT * FROM thumbnail_retry WHERE disabled = TRUE AND monitor_reported = FALSE ORDER BY id LIMIT ?";
        return jdbcTemplate.query(sql, ROW_MAPPER, limit);
    }

    public boolean markMonitorReported(Long mediaId, LocalDateTime now) {
        String sql = "UPDATE thumbnail_retry SET monitor_reported = TRUE, updated_at = ? WHERE media_id = ? AND monitor_reported = FALSE";
        return jdbcTemplate.update(sql, Timestamp.valueOf(now), mediaId) > 0;
    }
}
