package com.supersoft.photonest.media_import_processor.repository;

import com.supersoft.photonest.media_import_processor.domain.PickerSelection;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Work item store. Every state change is one conditional UPDATE keyed by id plus the
 * expected status and/or lock owner; callers read the affected-row count as the outcome.
 */
@Repository
public class PickerSelectionRepository {

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private static final RowMapper<PickerSelection> ROW_MAPPER = new RowMapper<PickerSelection>() {
        @Override
        public PickerSelection mapRow(ResultSet rs, int rowNum) throws SQLException {
            String failureKind = rs.getString("failure_kind");
            long mediaId = rs.getLong("media_id");
            boolean mediaIdNull = rs.wasNull();
            return PickerSelection.builder()
                    .id(rs.getLong("id"))
                    .sessionId(rs.getLong("session_id"))
                    .sourceType(PickerSelection.SourceType.valueOf(rs.getString("source_type")))
                    .sourceReference(rs.getString("source_reference"))
                    .baseUrl(rs.getString("base_url"))
                    .filename(rs.getString("filename"))
                    .mimeType(rs.getString("mime_type"))
                    .status(PickerSelection.SelectionStatus.valueOf(rs.getString("status")))
                    .attempts(rs.getInt("attempts"))
                    .lockedBy(rs.getString("locked_by"))
                    .lockHeartbeatAt(toLocal(rs.getTimestamp("lock_heartbeat_at")))
                    .startedAt(toLocal(rs.getTimestamp("started_at")))
                    .finishedAt(toLocal(rs.getTimestamp("finished_at")))
                    .enqueuedAt(toLocal(rs.getTimestamp("enqueued_at")))
                    .lastTransitionAt(toLocal(rs.getTimestamp("last_transition_at")))
                    .errorMsg(rs.getString("error_msg"))
                    .failureKind(failureKind != null ? PickerSelection.FailureKind.valueOf(failureKind) : null)
                    .mediaId(mediaIdNull ? null : mediaId)
                    .createdAt(toLocal(rs.getTimestamp("created_at")))
                    .build();
        }
    };

    public PickerSelection insert(PickerSelection selection) {
        String sql = "INSERT INTO picker_selection (session_id, source_type, source_reference, base_url, filename, mime_type, status, attempts, last_transition_at) VALUES (?, ?, ?, ?, ?, ?, ?, 0, ?)";

        KeyHolder keyHolder = new GeneratedKeyHolder();

        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS);
            ps.setLong(1, selection.getSessionId());
            ps.setString(2, selection.getSourceType().name());
            ps.setString(3, selection.getSourceReference());
            ps.setString(4, selection.getBaseUrl());
            ps.setString(5, selection.getFilename());
            ps.setString(6, selection.getMimeType());
            ps.setString(7, selection.getStatus().name());
            ps.setTimestamp(8, ts(selection.getLastTransitionAt()));
            return ps;
        }, keyHolder);

        selection.setId(((Number) keyHolder.getKeys().get("id")).longValue());
        return selection;
    }

    public Optional<PickerSelection> findById(Long id) {
        String sql = "SELECT * FROM picker_selection WHERE id = ?";
        List<PickerSelection> rows = jdbcTemplate.query(sql, ROW_MAPPER, id);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<PickerSelection> findBySessionId(Long sessionId) {
        String sql = "SELECT * FROM picker_selection WHERE session_id = ? ORDER BY id";
        return jdbcTemplate.query(sql, ROW_MAPPER, sessionId);
    }

    public List<PickerSelection> findBySessionIdAndStatus(Long sessionId, PickerSelection.SelectionStatus status) {
        String sql = "SELECT * FROM picker_selection WHERE session_id = ? AND status = ? ORDER BY id";
        return jdbcTemplate.query(sql, ROW_MAPPER, sessionId, status.name());
    }

    /**
     * Claims an enqueued selection for one worker. Returns the number of rows changed (0 or 1).
     */
    public int claim(Long id, Long sessionId, String workerId, LocalDateTime now) {
        String sql = "UPDATE picker_selection SET status = 'RUNNING', locked_by = ?, lock_heartbeat_at = ?, started_at = ?, " +
                "last_transition_at = ?, attempts = attempts + 1, finished_at = NULL " +
                "WHERE id = ? AND session_id = ? AND status = 'ENQUEUED'";
        Timestamp at = ts(now);
        return jdbcTemplate.update(sql, workerId, at, at, at, id, sessionId);
    }

    public boolean renewHeartbeat(Long id, String workerId, LocalDateTime now) {
        String sql = "UPDATE picker_selection SET lock_heartbeat_at = ? WHERE id = ? AND locked_by = ? AND status = 'RUNNING'";
        return jdbcTemplate.update(sql, ts(now), id, workerId) > 0;
    }

    /**
     * Writes the terminal outcome of a claimed selection. Only the lock owner can finalize.
     */
    public boolean finalizeClaimed(Long id, String workerId, PickerSelection.SelectionStatus status,
                                   PickerSelection.FailureKind failureKind, String errorMsg, Long mediaId, LocalDateTime now) {
        String sql = "UPDATE picker_selection SET status = ?, locked_by = NULL, lock_heartbeat_at = NULL, finished_at = ?, " +
                "last_transition_at = ?, error_msg = ?, failure_kind = ?, media_id = ? " +
                "WHERE id = ? AND status = 'RUNNING' AND locked_by = ?";
        Timestamp at = ts(now);
        return jdbcTemplate.update(sql,
                status.name(),
                at,
                at,
                truncate(errorMsg),
                failureKind != null ? failureKind.name() : null,
                mediaId,
                id,
                workerId) > 0;
    }

    /**
     * Hands a claimed selection back to the queue after a transient failure.
     */
    public boolean releaseForRetry(Long id, String workerId, String errorMsg, LocalDateTime now) {
        String sql = "UPDATE picker_selection SET status = 'ENQUEUED', locked_by = NULL, lock_heartbeat_at = NULL, started_at = NULL, " +
                "enqueued_at = ?, last_transition_at = ?, error_msg = ?, failure_kind = 'TRANSIENT' " +
                "WHERE id = ? AND status = 'RUNNING' AND locked_by = ?";
        Timestamp at = ts(now);
        return jdbcTemplate.update(sql, at, at, truncate(errorMsg), id, workerId) > 0;
    }

    public List<PickerSelection> findStaleRunning(LocalDateTime heartbeatCutoff, LocalDateTime startedCutoff, int limit) {
        String sql = "SELECT * FROM picker_selection WHERE status = 'RUNNING' " +
                "AND (lock_heartbeat_at IS NULL OR lock_heartbeat_at < ? OR started_at < ?) ORDER BY id LIMIT ?";
        return jdbcTemplate.query(sql, ROW_MAPPER, ts(heartbeatCutoff), ts(startedCutoff), limit);
    }

    /**
     * Returns a stale running selection to the queue. The staleness test is repeated in the
     * WHERE clause so a heartbeat written after the scan keeps the claim alive.
     */
    public boolean requeueStale(Long id, int attempts, LocalDateTime heartbeatCutoff, LocalDateTime startedCutoff, LocalDateTime now) {
        String sql = "UPDATE picker_selection SET status = 'ENQUEUED', locked_by = NULL, lock_heartbeat_at = NULL, started_at = NULL, " +
                "enqueued_at = ?, last_transition_at = ? " +
                "WHERE id = ? AND status = 'RUNNING' AND attempts = ? " +
                "AND (lock_heartbeat_at IS NULL OR lock_heartbeat_at < ? OR started_at < ?)";
        Timestamp at = ts(now);
        return jdbcTemplate.update(sql, at, at, id, attempts, ts(heartbeatCutoff), ts(startedCutoff)) > 0;
    }

    public boolean failStale(Long id, int attempts, LocalDateTime heartbeatCutoff, LocalDateTime startedCutoff,
                             String errorMsg, LocalDateTime now) {
        String sql = "UPDATE picker_selection SET status = 'FAILED', locked_by = NULL, lock_heartbeat_at = NULL, finished_at = ?, " +
                "last_transition_at = ?, error_msg = ?, failure_kind = 'LEASE_EXPIRED' " +
                "WHERE id = ? AND status = 'RUNNING' AND attempts = ? " +
                "AND (lock_heartbeat_at IS NULL OR lock_heartbeat_at < ? OR started_at < ?)";
        Timestamp at = ts(now);
        return jdbcTemplate.update(sql, at, at, truncate(errorMsg), id, attempts, ts(heartbeatCutoff), ts(startedCutoff)) > 0;
    }

    public List<PickerSelection> findRetryableFailed(int maxAttempts, int limit) {
        String sql = "SELECT * FROM picker_selection WHERE status = 'FAILED' " +
                "AND failure_kind IN ('TRANSIENT', 'LEASE_EXPIRED') AND attempts < ? ORDER BY last_transition_at LIMIT ?";
        return jdbcTemplate.query(sql, ROW_MAPPER, maxAttempts, limit);
    }

    /**
     * Moves a failed selection back to the queue once its backoff window has passed.
     * {@code eligibleBefore} is {@code now - backoff(attempts)}.
     */
    public boolean requeueFailed(Long id, int attempts, LocalDateTime eligibleBefore, LocalDateTime now) {
        String sql = "UPDATE picker_selection SET status = 'ENQUEUED', finished_at = NULL, enqueued_at = ?, last_transition_at = ? " +
                "WHERE id = ? AND status = 'FAILED' AND attempts = ? AND last_transition_at <= ?";
        Timestamp at = ts(now);
        return jdbcTemplate.update(sql, at, at, id, attempts, ts(eligibleBefore)) > 0;
    }

    public List<PickerSelection> findStuckEnqueued(LocalDateTime cutoff, int limit) {
        String sql = "SELECT * FROM picker_selection WHERE status = 'ENQUEUED' " +
                "AND COALESCE(enqueued_at, last_transition_at, created_at) < ? ORDER BY id LIMIT ?";
        return jdbcTemplate.query(sql, ROW_MAPPER, ts(cutoff), limit);
    }

    public boolean touchEnqueued(Long id, LocalDateTime cutoff, LocalDateTime now) {
        String sql = "UPDATE picker_selection SET enqueued_at = ? " +
                "WHERE id = ? AND status = 'ENQUEUED' AND COALESCE(enqueued_at, last_transition_at, created_at) < ?";
        return jdbcTemplate.update(sql, ts(now), id, ts(cutoff)) > 0;
    }

    public boolean markEnqueued(Long id, LocalDateTime now) {
        String sql = "UPDATE picker_selection SET enqueued_at = ? WHERE id = ? AND status = 'ENQUEUED'";
        return jdbcTemplate.update(sql, ts(now), id) > 0;
    }

    /**
     * Skips every selection of the session that no worker has claimed yet.
     */
    public int skipEnqueued(Long sessionId, String reason, LocalDateTime now) {
        String sql = "UPDATE picker_selection SET status = 'SKIPPED', finished_at = ?, last_transition_at = ?, error_msg = ? " +
                "WHERE session_id = ? AND status = 'ENQUEUED'";
        Timestamp at = ts(now);
        return jdbcTemplate.update(sql, at, at, truncate(reason), sessionId);
    }

    public Map<PickerSelection.SelectionStatus, Integer> countByStatus(Long sessionId) {
        String sql = "SELECT status, COUNT(*) AS cnt FROM picker_selection WHERE session_id = ? GROUP BY status";
        Map<PickerSelection.SelectionStatus, Integer> counts = new EnumMap<>(PickerSelection.SelectionStatus.class);
        jdbcTemplate.query(sql, rs -> {
            counts.put(PickerSelection.SelectionStatus.valueOf(rs.getString("status")), rs.getInt("cnt"));
        }, sessionId);
        return counts;
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= 2000) {
            return message;
        }
        return message.substring(0, 2000);
    }

    private static Timestamp ts(LocalDateTime value) {
        return value != null ? Timestamp.valueOf(value) : null;
    }

    private static LocalDateTime toLocal(Timestamp value) {
        return value != null ? value.toLocalDateTime() : null;
    }
}
