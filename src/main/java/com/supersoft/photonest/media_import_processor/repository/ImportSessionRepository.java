package com.supersoft.photonest.media_import_processor.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.supersoft.photonest.media_import_processor.domain.ImportSession;
import com.supersoft.photonest.media_import_processor.domain.ImportSessionStats;
import lombok.extern.slf4j.Slf4j;
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
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Slf4j
@Repository
public class ImportSessionRepository {

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    private static final RowMapper<ImportSession> ROW_MAPPER = new RowMapper<ImportSession>() {
        @Override
        public ImportSession mapRow(ResultSet rs, int rowNum) throws SQLException {
            return ImportSession.builder()
                    .id(rs.getLong("id"))
                    .accountId(rs.getLong("account_id"))
                    .sessionKey(rs.getString("session_key"))
                    .status(ImportSession.SessionStatus.valueOf(rs.getString("status")))
                    .selectedCount(rs.getInt("selected_count"))
                    .statsJson(rs.getString("stats_json"))
                    .lastProgressAt(rs.getTimestamp("last_progress_at") != null ? rs.getTimestamp("last_progress_at").toLocalDateTime() : null)
                    .createdAt(rs.getTimestamp("created_at").toLocalDateTime())
                    .updatedAt(rs.getTimestamp("updated_at").toLocalDateTime())
                    .build();
        }
    };

    public ImportSession insert(ImportSession session) {
        String sql = "INSERT INTO import_session (account_id, session_key, status, selected_count, created_at, updated_at) VALUES (?, ?, ?, ?, ?, ?)";

        KeyHolder keyHolder = new GeneratedKeyHolder();

        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS);
            ps.setLong(1, session.getAccountId());
            ps.setString(2, session.getSessionKey());
            ps.setString(3, session.getStatus().name());
            ps.setInt(4, session.getSelectedCount());
            ps.setTimestamp(5, Timestamp.valueOf(session.getCreatedAt()));
            ps.setTimestamp(6, Timestamp.valueOf(session.getUpdatedAt()));
            return ps;
        }, keyHolder);

        session.setId(((Number) keyHolder.getKeys().get("id")).longValue());
        return session;
    }

    public Optional<ImportSession> findById(Long id) {
        String sql = "SELECT * FROM import_session WHERE id = ?";
        List<ImportSession> sessions = jdbcTemplate.query(sql, ROW_MAPPER, id);
        return sessions.isEmpty() ? Optional.empty() : Optional.of(sessions.get(0));
    }

    public List<ImportSession> findByStatuses(Collection<ImportSession.SessionStatus> statuses) {
        if (statuses.isEmpty()) {
            return Collections.emptyList();
        }
        String placeholders = statuses.stream().map(s -> "?").collect(Collectors.joining(", "));
        String sql = "SELECT * FROM import_session WHERE status IN (" + placeholders + ") ORDER BY id";
        Object[] params = statuses.stream().map(Enum::name).toArray();
        return jdbcTemplate.query(sql, ROW_MAPPER, params);
    }

    /**
     * Compare-and-set on the session status.
     */
    public boolean updateStatus(Long id, ImportSession.SessionStatus expected, ImportSession.SessionStatus next, LocalDateTime now) {
        String sql = "UPDATE import_session SET status = ?, last_progress_at = ?, updated_at = ? WHERE id = ? AND status = ?";
        Timestamp at = Timestamp.valueOf(now);
        int updated = jdbcTemplate.update(sql, next.name(), at, at, id, expected.name());
        if (updated == 0) {
            log.debug("Session {} status not moved {} -> {}: status changed concurrently", id, expected, next);
        }
        return updated > 0;
    }

    public void updateStats(Long id, ImportSessionStats stats, LocalDateTime now) {
        String json;
        try {
            json = objectMapper.writeValueAsString(stats);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize stats for session " + id, e);
        }
        String sql = "UPDATE import_session SET stats_json = ?, updated_at = ? WHERE id = ?";
        jdbcTemplate.update(sql, json, Timestamp.valueOf(now), id);
    }

    public Optional<ImportSessionStats> readStats(ImportSession session) {
        if (session.getStatsJson() == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(session.getStatsJson(), ImportSessionStats.class));
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable stats for session {}: {}", session.getId(), e.getMessage());
            return Optional.empty();
        }
    }
}
