package com.supersoft.photonest.media_import_processor.repository;

import com.supersoft.photonest.media_import_processor.domain.ImportJob;
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
import java.util.List;

@Repository
public class ImportJobRepository {

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private static final RowMapper<ImportJob> ROW_MAPPER = new RowMapper<ImportJob>() {
        @Override
        public ImportJob mapRow(ResultSet rs, int rowNum) throws SQLException {
            return ImportJob.builder()
                    .id(rs.getLong("id"))
                    .sessionId(rs.getLong("session_id"))
                    .targetType(rs.getString("target_type"))
                    .status(ImportJob.JobStatus.valueOf(rs.getString("status")))
                    .statsJson(rs.getString("stats_json"))
                    .startedAt(rs.getTimestamp("started_at") != null ? rs.getTimestamp("started_at").toLocalDateTime() : null)
                    .finishedAt(rs.getTimestamp("finished_at") != null ? rs.getTimestamp("finished_at").toLocalDateTime() : null)
                    .createdAt(rs.getTimestamp("created_at").toLocalDateTime())
                    .build();
        }
    };

    public ImportJob insert(ImportJob job) {
        String sql = "INSERT INTO import_job (session_id, target_type, status, started_at, created_at) VALUES (?, ?, ?, ?, ?)";

        KeyHolder keyHolder = new GeneratedKeyHolder();

        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS);
            ps.setLong(1, job.getSessionId());
            ps.setString(2, job.getTargetType());
            ps.setString(3, job.getStatus().name());
            ps.setTimestamp(4, job.getStartedAt() != null ? Timestamp.valueOf(job.getStartedAt()) : null);
            ps.setTimestamp(5, Timestamp.valueOf(job.getCreatedAt()));
            return ps;
        }, keyHolder);

        job.setId(((Number) keyHolder.getKeys().get("id")).longValue());
        return job;
    }

    public List<ImportJob> findOpenBySessionId(Long sessionId) {
        String sql = "SELECT * FROM import_job WHERE session_id = ? AND status IN ('QUEUED', 'RUNNING') ORDER BY id";
        return jdbcTemplate.query(sql, ROW_MAPPER, sessionId);
    }

    public List<ImportJob> findBySessionId(Long sessionId) {
        String sql = "SELECT * FROM import_job WHERE session_id = ? ORDER BY id";
        return jdbcTemplate.query(sql, ROW_MAPPER, sessionId);
    }

    /**
     * Closes a job that is still queued or running. Returns false when it was already closed.
     */
    public boolean finish(Long id, ImportJob.JobStatus status, String statsJson, LocalDateTime now) {
        String sql = "UPDATE import_job SET status = ?, stats_json = ?, finished_at = ? WHERE id = ? AND status IN ('QUEUED', 'RUNNING')";
        return jdbcTemplate.update(sql, status.name(), statsJson, Timestamp.valueOf(now), id) > 0;
    }
}
