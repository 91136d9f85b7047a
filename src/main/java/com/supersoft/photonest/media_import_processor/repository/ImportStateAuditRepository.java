package com.supersoft.photonest.media_import_processor.repository;

import com.supersoft.photonest.media_import_processor.domain.ImportStateAudit;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.Statement;
import java.sql.Timestamp;
import java.util.List;

@Repository
public class ImportStateAuditRepository {

    @Autowired
    private JdbcTemplate jdbcTemplate;

    public ImportStateAudit save(ImportStateAudit audit) {
        String sql = "INSERT INTO import_state_audit (entity_type, entity_id, from_state, to_state, reason, forced, metadata_json, created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?)";

        KeyHolder keyHolder = new GeneratedKeyHolder();

        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS);
            ps.setString(1, audit.getEntityType());
            ps.setLong(2, audit.getEntityId());
            ps.setString(3, audit.getFromState());
            ps.setString(4, audit.getToState());
            ps.setString(5, audit.getReason());
            ps.setBoolean(6, audit.isForced());
            ps.setString(7, audit.getMetadataJson());
            ps.setTimestamp(8, Timestamp.valueOf(audit.getCreatedAt()));
            return ps;
        }, keyHolder);

        audit.setId(((Number) keyHolder.getKeys().get("id")).longValue());
        return audit;
    }

    public List<ImportStateAudit> findByEntity(String entityType, Long entityId) {
        String sql = "SELECT * FROM import_state_audit WHERE entity_type = ? AND entity_id = ? ORDER BY created_at ASC, id ASC";
        return jdbcTemplate.query(sql, (rs, rowNum) -> ImportStateAudit.builder()
                .id(rs.getLong("id"))
                .entityType(rs.getString("entity_type"))
                .entityId(rs.getLong("entity_id"))
                .fromState(rs.getString("from_state"))
                .toState(rs.getString("to_state"))
                .reason(rs.getString("reason"))
                .forced(rs.getBoolean("forced"))
                .metadataJson(rs.getString("metadata_json"))
                .createdAt(rs.getTimestamp("created_at").toLocalDateTime())
                .build(), entityType, entityId);
    }
}
