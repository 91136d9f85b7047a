package com.supersoft.photonest.media_import_processor.repository;

import com.supersoft.photonest.media_import_processor.domain.MediaRecord;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.Statement;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

@Repository
public class MediaRepository {

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private static final RowMapper<MediaRecord> ROW_MAPPER = (rs, rowNum) -> MediaRecord.builder()
            .id(rs.getLong("id"))
            .accountId(rs.getLong("account_id"))
            .sourceReference(rs.getString("source_reference"))
            .hashSha256(rs.getString("hash_sha256"))
            .sizeBytes(rs.getLong("size_bytes"))
            .mimeType(rs.getString("mime_type"))
            .filename(rs.getString("filename"))
            .localRelPath(rs.getString("local_rel_path"))
            .video(rs.getBoolean("is_video"))
            .shotAt(rs.getTimestamp("shot_at") != null ? rs.getTimestamp("shot_at").toLocalDateTime() : null)
            .importedAt(rs.getTimestamp("imported_at").toLocalDateTime())
            .build();

    public Optional<MediaRecord> findByHash(String hashSha256) {
        String sql = "SELECT * FROM media WHERE hash_sha256 = ?";
        List<MediaRecord> rows = jdbcTemplate.query(sql, ROW_MAPPER, hashSha256);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public Optional<MediaRecord> findById(Long id) {
        String sql = "SELECT * FROM media WHERE id = ?";
        List<MediaRecord> rows = jdbcTemplate.query(sql, ROW_MAPPER, id);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /**
     * Inserts a catalog row. A concurrent insert of the same content fails on the unique hash.
     */
    public MediaRecord insert(MediaRecord media) {
        String sql = "INSERT INTO media (account_id, source_reference, hash_sha256, size_bytes, mime_type, filename, local_rel_path, is_video, shot_at, imported_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

        KeyHolder keyHolder = new GeneratedKeyHolder();

        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS);
            ps.setLong(1, media.getAccountId());
            ps.setString(2, media.getSourceReference());
            ps.setString(3, media.getHashSha256());
            ps.setLong(4, media.getSizeBytes());
            ps.setString(5, media.getMimeType());
            ps.setString(6, media.getFilename());
            ps.setString(7, media.getLocalRelPath());
            ps.setBoolean(8, media.isVideo());
            ps.setTimestamp(9, media.getShotAt() != null ? Timestamp.valueOf(media.getShotAt()) : null);
            ps.setTimestamp(10, Timestamp.valueOf(media.getImportedAt()));
            return ps;
        }, keyHolder);

        media.setId(((Number) keyHolder.getKeys().get("id")).longValue());
        return media;
    }
}
