package mcsnap.engine.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import mcsnap.engine.error.StorageException;
import mcsnap.engine.model.ActionKind;
import mcsnap.engine.model.Artifact;
import mcsnap.engine.model.ArtifactEntry;
import mcsnap.engine.model.TargetName;
import mcsnap.engine.repository.ArtifactRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of ArtifactRepository.
 * File-set entries are stored as a JSON array in the {@code entries} column.
 */
public class JdbcArtifactRepository implements ArtifactRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcArtifactRepository.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<ArtifactEntry>> ENTRY_LIST = new TypeReference<>() {
    };

    private final Database db;

    public JdbcArtifactRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Artifact artifact) {
        String sql = """
                    INSERT INTO artifacts (id, kind, server_name, schedule_id, description, entries, version_ref, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, artifact.id());
            ps.setString(2, artifact.kind().name());
            ps.setString(3, artifact.target().value());
            ps.setString(4, artifact.scheduleId());
            ps.setString(5, artifact.description());
            ps.setString(6, MAPPER.writeValueAsString(artifact.entries()));
            ps.setString(7, artifact.versionRef());
            ps.setTimestamp(8, Timestamp.from(artifact.createdAt()));

            ps.executeUpdate();
            conn.commit();

            log.debug("Saved artifact: {}", artifact.id());
        } catch (SQLException | JsonProcessingException e) {
            throw new StorageException("Failed to save artifact: " + artifact.id(), e);
        }
    }

    @Override
    public Optional<Artifact> findById(String id) {
        List<Artifact> rows = query("SELECT * FROM artifacts WHERE id = ?", ps -> ps.setString(1, id));
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public List<Artifact> findByTarget(String target, ActionKind kind, int limit, int offset) {
        if (limit > 0) {
            return query("""
                        SELECT * FROM artifacts WHERE server_name = ? AND kind = ?
                        ORDER BY created_at DESC, id DESC LIMIT ? OFFSET ?
                    """, ps -> {
                ps.setString(1, target);
                ps.setString(2, kind.name());
                ps.setInt(3, limit);
                ps.setInt(4, Math.max(0, offset));
            });
        }
        return query("""
                    SELECT * FROM artifacts WHERE server_name = ? AND kind = ?
                    ORDER BY created_at DESC, id DESC OFFSET ? ROWS
                """, ps -> {
            ps.setString(1, target);
            ps.setString(2, kind.name());
            ps.setInt(3, Math.max(0, offset));
        });
    }

    @Override
    public List<Artifact> findByTarget(String target) {
        return query("SELECT * FROM artifacts WHERE server_name = ? ORDER BY created_at DESC, id DESC",
                ps -> ps.setString(1, target));
    }

    @Override
    public List<Artifact> findByScheduleId(String scheduleId) {
        return query("SELECT * FROM artifacts WHERE schedule_id = ? ORDER BY created_at DESC, id DESC",
                ps -> ps.setString(1, scheduleId));
    }

    @Override
    public List<Artifact> findOldestFirst(String target, ActionKind kind) {
        return query("SELECT * FROM artifacts WHERE server_name = ? AND kind = ? ORDER BY created_at ASC, id ASC",
                ps -> {
                    ps.setString(1, target);
                    ps.setString(2, kind.name());
                });
    }

    @Override
    public List<Artifact> findCreatedBefore(String target, ActionKind kind, Instant cutoff) {
        return query("""
                    SELECT * FROM artifacts WHERE server_name = ? AND kind = ? AND created_at < ?
                    ORDER BY created_at ASC, id ASC
                """, ps -> {
            ps.setString(1, target);
            ps.setString(2, kind.name());
            ps.setTimestamp(3, Timestamp.from(cutoff));
        });
    }

    @Override
    public int countByTarget(String target, ActionKind kind) {
        String sql = "SELECT COUNT(*) FROM artifacts WHERE server_name = ? AND kind = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, target);
            ps.setString(2, kind.name());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to count artifacts for " + target, e);
        }
    }

    @Override
    public boolean delete(String id) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("DELETE FROM artifacts WHERE id = ?")) {
            ps.setString(1, id);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw new StorageException("Failed to delete artifact: " + id, e);
        }
    }

    @Override
    public String generateId() {
        return UUID.randomUUID().toString();
    }

    // --- Helpers ---

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    private List<Artifact> query(String sql, Binder binder) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            binder.bind(ps);
            List<Artifact> artifacts = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    artifacts.add(mapRow(rs));
                }
            }
            return artifacts;
        } catch (SQLException e) {
            throw new StorageException("Failed to query artifacts", e);
        }
    }

    private Artifact mapRow(ResultSet rs) throws SQLException {
        return Artifact.builder()
                .id(rs.getString("id"))
                .kind(ActionKind.valueOf(rs.getString("kind")))
                .target(TargetName.of(rs.getString("server_name")))
                .scheduleId(rs.getString("schedule_id"))
                .description(rs.getString("description"))
                .entries(readEntries(rs.getString("entries")))
                .versionRef(rs.getString("version_ref"))
                .createdAt(rs.getTimestamp("created_at").toInstant())
                .build();
    }

    private List<ArtifactEntry> readEntries(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return MAPPER.readValue(json, ENTRY_LIST);
        } catch (JsonProcessingException e) {
            throw new StorageException("Corrupt artifact entries column", e);
        }
    }
}
