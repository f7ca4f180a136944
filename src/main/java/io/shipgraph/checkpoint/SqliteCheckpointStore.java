package io.shipgraph.checkpoint;

import io.shipgraph.util.ThreadIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * SQLite backed store. The latest checkpoint of a thread and its history row are written in
 * one transaction, so a crash leaves either both or neither.
 */
public final class SqliteCheckpointStore implements CheckpointStore {
    private static final Logger LOG = LoggerFactory.getLogger(SqliteCheckpointStore.class);

    private final Path dbFile;
    private final String jdbcUrl;
    private final int historyLimit;

    public SqliteCheckpointStore(Path dbFile) {
        this(dbFile, 0);
    }

    public SqliteCheckpointStore(Path dbFile, int historyLimit) {
        this.dbFile = dbFile;
        this.jdbcUrl = "jdbc:sqlite:" + dbFile.toString();
        this.historyLimit = Math.max(0, historyLimit);
    }

    public SqliteCheckpointStore init() {
        try {
            Path parent = dbFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new CheckpointIOException("Failed to create directory for " + dbFile, e);
        }
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");
            st.execute("""
                    CREATE TABLE IF NOT EXISTS checkpoints (
                        thread_id TEXT PRIMARY KEY,
                        superstep INTEGER NOT NULL,
                        payload TEXT NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS checkpoint_history (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        thread_id TEXT NOT NULL,
                        superstep INTEGER NOT NULL,
                        payload TEXT NOT NULL,
                        created_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_checkpoint_history_thread ON checkpoint_history(thread_id, id)");
        } catch (SQLException e) {
            throw new CheckpointIOException("Failed to initialize checkpoint database " + dbFile, e);
        }
        LOG.debug("SQLite checkpoint store ready at {}", dbFile);
        return this;
    }

    private Connection openConnection() throws SQLException {
        Connection conn = DriverManager.getConnection(jdbcUrl);
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA busy_timeout=5000");
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
        return conn;
    }

    @Override
    public void save(Checkpoint checkpoint) {
        ThreadIds.require(checkpoint.threadId());
        String payload = CheckpointCodec.encode(checkpoint);
        try (Connection c = openConnection()) {
            c.setAutoCommit(false);
            try {
                try (PreparedStatement latest = c.prepareStatement(
                        "INSERT INTO checkpoints(thread_id,superstep,payload,updated_at_ms) VALUES(?,?,?,?) "
                                + "ON CONFLICT(thread_id) DO UPDATE SET superstep=excluded.superstep, "
                                + "payload=excluded.payload, updated_at_ms=excluded.updated_at_ms");
                     PreparedStatement history = c.prepareStatement(
                             "INSERT INTO checkpoint_history(thread_id,superstep,payload,created_at_ms) VALUES(?,?,?,?)")) {
                    latest.setString(1, checkpoint.threadId());
                    latest.setInt(2, checkpoint.superstep());
                    latest.setString(3, payload);
                    latest.setLong(4, checkpoint.createdAtMs());
                    latest.executeUpdate();

                    history.setString(1, checkpoint.threadId());
                    history.setInt(2, checkpoint.superstep());
                    history.setString(3, payload);
                    history.setLong(4, checkpoint.createdAtMs());
                    history.executeUpdate();
                }
                if (historyLimit > 0) {
                    pruneHistory(c, checkpoint.threadId());
                }
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new CheckpointIOException("Failed to save checkpoint of thread " + checkpoint.threadId(), e);
        }
    }

    private void pruneHistory(Connection c, String threadId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "DELETE FROM checkpoint_history WHERE thread_id=? AND id <= ("
                        + "SELECT id FROM checkpoint_history WHERE thread_id=? ORDER BY id DESC LIMIT 1 OFFSET ?)")) {
            ps.setString(1, threadId);
            ps.setString(2, threadId);
            ps.setInt(3, historyLimit);
            ps.executeUpdate();
        }
    }

    @Override
    public Optional<Checkpoint> load(String threadId) {
        String sql = "SELECT payload FROM checkpoints WHERE thread_id=?";
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, threadId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(CheckpointCodec.decode(rs.getString("payload"), "sqlite:" + threadId));
            }
        } catch (SQLException e) {
            throw new CheckpointIOException("Failed to load checkpoint of thread " + threadId, e);
        }
    }

    @Override
    public boolean delete(String threadId) {
        try (Connection c = openConnection()) {
            c.setAutoCommit(false);
            try {
                int removed;
                try (PreparedStatement latest = c.prepareStatement("DELETE FROM checkpoints WHERE thread_id=?");
                     PreparedStatement history = c.prepareStatement("DELETE FROM checkpoint_history WHERE thread_id=?")) {
                    latest.setString(1, threadId);
                    removed = latest.executeUpdate();
                    history.setString(1, threadId);
                    history.executeUpdate();
                }
                c.commit();
                return removed > 0;
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new CheckpointIOException("Failed to delete checkpoints of thread " + threadId, e);
        }
    }

    @Override
    public List<Checkpoint> history(String threadId, int limit) {
        String sql = "SELECT payload FROM checkpoint_history WHERE thread_id=? ORDER BY id DESC LIMIT ?";
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, threadId);
            ps.setInt(2, limit > 0 ? limit : -1);
            List<Checkpoint> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(CheckpointCodec.decode(rs.getString("payload"), "sqlite-history:" + threadId));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new CheckpointIOException("Failed to read checkpoint history of thread " + threadId, e);
        }
    }

    @Override
    public List<String> listThreads() {
        try (Connection c = openConnection();
             Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT thread_id FROM checkpoints ORDER BY thread_id")) {
            List<String> out = new ArrayList<>();
            while (rs.next()) {
                out.add(rs.getString(1));
            }
            return out;
        } catch (SQLException e) {
            throw new CheckpointIOException("Failed to list checkpoint threads", e);
        }
    }

    @Override
    public String backend() {
        return "sqlite";
    }
}
