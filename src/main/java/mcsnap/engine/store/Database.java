package mcsnap.engine.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import mcsnap.engine.config.EngineConfig;
import mcsnap.engine.error.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling; auto-commit is off, so writers commit explicitly.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(EngineConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(1);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("mcsnap-db-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    /**
     * Check if database is healthy.
     */
    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- SCHEDULES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS schedules (
                            id                      VARCHAR(64) PRIMARY KEY,
                            kind                    VARCHAR(32) NOT NULL,
                            server_name             VARCHAR(64) NOT NULL,
                            name                    VARCHAR(256) NOT NULL,
                            cron_expression         VARCHAR(128) NOT NULL,
                            enabled                 BOOLEAN DEFAULT TRUE,
                            retention_max_count     INT,
                            retention_max_age_days  INT,
                            last_run_at             TIMESTAMP,
                            last_run_status         VARCHAR(16),
                            last_run_message        VARCHAR(4096),
                            created_at              TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            updated_at              TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- ARTIFACTS ----------
            // schedule_id deliberately has no foreign key: deleting a schedule keeps its history.
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS artifacts (
                            id              VARCHAR(64) PRIMARY KEY,
                            kind            VARCHAR(32) NOT NULL,
                            server_name     VARCHAR(64) NOT NULL,
                            schedule_id     VARCHAR(64),
                            description     VARCHAR(1024),
                            entries         CLOB,
                            version_ref     VARCHAR(64),
                            created_at      TIMESTAMP NOT NULL
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_schedules_server ON schedules(server_name);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_schedules_enabled ON schedules(enabled);");
            st.addBatch(
                    "CREATE INDEX IF NOT EXISTS idx_artifacts_server_kind ON artifacts(server_name, kind, created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_artifacts_schedule ON artifacts(schedule_id);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new StorageException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
