package mcsnap.engine.config;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration holder for the snapshot engine.
 * All settings have sensible defaults.
 */
public final class EngineConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/mcsnap;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Filesystem layout
    private Path serversDir = Path.of("servers");
    private Path snapshotDir = Path.of("data", "config-snapshots");
    private Path platformDir = Path.of(".");
    private Path backupRepoDir = Path.of(System.getProperty("user.home"), ".minecraft-backup");

    // Execution settings
    private int executionThreads = 4;
    private Duration actionTimeout = Duration.ofMinutes(5);
    private long maxConfigFileSize = 1024 * 1024;

    // Schedule defaults
    private int defaultRetentionCount = 10;

    private EngineConfig() {
    }

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    public static EngineConfig fromEnv() {
        EngineConfig config = new EngineConfig();

        String dbUrl = System.getenv("MCSNAP_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String serversDir = System.getenv("MCSNAP_SERVERS_DIR");
        if (serversDir != null && !serversDir.isBlank()) {
            config.serversDir = Path.of(serversDir);
        }

        String snapshotDir = System.getenv("MCSNAP_SNAPSHOT_DIR");
        if (snapshotDir != null && !snapshotDir.isBlank()) {
            config.snapshotDir = Path.of(snapshotDir);
        }

        String platformDir = System.getenv("MCSNAP_PLATFORM_DIR");
        if (platformDir != null && !platformDir.isBlank()) {
            config.platformDir = Path.of(platformDir);
        }

        String backupRepo = System.getenv("MCSNAP_BACKUP_REPO");
        if (backupRepo != null && !backupRepo.isBlank()) {
            config.backupRepoDir = Path.of(backupRepo);
        }

        String threads = System.getenv("MCSNAP_EXEC_THREADS");
        if (threads != null && !threads.isBlank()) {
            config.executionThreads = Integer.parseInt(threads);
        }

        String timeout = System.getenv("MCSNAP_ACTION_TIMEOUT_SECONDS");
        if (timeout != null && !timeout.isBlank()) {
            config.actionTimeout = Duration.ofSeconds(Long.parseLong(timeout));
        }

        return config;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    /** Root holding one directory per target server */
    public Path serversDir() {
        return serversDir;
    }

    /** Root of stored config snapshot contents: {@code <snapshotDir>/<target>/<artifactId>/} */
    public Path snapshotDir() {
        return snapshotDir;
    }

    /** Platform root: holds {@code worlds/} and {@code scripts/backup.sh} */
    public Path platformDir() {
        return platformDir;
    }

    public Path worldsDir() {
        return platformDir.resolve("worlds");
    }

    public Path backupScript() {
        return platformDir.resolve("scripts").resolve("backup.sh");
    }

    /** Git working copy used when the backup script is absent */
    public Path backupRepoDir() {
        return backupRepoDir;
    }

    public int executionThreads() {
        return executionThreads;
    }

    public Duration actionTimeout() {
        return actionTimeout;
    }

    public long maxConfigFileSize() {
        return maxConfigFileSize;
    }

    public int defaultRetentionCount() {
        return defaultRetentionCount;
    }

    // Fluent setters for testing/customization
    public EngineConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public EngineConfig withServersDir(Path dir) {
        this.serversDir = dir;
        return this;
    }

    public EngineConfig withSnapshotDir(Path dir) {
        this.snapshotDir = dir;
        return this;
    }

    public EngineConfig withPlatformDir(Path dir) {
        this.platformDir = dir;
        return this;
    }

    public EngineConfig withBackupRepoDir(Path dir) {
        this.backupRepoDir = dir;
        return this;
    }

    public EngineConfig withExecutionThreads(int threads) {
        this.executionThreads = threads;
        return this;
    }

    public EngineConfig withActionTimeout(Duration timeout) {
        this.actionTimeout = timeout;
        return this;
    }

    public EngineConfig withDefaultRetentionCount(int count) {
        this.defaultRetentionCount = count;
        return this;
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serversDir=" + serversDir +
                ", snapshotDir=" + snapshotDir +
                ", platformDir=" + platformDir +
                ", executionThreads=" + executionThreads +
                ", actionTimeout=" + actionTimeout +
                '}';
    }
}
