package mcsnap.engine.config;

import mcsnap.engine.execution.ActionExecutor;
import mcsnap.engine.execution.ConfigFileCollector;
import mcsnap.engine.execution.ConfigSnapshotAction;
import mcsnap.engine.execution.DefaultProcessRunner;
import mcsnap.engine.execution.GitVersionDiffer;
import mcsnap.engine.execution.ProcessRunner;
import mcsnap.engine.execution.WorldBackupAction;
import mcsnap.engine.repository.ArtifactRepository;
import mcsnap.engine.repository.AuditSink;
import mcsnap.engine.repository.ScheduleRepository;
import mcsnap.engine.repository.TargetStatusProbe;
import mcsnap.engine.scheduler.CronTimers;
import mcsnap.engine.scheduler.RetentionEngine;
import mcsnap.engine.scheduler.SchedulerCore;
import mcsnap.engine.service.ArtifactService;
import mcsnap.engine.service.DiffEngine;
import mcsnap.engine.service.ScheduleService;
import mcsnap.engine.store.Database;
import mcsnap.engine.store.FileSystemSnapshotStorage;
import mcsnap.engine.store.JdbcArtifactRepository;
import mcsnap.engine.store.JdbcScheduleRepository;
import mcsnap.engine.store.LoggingAuditSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Manual dependency injection container.
 * Creates and wires all engine dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(EngineConfig.fromEnv());
 * deps.startScheduler(); // register enabled schedules
 * ScheduleService schedules = deps.scheduleService();
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final EngineConfig config;
    private final Database database;
    private final ScheduleRepository scheduleRepository;
    private final ArtifactRepository artifactRepository;
    private final FileSystemSnapshotStorage snapshotStorage;
    private final ProcessRunner processRunner;
    private final AuditSink auditSink;
    private final ActionExecutor actionExecutor;
    private final RetentionEngine retentionEngine;
    private final DiffEngine diffEngine;
    private final Optional<CronTimers> cronTimers;
    private final ExecutorService workers;
    private final SchedulerCore scheduler;
    private final ScheduleService scheduleService;
    private final ArtifactService artifactService;

    private Dependencies(EngineConfig config, ProcessRunner processRunner, TargetStatusProbe statusProbe,
            AuditSink auditSink) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);
        this.snapshotStorage = new FileSystemSnapshotStorage(config.snapshotDir());
        this.processRunner = processRunner;
        this.auditSink = auditSink;

        // Repositories
        this.scheduleRepository = new JdbcScheduleRepository(database);
        this.artifactRepository = new JdbcArtifactRepository(database);

        // Execution
        ConfigSnapshotAction configSnapshots = new ConfigSnapshotAction(config.serversDir(),
                new ConfigFileCollector(config.serversDir(), config.maxConfigFileSize()),
                snapshotStorage, artifactRepository);
        WorldBackupAction worldBackups = new WorldBackupAction(config, processRunner, artifactRepository);
        this.actionExecutor = new ActionExecutor(configSnapshots, worldBackups);
        this.retentionEngine = new RetentionEngine(artifactRepository, actionExecutor, auditSink);
        this.diffEngine = new DiffEngine(actionExecutor,
                new GitVersionDiffer(config.backupRepoDir(), config.actionTimeout(), processRunner));

        // Scheduler
        this.cronTimers = CronTimers.load();
        this.workers = newWorkerPool(config.executionThreads());
        this.scheduler = new SchedulerCore(scheduleRepository, actionExecutor, retentionEngine, auditSink,
                cronTimers, workers);

        // Services
        this.scheduleService = new ScheduleService(scheduleRepository, scheduler, auditSink, config);
        this.artifactService = new ArtifactService(artifactRepository, actionExecutor, diffEngine, statusProbe,
                auditSink);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(EngineConfig config) {
        return new Dependencies(config, new DefaultProcessRunner(), TargetStatusProbe.NEVER_RUNNING,
                new LoggingAuditSink());
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(EngineConfig.fromEnv());
    }

    /**
     * Create dependencies with replaced outbound ports.
     */
    public static Dependencies create(EngineConfig config, ProcessRunner processRunner,
            TargetStatusProbe statusProbe, AuditSink auditSink) {
        return new Dependencies(config, processRunner, statusProbe, auditSink);
    }

    // Getters
    public EngineConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public ScheduleRepository scheduleRepository() {
        return scheduleRepository;
    }

    public ArtifactRepository artifactRepository() {
        return artifactRepository;
    }

    public FileSystemSnapshotStorage snapshotStorage() {
        return snapshotStorage;
    }

    public ProcessRunner processRunner() {
        return processRunner;
    }

    public AuditSink auditSink() {
        return auditSink;
    }

    public ActionExecutor actionExecutor() {
        return actionExecutor;
    }

    public RetentionEngine retentionEngine() {
        return retentionEngine;
    }

    public DiffEngine diffEngine() {
        return diffEngine;
    }

    public SchedulerCore scheduler() {
        return scheduler;
    }

    public ScheduleService scheduleService() {
        return scheduleService;
    }

    public ArtifactService artifactService() {
        return artifactService;
    }

    /**
     * Load enabled schedules and start their timers.
     */
    public void startScheduler() {
        scheduler.initialize();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop timers first so nothing new is dispatched
        try {
            scheduler.shutdown();
        } catch (Exception e) {
            log.warn("Error stopping scheduler: {}", e.getMessage());
        }
        cronTimers.ifPresent(CronTimers::close);

        // Let running executions finish and record
        workers.shutdown();
        try {
            if (!workers.awaitTermination(config.actionTimeout().toSeconds() + 10, TimeUnit.SECONDS)) {
                workers.shutdownNow();
                log.warn("Worker pool forcefully stopped");
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }

        // Close database
        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }

    private static ExecutorService newWorkerPool(int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "mcsnap-exec-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
