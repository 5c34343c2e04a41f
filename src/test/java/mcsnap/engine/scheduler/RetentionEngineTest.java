package mcsnap.engine.scheduler;

import mcsnap.engine.config.EngineConfig;
import mcsnap.engine.execution.ActionExecutor;
import mcsnap.engine.execution.ConfigFileCollector;
import mcsnap.engine.execution.ConfigSnapshotAction;
import mcsnap.engine.execution.WorldBackupAction;
import mcsnap.engine.model.ActionKind;
import mcsnap.engine.model.Artifact;
import mcsnap.engine.model.AuditAction;
import mcsnap.engine.model.CronSchedule;
import mcsnap.engine.model.RetentionPolicy;
import mcsnap.engine.model.Schedule;
import mcsnap.engine.model.TargetName;
import mcsnap.engine.store.Database;
import mcsnap.engine.store.FileSystemSnapshotStorage;
import mcsnap.engine.store.JdbcArtifactRepository;
import mcsnap.engine.support.RecordingAuditSink;
import mcsnap.engine.support.ScriptedProcessRunner;
import mcsnap.engine.support.TestDatabases;
import mcsnap.engine.support.UndeletableArtifactRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RetentionEngineTest {

    @TempDir
    Path root;

    private Database db;
    private JdbcArtifactRepository artifacts;
    private FileSystemSnapshotStorage storage;
    private RecordingAuditSink audit;
    private ActionExecutor executor;
    private RetentionEngine retention;

    private static final TargetName LOBBY = TargetName.of("lobby");

    @BeforeEach
    void setUp() {
        EngineConfig config = TestDatabases.config("retention", root);
        db = new Database(config);
        artifacts = new JdbcArtifactRepository(db);
        storage = new FileSystemSnapshotStorage(config.snapshotDir());
        audit = new RecordingAuditSink();
        executor = new ActionExecutor(
                new ConfigSnapshotAction(config.serversDir(),
                        new ConfigFileCollector(config.serversDir(), config.maxConfigFileSize()), storage, artifacts),
                new WorldBackupAction(config, new ScriptedProcessRunner(), artifacts));
        retention = new RetentionEngine(artifacts, executor, audit);
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    private Artifact snapshot(String id, Instant createdAt) {
        Artifact artifact = Artifact.builder()
                .id(id)
                .kind(ActionKind.CONFIG_SNAPSHOT)
                .target(LOBBY)
                .createdAt(createdAt)
                .build();
        storage.store(LOBBY, id, Map.of("server.properties", id.getBytes(StandardCharsets.UTF_8)));
        artifacts.save(artifact);
        return artifact;
    }

    private Schedule schedule(RetentionPolicy policy) {
        return Schedule.builder()
                .id("sched-1")
                .target(LOBBY)
                .name("Nightly")
                .cron(CronSchedule.parse("0 3 * * *"))
                .retention(policy)
                .build();
    }

    @Test
    void countBoundDeletesOldestBeyondLimit() {
        Instant base = Instant.now().minus(Duration.ofHours(6));
        for (int i = 1; i <= 6; i++) {
            snapshot("snap-" + i, base.plus(Duration.ofMinutes(i)));
        }

        int pruned = retention.apply(schedule(RetentionPolicy.ofCount(5)), "snap-6");

        assertEquals(1, pruned);
        assertEquals(5, artifacts.countByTarget("lobby", ActionKind.CONFIG_SNAPSHOT));
        assertTrue(artifacts.findById("snap-1").isEmpty());
        assertFalse(storage.exists(LOBBY, "snap-1"));
        assertTrue(storage.exists(LOBBY, "snap-2"));
        assertEquals(1, audit.events(AuditAction.ARTIFACT_PRUNE).size());
    }

    @Test
    void failedRecordDeleteKeepsContents() {
        Instant base = Instant.now().minus(Duration.ofHours(1));
        snapshot("snap-1", base);
        snapshot("snap-2", base.plusSeconds(60));
        RetentionEngine failing = new RetentionEngine(new UndeletableArtifactRepository(artifacts), executor, audit);

        assertEquals(0, failing.apply(schedule(RetentionPolicy.ofCount(1)), "snap-2"));

        assertTrue(artifacts.findById("snap-1").isPresent());
        assertTrue(storage.exists(LOBBY, "snap-1"));
        assertEquals("snap-1", storage.retrieve(LOBBY, "snap-1").get("server.properties"));
        assertTrue(audit.events(AuditAction.ARTIFACT_PRUNE).isEmpty());
    }

    @Test
    void withinLimitNothingIsPruned() {
        Instant base = Instant.now();
        for (int i = 1; i <= 3; i++) {
            snapshot("snap-" + i, base.plusSeconds(i));
        }
        assertEquals(0, retention.apply(schedule(RetentionPolicy.ofCount(5)), "snap-3"));
        assertEquals(3, artifacts.countByTarget("lobby", ActionKind.CONFIG_SNAPSHOT));
    }

    @Test
    void ageBoundDeletesEverythingOlderThanCutoff() {
        Instant now = Instant.now();
        snapshot("ancient", now.minus(Duration.ofDays(40)));
        snapshot("old", now.minus(Duration.ofDays(8)));
        snapshot("recent", now.minus(Duration.ofDays(1)));

        int pruned = retention.apply(schedule(new RetentionPolicy(null, 7)), "recent");

        assertEquals(2, pruned);
        assertEquals(List.of("recent"),
                artifacts.findOldestFirst("lobby", ActionKind.CONFIG_SNAPSHOT).stream().map(Artifact::id).toList());
    }

    @Test
    void protectedArtifactSurvivesEvenWhenOld() {
        Instant now = Instant.now();
        snapshot("just-made", now.minus(Duration.ofDays(30)));
        snapshot("other", now.minus(Duration.ofDays(20)));

        int pruned = retention.apply(schedule(new RetentionPolicy(1, 7)), "just-made");

        assertEquals(1, pruned);
        assertTrue(artifacts.findById("just-made").isPresent());
    }

    @Test
    void countAndAgeApplyIndependently() {
        Instant now = Instant.now();
        snapshot("a", now.minus(Duration.ofDays(10)));
        snapshot("b", now.minus(Duration.ofHours(3)));
        snapshot("c", now.minus(Duration.ofHours(2)));
        snapshot("d", now.minus(Duration.ofHours(1)));

        int pruned = retention.apply(schedule(new RetentionPolicy(2, 5)), "d");

        assertEquals(2, pruned);
        assertEquals(List.of("c", "d"),
                artifacts.findOldestFirst("lobby", ActionKind.CONFIG_SNAPSHOT).stream().map(Artifact::id).toList());
    }

    @Test
    void emptyPolicyRetainsEverything() {
        snapshot("a", Instant.now().minus(Duration.ofDays(1000)));
        assertEquals(0, retention.apply(schedule(RetentionPolicy.none()), null));
        assertEquals(1, artifacts.countByTarget("lobby", ActionKind.CONFIG_SNAPSHOT));
    }

    @Test
    void otherTargetsAndKindsAreUntouched() {
        Instant now = Instant.now();
        snapshot("mine-1", now.minusSeconds(30));
        snapshot("mine-2", now.minusSeconds(20));
        artifacts.save(Artifact.builder().id("world").kind(ActionKind.WORLD_BACKUP).target(LOBBY)
                .createdAt(now.minusSeconds(100)).versionRef("abcd123").build());
        artifacts.save(Artifact.builder().id("theirs").kind(ActionKind.CONFIG_SNAPSHOT)
                .target(TargetName.of("survival")).createdAt(now.minusSeconds(100)).build());

        assertEquals(1, retention.apply(schedule(RetentionPolicy.ofCount(1)), "mine-2"));
        assertTrue(artifacts.findById("world").isPresent());
        assertTrue(artifacts.findById("theirs").isPresent());
        assertTrue(artifacts.findById("mine-1").isEmpty());
    }
}
