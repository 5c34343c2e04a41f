package mcsnap.engine.execution;

import mcsnap.engine.config.EngineConfig;
import mcsnap.engine.error.PreconditionFailedException;
import mcsnap.engine.model.Artifact;
import mcsnap.engine.model.TargetName;
import mcsnap.engine.store.Database;
import mcsnap.engine.store.FileSystemSnapshotStorage;
import mcsnap.engine.store.JdbcArtifactRepository;
import mcsnap.engine.support.TestDatabases;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ConfigSnapshotActionTest {

    @TempDir
    Path root;

    private EngineConfig config;
    private Database db;
    private JdbcArtifactRepository artifacts;
    private FileSystemSnapshotStorage storage;
    private ConfigSnapshotAction action;
    private Path lobby;

    @BeforeEach
    void setUp() throws Exception {
        config = TestDatabases.config("config-snapshot", root);
        db = new Database(config);
        artifacts = new JdbcArtifactRepository(db);
        storage = new FileSystemSnapshotStorage(config.snapshotDir());
        action = new ConfigSnapshotAction(config.serversDir(),
                new ConfigFileCollector(config.serversDir(), config.maxConfigFileSize()), storage, artifacts);
        lobby = Files.createDirectories(config.serversDir().resolve("lobby"));
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Test
    void captureStoresContentsAndRecord() throws Exception {
        Files.writeString(lobby.resolve("server.properties"), "motd=hello\n");
        Files.writeString(lobby.resolve("bukkit.yml"), "settings: {}\n");

        ActionResult result = action.capture(TargetName.of("lobby"), "before update", null);

        Artifact artifact = result.artifact();
        assertEquals("Snapshot created (2 files)", result.message());
        assertEquals(2, artifact.entries().size());
        assertTrue(artifacts.findById(artifact.id()).isPresent());
        assertEquals("motd=hello\n", storage.retrieve(artifact.target(), artifact.id()).get("server.properties"));
    }

    @Test
    void missingServerDirectoryFailsPrecondition() {
        PreconditionFailedException e = assertThrows(PreconditionFailedException.class,
                () -> action.capture(TargetName.of("ghost"), "", "sched-1"));
        assertEquals("Server directory not found: ghost", e.getMessage());
    }

    @Test
    void restoreWritesFilesBack() throws Exception {
        Files.writeString(lobby.resolve("server.properties"), "motd=original\n");
        Artifact artifact = action.capture(TargetName.of("lobby"), "", null).artifact();

        Files.writeString(lobby.resolve("server.properties"), "motd=broken\n");
        int restored = action.restore(artifact);

        assertEquals(1, restored);
        assertEquals("motd=original\n", Files.readString(lobby.resolve("server.properties")));
    }

    @Test
    void discardRemovesStoredContents() throws Exception {
        Files.writeString(lobby.resolve("ops.json"), "[]");
        Artifact artifact = action.capture(TargetName.of("lobby"), "", null).artifact();

        action.discard(artifact);

        assertFalse(storage.exists(artifact.target(), artifact.id()));
    }
}
