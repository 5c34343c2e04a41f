package mcsnap.engine.config;

import mcsnap.engine.api.dto.CreateScheduleRequest;
import mcsnap.engine.api.dto.ScheduleResponse;
import mcsnap.engine.repository.TargetStatusProbe;
import mcsnap.engine.support.RecordingAuditSink;
import mcsnap.engine.support.ScriptedProcessRunner;
import mcsnap.engine.support.TestDatabases;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DependenciesTest {

    @TempDir
    Path root;

    @Test
    void wiresAllComponents() {
        EngineConfig config = TestDatabases.config("deps", root)
                .withDefaultRetentionCount(3)
                .withActionTimeout(Duration.ofSeconds(30));
        ScriptedProcessRunner runner = new ScriptedProcessRunner();
        RecordingAuditSink audit = new RecordingAuditSink();

        try (Dependencies deps = Dependencies.create(config, runner, TargetStatusProbe.NEVER_RUNNING, audit)) {
            assertTrue(deps.database().isHealthy());
            assertSame(runner, deps.processRunner());
            assertSame(audit, deps.auditSink());
            assertNotNull(deps.actionExecutor());
            assertNotNull(deps.retentionEngine());
            assertNotNull(deps.diffEngine());
            assertEquals(Duration.ofSeconds(30), deps.config().actionTimeout());

            ScheduleResponse created = deps.scheduleService()
                    .create(CreateScheduleRequest.of("lobby", "Nightly", "0 3 * * *"));
            assertEquals(3, created.retentionCount());

            deps.startScheduler();
            assertEquals(1, deps.scheduler().activeTaskCount());
        }
    }

    @Test
    void envConfigFallsBackToDefaults() {
        EngineConfig config = EngineConfig.defaults();
        assertEquals(Duration.ofMinutes(5), config.actionTimeout());
        assertEquals(1024 * 1024, config.maxConfigFileSize());
        assertEquals(10, config.defaultRetentionCount());
        assertEquals(config.platformDir().resolve("worlds"), config.worldsDir());
    }
}
