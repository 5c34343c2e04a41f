package mcsnap.engine.execution;

import mcsnap.engine.error.ActionFailedException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({ OS.LINUX, OS.MAC })
class DefaultProcessRunnerTest {

    private final DefaultProcessRunner runner = new DefaultProcessRunner();

    @TempDir
    Path dir;

    @Test
    void shellMetacharactersArePassedLiterally() {
        Path marker = dir.resolve("pwned");
        String hostile = "backup; touch " + marker + " && echo $(id) `id` | cat";

        ProcessResult result = runner.run(ProcessCommand.of("echo", List.of(hostile), dir, Duration.ofSeconds(10)));

        assertTrue(result.succeeded());
        assertEquals(hostile, result.stdout().trim());
        assertFalse(Files.exists(marker));
    }

    @Test
    void capturesExitCodeAndStderr() {
        ProcessResult result = runner.run(ProcessCommand.of("sh",
                List.of("-c", "echo oops >&2; exit 3"), dir, Duration.ofSeconds(10)));

        assertEquals(3, result.exitCode());
        assertFalse(result.succeeded());
        assertEquals("oops", result.diagnostic());
    }

    @Test
    void environmentIsPassed() {
        ProcessResult result = runner.run(ProcessCommand.of("sh", List.of("-c", "printf %s \"$MCSNAP_ROOT\""),
                dir, Duration.ofSeconds(10)).withEnv(java.util.Map.of("MCSNAP_ROOT", "/srv/platform")));
        assertEquals("/srv/platform", result.stdout());
    }

    @Test
    void largeOutputOnBothStreamsFromManyConcurrentRuns() throws Exception {
        int runs = Runtime.getRuntime().availableProcessors() * 2 + 2;
        ExecutorService callers = Executors.newFixedThreadPool(runs);
        List<Future<ProcessResult>> results = new ArrayList<>();
        for (int i = 0; i < runs; i++) {
            results.add(callers.submit(() -> runner.run(ProcessCommand.of("sh",
                    List.of("-c", "yes out | head -c 1048576; yes err | head -c 1048576 >&2"),
                    dir, Duration.ofSeconds(30)))));
        }
        try {
            for (Future<ProcessResult> future : results) {
                ProcessResult result = future.get(60, TimeUnit.SECONDS);
                assertTrue(result.succeeded());
                assertEquals(1048576, result.stdout().length());
                assertEquals(1048576, result.stderr().length());
            }
        } finally {
            callers.shutdownNow();
        }
    }

    @Test
    void timeoutDestroysProcess() {
        long start = System.nanoTime();
        ProcessResult result = runner.run(ProcessCommand.of("sleep", List.of("30"), dir, Duration.ofMillis(300)));

        assertTrue(result.timedOut());
        assertFalse(result.succeeded());
        assertTrue(Duration.ofNanos(System.nanoTime() - start).compareTo(Duration.ofSeconds(10)) < 0);
    }

    @Test
    void missingProgramFailsToStart() {
        assertThrows(ActionFailedException.class, () -> runner.run(
                ProcessCommand.of("mcsnap-no-such-program", List.of(), dir, Duration.ofSeconds(5))));
    }
}
