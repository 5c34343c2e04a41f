package mcsnap.engine.execution;

import mcsnap.engine.error.ActionFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link ProcessRunner} backed by {@link ProcessBuilder}. Both output streams
 * are drained concurrently on a dedicated daemon pool.
 */
public class DefaultProcessRunner implements ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(DefaultProcessRunner.class);

    private static final AtomicInteger DRAIN_THREADS = new AtomicInteger();
    private static final ExecutorService DRAIN_POOL = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "mcsnap-proc-io-" + DRAIN_THREADS.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    @Override
    public ProcessResult run(ProcessCommand command) {
        ProcessBuilder builder = new ProcessBuilder(command.argv());
        if (command.workDir() != null) {
            builder.directory(command.workDir().toFile());
        }
        builder.environment().putAll(command.env());

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new ActionFailedException("Failed to start " + command.program() + ": " + e.getMessage(), e);
        }

        CompletableFuture<String> stdout =
                CompletableFuture.supplyAsync(() -> drain(process.getInputStream()), DRAIN_POOL);
        CompletableFuture<String> stderr =
                CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()), DRAIN_POOL);

        try {
            boolean finished;
            if (command.timeout() != null) {
                finished = process.waitFor(command.timeout().toMillis(), TimeUnit.MILLISECONDS);
            } else {
                process.waitFor();
                finished = true;
            }

            if (!finished) {
                log.warn("Process {} exceeded timeout {}, destroying", command.program(), command.timeout());
                process.destroyForcibly();
                process.waitFor(5, TimeUnit.SECONDS);
                return new ProcessResult(-1, stdout.getNow(""), stderr.getNow(""), true);
            }

            int exitCode = process.exitValue();
            log.debug("Process {} finished with code: {}", command.program(), exitCode);
            return new ProcessResult(exitCode, stdout.get(), stderr.get(), false);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ActionFailedException("Interrupted while waiting for " + command.program(), e);
        } catch (ExecutionException e) {
            throw new ActionFailedException("Failed to read output of " + command.program(), e.getCause());
        }
    }

    private static String drain(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
