package mcsnap.engine;

import mcsnap.engine.config.Dependencies;
import mcsnap.engine.config.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Standalone entry point: wires the engine from environment variables, starts
 * the scheduler and runs until the JVM is asked to stop.
 */
public final class EngineApp {

    private static final Logger log = LoggerFactory.getLogger(EngineApp.class);

    private EngineApp() {
    }

    public static void main(String[] args) throws InterruptedException {
        EngineConfig config = EngineConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested, stopping engine...");
            deps.close();
            stopped.countDown();
        }, "mcsnap-shutdown"));

        deps.startScheduler();
        log.info("Snapshot engine started with {} active schedule(s)", deps.scheduler().activeTaskCount());

        stopped.await();
    }
}
