package com.janitor;

import com.janitor.config.JanitorConfig;
import com.janitor.dispatch.CleanupCoordinator;
import com.janitor.exception.JanitorException;
import com.janitor.shutdown.ShutdownGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;

/**
 * Runs cleanup passes every interval, or a single pass in once mode, until shutdown.
 */
public class CleanupLoop implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(CleanupLoop.class);

    private final CleanupCoordinator coordinator;
    private final ShutdownGate gate;
    private final JanitorConfig config;

    public CleanupLoop(CleanupCoordinator coordinator, ShutdownGate gate, JanitorConfig config) {
        this.coordinator = coordinator;
        this.gate = gate;
        this.config = config;
    }

    @Override
    public void run(String... args) throws Exception {
        log.info("Janitor started (dry-run={}, interval={}s, once={}, parallelism={})",
                config.dryRun(), config.interval().getSeconds(), config.once(), config.parallelism());

        while (!gate.isShutdownRequested()) {
            gate.enterCleanup();
            try {
                coordinator.runOnce();
            } catch (JanitorException e) {
                if (config.once()) {
                    throw e;
                }
                log.error("Failed to clean up: {}", e.getMessage(), e);
            } finally {
                gate.exitCleanup();
            }

            if (config.once()) {
                break;
            }
            gate.pause(config.interval());
        }
        log.info("Janitor stopped");
    }
}
