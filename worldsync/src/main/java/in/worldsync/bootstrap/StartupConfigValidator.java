package in.worldsync.bootstrap;

import in.worldsync.config.WorldsSyncConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Startup configuration validator.
 *
 * Runs before anything connects. Throws IllegalStateException listing every problem
 * found, so the process refuses to start on a bad environment.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    /**
     * @throws IllegalStateException if the configuration is unusable
     */
    public static void validate(WorldsSyncConfig config) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");
        log.info("Run mode: {}", config.runMode());

        List<String> problems = config.problems();
        if (!problems.isEmpty()) {
            StringBuilder msg = new StringBuilder("❌ INVALID CONFIG: system refuses to start.\n");
            for (String p : problems) {
                msg.append("  - ").append(p).append('\n');
            }
            throw new IllegalStateException(msg.toString());
        }

        if (config.runMode().runsPollCycle()) {
            if (config.deviceIds().isEmpty()) {
                log.info("✓ Devices: discovered each cycle (address like '{}')", config.deviceAddressFilter());
            } else {
                log.info("✓ Devices: {} configured", config.deviceIds().size());
            }
        }
        if (config.runMode().runsIngestion()) {
            if (config.priorityTags().isEmpty()) {
                log.warn("⚠️ No PRIORITY_TAGS configured, alerts are disabled");
            } else {
                log.info("✓ Priority tags: {}", config.priorityTags());
            }
            if (config.queueCapacity() < config.batchMaxSize()) {
                log.warn("⚠️ QUEUE_CAPACITY ({}) is below BATCH_MAX_SIZE ({})",
                    config.queueCapacity(), config.batchMaxSize());
            }
        }

        log.info("✅ Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }

    private StartupConfigValidator() {}
}
