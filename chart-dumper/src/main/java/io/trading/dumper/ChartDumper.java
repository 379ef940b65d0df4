package io.trading.dumper;

import io.trading.dumper.config.ChartConfig;
import io.trading.dumper.config.DumperConfig;
import io.trading.dumper.core.DumperController;
import org.agrona.concurrent.ShutdownSignalBarrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for the Chart Dumper application.
 */
public class ChartDumper {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChartDumper.class);

    public static void main(String[] args) {
        LOGGER.info("========================================");
        LOGGER.info("   Chart Dumper Starting...");
        LOGGER.info("========================================");

        try {
            // Load configuration from environment variables
            DumperConfig config = DumperConfig.fromEnv();
            LOGGER.info("Configuration loaded:");
            LOGGER.info("  Dumper ID: {}", config.dumperId());
            LOGGER.info("  Output Dir: {}", config.outputDir());
            LOGGER.info("  Log Zone: {}", config.logZone());
            LOGGER.info("  Source Provider: {}", config.sourceProvider());
            for (ChartConfig chart : config.charts()) {
                LOGGER.info("  Chart: {} {}", chart.source(), chart.features());
            }

            DumperController controller = new DumperController(config);
            controller.start();

            // Setup shutdown hooks for graceful termination
            ShutdownSignalBarrier shutdownBarrier = controller.getShutdownBarrier();

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                LOGGER.info("Shutdown hook triggered");
                shutdownBarrier.signal();
            }));

            controller.waitForShutdown();

            controller.close();

        } catch (Exception e) {
            LOGGER.error("Fatal error in Chart Dumper", e);
            System.exit(1);
        }

        LOGGER.info("Chart Dumper exited");
    }
}
