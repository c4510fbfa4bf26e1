package com.questrail.helixd.runtime;

import com.questrail.helixd.config.DaemonConfig;
import com.questrail.helixd.observability.Slf4jDaemonObservabilitySink;
import com.questrail.helixd.server.DaemonStartupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Process entry point. Configuration comes from {@code -Dhelixd.*} system
 * properties; see {@link DaemonConfig#fromProperties}.
 */
public final class HelixDaemonMain {
    private static final Logger log = LoggerFactory.getLogger(HelixDaemonMain.class);

    private HelixDaemonMain() {
    }

    public static void main(String[] args) {
        System.exit(run());
    }

    static int run() {
        final DaemonConfig config;
        try {
            config = DaemonConfig.fromProperties(System.getProperties());
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return 1;
        }

        HelixDaemonRuntime runtime = HelixDaemonRuntime.builder()
                .withConfig(config)
                .withObservabilitySink(new Slf4jDaemonObservabilitySink())
                .build();

        Thread hook = new Thread(() -> {
            runtime.shutdown("signal");
            try {
                if (!runtime.awaitClosed(Duration.ofSeconds(10))) {
                    log.warn("helixd did not stop within 10s");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "helixd-shutdown-hook");

        try {
            runtime.start();
            Runtime.getRuntime().addShutdownHook(hook);
            runtime.awaitShutdown();
            return 0;
        } catch (DaemonStartupException e) {
            log.error("helixd failed to start: {}", e.getMessage(), e);
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 1;
        } finally {
            runtime.close();
        }
    }
}
