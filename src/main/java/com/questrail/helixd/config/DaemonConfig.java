package com.questrail.helixd.config;

import com.questrail.helixd.protocol.HelixProtocol;
import com.questrail.helixd.server.SocketPaths;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Properties;

/**
 * Aggregated configuration for the helixd runtime.
 *
 * @param socketPath  Unix domain socket the daemon listens on
 * @param syncWorkers size of the pool that runs sync executors
 * @param ioThreads   number of transport I/O threads; {@code 0} picks a default
 * @param syncCommand command template run by the process executor
 */
public record DaemonConfig(
    Path socketPath,
    int syncWorkers,
    int ioThreads,
    List<String> syncCommand
) {
    public static final String SOCKET_KEY = "helixd.socket";
    public static final String SYNC_WORKERS_KEY = "helixd.sync-workers";
    public static final String IO_THREADS_KEY = "helixd.io-threads";
    public static final String SYNC_COMMAND_KEY = "helixd.sync-command";

    public static final int DEFAULT_SYNC_WORKERS = Math.max(1, Runtime.getRuntime().availableProcessors());
    public static final List<String> DEFAULT_SYNC_COMMAND =
            List.of("{tool}", "sync", "--directory", "{directory}");

    public DaemonConfig {
        Objects.requireNonNull(socketPath, "socketPath");
        Objects.requireNonNull(syncCommand, "syncCommand");
        if (syncWorkers <= 0) {
            throw new IllegalArgumentException("syncWorkers must be > 0");
        }
        if (ioThreads < 0) {
            throw new IllegalArgumentException("ioThreads must be >= 0");
        }
        if (syncCommand.isEmpty()) {
            throw new IllegalArgumentException("syncCommand must not be empty");
        }
        syncCommand = List.copyOf(syncCommand);
    }

    public static DaemonConfig defaults() {
        return builder().build();
    }

    /**
     * Reads configuration from {@code properties}; absent keys keep their
     * defaults. The sync command is split on whitespace.
     *
     * @throws IllegalArgumentException if a numeric value is malformed
     */
    public static DaemonConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");
        Builder builder = builder();

        String socket = trimmed(properties.getProperty(SOCKET_KEY));
        if (socket != null) {
            builder.withSocketPath(SocketPaths.expand(socket));
        }
        String workers = trimmed(properties.getProperty(SYNC_WORKERS_KEY));
        if (workers != null) {
            builder.withSyncWorkers(parseInt(SYNC_WORKERS_KEY, workers));
        }
        String io = trimmed(properties.getProperty(IO_THREADS_KEY));
        if (io != null) {
            builder.withIoThreads(parseInt(IO_THREADS_KEY, io));
        }
        String command = trimmed(properties.getProperty(SYNC_COMMAND_KEY));
        if (command != null) {
            builder.withSyncCommand(new ArrayList<>(Arrays.asList(command.split("\\s+"))));
        }
        return builder.build();
    }

    private static String trimmed(String value) {
        if (value == null) {
            return null;
        }
        String t = value.trim();
        return t.isEmpty() ? null : t;
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path socketPath = SocketPaths.expand(HelixProtocol.DEFAULT_SOCKET_PATH);
        private int syncWorkers = DEFAULT_SYNC_WORKERS;
        private int ioThreads = 0;
        private List<String> syncCommand = DEFAULT_SYNC_COMMAND;

        public Builder withSocketPath(Path socketPath) {
            this.socketPath = socketPath;
            return this;
        }

        public Builder withSyncWorkers(int syncWorkers) {
            this.syncWorkers = syncWorkers;
            return this;
        }

        public Builder withIoThreads(int ioThreads) {
            this.ioThreads = ioThreads;
            return this;
        }

        public Builder withSyncCommand(List<String> syncCommand) {
            this.syncCommand = syncCommand;
            return this;
        }

        public DaemonConfig build() {
            return new DaemonConfig(socketPath, syncWorkers, ioThreads, syncCommand);
        }
    }
}
