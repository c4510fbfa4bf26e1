package com.questrail.helixd.server;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * Filesystem handling of the daemon's socket path.
 */
public final class SocketPaths
{
    private SocketPaths() {}

    /**
     * Expands a leading {@code ~/} to the current user's home directory.
     * Other paths are returned unchanged.
     */
    public static Path expand(String path)
    {
        return expand(path, System.getProperty("user.home"));
    }

    static Path expand(String path, String home)
    {
        Objects.requireNonNull(path, "path");
        if (path.startsWith("~/") && home != null && !home.isEmpty()) {
            return Paths.get(home, path.substring(2));
        }
        return Paths.get(path);
    }

    /**
     * Creates the parent directories of {@code socketPath} and removes a stale
     * socket file left by a previous run.
     */
    public static void prepare(Path socketPath) throws IOException
    {
        Path parent = socketPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.deleteIfExists(socketPath);
    }

    /**
     * Removes the socket file if present.
     *
     * @return {@code true} if a file was removed
     */
    public static boolean remove(Path socketPath) throws IOException
    {
        return Files.deleteIfExists(socketPath);
    }
}
