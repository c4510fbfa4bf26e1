package com.questrail.helixd.protocol;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * HelixProtocol
 * =============================================================================
 * Constants of the helixd wire contract.
 *
 * <ul>
 *   <li>{@link #PROTOCOL_VERSION}: the single request version the daemon accepts</li>
 *   <li>{@link #MAX_MESSAGE_SIZE}: the longest request line accepted, in bytes</li>
 *   <li>{@link #DEFAULT_SOCKET_PATH}: the well-known endpoint clients connect to</li>
 * </ul>
 */
public final class HelixProtocol
{
    public static final int PROTOCOL_VERSION = 1;

    public static final int MAX_MESSAGE_SIZE = 1024 * 1024;

    public static final String DEFAULT_SOCKET_PATH = "~/.helix/run/helixd.sock";

    private static final String VERSION_RESOURCE = "/helixd.properties";

    private HelixProtocol() {}

    /**
     * Returns the daemon build version reported by {@code ping}.
     *
     * <p>Read from the build-filtered {@code helixd.properties} resource.</p>
     */
    public static String daemonVersion()
    {
        return VersionHolder.VERSION;
    }

    private static final class VersionHolder
    {
        private static final String VERSION = load();

        private static String load()
        {
            try (InputStream in = HelixProtocol.class.getResourceAsStream(VERSION_RESOURCE)) {
                if (in == null) {
                    return "unknown";
                }
                Properties props = new Properties();
                props.load(in);
                return props.getProperty("daemon.version", "unknown");
            }
            catch (IOException e) {
                throw new UncheckedIOException("Failed to read " + VERSION_RESOURCE, e);
            }
        }
    }
}
