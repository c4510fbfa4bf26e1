package com.questrail.helixd.protocol.codec.impl;

import java.util.Arrays;

/**
 * LineFraming
 * -----------------------------------------------------------------------------
 * Line delimiting rules of the helixd protocol.
 *
 * <p>Each message is one UTF-8 JSON object terminated by {@code \n}. A
 * carriage return immediately before the terminator is tolerated and removed.
 * The size limit applies to the line content, excluding the terminator.</p>
 */
public final class LineFraming
{
    public static final byte DELIMITER = '\n';

    private static final byte CARRIAGE_RETURN = '\r';

    private LineFraming() {}

    /**
     * Returns {@code line} followed by the delimiter.
     */
    public static byte[] terminate(byte[] line)
    {
        byte[] framed = Arrays.copyOf(line, line.length + 1);
        framed[line.length] = DELIMITER;
        return framed;
    }

    /**
     * Removes a trailing {@code \r\n}, {@code \n} or {@code \r}, if present.
     */
    public static byte[] stripLineEnding(byte[] line)
    {
        int end = line.length;
        if (end > 0 && line[end - 1] == DELIMITER) {
            end--;
        }
        if (end > 0 && line[end - 1] == CARRIAGE_RETURN) {
            end--;
        }
        return end == line.length ? line : Arrays.copyOf(line, end);
    }

    public static boolean exceedsLimit(int lineLength, int maxMessageSize)
    {
        return lineLength > maxMessageSize;
    }
}
