///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.besttrack;

/**
 * The base class of the exceptions thrown when a best-track file cannot be parsed into a well-formed dataset.
 * <p>
 * These exceptions indicate that either the input is corrupt or the offsets in which its fields are read don't match
 * the file's revision of the format.  Continuing would produce wrong data, so the parse stops.
 * </p>
 */
public abstract class BestTrackFormatException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    /** The line number used when the line is not known. */
    public static final int UNKNOWN_LINE = 0;

    private final int lineNumber;
    private final String stormIdentity;

    BestTrackFormatException(String message, int lineNumber, String stormIdentity, Throwable cause) {
        super(describe(message, lineNumber, stormIdentity), cause);
        this.lineNumber = lineNumber;
        this.stormIdentity = stormIdentity;
    }

    private static String describe(String message, int lineNumber, String stormIdentity) {
        StringBuilder builder = new StringBuilder(message);
        if (lineNumber != UNKNOWN_LINE) {
            builder.append(" (line ").append(lineNumber);
            if (stormIdentity != null) {
                builder.append(", storm ").append(stormIdentity);
            }
            builder.append(')');
        } else if (stormIdentity != null) {
            builder.append(" (storm ").append(stormIdentity).append(')');
        }
        return builder.toString();
    }

    /**
     * Gets the 1-based number of the line that could not be parsed.
     *
     * @return the line number, or {@link #UNKNOWN_LINE} if it isn't known.
     */
    public int lineNumber() {
        return lineNumber;
    }

    /**
     * Gets the identity of the storm whose data could not be parsed, such as {@code "AL011851 UNNAMED"}.
     *
     * @return the storm identity, or {@code null} if it isn't known.
     */
    public String stormIdentity() {
        return stormIdentity;
    }
}
