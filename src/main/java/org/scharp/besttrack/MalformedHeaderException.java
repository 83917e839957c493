///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.besttrack;

/**
 * Thrown when a line that has the shape of a storm header can't be parsed as one.
 */
public class MalformedHeaderException extends BestTrackFormatException {
    private static final long serialVersionUID = 1L;

    MalformedHeaderException(String message, int lineNumber, String stormIdentity) {
        super(message, lineNumber, stormIdentity, null);
    }

    MalformedHeaderException(String message, int lineNumber, String stormIdentity, Throwable cause) {
        super(message, lineNumber, stormIdentity, cause);
    }
}
