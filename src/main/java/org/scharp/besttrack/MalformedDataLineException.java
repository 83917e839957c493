///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.besttrack;

/**
 * Thrown when a track point line is too short or has an unparseable value in a required field.
 */
public class MalformedDataLineException extends BestTrackFormatException {
    private static final long serialVersionUID = 1L;

    MalformedDataLineException(String message, int lineNumber, String stormIdentity) {
        super(message, lineNumber, stormIdentity, null);
    }

    MalformedDataLineException(String message, int lineNumber, String stormIdentity, Throwable cause) {
        super(message, lineNumber, stormIdentity, cause);
    }
}
