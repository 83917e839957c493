///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.besttrack;

/**
 * Thrown when a track point's date and time don't form a real calendar date and time.
 */
public class InvalidDateException extends BestTrackFormatException {
    private static final long serialVersionUID = 1L;

    InvalidDateException(String message, int lineNumber, String stormIdentity) {
        super(message, lineNumber, stormIdentity, null);
    }

    InvalidDateException(String message, int lineNumber, String stormIdentity, Throwable cause) {
        super(message, lineNumber, stormIdentity, cause);
    }
}
