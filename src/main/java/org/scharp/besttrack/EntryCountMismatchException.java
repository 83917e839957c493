///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.besttrack;

/**
 * Thrown when a storm's number of track points differs from its declared count and the difference can't be
 * explained by the storm crossing into a new year.  This is only thrown when
 * {@link BestTrackOptions#failOnUnexpectedMismatch()} is set.
 */
public class EntryCountMismatchException extends BestTrackFormatException {
    private static final long serialVersionUID = 1L;

    EntryCountMismatchException(String message, int lineNumber, String stormIdentity) {
        super(message, lineNumber, stormIdentity, null);
    }

    EntryCountMismatchException(String message, int lineNumber, String stormIdentity, Throwable cause) {
        super(message, lineNumber, stormIdentity, cause);
    }
}
