///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.besttrack;

/**
 * Thrown when a coordinate's hemisphere is not N or S (latitude) or E or W (longitude).
 */
public class InvalidHemisphereException extends BestTrackFormatException {
    private static final long serialVersionUID = 1L;

    InvalidHemisphereException(String message, int lineNumber, String stormIdentity) {
        super(message, lineNumber, stormIdentity, null);
    }

    InvalidHemisphereException(String message, int lineNumber, String stormIdentity, Throwable cause) {
        super(message, lineNumber, stormIdentity, cause);
    }
}
