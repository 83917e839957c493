///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.besttrack;

/**
 * What to do with a track point whose status code is unknown or whose date and time aren't a real instant.
 * <p>
 * These problems usually mean that the file doesn't use the field offsets this library reads, so by default they stop
 * the parse.
 * </p>
 */
public enum ErrorPolicy {

    /**
     * Throw an {@link UnknownStatusException} or {@link InvalidDateException}.
     */
    FAIL,

    /**
     * Log a warning and set the status or timestamp to {@code null}.  The status and timestamp columns of the dataset
     * are then declared nullable.
     */
    WARN_AND_MARK_MISSING,
}
