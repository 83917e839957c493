///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.besttrack;

import java.util.Objects;

/**
 * The storm header line that precedes a storm's track points.
 * <p>
 * Instances of this class are immutable.
 * </p>
 */
public final class HeaderRecord {

    private final String basin;
    private final String cycloneNumber;
    private final int year;
    private final String name;
    private final int declaredEntries;
    private final int lineNumber;

    HeaderRecord(String basin, String cycloneNumber, int year, String name, int declaredEntries, int lineNumber) {
        this.basin = basin;
        this.cycloneNumber = cycloneNumber;
        this.year = year;
        this.name = name;
        this.declaredEntries = declaredEntries;
        this.lineNumber = lineNumber;
    }

    /**
     * Gets the two-letter basin code, such as {@code "AL"} for the North Atlantic.
     *
     * @return The basin.  This is never {@code null}.
     */
    public String basin() {
        return basin;
    }

    /**
     * Gets the storm's two-digit number within its basin and year, such as {@code "01"}.
     *
     * @return The cyclone number.  This is never {@code null}.
     */
    public String cycloneNumber() {
        return cycloneNumber;
    }

    /**
     * Gets the year in which the storm began.
     *
     * @return The storm's year.
     */
    public int year() {
        return year;
    }

    /**
     * Gets the storm's name, which is {@code "UNNAMED"} for storms that were never named.
     *
     * @return The name, without padding.  This is never {@code null}.
     */
    public String name() {
        return name;
    }

    /**
     * Gets the number of track point lines that follow this header.
     *
     * @return The declared entry count.
     */
    public int declaredEntries() {
        return declaredEntries;
    }

    /**
     * Gets the 1-based line number of the header.
     *
     * @return The line number, or {@link BestTrackFormatException#UNKNOWN_LINE} if it isn't known.
     */
    public int lineNumber() {
        return lineNumber;
    }

    /**
     * Gets the key shared by all of this storm's track points: the year, basin, and cyclone number, such as
     * {@code "1851AL01"}.
     *
     * @return The storm's unique ID.
     */
    public String uniqueId() {
        return String.format("%04d%s%s", year, basin, cycloneNumber);
    }

    /**
     * Gets a short description of this storm for messages, such as {@code "AL011851 UNNAMED"}.
     *
     * @return a description of the storm.
     */
    public String identity() {
        return String.format("%s%s%04d %s", basin, cycloneNumber, year, name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(basin, cycloneNumber, year, name, declaredEntries, lineNumber);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof HeaderRecord otherHeader)) {
            return false;
        }

        return basin.equals(otherHeader.basin) &&
            cycloneNumber.equals(otherHeader.cycloneNumber) &&
            year == otherHeader.year &&
            name.equals(otherHeader.name) &&
            declaredEntries == otherHeader.declaredEntries &&
            lineNumber == otherHeader.lineNumber;
    }

    @Override
    public String toString() {
        return identity() + " (" + declaredEntries + " entries)";
    }
}
