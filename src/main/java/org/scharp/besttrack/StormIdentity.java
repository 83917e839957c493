///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.besttrack;

import java.util.Objects;

/**
 * The identity under which track points are counted: basin, cyclone number, observation year, and name.
 * <p>
 * The year is the year in which a track point was observed, not the year in the storm's header.  A storm whose track
 * continues past December 31 therefore has two identities.
 * </p>
 * <p>
 * Instances of this class are immutable.
 * </p>
 */
public final class StormIdentity {

    private final String basin;
    private final String cycloneNumber;
    private final String year;
    private final String name;

    StormIdentity(String basin, String cycloneNumber, String year, String name) {
        this.basin = basin;
        this.cycloneNumber = cycloneNumber;
        this.year = year;
        this.name = name;
    }

    /**
     * Gets the identity of a track point.
     *
     * @param record
     *     The track point.
     *
     * @return its identity
     */
    static StormIdentity of(CompositeRecord record) {
        HeaderRecord header = record.header();
        return new StormIdentity(header.basin(), header.cycloneNumber(), record.rawTrackPoint().year(), header.name());
    }

    public String basin() {
        return basin;
    }

    public String cycloneNumber() {
        return cycloneNumber;
    }

    /**
     * Gets the year in which the track points were observed.
     *
     * @return The observation year as it appears in the track point lines.
     */
    public String year() {
        return year;
    }

    public String name() {
        return name;
    }

    @Override
    public int hashCode() {
        return Objects.hash(basin, cycloneNumber, year, name);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof StormIdentity otherIdentity)) {
            return false;
        }

        return basin.equals(otherIdentity.basin) &&
            cycloneNumber.equals(otherIdentity.cycloneNumber) &&
            year.equals(otherIdentity.year) &&
            name.equals(otherIdentity.name);
    }

    /**
     * Gets a short description of this identity, such as {@code "AL011851 UNNAMED"}.
     *
     * @return a description of the identity
     */
    @Override
    public String toString() {
        return basin + cycloneNumber + year + ' ' + name;
    }
}
