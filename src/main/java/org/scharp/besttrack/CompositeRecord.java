///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.besttrack;

/**
 * A track point line joined with the header of the storm it belongs to.
 * <p>
 * The coordinates have already been converted to signed decimal degrees; every other field is still the text from the
 * line.  Instances of this class are immutable.
 * </p>
 */
public final class CompositeRecord {

    private final HeaderRecord header;
    private final RawTrackPoint rawTrackPoint;
    private final double latitude;
    private final double longitude;
    private final int lineNumber;

    CompositeRecord(HeaderRecord header, RawTrackPoint rawTrackPoint, double latitude, double longitude,
        int lineNumber) {
        this.header = header;
        this.rawTrackPoint = rawTrackPoint;
        this.latitude = latitude;
        this.longitude = longitude;
        this.lineNumber = lineNumber;
    }

    /**
     * Gets the header of the storm to which this track point belongs.
     *
     * @return the header
     */
    public HeaderRecord header() {
        return header;
    }

    /**
     * Gets the track point's fields as text.
     *
     * @return the track point's fields
     */
    public RawTrackPoint rawTrackPoint() {
        return rawTrackPoint;
    }

    /**
     * @return the latitude in decimal degrees, positive in the northern hemisphere.
     */
    public double latitude() {
        return latitude;
    }

    /**
     * @return the longitude in decimal degrees, positive in the eastern hemisphere.
     */
    public double longitude() {
        return longitude;
    }

    /**
     * Gets the 1-based number of the line from which the track point was read.
     *
     * @return the line number
     */
    public int lineNumber() {
        return lineNumber;
    }

    /**
     * Gets the key shared by all of the storm's track points, such as {@code "1851AL01"}.
     *
     * @return the storm's unique ID
     */
    public String uniqueId() {
        return header.uniqueId();
    }

    /**
     * Gets the identity under which this track point is counted.
     *
     * @return the storm identity
     */
    public StormIdentity stormIdentity() {
        return StormIdentity.of(this);
    }

    @Override
    public String toString() {
        return header.identity() + " line " + lineNumber;
    }
}
