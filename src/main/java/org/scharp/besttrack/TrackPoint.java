///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.besttrack;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One observation of a storm, with every field converted to its final type.
 * <p>
 * Missing numeric values are {@code null}.  Instances of this class are immutable.
 * </p>
 */
public final class TrackPoint {

    private final String uniqueId;
    private final String basin;
    private final String cycloneNumber;
    private final int stormYear;
    private final String name;
    private final int year;
    private final int month;
    private final int day;
    private final int hour;
    private final int minute;
    private final LocalDateTime timestamp;
    private final RecordIdentifier recordIdentifier;
    private final StormStatus status;
    private final double latitude;
    private final double longitude;
    private final Integer maxWind;
    private final Integer minPressure;
    private final List<Integer> windRadii;
    private final Integer radiusOfMaximumWind;
    private final int lineNumber;

    TrackPoint(HeaderRecord header, int year, int month, int day, int hour, int minute, LocalDateTime timestamp,
        RecordIdentifier recordIdentifier, StormStatus status, double latitude, double longitude, Integer maxWind,
        Integer minPressure, List<Integer> windRadii, Integer radiusOfMaximumWind, int lineNumber) {
        assert windRadii.size() == WindRadius.values().length : "wrong number of wind radii";

        this.uniqueId = header.uniqueId();
        this.basin = header.basin();
        this.cycloneNumber = header.cycloneNumber();
        this.stormYear = header.year();
        this.name = header.name();
        this.year = year;
        this.month = month;
        this.day = day;
        this.hour = hour;
        this.minute = minute;
        this.timestamp = timestamp;
        this.recordIdentifier = recordIdentifier;
        this.status = status;
        this.latitude = latitude;
        this.longitude = longitude;
        this.maxWind = maxWind;
        this.minPressure = minPressure;
        this.windRadii = Collections.unmodifiableList(new ArrayList<>(windRadii));
        this.radiusOfMaximumWind = radiusOfMaximumWind;
        this.lineNumber = lineNumber;
    }

    /**
     * Gets the key shared by all of the storm's track points: the storm's year, basin, and cyclone number, such as
     * {@code "1851AL01"}.
     *
     * @return the storm's unique ID
     */
    public String uniqueId() {
        return uniqueId;
    }

    public String basin() {
        return basin;
    }

    public String cycloneNumber() {
        return cycloneNumber;
    }

    /**
     * @return the year from the storm's header, which is the year the storm began.
     */
    public int stormYear() {
        return stormYear;
    }

    public String name() {
        return name;
    }

    /**
     * @return the year in which this track point was observed.
     */
    public int year() {
        return year;
    }

    public int month() {
        return month;
    }

    public int day() {
        return day;
    }

    public int hour() {
        return hour;
    }

    public int minute() {
        return minute;
    }

    /**
     * Gets the time of the observation in UTC.
     *
     * @return the timestamp, or {@code null} if the date was impossible and
     *     {@link ErrorPolicy#WARN_AND_MARK_MISSING} was in effect.
     */
    public LocalDateTime timestamp() {
        return timestamp;
    }

    /**
     * @return the record identifier, or {@code null} if the track point has none.
     */
    public RecordIdentifier recordIdentifier() {
        return recordIdentifier;
    }

    /**
     * Gets the storm's status at this track point.
     *
     * @return the status, or {@code null} if the status code was unknown and
     *     {@link ErrorPolicy#WARN_AND_MARK_MISSING} was in effect.
     */
    public StormStatus status() {
        return status;
    }

    public double latitude() {
        return latitude;
    }

    public double longitude() {
        return longitude;
    }

    /**
     * @return the maximum sustained wind in knots, or {@code null} if it is missing.
     */
    public Integer maxWind() {
        return maxWind;
    }

    /**
     * @return the minimum central pressure in millibars, or {@code null} if it is missing.
     */
    public Integer minPressure() {
        return minPressure;
    }

    /**
     * Gets the maximum extent of a wind speed in one quadrant.
     *
     * @param radius
     *     which radius to get
     *
     * @return the radius in nautical miles, or {@code null} if it is missing.
     */
    public Integer windRadius(WindRadius radius) {
        return windRadii.get(radius.ordinal());
    }

    /**
     * @return an unmodifiable list of the twelve wind radii in the order of the {@link WindRadius} constants.
     */
    public List<Integer> windRadii() {
        return windRadii;
    }

    /**
     * @return the radius of maximum wind in nautical miles, or {@code null} if it is missing.
     */
    public Integer radiusOfMaximumWind() {
        return radiusOfMaximumWind;
    }

    /**
     * @return the 1-based number of the line from which this track point was read.
     */
    public int lineNumber() {
        return lineNumber;
    }

    @Override
    public int hashCode() {
        return Objects.hash(uniqueId, name, year, month, day, hour, minute, lineNumber);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof TrackPoint otherPoint)) {
            return false;
        }

        return uniqueId.equals(otherPoint.uniqueId) &&
            basin.equals(otherPoint.basin) &&
            cycloneNumber.equals(otherPoint.cycloneNumber) &&
            stormYear == otherPoint.stormYear &&
            name.equals(otherPoint.name) &&
            year == otherPoint.year &&
            month == otherPoint.month &&
            day == otherPoint.day &&
            hour == otherPoint.hour &&
            minute == otherPoint.minute &&
            Objects.equals(timestamp, otherPoint.timestamp) &&
            recordIdentifier == otherPoint.recordIdentifier &&
            status == otherPoint.status &&
            Double.compare(latitude, otherPoint.latitude) == 0 &&
            Double.compare(longitude, otherPoint.longitude) == 0 &&
            Objects.equals(maxWind, otherPoint.maxWind) &&
            Objects.equals(minPressure, otherPoint.minPressure) &&
            windRadii.equals(otherPoint.windRadii) &&
            Objects.equals(radiusOfMaximumWind, otherPoint.radiusOfMaximumWind) &&
            lineNumber == otherPoint.lineNumber;
    }

    @Override
    public String toString() {
        return uniqueId + ' ' + name + ' ' + String.format("%04d-%02d-%02d %02d:%02d", year, month, day, hour, minute) +
            ' ' + status + ' ' + latitude + ',' + longitude;
    }
}
