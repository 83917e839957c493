///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.besttrack;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The fields of a track point line as trimmed text, before any type conversion.
 * <p>
 * Values are exactly what the line holds.  In particular, missing-value sentinels such as {@code "-999"} are kept as
 * they are; turning them into missing values is the job of {@link SchemaNormalizer}.
 * </p>
 */
public final class RawTrackPoint {

    private final String year;
    private final String month;
    private final String day;
    private final String hour;
    private final String minute;
    private final String recordIdentifier;
    private final String status;
    private final String latitudeMagnitude;
    private final String latitudeHemisphere;
    private final String longitudeMagnitude;
    private final String longitudeHemisphere;
    private final String maxWind;
    private final String minPressure;
    private final List<String> windRadii;
    private final String radiusOfMaximumWind;

    RawTrackPoint(String year, String month, String day, String hour, String minute, String recordIdentifier,
        String status, String latitudeMagnitude, String latitudeHemisphere, String longitudeMagnitude,
        String longitudeHemisphere, String maxWind, String minPressure, List<String> windRadii,
        String radiusOfMaximumWind) {
        assert windRadii.size() == WindRadius.values().length : "wrong number of wind radii";

        this.year = year;
        this.month = month;
        this.day = day;
        this.hour = hour;
        this.minute = minute;
        this.recordIdentifier = recordIdentifier;
        this.status = status;
        this.latitudeMagnitude = latitudeMagnitude;
        this.latitudeHemisphere = latitudeHemisphere;
        this.longitudeMagnitude = longitudeMagnitude;
        this.longitudeHemisphere = longitudeHemisphere;
        this.maxWind = maxWind;
        this.minPressure = minPressure;
        this.windRadii = Collections.unmodifiableList(new ArrayList<>(windRadii));
        this.radiusOfMaximumWind = radiusOfMaximumWind;
    }

    public String year() {
        return year;
    }

    public String month() {
        return month;
    }

    public String day() {
        return day;
    }

    public String hour() {
        return hour;
    }

    public String minute() {
        return minute;
    }

    /**
     * Gets the one-letter record identifier, such as {@code "L"} for landfall.
     *
     * @return the identifier, which is usually blank.
     */
    public String recordIdentifier() {
        return recordIdentifier;
    }

    public String status() {
        return status;
    }

    public String latitudeMagnitude() {
        return latitudeMagnitude;
    }

    public String latitudeHemisphere() {
        return latitudeHemisphere;
    }

    public String longitudeMagnitude() {
        return longitudeMagnitude;
    }

    public String longitudeHemisphere() {
        return longitudeHemisphere;
    }

    public String maxWind() {
        return maxWind;
    }

    public String minPressure() {
        return minPressure;
    }

    /**
     * Gets one of the twelve wind radii.
     *
     * @param radius
     *     which radius to get
     *
     * @return the radius's text.
     */
    public String windRadius(WindRadius radius) {
        return windRadii.get(radius.ordinal());
    }

    /**
     * Gets the twelve wind radii in the order of the {@link WindRadius} constants.
     *
     * @return an unmodifiable list
     */
    public List<String> windRadii() {
        return windRadii;
    }

    /**
     * Gets the radius of maximum wind.
     *
     * @return the radius's text, which is blank for lines that predate the field.
     */
    public String radiusOfMaximumWind() {
        return radiusOfMaximumWind;
    }
}
