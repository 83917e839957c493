///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.besttrack;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the fixed-width track point lines that follow a storm header.
 * <p>
 * A track point line looks like this (wrapped here):
 * </p>
 * <pre>
 * 18510625, 0000,  , HU, 28.0N,  94.8W,  80, -999, -999, -999, -999, -999, -999, -999, -999, -999,
 *     -999, -999, -999, -999,
 * </pre>
 * <p>
 * Fields are read by position:
 * </p>
 * <pre>
 *   [0,4) year      [4,6) month    [6,8) day      [10,12) hour    [12,14) minute
 *   [16,17) record identifier      [19,21) status
 *   [23,27) latitude   [27,28) N/S  [30,35) longitude  [35,36) E/W
 *   [38,41) maximum sustained wind  [43,47) minimum pressure
 *   [49,53), [55,59), ... [115,119)  twelve wind radii (see {@link WindRadius})
 *   [121,125) radius of maximum wind
 * </pre>
 */
public final class DataLineParser {

    /** The shortest line that holds every field, through the radius of maximum wind. */
    public static final int MINIMUM_LENGTH = 125;

    /** The shortest line written before the radius of maximum wind was added to the format. */
    public static final int MINIMUM_LEGACY_LENGTH = 119;

    private static final int FIRST_WIND_RADIUS_START = 49;
    private static final int WIND_RADIUS_WIDTH = 4;
    private static final int WIND_RADIUS_STRIDE = 6;

    private static final int RADIUS_OF_MAXIMUM_WIND_START = 121;
    private static final int RADIUS_OF_MAXIMUM_WIND_END = 125;

    // private constructor to prevent anyone from instantiating the class.
    private DataLineParser() {
    }

    private static String field(String line, int start, int end) {
        return line.substring(start, end).trim();
    }

    /**
     * Parses a track point line.
     *
     * @param line
     *     The line to parse.
     * @param lineNumber
     *     The 1-based line number, for error messages.  Use {@link BestTrackFormatException#UNKNOWN_LINE} if it isn't
     *     known.
     *
     * @return The line's fields.
     *
     * @throws NullPointerException
     *     if {@code line} is {@code null}.
     * @throws MalformedDataLineException
     *     if the line is shorter than {@link #MINIMUM_LENGTH}.
     */
    public static RawTrackPoint parse(String line, int lineNumber) {
        return parse(line, lineNumber, null, false);
    }

    /**
     * Parses a track point line.
     *
     * @param line
     *     The line to parse.
     * @param lineNumber
     *     The 1-based line number, for error messages.
     * @param stormIdentity
     *     The storm the line belongs to, for error messages.  This may be {@code null}.
     * @param acceptLegacyLines
     *     Whether lines that end after the wind radii are accepted, in which case the radius of maximum wind is
     *     blank.
     *
     * @return The line's fields.
     */
    static RawTrackPoint parse(String line, int lineNumber, String stormIdentity, boolean acceptLegacyLines) {
        ArgumentUtil.checkNotNull(line, "line");

        final int minimumLength = acceptLegacyLines ? MINIMUM_LEGACY_LENGTH : MINIMUM_LENGTH;
        if (line.length() < minimumLength) {
            throw new MalformedDataLineException(
                "track point line has " + line.length() + " characters but at least " + minimumLength +
                    " are required", lineNumber, stormIdentity);
        }

        List<String> windRadii = new ArrayList<>(WindRadius.values().length);
        for (WindRadius radius : WindRadius.values()) {
            int start = FIRST_WIND_RADIUS_START + radius.ordinal() * WIND_RADIUS_STRIDE;
            windRadii.add(field(line, start, start + WIND_RADIUS_WIDTH));
        }

        final String radiusOfMaximumWind;
        if (RADIUS_OF_MAXIMUM_WIND_END <= line.length()) {
            radiusOfMaximumWind = field(line, RADIUS_OF_MAXIMUM_WIND_START, RADIUS_OF_MAXIMUM_WIND_END);
        } else {
            // A legacy line.  If it was only partially cut off, the field is still unusable.
            radiusOfMaximumWind = "";
        }

        return new RawTrackPoint(
            field(line, 0, 4),
            field(line, 4, 6),
            field(line, 6, 8),
            field(line, 10, 12),
            field(line, 12, 14),
            field(line, 16, 17),
            field(line, 19, 21),
            field(line, 23, 27),
            field(line, 27, 28),
            field(line, 30, 35),
            field(line, 35, 36),
            field(line, 38, 41),
            field(line, 43, 47),
            windRadii,
            radiusOfMaximumWind);
    }
}
