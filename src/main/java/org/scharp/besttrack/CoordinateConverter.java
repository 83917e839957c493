///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.besttrack;

/**
 * Converts a coordinate's unsigned magnitude and hemisphere letter into signed decimal degrees.
 * <p>
 * The magnitude is given either in degrees with a decimal point ({@code "28.0"}) or, in the older encoding, in tenths
 * of a degree without one ({@code "283"} is 28.3 degrees).  North and east are positive; south and west are negative.
 * </p>
 */
public final class CoordinateConverter {

    private static final double MAX_LATITUDE = 90.0;
    private static final double MAX_LONGITUDE = 180.0;

    // private constructor to prevent anyone from instantiating the class.
    private CoordinateConverter() {
    }

    /**
     * Converts a latitude.
     *
     * @param magnitude
     *     The unsigned magnitude, such as {@code "28.0"} or {@code "283"}.
     * @param hemisphere
     *     {@code 'N'} or {@code 'S'}.
     *
     * @return The latitude in decimal degrees, negative in the southern hemisphere.
     *
     * @throws NullPointerException
     *     if {@code magnitude} is {@code null}.
     * @throws InvalidHemisphereException
     *     if {@code hemisphere} is not {@code 'N'} or {@code 'S'}.
     * @throws IllegalArgumentException
     *     if {@code magnitude} is not a number or is greater than 90.
     */
    public static double latitude(String magnitude, char hemisphere) {
        final double sign;
        if (hemisphere == 'N') {
            sign = 1;
        } else if (hemisphere == 'S') {
            sign = -1;
        } else {
            throw new InvalidHemisphereException(
                "latitude hemisphere '" + hemisphere + "' is not N or S", BestTrackFormatException.UNKNOWN_LINE, null);
        }
        return sign * degrees(magnitude, MAX_LATITUDE, "latitude");
    }

    /**
     * Converts a longitude.
     *
     * @param magnitude
     *     The unsigned magnitude, such as {@code "94.8"} or {@code "948"}.
     * @param hemisphere
     *     {@code 'E'} or {@code 'W'}.
     *
     * @return The longitude in decimal degrees, negative in the western hemisphere.
     *
     * @throws NullPointerException
     *     if {@code magnitude} is {@code null}.
     * @throws InvalidHemisphereException
     *     if {@code hemisphere} is not {@code 'E'} or {@code 'W'}.
     * @throws IllegalArgumentException
     *     if {@code magnitude} is not a number or is greater than 180.
     */
    public static double longitude(String magnitude, char hemisphere) {
        final double sign;
        if (hemisphere == 'E') {
            sign = 1;
        } else if (hemisphere == 'W') {
            sign = -1;
        } else {
            throw new InvalidHemisphereException(
                "longitude hemisphere '" + hemisphere + "' is not E or W", BestTrackFormatException.UNKNOWN_LINE, null);
        }
        return sign * degrees(magnitude, MAX_LONGITUDE, "longitude");
    }

    /**
     * Converts a hemisphere field, which must be exactly one character, into that character.
     *
     * @param hemisphere
     *     The trimmed hemisphere field.
     *
     * @return The hemisphere letter, or a blank if the field is not a single character.  A blank is never a valid
     *     hemisphere, so passing the result on reports the problem.
     */
    static char hemisphereLetter(String hemisphere) {
        return hemisphere.length() == 1 ? hemisphere.charAt(0) : ' ';
    }

    private static double degrees(String magnitude, double maximum, String description) {
        ArgumentUtil.checkNotNull(magnitude, "magnitude");

        String text = magnitude.trim();
        if (text.isEmpty()) {
            throw new IllegalArgumentException(description + " is blank");
        }
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if ((c < '0' || '9' < c) && c != '.') {
                throw new IllegalArgumentException(description + " \"" + text + "\" is not an unsigned number");
            }
        }

        final double degrees;
        try {
            if (text.indexOf('.') != -1) {
                degrees = Double.parseDouble(text);
            } else {
                // Tenths of a degree.  Dividing the exact integer gives the same double as parsing "28.3".
                degrees = Integer.parseInt(text) / 10.0;
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(description + " \"" + text + "\" is not an unsigned number", e);
        }

        if (maximum < degrees) {
            throw new IllegalArgumentException(description + " " + text + " is greater than " + (int) maximum);
        }
        return degrees;
    }
}
