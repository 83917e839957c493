///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.besttrack;

import java.util.Locale;

/**
 * The twelve wind radii of a track point: the maximum extent, in nautical miles, of 34, 50, and 64 knot winds in each
 * quadrant around the storm's center.
 * <p>
 * The constants are declared in the order in which the fields appear on a track point line.
 * </p>
 */
public enum WindRadius {
    NE34(34, "NE"),
    SE34(34, "SE"),
    SW34(34, "SW"),
    NW34(34, "NW"),
    NE50(50, "NE"),
    SE50(50, "SE"),
    SW50(50, "SW"),
    NW50(50, "NW"),
    NE64(64, "NE"),
    SE64(64, "SE"),
    SW64(64, "SW"),
    NW64(64, "NW");

    private final int knots;
    private final String quadrant;

    WindRadius(int knots, String quadrant) {
        this.knots = knots;
        this.quadrant = quadrant;
    }

    /**
     * Gets the wind speed threshold.
     *
     * @return 34, 50, or 64.
     */
    public int knots() {
        return knots;
    }

    /**
     * Gets the quadrant.
     *
     * @return "NE", "SE", "SW", or "NW".
     */
    public String quadrant() {
        return quadrant;
    }

    /**
     * Gets the name of the dataset column that holds this radius, such as {@code "ne34"}.
     *
     * @return the column name
     */
    public String columnName() {
        return quadrant.toLowerCase(Locale.ROOT) + knots;
    }
}
