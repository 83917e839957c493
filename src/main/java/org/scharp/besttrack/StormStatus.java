///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.besttrack;

/**
 * The status (system type) of a storm at one track point.
 */
public enum StormStatus {
    /** Tropical cyclone of tropical depression intensity (less than 34 knots). */
    TD("Tropical depression"),

    /** Tropical cyclone of tropical storm intensity (34 to 63 knots). */
    TS("Tropical storm"),

    /** Tropical cyclone of hurricane intensity (64 knots or more). */
    HU("Hurricane"),

    /** Extratropical cyclone (of any intensity). */
    EX("Extratropical cyclone"),

    /** Subtropical cyclone of subtropical depression intensity (less than 34 knots). */
    SD("Subtropical depression"),

    /** Subtropical cyclone of subtropical storm intensity (34 knots or more). */
    SS("Subtropical storm"),

    /** A low that is neither a tropical, a subtropical, nor an extratropical cyclone (of any intensity). */
    LO("Low"),

    /** Tropical wave (of any intensity). */
    WV("Tropical wave"),

    /** Disturbance (of any intensity). */
    DB("Disturbance");

    private final String description;

    StormStatus(String description) {
        this.description = description;
    }

    /**
     * Gets a human-readable description of this status.
     *
     * @return the description
     */
    public String description() {
        return description;
    }

    /**
     * Gets the status with the given two-letter code.
     *
     * @param code
     *     The code, such as {@code "HU"}.  It must be upper case and must not have surrounding spaces.
     *
     * @return The status, or {@code null} if no status has that code.
     *
     * @throws NullPointerException
     *     if {@code code} is {@code null}.
     */
    public static StormStatus fromCode(String code) {
        ArgumentUtil.checkNotNull(code, "code");
        for (StormStatus status : values()) {
            if (status.name().equals(code)) {
                return status;
            }
        }
        return null;
    }
}
