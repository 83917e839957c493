///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.besttrack;

/**
 * Why a track point was recorded outside the regular six-hourly schedule, or what it marks.  Most track points have no
 * record identifier.
 */
public enum RecordIdentifier {
    /** Closest approach to a coast, not followed by a landfall. */
    C('C'),

    /** Genesis. */
    G('G'),

    /** An intensity peak in terms of both pressure and wind. */
    I('I'),

    /** Landfall (center of system crossing a coastline). */
    L('L'),

    /** Minimum in central pressure. */
    P('P'),

    /** Provides additional detail on the intensity of the cyclone when rapid changes are underway. */
    R('R'),

    /** Change of status of the system. */
    S('S'),

    /** Provides additional detail on the track (position) of the cyclone. */
    T('T'),

    /** Maximum sustained wind speed. */
    W('W');

    private final char code;

    RecordIdentifier(char code) {
        this.code = code;
    }

    /**
     * Gets the letter that represents this identifier in a track point line.
     *
     * @return the code
     */
    public char code() {
        return code;
    }

    /**
     * Gets the identifier with the given one-letter code.
     *
     * @param code
     *     The code.
     *
     * @return The identifier, or {@code null} if no identifier has that code.
     */
    public static RecordIdentifier fromCode(char code) {
        for (RecordIdentifier identifier : values()) {
            if (identifier.code == code) {
                return identifier;
            }
        }
        return null;
    }
}
