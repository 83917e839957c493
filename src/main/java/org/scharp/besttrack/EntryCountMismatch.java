///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.besttrack;

import java.util.Objects;

/**
 * A storm identity whose number of track points differs from the number its header declares.
 * <p>
 * Instances of this class are immutable.
 * </p>
 */
public final class EntryCountMismatch {

    private final StormIdentity stormIdentity;
    private final HeaderRecord header;
    private final int observedEntries;
    private final boolean expected;

    EntryCountMismatch(StormIdentity stormIdentity, HeaderRecord header, int observedEntries, boolean expected) {
        this.stormIdentity = stormIdentity;
        this.header = header;
        this.observedEntries = observedEntries;
        this.expected = expected;
    }

    public StormIdentity stormIdentity() {
        return stormIdentity;
    }

    /**
     * Gets the header that declared the number of track points.
     *
     * @return the header
     */
    public HeaderRecord header() {
        return header;
    }

    public int declaredEntries() {
        return header.declaredEntries();
    }

    public int observedEntries() {
        return observedEntries;
    }

    /**
     * Determines whether the mismatch is explained by the storm continuing into a new year.  When it is, the header's
     * track points are split among one identity per year and their total matches the declared count.
     *
     * @return {@code true} if the mismatch is expected.
     */
    public boolean isExpected() {
        return expected;
    }

    @Override
    public int hashCode() {
        return Objects.hash(stormIdentity, header, observedEntries, expected);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof EntryCountMismatch otherMismatch)) {
            return false;
        }

        return stormIdentity.equals(otherMismatch.stormIdentity) &&
            header.equals(otherMismatch.header) &&
            observedEntries == otherMismatch.observedEntries &&
            expected == otherMismatch.expected;
    }

    @Override
    public String toString() {
        return stormIdentity + " has " + observedEntries + " track point(s) but its header on line " +
            header.lineNumber() + " declares " + header.declaredEntries() + (expected ? " (crosses a year)" : "");
    }
}
