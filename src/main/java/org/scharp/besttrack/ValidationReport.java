///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.besttrack;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The result of checking every storm's track point count against its header.
 * <p>
 * Instances of this class are immutable.
 * </p>
 */
public final class ValidationReport {

    private final List<EntryCountMismatch> mismatches;
    private final int stormIdentities;

    ValidationReport(List<EntryCountMismatch> mismatches, int stormIdentities) {
        this.mismatches = Collections.unmodifiableList(new ArrayList<>(mismatches));
        this.stormIdentities = stormIdentities;
    }

    /**
     * @return an unmodifiable list of every mismatch, in the order in which the storms appear in the input.
     */
    public List<EntryCountMismatch> mismatches() {
        return mismatches;
    }

    /**
     * @return the mismatches that are explained by a storm crossing into a new year.
     */
    public List<EntryCountMismatch> expectedMismatches() {
        List<EntryCountMismatch> expected = new ArrayList<>();
        for (EntryCountMismatch mismatch : mismatches) {
            if (mismatch.isExpected()) {
                expected.add(mismatch);
            }
        }
        return expected;
    }

    /**
     * @return the mismatches that are not explained by a storm crossing into a new year.
     */
    public List<EntryCountMismatch> unexpectedMismatches() {
        List<EntryCountMismatch> unexpected = new ArrayList<>();
        for (EntryCountMismatch mismatch : mismatches) {
            if (!mismatch.isExpected()) {
                unexpected.add(mismatch);
            }
        }
        return unexpected;
    }

    /**
     * @return {@code true} if there are no unexpected mismatches.
     */
    public boolean isValid() {
        return unexpectedMismatches().isEmpty();
    }

    /**
     * Gets the number of distinct storm identities that were checked.
     *
     * @return the number of storm identities
     */
    public int stormIdentities() {
        return stormIdentities;
    }

    @Override
    public String toString() {
        return "ValidationReport[" + stormIdentities + " storm identities, " + mismatches.size() + " mismatch(es)]";
    }
}
