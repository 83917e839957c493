///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.besttrack;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks that each storm has as many track points as its header declares.
 * <p>
 * Track points are counted per {@link StormIdentity}.  A storm that continues past December 31 has one identity per
 * year, so neither count matches the header.  When the counts of all of a header's identities add up to the declared
 * count, the mismatches are reported as expected.  Any other mismatch is unexpected.
 * </p>
 * <p>
 * Mismatches are logged and reported, not thrown, unless {@link BestTrackOptions#failOnUnexpectedMismatch()} is set.
 * Records can be given one at a time with {@link #accept} followed by {@link #finish}, or all at once with
 * {@link #validate}.
 * </p>
 */
public final class EntryCountValidator {

    private static final Logger LOG = LoggerFactory.getLogger(EntryCountValidator.class);

    private static final class Tally {
        final HeaderRecord header;
        int count;

        Tally(HeaderRecord header) {
            this.header = header;
            this.count = 0;
        }
    }

    private final boolean failOnUnexpectedMismatch;
    private final Map<StormIdentity, Tally> tallies;
    private final Map<HeaderRecord, Integer> headerTotals;
    private final Map<HeaderRecord, Set<String>> headerYears;
    private boolean finished;

    /**
     * Creates a validator with the default options.
     */
    public EntryCountValidator() {
        this(BestTrackOptions.defaults());
    }

    /**
     * Creates a validator.
     *
     * @param options
     *     The options.  Only {@link BestTrackOptions#failOnUnexpectedMismatch()} is used.
     *
     * @throws NullPointerException
     *     if {@code options} is {@code null}.
     */
    public EntryCountValidator(BestTrackOptions options) {
        ArgumentUtil.checkNotNull(options, "options");
        this.failOnUnexpectedMismatch = options.failOnUnexpectedMismatch();
        this.tallies = new LinkedHashMap<>();
        this.headerTotals = new LinkedHashMap<>();
        this.headerYears = new LinkedHashMap<>();
        this.finished = false;
    }

    /**
     * Counts one track point.
     *
     * @param record
     *     The track point.
     *
     * @throws NullPointerException
     *     if {@code record} is {@code null}.
     * @throws IllegalStateException
     *     if {@link #finish} has already been invoked.
     */
    public void accept(CompositeRecord record) {
        ArgumentUtil.checkNotNull(record, "record");
        if (finished) {
            throw new IllegalStateException("Cannot invoke accept on a finished validator");
        }

        HeaderRecord header = record.header();
        tallies.computeIfAbsent(record.stormIdentity(), identity -> new Tally(header)).count++;
        headerTotals.merge(header, 1, Integer::sum);
        headerYears.computeIfAbsent(header, h -> new HashSet<>()).add(record.rawTrackPoint().year());
    }

    /**
     * Compares the counted track points with the declared counts.
     *
     * @return the mismatches that were found
     *
     * @throws EntryCountMismatchException
     *     if {@link BestTrackOptions#failOnUnexpectedMismatch()} is set and there is an unexpected mismatch.
     * @throws IllegalStateException
     *     if this method has already been invoked.
     */
    public ValidationReport finish() {
        if (finished) {
            throw new IllegalStateException("Cannot invoke finish on a finished validator");
        }
        finished = true;

        List<EntryCountMismatch> mismatches = new ArrayList<>();
        for (Map.Entry<StormIdentity, Tally> entry : tallies.entrySet()) {
            StormIdentity identity = entry.getKey();
            Tally tally = entry.getValue();
            HeaderRecord header = tally.header;
            if (tally.count == header.declaredEntries()) {
                continue;
            }

            boolean crossesYear = 1 < headerYears.get(header).size();
            boolean expected = crossesYear && headerTotals.get(header) == header.declaredEntries();
            EntryCountMismatch mismatch = new EntryCountMismatch(identity, header, tally.count, expected);
            mismatches.add(mismatch);

            if (expected) {
                LOG.info("{}", mismatch);
            } else {
                LOG.warn("Unexpected entry count mismatch: {}", mismatch);
                if (failOnUnexpectedMismatch) {
                    throw new EntryCountMismatchException(
                        "storm has " + tally.count + " track point(s) in " + identity.year() + " but its header declares " +
                            header.declaredEntries(),
                        header.lineNumber(),
                        identity.toString());
                }
            }
        }

        LOG.debug("Checked {} storm identities, found {} mismatch(es)", tallies.size(), mismatches.size());
        return new ValidationReport(mismatches, tallies.size());
    }

    /**
     * Counts all of the given track points and compares them with the declared counts.  This is a shortcut for
     * invoking {@link #accept} on each record and then {@link #finish}.
     *
     * @param records
     *     The track points.
     *
     * @return the mismatches that were found
     *
     * @throws EntryCountMismatchException
     *     if {@link BestTrackOptions#failOnUnexpectedMismatch()} is set and there is an unexpected mismatch.
     */
    public ValidationReport validate(Iterable<CompositeRecord> records) {
        ArgumentUtil.checkNotNull(records, "records");
        for (CompositeRecord record : records) {
            accept(record);
        }
        return finish();
    }
}
