///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.besttrack;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Converts the text fields of a {@link CompositeRecord} into a typed {@link TrackPoint}.
 * <p>
 * The date and time fields are required.  Numeric fields that are blank, not a number, or one of the configured
 * {@linkplain BestTrackOptions#sentinelValues() sentinel values} become {@code null}.  An unknown status code or an
 * impossible date is handled according to the {@link ErrorPolicy}.
 * </p>
 */
public final class SchemaNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaNormalizer.class);

    private final ErrorPolicy errorPolicy;
    private final Set<Integer> sentinelValues;

    /**
     * Creates a normalizer with the default options.
     */
    public SchemaNormalizer() {
        this(BestTrackOptions.defaults());
    }

    /**
     * Creates a normalizer.
     *
     * @param options
     *     The options.
     *
     * @throws NullPointerException
     *     if {@code options} is {@code null}.
     */
    public SchemaNormalizer(BestTrackOptions options) {
        ArgumentUtil.checkNotNull(options, "options");
        this.errorPolicy = options.errorPolicy();
        this.sentinelValues = options.sentinelValues();
    }

    /**
     * Converts one record.
     *
     * @param record
     *     The record to convert.
     *
     * @return the typed track point
     *
     * @throws NullPointerException
     *     if {@code record} is {@code null}.
     * @throws MalformedDataLineException
     *     if a date or time field is not an integer.
     * @throws UnknownStatusException
     *     if the status code is unknown and the error policy is {@link ErrorPolicy#FAIL}.
     * @throws InvalidDateException
     *     if the date and time aren't a real instant and the error policy is {@link ErrorPolicy#FAIL}.
     */
    public TrackPoint normalize(CompositeRecord record) {
        ArgumentUtil.checkNotNull(record, "record");

        RawTrackPoint raw = record.rawTrackPoint();
        int lineNumber = record.lineNumber();
        String stormIdentity = record.header().identity();

        int year = requiredInteger(raw.year(), "year", lineNumber, stormIdentity);
        int month = requiredInteger(raw.month(), "month", lineNumber, stormIdentity);
        int day = requiredInteger(raw.day(), "day", lineNumber, stormIdentity);
        int hour = requiredInteger(raw.hour(), "hour", lineNumber, stormIdentity);
        int minute = requiredInteger(raw.minute(), "minute", lineNumber, stormIdentity);

        LocalDateTime timestamp;
        try {
            timestamp = LocalDateTime.of(year, month, day, hour, minute);
        } catch (DateTimeException e) {
            String message = String.format(
                "%04d-%02d-%02d %02d:%02d is not a valid date and time", year, month, day, hour, minute);
            if (errorPolicy == ErrorPolicy.FAIL) {
                throw new InvalidDateException(message, lineNumber, stormIdentity, e);
            }
            LOG.warn("{} (line {}, storm {}); timestamp marked missing", message, lineNumber, stormIdentity);
            timestamp = null;
        }

        StormStatus status = StormStatus.fromCode(raw.status());
        if (status == null) {
            String message = "unknown status \"" + raw.status() + "\"";
            if (errorPolicy == ErrorPolicy.FAIL) {
                throw new UnknownStatusException(message, lineNumber, stormIdentity);
            }
            LOG.warn("{} (line {}, storm {}); status marked missing", message, lineNumber, stormIdentity);
        }

        List<Integer> windRadii = new ArrayList<>(WindRadius.values().length);
        for (String windRadius : raw.windRadii()) {
            windRadii.add(optionalInteger(windRadius));
        }

        return new TrackPoint(
            record.header(),
            year,
            month,
            day,
            hour,
            minute,
            timestamp,
            recordIdentifier(raw.recordIdentifier(), lineNumber, stormIdentity),
            status,
            record.latitude(),
            record.longitude(),
            optionalInteger(raw.maxWind()),
            optionalInteger(raw.minPressure()),
            windRadii,
            optionalInteger(raw.radiusOfMaximumWind()),
            lineNumber);
    }

    private static boolean isInteger(String text) {
        int start = text.startsWith("-") ? 1 : 0;
        // Longer values can't be in any fixed-width field and might overflow.
        if (text.length() == start || 9 < text.length() - start) {
            return false;
        }
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < '0' || '9' < c) {
                return false;
            }
        }
        return true;
    }

    private static int requiredInteger(String text, String field, int lineNumber, String stormIdentity) {
        if (!isInteger(text)) {
            throw new MalformedDataLineException(
                "track point " + field + " \"" + text + "\" is not an integer", lineNumber, stormIdentity);
        }
        return Integer.parseInt(text);
    }

    /**
     * Converts a numeric field.
     *
     * @return the number, or {@code null} if the field is blank, not an integer, or a sentinel.
     */
    Integer optionalInteger(String text) {
        if (!isInteger(text)) {
            return null;
        }
        int value = Integer.parseInt(text);
        return sentinelValues.contains(value) ? null : value;
    }

    private static RecordIdentifier recordIdentifier(String text, int lineNumber, String stormIdentity) {
        if (text.isEmpty()) {
            return null;
        }
        RecordIdentifier identifier = text.length() == 1 ? RecordIdentifier.fromCode(text.charAt(0)) : null;
        if (identifier == null) {
            LOG.warn("Unknown record identifier \"{}\" (line {}, storm {}); marked missing",
                text, lineNumber, stormIdentity);
        }
        return identifier;
    }
}
