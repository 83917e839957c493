///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.besttrack;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Reads a best-track file and joins each track point line with the header of the storm it belongs to.
 * <p>
 * The assembler reads one line at a time.  When it finds a storm header, the next lines, as many as the header
 * declares, are read as that storm's track points.  Lines outside of a storm that are not headers (such as blank lines)
 * are skipped.  A line that begins like a header but can't be parsed as one is skipped with a warning, unless
 * {@link BestTrackOptions#failOnDamagedHeader} is set.
 * </p>
 * <p>
 * Records are produced lazily, in the order of the input, and can only be iterated once.  Closing the assembler closes
 * the underlying reader.
 * </p>
 * <pre>
 * try (RecordAssembler assembler = new RecordAssembler(Files.newBufferedReader(path), BestTrackOptions.defaults())) {
 *     while (assembler.hasNext()) {
 *         CompositeRecord record = assembler.next();
 *         ...
 *     }
 * }
 * </pre>
 */
public final class RecordAssembler implements Iterator<CompositeRecord>, Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(RecordAssembler.class);

    private final LineCursor cursor;
    private final boolean acceptLegacyLines;
    private final boolean failOnDamagedHeader;

    private HeaderRecord currentHeader;
    private int remainingEntries;
    private CompositeRecord nextRecord;
    private int skippedLines;

    /**
     * Creates an assembler with the default options.
     *
     * @param reader
     *     The source of the best-track lines.
     *
     * @throws NullPointerException
     *     if {@code reader} is {@code null}.
     */
    public RecordAssembler(Reader reader) {
        this(reader, BestTrackOptions.defaults());
    }

    /**
     * Creates an assembler.
     *
     * @param reader
     *     The source of the best-track lines.  The assembler takes ownership of it.
     * @param options
     *     The options that control parsing.
     *
     * @throws NullPointerException
     *     if {@code reader} or {@code options} is {@code null}.
     */
    public RecordAssembler(Reader reader, BestTrackOptions options) {
        ArgumentUtil.checkNotNull(reader, "reader");
        ArgumentUtil.checkNotNull(options, "options");

        this.cursor = new LineCursor(reader);
        this.acceptLegacyLines = options.acceptLegacyLines();
        this.failOnDamagedHeader = options.failOnDamagedHeader();
        this.currentHeader = null;
        this.remainingEntries = 0;
        this.nextRecord = null;
        this.skippedLines = 0;
    }

    /**
     * Determines whether there is another track point.
     *
     * @return {@code true} if {@link #next} will return a record.
     *
     * @throws BestTrackFormatException
     *     if the input is malformed.
     * @throws UncheckedIOException
     *     if the input couldn't be read.
     */
    @Override
    public boolean hasNext() {
        if (nextRecord == null) {
            nextRecord = readRecord();
        }
        return nextRecord != null;
    }

    /**
     * Gets the next track point.
     *
     * @return the next record.
     *
     * @throws NoSuchElementException
     *     if there are no more track points.
     * @throws BestTrackFormatException
     *     if the input is malformed.
     * @throws UncheckedIOException
     *     if the input couldn't be read.
     */
    @Override
    public CompositeRecord next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        CompositeRecord record = nextRecord;
        nextRecord = null;
        return record;
    }

    /**
     * Gets the remaining track points as a sequential stream.  Closing the stream closes this assembler.
     *
     * @return a stream of the records that haven't been returned by {@link #next} yet.
     */
    public Stream<CompositeRecord> stream() {
        Spliterator<CompositeRecord> spliterator = Spliterators.spliteratorUnknownSize(
            this,
            Spliterator.ORDERED | Spliterator.NONNULL);
        return StreamSupport.stream(spliterator, false).onClose(() -> {
            try {
                close();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
    }

    /**
     * Gets the number of lines that were skipped because they were neither headers nor inside a storm.
     *
     * @return the number of lines skipped so far
     */
    public int skippedLines() {
        return skippedLines;
    }

    private CompositeRecord readRecord() {
        while (true) {
            if (0 < remainingEntries) {
                String line = cursor.nextLine();
                if (line == null) {
                    int found = currentHeader.declaredEntries() - remainingEntries;
                    throw new TruncatedStormException(
                        "storm declares " + currentHeader.declaredEntries() + " track points but the input ends after " +
                            found,
                        currentHeader.lineNumber(),
                        currentHeader.identity());
                }
                remainingEntries--;
                return assemble(line, cursor.lineNumber());
            }

            String line = cursor.nextLine();
            if (line == null) {
                if (skippedLines != 0) {
                    LOG.debug("Skipped {} line(s) that were not part of a storm", skippedLines);
                }
                return null;
            }

            if (HeaderLineParser.isHeader(line)) {
                currentHeader = HeaderLineParser.parse(line, cursor.lineNumber());
                remainingEntries = currentHeader.declaredEntries();
                if (remainingEntries == 0) {
                    LOG.debug("Storm {} on line {} has no track points", currentHeader.identity(), cursor.lineNumber());
                }
            } else if (HeaderLineParser.claimsHeader(line)) {
                if (failOnDamagedHeader) {
                    // Throws with the reason the line isn't a header.
                    HeaderLineParser.parse(line, cursor.lineNumber());
                }
                skippedLines++;
                LOG.warn("Skipping line {}: it begins like a storm header but can't be parsed as one",
                    cursor.lineNumber());
            } else {
                skippedLines++;
                LOG.debug("Skipping line {}: not a storm header", cursor.lineNumber());
            }
        }
    }

    private CompositeRecord assemble(String line, int lineNumber) {
        String stormIdentity = currentHeader.identity();
        RawTrackPoint point = DataLineParser.parse(line, lineNumber, stormIdentity, acceptLegacyLines);

        final double latitude;
        final double longitude;
        try {
            latitude = CoordinateConverter.latitude(
                point.latitudeMagnitude(),
                CoordinateConverter.hemisphereLetter(point.latitudeHemisphere()));
            longitude = CoordinateConverter.longitude(
                point.longitudeMagnitude(),
                CoordinateConverter.hemisphereLetter(point.longitudeHemisphere()));
        } catch (InvalidHemisphereException e) {
            // Add the location.
            throw new InvalidHemisphereException(e.getMessage(), lineNumber, stormIdentity, e);
        } catch (IllegalArgumentException e) {
            throw new MalformedDataLineException(e.getMessage(), lineNumber, stormIdentity, e);
        }

        return new CompositeRecord(currentHeader, point, latitude, longitude, lineNumber);
    }

    @Override
    public void close() throws IOException {
        nextRecord = null;
        remainingEntries = 0;
        cursor.close();
    }
}
