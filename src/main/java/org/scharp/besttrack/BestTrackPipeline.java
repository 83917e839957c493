///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.besttrack;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a best-track file into typed track points and, optionally, writes them as a track dataset file.
 * <p>
 * This runs the whole pipeline: the {@link RecordAssembler} joins track point lines with their storm headers, the
 * {@link EntryCountValidator} checks the number of track points of each storm, and the {@link SchemaNormalizer}
 * converts each record into a {@link TrackPoint}.
 * </p>
 * <pre>
 * BestTrackResult result = BestTrackPipeline.read(Paths.get("hurdat2.txt"), BestTrackOptions.defaults());
 * for (TrackPoint trackPoint : result.trackPoints()) {
 *     ...
 * }
 * result.write(Paths.get("hurdat2.btrk"));
 * </pre>
 */
public final class BestTrackPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(BestTrackPipeline.class);

    // private constructor to prevent anyone from instantiating the class.
    private BestTrackPipeline() {
    }

    /**
     * Reads a best-track file.
     *
     * @param sourceLocation
     *     The file to read.
     * @param options
     *     The options that control parsing.
     *
     * @return the track points and the result of checking their counts
     *
     * @throws IOException
     *     if the file couldn't be read.
     * @throws BestTrackFormatException
     *     if the file is malformed.
     * @throws NullPointerException
     *     if {@code sourceLocation} or {@code options} is {@code null}.
     */
    public static BestTrackResult read(Path sourceLocation, BestTrackOptions options) throws IOException {
        ArgumentUtil.checkNotNull(sourceLocation, "sourceLocation");
        ArgumentUtil.checkNotNull(options, "options");

        LOG.info("Reading best-track file {}", sourceLocation);
        return read(Files.newBufferedReader(sourceLocation, options.charset()), options);
    }

    /**
     * Reads best-track lines.
     *
     * @param reader
     *     The source of the lines.  It is closed when this method returns.
     * @param options
     *     The options that control parsing.  The charset is not used, since the reader already decodes the input.
     *
     * @return the track points and the result of checking their counts
     *
     * @throws IOException
     *     if the input couldn't be read.
     * @throws BestTrackFormatException
     *     if the input is malformed.
     * @throws NullPointerException
     *     if {@code reader} or {@code options} is {@code null}.
     */
    public static BestTrackResult read(Reader reader, BestTrackOptions options) throws IOException {
        ArgumentUtil.checkNotNull(reader, "reader");
        ArgumentUtil.checkNotNull(options, "options");

        EntryCountValidator validator = new EntryCountValidator(options);
        SchemaNormalizer normalizer = new SchemaNormalizer(options);
        List<TrackPoint> trackPoints = new ArrayList<>();

        try (RecordAssembler assembler = new RecordAssembler(reader, options)) {
            while (assembler.hasNext()) {
                CompositeRecord record = assembler.next();
                validator.accept(record);
                trackPoints.add(normalizer.normalize(record));
            }
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }

        ValidationReport report = validator.finish();
        BestTrackResult result = new BestTrackResult(trackPoints, report, TrackPointSchema.metadata(options));
        LOG.info("Read {} track point(s) from {} storm(s)", trackPoints.size(), result.uniqueIds().size());
        return result;
    }

    /**
     * Reads a best-track file and writes its track points as a track dataset file.
     *
     * @param sourceLocation
     *     The best-track file to read.
     * @param targetLocation
     *     The dataset file to write.  If it exists, it is replaced.
     * @param options
     *     The options that control parsing.
     *
     * @return the track points and the result of checking their counts
     *
     * @throws IOException
     *     if a file couldn't be read or written.
     * @throws BestTrackFormatException
     *     if the best-track file is malformed.  Nothing is written in this case.
     * @throws NullPointerException
     *     if any argument is {@code null}.
     */
    public static BestTrackResult convert(Path sourceLocation, Path targetLocation, BestTrackOptions options)
        throws IOException {
        ArgumentUtil.checkNotNull(targetLocation, "targetLocation");

        BestTrackResult result = read(sourceLocation, options);
        result.write(targetLocation);
        LOG.info("Wrote {} observation(s) to {}", result.trackPoints().size(), targetLocation);
        return result;
    }
}
