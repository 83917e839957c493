///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.besttrack;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The track points read from a best-track file, together with the result of checking their counts.
 * <p>
 * Instances of this class are immutable.
 * </p>
 */
public final class BestTrackResult {

    private final List<TrackPoint> trackPoints;
    private final ValidationReport validationReport;
    private final DatasetMetadata metadata;

    BestTrackResult(List<TrackPoint> trackPoints, ValidationReport validationReport, DatasetMetadata metadata) {
        this.trackPoints = Collections.unmodifiableList(new ArrayList<>(trackPoints));
        this.validationReport = validationReport;
        this.metadata = metadata;
    }

    /**
     * @return an unmodifiable list of the track points in the order in which they appear in the input.
     */
    public List<TrackPoint> trackPoints() {
        return trackPoints;
    }

    public ValidationReport validationReport() {
        return validationReport;
    }

    /**
     * Gets the unique IDs of the storms, in the order in which they first appear in the input.
     *
     * @return a new set of the storms' unique IDs
     */
    public Set<String> uniqueIds() {
        Set<String> uniqueIds = new LinkedHashSet<>();
        for (TrackPoint trackPoint : trackPoints) {
            uniqueIds.add(trackPoint.uniqueId());
        }
        return uniqueIds;
    }

    /**
     * Gets the metadata of the dataset that holds these track points.
     *
     * @return the metadata
     */
    public DatasetMetadata metadata() {
        return metadata;
    }

    /**
     * Converts the track points into a dataset with the columns of {@link TrackPointSchema}.
     *
     * @return a new dataset
     */
    public Dataset toDataset() {
        List<List<Object>> observations = new ArrayList<>(trackPoints.size());
        for (TrackPoint trackPoint : trackPoints) {
            observations.add(TrackPointSchema.toObservation(trackPoint));
        }
        return new Dataset(metadata, observations);
    }

    /**
     * Writes the track points to a track dataset file.
     *
     * @param targetLocation
     *     The file to write.  If it exists, it is replaced.
     *
     * @throws IOException
     *     if the file couldn't be written.
     * @throws NullPointerException
     *     if {@code targetLocation} is {@code null}.
     */
    public void write(Path targetLocation) throws IOException {
        ArgumentUtil.checkNotNull(targetLocation, "targetLocation");
        try (DatasetExporter exporter = new DatasetExporter(targetLocation, metadata, trackPoints.size())) {
            for (TrackPoint trackPoint : trackPoints) {
                exporter.writeObservation(TrackPointSchema.toObservation(trackPoint));
            }
        }
    }
}
