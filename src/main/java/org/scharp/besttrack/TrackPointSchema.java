///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.besttrack;

import java.util.ArrayList;
import java.util.List;

/**
 * The columns of a track point dataset and the conversion of a {@link TrackPoint} into a row.
 * <p>
 * The columns, in order, are:
 * </p>
 * <pre>
 *   unique_id          CHARACTER(8)   e.g. "1851AL01"
 *   basin              CHARACTER(2)
 *   cyclone_number     CHARACTER(2)
 *   storm_year         INTEGER
 *   name               CHARACTER(10)
 *   year, month, day, hour, minute   INTEGER
 *   timestamp          TIMESTAMP      nullable under {@link ErrorPolicy#WARN_AND_MARK_MISSING}
 *   record_identifier  CHARACTER(1)   nullable
 *   status             CHARACTER(2)   nullable under {@link ErrorPolicy#WARN_AND_MARK_MISSING}
 *   latitude           DOUBLE
 *   longitude          DOUBLE
 *   max_wind           INTEGER        nullable
 *   min_pressure       INTEGER        nullable
 *   ne34 ... nw64      INTEGER        nullable, one per {@link WindRadius}
 *   max_wind_radius    INTEGER        nullable
 * </pre>
 */
public final class TrackPointSchema {

    /** The name given to track point datasets. */
    public static final String DATASET_NAME = "BEST_TRACK";

    /** The name of the column that identifies the storm. */
    public static final String UNIQUE_ID = "unique_id";

    // private constructor to prevent anyone from instantiating the class.
    private TrackPointSchema() {
    }

    private static Column character(String name, int length, String label, boolean nullable) {
        return Column.builder().name(name).type(ColumnType.CHARACTER).length(length).label(label).nullable(nullable)
            .build();
    }

    private static Column column(String name, ColumnType type, String label, boolean nullable) {
        return Column.builder().name(name).type(type).label(label).nullable(nullable).build();
    }

    /**
     * Gets the columns of a track point dataset.
     *
     * @param errorPolicy
     *     The policy with which the track points were normalized.  It determines whether the status and timestamp
     *     columns accept {@code null}.
     *
     * @return a new list of the columns
     *
     * @throws NullPointerException
     *     if {@code errorPolicy} is {@code null}.
     */
    public static List<Column> columns(ErrorPolicy errorPolicy) {
        ArgumentUtil.checkNotNull(errorPolicy, "errorPolicy");
        boolean lenient = errorPolicy == ErrorPolicy.WARN_AND_MARK_MISSING;

        List<Column> columns = new ArrayList<>();
        columns.add(character(UNIQUE_ID, 8, "Storm year, basin, and cyclone number", false));
        columns.add(character("basin", 2, "Basin code", false));
        columns.add(character("cyclone_number", 2, "Cyclone number within the basin and year", false));
        columns.add(column("storm_year", ColumnType.INTEGER, "Year in the storm header", false));
        columns.add(character("name", 10, "Storm name", false));
        columns.add(column("year", ColumnType.INTEGER, "Year of observation", false));
        columns.add(column("month", ColumnType.INTEGER, "Month of observation", false));
        columns.add(column("day", ColumnType.INTEGER, "Day of observation", false));
        columns.add(column("hour", ColumnType.INTEGER, "Hour of observation (UTC)", false));
        columns.add(column("minute", ColumnType.INTEGER, "Minute of observation", false));
        columns.add(column("timestamp", ColumnType.TIMESTAMP, "Time of observation (UTC)", lenient));
        columns.add(character("record_identifier", 1, "Record identifier", true));
        columns.add(character("status", 2, "Status of system", lenient));
        columns.add(column("latitude", ColumnType.DOUBLE, "Latitude in decimal degrees", false));
        columns.add(column("longitude", ColumnType.DOUBLE, "Longitude in decimal degrees", false));
        columns.add(column("max_wind", ColumnType.INTEGER, "Maximum sustained wind (knots)", true));
        columns.add(column("min_pressure", ColumnType.INTEGER, "Minimum pressure (millibars)", true));
        for (WindRadius radius : WindRadius.values()) {
            columns.add(column(
                radius.columnName(),
                ColumnType.INTEGER,
                radius.knots() + " kt wind maximum extent in " + radius.quadrant() + " quadrant (nautical miles)",
                true));
        }
        columns.add(column("max_wind_radius", ColumnType.INTEGER, "Radius of maximum wind (nautical miles)", true));
        return columns;
    }

    /**
     * Gets the metadata of a track point dataset.
     *
     * @param options
     *     The options with which the track points were read.
     *
     * @return the metadata, with the current time as its creation time
     *
     * @throws NullPointerException
     *     if {@code options} is {@code null}.
     */
    public static DatasetMetadata metadata(BestTrackOptions options) {
        ArgumentUtil.checkNotNull(options, "options");
        return DatasetMetadata.builder().
            datasetName(DATASET_NAME).
            datasetLabel("Best-track storm observations").
            columns(columns(options.errorPolicy())).
            build();
    }

    /**
     * Converts a track point into a row of a dataset with the columns of {@link #columns}.
     *
     * @param trackPoint
     *     The track point.
     *
     * @return a new list of the values, in column order
     *
     * @throws NullPointerException
     *     if {@code trackPoint} is {@code null}.
     */
    public static List<Object> toObservation(TrackPoint trackPoint) {
        ArgumentUtil.checkNotNull(trackPoint, "trackPoint");

        List<Object> observation = new ArrayList<>();
        observation.add(trackPoint.uniqueId());
        observation.add(trackPoint.basin());
        observation.add(trackPoint.cycloneNumber());
        observation.add(trackPoint.stormYear());
        observation.add(trackPoint.name());
        observation.add(trackPoint.year());
        observation.add(trackPoint.month());
        observation.add(trackPoint.day());
        observation.add(trackPoint.hour());
        observation.add(trackPoint.minute());
        observation.add(trackPoint.timestamp());
        RecordIdentifier recordIdentifier = trackPoint.recordIdentifier();
        observation.add(recordIdentifier == null ? null : String.valueOf(recordIdentifier.code()));
        StormStatus status = trackPoint.status();
        observation.add(status == null ? null : status.name());
        observation.add(trackPoint.latitude());
        observation.add(trackPoint.longitude());
        observation.add(trackPoint.maxWind());
        observation.add(trackPoint.minPressure());
        observation.addAll(trackPoint.windRadii());
        observation.add(trackPoint.radiusOfMaximumWind());
        return observation;
    }
}
