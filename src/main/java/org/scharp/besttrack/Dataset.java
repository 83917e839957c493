///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.besttrack;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An in-memory track dataset: its metadata and its observations (rows) in order.
 * <p>
 * Instances of this class are immutable.  Values follow the same conventions as
 * {@link DatasetExporter#writeObservation}: each value is an instance of its column type's
 * {@linkplain ColumnType#valueClass() value class}, or {@code null} when missing.
 * </p>
 */
public final class Dataset {

    private final DatasetMetadata metadata;
    private final List<List<Object>> observations;

    /**
     * Creates a dataset.
     *
     * @param metadata
     *     The dataset's metadata.
     * @param observations
     *     The dataset's rows, each a list of values in column order.  The rows are copied.
     *
     * @throws NullPointerException
     *     if {@code metadata}, {@code observations}, or one of the observations is {@code null}.
     * @throws IllegalArgumentException
     *     if an observation does not have one value per column.
     */
    public Dataset(DatasetMetadata metadata, List<List<Object>> observations) {
        ArgumentUtil.checkNotNull(metadata, "metadata");
        ArgumentUtil.checkNotNull(observations, "observations");

        final int totalColumns = metadata.columns().size();
        List<List<Object>> copy = new ArrayList<>(observations.size());
        for (List<Object> observation : observations) {
            if (observation == null) {
                throw new NullPointerException("observations must not contain a null observation");
            }
            if (observation.size() != totalColumns) {
                throw new IllegalArgumentException(
                    "observation has " + observation.size() + " values but the dataset has " + totalColumns + " columns");
            }
            // List.copyOf() rejects null values, which are legal for nullable columns.
            copy.add(Collections.unmodifiableList(new ArrayList<>(observation)));
        }

        this.metadata = metadata;
        this.observations = Collections.unmodifiableList(copy);
    }

    /**
     * Gets the dataset's metadata.
     *
     * @return The metadata.  This is never {@code null}.
     */
    public DatasetMetadata metadata() {
        return metadata;
    }

    /**
     * Gets the dataset's rows.
     *
     * @return An unmodifiable list of unmodifiable rows.
     */
    public List<List<Object>> observations() {
        return observations;
    }

    /**
     * Gets the number of rows.
     *
     * @return the number of rows
     */
    public int size() {
        return observations.size();
    }

    /**
     * Gets every value of one column, in row order.
     *
     * @param columnName
     *     The name of the column.
     *
     * @return An unmodifiable list of the column's values.  Missing values are {@code null}.
     *
     * @throws IllegalArgumentException
     *     if the dataset has no such column.
     */
    public List<Object> columnValues(String columnName) {
        int index = metadata.columnIndex(columnName);
        if (index < 0) {
            throw new IllegalArgumentException("dataset has no column named \"" + columnName + "\"");
        }

        List<Object> values = new ArrayList<>(observations.size());
        for (List<Object> observation : observations) {
            values.add(observation.get(index));
        }
        return Collections.unmodifiableList(values);
    }
}
