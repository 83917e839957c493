///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.besttrack;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A representation of a track dataset's metadata (creation time, name, columns, etc.).
 * <p>
 * Instances of this class are immutable.  They are created with a {@link DatasetMetadata.Builder}:
 * </p>
 * <pre>
 * DatasetMetadata metadata = DatasetMetadata.builder().
 *     datasetName("HURDAT2").
 *     datasetLabel("Atlantic best-track observations").
 *     columns(
 *         List.of(
 *             Column.builder().name("unique_id").type(ColumnType.CHARACTER).length(8).build(),
 *             Column.builder().name("latitude").type(ColumnType.DOUBLE).build(),
 *             Column.builder().name("max_wind").type(ColumnType.INTEGER).nullable(true).build()
 *     )).build();
 * </pre>
 */
public final class DatasetMetadata {

    /** The maximum number of bytes in a dataset name when encoded in UTF-8. */
    public static final int MAX_NAME_LENGTH = 64;

    /** The maximum number of bytes in a dataset label when encoded in UTF-8. */
    public static final int MAX_LABEL_LENGTH = 256;

    private final LocalDateTime creationTime;
    private final String datasetName;
    private final String datasetLabel;
    private final List<Column> columns;

    /**
     * A builder class for {@link DatasetMetadata}.
     */
    public final static class Builder {
        private LocalDateTime creationTime;
        private String datasetName;
        private String datasetLabel;
        private List<Column> columns;

        private Builder() {
            this.creationTime = LocalDateTime.now();
            this.datasetName = "";
            this.datasetLabel = "";
            this.columns = List.of();
        }

        /**
         * Sets the dataset's creation time.
         *
         * @param creationTime
         *     The dataset's new creation time.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code creationTime} is {@code null}.
         */
        public Builder creationTime(LocalDateTime creationTime) {
            ArgumentUtil.checkNotNull(creationTime, "creationTime");
            this.creationTime = creationTime;
            return this;
        }

        /**
         * Sets the dataset's name.
         *
         * @param datasetName
         *     The dataset's name.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code datasetName} is {@code null}.
         * @throws IllegalArgumentException
         *     if {@code datasetName} is longer than 64 bytes when encoded in UTF-8.
         */
        public Builder datasetName(String datasetName) {
            ArgumentUtil.checkNotNull(datasetName, "datasetName");
            ArgumentUtil.checkMaximumUtf8Length(datasetName, MAX_NAME_LENGTH, "datasetName");

            this.datasetName = datasetName;
            return this;
        }

        /**
         * Sets the dataset's label.
         *
         * @param datasetLabel
         *     The dataset's label.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code datasetLabel} is {@code null}.
         * @throws IllegalArgumentException
         *     if {@code datasetLabel} is longer than 256 bytes when encoded in UTF-8.
         */
        public Builder datasetLabel(String datasetLabel) {
            ArgumentUtil.checkNotNull(datasetLabel, "datasetLabel");
            ArgumentUtil.checkMaximumUtf8Length(datasetLabel, MAX_LABEL_LENGTH, "datasetLabel");

            this.datasetLabel = datasetLabel;
            return this;
        }

        /**
         * Sets the dataset's columns.
         *
         * @param columns
         *     A list of columns given in the order in which they should appear in the dataset. This list is copied, so
         *     subsequent changes to the list do not impact this builder or the resulting {@code DatasetMetadata}.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code columns} is {@code null} or contains a {@code null} entry.
         * @throws IllegalArgumentException
         *     if {@code columns} is empty, has more than 32767 entries, or contains two columns with the same name.
         */
        public Builder columns(List<Column> columns) {
            ArgumentUtil.checkNotNull(columns, "columns");
            if (columns.isEmpty()) {
                throw new IllegalArgumentException("columns must not be empty");
            }
            if (Short.MAX_VALUE < columns.size()) {
                throw new IllegalArgumentException("A dataset cannot have more than " + Short.MAX_VALUE + " columns");
            }

            // Copy the columns while checking for null entries and duplicate names.
            List<Column> newList = new ArrayList<>(columns.size());
            Set<String> columnNames = new HashSet<>(columns.size() * 2);
            for (Column column : columns) {
                if (column == null) {
                    throw new NullPointerException("columns cannot contain a null entry");
                }
                if (!columnNames.add(column.name())) {
                    throw new IllegalArgumentException("columns contains two columns named \"" + column.name() + "\"");
                }
                newList.add(column);
            }

            this.columns = newList;
            return this;
        }

        /**
         * Builds the immutable {@code DatasetMetadata} with the configured options.
         *
         * @return A {@code DatasetMetadata}
         *
         * @throws IllegalStateException
         *     if the columns haven't been set.
         */
        public DatasetMetadata build() {
            if (columns.isEmpty()) {
                throw new IllegalStateException("columns must be set");
            }
            return new DatasetMetadata(creationTime, datasetName, datasetLabel, columns);
        }
    }

    /**
     * Creates a new DatasetMetadata builder initialized with the current time as the creation time, no name, no label,
     * and no columns.
     * <p>
     * The columns must be set before invoking {@link Builder#build build()}.
     * </p>
     *
     * @return A new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    private DatasetMetadata(LocalDateTime creationTime, String datasetName, String datasetLabel, List<Column> columns) {
        this.creationTime = creationTime;
        this.datasetName = datasetName;
        this.datasetLabel = datasetLabel;
        this.columns = columns; // Builder ensures that the library client does not have a reference.
    }

    /**
     * Gets the time and date at which the dataset was created.
     *
     * @return A local date time.
     */
    public LocalDateTime creationTime() {
        return creationTime;
    }

    /**
     * Gets the name of the dataset.
     *
     * @return The dataset name. This is never {@code null}.
     */
    public String datasetName() {
        return datasetName;
    }

    /**
     * Gets the dataset's label.
     *
     * @return The dataset label.  This is never {@code null}.
     */
    public String datasetLabel() {
        return datasetLabel;
    }

    /**
     * Gets the dataset's columns.
     * <p>
     * The returned list is not modifiable.
     * </p>
     *
     * @return The dataset's columns, in order.  This is never {@code null}.
     */
    public List<Column> columns() {
        return Collections.unmodifiableList(columns);
    }

    /**
     * Finds the position of a column by its name.
     *
     * @param columnName
     *     The name of the column.
     *
     * @return The 0-based position of the column, or -1 if the dataset has no such column.
     */
    public int columnIndex(String columnName) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).name().equals(columnName)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Creates a builder with this metadata's creation time, name, and label, and with no columns.
     *
     * @return A new builder.
     */
    Builder toBuilderWithoutColumns() {
        return builder().creationTime(creationTime).datasetName(datasetName).datasetLabel(datasetLabel);
    }

    @Override
    public int hashCode() {
        return Objects.hash(creationTime, datasetName, datasetLabel, columns);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof DatasetMetadata otherMetadata)) {
            return false;
        }

        return creationTime.equals(otherMetadata.creationTime) &&
            datasetName.equals(otherMetadata.datasetName) &&
            datasetLabel.equals(otherMetadata.datasetLabel) &&
            columns.equals(otherMetadata.columns);
    }
}
