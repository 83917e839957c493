///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.besttrack;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes a track dataset file.
 * <p>
 * A track dataset is column-major, so the rows are buffered in memory and the file is written when the exporter is
 * closed.  The number of rows must be promised up front so that the column buffers can be sized once.
 * </p>
 *
 * <pre>
 * try (DatasetExporter exporter = new DatasetExporter(path, metadata, rows.size())) {
 *     for (List&lt;Object&gt; row : rows) {
 *         exporter.writeObservation(row);
 *     }
 * }
 * </pre>
 */
public final class DatasetExporter implements AutoCloseable {

    private final OutputStream outputStream;
    private final DatasetHeader header;
    private final int totalObservationsInDataset;

    private ColumnLayout columnLayout;
    private int totalObservationsWritten;

    /**
     * Creates a {@code DatasetExporter} for writing a track dataset to a file.
     *
     * @param targetLocation
     *     The path to the file to which the dataset should be written. If the file doesn't exist, then it will be
     *     created.  If the file does exist, then its contents will be replaced.
     * @param metadata
     *     The metadata for the dataset.
     * @param totalObservationsInDataset
     *     The total number of observations (rows) that will be written to the dataset.  You must invoke
     *     {@link DatasetExporter#writeObservation writeObservation} exactly this number of times before invoking
     *     {@link DatasetExporter#close}.
     *
     * @throws IOException
     *     If an I/O problem prevented the file from being created.
     * @throws NullPointerException
     *     If {@code targetLocation} or {@code metadata} is {@code null}.
     * @throws IllegalArgumentException
     *     If {@code totalObservationsInDataset} is negative or too large.
     */
    public DatasetExporter(Path targetLocation, DatasetMetadata metadata, int totalObservationsInDataset)
        throws IOException {
        ArgumentUtil.checkNotNull(targetLocation, "targetLocation");
        ArgumentUtil.checkNotNull(metadata, "metadata");
        ArgumentUtil.checkNotNegative(totalObservationsInDataset, "totalObservationsInDataset");

        // Nothing may throw after the file is opened.
        this.header = new DatasetHeader(metadata, totalObservationsInDataset);
        this.totalObservationsInDataset = totalObservationsInDataset;
        this.columnLayout = new ColumnLayout(metadata.columns(), totalObservationsInDataset);
        this.totalObservationsWritten = 0;
        this.outputStream = new BufferedOutputStream(Files.newOutputStream(targetLocation));
    }

    /**
     * Creates a {@code DatasetExporter} for writing a track dataset to an output stream.  The stream is closed when
     * the exporter is closed.
     *
     * @param outputStream
     *     The stream to which the dataset should be written.
     * @param metadata
     *     The metadata for the dataset.
     * @param totalObservationsInDataset
     *     The total number of observations (rows) that will be written to the dataset.
     *
     * @throws NullPointerException
     *     If {@code outputStream} or {@code metadata} is {@code null}.
     * @throws IllegalArgumentException
     *     If {@code totalObservationsInDataset} is negative or too large.
     */
    public DatasetExporter(OutputStream outputStream, DatasetMetadata metadata, int totalObservationsInDataset) {
        ArgumentUtil.checkNotNull(outputStream, "outputStream");
        ArgumentUtil.checkNotNull(metadata, "metadata");
        ArgumentUtil.checkNotNegative(totalObservationsInDataset, "totalObservationsInDataset");

        this.header = new DatasetHeader(metadata, totalObservationsInDataset);
        this.totalObservationsInDataset = totalObservationsInDataset;
        this.columnLayout = new ColumnLayout(metadata.columns(), totalObservationsInDataset);
        this.totalObservationsWritten = 0;
        this.outputStream = outputStream;
    }

    /**
     * Appends an observation (row) to the dataset that is being exported.
     *
     * @param observation
     *     The observation to write, given as a list of objects in the same order as the columns of the metadata
     *     given to this exporter's constructor.  Each value must be exactly of its column type's
     *     {@linkplain ColumnType#valueClass() value class}, or {@code null} for a nullable column.  The observation is
     *     copied immediately, so subsequent modifications to it don't change the exported dataset.
     *
     * @throws NullPointerException
     *     If {@code observation} is {@code null}, or if a {@code null} value is given for a column that isn't
     *     nullable.
     * @throws IllegalStateException
     *     If writing this observation would exceed the {@code totalObservationsInDataset} argument given in the
     *     constructor or if this exporter has already been closed.
     * @throws IllegalArgumentException
     *     if {@code observation} doesn't contain values that conform to the metadata.
     */
    public void writeObservation(List<Object> observation) {
        ArgumentUtil.checkNotNull(observation, "observation");
        if (isClosed()) {
            throw new IllegalStateException("Cannot invoke writeObservation on closed exporter");
        }
        if (totalObservationsInDataset <= totalObservationsWritten) {
            throw new IllegalStateException("wrote more observations than promised in the constructor");
        }

        columnLayout.writeRow(totalObservationsWritten, observation);
        totalObservationsWritten++;
    }

    private boolean isClosed() {
        return columnLayout == null;
    }

    /**
     * Writes the dataset to the output and closes it.
     * <p>
     * This is safe to invoke multiple times.
     * </p>
     *
     * @throws IOException
     *     if there was a problem writing the dataset.
     * @throws IllegalStateException
     *     if this method is invoked before all observations that were promised in the constructor have been written.
     *     Nothing is written in this case.
     */
    @Override
    public void close() throws IOException {
        if (isClosed()) {
            return;
        }

        ColumnLayout layout = columnLayout;
        columnLayout = null;
        try (OutputStream stream = outputStream) {
            // If the caller invokes close() from a try-with-resources block that is exiting because of an exception
            // while writing observations, the JVM suppresses this exception in favor of the original one.
            if (totalObservationsInDataset != totalObservationsWritten) {
                throw new IllegalStateException(
                    "The constructor was told to expect " + totalObservationsInDataset +
                        " observation(s) but only " + totalObservationsWritten + " were written.");
            }

            stream.write(header.toBytes());
            layout.write(stream);
        }
    }

    /**
     * Writes a track dataset with the given metadata and observations to the file system.
     *
     * @param targetLocation
     *     The path to the file to which the dataset should be written. If the file doesn't exist, then it will be
     *     created.  If the file does exist, then its contents will be replaced.
     * @param metadata
     *     The dataset's metadata.
     * @param observations
     *     A list of observations, each a list of values in column order.
     *
     * @throws IOException
     *     If a file I/O error prevents the dataset from being written.
     * @throws NullPointerException
     *     If {@code targetLocation}, {@code metadata}, {@code observations}, or one of the observations is
     *     {@code null}.
     */
    public static void exportDataset(Path targetLocation, DatasetMetadata metadata, List<List<Object>> observations)
        throws IOException {
        ArgumentUtil.checkNotNull(observations, "observations");
        ArgumentUtil.checkNotNull(targetLocation, "targetLocation");
        ArgumentUtil.checkNotNull(metadata, "metadata");

        try (DatasetExporter exporter = new DatasetExporter(targetLocation, metadata, observations.size())) {
            for (List<Object> observation : observations) {
                if (observation == null) {
                    throw new NullPointerException("observations must not contain a null observation");
                }
                exporter.writeObservation(observation);
            }
        }
    }

    /**
     * Writes an in-memory dataset to the file system.
     *
     * @param targetLocation
     *     The path to the file to which the dataset should be written.
     * @param dataset
     *     The dataset to write.
     *
     * @throws IOException
     *     If a file I/O error prevents the dataset from being written.
     */
    public static void exportDataset(Path targetLocation, Dataset dataset) throws IOException {
        ArgumentUtil.checkNotNull(dataset, "dataset");
        exportDataset(targetLocation, dataset.metadata(), dataset.observations());
    }
}
