///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.besttrack;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads a track dataset file that was written by {@link DatasetExporter}.
 * <p>
 * Values come back as exactly the types that were written: {@link Integer} for INTEGER columns, {@link Double} for
 * DOUBLE columns, {@link java.time.LocalDateTime} for TIMESTAMP columns, {@link String} for CHARACTER columns, and
 * {@code null} for missing values.
 * </p>
 */
public final class DatasetReader {

    // private constructor to prevent anyone from instantiating the class.
    private DatasetReader() {
    }

    /**
     * Reads a track dataset file.
     *
     * @param sourceLocation
     *     The file to read.
     *
     * @return The dataset.
     *
     * @throws IOException
     *     if the file could not be read or is not a well-formed track dataset file.
     */
    public static Dataset readDataset(Path sourceLocation) throws IOException {
        ArgumentUtil.checkNotNull(sourceLocation, "sourceLocation");
        return readDataset(Files.readAllBytes(sourceLocation));
    }

    /**
     * Reads a track dataset from a stream.  The stream is read to its end but is not closed.
     *
     * @param inputStream
     *     The stream to read.
     *
     * @return The dataset.
     *
     * @throws IOException
     *     if the stream could not be read or does not hold a well-formed track dataset.
     */
    public static Dataset readDataset(InputStream inputStream) throws IOException {
        ArgumentUtil.checkNotNull(inputStream, "inputStream");
        return readDataset(inputStream.readAllBytes());
    }

    private static Dataset readDataset(byte[] data) throws IOException {
        final DatasetHeader header;
        try {
            header = DatasetHeader.fromBytes(data);
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new IOException("malformed track dataset: " + e.getMessage(), e);
        }

        final List<Column> columns = header.metadata.columns();
        final int totalRows = header.totalRows;

        // Find where each column's null bitmap and values start.
        final int[] bitmapOffsets = new int[columns.size()];
        final int[] valuesOffsets = new int[columns.size()];
        long offset = header.headerLength();
        for (int i = 0; i < columns.size(); i++) {
            Column column = columns.get(i);
            if (column.nullable()) {
                bitmapOffsets[i] = (int) offset;
                offset += ColumnLayout.bitmapLength(totalRows);
            } else {
                bitmapOffsets[i] = -1;
            }
            valuesOffsets[i] = (int) offset;
            try {
                offset += ColumnLayout.valuesLength(column, totalRows);
            } catch (IllegalArgumentException e) {
                throw new IOException("malformed track dataset: " + e.getMessage(), e);
            }

            if (data.length < offset) {
                throw new IOException("malformed track dataset: column \"" + column.name() + "\" is truncated");
            }
        }

        List<List<Object>> observations = new ArrayList<>(totalRows);
        for (int row = 0; row < totalRows; row++) {
            Object[] values = new Object[columns.size()];
            for (int i = 0; i < columns.size(); i++) {
                if (bitmapOffsets[i] != -1 && ColumnLayout.isNull(data, bitmapOffsets[i], row)) {
                    values[i] = null;
                } else {
                    values[i] = ColumnLayout.readValue(columns.get(i), data, valuesOffsets[i], row);
                }
            }
            observations.add(Arrays.asList(values));
        }

        return new Dataset(header.metadata, observations);
    }
}
