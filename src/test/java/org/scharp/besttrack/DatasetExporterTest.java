///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.besttrack;

import org.hamcrest.Matchers;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Unit tests for {@link DatasetExporter} and {@link DatasetReader}. */
public class DatasetExporterTest {

    private static final LocalDateTime CREATION_TIME = LocalDateTime.of(2024, 6, 1, 8, 15, 30, 123_000_000);

    private static DatasetMetadata metadata() {
        return DatasetMetadata.builder().
            creationTime(CREATION_TIME).
            datasetName("STORMS").
            datasetLabel("A sample dataset: Ελληνικά").
            columns(List.of(
                Column.builder().name("unique_id").type(ColumnType.CHARACTER).length(8).label("Storm").build(),
                Column.builder().name("year").type(ColumnType.INTEGER).build(),
                Column.builder().name("timestamp").type(ColumnType.TIMESTAMP).nullable(true).build(),
                Column.builder().name("latitude").type(ColumnType.DOUBLE).build(),
                Column.builder().name("max_wind").type(ColumnType.INTEGER).nullable(true).build(),
                Column.builder().name("name").type(ColumnType.CHARACTER).length(10).nullable(true).build())).
            build();
    }

    private static List<List<Object>> observations() {
        return List.of(
            Arrays.asList("1851AL01", 1851, LocalDateTime.of(1851, 6, 25, 0, 0), 28.0, 80, "UNNAMED"),
            Arrays.asList("2005AL30", 2005, LocalDateTime.of(2005, 12, 30, 18, 0), -23.9, null, "ZETA"),
            Arrays.asList("2005AL30", 2006, null, 0.1 + 0.2, Integer.MIN_VALUE, null),
            Arrays.asList("2023AL12", 2023, LocalDateTime.of(2023, 8, 30, 11, 45), Double.MIN_VALUE,
                Integer.MAX_VALUE, "ÉTÉ"),
            Arrays.asList("", -1, LocalDateTime.of(1969, 12, 31, 23, 59, 59), Double.NaN, 0, ""));
    }

    private static byte[] export(DatasetMetadata metadata, List<List<Object>> observations) throws IOException {
        ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
        try (DatasetExporter exporter = new DatasetExporter(outputStream, metadata, observations.size())) {
            for (List<Object> observation : observations) {
                exporter.writeObservation(observation);
            }
        }
        return outputStream.toByteArray();
    }

    @Test
    void roundTrip() throws IOException {
        byte[] data = export(metadata(), observations());

        // Every section is 8-byte aligned.
        assertEquals(0, data.length % 8);

        Dataset dataset = DatasetReader.readDataset(new ByteArrayInputStream(data));
        assertEquals(metadata(), dataset.metadata());
        assertEquals(observations(), dataset.observations());

        // The values have exactly the types that were written.
        List<Object> firstRow = dataset.observations().get(0);
        assertSame(String.class, firstRow.get(0).getClass());
        assertSame(Integer.class, firstRow.get(1).getClass());
        assertSame(LocalDateTime.class, firstRow.get(2).getClass());
        assertSame(Double.class, firstRow.get(3).getClass());

        // Doubles are not rounded.
        assertEquals(0.1 + 0.2, (Double) dataset.observations().get(2).get(3));
    }

    @Test
    void roundTripThroughFile() throws IOException {
        Path targetDirectory = Files.createTempDirectory("besttrack-roundTripThroughFile");
        Path targetFile = targetDirectory.resolve("dataset.btrk");
        try {
            DatasetExporter.exportDataset(targetFile, metadata(), observations());
            Dataset dataset = DatasetReader.readDataset(targetFile);
            assertEquals(metadata(), dataset.metadata());
            assertEquals(observations(), dataset.observations());
            assertEquals(Arrays.asList("UNNAMED", "ZETA", null, "ÉTÉ", ""), dataset.columnValues("name"));
        } finally {
            Files.deleteIfExists(targetFile);
            Files.deleteIfExists(targetDirectory);
        }
    }

    @Test
    void exportToExistingFile() throws IOException {
        Path targetDirectory = Files.createTempDirectory("besttrack-exportToExistingFile");
        Path targetFile = targetDirectory.resolve("dataset.btrk");
        try {
            Files.write(targetFile, new byte[100_000]);
            long originalFileSize = Files.size(targetFile);

            DatasetExporter.exportDataset(targetFile, new Dataset(metadata(), observations()));

            // The old contents were truncated.
            assertThat(Files.size(targetFile), Matchers.lessThan(originalFileSize));
            assertEquals(observations(), DatasetReader.readDataset(targetFile).observations());
        } finally {
            Files.deleteIfExists(targetFile);
            Files.deleteIfExists(targetDirectory);
        }
    }

    @Test
    void emptyDataset() throws IOException {
        byte[] data = export(metadata(), List.of());
        Dataset dataset = DatasetReader.readDataset(new ByteArrayInputStream(data));
        assertEquals(metadata(), dataset.metadata());
        assertEquals(0, dataset.size());
    }

    @Test
    void tooFewObservations() throws IOException {
        ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
        DatasetExporter exporter = new DatasetExporter(outputStream, metadata(), 2);
        exporter.writeObservation(observations().get(0));

        Exception exception = assertThrows(IllegalStateException.class, exporter::close);
        assertEquals("The constructor was told to expect 2 observation(s) but only 1 were written.",
            exception.getMessage());

        // Nothing was written and closing again does nothing.
        assertEquals(0, outputStream.size());
        exporter.close();
    }

    @Test
    void tooManyObservations() throws IOException {
        ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
        try (DatasetExporter exporter = new DatasetExporter(outputStream, metadata(), 1)) {
            exporter.writeObservation(observations().get(0));

            Exception exception = assertThrows(
                IllegalStateException.class,
                () -> exporter.writeObservation(observations().get(1)));
            assertEquals("wrote more observations than promised in the constructor", exception.getMessage());
        }

        // The observation that was promised was written.
        Dataset dataset = DatasetReader.readDataset(new ByteArrayInputStream(outputStream.toByteArray()));
        assertEquals(List.of(observations().get(0)), dataset.observations());
    }

    @Test
    void writeAfterClose() throws IOException {
        DatasetExporter exporter = new DatasetExporter(new ByteArrayOutputStream(), metadata(), 0);
        exporter.close();

        Exception exception = assertThrows(
            IllegalStateException.class,
            () -> exporter.writeObservation(observations().get(0)));
        assertEquals("Cannot invoke writeObservation on closed exporter", exception.getMessage());
    }

    @Test
    void badObservations() throws IOException {
        try (DatasetExporter exporter = new DatasetExporter(new ByteArrayOutputStream(), metadata(), 1)) {
            // Wrong number of values.
            Exception exception = assertThrows(
                IllegalArgumentException.class,
                () -> exporter.writeObservation(List.of("1851AL01", 1851)));
            assertEquals("observation has 2 values but the dataset has 6 columns", exception.getMessage());

            // Null in a column that isn't nullable.
            exception = assertThrows(
                NullPointerException.class,
                () -> exporter.writeObservation(Arrays.asList("1851AL01", null, null, 28.0, null, null)));
            assertEquals("null given for non-nullable column \"year\"", exception.getMessage());

            // A Long is not an Integer.
            exception = assertThrows(
                IllegalArgumentException.class,
                () -> exporter.writeObservation(Arrays.asList("1851AL01", 1851L, null, 28.0, null, null)));
            assertEquals("value for column \"year\" must be a Integer but was a Long", exception.getMessage());

            // A value that's too long.
            exception = assertThrows(
                IllegalArgumentException.class,
                () -> exporter.writeObservation(Arrays.asList("1851AL011", 1851, null, 28.0, null, null)));
            assertEquals("value \"1851AL011\" is too long for column \"unique_id\" (8 bytes)", exception.getMessage());

            // A value with a NUL character.
            exception = assertThrows(
                IllegalArgumentException.class,
                () -> exporter.writeObservation(Arrays.asList("1851\0AL", 1851, null, 28.0, null, null)));
            assertEquals("value for column \"unique_id\" must not contain a NUL character", exception.getMessage());

            // Timestamps have whole-second precision.
            exception = assertThrows(
                IllegalArgumentException.class,
                () -> exporter.writeObservation(
                    Arrays.asList("1851AL01", 1851, LocalDateTime.of(1851, 6, 25, 0, 0, 0, 1), 28.0, null, null)));
            assertEquals("value for column \"timestamp\" must not have fractional seconds", exception.getMessage());

            exception = assertThrows(NullPointerException.class, () -> exporter.writeObservation(null));
            assertEquals("observation must not be null", exception.getMessage());

            // None of the bad observations were counted.
            exporter.writeObservation(observations().get(0));
        }
    }

    @Test
    void badConstructorArguments() {
        Exception exception = assertThrows(
            IllegalArgumentException.class,
            () -> new DatasetExporter(new ByteArrayOutputStream(), metadata(), -1));
        assertEquals("totalObservationsInDataset must not be negative", exception.getMessage());

        exception = assertThrows(
            NullPointerException.class,
            () -> new DatasetExporter(new ByteArrayOutputStream(), null, 1));
        assertEquals("metadata must not be null", exception.getMessage());

        exception = assertThrows(
            NullPointerException.class,
            () -> new DatasetExporter((Path) null, metadata(), 1));
        assertEquals("targetLocation must not be null", exception.getMessage());
    }

    @Test
    void badArgumentsLeaveExistingFileAlone() throws IOException {
        Path targetDirectory = Files.createTempDirectory("besttrack-badArgumentsLeaveExistingFileAlone");
        Path targetFile = targetDirectory.resolve("dataset.btrk");
        try {
            Files.write(targetFile, "precious".getBytes(StandardCharsets.UTF_8));

            Exception exception = assertThrows(
                NullPointerException.class,
                () -> new DatasetExporter(targetFile, null, 1));
            assertEquals("metadata must not be null", exception.getMessage());

            exception = assertThrows(
                IllegalArgumentException.class,
                () -> new DatasetExporter(targetFile, metadata(), -1));
            assertEquals("totalObservationsInDataset must not be negative", exception.getMessage());

            // The column buffers would be too large to allocate.
            DatasetMetadata wideMetadata = DatasetMetadata.builder().
                columns(List.of(Column.builder().name("text").type(ColumnType.CHARACTER).length(32767).build())).
                build();
            exception = assertThrows(
                IllegalArgumentException.class,
                () -> new DatasetExporter(targetFile, wideMetadata, Integer.MAX_VALUE));
            assertEquals("column \"text\" is too large", exception.getMessage());

            assertArrayEquals("precious".getBytes(StandardCharsets.UTF_8), Files.readAllBytes(targetFile));
        } finally {
            Files.deleteIfExists(targetFile);
            Files.deleteIfExists(targetDirectory);
        }
    }

    @Test
    void readMalformedData() {
        Exception exception = assertThrows(
            IOException.class,
            () -> DatasetReader.readDataset(new ByteArrayInputStream("not a dataset".getBytes())));
        assertEquals("malformed track dataset: not a track dataset file", exception.getMessage());
    }

    @Test
    void readTruncatedData() throws IOException {
        byte[] data = export(metadata(), observations());
        byte[] truncated = Arrays.copyOf(data, data.length - 8);

        Exception exception = assertThrows(
            IOException.class,
            () -> DatasetReader.readDataset(new ByteArrayInputStream(truncated)));
        assertEquals("malformed track dataset: column \"name\" is truncated", exception.getMessage());
    }

    @Test
    void readUnsupportedVersion() throws IOException {
        byte[] data = export(metadata(), observations());
        data[8] = 2;

        Exception exception = assertThrows(
            IOException.class,
            () -> DatasetReader.readDataset(new ByteArrayInputStream(data)));
        assertEquals("malformed track dataset: unsupported track dataset format version 2", exception.getMessage());
    }
}
