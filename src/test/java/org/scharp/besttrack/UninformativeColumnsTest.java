///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.besttrack;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Unit tests for {@link UninformativeColumns}. */
public class UninformativeColumnsTest {

    private static final LocalDateTime CREATION_TIME = LocalDateTime.of(2024, 1, 2, 3, 4, 5);

    private static DatasetMetadata metadata() {
        return DatasetMetadata.builder().
            creationTime(CREATION_TIME).
            datasetName("STORMS").
            columns(List.of(
                Column.builder().name("unique_id").type(ColumnType.CHARACTER).length(8).build(),
                Column.builder().name("basin").type(ColumnType.CHARACTER).length(2).build(),
                Column.builder().name("max_wind").type(ColumnType.INTEGER).nullable(true).build(),
                Column.builder().name("min_pressure").type(ColumnType.INTEGER).nullable(true).build(),
                Column.builder().name("latitude").type(ColumnType.DOUBLE).build())).
            build();
    }

    private static Dataset dataset() {
        return new Dataset(metadata(), List.of(
            Arrays.asList("1851AL01", "AL", 80, null, 28.0),
            Arrays.asList("1851AL01", "AL", null, null, 28.1),
            Arrays.asList("1851AL02", "AL", 80, null, 28.0)));
    }

    @Test
    void find() {
        assertEquals(List.of("basin", "min_pressure"), UninformativeColumns.find(dataset()));
    }

    @Test
    void findInEmptyDataset() {
        assertEquals(List.of(), UninformativeColumns.find(new Dataset(metadata(), List.of())));
    }

    @Test
    void drop() {
        Dataset dataset = UninformativeColumns.drop(dataset(), List.of("latitude", "unique_id"));

        assertEquals(CREATION_TIME, dataset.metadata().creationTime());
        assertEquals("STORMS", dataset.metadata().datasetName());
        assertEquals(3, dataset.metadata().columns().size());
        assertEquals(0, dataset.metadata().columnIndex("basin"));
        assertEquals(
            List.of(Arrays.asList("AL", 80, null), Arrays.asList("AL", null, null), Arrays.asList("AL", 80, null)),
            dataset.observations());
    }

    @Test
    void dropNothing() {
        Dataset dataset = UninformativeColumns.drop(dataset(), List.of());
        assertEquals(dataset().metadata(), dataset.metadata());
        assertEquals(dataset().observations(), dataset.observations());
    }

    @Test
    void dropAll() {
        Dataset dataset = UninformativeColumns.dropAll(dataset());
        List<String> names = new ArrayList<>();
        for (Column column : dataset.metadata().columns()) {
            names.add(column.name());
        }
        assertEquals(List.of("unique_id", "max_wind", "latitude"), names);
        assertEquals(Arrays.asList(80, null, 80), dataset.columnValues("max_wind"));
    }

    @Test
    void dropAllFromSingleRow() {
        Dataset original = new Dataset(metadata(), List.of(Arrays.asList("1851AL01", "AL", 80, null, 28.0)));

        // Every column is uninformative, so nothing is dropped.
        assertSame(original, UninformativeColumns.dropAll(original));
    }

    @Test
    void badDrop() {
        Exception exception = assertThrows(
            IllegalArgumentException.class,
            () -> UninformativeColumns.drop(dataset(), List.of("basin", "longitude")));
        assertEquals("dataset has no column named \"longitude\"", exception.getMessage());

        exception = assertThrows(
            IllegalArgumentException.class,
            () -> UninformativeColumns.drop(
                dataset(),
                List.of("unique_id", "basin", "max_wind", "min_pressure", "latitude")));
        assertEquals("cannot drop every column of a dataset", exception.getMessage());

        exception = assertThrows(NullPointerException.class, () -> UninformativeColumns.drop(null, List.of()));
        assertEquals("dataset must not be null", exception.getMessage());
    }
}
