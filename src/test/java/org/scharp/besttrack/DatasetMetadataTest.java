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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Unit tests for {@link DatasetMetadata}. */
public class DatasetMetadataTest {

    private static final Column UNIQUE_ID = Column.builder().
        name("unique_id").
        type(ColumnType.CHARACTER).
        length(8).
        build();

    private static final Column LATITUDE = Column.builder().name("latitude").type(ColumnType.DOUBLE).build();

    @Test
    void buildWithDefaults() {
        LocalDateTime beforeBuilder = LocalDateTime.now();
        DatasetMetadata metadata = DatasetMetadata.builder().columns(List.of(UNIQUE_ID)).build();

        assertThat(metadata.creationTime(), greaterThanOrEqualTo(beforeBuilder));
        assertEquals("", metadata.datasetName());
        assertEquals("", metadata.datasetLabel());
        assertEquals(List.of(UNIQUE_ID), metadata.columns());
    }

    @Test
    void buildWithAllFields() {
        LocalDateTime creationTime = LocalDateTime.of(2024, 5, 1, 12, 30, 15);
        DatasetMetadata metadata = DatasetMetadata.builder().
            creationTime(creationTime).
            datasetName("BEST_TRACK").
            datasetLabel("Best-track storm observations").
            columns(List.of(UNIQUE_ID, LATITUDE)).
            build();

        assertEquals(creationTime, metadata.creationTime());
        assertEquals("BEST_TRACK", metadata.datasetName());
        assertEquals("Best-track storm observations", metadata.datasetLabel());
        assertEquals(List.of(UNIQUE_ID, LATITUDE), metadata.columns());
        assertEquals(0, metadata.columnIndex("unique_id"));
        assertEquals(1, metadata.columnIndex("latitude"));
        assertEquals(-1, metadata.columnIndex("longitude"));
    }

    @Test
    void columnsAreCopied() {
        List<Column> columns = new ArrayList<>(Arrays.asList(UNIQUE_ID, LATITUDE));
        DatasetMetadata.Builder builder = DatasetMetadata.builder().columns(columns);
        columns.clear();

        DatasetMetadata metadata = builder.build();
        assertEquals(List.of(UNIQUE_ID, LATITUDE), metadata.columns());
        assertThrows(UnsupportedOperationException.class, () -> metadata.columns().add(UNIQUE_ID));
    }

    @Test
    void badColumns() {
        DatasetMetadata.Builder builder = DatasetMetadata.builder();

        Exception exception = assertThrows(IllegalStateException.class, builder::build);
        assertEquals("columns must be set", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, () -> builder.columns(List.of()));
        assertEquals("columns must not be empty", exception.getMessage());

        exception = assertThrows(NullPointerException.class, () -> builder.columns(null));
        assertEquals("columns must not be null", exception.getMessage());

        exception = assertThrows(NullPointerException.class, () -> builder.columns(Arrays.asList(UNIQUE_ID, null)));
        assertEquals("columns cannot contain a null entry", exception.getMessage());

        Column duplicate = Column.builder().name("unique_id").type(ColumnType.INTEGER).build();
        exception = assertThrows(
            IllegalArgumentException.class,
            () -> builder.columns(List.of(UNIQUE_ID, LATITUDE, duplicate)));
        assertEquals("columns contains two columns named \"unique_id\"", exception.getMessage());
    }

    @Test
    void badNameAndLabel() {
        DatasetMetadata.Builder builder = DatasetMetadata.builder();

        Exception exception = assertThrows(IllegalArgumentException.class, () -> builder.datasetName("x".repeat(65)));
        assertEquals("datasetName must not be longer than 64 bytes when encoded with UTF-8", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, () -> builder.datasetLabel("x".repeat(257)));
        assertEquals("datasetLabel must not be longer than 256 bytes when encoded with UTF-8", exception.getMessage());

        exception = assertThrows(NullPointerException.class, () -> builder.datasetName(null));
        assertEquals("datasetName must not be null", exception.getMessage());

        exception = assertThrows(NullPointerException.class, () -> builder.creationTime(null));
        assertEquals("creationTime must not be null", exception.getMessage());
    }

    @Test
    void testEquals() {
        LocalDateTime creationTime = LocalDateTime.of(2024, 5, 1, 12, 30, 15);
        DatasetMetadata metadata = DatasetMetadata.builder().creationTime(creationTime).columns(List.of(LATITUDE))
            .build();
        DatasetMetadata same = DatasetMetadata.builder().creationTime(creationTime).columns(List.of(LATITUDE)).build();
        DatasetMetadata otherName = DatasetMetadata.builder().creationTime(creationTime).datasetName("X")
            .columns(List.of(LATITUDE)).build();

        assertEquals(metadata, same);
        assertEquals(metadata.hashCode(), same.hashCode());
        assertNotEquals(metadata, otherName);
    }
}
