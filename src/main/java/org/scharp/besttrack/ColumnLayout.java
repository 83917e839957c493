///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.besttrack;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * The column-major storage of a track dataset's values.
 * <p>
 * Each column is stored as one section: a null bitmap (only for nullable columns) followed by the fixed-width values of
 * every row.  Both parts are padded to a multiple of 8 bytes.
 * </p>
 */
class ColumnLayout {

    static final int SECTION_ALIGNMENT = 8;

    private final List<Column> columns;
    private final int totalRows;
    private final byte[][] nullBitmaps;
    private final byte[][] values;

    ColumnLayout(List<Column> columnList, int totalRows) {
        columns = new ArrayList<>(columnList); // copy to a class that has O(1) random access
        this.totalRows = totalRows;
        nullBitmaps = new byte[columns.size()][];
        values = new byte[columns.size()][];

        for (int i = 0; i < columns.size(); i++) {
            Column column = columns.get(i);
            nullBitmaps[i] = column.nullable() ? new byte[bitmapLength(totalRows)] : null;
            values[i] = new byte[valuesLength(column, totalRows)];
        }
    }

    static int bitmapLength(int totalRows) {
        return ByteUtil.align(MathUtil.divideAndRoundUp(totalRows, 8), SECTION_ALIGNMENT);
    }

    static int valuesLength(Column column, int totalRows) {
        return ByteUtil.align(MathUtil.multiplySize(column.length(), totalRows, "column \"" + column.name() + "\""),
            SECTION_ALIGNMENT);
    }

    static boolean isNull(byte[] data, int bitmapOffset, int rowIndex) {
        return (data[bitmapOffset + rowIndex / 8] & (1 << (rowIndex % 8))) != 0;
    }

    /**
     * Copies one row into the column buffers.
     *
     * @param rowIndex
     *     The 0-based position of the row.
     * @param row
     *     The row's values, one for each column, in column order.
     *
     * @throws NullPointerException
     *     if a {@code null} is given for a column that isn't nullable.
     * @throws IllegalArgumentException
     *     if the row has the wrong number of values or a value doesn't conform to its column.
     */
    void writeRow(int rowIndex, List<Object> row) {
        assert 0 <= rowIndex && rowIndex < totalRows : "row " + rowIndex + " is out of range";

        if (row.size() != columns.size()) {
            throw new IllegalArgumentException(
                "observation has " + row.size() + " values but the dataset has " + columns.size() + " columns");
        }

        // Check every value before changing anything so that a bad row leaves no trace.
        for (int i = 0; i < columns.size(); i++) {
            checkValue(columns.get(i), row.get(i));
        }

        for (int i = 0; i < columns.size(); i++) {
            final Column column = columns.get(i);
            final Object value = row.get(i);
            final int offset = rowIndex * column.length();

            if (value == null) {
                nullBitmaps[i][rowIndex / 8] |= (byte) (1 << (rowIndex % 8));
                continue;
            }

            switch (column.type()) {
            case INTEGER:
                ByteUtil.write4(values[i], offset, (Integer) value);
                break;
            case DOUBLE:
                ByteUtil.write8(values[i], offset, Double.doubleToRawLongBits((Double) value));
                break;
            case TIMESTAMP:
                ByteUtil.write8(values[i], offset, ((LocalDateTime) value).toEpochSecond(ZoneOffset.UTC));
                break;
            case CHARACTER:
                ByteUtil.writeUtf8(values[i], offset, (String) value, column.length());
                break;
            default:
                throw new AssertionError("unhandled column type " + column.type());
            }
        }
    }

    private static void checkValue(Column column, Object value) {
        if (value == null) {
            if (!column.nullable()) {
                throw new NullPointerException("null given for non-nullable column \"" + column.name() + "\"");
            }
            return;
        }

        // Only the exact class is accepted so that reading the dataset back gives the same type.
        Class<?> expectedClass = column.type().valueClass();
        if (value.getClass() != expectedClass) {
            throw new IllegalArgumentException("value for column \"" + column.name() + "\" must be a " +
                expectedClass.getSimpleName() + " but was a " + value.getClass().getSimpleName());
        }

        if (column.type() == ColumnType.CHARACTER) {
            String text = (String) value;
            ArgumentUtil.checkNoNulCharacter(text, "value for column \"" + column.name() + "\"");
            if (column.length() < text.getBytes(StandardCharsets.UTF_8).length) {
                throw new IllegalArgumentException("value \"" + text + "\" is too long for column \"" +
                    column.name() + "\" (" + column.length() + " bytes)");
            }
        } else if (column.type() == ColumnType.TIMESTAMP) {
            if (((LocalDateTime) value).getNano() != 0) {
                throw new IllegalArgumentException(
                    "value for column \"" + column.name() + "\" must not have fractional seconds");
            }
        }
    }

    /**
     * Writes every column section, in column order.
     *
     * @param outputStream
     *     where to write the sections
     *
     * @throws IOException
     *     if the sections could not be written
     */
    void write(OutputStream outputStream) throws IOException {
        for (int i = 0; i < columns.size(); i++) {
            if (nullBitmaps[i] != null) {
                outputStream.write(nullBitmaps[i]);
            }
            outputStream.write(values[i]);
        }
    }

    /**
     * Decodes one value from a column section that was written by {@link #write}.
     *
     * @param column
     *     The column the value belongs to.
     * @param valuesSection
     *     The array holding the column's values.
     * @param valuesOffset
     *     The offset of the column's first value.
     * @param rowIndex
     *     The 0-based row of the value.
     *
     * @return The decoded value.
     */
    static Object readValue(Column column, byte[] valuesSection, int valuesOffset, int rowIndex) {
        final int offset = valuesOffset + rowIndex * column.length();
        switch (column.type()) {
        case INTEGER:
            return ByteUtil.read4(valuesSection, offset);
        case DOUBLE:
            return Double.longBitsToDouble(ByteUtil.read8(valuesSection, offset));
        case TIMESTAMP:
            return LocalDateTime.ofEpochSecond(ByteUtil.read8(valuesSection, offset), 0, ZoneOffset.UTC);
        case CHARACTER:
            return ByteUtil.readUtf8(valuesSection, offset, column.length());
        default:
            throw new AssertionError("unhandled column type " + column.type());
        }
    }
}
