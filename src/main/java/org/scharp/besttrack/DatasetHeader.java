///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.besttrack;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * The header of a track dataset file: the magic number, the row count, and the dataset's metadata.
 * <p>
 * Layout (all numbers little-endian):
 * </p>
 * <pre>
 *   0  8  magic "BTRKDSET"
 *   8  4  format version
 *  12  4  total rows
 *  16  4  total columns
 *  20  4  header length, including padding
 *  24  8  creation time, seconds since the epoch at UTC
 *  32  4  creation time, nanoseconds
 *  36     dataset name, dataset label, then one descriptor per column:
 *         name, label, type code (1), nullable flag (1), length (2)
 * </pre>
 * <p>
 * Strings are written as a two-byte length followed by that many bytes of UTF-8.  The header is padded to a multiple
 * of 8 bytes so that the first column section is aligned.
 * </p>
 */
final class DatasetHeader {

    static final byte[] MAGIC_NUMBER = "BTRKDSET".getBytes(StandardCharsets.US_ASCII);
    static final int FORMAT_VERSION = 1;

    private static final int FIXED_PART_LENGTH = 36;

    final DatasetMetadata metadata;
    final int totalRows;

    DatasetHeader(DatasetMetadata metadata, int totalRows) {
        this.metadata = metadata;
        this.totalRows = totalRows;
    }

    private static int stringLength(String string) {
        return 2 + string.getBytes(StandardCharsets.UTF_8).length;
    }

    private static int writeString(byte[] data, int offset, String string) {
        byte[] utf8 = string.getBytes(StandardCharsets.UTF_8);
        ByteUtil.write2(data, offset, (short) utf8.length);
        System.arraycopy(utf8, 0, data, offset + 2, utf8.length);
        return 2 + utf8.length;
    }

    int headerLength() {
        int length = FIXED_PART_LENGTH;
        length += stringLength(metadata.datasetName());
        length += stringLength(metadata.datasetLabel());
        for (Column column : metadata.columns()) {
            length += stringLength(column.name()) + stringLength(column.label()) + 4;
        }
        return ByteUtil.align(length, ColumnLayout.SECTION_ALIGNMENT);
    }

    byte[] toBytes() {
        byte[] data = new byte[headerLength()];

        System.arraycopy(MAGIC_NUMBER, 0, data, 0, MAGIC_NUMBER.length);
        ByteUtil.write4(data, 8, FORMAT_VERSION);
        ByteUtil.write4(data, 12, totalRows);
        ByteUtil.write4(data, 16, metadata.columns().size());
        ByteUtil.write4(data, 20, data.length);
        ByteUtil.write8(data, 24, metadata.creationTime().toEpochSecond(ZoneOffset.UTC));
        ByteUtil.write4(data, 32, metadata.creationTime().getNano());

        int offset = FIXED_PART_LENGTH;
        offset += writeString(data, offset, metadata.datasetName());
        offset += writeString(data, offset, metadata.datasetLabel());
        for (Column column : metadata.columns()) {
            offset += writeString(data, offset, column.name());
            offset += writeString(data, offset, column.label());
            data[offset++] = column.type().code();
            data[offset++] = (byte) (column.nullable() ? 1 : 0);
            offset += ByteUtil.write2(data, offset, (short) column.length());
        }
        // The remaining bytes are padding and are already 0.

        return data;
    }

    /**
     * Parses the header at the start of a track dataset file.
     *
     * @param data
     *     The file's contents.
     *
     * @return The header.
     *
     * @throws IllegalArgumentException
     *     if {@code data} doesn't start with a well-formed header.
     */
    static DatasetHeader fromBytes(byte[] data) {
        if (data.length < FIXED_PART_LENGTH || !Arrays.equals(data, 0, 8, MAGIC_NUMBER, 0, 8)) {
            throw new IllegalArgumentException("not a track dataset file");
        }
        int version = ByteUtil.read4(data, 8);
        if (version != FORMAT_VERSION) {
            throw new IllegalArgumentException("unsupported track dataset format version " + version);
        }

        int totalRows = ByteUtil.read4(data, 12);
        int totalColumns = ByteUtil.read4(data, 16);
        int headerLength = ByteUtil.read4(data, 20);
        if (totalRows < 0 || totalColumns <= 0 || headerLength < FIXED_PART_LENGTH || data.length < headerLength) {
            throw new IllegalArgumentException("track dataset header is corrupt");
        }

        LocalDateTime creationTime = LocalDateTime.ofEpochSecond(
            ByteUtil.read8(data, 24),
            ByteUtil.read4(data, 32),
            ZoneOffset.UTC);

        HeaderCursor cursor = new HeaderCursor(data, FIXED_PART_LENGTH, headerLength);
        String datasetName = cursor.readString();
        String datasetLabel = cursor.readString();

        List<Column> columns = new ArrayList<>(totalColumns);
        for (int i = 0; i < totalColumns; i++) {
            String name = cursor.readString();
            String label = cursor.readString();
            ColumnType type = ColumnType.fromCode(cursor.readByte());
            boolean nullable = cursor.readByte() != 0;
            int length = cursor.readShort();

            Column.Builder builder = Column.builder().name(name).type(type).label(label).nullable(nullable);
            if (type == ColumnType.CHARACTER) {
                builder.length(length);
            }
            columns.add(builder.build());
        }

        DatasetMetadata metadata = DatasetMetadata.builder().
            creationTime(creationTime).
            datasetName(datasetName).
            datasetLabel(datasetLabel).
            columns(columns).
            build();
        return new DatasetHeader(metadata, totalRows);
    }

    /** Reads the variable-length part of the header without running past its end. */
    private static final class HeaderCursor {
        private final byte[] data;
        private final int limit;
        private int offset;

        HeaderCursor(byte[] data, int offset, int limit) {
            this.data = data;
            this.offset = offset;
            this.limit = limit;
        }

        private void require(int length) {
            if (limit < offset + length) {
                throw new IllegalArgumentException("track dataset header is truncated");
            }
        }

        byte readByte() {
            require(1);
            return data[offset++];
        }

        int readShort() {
            require(2);
            int value = ByteUtil.read2(data, offset) & 0xFFFF;
            offset += 2;
            return value;
        }

        String readString() {
            int length = readShort();
            require(length);
            String value = new String(data, offset, length, StandardCharsets.UTF_8);
            offset += length;
            return value;
        }
    }
}
