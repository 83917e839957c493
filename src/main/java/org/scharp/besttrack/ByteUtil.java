///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.besttrack;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/** Little-endian reads and writes on the byte arrays that back a track dataset file. */
final class ByteUtil {

    // private constructor to prevent anyone from instantiating the class.
    private ByteUtil() {
    }

    static int write2(byte[] data, int offset, short number) {
        data[offset + 1] = (byte) (number >> 8);
        data[offset] = (byte) number;
        return 2;
    }

    static int write4(byte[] data, int offset, int number) {
        data[offset + 3] = (byte) (number >> 24);
        data[offset + 2] = (byte) (number >> 16);
        data[offset + 1] = (byte) (number >> 8);
        data[offset] = (byte) number;
        return 4;
    }

    static int write8(byte[] data, int offset, long number) {
        write4(data, offset, (int) number);
        write4(data, offset + 4, (int) (number >> 32));
        return 8;
    }

    static short read2(byte[] data, int offset) {
        return (short) ((data[offset] & 0xFF) | (data[offset + 1] & 0xFF) << 8);
    }

    static int read4(byte[] data, int offset) {
        return (data[offset] & 0xFF) |
            (data[offset + 1] & 0xFF) << 8 |
            (data[offset + 2] & 0xFF) << 16 |
            (data[offset + 3] & 0xFF) << 24;
    }

    static long read8(byte[] data, int offset) {
        long low = read4(data, offset) & 0xFFFF_FFFFL;
        long high = read4(data, offset + 4) & 0xFFFF_FFFFL;
        return high << 32 | low;
    }

    /**
     * Writes a string to a binary array as UTF-8, padding the rest of the field with NUL bytes.
     *
     * @param data
     *     The array to write to.
     * @param offset
     *     The offset of the array to which the first byte of the string is written.
     * @param string
     *     The string to write.
     * @param length
     *     The width of the field.  This must be at least the number of bytes in {@code string} when encoded in
     *     UTF-8.
     */
    static void writeUtf8(byte[] data, int offset, String string, int length) {
        byte[] utf8 = string.getBytes(StandardCharsets.UTF_8);
        assert utf8.length <= length : "string does not fit in field";

        System.arraycopy(utf8, 0, data, offset, utf8.length);
        Arrays.fill(data, offset + utf8.length, offset + length, (byte) 0);
    }

    /**
     * Reads a NUL-padded UTF-8 field.
     *
     * @param data
     *     The array to read from.
     * @param offset
     *     The offset of the field's first byte.
     * @param length
     *     The width of the field.
     *
     * @return The field's text without its padding.
     */
    static String readUtf8(byte[] data, int offset, int length) {
        int end = offset + length;
        while (offset < end && data[end - 1] == 0) {
            end--;
        }
        return new String(data, offset, end - offset, StandardCharsets.UTF_8);
    }

    /**
     * Computes the smallest number greater than or equal to {@code number} that is a multiple of
     * {@code alignmentSize}.
     *
     * @param number
     *     The number to align.
     * @param alignmentSize
     *     The desired alignment.
     *
     * @return An aligned number.
     */
    static int align(int number, int alignmentSize) {
        int excess = number % alignmentSize;
        return excess == 0 ? number : number + alignmentSize - excess;
    }
}
