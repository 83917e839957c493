///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.besttrack;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

/** Unit tests for {@link ByteUtil}. */
public class ByteUtilTest {

    @Test
    void writeLittleEndian() {
        byte[] data = new byte[14];
        assertEquals(2, ByteUtil.write2(data, 0, (short) 0x0102));
        assertEquals(4, ByteUtil.write4(data, 2, 0x03040506));
        assertEquals(8, ByteUtil.write8(data, 6, 0x0708090A0B0C0D0EL));

        assertArrayEquals(
            new byte[] { 0x02, 0x01, 0x06, 0x05, 0x04, 0x03, 0x0E, 0x0D, 0x0C, 0x0B, 0x0A, 0x09, 0x08, 0x07 },
            data);
    }

    @Test
    void readLittleEndian() {
        byte[] data = new byte[8];
        ByteUtil.write8(data, 0, -2L);
        assertEquals(-2L, ByteUtil.read8(data, 0));
        assertEquals(-2, ByteUtil.read4(data, 0));
        assertEquals((short) -2, ByteUtil.read2(data, 0));

        // The sign bit of the low word must not leak into the high word.
        ByteUtil.write8(data, 0, 0x00000000_FFFFFFFFL);
        assertEquals(0x00000000_FFFFFFFFL, ByteUtil.read8(data, 0));
    }

    @Test
    void utf8Fields() {
        byte[] data = new byte[] { 1, 1, 1, 1, 1, 1, 1, 1 };
        ByteUtil.writeUtf8(data, 1, "ÉT", 5);

        assertArrayEquals(new byte[] { 1, (byte) 0xC3, (byte) 0x89, 'T', 0, 0, 1, 1 }, data);
        assertEquals("ÉT", ByteUtil.readUtf8(data, 1, 5));
        assertEquals("", ByteUtil.readUtf8(data, 4, 2));
    }

    @Test
    void align() {
        assertEquals(0, ByteUtil.align(0, 8));
        assertEquals(8, ByteUtil.align(1, 8));
        assertEquals(8, ByteUtil.align(8, 8));
        assertEquals(16, ByteUtil.align(9, 8));
    }
}
